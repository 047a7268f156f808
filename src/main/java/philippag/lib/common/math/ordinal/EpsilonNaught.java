/*
MIT License

Copyright (c) 2024 Philipp Grasboeck

Permission is hereby granted, free of charge, to any person obtaining a copy
of this software and associated documentation files (the "Software"), to deal
in the Software without restriction, including without limitation the rights
to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
copies of the Software, and to permit persons to whom the Software is
furnished to do so, subject to the following conditions:

The above copyright notice and this permission notice shall be included in all
copies or substantial portions of the Software.

THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
SOFTWARE.
*/

package philippag.lib.common.math.ordinal;

/**
 * The first fixed point of x -> w^x, the upper bound of all ordinals handled here.
 */
public final class EpsilonNaught extends Ordinal {

    public static final EpsilonNaught INSTANCE = new EpsilonNaught();

    private EpsilonNaught() {
    }

    @Override
    public Kind kind() {
        return Kind.EPSILON_NAUGHT;
    }

    @Override
    public boolean isZero() {
        return false;
    }

    @Override
    public boolean isFinite() {
        return false;
    }

    @Override
    public boolean isLimit() {
        return true;
    }

    @Override
    public boolean isSuccessor() {
        return false;
    }

    @Override
    public boolean isOmega() {
        return false;
    }

    @Override
    public CnfOrdinal toCnf(OperationBudget budget) {
        throw new UnsupportedOrdinalOperationException("e_0 has no Cantor normal form with smaller exponents");
    }

    @Override
    public String toStringCNF() {
        return "e_0";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof EpsilonNaught;
    }

    @Override
    public int hashCode() {
        return 0xE0;
    }
}
