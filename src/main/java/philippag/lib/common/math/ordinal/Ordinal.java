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

import java.math.BigInteger;

/**
 * An ordinal number below or equal to epsilon-naught.
 *
 * There are exactly three kinds of ordinals, see {@link Kind}:
 * <ul>
 * <li>{@link CnfOrdinal}: a sum of terms w^e*c in Cantor Normal Form,</li>
 * <li>{@link EpsilonNaught}: the singleton e_0, bigger than any CNF ordinal,</li>
 * <li>{@link OmegaTower}: the compact form of w^^h, produced by simplification.</li>
 * </ul>
 *
 * All instances are immutable, so sub-terms are freely shared between values
 * instead of being copied.
 *
 * The natural ordering is the ordinal order. It is inconsistent with equals for towers:
 * {@code w^^2} compares equal to the CNF ordinal {@code w^w}, but they are not equal.
 */
public abstract class Ordinal implements Comparable<Ordinal> {

    public enum Kind {
        CNF,
        EPSILON_NAUGHT,
        OMEGA_TOWER,
    }

    Ordinal() {
        // sub-classes of this package only
    }

    public static CnfOrdinal fromInt(int value) {
        return CnfOrdinal.fromLong(value);
    }

    public static CnfOrdinal fromLong(long value) {
        return CnfOrdinal.fromLong(value);
    }

    public static CnfOrdinal fromBigInteger(BigInteger value) {
        return CnfOrdinal.fromBigInteger(value);
    }

    public static CnfOrdinal omega() {
        return CnfOrdinal.OMEGA;
    }

    public static EpsilonNaught epsilonNaught() {
        return EpsilonNaught.INSTANCE;
    }

    public static OmegaTower omegaTower(long height) {
        return OmegaTower.of(height);
    }

    public abstract Kind kind();

    public abstract boolean isZero();

    public abstract boolean isFinite();

    public abstract boolean isLimit();

    public abstract boolean isSuccessor();

    public abstract boolean isOmega();

    /**
     * The Cantor Normal Form of this ordinal, consuming {@code budget}.
     *
     * @throws UnsupportedOrdinalOperationException for e_0, which has no normal form in terms of smaller exponents
     */
    public abstract CnfOrdinal toCnf(OperationBudget budget);

    public abstract String toStringCNF();

    public Ordinal add(Ordinal rhs, OperationBudget budget) {
        return OrdinalArithmetic.add(this, rhs, budget);
    }

    public Ordinal multiply(Ordinal rhs, OperationBudget budget) {
        return OrdinalArithmetic.multiply(this, rhs, budget);
    }

    public Ordinal pow(Ordinal exponent, OperationBudget budget) {
        return OrdinalArithmetic.power(this, exponent, budget);
    }

    public Ordinal tetrate(Ordinal height, OperationBudget budget) {
        return OrdinalArithmetic.tetrate(this, height, budget);
    }

    @Override
    public int compareTo(Ordinal o) {
        return OrdinalComparison.compare(this, o, OperationBudget.unlimited());
    }

    @Override
    public final String toString() {
        return toStringCNF();
    }
}
