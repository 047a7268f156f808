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

import philippag.lib.common.math.ordinal.CnfOrdinal.Term;

/**
 * Structural size of an ordinal, roughly the number of symbols needed to write it down:
 * <pre>
 * g(0) = 0            g(n) = number of decimal digits of n
 * g(w) = 1            g(w*m) = g(m) + 2
 * g(w^a) = g(a) + 4   g(w^a*m) = g(a) + g(m) + 5
 * g(x + y) = g(x) + g(y) + 1
 * g(e_0) = 3          g(w^^m) = g(m) + 3
 * </pre>
 */
public final class OrdinalComplexity {

    private OrdinalComplexity() {
    }

    public static long complexity(Ordinal alpha, OperationBudget budget) {
        budget.consume();
        return switch (alpha.kind()) {
            case CNF -> complexity((CnfOrdinal) alpha, budget);
            case EPSILON_NAUGHT -> 3;
            case OMEGA_TOWER -> digits(((OmegaTower) alpha).getHeight()) + 3;
        };
    }

    public static long complexity(CnfOrdinal alpha, OperationBudget budget) {
        budget.consume();
        long g = 0;
        for (var term : alpha.terms()) {
            g += complexity(term, budget) + (g == 0 ? 0 : 1);
        }
        return g;
    }

    static long complexity(Term term, OperationBudget budget) {
        budget.consume();
        var e = term.getExponent();
        var c = term.getCoefficient();
        boolean one = BigInteger.ONE.equals(c);
        if (e.isZero()) {
            return digits(c);
        }
        if (e.isOne()) {
            return one ? 1 : digits(c) + 2;
        }
        long ge = complexity(e, budget);
        return one ? ge + 4 : ge + digits(c) + 5;
    }

    static long digits(BigInteger n) {
        assert n.signum() >= 0;
        if (n.signum() == 0) {
            return 0;
        }
        return n.bitLength() < 63 ? digits(n.longValue()) : n.toString().length();
    }

    static long digits(long n) {
        assert n >= 0;
        return n == 0 ? 0 : Long.toString(n).length();
    }

    /**
     * The largest number with {@code n} decimal digits, 10^n - 1.
     */
    static BigInteger largestWithDigits(long n) {
        return BigInteger.TEN.pow(Math.toIntExact(n)).subtract(BigInteger.ONE);
    }
}
