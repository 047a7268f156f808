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

import java.util.List;

import philippag.lib.common.math.ordinal.CnfOrdinal.Term;

/**
 * Total order over all kinds of ordinals: every CNF ordinal is less than e_0,
 * towers compare by their value.
 */
public final class OrdinalComparison {

    private OrdinalComparison() {
    }

    public static int compare(Ordinal lhs, Ordinal rhs, OperationBudget budget) {
        budget.consume();
        return switch (lhs.kind()) {
            case EPSILON_NAUGHT -> rhs.kind() == Ordinal.Kind.EPSILON_NAUGHT ? 0 : 1;
            case CNF -> switch (rhs.kind()) {
                case CNF -> compareCnf((CnfOrdinal) lhs, (CnfOrdinal) rhs, budget);
                case EPSILON_NAUGHT -> -1;
                case OMEGA_TOWER -> -compareTower((OmegaTower) rhs, (CnfOrdinal) lhs, budget);
            };
            case OMEGA_TOWER -> switch (rhs.kind()) {
                case CNF -> compareTower((OmegaTower) lhs, (CnfOrdinal) rhs, budget);
                case EPSILON_NAUGHT -> -1;
                case OMEGA_TOWER -> Long.compare(((OmegaTower) lhs).getHeight(), ((OmegaTower) rhs).getHeight());
            };
        };
    }

    /**
     * Lexicographic comparison of the term lists: exponents first, then coefficients.
     * A proper prefix is the smaller ordinal.
     */
    public static int compareCnf(CnfOrdinal lhs, CnfOrdinal rhs, OperationBudget budget) {
        budget.consume();
        if (lhs == rhs) {
            return 0;
        }
        List<Term> a = lhs.terms();
        List<Term> b = rhs.terms();
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = compareTerms(a.get(i), b.get(i), budget);
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    static int compareTerms(Term lhs, Term rhs, OperationBudget budget) {
        int c = compareCnf(lhs.getExponent(), rhs.getExponent(), budget);
        return c != 0 ? c : lhs.getCoefficient().compareTo(rhs.getCoefficient());
    }

    /**
     * The number of omegas in the chain of leading exponents.
     * For nonzero alpha with height h we have w^^h <= alpha < w^^(h+1).
     */
    static long towerHeight(CnfOrdinal alpha) {
        long h = 0;
        while (!alpha.isFinite()) {
            alpha = alpha.getLeadingExponent();
            h++;
        }
        return h;
    }

    // only towers with a height matching the CNF ordinal need to be expanded
    private static int compareTower(OmegaTower lhs, CnfOrdinal rhs, OperationBudget budget) {
        if (rhs.isZero()) {
            return 1;
        }
        long h = towerHeight(rhs);
        budget.consume(h);
        if (lhs.getHeight() != h) {
            return Long.compare(lhs.getHeight(), h);
        }
        return compareCnf(lhs.toCnf(budget), rhs, budget);
    }
}
