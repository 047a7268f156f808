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

import static philippag.lib.common.math.ordinal.OrdinalComplexity.complexity;
import static philippag.lib.common.math.ordinal.OrdinalComplexity.digits;
import static philippag.lib.common.math.ordinal.OrdinalComplexity.largestWithDigits;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import philippag.lib.common.math.ordinal.CnfOrdinal.Term;

/**
 * Approximates an ordinal from below by one of bounded {@link OrdinalComplexity complexity}.
 *
 * The search is greedy, not exhaustive. Terms are kept from the left for as long as
 * they fit. The first term that does not fit is shrunk, by lowering its coefficient or
 * by recursively simplifying its exponent, and everything after it is dropped.
 * When not even the chain of leading exponents can be written down,
 * a tower w^^h is used instead.
 *
 * The result is never bigger than the input, and its complexity never exceeds the limit.
 */
public final class OrdinalSimplifier {

    private static final Logger log = LoggerFactory.getLogger(OrdinalSimplifier.class);

    private static final CnfOrdinal TWO = CnfOrdinal.fromLong(2);

    private OrdinalSimplifier() {
    }

    public static Ordinal simplify(Ordinal alpha, long limit, OperationBudget budget) {
        if (limit < 0) {
            throw new IllegalArgumentException("negative complexity limit: " + limit);
        }
        budget.consume();
        if (complexity(alpha, budget) <= limit) {
            return alpha;
        }
        Ordinal result = switch (alpha.kind()) {
            case CNF -> simplifyCnf((CnfOrdinal) alpha, limit, budget);
            case EPSILON_NAUGHT -> largestBelowOmegaSquared(limit); // limit < g(e_0)
            case OMEGA_TOWER -> simplifyTower((OmegaTower) alpha, limit, budget);
        };
        log.debug("Simplified {} to {} for complexity limit {}", alpha, result, limit);
        return result;
    }

    private static Ordinal simplifyTower(OmegaTower tower, long limit, OperationBudget budget) {
        long h = tower.getHeight();
        if (h <= 2) {
            return simplifyCnf(tower.toCnf(budget), limit, budget);
        }
        if (limit < 4) {
            return largestBelowOmegaSquared(limit);
        }
        return OmegaTower.of(largestWithDigits(limit - 3).longValueExact());
    }

    private static Ordinal simplifyCnf(CnfOrdinal alpha, long limit, OperationBudget budget) {
        var best = accumulate(alpha, limit, budget);
        long h = OrdinalComparison.towerHeight(alpha);
        if (h >= 2 && limit >= 4 && skeletonComplexity(h) > limit) {
            // w^^h <= alpha keeps the height, which no CNF ordinal within the limit can
            long height = digits(h) <= limit - 3 ? h : largestWithDigits(limit - 3).longValueExact();
            var tower = OmegaTower.of(height);
            if (OrdinalComparison.compare(tower, best, budget) > 0) {
                return tower;
            }
        }
        return verify(alpha, best, limit, budget);
    }

    // g(w^w^...^w) with h omegas
    private static long skeletonComplexity(long h) {
        return 1 + 4 * (h - 1);
    }

    /**
     * Keeps the leading terms of alpha while they fit, shrinks the first one that doesn't and stops there.
     */
    private static CnfOrdinal accumulate(CnfOrdinal alpha, long limit, OperationBudget budget) {
        budget.consume();
        var result = new ArrayList<Term>();
        long available = limit;
        for (var term : alpha.terms()) {
            long separator = result.isEmpty() ? 0 : 1;
            var simplified = simplifyTerm(term, available - separator, budget);
            if (simplified == null) {
                break;
            }
            result.add(simplified);
            available -= separator + complexity(simplified, budget);
            if (!simplified.equals(term)) {
                break;
            }
        }
        return result.isEmpty() ? CnfOrdinal.ZERO : new CnfOrdinal(result);
    }

    /**
     * The largest term not bigger than {@code term} found within {@code limit}, or null if no term fits.
     */
    private static Term simplifyTerm(Term term, long limit, OperationBudget budget) {
        budget.consume();
        if (limit < 1) {
            return null;
        }
        var e = term.getExponent();
        var c = term.getCoefficient();
        if (complexity(term, budget) <= limit) {
            return term;
        }
        if (e.isZero()) {
            return new Term(e, largestWithDigits(limit));
        }
        if (!e.isOne()) {
            long ge = complexity(e, budget);
            if (ge + 4 <= limit) {
                // keep the exponent, shrink the coefficient
                long rest = limit - ge - 5;
                return new Term(e, rest >= 1 ? largestWithDigits(rest) : BigInteger.ONE);
            }
            if (limit >= 4) {
                var exponent = simplifyExponent(e, limit - 4, budget);
                if (OrdinalComparison.compareCnf(exponent, TWO, budget) >= 0) {
                    return new Term(exponent, BigInteger.ONE);
                }
            }
        }
        return new Term(CnfOrdinal.ONE, limit >= 3 ? largestWithDigits(limit - 2) : BigInteger.ONE);
    }

    private static CnfOrdinal simplifyExponent(CnfOrdinal e, long limit, OperationBudget budget) {
        budget.consume();
        return complexity(e, budget) <= limit ? e : accumulate(e, limit, budget);
    }

    // all ordinals of complexity 4 or less below w^2
    private static CnfOrdinal largestBelowOmegaSquared(long limit) {
        assert limit <= 4;
        if (limit >= 3) {
            return CnfOrdinal.term(CnfOrdinal.ONE, largestWithDigits(limit - 2));
        }
        return limit >= 1 ? CnfOrdinal.OMEGA : CnfOrdinal.ZERO;
    }

    private static Ordinal verify(CnfOrdinal alpha, CnfOrdinal candidate, long limit, OperationBudget budget) {
        if (fits(candidate, alpha, limit, budget)) {
            return candidate;
        }
        log.warn("Simplified value {} does not approximate {} within {}, trying the leading term", candidate, alpha, limit);
        var leading = simplifyTerm(alpha.getLeadingTerm(), limit, budget);
        if (leading != null) {
            var single = new CnfOrdinal(List.of(leading));
            if (fits(single, alpha, limit, budget)) {
                return single;
            }
        }
        return CnfOrdinal.ZERO;
    }

    private static boolean fits(CnfOrdinal candidate, CnfOrdinal alpha, long limit, OperationBudget budget) {
        return complexity(candidate, budget) <= limit && OrdinalComparison.compareCnf(candidate, alpha, budget) <= 0;
    }
}
