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
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordinal below e_0 in Cantor Normal Form: w^e1*c1 + w^e2*c2 + ... + w^en*cn
 * with e1 > e2 > ... > en and all ci > 0. The empty sum is 0.
 *
 * Exponents are CNF ordinals themselves, coefficients are arbitrary precision.
 * A term with exponent 0 is the finite part; it can only be the last term.
 *
 * Instances are immutable and share their terms (and the exponents within)
 * with the values they were computed from.
 */
public final class CnfOrdinal extends Ordinal {

    /**
     * One summand w^exponent*coefficient.
     */
    public static final class Term {

        private final CnfOrdinal exponent;
        private final BigInteger coefficient;

        public Term(CnfOrdinal exponent, BigInteger coefficient) {
            this.exponent = Objects.requireNonNull(exponent, "exponent");
            this.coefficient = Objects.requireNonNull(coefficient, "coefficient");
        }

        public CnfOrdinal getExponent() {
            return exponent;
        }

        public BigInteger getCoefficient() {
            return coefficient;
        }

        public boolean isFinite() {
            return exponent.isZero();
        }

        Term withCoefficient(BigInteger c) {
            return new Term(exponent, c);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Term o && coefficient.equals(o.coefficient) && exponent.equals(o.exponent);
        }

        @Override
        public int hashCode() {
            return 31 * exponent.hashCode() + coefficient.hashCode();
        }

        @Override
        public String toString() {
            var sb = new StringBuilder();
            appendTerm(sb, this);
            return sb.toString();
        }
    }

    public static final CnfOrdinal ZERO = new CnfOrdinal(List.of());
    public static final CnfOrdinal ONE = new CnfOrdinal(List.of(new Term(ZERO, BigInteger.ONE)));
    public static final CnfOrdinal OMEGA = new CnfOrdinal(List.of(new Term(ONE, BigInteger.ONE)));

    private final List<Term> terms;
    private int hash; // cached value

    /**
     * Trusted constructor, the list must already be in normal form.
     * Violations are reported as {@link IllegalArgumentException}.
     */
    CnfOrdinal(List<Term> terms) {
        this.terms = Collections.unmodifiableList(terms);
        checkNormalForm(this.terms);
    }

    private static void checkNormalForm(List<Term> terms) {
        CnfOrdinal previous = null;
        for (var term : terms) {
            if (term.coefficient.signum() <= 0) {
                throw new IllegalArgumentException("non-positive coefficient: " + term.coefficient);
            }
            if (previous != null && OrdinalComparison.compareCnf(previous, term.exponent, OperationBudget.unlimited()) <= 0) {
                throw new IllegalArgumentException("exponents not strictly decreasing: " + previous + ", " + term.exponent);
            }
            previous = term.exponent;
        }
    }

    public static CnfOrdinal fromLong(long value) {
        return fromBigInteger(BigInteger.valueOf(value));
    }

    public static CnfOrdinal fromBigInteger(BigInteger value) {
        return switch (value.signum()) {
            case -1 -> throw new IllegalArgumentException("negative value: " + value);
            case 0 -> ZERO;
            default -> BigInteger.ONE.equals(value) ? ONE : new CnfOrdinal(List.of(new Term(ZERO, value)));
        };
    }

    /**
     * w^exponent*coefficient, or 0 for a zero coefficient.
     */
    public static CnfOrdinal term(CnfOrdinal exponent, BigInteger coefficient) {
        if (coefficient.signum() == 0) {
            return ZERO;
        }
        if (exponent.isZero()) {
            return fromBigInteger(coefficient);
        }
        return new CnfOrdinal(List.of(new Term(exponent, coefficient)));
    }

    public static CnfOrdinal omegaPower(CnfOrdinal exponent) {
        return term(exponent, BigInteger.ONE);
    }

    /**
     * Builds the normal form of an arbitrary collection of terms:
     * zero coefficients are dropped, terms are sorted by descending exponent,
     * and terms with equal exponents are merged by adding their coefficients.
     */
    public static CnfOrdinal of(Collection<Term> terms) {
        var budget = OperationBudget.unlimited();
        var sorted = new ArrayList<Term>(terms.size());
        for (var term : terms) {
            if (term.coefficient.signum() < 0) {
                throw new IllegalArgumentException("negative coefficient: " + term.coefficient);
            }
            if (term.coefficient.signum() > 0) {
                sorted.add(term);
            }
        }
        sorted.sort((a, b) -> OrdinalComparison.compareCnf(b.exponent, a.exponent, budget));

        var merged = new ArrayList<Term>(sorted.size());
        for (var term : sorted) {
            int last = merged.size() - 1;
            if (last >= 0 && merged.get(last).exponent.equals(term.exponent)) {
                merged.set(last, merged.get(last).withCoefficient(merged.get(last).coefficient.add(term.coefficient)));
            } else {
                merged.add(term);
            }
        }
        return merged.isEmpty() ? ZERO : new CnfOrdinal(merged);
    }

    public List<Term> terms() {
        return terms;
    }

    public int size() {
        return terms.size();
    }

    @Override
    public Kind kind() {
        return Kind.CNF;
    }

    @Override
    public CnfOrdinal toCnf(OperationBudget budget) {
        return this;
    }

    @Override
    public boolean isZero() {
        return terms.isEmpty();
    }

    public boolean isOne() {
        return terms.size() == 1 && terms.get(0).isFinite() && BigInteger.ONE.equals(terms.get(0).coefficient);
    }

    @Override
    public boolean isFinite() {
        return terms.isEmpty() || (terms.size() == 1 && terms.get(0).isFinite());
    }

    @Override
    public boolean isLimit() {
        return !terms.isEmpty() && !getLastTerm().isFinite();
    }

    @Override
    public boolean isSuccessor() {
        return !terms.isEmpty() && getLastTerm().isFinite();
    }

    @Override
    public boolean isOmega() {
        return terms.size() == 1 && BigInteger.ONE.equals(terms.get(0).coefficient) && terms.get(0).exponent.isOne();
    }

    /**
     * Whether this is w^e for some e, including 1 = w^0.
     */
    public boolean isOmegaPower() {
        return terms.size() == 1 && BigInteger.ONE.equals(terms.get(0).coefficient);
    }

    public BigInteger getFinitePart() {
        if (terms.isEmpty()) {
            return BigInteger.ZERO;
        }
        var last = getLastTerm();
        return last.isFinite() ? last.coefficient : BigInteger.ZERO;
    }

    /**
     * The terms with a positive exponent.
     */
    public CnfOrdinal getLimitPart() {
        if (!isSuccessor()) {
            return this;
        }
        return terms.size() == 1 ? ZERO : new CnfOrdinal(terms.subList(0, terms.size() - 1));
    }

    public Term getLeadingTerm() {
        if (terms.isEmpty()) {
            throw new IllegalStateException("zero has no leading term");
        }
        return terms.get(0);
    }

    public CnfOrdinal getLeadingExponent() {
        return getLeadingTerm().exponent;
    }

    public BigInteger getLeadingCoefficient() {
        return getLeadingTerm().coefficient;
    }

    /**
     * Everything after the leading term.
     */
    public CnfOrdinal getRest() {
        if (terms.size() <= 1) {
            return ZERO;
        }
        return new CnfOrdinal(terms.subList(1, terms.size()));
    }

    Term getLastTerm() {
        return terms.get(terms.size() - 1);
    }

    @Override
    public String toStringCNF() {
        if (terms.isEmpty()) {
            return "0";
        }
        var sb = new StringBuilder();
        for (var term : terms) {
            if (sb.length() > 0) {
                sb.append('+');
            }
            appendTerm(sb, term);
        }
        return sb.toString();
    }

    private static void appendTerm(StringBuilder sb, Term term) {
        var exponent = term.exponent;
        if (exponent.isZero()) {
            sb.append(term.coefficient);
            return;
        }
        sb.append('w');
        if (!exponent.isOne()) {
            sb.append('^');
            if (exponent.needsParentheses()) {
                sb.append('(').append(exponent.toStringCNF()).append(')');
            } else {
                sb.append(exponent.toStringCNF());
            }
        }
        if (!BigInteger.ONE.equals(term.coefficient)) {
            sb.append('*').append(term.coefficient);
        }
    }

    // as an exponent: a sum, a coefficient or a nested power other than w itself
    private boolean needsParentheses() {
        return terms.size() > 1 || (terms.size() == 1 && !terms.get(0).isFinite() && !isOmega());
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof CnfOrdinal o && (this == o || terms.equals(o.terms));
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            hash = h = terms.hashCode();
        }
        return h;
    }
}
