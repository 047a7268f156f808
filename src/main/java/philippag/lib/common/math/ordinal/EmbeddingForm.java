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
import java.util.Objects;

/**
 * The shape of an ordinal as seen by {@link OrdinalEmbedding}: a finite number n,
 * e_0, a power w^k, a sum w^beta*c + delta with delta < w^beta, or a tower w^^h.
 *
 * Forms are immutable and compare structurally, so they serve as memo keys.
 */
public abstract class EmbeddingForm {

    public enum Kind {
        FINITE,
        EPSILON_NAUGHT,
        POW,
        SUM,
        TOWER,
    }

    public static final EmbeddingForm ZERO = new Finite(BigInteger.ZERO);
    public static final EmbeddingForm ONE = new Finite(BigInteger.ONE);
    public static final EmbeddingForm EPSILON_NAUGHT = new Epsilon();
    public static final EmbeddingForm OMEGA = new Pow(ONE);

    EmbeddingForm() {
    }

    public static EmbeddingForm finite(BigInteger n) {
        if (n.signum() < 0) {
            throw new IllegalArgumentException("negative value: " + n);
        }
        return new Finite(n);
    }

    public static EmbeddingForm finite(long n) {
        return finite(BigInteger.valueOf(n));
    }

    public static EmbeddingForm pow(EmbeddingForm exponent) {
        return new Pow(exponent);
    }

    public static EmbeddingForm sum(EmbeddingForm beta, BigInteger coefficient, EmbeddingForm delta) {
        if (coefficient.signum() <= 0) {
            throw new IllegalArgumentException("non-positive coefficient: " + coefficient);
        }
        return new Sum(beta, coefficient, delta);
    }

    public static EmbeddingForm tower(long height) {
        if (height < 1) {
            throw new IllegalArgumentException("tower height must be positive: " + height);
        }
        return new Tower(height);
    }

    public static EmbeddingForm of(Ordinal alpha) {
        return switch (alpha.kind()) {
            case CNF -> of((CnfOrdinal) alpha);
            case EPSILON_NAUGHT -> EPSILON_NAUGHT;
            case OMEGA_TOWER -> {
                long h = ((OmegaTower) alpha).getHeight();
                yield h == 0 ? ONE : tower(h);
            }
        };
    }

    static EmbeddingForm of(CnfOrdinal alpha) {
        if (alpha.isFinite()) {
            return finite(alpha.getFinitePart());
        }
        var leading = alpha.getLeadingTerm();
        if (alpha.isOmegaPower()) {
            return pow(of(leading.getExponent()));
        }
        return sum(of(leading.getExponent()), leading.getCoefficient(), of(alpha.getRest()));
    }

    public abstract Kind kind();

    /**
     * This + 1 in the shape the embedding expects.
     */
    public abstract EmbeddingForm addOne();

    public static final class Finite extends EmbeddingForm {

        private final BigInteger value;

        private Finite(BigInteger value) {
            this.value = value;
        }

        public BigInteger getValue() {
            return value;
        }

        @Override
        public Kind kind() {
            return Kind.FINITE;
        }

        @Override
        public EmbeddingForm addOne() {
            return new Finite(value.add(BigInteger.ONE));
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Finite o && value.equals(o.value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    private static final class Epsilon extends EmbeddingForm {

        @Override
        public Kind kind() {
            return Kind.EPSILON_NAUGHT;
        }

        @Override
        public EmbeddingForm addOne() {
            throw new UnsupportedOrdinalOperationException("Unsupported operation: e_0 + 1");
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Epsilon;
        }

        @Override
        public int hashCode() {
            return 0xE0;
        }

        @Override
        public String toString() {
            return "e_0";
        }
    }

    public static final class Pow extends EmbeddingForm {

        private final EmbeddingForm exponent;

        private Pow(EmbeddingForm exponent) {
            this.exponent = Objects.requireNonNull(exponent, "exponent");
        }

        public EmbeddingForm getExponent() {
            return exponent;
        }

        @Override
        public Kind kind() {
            return Kind.POW;
        }

        @Override
        public EmbeddingForm addOne() {
            if (exponent.equals(ZERO)) {
                return new Finite(BigInteger.TWO);
            }
            return new Sum(exponent, BigInteger.ONE, ONE);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Pow o && exponent.equals(o.exponent);
        }

        @Override
        public int hashCode() {
            return 31 * exponent.hashCode() + 1;
        }

        @Override
        public String toString() {
            return "pow(" + exponent + ")";
        }
    }

    public static final class Sum extends EmbeddingForm {

        private final EmbeddingForm beta;
        private final BigInteger coefficient;
        private final EmbeddingForm delta;

        private Sum(EmbeddingForm beta, BigInteger coefficient, EmbeddingForm delta) {
            this.beta = Objects.requireNonNull(beta, "beta");
            this.coefficient = Objects.requireNonNull(coefficient, "coefficient");
            this.delta = Objects.requireNonNull(delta, "delta");
        }

        public EmbeddingForm getBeta() {
            return beta;
        }

        public BigInteger getCoefficient() {
            return coefficient;
        }

        public EmbeddingForm getDelta() {
            return delta;
        }

        @Override
        public Kind kind() {
            return Kind.SUM;
        }

        @Override
        public EmbeddingForm addOne() {
            return new Sum(beta, coefficient, delta.addOne());
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Sum o && coefficient.equals(o.coefficient) && beta.equals(o.beta) && delta.equals(o.delta);
        }

        @Override
        public int hashCode() {
            return (31 * beta.hashCode() + coefficient.hashCode()) * 31 + delta.hashCode();
        }

        @Override
        public String toString() {
            return "sum(" + beta + ", " + coefficient + ", " + delta + ")";
        }
    }

    public static final class Tower extends EmbeddingForm {

        private final long height;

        private Tower(long height) {
            this.height = height;
        }

        public long getHeight() {
            return height;
        }

        @Override
        public Kind kind() {
            return Kind.TOWER;
        }

        @Override
        public EmbeddingForm addOne() {
            // w^^h + 1 = w^(w^^(h-1)) + 1
            if (height == 1) {
                return new Sum(ONE, BigInteger.ONE, ONE);
            }
            return new Sum(height == 2 ? OMEGA : new Tower(height - 1), BigInteger.ONE, ONE);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Tower o && height == o.height;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(height) * 17;
        }

        @Override
        public String toString() {
            return "tower(" + height + ")";
        }
    }
}
