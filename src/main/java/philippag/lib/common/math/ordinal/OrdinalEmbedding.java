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
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import philippag.lib.common.math.ordinal.EmbeddingForm.Finite;
import philippag.lib.common.math.ordinal.EmbeddingForm.Pow;
import philippag.lib.common.math.ordinal.EmbeddingForm.Sum;
import philippag.lib.common.math.ordinal.EmbeddingForm.Tower;

/**
 * Strictly increasing map f from the ordinals up to e_0 into the reals [0, f(e_0)],
 * and its numeric inverse.
 *
 * f interpolates between landmarks: finite n is squeezed into [0, 1), w^j for finite j into [1, f(w^w)),
 * the higher powers w^k into [f(w^w), f(e_0)) via a Moebius transform of f(k),
 * and w^beta*c + delta linearly between f(w^beta*c) and f(w^beta*(c+1)).
 *
 * The inverse is an approximate search: it partitions [0, f(e_0)] into the finite range, the range of the
 * w^j powers, the range of higher powers and the range of high towers near f(e_0), inverts the dominant
 * closed form for the leading unknown, and recurses on the remainder with an error threshold scaled by the
 * local derivative. The recursion depth is capped by {@link #getMaxDepth()}.
 *
 * An instance belongs to one calculation: it owns a memo cache for f and consumes one {@link OperationBudget}.
 * It is not thread-safe.
 */
public final class OrdinalEmbedding {

    private static final Logger log = LoggerFactory.getLogger(OrdinalEmbedding.class);

    public static final int DEFAULT_MAX_DEPTH = 400;
    public static final double DEFAULT_THRESHOLD = 1e-14;

    // amplified thresholds would otherwise swallow whole remainders
    private static final double MAX_THRESHOLD = 1e-6;
    private static final double MIN_DIFFERENCE = 1e-15;
    private static final long MAX_COEFFICIENT = 1L << 53;

    private final EmbeddingParameters params;
    private final OperationBudget budget;
    private final int maxDepth;
    private final Map<EmbeddingForm, Double> memo = new HashMap<>();

    public OrdinalEmbedding() {
        this(EmbeddingParameters.DEFAULT);
    }

    public OrdinalEmbedding(EmbeddingParameters params) {
        this(params, new OperationBudget(), DEFAULT_MAX_DEPTH);
    }

    public OrdinalEmbedding(EmbeddingParameters params, OperationBudget budget, int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("negative maxDepth: " + maxDepth);
        }
        this.params = params;
        this.budget = budget;
        this.maxDepth = maxDepth;
    }

    public EmbeddingParameters getParameters() {
        return params;
    }

    public OperationBudget getBudget() {
        return budget;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * f(alpha).
     */
    public double value(Ordinal alpha) {
        return f(EmbeddingForm.of(alpha));
    }

    /**
     * An ordinal alpha with f(alpha) close to x, see {@link #inverse(double)}.
     */
    public Ordinal fInverse(double x) {
        return toOrdinal(inverse(x));
    }

    public double f(EmbeddingForm alpha) {
        var cached = memo.get(alpha);
        if (cached != null) {
            return cached;
        }
        budget.consume();
        double result = switch (alpha.kind()) {
            case FINITE -> fFinite(((Finite) alpha).getValue(), params.getScaleAdd());
            case EPSILON_NAUGHT -> params.epsilonNaughtValue;
            case TOWER -> 1 + params.towerSpan * fFinite(((Tower) alpha).getHeight() - 1, params.getScaleTet());
            case POW -> fPow(((Pow) alpha).getExponent());
            case SUM -> fSum((Sum) alpha);
        };
        memo.put(alpha, result);
        return result;
    }

    private double fPow(EmbeddingForm k) {
        if (k instanceof Finite j) {
            if (j.getValue().signum() == 0) {
                return f(EmbeddingForm.ONE);
            }
            return 1 + params.powerSpan * fFinite(j.getValue().subtract(BigInteger.ONE), params.getScaleExp());
        }
        double fk = f(k);
        return (params.powNumerator + fk * params.powSlope) / (params.powPole - fk);
    }

    private double fSum(Sum alpha) {
        double fBeta = f(EmbeddingForm.pow(alpha.getBeta()));
        double fBeta1 = f(EmbeddingForm.pow(alpha.getBeta().addOne()));
        var c = alpha.getCoefficient();
        double base = fBeta + (fBeta1 - fBeta) * fFinite(c.subtract(BigInteger.ONE), params.getScaleMult());
        if (alpha.getDelta().equals(EmbeddingForm.ZERO)) {
            return base;
        }
        double next = fBeta + (fBeta1 - fBeta) * fFinite(c, params.getScaleMult());
        return base + (next - base) * f(alpha.getDelta()) / fBeta;
    }

    static double fFinite(BigInteger n, double scale) {
        if (n.signum() == 0) {
            return 0;
        }
        double d = n.doubleValue();
        return Double.isInfinite(d) ? 1 : d / (d + scale);
    }

    static double fFinite(long n, double scale) {
        return n == 0 ? 0 : n / (n + scale);
    }

    /**
     * Approximate inverse of {@link #f(EmbeddingForm)}.
     *
     * @throws IllegalArgumentException if x is outside [0, f(e_0)]
     * @throws RegressionLimitException if the recursion gets deeper than {@link #getMaxDepth()}
     */
    public EmbeddingForm inverse(double x) {
        return inverse(x, DEFAULT_THRESHOLD, 0);
    }

    private EmbeddingForm inverse(double x, double threshold, int depth) {
        if (depth > maxDepth) {
            log.warn("Inverse of {} exceeds depth {}", x, maxDepth);
            throw new RegressionLimitException(depth, x);
        }
        budget.consume();
        double u = params.epsilonNaughtValue;
        if (Double.isNaN(x) || x < -threshold || x > u + threshold) {
            throw new IllegalArgumentException("value outside [0, " + u + "]: " + x);
        }
        if (Math.abs(x) <= threshold) {
            return EmbeddingForm.ZERO;
        }
        if (Math.abs(x - u) <= threshold) {
            return EmbeddingForm.EPSILON_NAUGHT;
        }
        if (x > params.towerRegionStart && x < u - threshold) {
            return towerInverse(x, threshold);
        }
        if (Math.abs(x - 1) <= threshold) {
            return EmbeddingForm.OMEGA;
        }
        if (Math.abs(x - params.omegaOmegaValue) <= threshold) {
            return EmbeddingForm.pow(EmbeddingForm.OMEGA);
        }
        if (x < 1) {
            return EmbeddingForm.finite(finiteInverse(x, threshold));
        }
        if (x < params.omegaOmegaValue) {
            return omegaPowerInverse(x, threshold, depth);
        }
        return higherPowerInverse(x, threshold, depth);
    }

    // n with f(n) <= x < f(n+1)
    private long finiteInverse(double x, double threshold) {
        double scale = params.getScaleAdd();
        long n = (long) Math.floor(scale * x / (1 - x));
        return fFinite(n + 1, scale) < x + threshold ? n + 1 : n;
    }

    // w^^h near f(e_0): x = 1 + towerSpan * (h-1) / (h-1+t) solved for h
    private EmbeddingForm towerInverse(double x, double threshold) {
        double u = params.epsilonNaughtValue;
        double t = params.getScaleTet();
        double target = (params.towerSpan + (t - 1) * (x - 1)) / (u - x);
        long height = (long) Math.floor(target);
        if (height < 1) {
            return EmbeddingForm.EPSILON_NAUGHT;
        }
        double next = (params.towerSpan + (t - 1) * (x + threshold - 1)) / (u - (x + threshold));
        return EmbeddingForm.tower(next > height + 1 ? height + 1 : height);
    }

    // f(w^j) for finite j >= 1
    private double fOmegaPower(long j) {
        return 1 + params.powerSpan * fFinite(j - 1, params.getScaleExp());
    }

    // x in (1, f(w^w)): x = f(w^j*m + delta) with finite j
    private EmbeddingForm omegaPowerInverse(double x, double threshold, int depth) {
        double e = params.getScaleExp();
        long j = Math.max(1, 1 + (long) Math.floor(e * (x - 1) / (params.omegaOmegaValue - x)));
        if (fOmegaPower(j + 1) < x + threshold) {
            j++;
        }
        double low = fOmegaPower(j);
        double high = fOmegaPower(j + 1);
        long m = coefficientInverse((x - low) / (high - low), threshold);
        var delta = remainderInverse(x, low, high, m, threshold, depth);
        var exponent = EmbeddingForm.finite(j);
        if (m == 1 && delta.equals(EmbeddingForm.ZERO)) {
            return EmbeddingForm.pow(exponent);
        }
        return EmbeddingForm.sum(exponent, BigInteger.valueOf(m), delta);
    }

    // x in [f(w^w), f(w^^100)]: x = f(w^k*m + delta) with infinite k
    private EmbeddingForm higherPowerInverse(double x, double threshold, int depth) {
        double fk = (params.powPole * x - params.powNumerator) / (x + params.powSlope);
        fk = Math.min(Math.max(fk, 1), params.epsilonNaughtValue);
        double amplification = Math.max(1, (params.powPole - fk) * (params.powPole - fk) / params.powDerivative);
        var k = inverse(fk, amplify(threshold, amplification), depth + 1);
        if (k.kind() == EmbeddingForm.Kind.EPSILON_NAUGHT) {
            return k; // w^e_0 = e_0
        }
        double low = f(EmbeddingForm.pow(k));
        double high = f(EmbeddingForm.pow(k.addOne()));
        long m = x < low + threshold ? 1 : coefficientInverse((x - low) / (high - low), threshold);
        var delta = remainderInverse(x, low, high, m, threshold, depth);
        if (m == 1 && delta.equals(EmbeddingForm.ZERO)) {
            return EmbeddingForm.pow(k);
        }
        return EmbeddingForm.sum(k, BigInteger.valueOf(m), delta);
    }

    // m with f(m-1) <= t < f(m), for coefficients scaled by scaleMult
    private long coefficientInverse(double t, double threshold) {
        if (t < threshold) {
            return 1;
        }
        if (t >= 1 - MIN_DIFFERENCE) {
            return MAX_COEFFICIENT;
        }
        double scale = params.getScaleMult();
        long m = Math.max(1, 1 + (long) Math.floor(scale * t / (1 - t)));
        if (m < MAX_COEFFICIENT && fFinite(m, scale) < t + threshold) {
            m++;
        }
        return m;
    }

    /**
     * The delta with x = f(w^beta*m + delta), where low = f(w^beta) and high = f(w^(beta+1)).
     */
    private EmbeddingForm remainderInverse(double x, double low, double high, long m, double threshold, int depth) {
        double scale = params.getScaleMult();
        double from = low + (high - low) * fFinite(m - 1, scale);
        double to = low + (high - low) * fFinite(m, scale);
        double span = to - from;
        if (span < MIN_DIFFERENCE || Math.abs(x - from) < threshold) {
            return EmbeddingForm.ZERO;
        }
        double fr = (x - from) * low / span;
        if (fr < threshold) {
            return EmbeddingForm.ZERO;
        }
        fr = Math.min(fr, Math.nextDown(low)); // delta < w^beta
        return inverse(fr, amplify(threshold, low / span), depth + 1);
    }

    private static double amplify(double threshold, double factor) {
        return Math.min(MAX_THRESHOLD, threshold * Math.max(1, factor));
    }

    /**
     * Converts a form to the ordinal it denotes. Sums are rebuilt with ordinal addition,
     * which absorbs a remainder that came out too big.
     */
    public Ordinal toOrdinal(EmbeddingForm form) {
        budget.consume();
        return switch (form.kind()) {
            case FINITE -> CnfOrdinal.fromBigInteger(((Finite) form).getValue());
            case EPSILON_NAUGHT -> EpsilonNaught.INSTANCE;
            case TOWER -> OmegaTower.of(((Tower) form).getHeight());
            case POW -> omegaPower(toOrdinal(((Pow) form).getExponent()));
            case SUM -> {
                var sum = (Sum) form;
                var result = omegaPower(toOrdinal(sum.getBeta()));
                if (!BigInteger.ONE.equals(sum.getCoefficient())) {
                    result = OrdinalArithmetic.multiply(result, CnfOrdinal.fromBigInteger(sum.getCoefficient()), budget);
                }
                if (!sum.getDelta().equals(EmbeddingForm.ZERO)) {
                    result = OrdinalArithmetic.add(result, toOrdinal(sum.getDelta()), budget);
                }
                yield result;
            }
        };
    }

    private Ordinal omegaPower(Ordinal exponent) {
        if (exponent instanceof OmegaTower t) {
            return OmegaTower.of(t.getHeight() + 1);
        }
        return OrdinalArithmetic.power(CnfOrdinal.OMEGA, exponent, budget);
    }
}
