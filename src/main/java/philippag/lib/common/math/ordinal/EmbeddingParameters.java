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
 * Scale constants of the real embedding, one per operator level,
 * together with the values derived from them.
 *
 * For scales a, m, e, t the embedding maps
 * <pre>
 * n        -> n / (n + a)
 * w        -> 1
 * w^w      -> 1 + m(1+e)
 * e_0      -> 1 + (1+t) m(1+e)
 * </pre>
 */
public final class EmbeddingParameters {

    public static final EmbeddingParameters DEFAULT = new EmbeddingParameters(3, 3, 3, 3);
    public static final EmbeddingParameters UNIT = new EmbeddingParameters(1, 1, 1, 1);

    private final double scaleAdd;
    private final double scaleMult;
    private final double scaleExp;
    private final double scaleTet;

    final double powerSpan;          // f(w^w) - f(w)
    final double omegaOmegaValue;    // f(w^w)
    final double towerSpan;          // f(e_0) - f(w)
    final double epsilonNaughtValue; // f(e_0)
    final double powNumerator;       // f(w^k) = (powNumerator + f(k) * powSlope) / (powPole - f(k))
    final double powSlope;
    final double powPole;
    final double powDerivative;      // powNumerator + powSlope * powPole
    final double towerRegionStart;   // f(w^^100)

    public EmbeddingParameters(double scaleAdd, double scaleMult, double scaleExp, double scaleTet) {
        this.scaleAdd = checkScale("scaleAdd", scaleAdd);
        this.scaleMult = checkScale("scaleMult", scaleMult);
        this.scaleExp = checkScale("scaleExp", scaleExp);
        this.scaleTet = checkScale("scaleTet", scaleTet);

        powerSpan = scaleMult * (1 + scaleExp);
        omegaOmegaValue = 1 + powerSpan;
        towerSpan = (1 + scaleTet) * powerSpan;
        epsilonNaughtValue = 1 + towerSpan;
        powNumerator = epsilonNaughtValue * epsilonNaughtValue;
        powSlope = powerSpan * (scaleTet * scaleTet - 1) - 1;
        powPole = 1 + powerSpan * (1 + scaleTet) * (1 + scaleTet);
        powDerivative = powNumerator + powSlope * powPole;
        towerRegionStart = 1 + 99 * towerSpan / (99 + scaleTet);
    }

    private static double checkScale(String name, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
        return value;
    }

    public double getScaleAdd() {
        return scaleAdd;
    }

    public double getScaleMult() {
        return scaleMult;
    }

    public double getScaleExp() {
        return scaleExp;
    }

    public double getScaleTet() {
        return scaleTet;
    }

    public double getOmegaValue() {
        return 1;
    }

    public double getOmegaOmegaValue() {
        return omegaOmegaValue;
    }

    public double getEpsilonNaughtValue() {
        return epsilonNaughtValue;
    }

    @Override
    public String toString() {
        return "EmbeddingParameters[" + scaleAdd + ", " + scaleMult + ", " + scaleExp + ", " + scaleTet + "]";
    }
}
