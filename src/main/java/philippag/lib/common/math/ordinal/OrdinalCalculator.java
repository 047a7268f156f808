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

import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates ordinal expressions such as {@code (w+1)^2} or {@code w^^w}.
 *
 * Every call to {@link #evaluate(String, boolean)} or {@link #fInverse(double)} is one calculation
 * with a fresh {@link OperationBudget} of {@link CalculatorSettings#getOperationBudget()} steps,
 * shared by parsing, arithmetic, simplification and the real embedding.
 */
public final class OrdinalCalculator {

    private static final Logger log = LoggerFactory.getLogger(OrdinalCalculator.class);

    public static final class Result {

        private final String expression;
        private final Ordinal ordinal;
        private final Ordinal simplified;
        private final double value;
        private final long operationCount;

        private Result(String expression, Ordinal ordinal, Ordinal simplified, double value, long operationCount) {
            this.expression = expression;
            this.ordinal = ordinal;
            this.simplified = simplified;
            this.value = value;
            this.operationCount = operationCount;
        }

        public String getExpression() {
            return expression;
        }

        public Ordinal getOrdinal() {
            return ordinal;
        }

        public String getCnf() {
            return ordinal.toStringCNF();
        }

        /**
         * The ordinal itself if it is within the complexity budget, otherwise an approximation from below.
         */
        public Ordinal getSimplified() {
            return simplified;
        }

        public boolean isSimplified() {
            return !simplified.equals(ordinal);
        }

        public boolean hasValue() {
            return !Double.isNaN(value);
        }

        /**
         * f(ordinal), or NaN if it was not requested.
         */
        public double getValue() {
            return value;
        }

        public long getOperationCount() {
            return operationCount;
        }

        @Override
        public String toString() {
            var sb = new StringBuilder();
            sb.append(expression).append(" = ").append(getCnf());
            if (isSimplified()) {
                sb.append(" >= ").append(simplified.toStringCNF());
            }
            if (hasValue()) {
                sb.append(String.format(Locale.ROOT, " f=%.15g", value));
            }
            return sb.toString();
        }
    }

    private final CalculatorSettings settings;

    public OrdinalCalculator() {
        this(CalculatorSettings.DEFAULT);
    }

    public OrdinalCalculator(CalculatorSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public CalculatorSettings getSettings() {
        return settings;
    }

    public Result evaluate(String expression) {
        return evaluate(expression, false);
    }

    /**
     * @throws OrdinalFormatException if the expression is malformed
     * @throws OrdinalArithmeticException if the calculation exceeds its budget or needs an unsupported operation
     */
    public Result evaluate(String expression, boolean withValue) {
        var budget = new OperationBudget(settings.getOperationBudget());
        var ordinal = OrdinalParser.evaluate(expression, budget);
        var simplified = settings.getComplexityBudget() > 0
                ? OrdinalSimplifier.simplify(ordinal, settings.getComplexityBudget(), budget)
                : ordinal;
        double value = Double.NaN;
        if (withValue) {
            var embedding = new OrdinalEmbedding(settings.getEmbeddingParameters(), budget, OrdinalEmbedding.DEFAULT_MAX_DEPTH);
            value = embedding.value(ordinal);
        }
        log.debug("Evaluated {} to {} in {} steps", expression, ordinal, budget.getCount());
        return new Result(expression, ordinal, simplified, value, budget.getCount());
    }

    /**
     * An ordinal whose real embedding is close to x.
     *
     * @throws IllegalArgumentException if x is outside [0, f(e_0)]
     */
    public Ordinal fInverse(double x) {
        var budget = new OperationBudget(settings.getOperationBudget());
        var embedding = new OrdinalEmbedding(settings.getEmbeddingParameters(), budget, OrdinalEmbedding.DEFAULT_MAX_DEPTH);
        var result = embedding.fInverse(x);
        log.debug("Inverted {} to {} in {} steps", x, result, budget.getCount());
        return result;
    }

    /**
     * Usage: {@code [-f] [-i] args...}
     * <p>
     * Evaluates each argument as an expression, with {@code -f} also printing its real value.
     * With {@code -i} the arguments are reals to map back to ordinals.
     */
    public static void main(String[] args) {
        var calculator = new OrdinalCalculator(CalculatorSettings.fromSystemProperties());
        boolean withValue = false;
        boolean inverse = false;
        int failures = 0;

        for (String arg : args) {
            if ("-f".equals(arg)) {
                withValue = true;
                continue;
            }
            if ("-i".equals(arg)) {
                inverse = true;
                continue;
            }
            try {
                if (inverse) {
                    double x = Double.parseDouble(arg);
                    System.out.printf(Locale.ROOT, "f^-1(%s) = %s\n", arg, calculator.fInverse(x));
                } else {
                    System.out.println(calculator.evaluate(arg, withValue));
                }
            } catch (IllegalArgumentException | ArithmeticException e) {
                System.err.printf("%s: %s\n", arg, e.getMessage());
                failures++;
            }
        }
        if (failures > 0) {
            System.exit(1);
        }
    }
}
