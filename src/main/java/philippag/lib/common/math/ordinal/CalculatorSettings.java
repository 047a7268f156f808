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

import java.util.Objects;

/**
 * Limits and embedding parameters of one {@link OrdinalCalculator}.
 *
 * A complexity budget of 0 disables simplification.
 */
public final class CalculatorSettings {

    public static final long DEFAULT_COMPLEXITY_BUDGET = 1000;

    static final String PROP_OPERATION_BUDGET = "ordinal.operationBudget";
    static final String PROP_COMPLEXITY_BUDGET = "ordinal.complexityBudget";
    static final String PROP_SCALE_ADD = "ordinal.embedding.scaleAdd";
    static final String PROP_SCALE_MULT = "ordinal.embedding.scaleMult";
    static final String PROP_SCALE_EXP = "ordinal.embedding.scaleExp";
    static final String PROP_SCALE_TET = "ordinal.embedding.scaleTet";

    public static final CalculatorSettings DEFAULT = new CalculatorSettings(
            OperationBudget.DEFAULT_LIMIT, DEFAULT_COMPLEXITY_BUDGET, EmbeddingParameters.DEFAULT);

    private final long operationBudget;
    private final long complexityBudget;
    private final EmbeddingParameters embeddingParameters;

    public CalculatorSettings(long operationBudget, long complexityBudget, EmbeddingParameters embeddingParameters) {
        if (operationBudget < 0) {
            throw new IllegalArgumentException("negative operation budget: " + operationBudget);
        }
        if (complexityBudget < 0) {
            throw new IllegalArgumentException("negative complexity budget: " + complexityBudget);
        }
        this.operationBudget = operationBudget;
        this.complexityBudget = complexityBudget;
        this.embeddingParameters = Objects.requireNonNull(embeddingParameters, "embeddingParameters");
    }

    /**
     * Defaults, overridden by the {@code ordinal.*} system properties that are set.
     *
     * @throws IllegalArgumentException if a property is set but is not a valid value
     */
    public static CalculatorSettings fromSystemProperties() {
        var p = DEFAULT.embeddingParameters;
        var params = new EmbeddingParameters(
                readDouble(PROP_SCALE_ADD, p.getScaleAdd()),
                readDouble(PROP_SCALE_MULT, p.getScaleMult()),
                readDouble(PROP_SCALE_EXP, p.getScaleExp()),
                readDouble(PROP_SCALE_TET, p.getScaleTet()));
        return new CalculatorSettings(
                readLong(PROP_OPERATION_BUDGET, DEFAULT.operationBudget),
                readLong(PROP_COMPLEXITY_BUDGET, DEFAULT.complexityBudget),
                params);
    }

    private static long readLong(String property, long defaultValue) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(property + ": not an integer: " + raw, e);
        }
    }

    private static double readDouble(String property, double defaultValue) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(property + ": not a number: " + raw, e);
        }
    }

    public CalculatorSettings withOperationBudget(long operationBudget) {
        return new CalculatorSettings(operationBudget, complexityBudget, embeddingParameters);
    }

    public CalculatorSettings withComplexityBudget(long complexityBudget) {
        return new CalculatorSettings(operationBudget, complexityBudget, embeddingParameters);
    }

    public CalculatorSettings withEmbeddingParameters(EmbeddingParameters embeddingParameters) {
        return new CalculatorSettings(operationBudget, complexityBudget, embeddingParameters);
    }

    public long getOperationBudget() {
        return operationBudget;
    }

    public long getComplexityBudget() {
        return complexityBudget;
    }

    public EmbeddingParameters getEmbeddingParameters() {
        return embeddingParameters;
    }

    @Override
    public String toString() {
        return "CalculatorSettings[operationBudget=" + operationBudget
                + ", complexityBudget=" + complexityBudget
                + ", " + embeddingParameters + "]";
    }
}
