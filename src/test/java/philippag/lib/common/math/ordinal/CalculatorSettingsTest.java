package philippag.lib.common.math.ordinal;

import org.junit.Assert;
import org.junit.Test;

public class CalculatorSettingsTest extends CommonTestBase {

    private static final String[] PROPERTIES = {
        CalculatorSettings.PROP_OPERATION_BUDGET,
        CalculatorSettings.PROP_COMPLEXITY_BUDGET,
        CalculatorSettings.PROP_SCALE_ADD,
        CalculatorSettings.PROP_SCALE_MULT,
        CalculatorSettings.PROP_SCALE_EXP,
        CalculatorSettings.PROP_SCALE_TET,
    };

    @Test
    public void defaults() {
        var settings = CalculatorSettings.DEFAULT;
        Assert.assertEquals(OperationBudget.DEFAULT_LIMIT, settings.getOperationBudget());
        Assert.assertEquals(CalculatorSettings.DEFAULT_COMPLEXITY_BUDGET, settings.getComplexityBudget());
        Assert.assertSame(EmbeddingParameters.DEFAULT, settings.getEmbeddingParameters());

        clearProperties();
        var fromProperties = CalculatorSettings.fromSystemProperties();
        Assert.assertEquals(settings.getOperationBudget(), fromProperties.getOperationBudget());
        Assert.assertEquals(settings.getComplexityBudget(), fromProperties.getComplexityBudget());
        Assert.assertEquals(3, fromProperties.getEmbeddingParameters().getScaleTet(), 0);
    }

    @Test
    public void systemProperties() {
        try {
            System.setProperty(CalculatorSettings.PROP_OPERATION_BUDGET, "1234");
            System.setProperty(CalculatorSettings.PROP_COMPLEXITY_BUDGET, " 20 ");
            System.setProperty(CalculatorSettings.PROP_SCALE_ADD, "1");
            System.setProperty(CalculatorSettings.PROP_SCALE_TET, "0.5");
            System.setProperty(CalculatorSettings.PROP_SCALE_MULT, "");
            var settings = CalculatorSettings.fromSystemProperties();
            Assert.assertEquals(1234, settings.getOperationBudget());
            Assert.assertEquals(20, settings.getComplexityBudget());
            Assert.assertEquals(1, settings.getEmbeddingParameters().getScaleAdd(), 0);
            Assert.assertEquals(3, settings.getEmbeddingParameters().getScaleMult(), 0);
            Assert.assertEquals(3, settings.getEmbeddingParameters().getScaleExp(), 0);
            Assert.assertEquals(0.5, settings.getEmbeddingParameters().getScaleTet(), 0);
        } finally {
            clearProperties();
        }
    }

    @Test
    public void invalid() {
        checkInvalid(CalculatorSettings.PROP_OPERATION_BUDGET, "lots");
        checkInvalid(CalculatorSettings.PROP_OPERATION_BUDGET, "-1");
        checkInvalid(CalculatorSettings.PROP_COMPLEXITY_BUDGET, "1.5");
        checkInvalid(CalculatorSettings.PROP_SCALE_EXP, "0");
        checkInvalid(CalculatorSettings.PROP_SCALE_ADD, "three");
        try {
            new CalculatorSettings(1, -1, EmbeddingParameters.UNIT);
            Assert.fail("Expecting IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            System.out.println(e);
        }
    }

    private static void checkInvalid(String property, String value) {
        try {
            System.setProperty(property, value);
            CalculatorSettings.fromSystemProperties();
            Assert.fail("Expecting IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            System.out.println(e);
        } finally {
            clearProperties();
        }
    }

    private static void clearProperties() {
        for (var property : PROPERTIES) {
            System.clearProperty(property);
        }
    }
}
