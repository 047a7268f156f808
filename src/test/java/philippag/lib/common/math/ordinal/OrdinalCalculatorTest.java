package philippag.lib.common.math.ordinal;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.Assert;
import org.junit.Test;

public class OrdinalCalculatorTest extends CommonTestBase {

    @Test
    public void evaluate() {
        var calculator = new OrdinalCalculator();
        var result = calculator.evaluate("(w+1)^2");
        Assert.assertEquals("(w+1)^2", result.getExpression());
        Assert.assertEquals("w^2+w+1", result.getCnf());
        Assert.assertEquals(parse("w^2+w+1"), result.getOrdinal());
        Assert.assertSame(result.getOrdinal(), result.getSimplified());
        Assert.assertFalse(result.isSimplified());
        Assert.assertFalse(result.hasValue());
        Assert.assertTrue(Double.isNaN(result.getValue()));
        Assert.assertTrue(result.getOperationCount() > 0);
        Assert.assertEquals("(w+1)^2 = w^2+w+1", result.toString());
    }

    @Test
    public void value() {
        var calculator = new OrdinalCalculator();
        var result = calculator.evaluate("w^2", true);
        Assert.assertTrue(result.hasValue());
        Assert.assertEquals(4, result.getValue(), 1e-12);

        var unit = new OrdinalCalculator(CalculatorSettings.DEFAULT.withEmbeddingParameters(EmbeddingParameters.UNIT));
        Assert.assertEquals(1.5, unit.evaluate("w*2", true).getValue(), 1e-12);
        Assert.assertEquals("w*2", unit.fInverse(1.5).toString());
        Assert.assertEquals("w^w", calculator.fInverse(13).toString());
    }

    @Test
    public void simplify() {
        var calculator = new OrdinalCalculator(CalculatorSettings.DEFAULT.withComplexityBudget(4));
        var result = calculator.evaluate("w^w^w^w^w^w");
        Assert.assertTrue(result.isSimplified());
        Assert.assertEquals("w^^6", result.getSimplified().toString());
        Assert.assertTrue(result.toString().endsWith(" >= w^^6"));

        var unlimited = new OrdinalCalculator(CalculatorSettings.DEFAULT.withComplexityBudget(0));
        Assert.assertFalse(unlimited.evaluate("w^w^w^w^w^w").isSimplified());
    }

    @Test
    public void errors() {
        var calculator = new OrdinalCalculator(CalculatorSettings.DEFAULT.withOperationBudget(100));
        try {
            calculator.evaluate("2^10000");
            Assert.fail("Expecting BudgetExceededException");
        } catch (BudgetExceededException e) {
            System.out.println(e);
            Assert.assertEquals(100, e.getLimit());
        }
        // every calculation starts with a fresh budget
        Assert.assertEquals("1024", calculator.evaluate("2^10").getCnf());
        try {
            calculator.evaluate("w+");
            Assert.fail("Expecting OrdinalFormatException");
        } catch (OrdinalFormatException e) {
            System.out.println(e);
        }
        try {
            calculator.fInverse(-3);
            Assert.fail("Expecting IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            System.out.println(e);
        }
    }

    @Test
    public void main() {
        var out = new ByteArrayOutputStream();
        var saved = System.out;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        try {
            OrdinalCalculator.main(new String[] { "w+1", "-f", "w*2", "-i", "1.75" });
        } finally {
            System.setOut(saved);
        }
        var lines = out.toString(StandardCharsets.UTF_8).split("\\R");
        Assert.assertEquals(3, lines.length);
        Assert.assertEquals("w+1 = w+1", lines[0]);
        Assert.assertTrue(lines[1], lines[1].startsWith("w*2 = w*2 f=1.75"));
        Assert.assertEquals("f^-1(1.75) = w*2", lines[2]);
    }
}
