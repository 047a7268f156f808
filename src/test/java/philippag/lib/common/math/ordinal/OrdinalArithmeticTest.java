package philippag.lib.common.math.ordinal;

import java.math.BigInteger;
import java.util.Random;

import org.junit.Assert;
import org.junit.Test;

public class OrdinalArithmeticTest extends CommonTestBase {

    private static final Ordinal EPS = EpsilonNaught.INSTANCE;

    @Test
    public void add() {
        checkAdd("5", "2", "3");
        checkAdd("w", "1", "w");
        checkAdd("w+1", "w", "1");
        checkAdd("w*2", "w", "w");
        checkAdd("w^2", "w", "w^2");
        checkAdd("w^2+w", "w^2", "w");
        checkAdd("w^2*2+w+1", "w^2+w*5+3", "w^2+w+1");
        checkAdd("w^w+w^3", "w^w+w^2+w", "w^3");
        checkAdd("w^w", "0", "w^w");
        checkAdd("w^w", "w^w", "0");
        checkAdd("e_0", "w^w^w", "e_0");
        checkAdd("e_0", "e_0", "0");
    }

    @Test
    public void multiply() {
        checkMultiply("6", "2", "3");
        checkMultiply("w*2", "w", "2");
        checkMultiply("w", "2", "w");
        checkMultiply("w*2+1", "w+1", "2");
        checkMultiply("w^2", "w", "w");
        checkMultiply("w^2+w+1", "w+1", "w+1");
        checkMultiply("w^3+w^2*25+w*7+9", "w^2*5+w*7+9", "w+5");
        checkMultiply("w^w", "w^2+1", "w^w");
        checkMultiply("w^(w+2)+w^w", "w^w", "w^2+1");
        checkMultiply("0", "w^w", "0");
        checkMultiply("0", "0", "w");
        checkMultiply("w^w", "1", "w^w");
        checkMultiply("e_0", "w^w", "e_0");
        checkMultiply("0", "0", "e_0");
        checkMultiply("0", "e_0", "0");
        checkMultiply("e_0", "e_0", "1");
    }

    @Test
    public void power() {
        checkPower("8", "2", "3");
        checkPower("1", "w", "0");
        checkPower("0", "0", "w");
        checkPower("1", "0", "0");
        checkPower("1", "1", "w^w");
        checkPower("w", "2", "w");
        checkPower("w*2", "2", "w+1");
        checkPower("w^w", "2", "w^2");
        checkPower("w^w*8", "2", "w^2+3");
        checkPower("w^(w+1)", "w", "w+1");
        checkPower("w^w", "w^2", "w");
        checkPower("w^(w*2)", "w^w", "2");
        checkPower("w^2+w+1", "w+1", "2");
        checkPower("w^3+w^2+w+1", "w+1", "3");
        checkPower("w^(w+1)+w^w", "w+1", "w+1");
        checkPower("w^(w^2)", "w^2*7+3", "w^2");
        checkPower("w^(w^w)", "w", "w^w");
        checkPower("e_0", "2", "e_0");
        checkPower("e_0", "w", "e_0");
        checkPower("1", "1", "e_0");
        checkPower("0", "0", "e_0");
        checkPower("1", "e_0", "0");
        checkPower("e_0", "e_0", "1");
    }

    @Test
    public void tetrate() {
        checkTetrate("1", "5", "0");
        checkTetrate("5", "5", "1");
        checkTetrate("4", "2", "2");
        checkTetrate("16", "2", "3");
        checkTetrate("65536", "2", "4");
        checkTetrate("1", "1", "w");
        checkTetrate("1", "0", "2");
        checkTetrate("0", "0", "3");
        checkTetrate("1", "0", "4");
        checkTetrate("w^w", "w", "2");
        checkTetrate("w^(w^w)", "w", "3");
        checkTetrate("w", "2", "w");
        checkTetrate("w", "7", "w+3");
        checkTetrate("e_0", "w", "w");
        checkTetrate("e_0", "w+1", "w^2");
        checkTetrate("w", "2", "e_0");
        checkTetrate("e_0", "w", "e_0");
        checkTetrate("1", "e_0", "0");
        checkTetrate("e_0", "e_0", "1");
    }

    @Test
    public void originalExamples() {
        checkParse("w^2+w+1", "(w+1)*(w+1)");
        checkParse("w^2+w+1", "(w+1)^2");
        checkParse("w*2", "2^(w+1)");
        checkParse("w^(w+1)", "w^(w+1)");
        checkParse("w^w", "(w^2)^w");
        checkParse("w^(w*2)", "(w^w)^2");
        checkParse("w^3+w+1", "(w^2+w*3+5)*w+(w+1)");
        checkParse("w^w", "2^(w^2)");
    }

    private static void checkParse(String expected, String expression) {
        Assert.assertEquals(expected, parse(expression).toStringCNF());
    }

    @Test
    public void towersAreExpanded() {
        var budget = new OperationBudget();
        Assert.assertEquals("w^w+1", OrdinalArithmetic.add(OmegaTower.of(2), CnfOrdinal.ONE, budget).toString());
        Assert.assertEquals("w^(w^w)", OrdinalArithmetic.power(CnfOrdinal.OMEGA, OmegaTower.of(2), budget).toString());
        Assert.assertEquals("w^(w^w*2)", OrdinalArithmetic.multiply(OmegaTower.of(3), OmegaTower.of(3), budget).toString());
        Assert.assertEquals("e_0", OrdinalArithmetic.add(OmegaTower.of(5), EPS, budget).toString());
    }

    @Test
    public void unsupported() {
        checkUnsupported(EPS, "+", CnfOrdinal.ONE);
        checkUnsupported(EPS, "+", EPS);
        checkUnsupported(EPS, "*", CnfOrdinal.fromLong(2));
        checkUnsupported(EPS, "*", CnfOrdinal.OMEGA);
        checkUnsupported(EPS, "^", CnfOrdinal.fromLong(2));
        checkUnsupported(EPS, "^", EPS);
        checkUnsupported(EPS, "^^", CnfOrdinal.fromLong(2));
        checkUnsupported(CnfOrdinal.ZERO, "^^", CnfOrdinal.OMEGA);
        checkUnsupported(CnfOrdinal.ZERO, "^^", EPS);
    }

    private static void checkUnsupported(Ordinal lhs, String op, Ordinal rhs) {
        var budget = new OperationBudget();
        try {
            switch (op) {
                case "+" -> OrdinalArithmetic.add(lhs, rhs, budget);
                case "*" -> OrdinalArithmetic.multiply(lhs, rhs, budget);
                case "^" -> OrdinalArithmetic.power(lhs, rhs, budget);
                case "^^" -> OrdinalArithmetic.tetrate(lhs, rhs, budget);
                default -> throw new Error("UNREACHABLE");
            }
            Assert.fail("Expecting UnsupportedOrdinalOperationException");
        } catch (UnsupportedOrdinalOperationException e) {
            System.out.println(e);
            Assert.assertTrue(e instanceof ArithmeticException);
        }
    }

    @Test
    public void exponentPredecessor() {
        var budget = new OperationBudget();
        Assert.assertEquals("0", OrdinalArithmetic.exponentPredecessor(CnfOrdinal.ZERO, budget).toString());
        Assert.assertEquals("0", OrdinalArithmetic.exponentPredecessor(CnfOrdinal.ONE, budget).toString());
        Assert.assertEquals("4", OrdinalArithmetic.exponentPredecessor(CnfOrdinal.fromLong(5), budget).toString());
        Assert.assertEquals("w", OrdinalArithmetic.exponentPredecessor(cnf("w+1"), budget).toString());
        Assert.assertEquals("w^2+w+2", OrdinalArithmetic.exponentPredecessor(cnf("w^2+w+3"), budget).toString());
        Assert.assertEquals("w^w", OrdinalArithmetic.exponentPredecessor(cnf("w^w"), budget).toString());
    }

    @Test
    public void divideByOmega() {
        var budget = new OperationBudget();
        Assert.assertEquals("1", OrdinalArithmetic.divideByOmega(CnfOrdinal.OMEGA, budget).toString());
        Assert.assertEquals("5", OrdinalArithmetic.divideByOmega(cnf("w*5"), budget).toString());
        Assert.assertEquals("w*2+3", OrdinalArithmetic.divideByOmega(cnf("w^2*2+w*3"), budget).toString());
        Assert.assertEquals("w^w+w^2", OrdinalArithmetic.divideByOmega(cnf("w^w+w^3"), budget).toString());
        Assert.assertEquals("w", OrdinalArithmetic.divideByOmega(cnf("w^2+7"), budget).toString());
        // w * w^(w+1) = w^(w+1)
        Assert.assertEquals("w^(w+1)", OrdinalArithmetic.divideByOmega(cnf("w^(w+1)"), budget).toString());
        var xi = OrdinalArithmetic.divideByOmega(cnf("w^(w+1)*3+w^4"), budget);
        Assert.assertEquals(cnf("w^(w+1)*3+w^4"), OrdinalArithmetic.multiply(CnfOrdinal.OMEGA, xi, budget));
    }

    @Test
    public void hugeFinitePowerExceedsBudget() {
        try {
            OrdinalParser.evaluate("2^100000000", new OperationBudget());
            Assert.fail("Expecting BudgetExceededException");
        } catch (BudgetExceededException e) {
            System.out.println(e);
        }
        Assert.assertEquals(19729, OrdinalParser.evaluate("2^^5", new OperationBudget()).toStringCNF().length());
        try {
            OrdinalParser.evaluate("2^^6", new OperationBudget());
            Assert.fail("Expecting BudgetExceededException");
        } catch (BudgetExceededException e) {
            System.out.println(e);
        }
        try {
            OrdinalParser.evaluate("w^^100000", new OperationBudget(10_000));
            Assert.fail("Expecting BudgetExceededException");
        } catch (BudgetExceededException e) {
            System.out.println(e);
        }
    }

    @Test
    public void laws() {
        var rnd = new Random(1234);
        for (int i = 0; i < 300; i++) {
            var a = randomOrdinal(rnd, 2);
            var b = randomOrdinal(rnd, 2);
            var c = randomOrdinal(rnd, 2);
            var budget = new OperationBudget(10_000_000);
            Assert.assertEquals(add(add(a, b, budget), c, budget), add(a, add(b, c, budget), budget));
            Assert.assertEquals(mul(mul(a, b, budget), c, budget), mul(a, mul(b, c, budget), budget));
            // left distributive only
            Assert.assertEquals(mul(a, add(b, c, budget), budget), add(mul(a, b, budget), mul(a, c, budget), budget));
            Assert.assertTrue(add(a, b, budget).compareTo(a) >= 0);
            Assert.assertTrue(add(a, b, budget).compareTo(b) >= 0);
        }
    }

    @Test
    public void powerLaws() {
        var rnd = new Random(99);
        for (int i = 0; i < 100; i++) {
            var a = randomOrdinal(rnd, 1);
            var b = CnfOrdinal.fromLong(random(rnd, 0, 4));
            var c = CnfOrdinal.fromLong(random(rnd, 0, 4));
            if (rnd.nextBoolean()) {
                b = OrdinalArithmetic.add(CnfOrdinal.OMEGA, b, OperationBudget.unlimited());
            }
            var budget = new OperationBudget(10_000_000);
            // a^(b+c) = a^b * a^c
            Assert.assertEquals(
                    OrdinalArithmetic.power(a, OrdinalArithmetic.add(b, c, budget), budget),
                    mul(OrdinalArithmetic.power(a, b, budget), OrdinalArithmetic.power(a, c, budget), budget));
        }
    }

    @Test
    public void finitePowerCharge() {
        var budget = new OperationBudget();
        Assert.assertEquals(BigInteger.ONE.shiftLeft(1000), OrdinalArithmetic.powFinite(BigInteger.TWO, BigInteger.valueOf(1000), budget));
        // one step plus the words of the result
        Assert.assertEquals(1 + 2 * 1000 / 64, budget.getCount());
    }

    private static CnfOrdinal add(CnfOrdinal a, CnfOrdinal b, OperationBudget budget) {
        return OrdinalArithmetic.add(a, b, budget);
    }

    private static CnfOrdinal mul(CnfOrdinal a, CnfOrdinal b, OperationBudget budget) {
        return OrdinalArithmetic.multiply(a, b, budget);
    }

    private static void checkAdd(String expected, String lhs, String rhs) {
        var result = OrdinalArithmetic.add(parse(lhs), parse(rhs), new OperationBudget());
        Assert.assertEquals(lhs + " + " + rhs, expected, result.toStringCNF());
        Assert.assertEquals(expected, parse("(" + lhs + ")+(" + rhs + ")").toStringCNF());
    }

    private static void checkMultiply(String expected, String lhs, String rhs) {
        var result = OrdinalArithmetic.multiply(parse(lhs), parse(rhs), new OperationBudget());
        Assert.assertEquals(lhs + " * " + rhs, expected, result.toStringCNF());
        Assert.assertEquals(expected, parse(lhs).multiply(parse(rhs), new OperationBudget()).toStringCNF());
    }

    private static void checkPower(String expected, String base, String exponent) {
        var result = OrdinalArithmetic.power(parse(base), parse(exponent), new OperationBudget());
        Assert.assertEquals(base + " ^ " + exponent, expected, result.toStringCNF());
        Assert.assertEquals(expected, parse(base).pow(parse(exponent), new OperationBudget()).toStringCNF());
    }

    private static void checkTetrate(String expected, String base, String height) {
        var result = OrdinalArithmetic.tetrate(parse(base), parse(height), new OperationBudget());
        Assert.assertEquals(base + " ^^ " + height, expected, result.toStringCNF());
        Assert.assertEquals(expected, parse(base).tetrate(parse(height), new OperationBudget()).toStringCNF());
    }
}
