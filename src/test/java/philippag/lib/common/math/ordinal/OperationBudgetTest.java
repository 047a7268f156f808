package philippag.lib.common.math.ordinal;

import org.junit.Assert;
import org.junit.Test;

public class OperationBudgetTest extends CommonTestBase {

    @Test
    public void consume() {
        var budget = new OperationBudget(3);
        Assert.assertEquals(0, budget.getCount());
        Assert.assertEquals(3, budget.getRemaining());
        budget.consume();
        budget.consume(2);
        Assert.assertEquals(3, budget.getCount());
        Assert.assertEquals(0, budget.getRemaining());
        Assert.assertEquals("3/3", budget.toString());
        try {
            budget.consume();
            Assert.fail("Expecting BudgetExceededException");
        } catch (BudgetExceededException e) {
            System.out.println(e);
            Assert.assertEquals(3, e.getLimit());
            Assert.assertEquals(4, e.getCount());
            Assert.assertTrue(e instanceof OrdinalArithmeticException);
        }
    }

    @Test
    public void saturates() {
        var budget = OperationBudget.unlimited();
        budget.consume(Long.MAX_VALUE - 1);
        budget.consume(Long.MAX_VALUE);
        Assert.assertEquals(Long.MAX_VALUE, budget.getCount());
    }

    @Test
    public void errors() {
        try {
            new OperationBudget(-1);
            Assert.fail("Expecting IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            System.out.println(e);
        }
        try {
            new OperationBudget().consume(-1);
            Assert.fail("Expecting IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            System.out.println(e);
        }
        try {
            new OperationBudget(0).consume();
            Assert.fail("Expecting BudgetExceededException");
        } catch (BudgetExceededException e) {
            System.out.println(e);
        }
    }

    @Test
    public void exactLimit() {
        // a calculation that needs n steps succeeds with a limit of n and fails with n - 1
        for (var expression : new String[] { "w*w", "(w+1)^3", "2^^4", "w^^3+w^(w+1)*5", "(w^w)^(w+2)",
                "2^^2^^2", "w^^2^^2", "w^^2^^2^^1" }) {
            var budget = new OperationBudget();
            var expected = OrdinalParser.evaluate(expression, budget);
            long n = budget.getCount();
            Assert.assertTrue(n > 0);

            Assert.assertEquals(expected, OrdinalParser.evaluate(expression, new OperationBudget(n)));
            try {
                OrdinalParser.evaluate(expression, new OperationBudget(n - 1));
                Assert.fail("Expecting BudgetExceededException");
            } catch (BudgetExceededException e) {
                Assert.assertEquals(n - 1, e.getLimit());
            }
        }
    }
}
