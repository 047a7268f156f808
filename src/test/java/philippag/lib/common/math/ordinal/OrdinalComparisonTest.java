package philippag.lib.common.math.ordinal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.Assert;
import org.junit.Test;

public class OrdinalComparisonTest extends CommonTestBase {

    // strictly increasing
    private static final String[] CHAIN = {
        "0", "1", "2", "1000", "w", "w+1", "w+2", "w*2", "w*2+5", "w^2", "w^2+w", "w^2*3",
        "w^3", "w^w", "w^w+1", "w^(w+1)", "w^(w*2)", "w^(w^2)", "w^w^w", "w^w^w*2", "w^w^w^w", "e_0",
    };

    @Test
    public void chain() {
        for (int i = 0; i < CHAIN.length; i++) {
            for (int j = 0; j < CHAIN.length; j++) {
                checkCompare(Integer.compare(i, j), parse(CHAIN[i]), parse(CHAIN[j]));
            }
        }
    }

    @Test
    public void sort() {
        var list = new ArrayList<Ordinal>();
        for (var str : CHAIN) {
            list.add(parse(str));
        }
        var shuffled = new ArrayList<>(list);
        Collections.shuffle(shuffled, new Random(42));
        Collections.sort(shuffled);
        Assert.assertEquals(list, shuffled);
    }

    @Test
    public void towers() {
        checkCompare(0, OmegaTower.of(0), CnfOrdinal.ONE);
        checkCompare(1, OmegaTower.of(0), CnfOrdinal.ZERO);
        checkCompare(-1, OmegaTower.of(0), CnfOrdinal.fromLong(2));
        checkCompare(0, OmegaTower.of(1), CnfOrdinal.OMEGA);
        checkCompare(0, OmegaTower.of(2), parse("w^w"));
        checkCompare(-1, OmegaTower.of(2), parse("w^w*2"));
        checkCompare(0, OmegaTower.of(3), parse("w^w^w"));
        checkCompare(-1, OmegaTower.of(3), parse("w^w^w+1"));
        checkCompare(1, OmegaTower.of(3), parse("w^(w^5*9+w)"));
        checkCompare(1, OmegaTower.of(5), parse("w^(w+1)"));
        checkCompare(-1, OmegaTower.of(4), OmegaTower.of(5));
        checkCompare(-1, OmegaTower.of(1_000_000), EpsilonNaught.INSTANCE);
        checkCompare(0, EpsilonNaught.INSTANCE, EpsilonNaught.INSTANCE);
    }

    @Test
    public void towerHeightDecidesWithoutExpansion() {
        // a tower of another height is decided by the height alone
        var budget = new OperationBudget(100);
        checkCompare(1, OmegaTower.of(1_000_000), parse("w^w^w"), budget);
        checkCompare(-1, parse("w^(w^2+1)"), OmegaTower.of(500_000), budget);
        Assert.assertTrue(budget.getCount() < 100);
    }

    @Test
    public void randomOrdinals() {
        var rnd = new Random(7);
        for (int i = 0; i < 500; i++) {
            var a = randomOrdinal(rnd, 3);
            var b = randomOrdinal(rnd, 3);
            int c = a.compareTo(b);
            Assert.assertEquals(-c, b.compareTo(a));
            Assert.assertEquals(c == 0, a.equals(b));
            // a < a + 1 and a <= b + a
            var budget = new OperationBudget();
            Assert.assertTrue(a.compareTo(OrdinalArithmetic.add(a, CnfOrdinal.ONE, budget)) < 0);
            Assert.assertTrue(a.compareTo(OrdinalArithmetic.add(b, a, budget)) <= 0);
        }
    }

    private static void checkCompare(int expected, Ordinal lhs, Ordinal rhs) {
        checkCompare(expected, lhs, rhs, new OperationBudget());
    }

    private static void checkCompare(int expected, Ordinal lhs, Ordinal rhs, OperationBudget budget) {
        Assert.assertEquals(lhs + " vs " + rhs, expected, Integer.signum(OrdinalComparison.compare(lhs, rhs, budget)));
        Assert.assertEquals(rhs + " vs " + lhs, -expected, Integer.signum(OrdinalComparison.compare(rhs, lhs, budget)));
        Assert.assertEquals(expected, Integer.signum(lhs.compareTo(rhs)));
    }

    @Test
    public void listOrder() {
        // prefix is smaller
        Assert.assertTrue(OrdinalComparison.compareCnf(cnf("w^2"), cnf("w^2+1"), new OperationBudget()) < 0);
        Assert.assertTrue(OrdinalComparison.compareCnf(cnf("w^2+w*9"), cnf("w^2*2"), new OperationBudget()) < 0);
        Assert.assertEquals(List.of(), CnfOrdinal.ZERO.terms());
    }
}
