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
 * Counter bounding the total work of one calculation.
 *
 * Every arithmetic, comparison, complexity and embedding step calls {@link #consume()}
 * at least once, recursive sub-steps included. When the counter exceeds the limit,
 * a {@link BudgetExceededException} aborts the calculation.
 *
 * An instance belongs to exactly one calculation and is never reset.
 * It is not thread-safe.
 */
public final class OperationBudget {

    public static final long DEFAULT_LIMIT = 1_000_000;

    private final long limit;
    private long count;

    public OperationBudget() {
        this(DEFAULT_LIMIT);
    }

    public OperationBudget(long limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("negative limit: " + limit);
        }
        this.limit = limit;
    }

    /**
     * A fresh budget that never runs out, for callers outside of a calculation
     * such as {@link Ordinal#compareTo(Ordinal)}.
     */
    public static OperationBudget unlimited() {
        return new OperationBudget(Long.MAX_VALUE);
    }

    public void consume() {
        consume(1);
    }

    public void consume(long n) {
        if (n < 0) {
            throw new IllegalArgumentException("negative amount: " + n);
        }
        count = count > Long.MAX_VALUE - n ? Long.MAX_VALUE : count + n; // saturate
        if (count > limit) {
            throw new BudgetExceededException(limit, count);
        }
    }

    public long getCount() {
        return count;
    }

    public long getLimit() {
        return limit;
    }

    public long getRemaining() {
        return limit - count;
    }

    @Override
    public String toString() {
        return count + "/" + limit;
    }
}
