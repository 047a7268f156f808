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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compact representation of w^^height, i.e. w^w^...^w with {@code height} omegas.
 *
 * Height 0 is 1, height 1 is w. Towers are an output of simplification
 * and of the inverse embedding; arithmetic converts them to CNF first.
 */
public final class OmegaTower extends Ordinal {

    private static final Logger log = LoggerFactory.getLogger(OmegaTower.class);

    private final long height;

    private OmegaTower(long height) {
        this.height = height;
    }

    public static OmegaTower of(long height) {
        if (height < 0) {
            throw new IllegalArgumentException("negative height: " + height);
        }
        return new OmegaTower(height);
    }

    public long getHeight() {
        return height;
    }

    @Override
    public Kind kind() {
        return Kind.OMEGA_TOWER;
    }

    @Override
    public boolean isZero() {
        return false;
    }

    @Override
    public boolean isFinite() {
        return height == 0;
    }

    @Override
    public boolean isLimit() {
        return height > 0;
    }

    @Override
    public boolean isSuccessor() {
        return height == 0;
    }

    @Override
    public boolean isOmega() {
        return height == 1;
    }

    /**
     * Expands the tower by tetrating w, which consumes budget proportional to the height.
     */
    @Override
    public CnfOrdinal toCnf(OperationBudget budget) {
        log.debug("Expanding w^^{} to CNF, budget {}", height, budget);
        var result = OrdinalArithmetic.tetrate(CnfOrdinal.OMEGA, CnfOrdinal.fromLong(height), budget);
        assert result.kind() == Kind.CNF;
        return (CnfOrdinal) result;
    }

    @Override
    public String toStringCNF() {
        return "w^^" + height;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof OmegaTower o && height == o.height;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(height);
    }
}
