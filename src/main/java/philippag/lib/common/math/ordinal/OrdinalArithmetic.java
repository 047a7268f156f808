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

import static philippag.lib.common.math.ordinal.CnfOrdinal.ONE;
import static philippag.lib.common.math.ordinal.CnfOrdinal.ZERO;

import java.math.BigInteger;
import java.util.ArrayList;

import philippag.lib.common.math.ordinal.CnfOrdinal.Term;

/**
 * Ordinal addition, multiplication, exponentiation and tetration.
 *
 * The {@link Ordinal} entry points dispatch on the kinds of both operands.
 * Towers are expanded to CNF first. Arithmetic with e_0 is limited to a few exact identities,
 * every other combination throws {@link UnsupportedOrdinalOperationException}.
 *
 * Every method consumes the given budget for itself and for all of its sub-steps.
 */
public final class OrdinalArithmetic {

    private OrdinalArithmetic() {
    }

    public static Ordinal add(Ordinal lhs, Ordinal rhs, OperationBudget budget) {
        budget.consume();
        var a = expandTower(lhs, budget);
        var b = expandTower(rhs, budget);
        return switch (a.kind()) {
            case CNF -> switch (b.kind()) {
                case CNF -> add((CnfOrdinal) a, (CnfOrdinal) b, budget);
                case EPSILON_NAUGHT -> b; // a + e_0 = e_0
                case OMEGA_TOWER -> throw new Error("UNREACHABLE");
            };
            case EPSILON_NAUGHT -> {
                if (b.isZero()) {
                    yield a;
                }
                throw unsupported(a, "+", b);
            }
            case OMEGA_TOWER -> throw new Error("UNREACHABLE");
        };
    }

    public static Ordinal multiply(Ordinal lhs, Ordinal rhs, OperationBudget budget) {
        budget.consume();
        var a = expandTower(lhs, budget);
        var b = expandTower(rhs, budget);
        return switch (a.kind()) {
            case CNF -> switch (b.kind()) {
                case CNF -> multiply((CnfOrdinal) a, (CnfOrdinal) b, budget);
                case EPSILON_NAUGHT -> a.isZero() ? ZERO : b; // a * w^e_0 = w^(a1 + e_0)
                case OMEGA_TOWER -> throw new Error("UNREACHABLE");
            };
            case EPSILON_NAUGHT -> {
                if (b.isZero()) {
                    yield ZERO;
                }
                if (isOne(b)) {
                    yield a;
                }
                throw unsupported(a, "*", b);
            }
            case OMEGA_TOWER -> throw new Error("UNREACHABLE");
        };
    }

    public static Ordinal power(Ordinal base, Ordinal exponent, OperationBudget budget) {
        budget.consume();
        var a = expandTower(base, budget);
        var b = expandTower(exponent, budget);
        return switch (a.kind()) {
            case CNF -> switch (b.kind()) {
                case CNF -> power((CnfOrdinal) a, (CnfOrdinal) b, budget);
                case EPSILON_NAUGHT -> a.isZero() || isOne(a) ? a : b; // x^e_0 = e_0 for x > 1
                case OMEGA_TOWER -> throw new Error("UNREACHABLE");
            };
            case EPSILON_NAUGHT -> {
                if (b.isZero()) {
                    yield ONE;
                }
                if (isOne(b)) {
                    yield a;
                }
                throw unsupported(a, "^", b);
            }
            case OMEGA_TOWER -> throw new Error("UNREACHABLE");
        };
    }

    public static Ordinal tetrate(Ordinal base, Ordinal height, OperationBudget budget) {
        budget.consume();
        var a = expandTower(base, budget);
        var b = expandTower(height, budget);
        return switch (a.kind()) {
            case CNF -> switch (b.kind()) {
                case CNF -> tetrate((CnfOrdinal) a, (CnfOrdinal) b, budget);
                case EPSILON_NAUGHT -> tetrateToEpsilonNaught((CnfOrdinal) a);
                case OMEGA_TOWER -> throw new Error("UNREACHABLE");
            };
            case EPSILON_NAUGHT -> {
                if (b.isZero()) {
                    yield ONE;
                }
                if (isOne(b)) {
                    yield a;
                }
                throw unsupported(a, "^^", b);
            }
            case OMEGA_TOWER -> throw new Error("UNREACHABLE");
        };
    }

    public static CnfOrdinal add(CnfOrdinal lhs, CnfOrdinal rhs, OperationBudget budget) {
        budget.consume();
        if (rhs.isZero()) {
            return lhs;
        }
        if (lhs.isZero()) {
            return rhs;
        }
        if (lhs.isFinite()) {
            return rhs.isFinite() ? CnfOrdinal.fromBigInteger(lhs.getFinitePart().add(rhs.getFinitePart())) : rhs;
        }

        var a = lhs.terms();
        var b = rhs.terms();
        var leading = b.get(0);
        var result = new ArrayList<Term>(a.size() + b.size());
        int c = 1;
        int j = 0;
        for (; j < a.size(); j++) {
            c = OrdinalComparison.compareCnf(a.get(j).getExponent(), leading.getExponent(), budget);
            if (c <= 0) {
                break;
            }
            result.add(a.get(j));
        }
        if (j < a.size() && c == 0) {
            result.add(a.get(j).withCoefficient(a.get(j).getCoefficient().add(leading.getCoefficient())));
            result.addAll(b.subList(1, b.size()));
        } else {
            // the smaller tail of lhs is absorbed
            result.addAll(b);
        }
        return new CnfOrdinal(result);
    }

    public static CnfOrdinal multiply(CnfOrdinal lhs, CnfOrdinal rhs, OperationBudget budget) {
        budget.consume();
        if (lhs.isZero() || rhs.isZero()) {
            return ZERO;
        }
        if (lhs.isOne()) {
            return rhs;
        }
        if (rhs.isOne()) {
            return lhs;
        }
        if (lhs.isFinite() && rhs.isFinite()) {
            return CnfOrdinal.fromBigInteger(lhs.getFinitePart().multiply(rhs.getFinitePart()));
        }
        var result = ZERO;
        for (var term : rhs.terms()) {
            result = add(result, multiplyByTerm(lhs, term, budget), budget);
        }
        return result;
    }

    private static CnfOrdinal multiplyByTerm(CnfOrdinal lhs, Term term, OperationBudget budget) {
        budget.consume();
        var k = term.getCoefficient();
        if (term.isFinite()) {
            if (lhs.isFinite()) {
                return CnfOrdinal.fromBigInteger(lhs.getFinitePart().multiply(k));
            }
            // (w^a*c + r) * k = w^a*(c*k) + r
            var terms = new ArrayList<>(lhs.terms());
            var first = terms.get(0);
            terms.set(0, first.withCoefficient(first.getCoefficient().multiply(k)));
            return new CnfOrdinal(terms);
        }
        if (lhs.isFinite()) {
            return CnfOrdinal.term(term.getExponent(), k);
        }
        // (w^a*c + r) * w^e = w^(a+e)
        return CnfOrdinal.term(add(lhs.getLeadingExponent(), term.getExponent(), budget), k);
    }

    public static CnfOrdinal power(CnfOrdinal base, CnfOrdinal exponent, OperationBudget budget) {
        budget.consume();
        if (exponent.isZero()) {
            return ONE;
        }
        if (base.isZero()) {
            return ZERO;
        }
        if (base.isOne()) {
            return ONE;
        }
        if (exponent.isOne()) {
            return base;
        }
        if (base.isFinite()) {
            var k = base.getFinitePart();
            if (exponent.isFinite()) {
                return CnfOrdinal.fromBigInteger(powFinite(k, exponent.getFinitePart(), budget));
            }
            // k^(w*xi + r) = (k^w)^xi * k^r = w^xi * k^r
            var xi = divideByOmega(exponent.getLimitPart(), budget);
            var kr = powFinite(k, exponent.getFinitePart(), budget);
            return multiply(CnfOrdinal.omegaPower(xi), CnfOrdinal.fromBigInteger(kr), budget);
        }
        if (exponent.isFinite()) {
            return powFiniteExponent(base, exponent.getFinitePart(), budget);
        }
        // a^(B + m) = a^B * a^m with a^B = w^(a1*B), the rest of a is absorbed
        var m = exponent.getFinitePart();
        var limitPower = CnfOrdinal.omegaPower(multiply(base.getLeadingExponent(), exponent.getLimitPart(), budget));
        if (m.signum() == 0) {
            return limitPower;
        }
        return multiply(limitPower, powFiniteExponent(base, m, budget), budget);
    }

    // infinite base, finite exponent
    private static CnfOrdinal powFiniteExponent(CnfOrdinal base, BigInteger m, OperationBudget budget) {
        assert !base.isFinite();
        budget.consume();
        if (m.signum() == 0) {
            return ONE;
        }
        if (base.size() == 1) {
            // (w^a*c)^m = w^(a*m)*c
            var term = base.getLeadingTerm();
            return CnfOrdinal.term(multiply(term.getExponent(), CnfOrdinal.fromBigInteger(m), budget), term.getCoefficient());
        }
        var result = ONE;
        for (var i = BigInteger.ZERO; i.compareTo(m) < 0; i = i.add(BigInteger.ONE)) {
            budget.consume();
            result = multiply(result, base, budget);
        }
        return result;
    }

    /**
     * k^m for finite values, charging the budget by the size of the result
     * so that huge powers fail before they are computed.
     */
    static BigInteger powFinite(BigInteger k, BigInteger m, OperationBudget budget) {
        long bits = k.bitLength();
        long words = m.bitLength() > 62 || bits > Long.MAX_VALUE / Math.max(1, m.longValue())
                ? Long.MAX_VALUE
                : bits * m.longValue() / 64;
        budget.consume(words == Long.MAX_VALUE ? words : 1 + words);
        return k.pow(m.intValueExact());
    }

    /**
     * gamma - 1 where defined: n -> n-1, a+n -> a+(n-1), 0 and limit ordinals are returned unchanged.
     */
    public static CnfOrdinal exponentPredecessor(CnfOrdinal gamma, OperationBudget budget) {
        budget.consume();
        if (!gamma.isSuccessor()) {
            return gamma;
        }
        var terms = new ArrayList<>(gamma.terms());
        int last = terms.size() - 1;
        var n = terms.get(last).getCoefficient();
        if (BigInteger.ONE.equals(n)) {
            terms.remove(last);
        } else {
            terms.set(last, terms.get(last).withCoefficient(n.subtract(BigInteger.ONE)));
        }
        return terms.isEmpty() ? ZERO : new CnfOrdinal(terms);
    }

    /**
     * The xi with w*xi = B for a limit ordinal B. A finite part of B is discarded.
     *
     * Since w*w^e = w^(1+e), finite exponents drop by one while infinite exponents stay.
     */
    public static CnfOrdinal divideByOmega(CnfOrdinal limit, OperationBudget budget) {
        budget.consume();
        var terms = new ArrayList<Term>(limit.size());
        for (var term : limit.terms()) {
            if (term.isFinite()) {
                continue;
            }
            var e = term.getExponent();
            terms.add(new Term(e.isFinite() ? exponentPredecessor(e, budget) : e, term.getCoefficient()));
        }
        return terms.isEmpty() ? ZERO : new CnfOrdinal(terms);
    }

    public static Ordinal tetrate(CnfOrdinal base, CnfOrdinal height, OperationBudget budget) {
        budget.consume();
        if (height.isZero()) {
            return ONE;
        }
        if (height.isOne()) {
            return base;
        }
        if (base.isZero()) {
            if (!height.isFinite()) {
                throw new UnsupportedOrdinalOperationException("0^^" + height + " is undefined");
            }
            // 0^^m alternates between 1 and 0
            return height.getFinitePart().testBit(0) ? ZERO : ONE;
        }
        if (base.isOne()) {
            return ONE;
        }
        if (!height.isFinite()) {
            return base.isFinite() ? CnfOrdinal.OMEGA : EpsilonNaught.INSTANCE;
        }
        // a^^m = a^(a^^(m-1)), evaluated from the top of the tower down
        var m = height.getFinitePart();
        var result = base;
        for (var i = BigInteger.ONE; i.compareTo(m) < 0; i = i.add(BigInteger.ONE)) {
            budget.consume();
            result = power(base, result, budget);
        }
        return result;
    }

    private static Ordinal tetrateToEpsilonNaught(CnfOrdinal base) {
        if (base.isZero()) {
            throw new UnsupportedOrdinalOperationException("0^^e_0 is undefined");
        }
        if (base.isOne()) {
            return ONE;
        }
        return base.isFinite() ? CnfOrdinal.OMEGA : EpsilonNaught.INSTANCE;
    }

    private static Ordinal expandTower(Ordinal x, OperationBudget budget) {
        return x.kind() == Ordinal.Kind.OMEGA_TOWER ? x.toCnf(budget) : x;
    }

    private static boolean isOne(Ordinal x) {
        return x instanceof CnfOrdinal o && o.isOne();
    }

    private static UnsupportedOrdinalOperationException unsupported(Ordinal lhs, String op, Ordinal rhs) {
        return new UnsupportedOrdinalOperationException("Unsupported operation: " + lhs + " " + op + " " + rhs);
    }
}
