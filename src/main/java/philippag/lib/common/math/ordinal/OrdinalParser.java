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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recursive descent parser and evaluator for ordinal expressions.
 *
 * <pre>
 * expression := product ('+' product)*
 * product    := power ('*' power)*
 * power      := tetration ('^' power)?
 * tetration  := atom ('^^' tetration)?
 * atom       := number | 'w' | 'e_0' | '(' expression ')'
 * </pre>
 *
 * So {@code ^^} binds tighter than {@code ^}, which binds tighter than {@code *} and {@code +}.
 * {@code ^^} and {@code ^} associate to the right, {@code *} and {@code +} to the left.
 * Whitespace is ignored, the empty expression is 0.
 *
 * Each operator consumes one unit of the budget before it is evaluated.
 */
public final class OrdinalParser {

    private enum TokenType {
        NUMBER,
        OMEGA,
        EPSILON_NAUGHT,
        PLUS,
        TIMES,
        POWER,
        TETRATION,
        LEFT,
        RIGHT,
    }

    private static final class Token {

        final TokenType type;
        final int position;
        final BigInteger value;

        Token(TokenType type, int position, BigInteger value) {
            this.type = type;
            this.position = position;
            this.value = value;
        }

        @Override
        public String toString() {
            return switch (type) {
                case NUMBER -> value.toString();
                case OMEGA -> "w";
                case EPSILON_NAUGHT -> "e_0";
                case PLUS -> "+";
                case TIMES -> "*";
                case POWER -> "^";
                case TETRATION -> "^^";
                case LEFT -> "(";
                case RIGHT -> ")";
            };
        }
    }

    private final String input;
    private final OperationBudget budget;
    private final List<Token> tokens;
    private int pos;

    private OrdinalParser(String input, OperationBudget budget) {
        this.input = Objects.requireNonNull(input, "input");
        this.budget = Objects.requireNonNull(budget, "budget");
        this.tokens = tokenize(input);
    }

    public static Ordinal evaluate(String input, OperationBudget budget) {
        return new OrdinalParser(input, budget).parse();
    }

    private static List<Token> tokenize(String str) {
        var result = new ArrayList<Token>();
        int i = 0;
        int length = str.length();
        while (i < length) {
            char ch = str.charAt(i);
            if (Character.isWhitespace(ch)) {
                i++;
            } else if (ch >= '0' && ch <= '9') {
                int start = i;
                while (i < length && str.charAt(i) >= '0' && str.charAt(i) <= '9') {
                    i++;
                }
                result.add(new Token(TokenType.NUMBER, start, new BigInteger(str.substring(start, i))));
            } else if (ch == 'w') {
                result.add(new Token(TokenType.OMEGA, i++, null));
            } else if (str.startsWith("e_0", i)) {
                result.add(new Token(TokenType.EPSILON_NAUGHT, i, null));
                i += 3;
            } else if (str.startsWith("^^", i)) {
                result.add(new Token(TokenType.TETRATION, i, null));
                i += 2;
            } else {
                var type = switch (ch) {
                    case '+' -> TokenType.PLUS;
                    case '*' -> TokenType.TIMES;
                    case '^' -> TokenType.POWER;
                    case '(' -> TokenType.LEFT;
                    case ')' -> TokenType.RIGHT;
                    default -> throw new OrdinalFormatException("Unexpected character '" + ch + "'", i);
                };
                result.add(new Token(type, i++, null));
            }
        }
        return result;
    }

    private Ordinal parse() {
        if (tokens.isEmpty()) {
            return CnfOrdinal.ZERO;
        }
        var result = parseExpression();
        if (pos < tokens.size()) {
            var token = tokens.get(pos);
            throw new OrdinalFormatException("Unexpected token '" + token + "'", token.position);
        }
        return result;
    }

    private Token peek() {
        return pos < tokens.size() ? tokens.get(pos) : null;
    }

    private boolean accept(TokenType type) {
        var token = peek();
        if (token != null && token.type == type) {
            pos++;
            return true;
        }
        return false;
    }

    private Ordinal parseExpression() {
        var left = parseProduct();
        while (accept(TokenType.PLUS)) {
            var right = parseProduct();
            budget.consume();
            left = OrdinalArithmetic.add(left, right, budget);
        }
        return left;
    }

    private Ordinal parseProduct() {
        var left = parsePower();
        while (accept(TokenType.TIMES)) {
            var right = parsePower();
            budget.consume();
            left = OrdinalArithmetic.multiply(left, right, budget);
        }
        return left;
    }

    private Ordinal parsePower() {
        var left = parseTetration();
        if (accept(TokenType.POWER)) {
            var right = parsePower();
            budget.consume();
            return OrdinalArithmetic.power(left, right, budget);
        }
        return left;
    }

    private Ordinal parseTetration() {
        var left = parseAtom();
        if (accept(TokenType.TETRATION)) {
            var right = parseTetration();
            budget.consume();
            return OrdinalArithmetic.tetrate(left, right, budget);
        }
        return left;
    }

    private Ordinal parseAtom() {
        var token = peek();
        if (token == null) {
            throw new OrdinalFormatException("Unexpected end of input", input.length());
        }
        pos++;
        return switch (token.type) {
            case NUMBER -> CnfOrdinal.fromBigInteger(token.value);
            case OMEGA -> CnfOrdinal.OMEGA;
            case EPSILON_NAUGHT -> EpsilonNaught.INSTANCE;
            case LEFT -> {
                var result = parseExpression();
                var closing = peek();
                if (closing == null || closing.type != TokenType.RIGHT) {
                    throw new OrdinalFormatException("Expected ')'", closing == null ? input.length() : closing.position);
                }
                pos++;
                yield result;
            }
            default -> throw new OrdinalFormatException("Unexpected token '" + token + "'", token.position);
        };
    }
}
