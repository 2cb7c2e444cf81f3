package org.javai.gof.patterns.behavioral;

import org.javai.gof.DemoContext;
import org.javai.gof.patterns.AbstractPatternDemo;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Integer arithmetic with variables. Source text is parsed into an expression tree; each node
 * interprets itself against a variable binding.
 *
 * <p>Grammar:
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := factor (('*' | '/' | '%') factor)*
 * factor     := '-' factor | number | identifier | '(' expression ')'
 * </pre>
 */
public class InterpreterDemo extends AbstractPatternDemo {

    public InterpreterDemo(DemoContext context) {
        super(context, "Interpreter",
                "Defines a grammar for a simple language and an interpreter that evaluates sentences in it.");
    }

    @Override
    public void demonstrate() {
        out.println("Arithmetic Expression Interpreter Example");
        out.println();

        Map<String, Long> variables = new LinkedHashMap<>();
        variables.put("price", 40L);
        variables.put("quantity", 3L);
        variables.put("discount", 15L);
        out.println("Variables: " + variables);
        out.println();

        String[] sources = {
                "1 + 2 * 3",
                "(1 + 2) * 3",
                "price * quantity - discount",
                "-(price - discount) / 5",
                "quantity % 2 + tax",
                "price / (quantity - 3)",
                "price * (quantity"
        };

        for (String source : sources) {
            out.println("  " + source);
            try {
                Expression expression = Parser.parse(source);
                out.println("    tree:   " + expression);
                out.println("    result: " + expression.interpret(variables));
            } catch (IllegalArgumentException | ArithmeticException e) {
                out.println("    error:  " + e.getMessage());
            }
        }
    }

    /**
     * A node of the expression tree.
     */
    interface Expression {
        long interpret(Map<String, Long> variables);
    }

    record Literal(long value) implements Expression {
        @Override
        public long interpret(Map<String, Long> variables) {
            return value;
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    record Variable(String name) implements Expression {
        @Override
        public long interpret(Map<String, Long> variables) {
            Long value = variables.get(name);
            if (value == null) {
                throw new IllegalArgumentException("Unknown variable: " + name);
            }
            return value;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Negate(Expression operand) implements Expression {
        @Override
        public long interpret(Map<String, Long> variables) {
            return Math.negateExact(operand.interpret(variables));
        }

        @Override
        public String toString() {
            return "(-" + operand + ")";
        }
    }

    record Binary(char operator, Expression left, Expression right) implements Expression {
        @Override
        public long interpret(Map<String, Long> variables) {
            long l = left.interpret(variables);
            long r = right.interpret(variables);
            switch (operator) {
                case '+':
                    return Math.addExact(l, r);
                case '-':
                    return Math.subtractExact(l, r);
                case '*':
                    return Math.multiplyExact(l, r);
                case '/':
                case '%':
                    if (r == 0) {
                        throw new ArithmeticException("Division by zero in " + this);
                    }
                    return operator == '/' ? l / r : l % r;
                default:
                    throw new IllegalStateException("Unknown operator: " + operator);
            }
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator + " " + right + ")";
        }
    }

    /**
     * Recursive-descent parser over the grammar above.
     */
    static final class Parser {
        private final String source;
        private int position;

        private Parser(String source) {
            this.source = source;
        }

        static Expression parse(String source) {
            Parser parser = new Parser(source);
            Expression expression = parser.expression();
            parser.skipWhitespace();
            if (parser.position < source.length()) {
                throw parser.error("Unexpected '" + source.charAt(parser.position) + "'");
            }
            return expression;
        }

        private Expression expression() {
            Expression result = term();
            while (true) {
                char operator = peek();
                if (operator != '+' && operator != '-') {
                    return result;
                }
                position++;
                result = new Binary(operator, result, term());
            }
        }

        private Expression term() {
            Expression result = factor();
            while (true) {
                char operator = peek();
                if (operator != '*' && operator != '/' && operator != '%') {
                    return result;
                }
                position++;
                result = new Binary(operator, result, factor());
            }
        }

        private Expression factor() {
            char c = peek();
            if (c == '-') {
                position++;
                return new Negate(factor());
            }
            if (c == '(') {
                position++;
                Expression inner = expression();
                if (peek() != ')') {
                    throw error("Expected ')'");
                }
                position++;
                return inner;
            }
            if (Character.isDigit(c)) {
                int start = position;
                while (position < source.length() && Character.isDigit(source.charAt(position))) {
                    position++;
                }
                try {
                    return new Literal(Long.parseLong(source.substring(start, position)));
                } catch (NumberFormatException e) {
                    throw error("Number too large");
                }
            }
            if (Character.isLetter(c)) {
                int start = position;
                while (position < source.length() && Character.isLetterOrDigit(source.charAt(position))) {
                    position++;
                }
                return new Variable(source.substring(start, position));
            }
            throw error(c == 0 ? "Unexpected end of input" : "Unexpected '" + c + "'");
        }

        /**
         * Next significant character, or {@code 0} at end of input.
         */
        private char peek() {
            skipWhitespace();
            return position < source.length() ? source.charAt(position) : 0;
        }

        private void skipWhitespace() {
            while (position < source.length() && Character.isWhitespace(source.charAt(position))) {
                position++;
            }
        }

        private IllegalArgumentException error(String message) {
            return new IllegalArgumentException(message + " at position " + position);
        }
    }
}
