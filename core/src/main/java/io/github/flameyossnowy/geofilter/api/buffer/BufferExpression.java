package io.github.flameyossnowy.geofilter.api.buffer;

import io.github.flameyossnowy.geofilter.api.exceptions.InvalidBufferExpressionException;
import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Per-feature buffer distance: arithmetic over numbers and source-feature fields.
 * <pre>
 *   expr    := term (('+' | '-') term)*
 *   term    := unary (('*' | '/') unary)*
 *   unary   := '-' unary | primary
 *   primary := number | "quoted field" | field | '(' expr ')'
 * </pre>
 * Parsed once, then either rendered into a dialect's SQL or evaluated in-process.
 */
public final class BufferExpression {
    private final String text;
    private final Node root;
    private final Set<String> fields;

    private BufferExpression(String text, Node root, Set<String> fields) {
        this.text = text;
        this.root = root;
        this.fields = Collections.unmodifiableSet(fields);
    }

    @NotNull
    public static BufferExpression parse(@NotNull String text) {
        Parser parser = new Parser(text);
        Node root = parser.parseExpression();
        parser.skipBlanks();
        if (!parser.atEnd()) {
            throw parser.error("unexpected '" + parser.peek() + "'");
        }
        return new BufferExpression(text, root, parser.fields);
    }

    public String text() {
        return text;
    }

    public Set<String> referencedFields() {
        return fields;
    }

    /**
     * Renders the expression, letting the caller decide how a field reference is written
     * (quoting, table alias, casts). Number literals always carry a decimal point.
     */
    public String render(@NotNull UnaryOperator<String> fieldRenderer) {
        return root.render(fieldRenderer);
    }

    /**
     * Evaluates against one feature's attributes. Empty when a referenced attribute is null.
     *
     * @throws InvalidBufferExpressionException if a field is missing, not numeric, or the
     *                                          result is not a finite number
     */
    public OptionalDouble evaluate(@NotNull Map<String, ?> attributes) {
        Double value = root.evaluate(attributes, this);
        if (value == null) {
            return OptionalDouble.empty();
        }
        if (!Double.isFinite(value)) {
            throw new InvalidBufferExpressionException(text, 0, "evaluates to " + value);
        }
        return OptionalDouble.of(value);
    }

    @Override
    public String toString() {
        return text;
    }

    private interface Node {
        String render(UnaryOperator<String> fieldRenderer);

        Double evaluate(Map<String, ?> attributes, BufferExpression owner);
    }

    private record NumberNode(BigDecimal value) implements Node {
        // Always a decimal literal, so SQL never divides two integers.
        @Override
        public String render(UnaryOperator<String> fieldRenderer) {
            String plain = value.toPlainString();
            return plain.indexOf('.') < 0 ? plain + ".0" : plain;
        }

        @Override
        public Double evaluate(Map<String, ?> attributes, BufferExpression owner) {
            return value.doubleValue();
        }
    }

    private record FieldNode(String name) implements Node {
        @Override
        public String render(UnaryOperator<String> fieldRenderer) {
            return fieldRenderer.apply(name);
        }

        @Override
        public Double evaluate(Map<String, ?> attributes, BufferExpression owner) {
            if (!attributes.containsKey(name)) {
                throw new InvalidBufferExpressionException(owner.text, 0, "unknown field '" + name + "'");
            }

            Object value = attributes.get(name);
            if (value == null) {
                return null;
            }
            if (value instanceof Number number) {
                return number.doubleValue();
            }

            try {
                return Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new InvalidBufferExpressionException(owner.text, 0, "field '" + name + "' is not numeric: " + value);
            }
        }
    }

    private record NegateNode(Node operand) implements Node {
        @Override
        public String render(UnaryOperator<String> fieldRenderer) {
            return "-(" + operand.render(fieldRenderer) + ")";
        }

        @Override
        public Double evaluate(Map<String, ?> attributes, BufferExpression owner) {
            Double value = operand.evaluate(attributes, owner);
            return value == null ? null : -value;
        }
    }

    private record BinaryNode(char operator, Node left, Node right) implements Node {
        @Override
        public String render(UnaryOperator<String> fieldRenderer) {
            return "(" + left.render(fieldRenderer) + " " + operator + " " + right.render(fieldRenderer) + ")";
        }

        @Override
        public Double evaluate(Map<String, ?> attributes, BufferExpression owner) {
            Double l = left.evaluate(attributes, owner);
            Double r = right.evaluate(attributes, owner);
            if (l == null || r == null) {
                return null;
            }

            return switch (operator) {
                case '+' -> l + r;
                case '-' -> l - r;
                case '*' -> l * r;
                case '/' -> {
                    if (r == 0.0) {
                        throw new InvalidBufferExpressionException(owner.text, 0, "division by zero");
                    }
                    yield l / r;
                }
                default -> throw new IllegalStateException("Unknown operator: " + operator);
            };
        }
    }

    private static final class Parser {
        private final String text;
        private final Set<String> fields = new LinkedHashSet<>();
        private int position;

        Parser(String text) {
            this.text = text;
        }

        Node parseExpression() {
            Node node = parseTerm();
            while (true) {
                skipBlanks();
                if (consume('+')) {
                    node = new BinaryNode('+', node, parseTerm());
                } else if (consume('-')) {
                    node = new BinaryNode('-', node, parseTerm());
                } else {
                    return node;
                }
            }
        }

        private Node parseTerm() {
            Node node = parseUnary();
            while (true) {
                skipBlanks();
                if (consume('*')) {
                    node = new BinaryNode('*', node, parseUnary());
                } else if (consume('/')) {
                    node = new BinaryNode('/', node, parseUnary());
                } else {
                    return node;
                }
            }
        }

        private Node parseUnary() {
            skipBlanks();
            if (consume('-')) {
                return new NegateNode(parseUnary());
            }
            if (consume('+')) {
                return parseUnary();
            }
            return parsePrimary();
        }

        private Node parsePrimary() {
            skipBlanks();
            if (atEnd()) {
                throw error("unexpected end of expression");
            }

            char c = peek();
            if (c == '(') {
                position++;
                Node inner = parseExpression();
                skipBlanks();
                if (!consume(')')) {
                    throw error("missing ')'");
                }
                return inner;
            }
            if (c == '"') {
                return field(parseQuoted());
            }
            if (Character.isDigit(c) || c == '.') {
                return parseNumber();
            }
            if (Character.isLetter(c) || c == '_') {
                int start = position;
                while (!atEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
                    position++;
                }
                return field(text.substring(start, position));
            }

            throw error("unexpected '" + c + "'");
        }

        private Node field(String name) {
            fields.add(name);
            return new FieldNode(name);
        }

        private String parseQuoted() {
            int start = position++;
            StringBuilder name = new StringBuilder();
            while (!atEnd()) {
                char c = text.charAt(position++);
                if (c == '"') {
                    if (!atEnd() && peek() == '"') {
                        name.append('"');
                        position++;
                        continue;
                    }
                    if (name.length() == 0) {
                        position = start;
                        throw error("empty field name");
                    }
                    return name.toString();
                }
                name.append(c);
            }
            position = start;
            throw error("unterminated quoted field");
        }

        private Node parseNumber() {
            int start = position;
            while (!atEnd() && (Character.isDigit(peek()) || peek() == '.')) {
                position++;
            }
            if (!atEnd() && (peek() == 'e' || peek() == 'E')) {
                position++;
                if (!atEnd() && (peek() == '+' || peek() == '-')) {
                    position++;
                }
                while (!atEnd() && Character.isDigit(peek())) {
                    position++;
                }
            }

            String literal = text.substring(start, position);
            try {
                return new NumberNode(new BigDecimal(literal));
            } catch (NumberFormatException e) {
                position = start;
                throw error("malformed number '" + literal + "'");
            }
        }

        void skipBlanks() {
            while (!atEnd() && Character.isWhitespace(peek())) {
                position++;
            }
        }

        boolean atEnd() {
            return position >= text.length();
        }

        char peek() {
            return text.charAt(position);
        }

        private boolean consume(char expected) {
            if (!atEnd() && peek() == expected) {
                position++;
                return true;
            }
            return false;
        }

        InvalidBufferExpressionException error(String reason) {
            return new InvalidBufferExpressionException(text, position, reason);
        }
    }
}
