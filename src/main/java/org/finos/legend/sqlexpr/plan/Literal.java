package org.finos.legend.sqlexpr.plan;

import java.util.List;
import java.util.Objects;

/**
 * Represents a literal value in an expression tree.
 *
 * @param value       The literal value
 * @param literalType The type of the literal
 */
public record Literal(
        Object value,
        LiteralType literalType) implements Expression {

    public enum LiteralType {
        BOOLEAN("bool"),
        INTEGER("int"),
        DOUBLE("double"),
        STRING("string");

        private final String renderName;

        LiteralType(String renderName) {
            this.renderName = renderName;
        }

        public String renderName() {
            return renderName;
        }
    }

    public Literal {
        Objects.requireNonNull(value, "Literal value cannot be null");
        Objects.requireNonNull(literalType, "Literal type cannot be null");

        // Validate type matches value
        switch (literalType) {
            case BOOLEAN -> {
                if (!(value instanceof Boolean)) {
                    throw new IllegalArgumentException("BOOLEAN literal must have Boolean value");
                }
            }
            case INTEGER -> {
                if (!(value instanceof Long)) {
                    throw new IllegalArgumentException("INTEGER literal must have Long value");
                }
            }
            case DOUBLE -> {
                if (!(value instanceof Double)) {
                    throw new IllegalArgumentException("DOUBLE literal must have Double value");
                }
            }
            case STRING -> {
                if (!(value instanceof String)) {
                    throw new IllegalArgumentException("STRING literal must have String value");
                }
            }
        }
    }

    public static Literal bool(boolean value) {
        return new Literal(value, LiteralType.BOOLEAN);
    }

    public static Literal integer(long value) {
        return new Literal(value, LiteralType.INTEGER);
    }

    public static Literal decimal(double value) {
        return new Literal(value, LiteralType.DOUBLE);
    }

    public static Literal string(String value) {
        return new Literal(value, LiteralType.STRING);
    }

    /**
     * Creates a string literal from its source text, e.g. {@code 'abc'}.
     * Exactly one leading and one trailing delimiter character are removed.
     */
    public static Literal quoted(String source) {
        Objects.requireNonNull(source, "Literal source cannot be null");
        if (source.length() < 2) {
            throw new IllegalArgumentException("Quoted literal must include both delimiters: " + source);
        }
        return string(source.substring(1, source.length() - 1));
    }

    @Override
    public List<Expression> children() {
        return List.of();
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        return render();
    }
}
