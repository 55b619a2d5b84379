package tools.csv2json.csv;

import java.util.Objects;

/**
 * 单个字段推断后的值，四种类型同一时刻只有一种有效。
 */
public final class Value {
    private static final Value NULL = new Value(Type.NULL, null, 0L, 0d);

    private final Type type;
    private final String text;
    private final long integer;
    private final double floating;

    private Value(Type type, String text, long integer, double floating) {
        this.type = type;
        this.text = text;
        this.integer = integer;
        this.floating = floating;
    }

    public static Value ofNull() {
        return NULL;
    }

    public static Value ofString(String text) {
        return new Value(Type.STRING, Objects.requireNonNull(text, "text"), 0L, 0d);
    }

    public static Value ofInteger(long value) {
        return new Value(Type.INTEGER, null, value, 0d);
    }

    public static Value ofFloat(double value) {
        return new Value(Type.FLOAT, null, 0L, value);
    }

    public Type getType() {
        return type;
    }

    public boolean isNull() {
        return type == Type.NULL;
    }

    public boolean isString() {
        return type == Type.STRING;
    }

    public String asString() {
        expect(Type.STRING);
        return text;
    }

    public long asLong() {
        expect(Type.INTEGER);
        return integer;
    }

    public double asDouble() {
        expect(Type.FLOAT);
        return floating;
    }

    private void expect(Type expected) {
        if (type != expected) {
            throw new IllegalStateException("value is " + type + ", not " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Value other)) {
            return false;
        }
        return type == other.type
                && integer == other.integer
                && Double.compare(floating, other.floating) == 0
                && Objects.equals(text, other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, integer, floating);
    }

    @Override
    public String toString() {
        return switch (type) {
            case NULL -> "Null";
            case STRING -> "String(" + text + ")";
            case INTEGER -> "Integer(" + integer + ")";
            case FLOAT -> "Float(" + floating + ")";
        };
    }

    public enum Type {
        NULL,
        STRING,
        INTEGER,
        FLOAT
    }
}
