package cheesepp;

/**
 * Runtime value: either a number (IEEE double) or a string.
 */
public final class Value {
    public enum ValueKind {
        NUMBER("number"),
        STRING("string");

        private final String label;

        ValueKind(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    // integral doubles below this magnitude print without a fraction
    private static final double PLAIN_INTEGER_LIMIT = 1e15;

    public static final Value TRUE = number(1);
    public static final Value FALSE = number(0);

    private final ValueKind kind;
    private final double number;
    private final String string;

    private Value(ValueKind kind, double number, String string) {
        this.kind = kind;
        this.number = number;
        this.string = string;
    }

    public static Value number(double value) {
        return new Value(ValueKind.NUMBER, value, null);
    }

    public static Value string(String value) {
        if (value == null) {
            throw new IllegalArgumentException("string value must not be null");
        }
        return new Value(ValueKind.STRING, 0, value);
    }

    public static Value bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public ValueKind getKind() { return kind; }
    public boolean isNumber() { return kind == ValueKind.NUMBER; }
    public boolean isString() { return kind == ValueKind.STRING; }

    public double asNumber() {
        if (kind != ValueKind.NUMBER) {
            throw new IllegalStateException("not a number: " + this);
        }
        return number;
    }

    public String asString() {
        if (kind != ValueKind.STRING) {
            throw new IllegalStateException("not a string: " + this);
        }
        return string;
    }

    /** Non-zero numbers and non-empty strings are true. */
    public boolean isTruthy() {
        return kind == ValueKind.NUMBER ? number != 0 : !string.isEmpty();
    }

    /** Text written by a print statement. */
    public String format() {
        if (kind == ValueKind.STRING) {
            return string;
        }
        if (number == Math.rint(number) && Math.abs(number) < PLAIN_INTEGER_LIMIT) {
            return Long.toString((long) number);
        }
        return Double.toString(number);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (kind != other.kind) return false;
        return kind == ValueKind.NUMBER ? number == other.number : string.equals(other.string);
    }

    @Override
    public int hashCode() {
        return kind == ValueKind.NUMBER ? Double.hashCode(number == 0 ? 0 : number) : string.hashCode();
    }

    @Override
    public String toString() {
        return kind == ValueKind.STRING ? "\"" + string + "\"" : format();
    }
}
