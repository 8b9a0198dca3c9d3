package cheesepp;

public class StringNode extends Node {
    private final String value;

    public StringNode(String value, Position position) {
        super(NodeKind.STRING, position);
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "String(" + value + ")";
    }
}
