package cheesepp;

public class NumberNode extends Node {
    private final double value;

    public NumberNode(double value, Position position) {
        super(NodeKind.NUMBER, position);
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "Number(" + value + ")";
    }
}
