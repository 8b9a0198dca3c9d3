package cheesepp;

public class PrintNode extends Node {
    private final Node expr;

    public PrintNode(Node expr, Position position) {
        super(NodeKind.PRINT, position);
        this.expr = expr;
    }

    public Node getExpr() {
        return expr;
    }

    @Override
    public String toString() {
        return "Print(" + expr + ")";
    }
}
