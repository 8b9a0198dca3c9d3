package cheesepp;

public class AssignNode extends Node {
    private final String name;
    private final Node expr;

    public AssignNode(String name, Node expr, Position position) {
        super(NodeKind.ASSIGN, position);
        this.name = name;
        this.expr = expr;
    }

    public String getName() { return name; }
    public Node getExpr() { return expr; }

    @Override
    public String toString() {
        return "Assign(" + name + ", " + expr + ")";
    }
}
