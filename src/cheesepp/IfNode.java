package cheesepp;

import java.util.List;

public class IfNode extends Node {
    private final Node condition;
    private final List<Node> thenStatements;
    private final List<Node> elseStatements;

    public IfNode(Node condition, List<Node> thenStatements, List<Node> elseStatements, Position position) {
        super(NodeKind.IF, position);
        this.condition = condition;
        this.thenStatements = List.copyOf(thenStatements);
        this.elseStatements = List.copyOf(elseStatements);
    }

    public Node getCondition() { return condition; }
    public List<Node> getThenStatements() { return thenStatements; }
    public List<Node> getElseStatements() { return elseStatements; }

    @Override
    public String toString() {
        return "If(" + condition + ", " + thenStatements + ", " + elseStatements + ")";
    }
}
