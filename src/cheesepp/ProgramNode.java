package cheesepp;

import java.util.List;

public class ProgramNode extends Node {
    private final List<Node> statements;

    public ProgramNode(List<Node> statements, Position position) {
        super(NodeKind.PROGRAM, position);
        this.statements = List.copyOf(statements);
    }

    public List<Node> getStatements() {
        return statements;
    }

    @Override
    public String toString() {
        return "Program" + statements;
    }
}
