package cheesepp;

public class VarRefNode extends Node {
    private final String name;

    public VarRefNode(String name, Position position) {
        super(NodeKind.VAR_REF, position);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "Var(" + name + ")";
    }
}
