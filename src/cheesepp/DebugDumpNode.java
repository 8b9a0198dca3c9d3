package cheesepp;

/** The "Belgian" statement: dumps the program's own source to the output. */
public class DebugDumpNode extends Node {
    public DebugDumpNode(Position position) {
        super(NodeKind.DEBUG_DUMP, position);
    }

    @Override
    public String toString() {
        return "Belgian()";
    }
}
