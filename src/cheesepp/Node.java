package cheesepp;

/**
 * Base of the closed AST node set. The interpreter dispatches on {@link #getKind()};
 * every concrete node is immutable and owns its children exclusively.
 */
public abstract class Node {
    public enum NodeKind {
        PROGRAM,
        ASSIGN,
        PRINT,
        IF,
        LOOP,
        BIN_OP,
        NUMBER,
        STRING,
        VAR_REF,
        DEBUG_DUMP
    }

    protected final NodeKind kind;
    protected final Position position;

    protected Node(NodeKind kind, Position position) {
        this.kind = kind;
        this.position = position;
    }

    public NodeKind getKind() {
        return kind;
    }

    /** May be null for nodes built outside the parser. */
    public Position getPosition() {
        return position;
    }

    public Integer getLine() {
        return position != null ? position.line : null;
    }

    public Integer getColumn() {
        return position != null ? position.column : null;
    }
}
