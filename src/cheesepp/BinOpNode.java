package cheesepp;

public class BinOpNode extends Node {
    private final Node left;
    private final BinaryOperator op;
    private final Node right;

    public BinOpNode(Node left, BinaryOperator op, Node right, Position position) {
        super(NodeKind.BIN_OP, position);
        this.left = left;
        this.op = op;
        this.right = right;
    }

    public Node getLeft() { return left; }
    public BinaryOperator getOp() { return op; }
    public Node getRight() { return right; }

    @Override
    public String toString() {
        return "BinOp(" + left + " " + op.getSymbol() + " " + right + ")";
    }
}
