package cheesepp;

import java.util.List;

/** Post-test loop: the body always runs once before the condition is checked. */
public class LoopNode extends Node {
    private final List<Node> body;
    private final Node condition;

    public LoopNode(List<Node> body, Node condition, Position position) {
        super(NodeKind.LOOP, position);
        this.body = List.copyOf(body);
        this.condition = condition;
    }

    public List<Node> getBody() { return body; }
    public Node getCondition() { return condition; }

    @Override
    public String toString() {
        return "Loop(" + body + ", " + condition + ")";
    }
}
