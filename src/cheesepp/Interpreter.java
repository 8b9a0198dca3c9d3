package cheesepp;

import java.util.List;
import java.util.Map;

/**
 * Tree-walking evaluator. One instance owns one {@link ExecutionContext}; bindings
 * survive across {@link #run} calls, the output buffer does not.
 *
 * <p>Branches and loop bodies run in the scope of the enclosing statement: no
 * statement opens a scope of its own.
 */
public class Interpreter {
    private final ExecutionContext context;
    private final ErrorReporter reporter;

    public Interpreter() {
        this(new ErrorReporter());
    }

    public Interpreter(ErrorReporter reporter) {
        this.context = new ExecutionContext();
        this.reporter = reporter;
    }

    public void setDebugMode(boolean debugMode) {
        context.setDebugMode(debugMode);
    }

    /**
     * Runs a program and returns everything it printed, one line per print.
     * On failure the error is recorded and rethrown; the lines printed before it
     * remain available from {@link #getOutput()}.
     */
    public String run(ProgramNode program, String source) {
        context.setSourceCode(source);
        context.clearOutput();
        try {
            executeAll(program.getStatements());
        } catch (CheeseException e) {
            reporter.reportError(e);
            throw e;
        }
        return context.getOutput();
    }

    public String run(ProgramNode program) {
        return run(program, null);
    }

    public String getOutput() {
        return context.getOutput();
    }

    public List<String> getOutputLines() {
        return context.getOutputLines();
    }

    public Map<String, Value> getEnvironment() {
        return context.getEnvironment();
    }

    public List<CheeseException> getErrors() {
        return reporter.getErrors();
    }

    public ErrorReporter getReporter() {
        return reporter;
    }

    public ExecutionContext getContext() {
        return context;
    }

    public Map<ExecutionContext.Statistic, Integer> getStatistics() {
        return context.getStatistics();
    }

    public void reset() {
        context.reset();
        reporter.clear();
    }

    // --- statements ---

    private void executeAll(List<Node> statements) {
        for (Node statement : statements) {
            execute(statement);
        }
    }

    private void execute(Node node) {
        if (context.isDebugMode()) {
            System.err.println("Debug: executing " + node.getKind() + " at line " + node.getLine());
        }
        switch (node.getKind()) {
            case ASSIGN:
                executeAssign((AssignNode) node);
                break;
            case PRINT:
                Value printed = evaluate(((PrintNode) node).getExpr());
                context.addOutput(printed.format());
                break;
            case IF:
                executeIf((IfNode) node);
                break;
            case LOOP:
                executeLoop((LoopNode) node);
                break;
            case DEBUG_DUMP:
                context.executeBelgian();
                break;
            default:
                throw CheeseException.semantic("Error: " + node.getKind() + " is not a statement",
                        node.getLine(), node.getColumn(), contextOf(node), null);
        }
        context.increment(ExecutionContext.Statistic.STATEMENTS_EXECUTED);
    }

    private void executeAssign(AssignNode node) {
        Value value = evaluate(node.getExpr());
        SymbolTable symbols = context.getSymbolTable();
        if (symbols.update(node.getName(), value)) {
            return;
        }
        if (!context.declareVariable(node.getName(), value, node.getLine())) {
            throw CheeseException.semantic(Diagnostic.REDEFINED_VARIABLE.format(node.getName()),
                    node.getLine(), node.getColumn(), contextOf(node), null);
        }
    }

    private void executeIf(IfNode node) {
        if (evaluate(node.getCondition()).isTruthy()) {
            executeAll(node.getThenStatements());
        } else {
            executeAll(node.getElseStatements());
        }
    }

    private void executeLoop(LoopNode node) {
        do {
            executeAll(node.getBody());
        } while (evaluate(node.getCondition()).isTruthy());
    }

    // --- expressions ---

    private Value evaluate(Node node) {
        context.increment(ExecutionContext.Statistic.EXPRESSIONS_EVALUATED);
        switch (node.getKind()) {
            case NUMBER:
                return Value.number(((NumberNode) node).getValue());
            case STRING:
                return Value.string(((StringNode) node).getValue());
            case VAR_REF:
                return lookupVariable((VarRefNode) node);
            case BIN_OP:
                return evaluateBinary((BinOpNode) node);
            default:
                throw CheeseException.semantic("Error: " + node.getKind() + " is not an expression",
                        node.getLine(), node.getColumn(), contextOf(node), null);
        }
    }

    private Value lookupVariable(VarRefNode node) {
        Symbol symbol = context.getSymbolTable().lookup(node.getName());
        if (symbol == null) {
            throw CheeseException.runtime(Diagnostic.UNDEFINED_VARIABLE.format(node.getName()),
                    node.getLine(), node.getColumn(), contextOf(node),
                    Diagnostic.UNDEFINED_VARIABLE.getSuggestions());
        }
        return symbol.getValue();
    }

    private Value evaluateBinary(BinOpNode node) {
        Value lhs = evaluate(node.getLeft());
        Value rhs = evaluate(node.getRight());
        BinaryOperator op = node.getOp();

        switch (op) {
            case ADD:
                if (lhs.isString() && rhs.isString()) {
                    return Value.string(lhs.asString() + rhs.asString());
                }
                requireNumbers(node, lhs, rhs);
                return Value.number(lhs.asNumber() + rhs.asNumber());
            case SUB:
                requireNumbers(node, lhs, rhs);
                return Value.number(lhs.asNumber() - rhs.asNumber());
            case MUL:
                requireNumbers(node, lhs, rhs);
                return Value.number(lhs.asNumber() * rhs.asNumber());
            case DIV:
                requireNumbers(node, lhs, rhs);
                if (rhs.asNumber() == 0) {
                    throw CheeseException.runtime(Diagnostic.DIVISION_BY_ZERO.format(),
                            node.getLine(), node.getColumn(), contextOf(node), null);
                }
                return Value.number(lhs.asNumber() / rhs.asNumber());
            case EQ:
                return Value.bool(lhs.equals(rhs));
            case NE:
                return Value.bool(!lhs.equals(rhs));
            case GT:
                return Value.bool(compare(node, lhs, rhs) > 0);
            case LT:
                return Value.bool(compare(node, lhs, rhs) < 0);
            case GE:
                return Value.bool(compare(node, lhs, rhs) >= 0);
            case LE:
                return Value.bool(compare(node, lhs, rhs) <= 0);
            default:
                throw CheeseException.semantic("Error: unknown operator " + op,
                        node.getLine(), node.getColumn(), contextOf(node), null);
        }
    }

    private int compare(BinOpNode node, Value lhs, Value rhs) {
        if (lhs.isNumber() && rhs.isNumber()) {
            double a = lhs.asNumber();
            double b = rhs.asNumber();
            return a < b ? -1 : (a > b ? 1 : 0);
        }
        if (lhs.isString() && rhs.isString()) {
            return lhs.asString().compareTo(rhs.asString());
        }
        throw invalidOperation(node, lhs, rhs);
    }

    private void requireNumbers(BinOpNode node, Value lhs, Value rhs) {
        if (!lhs.isNumber() || !rhs.isNumber()) {
            throw invalidOperation(node, lhs, rhs);
        }
    }

    private CheeseException invalidOperation(BinOpNode node, Value lhs, Value rhs) {
        String message = Diagnostic.INVALID_OPERATION.format(node.getOp().getKeyword(),
                lhs.getKind().getLabel(), rhs.getKind().getLabel());
        return CheeseException.type(message, node.getLine(), node.getColumn(), contextOf(node), null);
    }

    private String contextOf(Node node) {
        return SourceText.lineAt(context.getSourceCode(), node.getLine());
    }
}
