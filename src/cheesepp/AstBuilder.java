package cheesepp;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the AST from an ANTLR parse tree, one node per production.
 */
public class AstBuilder extends CheeseBaseVisitor<Node> {
    public static final String STRING_DELIMITER = "Swiss";
    public static final int DELIMITER_WIDTH = STRING_DELIMITER.length();

    private final String source;

    public AstBuilder(String source) {
        this.source = source;
    }

    public ProgramNode build(CheeseParser.ProgramContext ctx) {
        return (ProgramNode) visit(ctx);
    }

    // --- statements ---

    @Override
    public Node visitProgram(CheeseParser.ProgramContext ctx) {
        return new ProgramNode(statements(ctx.statement()), positionOf(ctx));
    }

    @Override
    public Node visitStatement(CheeseParser.StatementContext ctx) {
        if (ctx.getChildCount() != 1) {
            throw malformed("statement", ctx);
        }
        return visit(ctx.getChild(0));
    }

    @Override
    public Node visitAssignment(CheeseParser.AssignmentContext ctx) {
        if (ctx.IDENT() == null || ctx.expr() == null) {
            throw malformed("assignment", ctx);
        }
        return new AssignNode(ctx.IDENT().getText(), visit(ctx.expr()), positionOf(ctx));
    }

    @Override
    public Node visitPrintStmt(CheeseParser.PrintStmtContext ctx) {
        if (ctx.expr() == null) {
            throw malformed("print statement", ctx);
        }
        return new PrintNode(visit(ctx.expr()), positionOf(ctx));
    }

    @Override
    public Node visitBelgianStmt(CheeseParser.BelgianStmtContext ctx) {
        return new DebugDumpNode(positionOf(ctx));
    }

    @Override
    public Node visitIfStmt(CheeseParser.IfStmtContext ctx) {
        if (ctx.expr() == null || ctx.thenBlock() == null || ctx.elseBlock() == null) {
            throw malformed("Stilton statement", ctx);
        }
        Node condition = visit(ctx.expr());
        List<Node> thenStatements = statements(ctx.thenBlock().statement());
        List<Node> elseStatements = statements(ctx.elseBlock().statement());
        return new IfNode(condition, thenStatements, elseStatements, positionOf(ctx));
    }

    @Override
    public Node visitLoopStmt(CheeseParser.LoopStmtContext ctx) {
        if (ctx.expr() == null) {
            throw malformed("Cheddar loop", ctx);
        }
        List<Node> body = statements(ctx.statement());
        return new LoopNode(body, visit(ctx.expr()), positionOf(ctx));
    }

    // --- expressions ---

    @Override
    public Node visitMulExpr(CheeseParser.MulExprContext ctx) {
        return binary(ctx, ctx.expr(), ctx.op);
    }

    @Override
    public Node visitAddExpr(CheeseParser.AddExprContext ctx) {
        return binary(ctx, ctx.expr(), ctx.op);
    }

    @Override
    public Node visitRelExpr(CheeseParser.RelExprContext ctx) {
        return binary(ctx, ctx.expr(), ctx.op);
    }

    @Override
    public Node visitEqExpr(CheeseParser.EqExprContext ctx) {
        return binary(ctx, ctx.expr(), ctx.op);
    }

    @Override
    public Node visitPrimaryExpr(CheeseParser.PrimaryExprContext ctx) {
        return visit(ctx.primary());
    }

    @Override
    public Node visitNumberLit(CheeseParser.NumberLitContext ctx) {
        String text = ctx.NUMBER().getText();
        try {
            return new NumberNode(Double.parseDouble(text), positionOf(ctx));
        } catch (NumberFormatException e) {
            Position pos = positionOf(ctx);
            throw CheeseException.syntax("Invalid number literal '" + text + "'",
                    pos.line, pos.column, SourceText.lineAt(source, pos.line), null);
        }
    }

    @Override
    public Node visitStringLit(CheeseParser.StringLitContext ctx) {
        Position pos = positionOf(ctx);
        return new StringNode(stripDelimiters(ctx.STRING().getText(), pos, source), pos);
    }

    @Override
    public Node visitGlynVar(CheeseParser.GlynVarContext ctx) {
        return new VarRefNode(ctx.IDENT().getText(), positionOf(ctx));
    }

    @Override
    public Node visitVar(CheeseParser.VarContext ctx) {
        return new VarRefNode(ctx.IDENT().getText(), positionOf(ctx));
    }

    @Override
    public Node visitParenExpr(CheeseParser.ParenExprContext ctx) {
        return visit(ctx.expr());
    }

    /**
     * Removes the Swiss marker from both ends of a string lexeme.
     *
     * @throws CheeseException (SYNTAX) if the lexeme is not wrapped in the marker
     */
    static String stripDelimiters(String lexeme, Position pos, String source) {
        if (lexeme.length() < 2 * DELIMITER_WIDTH
                || !lexeme.startsWith(STRING_DELIMITER) || !lexeme.endsWith(STRING_DELIMITER)) {
            Integer line = pos != null ? pos.line : null;
            Integer column = pos != null ? pos.column : null;
            throw CheeseException.syntax(Diagnostic.INVALID_SWISS.format() + ": " + lexeme,
                    line, column, SourceText.lineAt(source, line), Diagnostic.INVALID_SWISS.getSuggestions());
        }
        return lexeme.substring(DELIMITER_WIDTH, lexeme.length() - DELIMITER_WIDTH);
    }

    // --- helpers ---

    private Node binary(ParserRuleContext ctx, List<CheeseParser.ExprContext> operands, Token op) {
        if (operands.size() != 2 || op == null) {
            throw malformed("binary expression", ctx);
        }
        BinaryOperator operator = BinaryOperator.fromKeyword(op.getText());
        if (operator == null) {
            Position pos = positionOf(ctx);
            throw CheeseException.syntax("Unknown operator '" + op.getText() + "'",
                    op.getLine(), op.getCharPositionInLine() + 1, SourceText.lineAt(source, pos.line), null);
        }
        Node left = visit(operands.get(0));
        Node right = visit(operands.get(1));
        return new BinOpNode(left, operator, right, positionOf(ctx));
    }

    private List<Node> statements(List<CheeseParser.StatementContext> contexts) {
        List<Node> result = new ArrayList<>(contexts.size());
        for (CheeseParser.StatementContext stmt : contexts) {
            Node node = visit(stmt);
            if (node == null) {
                throw malformed("statement", stmt);
            }
            result.add(node);
        }
        return result;
    }

    private CheeseException malformed(String what, ParserRuleContext ctx) {
        Position pos = positionOf(ctx);
        return CheeseException.syntax("Malformed " + what + " '" + ctx.getText() + "'",
                pos.line, pos.column, SourceText.lineAt(source, pos.line), null);
    }

    private static Position positionOf(ParserRuleContext ctx) {
        Token start = ctx.getStart();
        return new Position(start.getLine(), start.getCharPositionInLine() + 1);
    }
}
