package cheesepp;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AstBuilderTest {

    @Test
    void parsesPrintOfSwissString() {
        ProgramNode program = CheeseCompiler.parse(
                "Cheese\n"
                + "   Wensleydale(SwissHello WorldSwiss) Brie\n"
                + "NoCheese");

        assertEquals(1, program.getStatements().size());
        PrintNode print = (PrintNode) program.getStatements().get(0);
        assertEquals(Node.NodeKind.STRING, print.getExpr().getKind());
        assertEquals("Hello World", ((StringNode) print.getExpr()).getValue());
        assertEquals(new Position(2, 4), print.getPosition());
    }

    @Test
    void stringKeepsKeywordsBetweenMarkers() {
        ProgramNode program = CheeseCompiler.parse("Cheese Wensleydale(SwissCheese plus BrieSwiss) Brie NoCheese");
        PrintNode print = (PrintNode) program.getStatements().get(0);
        assertEquals("Cheese plus Brie", ((StringNode) print.getExpr()).getValue());
    }

    @Test
    void assignmentAcceptsBothTerminators() {
        ProgramNode program = CheeseCompiler.parse("Cheese Glyn(x) = 42; Glyn(y) = 1.5 Brie NoCheese");

        AssignNode first = (AssignNode) program.getStatements().get(0);
        assertEquals("x", first.getName());
        assertEquals(42.0, ((NumberNode) first.getExpr()).getValue());

        AssignNode second = (AssignNode) program.getStatements().get(1);
        assertEquals("y", second.getName());
        assertEquals(1.5, ((NumberNode) second.getExpr()).getValue());
    }

    @Test
    void multiplicationBindsTighterThanAddition() {
        ProgramNode program = CheeseCompiler.parse("Cheese Glyn(r) = 1 plus 2 times 3; NoCheese");
        BinOpNode add = (BinOpNode) ((AssignNode) program.getStatements().get(0)).getExpr();

        assertEquals(BinaryOperator.ADD, add.getOp());
        assertEquals(Node.NodeKind.NUMBER, add.getLeft().getKind());
        BinOpNode mul = (BinOpNode) add.getRight();
        assertEquals(BinaryOperator.MUL, mul.getOp());
    }

    @Test
    void comparisonBindsLooserThanArithmetic() {
        ProgramNode program = CheeseCompiler.parse("Cheese Glyn(r) = a plus 1 atleast Glyn(b) over 2; NoCheese");
        BinOpNode ge = (BinOpNode) ((AssignNode) program.getStatements().get(0)).getExpr();

        assertEquals(BinaryOperator.GE, ge.getOp());
        assertEquals(BinaryOperator.ADD, ((BinOpNode) ge.getLeft()).getOp());
        assertEquals(BinaryOperator.DIV, ((BinOpNode) ge.getRight()).getOp());
    }

    @Test
    void everyOperatorKeywordMapsToItsTag() {
        for (BinaryOperator op : BinaryOperator.values()) {
            ProgramNode program = CheeseCompiler.parse("Cheese Glyn(r) = 1 " + op.getKeyword() + " 2; NoCheese");
            BinOpNode node = (BinOpNode) ((AssignNode) program.getStatements().get(0)).getExpr();
            assertEquals(op, node.getOp(), op.getKeyword());
        }
    }

    @Test
    void glynWrapperAndBareNameAreTheSameReference() {
        ProgramNode program = CheeseCompiler.parse("Cheese Glyn(r) = Glyn(a) minus a; NoCheese");
        BinOpNode sub = (BinOpNode) ((AssignNode) program.getStatements().get(0)).getExpr();
        assertEquals("a", ((VarRefNode) sub.getLeft()).getName());
        assertEquals("a", ((VarRefNode) sub.getRight()).getName());
    }

    @Test
    void conditionalSplitsThenAndElseStatements() {
        ProgramNode program = CheeseCompiler.parse(
                "Cheese\n"
                + "Stilton Glyn(x) greater 5 Blue\n"
                + "    Wensleydale(SwissbigSwiss) Brie\n"
                + "    Glyn(y) = 1;\n"
                + "White\n"
                + "    Wensleydale(SwisssmallSwiss) Brie\n"
                + "NoCheese");

        IfNode ifNode = (IfNode) program.getStatements().get(0);
        assertEquals(BinaryOperator.GT, ((BinOpNode) ifNode.getCondition()).getOp());
        assertEquals(2, ifNode.getThenStatements().size());
        assertEquals(1, ifNode.getElseStatements().size());
        assertEquals(Node.NodeKind.PRINT, ifNode.getThenStatements().get(0).getKind());
        assertEquals(Node.NodeKind.ASSIGN, ifNode.getThenStatements().get(1).getKind());
    }

    @Test
    void emptyBranchesAreAllowed() {
        ProgramNode program = CheeseCompiler.parse("Cheese Stilton 1 Blue White NoCheese");
        IfNode ifNode = (IfNode) program.getStatements().get(0);
        assertTrue(ifNode.getThenStatements().isEmpty());
        assertTrue(ifNode.getElseStatements().isEmpty());
    }

    @Test
    void elseBranchRunsToEndOfEnclosingList() {
        ProgramNode program = CheeseCompiler.parse(
                "Cheese Stilton 1 Blue White Wensleydale(1) Brie Wensleydale(2) Brie NoCheese");
        assertEquals(1, program.getStatements().size());
        IfNode ifNode = (IfNode) program.getStatements().get(0);
        assertEquals(2, ifNode.getElseStatements().size());
    }

    @Test
    void userStringsCannotCollideWithBranchSplitting() {
        ProgramNode program = CheeseCompiler.parse(
                "Cheese Stilton 1 Blue Wensleydale(SwissWHITE_MARKERSwiss) Brie White NoCheese");
        IfNode ifNode = (IfNode) program.getStatements().get(0);
        assertEquals(1, ifNode.getThenStatements().size());
        assertTrue(ifNode.getElseStatements().isEmpty());
    }

    @Test
    void loopBodyPrecedesTrailingCondition() {
        ProgramNode program = CheeseCompiler.parse(
                "Cheese\n"
                + "Cheddar\n"
                + "    Wensleydale(Glyn(i)) Brie\n"
                + "    Glyn(i) = i plus 1;\n"
                + "Coleraine i minor 3\n"
                + "NoCheese");

        LoopNode loop = (LoopNode) program.getStatements().get(0);
        List<Node> body = loop.getBody();
        assertEquals(2, body.size());
        assertEquals(Node.NodeKind.PRINT, body.get(0).getKind());
        assertEquals(BinaryOperator.LT, ((BinOpNode) loop.getCondition()).getOp());
    }

    @Test
    void belgianStatement() {
        ProgramNode program = CheeseCompiler.parse("Cheese Belgian Brie NoCheese");
        assertEquals(Node.NodeKind.DEBUG_DUMP, program.getStatements().get(0).getKind());
    }

    @Test
    void emptyProgram() {
        assertTrue(CheeseCompiler.parse("Cheese NoCheese").getStatements().isEmpty());
    }

    @Test
    void unknownCharacterIsLexicalError() {
        CheeseException e = assertThrows(CheeseException.class,
                () -> CheeseCompiler.parse("Cheese\nWensleydale(1) @ Brie\nNoCheese"));
        assertEquals(ErrorKind.LEXICAL, e.getKind());
        assertEquals(2, e.getInfo().getLine());
        assertEquals(16, e.getInfo().getColumn());
        assertEquals("Wensleydale(1) @ Brie", e.getInfo().getContext());
    }

    @Test
    void incompleteAssignmentIsSyntaxError() {
        CheeseException e = assertThrows(CheeseException.class,
                () -> CheeseCompiler.parse("Cheese\n   Glyn(x) = \n   NoCheese"));
        assertEquals(ErrorKind.SYNTAX, e.getKind());
        assertEquals(3, e.getInfo().getLine());
        assertTrue(e.getMessage().startsWith("SYNTAX ERROR: Invalid syntax near 'NoCheese'"), e.getMessage());
    }

    @Test
    void missingStartKeywordSuggestsAddingIt() {
        CheeseException e = assertThrows(CheeseException.class,
                () -> CheeseCompiler.parse("Wensleydale(1) Brie NoCheese"));
        assertEquals(ErrorKind.SYNTAX, e.getKind());
        assertTrue(e.getInfo().getSuggestions().contains("Add 'Cheese' at the beginning of your program"));
    }

    @Test
    void missingTerminatorSuggestsBrie() {
        CheeseException e = assertThrows(CheeseException.class,
                () -> CheeseCompiler.parse("Cheese Wensleydale(1) NoCheese"));
        assertEquals(ErrorKind.SYNTAX, e.getKind());
        assertTrue(e.getInfo().getSuggestions().contains("Add 'Brie' at the end of the statement"));
    }

    @Test
    void conditionalWithoutWhiteIsSyntaxError() {
        CheeseException e = assertThrows(CheeseException.class,
                () -> CheeseCompiler.parse("Cheese Stilton 1 Blue Wensleydale(1) Brie NoCheese"));
        assertEquals(ErrorKind.SYNTAX, e.getKind());
    }

    @Test
    void swissDelimitersAreStrippedExactly() {
        assertEquals("abc", AstBuilder.stripDelimiters("SwissabcSwiss", null, null));
        assertEquals("", AstBuilder.stripDelimiters("SwissSwiss", null, null));
        assertEquals(" Swiss ", AstBuilder.stripDelimiters("Swiss Swiss Swiss", null, null));
    }

    @Test
    void tooShortSwissLiteralIsRejected() {
        CheeseException e = assertThrows(CheeseException.class,
                () -> AstBuilder.stripDelimiters("Swiss", new Position(4, 2), null));
        assertEquals(ErrorKind.SYNTAX, e.getKind());
        assertEquals(4, e.getInfo().getLine());
        assertTrue(e.getInfo().getMessage().startsWith("Invalid Swiss string format"));
        assertEquals(Diagnostic.INVALID_SWISS.getSuggestions(), e.getInfo().getSuggestions());
    }
}
