package cheesepp;

import org.antlr.v4.runtime.*;

/**
 * Entry points of the core: source text to AST, and source text to output.
 * The generated grammar is shared; each call builds its own lexer and parser.
 */
public final class CheeseCompiler {
    private CheeseCompiler() {
    }

    /**
     * Parses a whole program. Never returns a partial tree.
     *
     * @throws CheeseException with kind LEXICAL or SYNTAX
     */
    public static ProgramNode parse(String source) {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        CharStream input = CharStreams.fromString(source);

        // lexical analysis
        CheeseLexer lexer = new CheeseLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(new CheeseErrorListener(ErrorKind.LEXICAL, source));
        CommonTokenStream tokens = new CommonTokenStream(lexer);

        // syntax analysis
        CheeseParser parser = new CheeseParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(new CheeseErrorListener(ErrorKind.SYNTAX, source));
        CheeseParser.ProgramContext tree = parser.program();

        return new AstBuilder(source).build(tree);
    }

    /** Parses and runs in a fresh interpreter, returning the program's output. */
    public static String compileAndRun(String source) {
        return compileAndRun(source, false);
    }

    public static String compileAndRun(String source, boolean debug) {
        ProgramNode program = parse(source);
        Interpreter interpreter = new Interpreter();
        interpreter.setDebugMode(debug);
        return interpreter.run(program, source);
    }
}
