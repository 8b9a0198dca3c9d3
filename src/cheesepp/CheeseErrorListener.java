package cheesepp;

import org.antlr.v4.runtime.*;
import org.antlr.v4.runtime.misc.IntervalSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns ANTLR error reports into {@link CheeseException}s. Attached to the lexer it
 * raises lexical errors, attached to the parser syntax errors; either way the first
 * report aborts the parse.
 */
public class CheeseErrorListener extends BaseErrorListener {
    private final ErrorKind kind;
    private final String source;

    public CheeseErrorListener(ErrorKind kind, String source) {
        this.kind = kind;
        this.source = source;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg,
                            RecognitionException e) {
        String context = SourceText.lineAt(source, line);
        int column = charPositionInLine + 1;

        if (kind == ErrorKind.LEXICAL) {
            throw CheeseException.lexical(msg, line, column, context);
        }

        String tokenText = (offendingSymbol instanceof Token) ? ((Token) offendingSymbol).getText() : "";
        String message = Diagnostic.INVALID_SYNTAX.format(tokenText) + ": " + msg;
        throw CheeseException.syntax(message, line, column, context, suggestionsFor(recognizer));
    }

    private static List<String> suggestionsFor(Recognizer<?, ?> recognizer) {
        List<String> suggestions = new ArrayList<>();
        if (!(recognizer instanceof Parser)) {
            return suggestions;
        }
        IntervalSet expected = ((Parser) recognizer).getExpectedTokens();
        if (expected.contains(CheeseParser.CHEESE)) {
            suggestions.addAll(Diagnostic.MISSING_CHEESE.getSuggestions());
        }
        if (expected.contains(CheeseParser.NOCHEESE)) {
            suggestions.addAll(Diagnostic.MISSING_NOCHEESE.getSuggestions());
        }
        if (expected.contains(CheeseParser.BRIE)) {
            suggestions.addAll(Diagnostic.MISSING_BRIE.getSuggestions());
        }
        return suggestions;
    }
}
