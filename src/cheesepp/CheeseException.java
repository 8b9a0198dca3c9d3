package cheesepp;

import java.util.List;

/**
 * The single exception type raised by every phase. Callers branch on
 * {@link #getKind()} rather than on subclasses.
 */
public class CheeseException extends RuntimeException {
    private final ErrorInfo info;

    public CheeseException(ErrorInfo info) {
        super(info.toString());
        this.info = info;
    }

    public CheeseException(ErrorInfo info, Throwable cause) {
        super(info.toString(), cause);
        this.info = info;
    }

    public ErrorInfo getInfo() {
        return info;
    }

    public ErrorKind getKind() {
        return info.getKind();
    }

    public static CheeseException lexical(String message, Integer line, Integer column, String context) {
        return new CheeseException(new ErrorInfo(ErrorKind.LEXICAL, message, line, column, context, null));
    }

    public static CheeseException syntax(String message, Integer line, Integer column,
                                         String context, List<String> suggestions) {
        return new CheeseException(new ErrorInfo(ErrorKind.SYNTAX, message, line, column, context, suggestions));
    }

    public static CheeseException semantic(String message, Integer line, Integer column,
                                           String context, List<String> suggestions) {
        return new CheeseException(new ErrorInfo(ErrorKind.SEMANTIC, message, line, column, context, suggestions));
    }

    public static CheeseException runtime(String message, Integer line, Integer column,
                                          String context, List<String> suggestions) {
        return new CheeseException(new ErrorInfo(ErrorKind.RUNTIME, message, line, column, context, suggestions));
    }

    public static CheeseException type(String message, Integer line, Integer column,
                                       String context, List<String> suggestions) {
        return new CheeseException(new ErrorInfo(ErrorKind.TYPE, message, line, column, context, suggestions));
    }
}
