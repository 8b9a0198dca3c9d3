package cheesepp;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured description of one error: kind, message and, where known,
 * position, the offending source line and a few hints for the user.
 */
public class ErrorInfo {
    private final ErrorKind kind;
    private final String message;
    private final Integer line;      // 1-based, null when unknown
    private final Integer column;    // 1-based, null when unknown
    private final String context;
    private final List<String> suggestions;

    public ErrorInfo(ErrorKind kind, String message, Integer line, Integer column,
                     String context, List<String> suggestions) {
        this.kind = kind;
        this.message = message;
        this.line = line;
        this.column = column;
        this.context = context;
        this.suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
    }

    public ErrorKind getKind() { return kind; }
    public String getMessage() { return message; }
    public Integer getLine() { return line; }
    public Integer getColumn() { return column; }
    public String getContext() { return context; }
    public List<String> getSuggestions() { return new ArrayList<>(suggestions); }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind.getLabel().toUpperCase()).append(" ERROR: ").append(message);
        if (line != null) {
            sb.append(" at line ").append(line);
            if (column != null) {
                sb.append(", column ").append(column);
            }
        }
        if (context != null && !context.isEmpty()) {
            sb.append("\nContext: ").append(context);
        }
        if (!suggestions.isEmpty()) {
            sb.append("\nSuggestions: ").append(String.join(", ", suggestions));
        }
        return sb.toString();
    }
}
