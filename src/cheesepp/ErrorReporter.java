package cheesepp;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects errors and warnings from any phase and renders them for the user.
 */
public class ErrorReporter {
    public static final int DEFAULT_MAX_ERRORS = 10;

    private final List<CheeseException> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private int maxErrors;

    public ErrorReporter() {
        this(DEFAULT_MAX_ERRORS);
    }

    public ErrorReporter(int maxErrors) {
        if (maxErrors < 1) {
            throw new IllegalArgumentException("maxErrors must be positive, got " + maxErrors);
        }
        this.maxErrors = maxErrors;
    }

    public void reportError(CheeseException error) {
        errors.add(error);
    }

    public void reportLexicalError(String message, Integer line, Integer column, String context) {
        reportError(CheeseException.lexical(message, line, column, context));
    }

    public void reportSyntaxError(String message, Integer line, Integer column,
                                  String context, List<String> suggestions) {
        reportError(CheeseException.syntax(message, line, column, context, suggestions));
    }

    public void reportSemanticError(String message, Integer line, Integer column,
                                    String context, List<String> suggestions) {
        reportError(CheeseException.semantic(message, line, column, context, suggestions));
    }

    public void reportRuntimeError(String message, Integer line, Integer column,
                                   String context, List<String> suggestions) {
        reportError(CheeseException.runtime(message, line, column, context, suggestions));
    }

    public void reportTypeError(String message, Integer line, Integer column,
                                String context, List<String> suggestions) {
        reportError(CheeseException.type(message, line, column, context, suggestions));
    }

    public void reportWarning(String message) {
        warnings.add(message);
    }

    public boolean hasErrors() { return !errors.isEmpty(); }
    public boolean hasWarnings() { return !warnings.isEmpty(); }
    public int getErrorCount() { return errors.size(); }
    public int getWarningCount() { return warnings.size(); }
    public int getMaxErrors() { return maxErrors; }

    public void setMaxErrors(int maxErrors) {
        if (maxErrors < 1) {
            throw new IllegalArgumentException("maxErrors must be positive, got " + maxErrors);
        }
        this.maxErrors = maxErrors;
    }

    public boolean shouldStopCompilation() {
        return errors.size() >= maxErrors;
    }

    public List<CheeseException> getErrors() {
        return new ArrayList<>(errors);
    }

    public List<String> getWarnings() {
        return new ArrayList<>(warnings);
    }

    public List<CheeseException> getErrorsOfKind(ErrorKind kind) {
        return errors.stream()
                .filter(e -> e.getKind() == kind)
                .collect(Collectors.toList());
    }

    public String getFormattedErrors() {
        if (errors.isEmpty()) {
            return "No errors found.";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Found ").append(errors.size()).append(" error(s):\n");
        for (int i = 0; i < errors.size(); i++) {
            sb.append(i + 1).append(". ").append(errors.get(i).getInfo()).append("\n");
        }
        return sb.toString();
    }

    public String getFormattedWarnings() {
        if (warnings.isEmpty()) {
            return "No warnings found.";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Found ").append(warnings.size()).append(" warning(s):\n");
        for (int i = 0; i < warnings.size(); i++) {
            sb.append(i + 1).append(". WARNING: ").append(warnings.get(i)).append("\n");
        }
        return sb.toString();
    }

    public String getSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Compilation Summary:\n");
        sb.append("- Errors: ").append(errors.size()).append("\n");
        sb.append("- Warnings: ").append(warnings.size()).append("\n");
        if (!errors.isEmpty()) {
            sb.append("\nErrors by type:\n");
            for (ErrorKind kind : ErrorKind.values()) {
                int count = getErrorsOfKind(kind).size();
                if (count > 0) {
                    sb.append("- ").append(kind.getTitle()).append(": ").append(count).append("\n");
                }
            }
        }
        return sb.toString();
    }

    public void clear() {
        errors.clear();
        warnings.clear();
    }

    @Override
    public String toString() {
        return "ErrorReporter(errors=" + errors.size() + ", warnings=" + warnings.size() + ")";
    }
}
