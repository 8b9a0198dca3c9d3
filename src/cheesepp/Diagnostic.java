package cheesepp;

import java.util.List;

/**
 * Message templates and user hints shared by the front end and the interpreter.
 * Placeholders are written as {name} and filled positionally by {@link #format}.
 */
public enum Diagnostic {
    UNDEFINED_VARIABLE("Variable '{var_name}' is not defined",
            "Check variable name spelling", "Ensure variable is declared before use"),
    REDEFINED_VARIABLE("Variable '{var_name}' is already defined"),
    INVALID_OPERATION("Invalid operation '{op}' between {type1} and {type2}"),
    MISSING_CHEESE("Missing 'Cheese' at the beginning of the program",
            "Add 'Cheese' at the beginning of your program"),
    MISSING_NOCHEESE("Missing 'NoCheese' at the end of the program",
            "Add 'NoCheese' at the end of your program"),
    MISSING_BRIE("Missing 'Brie' statement terminator",
            "Add 'Brie' at the end of the statement"),
    INVALID_SWISS("Invalid Swiss string format",
            "Use Swiss...Swiss format for strings"),
    DIVISION_BY_ZERO("Division by zero"),
    INVALID_SYNTAX("Invalid syntax near '{token}'");

    private final String template;
    private final List<String> suggestions;

    Diagnostic(String template, String... suggestions) {
        this.template = template;
        this.suggestions = List.of(suggestions);
    }

    public String getTemplate() {
        return template;
    }

    public List<String> getSuggestions() {
        return suggestions;
    }

    public String format(Object... args) {
        StringBuilder sb = new StringBuilder();
        int argIndex = 0;
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            int close = c == '{' ? template.indexOf('}', i) : -1;
            if (close > 0 && argIndex < args.length) {
                sb.append(args[argIndex++]);
                i = close + 1;
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }
}
