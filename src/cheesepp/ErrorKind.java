package cheesepp;

public enum ErrorKind {
    LEXICAL("lexical"),
    SYNTAX("syntax"),
    SEMANTIC("semantic"),
    RUNTIME("runtime"),
    TYPE("type");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    // "Lexical", "Syntax", ... for summaries
    public String getTitle() {
        return Character.toUpperCase(label.charAt(0)) + label.substring(1);
    }
}
