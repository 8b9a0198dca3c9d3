package cheesepp;

public class Symbol {
    public enum SymbolKind {
        VARIABLE("variable"),
        CONSTANT("constant"),
        FUNCTION("function");

        private final String label;

        SymbolKind(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    private final String name;
    private final SymbolKind kind;
    private Value value;
    private final int scopeLevel;
    private final Integer line;     // declaring line, optional

    public Symbol(String name, SymbolKind kind, Value value, int scopeLevel, Integer line) {
        this.name = name;
        this.kind = kind;
        this.value = value;
        this.scopeLevel = scopeLevel;
        this.line = line;
    }

    public String getName() { return name; }
    public SymbolKind getKind() { return kind; }
    public Value getValue() { return value; }
    public int getScopeLevel() { return scopeLevel; }
    public Integer getLine() { return line; }

    void setValue(Value value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return "Symbol(" + name + ", " + kind.getLabel() + ", " + value + ", scope=" + scopeLevel + ")";
    }
}
