package cheesepp;

import java.util.HashMap;
import java.util.Map;

public enum BinaryOperator {
    ADD("+", "plus"),
    SUB("-", "minus"),
    MUL("*", "times"),
    DIV("/", "over"),
    EQ("==", "equals"),
    NE("!=", "notequals"),
    GT(">", "greater"),
    LT("<", "minor"),
    GE(">=", "atleast"),
    LE("<=", "atmost");

    private static final Map<String, BinaryOperator> BY_KEYWORD = new HashMap<>();

    static {
        for (BinaryOperator op : values()) {
            BY_KEYWORD.put(op.keyword, op);
        }
    }

    private final String symbol;
    private final String keyword;

    BinaryOperator(String symbol, String keyword) {
        this.symbol = symbol;
        this.keyword = keyword;
    }

    public String getSymbol() { return symbol; }
    public String getKeyword() { return keyword; }

    public boolean isArithmetic() {
        return this == ADD || this == SUB || this == MUL || this == DIV;
    }

    public boolean isEquality() {
        return this == EQ || this == NE;
    }

    /** Returns null for a word that is not an operator keyword. */
    public static BinaryOperator fromKeyword(String keyword) {
        return BY_KEYWORD.get(keyword);
    }
}
