package cheesepp;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State of one evaluation run: symbol table, output buffer, the source being run
 * and counters. Owned by a single {@link Interpreter}.
 */
public class ExecutionContext {
    public static final String BELGIAN_BANNER = "=== Belgian Mode ===";
    public static final String NO_SOURCE = "No source available.";

    public enum Statistic {
        VARIABLES_DECLARED,
        EXPRESSIONS_EVALUATED,
        STATEMENTS_EXECUTED
    }

    private SymbolTable symbolTable = new SymbolTable();
    private final List<String> outputBuffer = new ArrayList<>();
    private final Map<Statistic, Integer> statistics = new EnumMap<>(Statistic.class);
    private String sourceCode;
    private boolean debugMode;

    public ExecutionContext() {
        resetStatistics();
    }

    public SymbolTable getSymbolTable() {
        return symbolTable;
    }

    public String getSourceCode() {
        return sourceCode;
    }

    public void setSourceCode(String sourceCode) {
        this.sourceCode = sourceCode;
    }

    public boolean isDebugMode() {
        return debugMode;
    }

    public void setDebugMode(boolean debugMode) {
        this.debugMode = debugMode;
    }

    public void addOutput(String line) {
        outputBuffer.add(line);
    }

    public void clearOutput() {
        outputBuffer.clear();
    }

    public List<String> getOutputLines() {
        return new ArrayList<>(outputBuffer);
    }

    public String getOutput() {
        return String.join("\n", outputBuffer);
    }

    public void executeBelgian() {
        if (sourceCode != null && !sourceCode.isEmpty()) {
            addOutput(BELGIAN_BANNER);
            addOutput(sourceCode);
        } else {
            addOutput(NO_SOURCE);
        }
    }

    public boolean declareVariable(String name, Value value, Integer line) {
        boolean defined = symbolTable.define(name, Symbol.SymbolKind.VARIABLE, value, line);
        if (defined) {
            increment(Statistic.VARIABLES_DECLARED);
        }
        return defined;
    }

    public void increment(Statistic statistic) {
        statistics.merge(statistic, 1, Integer::sum);
    }

    public Map<Statistic, Integer> getStatistics() {
        return new EnumMap<>(statistics);
    }

    /** Visible bindings after (or during) a run, name to value. */
    public Map<String, Value> getEnvironment() {
        Map<String, Value> env = new LinkedHashMap<>();
        symbolTable.getAllSymbols().forEach((name, symbol) -> env.put(name, symbol.getValue()));
        return env;
    }

    public void reset() {
        symbolTable = new SymbolTable();
        outputBuffer.clear();
        resetStatistics();
    }

    private void resetStatistics() {
        for (Statistic statistic : Statistic.values()) {
            statistics.put(statistic, 0);
        }
    }

    @Override
    public String toString() {
        return "ExecutionContext(symbols=" + symbolTable.size()
                + ", output_lines=" + outputBuffer.size() + ")";
    }
}
