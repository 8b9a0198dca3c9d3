package cheesepp;

final class SourceText {
    private SourceText() {
    }

    /** Returns the trimmed text of a 1-based line, or null when out of range. */
    static String lineAt(String source, Integer line) {
        if (source == null || line == null || line < 1) {
            return null;
        }
        String[] lines = source.split("\r?\n", -1);
        if (line > lines.length) {
            return null;
        }
        return lines[line - 1].trim();
    }
}
