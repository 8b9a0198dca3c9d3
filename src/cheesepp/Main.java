package cheesepp;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class Main {
    public static void main(String[] args) throws IOException {
        boolean debug = false;
        int maxErrors = ErrorReporter.DEFAULT_MAX_ERRORS;
        String inputFile = null;

        for (int i = 0; i < args.length; i++) {
            if (args[i].equals("--debug")) {
                debug = true;
            } else if (args[i].equals("--max-errors") && i + 1 < args.length) {
                maxErrors = parseMaxErrors(args[++i]);
            } else if (inputFile == null) {
                inputFile = args[i];
            } else {
                usage();
            }
        }
        if (inputFile == null) {
            usage();
        }

        String source = Files.readString(Path.of(inputFile), StandardCharsets.UTF_8);
        ErrorReporter reporter = new ErrorReporter(maxErrors);
        Interpreter interpreter = new Interpreter(reporter);
        interpreter.setDebugMode(debug);

        try {
            ProgramNode program = CheeseCompiler.parse(source);
            String output = interpreter.run(program, source);
            if (!output.isEmpty()) {
                System.out.println(output);
            }
        } catch (CheeseException e) {
            if (e.getKind() == ErrorKind.LEXICAL || e.getKind() == ErrorKind.SYNTAX) {
                reporter.reportError(e);
            }
            // whatever ran before the failure is still shown
            String partial = interpreter.getOutput();
            if (!partial.isEmpty()) {
                System.out.println(partial);
            }
            System.err.println(e.getInfo());
            if (debug) {
                System.err.print(reporter.getSummary());
            }
            System.exit(1);
        }
    }

    private static int parseMaxErrors(String text) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            System.err.println("Invalid --max-errors value: " + text);
            System.exit(1);
            return ErrorReporter.DEFAULT_MAX_ERRORS;
        }
    }

    private static void usage() {
        System.err.println("Usage: java cheesepp.Main [--debug] [--max-errors N] <input file>");
        System.exit(1);
    }
}
