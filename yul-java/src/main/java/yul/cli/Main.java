package yul.cli;

import yul.ast.CharStream;
import yul.ast.stmt.Block;
import yul.diagnostics.Diagnostic;
import yul.diagnostics.ErrorReporter;
import yul.dialect.Dialect;
import yul.dialect.Dialects;
import yul.dialect.EvmVersion;
import yul.parser.Parser;
import yul.printer.Printer;
import yul.sema.AnalysisInfo;
import yul.sema.Analyzer;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_COMPILE_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE =
            "Usage: yul [--dialect evm|evm-typed] [--evm-version <name>] [--source-indices] <input.yul>";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    public static int run(String[] args, PrintStream out, PrintStream err) {
        String dialectName = Dialects.EVM;
        EvmVersion version = EvmVersion.current();
        boolean sourceIndices = false;
        Path input = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--dialect", "--evm-version" -> {
                    if (i + 1 >= args.length) {
                        err.println("Missing value for " + arg);
                        err.println(USAGE);
                        return EXIT_USAGE;
                    }
                    String value = args[++i];
                    if (arg.equals("--dialect")) {
                        dialectName = value;
                    } else {
                        try {
                            version = EvmVersion.fromName(value);
                        } catch (IllegalArgumentException e) {
                            err.println(e.getMessage());
                            return EXIT_USAGE;
                        }
                    }
                }
                case "--source-indices" -> sourceIndices = true;
                default -> {
                    if (arg.startsWith("--") || input != null) {
                        err.println(USAGE);
                        return EXIT_USAGE;
                    }
                    input = Path.of(arg);
                }
            }
        }
        if (input == null) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        Path file = input;

        Dialect dialect;
        try {
            dialect = Dialects.forName(dialectName, version);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        }

        // 1. Reading
        String text;
        try {
            text = Files.readString(file);
        } catch (IOException e) {
            err.println("Cannot read " + file + ": " + e.getMessage());
            return EXIT_USAGE;
        }
        LOGGER.info(() -> "[1/3] Reading: " + file + " (" + dialect + ")");

        // 2. Parser, source indices seen in @src annotations are kept for printing
        List<Diagnostic> diagnostics = new ArrayList<>();
        ErrorReporter reporter = new ErrorReporter(diagnostics);
        Map<String, Integer> indices = new LinkedHashMap<>();
        Parser parser = new Parser(reporter, dialect, index -> {
            CharStream source = Parser.virtualSource(index);
            indices.put(source.name(), index);
            return source;
        });
        Optional<Block> block = parser.parse(new CharStream(file.toString(), text));
        LOGGER.info(() -> "[2/3] Parser: " + (block.isPresent() ? "OK" : "failed"));

        // 3. Analysis
        boolean ok = false;
        if (block.isPresent()) {
            ok = new Analyzer(new AnalysisInfo(), reporter, dialect).analyze(block.get());
            boolean analyzed = ok;
            LOGGER.info(() -> "[3/3] Analyzer: " + (analyzed ? "OK" : "failed"));
        }

        for (Diagnostic d : diagnostics) {
            err.println(d.kind().displayName() + ": " + d.message());
            if (d.location() != null) {
                err.println("  --> " + d.location().sourceName() + ":" + d.location().start() + ":" + d.location().end());
            }
        }
        if (!ok) return EXIT_COMPILE_ERROR;

        Printer printer = sourceIndices ? new Printer(dialect, indices) : new Printer(dialect);
        out.println(printer.print(block.get()));
        return EXIT_OK;
    }
}
