package com.ttennebkram.pdpatch;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.ttennebkram.pdpatch.layout.AutoLayout;
import com.ttennebkram.pdpatch.model.CycleWarning;
import com.ttennebkram.pdpatch.model.PatchConnectionException;
import com.ttennebkram.pdpatch.model.Patcher;
import com.ttennebkram.pdpatch.model.ValidationReport;
import com.ttennebkram.pdpatch.optimize.OptimizeStats;
import com.ttennebkram.pdpatch.serialization.GraphJsonSerializer;
import com.ttennebkram.pdpatch.serialization.PatchParseException;
import com.ttennebkram.pdpatch.serialization.PatchParser;
import com.ttennebkram.pdpatch.serialization.PatchSerializer;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command line front end: read a patch, optionally validate, optimize and
 * lay it out, then write it as patch text or JSON.
 */
public class PatchTool {

    private static final Logger LOGGER = Logger.getLogger(PatchTool.class.getName());

    private static final String PACKAGE_LOGGER = "com.ttennebkram.pdpatch";

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private final PrintStream out;
    private final PrintStream err;

    // Command line options
    private String inputFile = null;
    private String outputFile = null;
    private boolean optimize = false;
    private boolean recursive = false;
    private final Set<String> collapsible = new LinkedHashSet<>();
    private boolean autoLayout = false;
    private boolean validate = false;
    private boolean json = false;
    private boolean stats = false;
    private boolean verbose = false;

    public PatchTool(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        loadLoggingConfiguration();
        System.exit(new PatchTool(System.out, System.err).run(args));
    }

    /**
     * Run with the given arguments.
     *
     * @return process exit code
     */
    public int run(String[] args) {
        Integer parseResult = parseArguments(args);
        if (parseResult != null) {
            return parseResult;
        }
        if (verbose) {
            enableVerboseLogging();
        }

        Patcher patcher;
        try {
            patcher = load(Paths.get(inputFile));
        } catch (PatchParseException e) {
            err.println("Error: " + inputFile + ": " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException | JsonParseException | PatchConnectionException e) {
            err.println("Error: cannot read " + inputFile + ": " + e.getMessage());
            return EXIT_FAILURE;
        }

        if (validate) {
            ValidationReport report = patcher.validate(true);
            for (PatchConnectionException error : report.getErrors()) {
                err.println("Invalid connection: " + error.getMessage());
            }
            for (CycleWarning warning : report.getCycleWarnings()) {
                err.println("Warning: " + warning.getMessage());
            }
            if (!report.isValid()) {
                return EXIT_FAILURE;
            }
        }

        if (optimize) {
            OptimizeStats result = patcher.optimize(recursive, collapsible);
            LOGGER.info("Optimized " + inputFile + ": " + result);
            if (stats) {
                // Keep stdout clean for the patch itself when no output file is given
                PrintStream target = outputFile == null ? err : out;
                target.println(GSON.toJson(result));
            }
        }

        if (autoLayout) {
            AutoLayout.Result layout = patcher.autoLayout();
            LOGGER.fine(() -> "Auto layout placed " + layout.getPlacedNodes() + " nodes in "
                    + layout.getRows() + " rows");
        }

        try {
            write(patcher);
        } catch (IOException e) {
            err.println("Error: cannot write " + outputFile + ": " + e.getMessage());
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    /**
     * Parse the command line into fields.
     *
     * @return an exit code to stop with, or null to go on
     */
    private Integer parseArguments(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String param = args[i];
            if ("-h".equals(param) || "--help".equals(param)) {
                printHelp();
                return EXIT_OK;
            } else if ("-o".equals(param) || "--output".equals(param)) {
                if (i + 1 < args.length) {
                    outputFile = args[++i];
                } else {
                    err.println("Error: " + param + " requires a file name");
                    return EXIT_USAGE;
                }
            } else if ("--optimize".equals(param)) {
                optimize = true;
            } else if ("--recursive".equals(param)) {
                recursive = true;
            } else if ("--collapse".equals(param)) {
                if (i + 1 < args.length) {
                    for (String name : args[++i].split(",")) {
                        if (!name.trim().isEmpty()) {
                            collapsible.add(name.trim());
                        }
                    }
                } else {
                    err.println("Error: --collapse requires a comma separated list of object classes");
                    return EXIT_USAGE;
                }
            } else if ("--auto-layout".equals(param)) {
                autoLayout = true;
            } else if ("--validate".equals(param)) {
                validate = true;
            } else if ("--json".equals(param)) {
                json = true;
            } else if ("--stats".equals(param)) {
                stats = true;
            } else if ("--verbose".equals(param)) {
                verbose = true;
            } else if (!param.startsWith("-")) {
                // Non-flag argument is the input file
                if (inputFile != null) {
                    err.println("Error: only one input file is allowed");
                    return EXIT_USAGE;
                }
                inputFile = param;
            } else {
                err.println("Unknown option: " + param);
                printHelp();
                return EXIT_USAGE;
            }
        }
        if (inputFile == null) {
            err.println("Error: no input file given");
            printHelp();
            return EXIT_USAGE;
        }
        if ((recursive || !collapsible.isEmpty()) && !optimize) {
            err.println("Warning: --recursive and --collapse only apply with --optimize");
        }
        return null;
    }

    private static Patcher load(Path path) throws IOException, PatchParseException {
        if (path.toString().endsWith(".json")) {
            return GraphJsonSerializer.load(path);
        }
        return Patcher.fromPatch(PatchParser.read(path));
    }

    private void write(Patcher patcher) throws IOException {
        boolean asJson = json || (outputFile != null && outputFile.endsWith(".json"));
        if (outputFile == null) {
            out.print(asJson ? GraphJsonSerializer.toJsonString(patcher) + "\n"
                    : PatchSerializer.serialize(patcher.toPatch()));
            out.flush();
        } else if (asJson) {
            GraphJsonSerializer.save(Paths.get(outputFile), patcher);
        } else {
            patcher.save(Paths.get(outputFile));
        }
    }

    private void printHelp() {
        out.println("Pd Patch Tool");
        out.println();
        out.println("Usage: java -jar pd-patch.jar [options] <input.pd|input.json>");
        out.println();
        out.println("Options:");
        out.println("  -h, --help                 Show this help message and exit");
        out.println("  -o, --output FILE          Write the result to FILE instead of standard output");
        out.println("  --optimize                 Remove duplicate connections and unused objects");
        out.println("  --recursive                Also optimize every subpatch (with --optimize)");
        out.println("  --collapse A,B,...         Collapse pass-through objects of these classes (with --optimize)");
        out.println("  --auto-layout              Reposition nodes by signal flow");
        out.println("  --validate                 Check connections; fail on invalid ones, warn on cycles");
        out.println("  --json                     Write the graph as JSON");
        out.println("  --stats                    Print optimizer counts as JSON");
        out.println("  --verbose                  Log details");
        out.println();
        out.println("Examples:");
        out.println("  java -jar pd-patch.jar synth.pd --optimize --stats -o synth-opt.pd");
        out.println("  java -jar pd-patch.jar synth.pd --auto-layout --json");
    }

    /**
     * Install the bundled logging.properties unless a configuration was
     * given on the command line.
     */
    private static void loadLoggingConfiguration() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = PatchTool.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Warning: cannot load logging configuration: " + e.getMessage());
        }
    }

    private static void enableVerboseLogging() {
        Logger packageLogger = Logger.getLogger(PACKAGE_LOGGER);
        packageLogger.setLevel(Level.FINE);
        boolean hasConsole = false;
        for (Handler handler : Logger.getLogger("").getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(Level.FINE);
                hasConsole = true;
            }
        }
        if (!hasConsole) {
            Handler handler = new ConsoleHandler();
            handler.setLevel(Level.FINE);
            packageLogger.addHandler(handler);
        }
    }
}
