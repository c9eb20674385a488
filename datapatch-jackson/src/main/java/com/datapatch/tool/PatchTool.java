package com.datapatch.tool;

import com.datapatch.ast.Coordinate;
import com.datapatch.ast.Patch;
import com.datapatch.diagnostics.CollectingDiagnosticSink;
import com.datapatch.diagnostics.Diagnostic;
import com.datapatch.interpret.Interpreter;
import com.datapatch.interpret.PatchEnvironment;
import com.datapatch.interpret.PatchResult;
import com.datapatch.jackson.JsonDocument;
import com.datapatch.json.AstJsonProvider;
import com.datapatch.parse.ParseNode;
import com.datapatch.transform.Transformer;
import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Applies patches to a JSON element document (see {@link JsonDocument} for its layout).
 *
 * <p>Patches are given as parse-tree JSON, the output of the external patch grammar. They are
 * transformed in parallel and then run in the order given.</p>
 *
 * Usage:
 *   java -cp ... com.datapatch.tool.PatchTool --document=parts.json --patch=a.json [options]
 *
 * Options:
 *   --patch=PATH       Parse-tree JSON of a patch, repeatable, run in order
 *   --document=PATH    Element document to patch
 *   --output=PATH      Where to write the patched document (default: standard output)
 *   --stage=NAME       Run the blocks of this stage instead of the untagged ones
 *   --mod=NAME         Mark a mod as active, repeatable
 *   --threads=N        Worker threads for transformation (default: available processors)
 *   --verbose          Enable debug logging
 *
 * Exit codes: 0 on success, 1 when a patch failed at runtime, 2 on syntax errors or bad input.
 */
public class PatchTool {

    private static final Logger log = Logger.getLogger(PatchTool.class);

    private final Config config;

    public static void main(String[] args) {
        Config config = Config.parse(args);
        if (config == null) {
            printUsage();
            System.exit(2);
        }
        configureLogging(config.verbose);

        PatchTool tool = new PatchTool(config);
        try {
            System.exit(tool.run());
        } catch (Exception e) {
            System.err.println("Fatal error: " + e.getMessage());
            e.printStackTrace();
            System.exit(2);
        }
    }

    public PatchTool(Config config) {
        this.config = config;
    }

    public int run() throws IOException, InterruptedException {
        AstJsonProvider provider = AstJsonProvider.getProvider();
        log.info("Using " + provider.getName() + " JSON provider");

        List<Compiled> compiled = transformAll(provider);
        boolean errored = false;
        for (Compiled unit : compiled) {
            for (Diagnostic diagnostic : unit.diagnostics) {
                System.err.println(diagnostic);
            }
            errored |= unit.errored;
        }
        if (errored) {
            System.err.println("Not running: syntax errors in patches");
            return 2;
        }

        JsonDocument document;
        try {
            document = JsonDocument.parse(Files.readString(config.document));
        } catch (IllegalArgumentException e) {
            System.err.println(config.document + ": " + e.getMessage());
            return 2;
        }

        PatchEnvironment environment = PatchEnvironment.builder()
            .activeMods(config.mods)
            .assetCreator(document)
            .build();
        CollectingDiagnosticSink runtimeSink = new CollectingDiagnosticSink();
        Interpreter interpreter = new Interpreter(environment, runtimeSink);
        List<Patch> patches = compiled.stream().map(unit -> unit.patch).toList();
        List<PatchResult> results = interpreter.runAll(patches, document::roots, config.stage);

        int failed = 0;
        for (int i = 0; i < results.size(); i++) {
            PatchResult result = results.get(i);
            if (!result.succeeded()) {
                failed++;
                System.err.println(compiled.get(i).path + ": " + result.error());
            } else if (config.verbose) {
                System.err.println(compiled.get(i).path + ": stages " + result.stages()
                    + ", labels " + result.labels() + ", " + result.modifiedElements() + " element(s) modified");
            }
        }

        if (config.output != null) {
            Files.writeString(config.output, document.toPrettyJson());
        } else {
            System.out.println(document.toPrettyJson());
        }
        log.info(results.size() + " patch(es) run, " + failed + " failed, "
            + document.modifiedElements() + " modification(s)");
        return failed > 0 ? 1 : 0;
    }

    private List<Compiled> transformAll(AstJsonProvider provider) throws InterruptedException, IOException {
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, Math.min(config.threads, config.patches.size())));
        try {
            List<Future<Compiled>> futures = new ArrayList<>();
            for (Path path : config.patches) {
                futures.add(executor.submit(() -> transform(provider, path)));
            }
            List<Compiled> compiled = new ArrayList<>(futures.size());
            for (Future<Compiled> future : futures) {
                try {
                    compiled.add(future.get());
                } catch (ExecutionException e) {
                    if (e.getCause() instanceof IOException io) {
                        throw io;
                    }
                    if (e.getCause() instanceof RuntimeException runtime) {
                        throw runtime;
                    }
                    throw new IllegalStateException(e.getCause());
                }
            }
            return compiled;
        } finally {
            executor.shutdown();
        }
    }

    private static Compiled transform(AstJsonProvider provider, Path path) throws IOException {
        ParseNode tree = provider.getDeserializer().deserializeParseTree(Files.readString(path));
        CollectingDiagnosticSink sink = new CollectingDiagnosticSink();
        Transformer transformer = new Transformer(sink);
        Patch patch = transformer.transformPatch(inFile(tree, path.getFileName().toString()));
        if (log.isDebugEnabled()) {
            log.debug("Transformed " + path + " into " + patch.statements().size() + " statement(s)");
        }
        return new Compiled(path, patch, sink.diagnostics(), transformer.errored());
    }

    /**
     * Fills in the file name of coordinates that do not carry one.
     */
    static ParseNode inFile(ParseNode node, String file) {
        Coordinate coordinate = node.coordinate();
        if (Coordinate.UNKNOWN.file().equals(coordinate.file())) {
            coordinate = Coordinate.of(file, coordinate.line(), coordinate.column());
        }
        Map<String, ParseNode> labels = new LinkedHashMap<>();
        node.labels().forEach((label, child) -> labels.put(label, inFile(child, file)));
        List<ParseNode> children = new ArrayList<>(node.children().size());
        for (ParseNode child : node.children()) {
            children.add(inFile(child, file));
        }
        return new ParseNode(node.rule(), coordinate, node.text(), labels, children);
    }

    private static void configureLogging(boolean verbose) {
        Logger root = Logger.getRootLogger();
        if (!root.getAllAppenders().hasMoreElements()) {
            // standard output may carry the patched document
            root.addAppender(new ConsoleAppender(new PatternLayout("%-5p %c{1} - %m%n"), ConsoleAppender.SYSTEM_ERR));
        }
        root.setLevel(verbose ? Level.DEBUG : Level.WARN);
    }

    private static void printUsage() {
        System.out.println("Usage: PatchTool --document=PATH --patch=PATH [--patch=PATH...] [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --patch=PATH      Parse-tree JSON of a patch (repeatable, run in order)");
        System.out.println("  --document=PATH   Element document to patch");
        System.out.println("  --output=PATH     Where to write the result (default: standard output)");
        System.out.println("  --stage=NAME      Run the blocks of this stage");
        System.out.println("  --mod=NAME        Mark a mod as active (repeatable)");
        System.out.println("  --threads=N       Worker threads for transformation (default: CPU count)");
        System.out.println("  --verbose         Enable debug logging");
        System.out.println("  --help            Show this help");
    }

    private record Compiled(Path path, Patch patch, List<Diagnostic> diagnostics, boolean errored) {
    }

    public static class Config {
        List<Path> patches = new ArrayList<>();
        Path document;
        Path output;
        String stage;
        Set<String> mods = new LinkedHashSet<>();
        int threads = Runtime.getRuntime().availableProcessors();
        boolean verbose = false;

        public static Config parse(String[] args) {
            Config config = new Config();

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    return null;
                } else if (arg.startsWith("--patch=")) {
                    config.patches.add(Path.of(arg.substring(8)));
                } else if (arg.startsWith("--document=")) {
                    config.document = Path.of(arg.substring(11));
                } else if (arg.startsWith("--output=")) {
                    config.output = Path.of(arg.substring(9));
                } else if (arg.startsWith("--stage=")) {
                    config.stage = arg.substring(8);
                } else if (arg.startsWith("--mod=")) {
                    config.mods.add(arg.substring(6));
                } else if (arg.startsWith("--threads=")) {
                    try {
                        config.threads = Integer.parseInt(arg.substring(10));
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid thread count: " + arg.substring(10));
                        return null;
                    }
                } else if (arg.equals("--verbose") || arg.equals("-v")) {
                    config.verbose = true;
                } else {
                    System.err.println("Unknown option: " + arg);
                    return null;
                }
            }

            if (config.document == null) {
                System.err.println("Error: No document specified");
                return null;
            }
            if (config.patches.isEmpty()) {
                System.err.println("Error: No patches specified");
                return null;
            }
            return config;
        }
    }
}
