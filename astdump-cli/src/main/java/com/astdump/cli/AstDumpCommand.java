package com.astdump.cli;

import ch.qos.logback.classic.Level;
import com.astdump.javaparser.UpstreamParseException;
import com.astdump.json.DocumentJsonException;
import com.astdump.walk.CyclicTreeException;
import com.astdump.walk.TreeDepthExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

/**
 * Command-line entry point: dumps the syntax tree of a Java source file, or of every
 * {@code .java} file in a directory, as JSON.
 */
@Command(
    name = "astdump",
    description = "Write the syntax tree of Java sources as JSON documents",
    mixinStandardHelpOptions = true,
    version = "astdump 1.0",
    exitCodeOnInvalidInput = ExitCodes.USAGE
)
public class AstDumpCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(AstDumpCommand.class);

    static final String SOURCE_SUFFIX = ".java";

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "INPUT", description = "Java source file, or a directory of them")
    private Path input;

    @Option(names = {"-o", "--output"}, description = "Output file for a single input (default: output.json)")
    private Path output;

    @Option(names = {"--output-dir"}, description = "Output directory for a directory input (default: json_out)")
    private Path outputDir;

    @Option(names = {"--compact"}, description = "Write JSON without indentation")
    private boolean compact;

    @Option(names = {"--max-depth"}, description = "Deepest tree accepted before giving up")
    private Integer maxDepth;

    @Option(names = {"--language-level"}, description = "Java language level, e.g. JAVA_17, 11 or current")
    private String languageLevel;

    @Option(names = {"--include-comments"}, description = "Keep comments as nodes of the tree")
    private boolean includeComments;

    @Option(names = {"--literal-kind"}, paramLabel = "KIND",
        description = "Node kind whose first token becomes its value (repeatable)")
    private List<String> literalKinds;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private Path configFile;

    @Option(names = {"-v", "--verbose"}, description = "Log progress and parser diagnostics")
    private boolean verbose;

    @Override
    public Integer call() {
        if (verbose) {
            enableDebugLogging();
        }

        AstDumpService service;
        AstDumpConfig config;
        try {
            config = loadConfig();
            service = new AstDumpService(config);
        } catch (InvalidOptionsException e) {
            err().println("Error: " + e.getMessage());
            return ExitCodes.INVALID_OPTIONS;
        }

        if (!Files.exists(input)) {
            err().println("Error: input not found: " + input);
            return ExitCodes.USAGE;
        }

        if (Files.isDirectory(input)) {
            return dumpDirectory(service, Paths.get(config.getOutputDir()));
        }
        return dumpOne(service, input, Paths.get(config.getOutput()));
    }

    private AstDumpConfig loadConfig() {
        AstDumpConfig config = new ConfigLoader().load(configFile);
        if (compact) {
            config.setPretty(false);
        }
        if (maxDepth != null) {
            config.setMaxDepth(maxDepth);
        }
        if (languageLevel != null) {
            config.setLanguageLevel(languageLevel);
        }
        if (includeComments) {
            config.setIncludeComments(true);
        }
        if (literalKinds != null && !literalKinds.isEmpty()) {
            config.setLiteralKinds(literalKinds);
        }
        if (output != null) {
            config.setOutput(output.toString());
        }
        if (outputDir != null) {
            config.setOutputDir(outputDir.toString());
        }
        return config;
    }

    private int dumpDirectory(AstDumpService service, Path targetDir) {
        List<Path> sources;
        try (Stream<Path> entries = Files.list(input)) {
            sources = entries
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().endsWith(SOURCE_SUFFIX))
                .sorted()
                .toList();
        } catch (IOException e) {
            err().println("Error: cannot list " + input + ": " + e.getMessage());
            return ExitCodes.USAGE;
        }

        if (sources.isEmpty()) {
            err().println("Error: no " + SOURCE_SUFFIX + " files found in " + input);
            return ExitCodes.USAGE;
        }

        // keep going after a failure, report the first one
        int exitCode = ExitCodes.SUCCESS;
        for (Path source : sources) {
            int result = dumpOne(service, source, targetDir.resolve(baseName(source) + ".json"));
            if (exitCode == ExitCodes.SUCCESS) {
                exitCode = result;
            }
        }
        out().println("Processed " + sources.size() + " file(s) into " + targetDir);
        return exitCode;
    }

    private int dumpOne(AstDumpService service, Path source, Path target) {
        out().println("Input file: " + source);
        try {
            service.dumpFile(source, target);
        } catch (IOException e) {
            err().println("Error: cannot read " + source + ": " + e.getMessage());
            return ExitCodes.USAGE;
        } catch (UpstreamParseException e) {
            err().println("Error: " + e.getMessage());
            e.getProblems().forEach(problem -> err().println("  " + problem));
            return ExitCodes.PARSE_FAILURE;
        } catch (CyclicTreeException | TreeDepthExceededException e) {
            err().println("Error: " + source + ": " + e.getMessage());
            return ExitCodes.MALFORMED_TREE;
        } catch (DocumentJsonException e) {
            err().println("Error: cannot write " + target + ": " + e.getMessage());
            logger.debug("Write failure for {}", target, e);
            return ExitCodes.OUTPUT_FAILURE;
        }
        out().println("Output written to: " + target);
        return ExitCodes.SUCCESS;
    }

    static String baseName(Path source) {
        String fileName = source.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static void enableDebugLogging() {
        Logger packageLogger = LoggerFactory.getLogger("com.astdump");
        if (packageLogger instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(Level.DEBUG);
        } else {
            logger.warn("--verbose needs Logback as the SLF4J backend, found {}", packageLogger.getClass().getName());
        }
    }

    private PrintWriter out() {
        return spec.commandLine().getOut();
    }

    private PrintWriter err() {
        return spec.commandLine().getErr();
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AstDumpCommand()).execute(args);
        System.exit(exitCode);
    }
}
