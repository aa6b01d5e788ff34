package io.pyscan;

import ch.qos.logback.classic.Level;
import io.pyscan.analysis.Analyzer;
import io.pyscan.analysis.InputTooLargeException;
import io.pyscan.detectors.DetectorRegistry;
import io.pyscan.model.AnalysisReport;
import io.pyscan.model.Severity;
import io.pyscan.report.ConsoleReporter;
import io.pyscan.report.JsonReporter;
import io.pyscan.report.Reporter;
import io.pyscan.scope.BuiltinNames;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI entry point for the py-scan tool.
 */
@Command(
        name = "py-scan",
        mixinStandardHelpOptions = true,
        version = "py-scan 1.0.0",
        description = "Finds likely runtime issues in a Python source file and estimates its complexity.",
        footer = {
                "",
                "Examples:",
                "  py-scan script.py",
                "  py-scan script.py --output-format json --output-file report.json",
                "  cat script.py | py-scan - --min-severity warning --fail-on warning"
        }
)
public class PyScanCli implements Callable<Integer> {

    static final String STDIN = "-";

    @Parameters(
            index = "0",
            description = "Python file to analyze, or '-' to read from stdin"
    )
    private String input;

    @Option(
            names = {"-o", "--output-format"},
            description = "Output format: console (default), json",
            defaultValue = "console"
    )
    private OutputFormat outputFormat;

    @Option(
            names = {"-f", "--output-file"},
            description = "Output file path (defaults to stdout)"
    )
    private Path outputFile;

    @Option(
            names = {"-c", "--config"},
            description = "Path to configuration YAML file (defaults to py-scan.yaml next to the input)"
    )
    private Path configFile;

    @Option(
            names = {"--no-complexity"},
            description = "Skip the complexity estimate"
    )
    private boolean noComplexity;

    @Option(
            names = {"--min-severity"},
            description = "Minimum severity to report: error, warning, info",
            defaultValue = "info"
    )
    private String minSeverity;

    @Option(
            names = {"--fail-on"},
            description = "Exit with code 2 if findings at this level or higher: error, warning, info, none",
            defaultValue = "error"
    )
    private String failOnLevel;

    @Option(
            names = {"--no-color"},
            description = "Disable ANSI colors in console output"
    )
    private boolean noColor;

    @Option(
            names = {"-v", "--verbose"},
            description = "Enable verbose output"
    )
    private boolean verbose;

    private final Map<String, String> environment;

    public PyScanCli() {
        this(System.getenv());
    }

    PyScanCli(Map<String, String> environment) {
        this.environment = environment;
    }

    public enum OutputFormat {
        console,
        json
    }

    @Override
    public Integer call() {
        if (verbose) {
            enableDebugLogging();
        }

        try {
            Severity minimum = parseSeverity(minSeverity, "min-severity");
            if (minimum == null) return 1;

            Severity failLevel = null;
            if (!"none".equalsIgnoreCase(failOnLevel)) {
                failLevel = parseSeverity(failOnLevel, "fail-on");
                if (failLevel == null) return 1;
            }

            Path sourceFile = STDIN.equals(input) ? null : Path.of(input);
            if (sourceFile != null && !Files.isRegularFile(sourceFile)) {
                System.err.println("Error: Input file does not exist: " + sourceFile);
                return 1;
            }

            ScanConfig config = ScanConfig.resolve(configFile, sourceFile).withEnvironment(environment);
            log("Max code size: " + config.getMaxCodeChars() + " characters");

            String source = sourceFile != null
                    ? Files.readString(sourceFile, StandardCharsets.UTF_8)
                    : readStdin(System.in);

            Analyzer analyzer = Analyzer.builder()
                    .registry(DetectorRegistry.createDefault().withDisabled(config.getDisabledDetectors()))
                    .builtins(BuiltinNames.loadDefault().withExtra(config.getExtraBuiltins()))
                    .maxCodeChars(config.getMaxCodeChars())
                    .includeComplexity(config.isIncludeComplexity() && !noComplexity)
                    .build();

            log("Analyzing " + (sourceFile != null ? sourceFile : "stdin") + "...");
            AnalysisReport report = analyzer.analyzeSource(source).withMinimumSeverity(minimum);
            log("  Found " + report.totalFindings() + " findings at " + minimum.label() + " or above");

            Reporter reporter = createReporter(sourceFile != null ? sourceFile.toString() : "<stdin>");
            writeReport(report, reporter);

            if (failLevel != null && report.hasFindingsAtLeast(failLevel)) {
                if (outputFormat == OutputFormat.console && outputFile == null) {
                    System.err.println("Failing due to findings at " + failLevel.label() + " level or higher.");
                }
                return 2;
            }
            return 0;

        } catch (InputTooLargeException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        } catch (RuntimeException e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        }
    }

    private Reporter createReporter(String sourceName) {
        return switch (outputFormat) {
            case console -> new ConsoleReporter(!noColor, sourceName);
            case json -> new JsonReporter(true);
        };
    }

    private void writeReport(AnalysisReport report, Reporter reporter) throws IOException {
        if (outputFile != null) {
            reporter.write(report, outputFile);
            if (outputFormat == OutputFormat.console) {
                System.out.println("Report written to: " + outputFile);
            }
        } else {
            reporter.write(report, new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
        }
    }

    private static String readStdin(InputStream in) throws IOException {
        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }

    private static void enableDebugLogging() {
        if (LoggerFactory.getLogger("io.pyscan") instanceof ch.qos.logback.classic.Logger logger) {
            logger.setLevel(Level.DEBUG);
        }
    }

    private void log(String message) {
        if (verbose && outputFormat != OutputFormat.json) {
            System.out.println(message);
        }
    }

    private Severity parseSeverity(String value, String optionName) {
        try {
            return Severity.parse(value);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: Invalid value for --" + optionName + ": " + value);
            System.err.println("Valid values: error, warning, info" + ("fail-on".equals(optionName) ? ", none" : ""));
            return null;
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PyScanCli()).execute(args);
        System.exit(exitCode);
    }
}
