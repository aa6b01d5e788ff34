package io.pyscan.report;

import io.pyscan.model.AnalysisReport;
import io.pyscan.model.ComplexityProfile;
import io.pyscan.model.Finding;
import io.pyscan.model.Severity;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;

/**
 * Formats analysis results for console output with ANSI colors.
 * <p>
 * Layout: header, one-line severity summary, findings in report order, complexity section.
 */
public class ConsoleReporter implements Reporter {

    // ANSI color codes
    private static final String RESET = "\u001B[0m";
    private static final String BOLD = "\u001B[1m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String GREEN = "\u001B[32m";
    private static final String CYAN = "\u001B[36m";

    private static final int WIDTH = 70;

    private final boolean useColors;
    private final String sourceName;

    public ConsoleReporter() {
        this(true, null);
    }

    public ConsoleReporter(boolean useColors) {
        this(useColors, null);
    }

    public ConsoleReporter(boolean useColors, String sourceName) {
        this.useColors = useColors;
        this.sourceName = sourceName;
    }

    @Override
    public String format() {
        return "console";
    }

    @Override
    public void write(AnalysisReport report, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);

        printHeader(out);
        if (report.emptyInput()) {
            out.println("No code provided.");
            out.println();
            out.flush();
            return;
        }
        printSummary(out, report);
        printFindings(out, report);
        report.complexityProfile().ifPresent(profile -> printComplexity(out, profile));
        printFooter(out, report);
        out.flush();
    }

    private void printHeader(PrintWriter out) {
        out.println();
        out.println(line('=', WIDTH));
        out.println(center("PY-SCAN REPORT", WIDTH));
        out.println(line('=', WIDTH));
        out.println();
        if (sourceName != null) {
            out.println("Source: " + sourceName);
            out.println();
        }
    }

    private void printSummary(PrintWriter out, AnalysisReport report) {
        out.println(bold("SUMMARY"));
        out.println(line('-', WIDTH));

        long errors = report.countBySeverity(Severity.ERROR);
        long warnings = report.countBySeverity(Severity.WARNING);
        long infos = report.countBySeverity(Severity.INFO);

        StringBuilder findings = new StringBuilder("Findings: ");
        findings.append(errors > 0 ? color(RED, errors + " error") : "0 error").append(" | ");
        findings.append(warnings > 0 ? color(YELLOW, warnings + " warning") : "0 warning").append(" | ");
        findings.append(infos).append(" info");
        out.println(findings);
        out.println();
    }

    private void printFindings(PrintWriter out, AnalysisReport report) {
        if (report.findings().isEmpty()) {
            return;
        }
        out.println(bold("FINDINGS"));
        out.println(line('-', WIDTH));

        int index = 1;
        for (Finding finding : report.findings()) {
            printFinding(out, index++, finding);
        }
    }

    private void printFinding(PrintWriter out, int index, Finding finding) {
        out.println("[" + index + "] " + severityIndicator(finding.severity()) + " " + bold(finding.label()));
        out.println("    Location: " + finding.location());
        finding.snippetText().ifPresent(snippet -> out.println("    Code: " + snippet));
        out.println("    Why: " + finding.explanation());
        out.println();
    }

    private void printComplexity(PrintWriter out, ComplexityProfile profile) {
        out.println(bold("COMPLEXITY"));
        out.println(line('-', WIDTH));
        out.println("  Time:  " + profile.timeClass());
        out.println("  Space: " + profile.spaceClass());
        out.println("  Max loop depth: " + profile.maxLoopDepth()
                + (profile.recursive() ? color(CYAN, " | recursion detected") : ""));
        out.println();
    }

    private void printFooter(PrintWriter out, AnalysisReport report) {
        out.println(line('=', WIDTH));

        if (report.hasSyntaxError()) {
            out.println(color(RED, bold("The code could not be parsed. Fix the syntax error first.")));
        } else if (report.countBySeverity(Severity.WARNING) > 0) {
            out.println(color(YELLOW, "Review the warnings above before running this code."));
        } else {
            out.println(color(GREEN, "No likely runtime issues found."));
        }

        out.println();
    }

    private String severityIndicator(Severity severity) {
        return switch (severity) {
            case ERROR -> color(RED, "[ERROR]");
            case WARNING -> color(YELLOW, "[WARN]");
            case INFO -> color(CYAN, "[INFO]");
        };
    }

    // Formatting helpers

    private String color(String color, String text) {
        if (!useColors) return text;
        return color + text + RESET;
    }

    private String bold(String text) {
        if (!useColors) return text;
        return BOLD + text + RESET;
    }

    private String line(char c, int length) {
        return String.valueOf(c).repeat(length);
    }

    private String center(String text, int width) {
        if (text.length() >= width) return text;
        int padding = (width - text.length()) / 2;
        return " ".repeat(padding) + text;
    }
}
