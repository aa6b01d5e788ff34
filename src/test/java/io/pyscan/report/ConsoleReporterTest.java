package io.pyscan.report;

import io.pyscan.analysis.Analyzer;
import io.pyscan.model.AnalysisReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleReporterTest {

    private Analyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = Analyzer.createDefault();
    }

    @Test
    void write_listsFindingsAndComplexity() {
        AnalysisReport report = analyzer.analyzeSource("for i in 5:\n    print(i == None)\n");

        String output = new ConsoleReporter(false, "sample.py").toString(report);

        assertThat(output)
                .contains("PY-SCAN REPORT")
                .contains("Source: sample.py")
                .contains("Findings: 0 error | 1 warning | 1 info")
                .contains("[WARN] TypeError")
                .contains("Location: line 1")
                .contains("Code: 5")
                .contains("[INFO] BestPractice")
                .contains("Time:  Roughly O(n)")
                .contains("Max loop depth: 1");
    }

    @Test
    void write_withoutColors_hasNoAnsiCodes() {
        String output = new ConsoleReporter(false).toString(analyzer.analyzeSource("print(x)\n"));

        assertThat(output).doesNotContain("\u001B[");
    }

    @Test
    void write_withColors_usesAnsiCodes() {
        String output = new ConsoleReporter(true).toString(analyzer.analyzeSource("print(x)\n"));

        assertThat(output).contains("\u001B[33m");
    }

    @Test
    void write_syntaxError_mentionsParsing() {
        String output = new ConsoleReporter(false).toString(analyzer.analyzeSource("def broken(:\n"));

        assertThat(output)
                .contains("[ERROR] SyntaxError")
                .contains("could not be parsed")
                .doesNotContain("COMPLEXITY");
    }

    @Test
    void write_emptyInput_saysNoCode() {
        String output = new ConsoleReporter(false).toString(AnalysisReport.empty());

        assertThat(output).contains("No code provided.");
    }

    @Test
    void write_recursion_isHighlighted() {
        String code = "def loop(n):\n    return loop(n - 1)\n";

        String output = new ConsoleReporter(false).toString(analyzer.analyzeSource(code));

        assertThat(output).contains("recursion detected").contains("O(recursion depth)");
    }
}
