package io.pyscan.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisReportTest {

    private AnalysisReport report;

    private static Finding finding(FindingKind kind, int line) {
        return Finding.builder().kind(kind).line(line).explanation("because").build();
    }

    @BeforeEach
    void setUp() {
        report = new AnalysisReport(
                List.of(
                        finding(FindingKind.UNDEFINED_REFERENCE, 3),
                        finding(FindingKind.DIVISION_BY_ZERO, 1),
                        finding(FindingKind.IDENTITY_VS_EQUALITY_STYLE, 2)),
                new ComplexityProfile("Roughly O(n)", "O(1) to O(n) typical for this file", 1, false),
                false);
    }

    @Test
    void findings_keepInsertionOrder() {
        assertThat(report.findings()).extracting(Finding::line).containsExactly(3, 1, 2);
    }

    @Test
    void withMinimumSeverity_dropsLowerSeverities() {
        AnalysisReport filtered = report.withMinimumSeverity(Severity.WARNING);

        assertThat(filtered.totalFindings()).isEqualTo(2);
        assertThat(filtered.complexity()).isEqualTo(report.complexity());
    }

    @Test
    void hasFindingsAtLeast_comparesByRank() {
        assertThat(report.hasFindingsAtLeast(Severity.WARNING)).isTrue();
        assertThat(report.hasFindingsAtLeast(Severity.ERROR)).isFalse();
    }

    @Test
    void countBySeverity_countsEachLevel() {
        assertThat(report.countBySeverity(Severity.WARNING)).isEqualTo(2);
        assertThat(report.countBySeverity(Severity.INFO)).isEqualTo(1);
        assertThat(report.findingCountsBySeverity()).containsEntry(Severity.WARNING, 2L);
    }

    @Test
    void findingsOfKind_filtersByKind() {
        assertThat(report.findingsOfKind(FindingKind.DIVISION_BY_ZERO)).hasSize(1);
    }

    @Test
    void withoutComplexity_removesProfile() {
        assertThat(report.withoutComplexity().complexityProfile()).isEmpty();
    }

    @Test
    void syntaxError_hasNoProfile() {
        AnalysisReport failed = AnalysisReport.syntaxError(finding(FindingKind.SYNTAX_ERROR, 1));

        assertThat(failed.hasSyntaxError()).isTrue();
        assertThat(failed.complexity()).isNull();
        assertThat(failed.emptyInput()).isFalse();
    }

    @Test
    void severityParse_acceptsAnyCase() {
        assertThat(Severity.parse("Warning")).isEqualTo(Severity.WARNING);
        assertThat(Severity.INFO.isAtLeast(Severity.WARNING)).isFalse();
        assertThat(Severity.ERROR.isAtLeast(Severity.WARNING)).isTrue();
    }
}
