package io.pyscan.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Result of analyzing one source text.
 * <p>
 * Findings keep detector execution order, then traversal order within a detector.
 * They are not sorted by line.
 *
 * @param findings   Ordered findings
 * @param complexity Complexity profile, or null when parsing failed, the input was empty,
 *                   or complexity was not requested
 * @param emptyInput True if the source was empty after stripping whitespace
 */
public record AnalysisReport(
        List<Finding> findings,
        ComplexityProfile complexity,
        boolean emptyInput
) {
    public AnalysisReport {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public static AnalysisReport empty() {
        return new AnalysisReport(List.of(), null, true);
    }

    public static AnalysisReport syntaxError(Finding syntaxError) {
        return new AnalysisReport(List.of(syntaxError), null, false);
    }

    public Optional<ComplexityProfile> complexityProfile() {
        return Optional.ofNullable(complexity);
    }

    /**
     * Returns true if the report describes a parse failure.
     */
    public boolean hasSyntaxError() {
        return findings.stream().anyMatch(f -> f.kind() == FindingKind.SYNTAX_ERROR);
    }

    /**
     * Returns a copy without findings below the given severity. The complexity profile is kept.
     */
    public AnalysisReport withMinimumSeverity(Severity minimum) {
        List<Finding> kept = findings.stream()
                .filter(f -> f.severity().isAtLeast(minimum))
                .toList();
        return new AnalysisReport(kept, complexity, emptyInput);
    }

    /**
     * Returns a copy without the complexity profile.
     */
    public AnalysisReport withoutComplexity() {
        return new AnalysisReport(findings, null, emptyInput);
    }

    public boolean hasFindingsAtLeast(Severity minimum) {
        return findings.stream().anyMatch(f -> f.severity().isAtLeast(minimum));
    }

    public List<Finding> findingsOfKind(FindingKind kind) {
        return findings.stream()
                .filter(f -> f.kind() == kind)
                .toList();
    }

    public Map<Severity, Long> findingCountsBySeverity() {
        return findings.stream()
                .collect(Collectors.groupingBy(Finding::severity, Collectors.counting()));
    }

    public long countBySeverity(Severity severity) {
        return findings.stream()
                .filter(f -> f.severity() == severity)
                .count();
    }

    public int totalFindings() {
        return findings.size();
    }
}
