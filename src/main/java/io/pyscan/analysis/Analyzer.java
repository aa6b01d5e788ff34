package io.pyscan.analysis;

import io.pyscan.complexity.ComplexityEstimator;
import io.pyscan.detectors.AnalysisContext;
import io.pyscan.detectors.DetectorRegistry;
import io.pyscan.model.AnalysisReport;
import io.pyscan.model.ComplexityProfile;
import io.pyscan.model.Finding;
import io.pyscan.model.FindingKind;
import io.pyscan.model.Severity;
import io.pyscan.scope.BuiltinNames;
import io.pyscan.syntax.ParseOutcome;
import io.pyscan.syntax.PythonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Runs every detector and the complexity estimator over one source text.
 * <p>
 * Instances hold only configuration; each call builds fresh traversal state, so one analyzer
 * may serve concurrent callers.
 */
public class Analyzer {

    private static final Logger log = LoggerFactory.getLogger(Analyzer.class);

    public static final int DEFAULT_MAX_CODE_CHARS = 20_000;

    private final PythonParser parser;
    private final DetectorRegistry registry;
    private final BuiltinNames builtins;
    private final ComplexityEstimator estimator;
    private final int maxCodeChars;
    private final boolean includeComplexity;

    private Analyzer(Builder builder) {
        this.parser = builder.parser;
        this.registry = builder.registry;
        this.builtins = builder.builtins;
        this.estimator = builder.estimator;
        this.maxCodeChars = builder.maxCodeChars;
        this.includeComplexity = builder.includeComplexity;
    }

    /**
     * Creates an analyzer with the default detectors, builtin table and limits.
     */
    public static Analyzer createDefault() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Strips, size-checks, parses and analyzes the given source.
     *
     * @throws InputTooLargeException if the stripped source is longer than the configured limit
     */
    public AnalysisReport analyzeSource(String source) {
        String code = source == null ? "" : source.strip();
        if (code.isEmpty()) {
            log.debug("Empty input, nothing to analyze");
            return AnalysisReport.empty();
        }
        if (code.length() > maxCodeChars) {
            throw new InputTooLargeException(code.length(), maxCodeChars);
        }
        return analyze(parser.parse(code));
    }

    /**
     * Analyzes an already parsed source. A parse failure yields a report holding a single
     * syntax error finding and no complexity profile.
     */
    public AnalysisReport analyze(ParseOutcome outcome) {
        if (outcome instanceof ParseOutcome.Failure failure) {
            return AnalysisReport.syntaxError(Finding.builder()
                    .kind(FindingKind.SYNTAX_ERROR)
                    .line(failure.line())
                    .snippet(failure.offendingText())
                    .explanation(failure.message())
                    .severity(Severity.ERROR)
                    .detectorId("parser")
                    .build());
        }

        ParseOutcome.Parsed parsed = (ParseOutcome.Parsed) outcome;
        AnalysisContext context = new AnalysisContext(parsed.tree(), parsed.source(), builtins);
        List<Finding> findings = registry.runAll(context);

        ComplexityProfile profile = includeComplexity ? estimateSafely(parsed) : null;
        log.debug("Analysis produced {} finding(s)", findings.size());
        return new AnalysisReport(findings, profile, false);
    }

    /**
     * Falls back to the profile of a flat, non-recursive file when the estimator fails.
     */
    private ComplexityProfile estimateSafely(ParseOutcome.Parsed parsed) {
        try {
            return estimator.estimate(parsed.tree());
        } catch (RuntimeException e) {
            log.warn("Complexity estimate failed, using the default profile: {}", e.toString(), e);
        } catch (StackOverflowError e) {
            log.warn("Complexity estimate ran out of stack, using the default profile");
        }
        return ComplexityEstimator.classify(0, false);
    }

    public int maxCodeChars() {
        return maxCodeChars;
    }

    public boolean includeComplexity() {
        return includeComplexity;
    }

    public static class Builder {
        private PythonParser parser = new PythonParser();
        private DetectorRegistry registry;
        private BuiltinNames builtins;
        private ComplexityEstimator estimator = new ComplexityEstimator();
        private int maxCodeChars = DEFAULT_MAX_CODE_CHARS;
        private boolean includeComplexity = true;

        public Builder parser(PythonParser parser) {
            this.parser = Objects.requireNonNull(parser, "parser");
            return this;
        }

        public Builder registry(DetectorRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder builtins(BuiltinNames builtins) {
            this.builtins = builtins;
            return this;
        }

        public Builder estimator(ComplexityEstimator estimator) {
            this.estimator = Objects.requireNonNull(estimator, "estimator");
            return this;
        }

        public Builder maxCodeChars(int maxCodeChars) {
            if (maxCodeChars <= 0) {
                throw new IllegalArgumentException("maxCodeChars must be positive");
            }
            this.maxCodeChars = maxCodeChars;
            return this;
        }

        public Builder includeComplexity(boolean includeComplexity) {
            this.includeComplexity = includeComplexity;
            return this;
        }

        public Analyzer build() {
            if (registry == null) {
                registry = DetectorRegistry.createDefault();
            }
            if (builtins == null) {
                builtins = BuiltinNames.loadDefault();
            }
            return new Analyzer(this);
        }
    }
}
