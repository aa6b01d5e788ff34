package io.pyscan.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.pyscan.model.AnalysisReport;
import io.pyscan.model.ComplexityProfile;
import io.pyscan.model.Finding;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Formats analysis results as JSON for machine processing.
 * <p>
 * Issue fields use the short names {@code type}, {@code line}, {@code snippet}, {@code why}
 * and {@code severity}; {@code kind} carries the stable enum name.
 */
public class JsonReporter implements Reporter {

    private final ObjectMapper mapper;
    private final boolean prettyPrint;

    public JsonReporter() {
        this(true);
    }

    public JsonReporter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
        this.mapper = createMapper();
    }

    private ObjectMapper createMapper() {
        ObjectMapper m = new ObjectMapper();
        m.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        m.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        if (prettyPrint) {
            m.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return m;
    }

    @Override
    public String format() {
        return "json";
    }

    @Override
    public void write(AnalysisReport report, Writer writer) throws IOException {
        mapper.writeValue(writer, toJsonReport(report));
        writer.flush();
    }

    JsonReport toJsonReport(AnalysisReport report) {
        ComplexityProfile profile = report.complexity();
        return new JsonReport(
                report.findings().stream()
                        .map(this::toJsonIssue)
                        .toList(),
                profile != null ? new JsonReport.Complexity(profile.timeClass(), profile.spaceClass()) : null,
                profile != null ? profile.recursive() : null,
                profile != null ? profile.maxLoopDepth() : null,
                report.emptyInput() ? Boolean.TRUE : null
        );
    }

    private JsonReport.Issue toJsonIssue(Finding finding) {
        return new JsonReport.Issue(
                finding.label(),
                finding.kind().name(),
                finding.line(),
                finding.snippet(),
                finding.explanation(),
                finding.severity().label()
        );
    }

    /**
     * JSON structure for the report.
     */
    public record JsonReport(
            List<Issue> issues,
            Complexity complexity,
            Boolean recursion,
            @JsonProperty("max_loop_depth") Integer maxLoopDepth,
            @JsonProperty("empty_input") Boolean emptyInput
    ) {
        public record Issue(
                String type,
                String kind,
                Integer line,
                String snippet,
                String why,
                String severity
        ) {}

        public record Complexity(
                String time,
                String space
        ) {}
    }
}
