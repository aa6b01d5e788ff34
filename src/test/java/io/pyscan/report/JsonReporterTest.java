package io.pyscan.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pyscan.analysis.Analyzer;
import io.pyscan.model.AnalysisReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsonReporterTest {

    private JsonReporter reporter;
    private ObjectMapper mapper;
    private Analyzer analyzer;

    @BeforeEach
    void setUp() {
        reporter = new JsonReporter();
        mapper = new ObjectMapper();
        analyzer = Analyzer.createDefault();
    }

    @Test
    void format_returnsJson() {
        assertThat(reporter.format()).isEqualTo("json");
    }

    @Test
    void write_includesIssuesAndComplexity() throws Exception {
        AnalysisReport report = analyzer.analyzeSource("value = 10 / 0\n");

        JsonNode json = mapper.readTree(reporter.toString(report));

        JsonNode issue = json.get("issues").get(0);
        assertThat(issue.get("type").asText()).isEqualTo("ZeroDivisionError");
        assertThat(issue.get("kind").asText()).isEqualTo("DIVISION_BY_ZERO");
        assertThat(issue.get("line").asInt()).isEqualTo(1);
        assertThat(issue.get("snippet").asText()).isEqualTo("10 / 0");
        assertThat(issue.get("why").asText()).isEqualTo("This expression can divide by zero.");
        assertThat(issue.get("severity").asText()).isEqualTo("warning");

        assertThat(json.get("complexity").get("time").asText()).isEqualTo("Roughly O(n)");
        assertThat(json.get("complexity").get("space").asText()).isNotBlank();
        assertThat(json.get("recursion").asBoolean()).isFalse();
        assertThat(json.get("max_loop_depth").asInt()).isZero();
        assertThat(json.has("empty_input")).isFalse();
    }

    @Test
    void write_syntaxError_omitsComplexity() throws Exception {
        AnalysisReport report = analyzer.analyzeSource("def broken(:\n");

        JsonNode json = mapper.readTree(reporter.toString(report));

        assertThat(json.get("issues")).hasSize(1);
        assertThat(json.get("issues").get(0).get("severity").asText()).isEqualTo("error");
        assertThat(json.has("complexity")).isFalse();
        assertThat(json.has("recursion")).isFalse();
    }

    @Test
    void write_emptyInput_isFlagged() throws Exception {
        JsonNode json = mapper.readTree(reporter.toString(AnalysisReport.empty()));

        assertThat(json.get("issues")).isEmpty();
        assertThat(json.get("empty_input").asBoolean()).isTrue();
    }

    @Test
    void write_compactOutput_isSingleLine() {
        String output = new JsonReporter(false).toString(analyzer.analyzeSource("x = 1\n"));

        assertThat(output).doesNotContain("\n");
    }
}
