package io.pyscan.detectors;

import io.pyscan.model.Finding;
import io.pyscan.model.FindingKind;
import io.pyscan.scope.BuiltinNames;
import io.pyscan.syntax.ParseOutcome;
import io.pyscan.syntax.PythonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class DetectorRegistryTest {

    private AnalysisContext context;

    @BeforeEach
    void setUp() {
        ParseOutcome.Parsed parsed = (ParseOutcome.Parsed) new PythonParser().parse("""
                result = total / 0
                print(missing)
                """);
        context = new AnalysisContext(parsed.tree(), parsed.source(), BuiltinNames.loadDefault());
    }

    @Test
    void createDefault_registersDetectorsInOrder() {
        DetectorRegistry registry = DetectorRegistry.createDefault();

        assertThat(registry.allDetectors()).extracting(Detector::id)
                .containsExactly("undefined-name", "runtime-patterns");
    }

    @Test
    void runAll_concatenatesFindingsByDetectorOrder() {
        List<Finding> findings = DetectorRegistry.createDefault().runAll(context);

        assertThat(findings).extracting(Finding::kind).containsExactly(
                FindingKind.UNDEFINED_REFERENCE,
                FindingKind.UNDEFINED_REFERENCE,
                FindingKind.DIVISION_BY_ZERO);
        assertThat(findings).extracting(Finding::snippet).containsExactly("total", "missing", "total / 0");
    }

    @Test
    void withDisabled_skipsDetector() {
        DetectorRegistry registry = DetectorRegistry.createDefault().withDisabled(List.of("undefined-name"));

        assertThat(registry.runAll(context)).extracting(Finding::kind)
                .containsExactly(FindingKind.DIVISION_BY_ZERO);
        assertThat(registry.disabledIds()).containsExactly("undefined-name");
    }

    @Test
    void run_selectsDetectorsById() {
        List<Finding> findings = DetectorRegistry.createDefault().run(context, Set.of("runtime-patterns"));

        assertThat(findings).hasSize(1);
    }

    @Test
    void runAll_failingDetectorContributesNothing() {
        Detector failing = new Detector() {
            @Override
            public String id() {
                return "failing";
            }

            @Override
            public String description() {
                return "Always throws";
            }

            @Override
            public List<Finding> detect(AnalysisContext ctx) {
                throw new IllegalStateException("boom");
            }
        };
        DetectorRegistry registry = DetectorRegistry.of(failing, new RuntimePatternDetector());

        assertThat(registry.runAll(context)).extracting(Finding::kind)
                .containsExactly(FindingKind.DIVISION_BY_ZERO);
    }

    @Test
    void runAll_detectorOutOfStackIsSkipped() {
        Detector overflowing = new Detector() {
            @Override
            public String id() {
                return "overflowing";
            }

            @Override
            public String description() {
                return "Runs out of stack";
            }

            @Override
            public List<Finding> detect(AnalysisContext ctx) {
                throw new StackOverflowError();
            }
        };
        DetectorRegistry registry = DetectorRegistry.of(overflowing, new RuntimePatternDetector());

        assertThat(registry.runAll(context)).extracting(Finding::kind)
                .containsExactly(FindingKind.DIVISION_BY_ZERO);
    }

    @Test
    void getById_returnsRegisteredDetector() {
        DetectorRegistry registry = DetectorRegistry.createDefault();

        assertThat(registry.getById("runtime-patterns")).containsInstanceOf(RuntimePatternDetector.class);
        assertThat(registry.getById("nope")).isEmpty();
    }
}
