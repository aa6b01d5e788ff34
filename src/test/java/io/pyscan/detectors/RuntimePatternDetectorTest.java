package io.pyscan.detectors;

import io.pyscan.model.Finding;
import io.pyscan.model.FindingKind;
import io.pyscan.model.Severity;
import io.pyscan.scope.BuiltinNames;
import io.pyscan.syntax.ParseOutcome;
import io.pyscan.syntax.PythonParser;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RuntimePatternDetectorTest {

    private static BuiltinNames builtins;

    private RuntimePatternDetector detector;
    private PythonParser parser;

    @BeforeAll
    static void loadBuiltins() {
        builtins = BuiltinNames.loadDefault();
    }

    @BeforeEach
    void setUp() {
        detector = new RuntimePatternDetector();
        parser = new PythonParser();
    }

    private List<Finding> detect(String code) {
        ParseOutcome.Parsed parsed = (ParseOutcome.Parsed) parser.parse(code);
        return detector.detect(new AnalysisContext(parsed.tree(), parsed.source(), builtins));
    }

    @Test
    void id_returnsRuntimePatterns() {
        assertThat(detector.id()).isEqualTo("runtime-patterns");
        assertThat(detector.matchers()).hasSize(3);
    }

    @Test
    void detect_findsDivisionByZeroForAllDivisionOperators() {
        List<Finding> findings = detect("a = x / 0\nb = x % 0\nc = x // 0.0\n");

        assertThat(findings).extracting(Finding::kind).containsOnly(FindingKind.DIVISION_BY_ZERO);
        assertThat(findings).extracting(Finding::snippet).containsExactly("x / 0", "x % 0", "x // 0.0");
        assertThat(findings).extracting(Finding::line).containsExactly(1, 2, 3);
        assertThat(findings.get(0).label()).isEqualTo("ZeroDivisionError");
        assertThat(findings.get(0).severity()).isEqualTo(Severity.WARNING);
    }

    @Test
    void detect_ignoresNonZeroAndVariableDivisors() {
        assertThat(detect("a = x / 1\nb = x / y\nc = x * 0\nd = x / True\ne = x / 0j\n")).isEmpty();
    }

    @Test
    void detect_findsDivisionByFalse() {
        List<Finding> findings = detect("y = x / False\n");

        assertThat(findings).singleElement().satisfies(f -> {
            assertThat(f.kind()).isEqualTo(FindingKind.DIVISION_BY_ZERO);
            assertThat(f.snippet()).isEqualTo("x / False");
        });
    }

    @Test
    void detect_findsLoopOverBoolLiteral() {
        List<Finding> findings = detect("for i in True:\n    pass\n");

        assertThat(findings).singleElement().satisfies(f -> {
            assertThat(f.kind()).isEqualTo(FindingKind.NON_ITERABLE_LOOP_TARGET);
            assertThat(f.snippet()).isEqualTo("True");
        });
    }

    @Test
    void detect_looksInsideMatchCases() {
        String code = """
                match command:
                    case 1:
                        print(total / 0)
                        for k in 5:
                            pass
                    case _:
                        pass
                """;

        assertThat(detect(code)).extracting(Finding::kind)
                .containsExactly(FindingKind.DIVISION_BY_ZERO, FindingKind.NON_ITERABLE_LOOP_TARGET);
    }

    @Test
    void detect_augmentedDivisionIsNotABinaryExpression() {
        assertThat(detect("x /= 0\n")).isEmpty();
    }

    @Test
    void detect_findsLoopOverIntLiteral() {
        List<Finding> findings = detect("for i in 5:\n    pass\n");

        assertThat(findings).singleElement().satisfies(f -> {
            assertThat(f.kind()).isEqualTo(FindingKind.NON_ITERABLE_LOOP_TARGET);
            assertThat(f.label()).isEqualTo("TypeError");
            assertThat(f.snippet()).isEqualTo("5");
            assertThat(f.line()).isEqualTo(1);
            assertThat(f.explanation()).isEqualTo("You are trying to iterate over an int, which is not iterable.");
        });
    }

    @Test
    void detect_ignoresLoopOverList() {
        assertThat(detect("for i in [1, 2, 3]:\n    pass\nfor j in range(5):\n    pass\n")).isEmpty();
    }

    @Test
    void detect_findsEqualityAgainstNone() {
        List<Finding> findings = detect("if value == None:\n    pass\nif None != other:\n    pass\n");

        assertThat(findings).hasSize(2);
        assertThat(findings).extracting(Finding::severity).containsOnly(Severity.INFO);
        assertThat(findings).extracting(Finding::label).containsOnly("BestPractice");
        assertThat(findings.get(0).snippet()).isEqualTo("value == None");
    }

    @Test
    void detect_ignoresIdentityChecksAndChains() {
        assertThat(detect("a = x is None\nb = x is not None\nc = x == y == None\n")).isEmpty();
    }

    @Test
    void detect_reportsInTreeOrder() {
        String code = """
                for i in 3:
                    if i == None:
                        print(i / 0)
                """;

        assertThat(detect(code)).extracting(Finding::kind).containsExactly(
                FindingKind.NON_ITERABLE_LOOP_TARGET,
                FindingKind.IDENTITY_VS_EQUALITY_STYLE,
                FindingKind.DIVISION_BY_ZERO);
    }

    @Test
    void detect_nestedPatternsInsideFunctionsAndLambdas() {
        String code = """
                def f():
                    g = lambda v: v % 0
                    return [x / 0 for x in range(3)]
                """;

        assertThat(detect(code)).extracting(Finding::line).containsExactly(2, 3);
    }

    @Test
    void detect_withCustomMatcherList_usesOnlyThoseMatchers() {
        detector = new RuntimePatternDetector(List.of(new NoneComparisonMatcher()));

        assertThat(detect("a = x / 0\nb = x == None\n"))
                .extracting(Finding::kind)
                .containsExactly(FindingKind.IDENTITY_VS_EQUALITY_STYLE);
    }
}
