package io.pyscan.complexity;

import io.pyscan.model.ComplexityProfile;
import io.pyscan.syntax.ParseOutcome;
import io.pyscan.syntax.PythonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ComplexityEstimatorTest {

    private ComplexityEstimator estimator;
    private PythonParser parser;

    @BeforeEach
    void setUp() {
        estimator = new ComplexityEstimator();
        parser = new PythonParser();
    }

    private ComplexityProfile estimate(String code) {
        return estimator.estimate(((ParseOutcome.Parsed) parser.parse(code)).tree());
    }

    @Test
    void estimate_noLoops_isLinear() {
        ComplexityProfile profile = estimate("x = 1\nprint(x)\n");

        assertThat(profile.timeClass()).isEqualTo(ComplexityEstimator.TIME_LINEAR);
        assertThat(profile.spaceClass()).isEqualTo(ComplexityEstimator.SPACE_TYPICAL);
        assertThat(profile.maxLoopDepth()).isZero();
        assertThat(profile.recursive()).isFalse();
    }

    @Test
    void estimate_singleLoop_isLinear() {
        ComplexityProfile profile = estimate("for i in range(10):\n    print(i)\n");

        assertThat(profile.timeClass()).isEqualTo("Roughly O(n)");
        assertThat(profile.maxLoopDepth()).isEqualTo(1);
    }

    @Test
    void estimate_nestedLoops_isQuadratic() {
        String code = """
                for i in range(10):
                    j = 0
                    while j < 10:
                        j += 1
                """;

        ComplexityProfile profile = estimate(code);
        assertThat(profile.timeClass()).isEqualTo("Approximately O(n^2)");
        assertThat(profile.maxLoopDepth()).isEqualTo(2);
    }

    @Test
    void estimate_tripleNestedLoops_isPolynomial() {
        String code = """
                for i in range(3):
                    for j in range(3):
                        for k in range(3):
                            print(i, j, k)
                for m in range(3):
                    pass
                """;

        ComplexityProfile profile = estimate(code);
        assertThat(profile.timeClass()).isEqualTo("Approximately O(n^k), k > 2");
        assertThat(profile.maxLoopDepth()).isEqualTo(3);
    }

    @Test
    void estimate_loopsInsideMatchCase_count() {
        String code = """
                match mode:
                    case "grid":
                        for i in range(3):
                            for j in range(3):
                                for k in range(3):
                                    pass
                """;

        ComplexityProfile profile = estimate(code);
        assertThat(profile.maxLoopDepth()).isEqualTo(3);
        assertThat(profile.timeClass()).isEqualTo(ComplexityEstimator.TIME_POLYNOMIAL);
    }

    @Test
    void estimate_siblingLoops_doNotNest() {
        String code = """
                for i in range(3):
                    pass
                for j in range(3):
                    pass
                """;

        assertThat(estimate(code).maxLoopDepth()).isEqualTo(1);
    }

    @Test
    void estimate_recursion_overridesLoopDepth() {
        String code = """
                def fib(n):
                    if n < 2:
                        return n
                    return fib(n - 1) + fib(n - 2)

                for i in range(3):
                    for j in range(3):
                        for k in range(3):
                            print(fib(i))
                """;

        ComplexityProfile profile = estimate(code);
        assertThat(profile.recursive()).isTrue();
        assertThat(profile.timeClass()).isEqualTo(ComplexityEstimator.TIME_RECURSIVE);
        assertThat(profile.spaceClass()).isEqualTo("O(recursion depth)");
        assertThat(profile.maxLoopDepth()).isEqualTo(3);
    }

    @Test
    void estimate_callToOtherFunction_isNotRecursion() {
        String code = """
                def helper(n):
                    return n

                def main(n):
                    return helper(n)
                """;

        assertThat(estimate(code).recursive()).isFalse();
    }

    @Test
    void estimate_methodCallWithSameName_isNotRecursion() {
        String code = """
                def run(self):
                    return self.run()
                """;

        assertThat(estimate(code).recursive()).isFalse();
    }

    @Test
    void estimate_loopsInsideFunctionsCountLexically() {
        String code = """
                for i in range(3):
                    def inner():
                        for j in range(3):
                            pass
                """;

        assertThat(estimate(code).maxLoopDepth()).isEqualTo(2);
    }

    @Test
    void classify_depthBuckets() {
        assertThat(ComplexityEstimator.classify(0, false).timeClass()).isEqualTo(ComplexityEstimator.TIME_LINEAR);
        assertThat(ComplexityEstimator.classify(2, false).timeClass()).isEqualTo(ComplexityEstimator.TIME_QUADRATIC);
        assertThat(ComplexityEstimator.classify(7, false).timeClass()).isEqualTo(ComplexityEstimator.TIME_POLYNOMIAL);
        assertThat(ComplexityEstimator.classify(0, true).timeClass()).isEqualTo(ComplexityEstimator.TIME_RECURSIVE);
    }
}
