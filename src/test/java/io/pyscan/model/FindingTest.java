package io.pyscan.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FindingTest {

    @Test
    void build_defaultsSeverityFromKind() {
        Finding finding = Finding.builder()
                .kind(FindingKind.IDENTITY_VS_EQUALITY_STYLE)
                .line(4)
                .explanation("Use `is None` / `is not None` for None checks.")
                .build();

        assertThat(finding.severity()).isEqualTo(Severity.INFO);
        assertThat(finding.location()).isEqualTo("line 4");
        assertThat(finding.snippetText()).isEmpty();
    }

    @Test
    void build_withoutLine_hasUnknownLocation() {
        Finding finding = Finding.builder()
                .kind(FindingKind.SYNTAX_ERROR)
                .explanation("invalid syntax")
                .build();

        assertThat(finding.lineNumber()).isEmpty();
        assertThat(finding.location()).isEqualTo("unknown line");
    }

    @Test
    void build_rejectsBlankExplanation() {
        assertThatThrownBy(() -> Finding.builder().kind(FindingKind.DIVISION_BY_ZERO).explanation(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("explanation");
    }

    @Test
    void build_rejectsMissingKind() {
        assertThatThrownBy(() -> Finding.builder().explanation("x").build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void build_rejectsZeroLine() {
        assertThatThrownBy(() -> Finding.builder().kind(FindingKind.DIVISION_BY_ZERO).line(0).explanation("x").build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
