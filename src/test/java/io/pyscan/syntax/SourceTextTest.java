package io.pyscan.syntax;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class SourceTextTest {

    @Test
    void slice_usesUtf8ByteOffsets() {
        SourceText source = SourceText.of("s = \"héllo\"; x = y");
        int start = "s = \"héllo\"; x = ".getBytes(StandardCharsets.UTF_8).length;

        assertThat(source.slice(start, start + 1)).isEqualTo("y");
    }

    @Test
    void slice_clampsEndBeyondSource() {
        SourceText source = SourceText.of("abc");

        assertThat(source.slice(1, 100)).isEqualTo("bc");
    }

    @Test
    void slice_invalidRange_returnsEmpty() {
        SourceText source = SourceText.of("abc");

        assertThat(source.slice(2, 1)).isEmpty();
        assertThat(source.slice(10, 12)).isEmpty();
    }

    @Test
    void line_handlesAllLineTerminators() {
        SourceText source = SourceText.of("one\r\ntwo\rthree\nfour");

        assertThat(source.lineCount()).isEqualTo(4);
        assertThat(source.line(2)).isEqualTo("two");
        assertThat(source.line(4)).isEqualTo("four");
        assertThat(source.line(0)).isEmpty();
        assertThat(source.line(5)).isEmpty();
    }

    @Test
    void of_null_isEmptySource() {
        SourceText source = SourceText.of(null);

        assertThat(source.text()).isEmpty();
        assertThat(source.byteLength()).isZero();
    }
}
