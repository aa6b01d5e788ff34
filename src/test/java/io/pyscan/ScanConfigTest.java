package io.pyscan;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScanConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void defaults_matchDocumentedValues() {
        ScanConfig config = ScanConfig.defaults();

        assertThat(config.getMaxCodeChars()).isEqualTo(20_000);
        assertThat(config.isIncludeComplexity()).isTrue();
        assertThat(config.getDisabledDetectors()).isEmpty();
        assertThat(config.getExtraBuiltins()).isEmpty();
    }

    @Test
    void load_readsAllKeys() throws IOException {
        Path file = tempDir.resolve("custom.yaml");
        Files.writeString(file, """
                maxCodeChars: 500
                includeComplexity: false
                disabledDetectors:
                  - runtime-patterns
                extraBuiltins:
                  - display
                  - " get_ipython "
                """);

        ScanConfig config = ScanConfig.load(file);

        assertThat(config.getMaxCodeChars()).isEqualTo(500);
        assertThat(config.isIncludeComplexity()).isFalse();
        assertThat(config.getDisabledDetectors()).containsExactly("runtime-patterns");
        assertThat(config.getExtraBuiltins()).containsExactly("display", "get_ipython");
    }

    @Test
    void load_emptyFile_usesDefaults() throws IOException {
        Path file = tempDir.resolve("empty.yaml");
        Files.writeString(file, "");

        assertThat(ScanConfig.load(file).getMaxCodeChars()).isEqualTo(20_000);
    }

    @Test
    void load_rejectsInvalidLimit() throws IOException {
        Path file = tempDir.resolve("bad.yaml");
        Files.writeString(file, "maxCodeChars: -3\n");

        assertThatThrownBy(() -> ScanConfig.load(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("maxCodeChars");
    }

    @Test
    void load_rejectsNonMappingDocument() throws IOException {
        Path file = tempDir.resolve("list.yaml");
        Files.writeString(file, "- a\n- b\n");

        assertThatThrownBy(() -> ScanConfig.load(file)).isInstanceOf(IOException.class);
    }

    @Test
    void resolve_prefersExplicitFile() throws IOException {
        Path explicit = tempDir.resolve("explicit.yaml");
        Files.writeString(explicit, "maxCodeChars: 100\n");
        Files.writeString(tempDir.resolve(ScanConfig.FILE_NAME), "maxCodeChars: 200\n");
        Path source = tempDir.resolve("script.py");

        assertThat(ScanConfig.resolve(explicit, source).getMaxCodeChars()).isEqualTo(100);
    }

    @Test
    void resolve_findsConfigNextToSource() throws IOException {
        Files.writeString(tempDir.resolve(ScanConfig.FILE_NAME), "maxCodeChars: 200\n");
        Path source = tempDir.resolve("script.py");

        assertThat(ScanConfig.resolve(null, source).getMaxCodeChars()).isEqualTo(200);
    }

    @Test
    void resolve_missingExplicitFile_fails() {
        assertThatThrownBy(() -> ScanConfig.resolve(tempDir.resolve("nope.yaml"), null))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    void resolve_stdinWithoutConfig_usesDefaults() throws IOException {
        assertThat(ScanConfig.resolve(null, null).isIncludeComplexity()).isTrue();
    }

    @Test
    void withEnvironment_overridesLimit() throws IOException {
        ScanConfig config = ScanConfig.defaults().withEnvironment(Map.of("MAX_CODE_CHARS", "1234"));

        assertThat(config.getMaxCodeChars()).isEqualTo(1234);
    }

    @Test
    void withEnvironment_ignoresMissingVariable() throws IOException {
        ScanConfig config = ScanConfig.defaults();

        assertThat(config.withEnvironment(Map.of())).isSameAs(config);
    }

    @Test
    void withEnvironment_rejectsGarbage() {
        assertThatThrownBy(() -> ScanConfig.defaults().withEnvironment(Map.of("MAX_CODE_CHARS", "lots")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("MAX_CODE_CHARS");
    }
}
