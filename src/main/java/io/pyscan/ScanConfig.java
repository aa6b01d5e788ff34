package io.pyscan;

import io.pyscan.analysis.Analyzer;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration loaded from a YAML file.
 * Every key is optional; missing keys keep their defaults.
 * <pre>
 * maxCodeChars: 20000
 * includeComplexity: true
 * disabledDetectors: [runtime-patterns]
 * extraBuiltins: [display, get_ipython]
 * </pre>
 */
public class ScanConfig {

    public static final String FILE_NAME = "py-scan.yaml";
    public static final String MAX_CODE_CHARS_ENV = "MAX_CODE_CHARS";
    public static final int DEFAULT_MAX_CODE_CHARS = Analyzer.DEFAULT_MAX_CODE_CHARS;

    private final int maxCodeChars;
    private final boolean includeComplexity;
    private final Set<String> disabledDetectors;
    private final Set<String> extraBuiltins;

    private ScanConfig(int maxCodeChars,
                       boolean includeComplexity,
                       Set<String> disabledDetectors,
                       Set<String> extraBuiltins) {
        this.maxCodeChars = maxCodeChars;
        this.includeComplexity = includeComplexity;
        this.disabledDetectors = disabledDetectors;
        this.extraBuiltins = extraBuiltins;
    }

    /**
     * Returns the configuration used when no file is found.
     */
    public static ScanConfig defaults() {
        return new ScanConfig(DEFAULT_MAX_CODE_CHARS, true, Set.of(), Set.of());
    }

    /**
     * Load configuration from a YAML file.
     */
    public static ScanConfig load(Path configPath) throws IOException {
        try (InputStream in = Files.newInputStream(configPath)) {
            return load(in, configPath.toString());
        }
    }

    /**
     * Load configuration from a YAML stream. An empty document yields the defaults.
     */
    @SuppressWarnings("unchecked")
    public static ScanConfig load(InputStream in, String origin) throws IOException {
        Yaml yaml = new Yaml();
        Object loaded;
        try {
            loaded = yaml.load(in);
        } catch (RuntimeException e) {
            throw new IOException("Invalid config file " + origin + ": " + e.getMessage(), e);
        }
        if (loaded == null) {
            return defaults();
        }
        if (!(loaded instanceof Map<?, ?>)) {
            throw new IOException("Config file must be a YAML mapping: " + origin);
        }
        Map<String, Object> data = (Map<String, Object>) loaded;

        int maxCodeChars = DEFAULT_MAX_CODE_CHARS;
        Object max = data.get("maxCodeChars");
        if (max != null) {
            if (!(max instanceof Integer value) || value <= 0) {
                throw new IOException("'maxCodeChars' must be a positive integer in " + origin);
            }
            maxCodeChars = value;
        }

        boolean includeComplexity = true;
        Object complexity = data.get("includeComplexity");
        if (complexity != null) {
            if (!(complexity instanceof Boolean value)) {
                throw new IOException("'includeComplexity' must be true or false in " + origin);
            }
            includeComplexity = value;
        }

        Set<String> disabled = toSet(data.get("disabledDetectors"));
        Set<String> extraBuiltins = toSet(data.get("extraBuiltins"));

        return new ScanConfig(maxCodeChars, includeComplexity, disabled, extraBuiltins);
    }

    /**
     * Resolves the configuration for a scan: the explicit file if given, otherwise
     * {@value #FILE_NAME} next to the analyzed file, otherwise the defaults.
     *
     * @param explicitConfig Path passed on the command line, or null
     * @param sourceFile     File being analyzed, or null for stdin
     */
    public static ScanConfig resolve(Path explicitConfig, Path sourceFile) throws IOException {
        if (explicitConfig != null) {
            if (!Files.exists(explicitConfig)) {
                throw new IOException("Config file does not exist: " + explicitConfig);
            }
            return load(explicitConfig);
        }
        if (sourceFile != null) {
            Path parent = sourceFile.toAbsolutePath().getParent();
            if (parent != null) {
                Path sibling = parent.resolve(FILE_NAME);
                if (Files.exists(sibling)) {
                    return load(sibling);
                }
            }
        }
        return defaults();
    }

    /**
     * Applies the {@value #MAX_CODE_CHARS_ENV} override from the given environment.
     */
    public ScanConfig withEnvironment(Map<String, String> env) throws IOException {
        String raw = env.get(MAX_CODE_CHARS_ENV);
        if (raw == null || raw.isBlank()) {
            return this;
        }
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IOException(MAX_CODE_CHARS_ENV + " must be an integer, got '" + raw + "'", e);
        }
        if (value <= 0) {
            throw new IOException(MAX_CODE_CHARS_ENV + " must be positive, got " + value);
        }
        return new ScanConfig(value, includeComplexity, disabledDetectors, extraBuiltins);
    }

    private static Set<String> toSet(Object value) {
        if (!(value instanceof List<?> list) || list.isEmpty()) {
            return Set.of();
        }
        Set<String> result = new LinkedHashSet<>();
        for (Object item : list) {
            if (item != null) {
                String trimmed = item.toString().trim();
                if (!trimmed.isEmpty()) {
                    result.add(trimmed);
                }
            }
        }
        return Collections.unmodifiableSet(result);
    }

    public int getMaxCodeChars() {
        return maxCodeChars;
    }

    public boolean isIncludeComplexity() {
        return includeComplexity;
    }

    public Set<String> getDisabledDetectors() {
        return disabledDetectors;
    }

    public Set<String> getExtraBuiltins() {
        return extraBuiltins;
    }
}
