package io.pyscan.scope;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Identifiers predeclared by the Python runtime.
 * The table ships as a classpath resource so results do not depend on the machine running the scan.
 */
public final class BuiltinNames {

    private static final String DEFAULT_TABLE = "/python-builtins.yaml";

    private static final Set<String> KEYWORD_CONSTANTS = Set.of("None", "True", "False");

    private final String pythonVersion;
    private final Set<String> names;

    private BuiltinNames(String pythonVersion, Set<String> names) {
        this.pythonVersion = pythonVersion;
        Set<String> all = new HashSet<>(names);
        all.addAll(KEYWORD_CONSTANTS);
        this.names = Set.copyOf(all);
    }

    /**
     * Loads the embedded table from the classpath.
     */
    public static BuiltinNames loadDefault() {
        try (InputStream is = BuiltinNames.class.getResourceAsStream(DEFAULT_TABLE)) {
            if (is == null) {
                throw new IllegalStateException("Builtin name table not found: " + DEFAULT_TABLE);
            }
            return load(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load builtin name table", e);
        }
    }

    /**
     * Loads a table from YAML with keys {@code pythonVersion} and {@code names}.
     */
    public static BuiltinNames load(InputStream is) {
        Yaml yaml = new Yaml();
        Map<String, Object> data = yaml.load(is);
        if (data == null) {
            data = Map.of();
        }
        Object version = data.get("pythonVersion");
        Set<String> names = new HashSet<>();
        if (data.get("names") instanceof Collection<?> list) {
            for (Object item : list) {
                if (item instanceof String s && !s.isBlank()) {
                    names.add(s.trim());
                }
            }
        }
        return new BuiltinNames(version != null ? version.toString() : "unknown", names);
    }

    /**
     * Returns a table that also contains the given names.
     */
    public BuiltinNames withExtra(Collection<String> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        Set<String> merged = new HashSet<>(names);
        for (String name : extra) {
            if (name != null && !name.isBlank()) {
                merged.add(name.trim());
            }
        }
        return new BuiltinNames(pythonVersion, merged);
    }

    public boolean isBuiltin(String name) {
        return names.contains(name);
    }

    public String pythonVersion() {
        return pythonVersion;
    }

    public int size() {
        return names.size();
    }
}
