package io.pyscan.detectors;

import io.pyscan.scope.BuiltinNames;
import io.pyscan.syntax.Module;
import io.pyscan.syntax.SourceText;

import java.util.Objects;

/**
 * Everything a detector needs to inspect one parsed source file.
 *
 * @param tree     Parsed module
 * @param source   Source the tree was parsed from, used for snippets
 * @param builtins Names that are never reported as undefined
 */
public record AnalysisContext(Module tree, SourceText source, BuiltinNames builtins) {

    public AnalysisContext {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(builtins, "builtins");
    }
}
