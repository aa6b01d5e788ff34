package io.pyscan.syntax;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Parses Python source with tree-sitter and converts the concrete tree into the analyzer's syntax model.
 * <p>
 * Tree-sitter recovers from more input than CPython accepts, so a clean tree is additionally
 * checked for Python 2 statements, inconsistent statement indentation and bracket nesting
 * beyond CPython's limit. All checks walk the tree with an explicit stack.
 * <p>
 * A new tree-sitter parser is created per call, so one instance can be shared between threads.
 */
public class PythonParser {

    private static final Logger log = LoggerFactory.getLogger(PythonParser.class);

    /**
     * CPython's tokenizer limit on open brackets.
     */
    public static final int MAX_BRACKET_DEPTH = 200;

    static final String INVALID_SYNTAX = "invalid syntax";
    static final String UNEXPECTED_INDENT = "unexpected indent";
    static final String TOO_MANY_PARENS = "too many nested parentheses";
    static final String TOO_DEEP = "maximum recursion depth exceeded during compilation";
    static final String MISSING_PRINT_PARENS = "Missing parentheses in call to 'print'. Did you mean print(...)?";
    static final String MISSING_EXEC_PARENS = "Missing parentheses in call to 'exec'. Did you mean exec(...)?";

    public ParseOutcome parse(String source) {
        SourceText text = SourceText.of(source);

        TSParser parser = new TSParser();
        parser.setLanguage(new TreeSitterPython());
        TSTree tree = parser.parseString(null, text.text());
        TSNode root = tree.getRootNode();

        Optional<ParseOutcome.Failure> failure = findFailure(root, text);
        if (failure.isPresent()) {
            ParseOutcome.Failure f = failure.get();
            log.debug("Parse failed at line {}: {}", f.line(), f.message());
            return f;
        }

        try {
            Module module = new TreeConverter(text).convertModule(root);
            return new ParseOutcome.Parsed(module, text);
        } catch (StackOverflowError e) {
            log.warn("Source nests too deeply to convert");
            return new ParseOutcome.Failure(null, TOO_DEEP, null);
        }
    }

    private Optional<ParseOutcome.Failure> findFailure(TSNode root, SourceText text) {
        // the tokenizer limit wins over any grammar error, as in CPython
        TSNode deepBracket = firstBracketBeyondLimit(root);
        if (deepBracket != null) {
            return Optional.of(failureAt(deepBracket, TOO_MANY_PARENS, text));
        }

        if (root.hasError()) {
            TSNode problem = firstProblem(root);
            if (problem == null) {
                return Optional.of(new ParseOutcome.Failure(null, INVALID_SYNTAX, null));
            }
            String message = problem.isMissing()
                    ? "expected '" + problem.getType() + "'"
                    : INVALID_SYNTAX;
            return Optional.of(failureAt(problem, message, text));
        }

        // Python 2 statements parse in tree-sitter but not in Python 3.
        TSNode legacy = firstOfType(root, "print_statement", "exec_statement");
        if (legacy != null) {
            String message = "print_statement".equals(legacy.getType()) ? MISSING_PRINT_PARENS : MISSING_EXEC_PARENS;
            return Optional.of(failureAt(legacy, message, text));
        }

        TSNode misindented = firstMisindentedStatement(root, text);
        if (misindented != null) {
            return Optional.of(failureAt(misindented, UNEXPECTED_INDENT, text));
        }
        return Optional.empty();
    }

    private ParseOutcome.Failure failureAt(TSNode node, String message, SourceText text) {
        int line = node.getStartPoint().getRow() + 1;
        String offending = text.line(line).strip();
        return new ParseOutcome.Failure(line, message, offending.isEmpty() ? null : offending);
    }

    /**
     * Returns the first ERROR or MISSING node in document order.
     */
    private TSNode firstProblem(TSNode root) {
        Deque<TSNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            TSNode node = pending.pop();
            if (node == null || node.isNull()) {
                continue;
            }
            if (node.isMissing() || "ERROR".equals(node.getType())) {
                return node;
            }
            if (node.hasError()) {
                pushChildren(node, pending, false);
            }
        }
        return null;
    }

    private TSNode firstOfType(TSNode root, String... types) {
        Deque<TSNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            TSNode node = pending.pop();
            if (node == null || node.isNull()) {
                continue;
            }
            for (String type : types) {
                if (type.equals(node.getType())) {
                    return node;
                }
            }
            pushChildren(node, pending, true);
        }
        return null;
    }

    /**
     * Returns the first opening bracket that exceeds {@link #MAX_BRACKET_DEPTH}, or null.
     * Bracket tokens are the anonymous leaves, so brackets inside string literals do not count.
     */
    private TSNode firstBracketBeyondLimit(TSNode root) {
        Deque<TSNode> pending = new ArrayDeque<>();
        pending.push(root);
        int depth = 0;
        while (!pending.isEmpty()) {
            TSNode node = pending.pop();
            if (node == null || node.isNull()) {
                continue;
            }
            if (node.getChildCount() == 0) {
                switch (node.getType()) {
                    case "(", "[", "{" -> {
                        if (++depth > MAX_BRACKET_DEPTH) {
                            return node;
                        }
                    }
                    case ")", "]", "}" -> depth = Math.max(0, depth - 1);
                    default -> {
                    }
                }
                continue;
            }
            pushChildren(node, pending, false);
        }
        return null;
    }

    /**
     * Returns the first statement that starts a line at a different column than the statements
     * before it in the same module or block, or null.
     * Statements sharing a line with their block header ({@code if x: a = 1}) are not line starts.
     */
    private TSNode firstMisindentedStatement(TSNode root, SourceText text) {
        Deque<TSNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            TSNode node = pending.pop();
            if (node == null || node.isNull()) {
                continue;
            }
            String type = node.getType();
            if ("module".equals(type) || "block".equals(type)) {
                TSNode offending = misindentedChild(node, "module".equals(type), text);
                if (offending != null) {
                    return offending;
                }
            }
            pushChildren(node, pending, true);
        }
        return null;
    }

    private TSNode misindentedChild(TSNode container, boolean module, SourceText text) {
        int expected = module ? 0 : -1;
        boolean first = true;
        for (int i = 0; i < container.getNamedChildCount(); i++) {
            TSNode child = container.getNamedChild(i);
            if (child == null || child.isNull() || "comment".equals(child.getType())) {
                continue;
            }
            int column = child.getStartPoint().getColumn();
            boolean lineStart = startsLine(child, text);
            if (first && !module) {
                // a body on the header line makes every later line start an unexpected indent
                expected = lineStart ? column : Integer.MIN_VALUE;
            } else if (lineStart && column != expected) {
                return child;
            }
            first = false;
        }
        return null;
    }

    private static boolean startsLine(TSNode node, SourceText text) {
        String line = text.line(node.getStartPoint().getRow() + 1);
        int column = node.getStartPoint().getColumn();
        if (column > line.length()) {
            return false;
        }
        return line.substring(0, column).isBlank();
    }

    /**
     * Pushes children so that they pop in document order.
     */
    private static void pushChildren(TSNode node, Deque<TSNode> pending, boolean namedOnly) {
        int count = namedOnly ? node.getNamedChildCount() : node.getChildCount();
        for (int i = count - 1; i >= 0; i--) {
            pending.push(namedOnly ? node.getNamedChild(i) : node.getChild(i));
        }
    }
}
