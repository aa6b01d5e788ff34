package io.pyscan.syntax;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Converts an error-free tree-sitter-python tree into {@link Module}.
 * Node kinds it does not know become {@code Unsupported} nodes instead of failing the conversion.
 */
class TreeConverter {

    private static final Logger log = LoggerFactory.getLogger(TreeConverter.class);

    private final SourceText source;

    TreeConverter(SourceText source) {
        this.source = source;
    }

    Module convertModule(TSNode root) {
        List<Stmt> body = new ArrayList<>();
        for (TSNode child : namedChildren(root)) {
            body.add(stmt(child));
        }
        return new Module(body, span(root));
    }

    // ---------------------------------------------------------------- statements

    private List<Stmt> block(TSNode node) {
        if (node == null) {
            return List.of();
        }
        if (!"block".equals(node.getType())) {
            return List.of(stmt(node));
        }
        List<Stmt> result = new ArrayList<>();
        for (TSNode child : namedChildren(node)) {
            result.add(stmt(child));
        }
        return result;
    }

    private Stmt stmt(TSNode n) {
        return switch (n.getType()) {
            case "expression_statement" -> expressionStatement(n);
            case "function_definition" -> functionDef(n, List.of());
            case "class_definition" -> classDef(n, List.of());
            case "decorated_definition" -> decorated(n);
            case "if_statement" -> ifStatement(n);
            case "for_statement" -> new Stmt.For(
                    expr(field(n, "left")),
                    expr(field(n, "right")),
                    block(field(n, "body")),
                    elseBody(field(n, "alternative")),
                    hasChildOfType(n, "async"),
                    span(n));
            case "while_statement" -> new Stmt.While(
                    expr(field(n, "condition")),
                    block(field(n, "body")),
                    elseBody(field(n, "alternative")),
                    span(n));
            case "with_statement" -> withStatement(n);
            case "try_statement" -> tryStatement(n);
            case "match_statement" -> matchStatement(n);
            case "import_statement" -> new Stmt.Import(aliases(n), span(n));
            case "import_from_statement" -> importFrom(n);
            case "future_import_statement" -> new Stmt.ImportFrom("__future__", aliases(n), false, span(n));
            case "return_statement" -> new Stmt.Return(expr(firstNamed(n)), span(n));
            case "delete_statement" -> new Stmt.Delete(elementsOf(firstNamed(n)), span(n));
            case "raise_statement" -> raise(n);
            case "assert_statement" -> assertStatement(n);
            case "global_statement" -> new Stmt.Global(identifiers(n), false, span(n));
            case "nonlocal_statement" -> new Stmt.Global(identifiers(n), true, span(n));
            case "pass_statement", "break_statement", "continue_statement" -> new Stmt.Simple(text(n), span(n));
            default -> {
                log.trace("No model for statement node '{}' at line {}", n.getType(), line(n));
                yield new Stmt.Unsupported(n.getType(), span(n));
            }
        };
    }

    private Stmt expressionStatement(TSNode n) {
        List<TSNode> children = namedChildren(n);
        if (children.size() == 1) {
            TSNode only = children.get(0);
            if ("assignment".equals(only.getType())) {
                return assignment(only, span(n));
            }
            if ("augmented_assignment".equals(only.getType())) {
                return augmentedAssignment(only, span(n));
            }
            return new Stmt.ExprStmt(expr(only), span(n));
        }
        return new Stmt.ExprStmt(new Expr.Sequence(Expr.Sequence.Kind.TUPLE, exprs(children), span(n)), span(n));
    }

    private Stmt assignment(TSNode n, Span span) {
        TSNode annotation = field(n, "type");
        if (annotation != null) {
            return new Stmt.AnnAssign(expr(field(n, "left")), expr(annotation), expr(field(n, "right")), span);
        }
        List<Expr> targets = new ArrayList<>();
        targets.add(expr(field(n, "left")));
        TSNode right = field(n, "right");
        while (right != null && "assignment".equals(right.getType()) && field(right, "type") == null) {
            targets.add(expr(field(right, "left")));
            right = field(right, "right");
        }
        return new Stmt.Assign(targets, expr(right), span);
    }

    private Stmt augmentedAssignment(TSNode n, Span span) {
        TSNode operator = field(n, "operator");
        return Expr.BinOp.Op.fromToken(operator != null ? text(operator) : "")
                .<Stmt>map(op -> new Stmt.AugAssign(expr(field(n, "left")), op, expr(field(n, "right")), span))
                .orElseGet(() -> new Stmt.Unsupported(n.getType(), span));
    }

    private Stmt decorated(TSNode n) {
        List<Expr> decorators = new ArrayList<>();
        for (TSNode child : namedChildren(n)) {
            if ("decorator".equals(child.getType())) {
                decorators.add(expr(firstNamed(child)));
            }
        }
        TSNode definition = field(n, "definition");
        if (definition == null) {
            return new Stmt.Unsupported(n.getType(), span(n));
        }
        return switch (definition.getType()) {
            case "function_definition" -> functionDef(definition, decorators, span(n));
            case "class_definition" -> classDef(definition, decorators, span(n));
            default -> new Stmt.Unsupported(definition.getType(), span(n));
        };
    }

    private Stmt functionDef(TSNode n, List<Expr> decorators) {
        return functionDef(n, decorators, span(n));
    }

    private Stmt functionDef(TSNode n, List<Expr> decorators, Span span) {
        return new Stmt.FunctionDef(
                text(field(n, "name")),
                parameters(field(n, "parameters")),
                decorators,
                expr(field(n, "return_type")),
                block(field(n, "body")),
                hasChildOfType(n, "async"),
                span);
    }

    private Stmt classDef(TSNode n, List<Expr> decorators) {
        return classDef(n, decorators, span(n));
    }

    private Stmt classDef(TSNode n, List<Expr> decorators, Span span) {
        List<Expr> bases = new ArrayList<>();
        List<Expr.Keyword> keywords = new ArrayList<>();
        TSNode superclasses = field(n, "superclasses");
        if (superclasses != null) {
            collectArguments(superclasses, bases, keywords);
        }
        return new Stmt.ClassDef(text(field(n, "name")), bases, keywords, decorators, block(field(n, "body")), span);
    }

    private Stmt ifStatement(TSNode n) {
        List<TSNode> alternatives = new ArrayList<>();
        for (TSNode child : namedChildren(n)) {
            if ("elif_clause".equals(child.getType()) || "else_clause".equals(child.getType())) {
                alternatives.add(child);
            }
        }
        return new Stmt.If(
                expr(field(n, "condition")),
                block(field(n, "consequence")),
                alternativeChain(alternatives, 0),
                span(n));
    }

    private List<Stmt> alternativeChain(List<TSNode> alternatives, int index) {
        if (index >= alternatives.size()) {
            return List.of();
        }
        TSNode clause = alternatives.get(index);
        if ("else_clause".equals(clause.getType())) {
            return elseBody(clause);
        }
        return List.of(new Stmt.If(
                expr(field(clause, "condition")),
                block(field(clause, "consequence")),
                alternativeChain(alternatives, index + 1),
                span(clause)));
    }

    private List<Stmt> elseBody(TSNode elseClause) {
        if (elseClause == null) {
            return List.of();
        }
        TSNode body = field(elseClause, "body");
        return block(body != null ? body : firstOfType(elseClause, "block"));
    }

    private Stmt withStatement(TSNode n) {
        List<Stmt.WithItem> items = new ArrayList<>();
        TSNode clause = firstOfType(n, "with_clause");
        if (clause != null) {
            for (TSNode item : namedChildren(clause)) {
                if ("with_item".equals(item.getType())) {
                    items.add(withItem(item));
                }
            }
        }
        return new Stmt.With(items, block(field(n, "body")), hasChildOfType(n, "async"), span(n));
    }

    private Stmt.WithItem withItem(TSNode item) {
        TSNode value = field(item, "value");
        if (value == null) {
            value = firstNamed(item);
        }
        TSNode alias = field(item, "alias");
        if (alias != null) {
            return new Stmt.WithItem(expr(value), expr(unwrapAsTarget(alias)));
        }
        if (value != null && "as_pattern".equals(value.getType())) {
            return new Stmt.WithItem(expr(firstNamed(value)), expr(asPatternTarget(value)));
        }
        return new Stmt.WithItem(expr(value), null);
    }

    private Stmt tryStatement(TSNode n) {
        List<Stmt.ExceptHandler> handlers = new ArrayList<>();
        List<Stmt> orElse = List.of();
        List<Stmt> finalBody = List.of();
        for (TSNode child : namedChildren(n)) {
            switch (child.getType()) {
                case "except_clause", "except_group_clause" -> handlers.add(exceptHandler(child));
                case "else_clause" -> orElse = elseBody(child);
                case "finally_clause" -> finalBody = block(firstOfType(child, "block"));
                default -> {
                }
            }
        }
        return new Stmt.Try(block(field(n, "body")), handlers, orElse, finalBody, span(n));
    }

    private Stmt.ExceptHandler exceptHandler(TSNode n) {
        TSNode body = null;
        List<TSNode> parts = new ArrayList<>();
        for (TSNode child : namedChildren(n)) {
            if ("block".equals(child.getType())) {
                body = child;
            } else {
                parts.add(child);
            }
        }
        Expr type = null;
        String name = null;
        if (!parts.isEmpty()) {
            TSNode first = parts.get(0);
            if ("as_pattern".equals(first.getType())) {
                type = expr(firstNamed(first));
                TSNode target = asPatternTarget(first);
                name = target != null ? text(target) : null;
            } else {
                type = expr(first);
                if (parts.size() > 1) {
                    name = text(unwrapAsTarget(parts.get(1)));
                }
            }
        }
        return new Stmt.ExceptHandler(type, name, block(body), span(n));
    }

    private Stmt matchStatement(TSNode n) {
        List<TSNode> subjects = childrenWithField(n, "subject");
        Expr subject = subjects.size() == 1
                ? expr(subjects.get(0))
                : new Expr.Sequence(Expr.Sequence.Kind.TUPLE, exprs(subjects), span(n));
        TSNode body = field(n, "body");
        List<Stmt.MatchCase> cases = new ArrayList<>();
        for (TSNode child : namedChildren(body != null ? body : n)) {
            if ("case_clause".equals(child.getType())) {
                cases.add(matchCase(child));
            }
        }
        return new Stmt.Match(subject, cases, span(n));
    }

    private Stmt.MatchCase matchCase(TSNode n) {
        List<Expr> reads = new ArrayList<>();
        List<Expr.Name> captures = new ArrayList<>();
        TSNode guard = field(n, "guard");
        TSNode consequence = field(n, "consequence");
        for (TSNode child : namedChildren(n)) {
            switch (child.getType()) {
                case "if_clause" -> guard = guard != null ? guard : child;
                case "block" -> consequence = consequence != null ? consequence : child;
                default -> collectPattern(child, reads, captures);
            }
        }
        Expr guardExpr = guard != null ? expr(firstNamed(guard)) : null;
        return new Stmt.MatchCase(reads, captures, guardExpr, block(consequence), span(n));
    }

    /**
     * Splits a case pattern into value reads and capture names.
     * A bare name captures; a dotted name is a value pattern and reads its first segment.
     */
    private void collectPattern(TSNode n, List<Expr> reads, List<Expr.Name> captures) {
        switch (n.getType()) {
            case "identifier" -> capture(n, captures);
            case "dotted_name" -> {
                List<TSNode> parts = namedChildren(n);
                if (parts.size() == 1) {
                    capture(parts.get(0), captures);
                } else {
                    reads.add(dottedName(n));
                }
            }
            case "class_pattern" -> {
                List<TSNode> parts = namedChildren(n);
                for (int i = 0; i < parts.size(); i++) {
                    TSNode part = parts.get(i);
                    if (i == 0 && "dotted_name".equals(part.getType())) {
                        reads.add(dottedName(part));
                    } else {
                        collectPattern(part, reads, captures);
                    }
                }
            }
            case "keyword_pattern" -> {
                List<TSNode> parts = namedChildren(n);
                // the leading identifier is an attribute name, not a binding
                for (int i = 1; i < parts.size(); i++) {
                    collectPattern(parts.get(i), reads, captures);
                }
            }
            case "string", "concatenated_string", "integer", "float", "true", "false", "none",
                    "complex_pattern" -> {
            }
            default -> {
                for (TSNode child : namedChildren(n)) {
                    collectPattern(child, reads, captures);
                }
            }
        }
    }

    private void capture(TSNode identifier, List<Expr.Name> captures) {
        String name = text(identifier);
        if (!name.isEmpty() && !"_".equals(name)) {
            captures.add(new Expr.Name(name, span(identifier)));
        }
    }

    private Expr dottedName(TSNode n) {
        List<TSNode> parts = namedChildren(n);
        Expr result = new Expr.Name(text(parts.get(0)), span(parts.get(0)));
        for (int i = 1; i < parts.size(); i++) {
            result = new Expr.Attribute(result, text(parts.get(i)), span(n));
        }
        return result;
    }

    private Stmt importFrom(TSNode n) {
        TSNode module = field(n, "module_name");
        boolean wildcard = hasChildOfType(n, "wildcard_import");
        return new Stmt.ImportFrom(module != null ? text(module) : "", aliases(n), wildcard, span(n));
    }

    private List<Stmt.Alias> aliases(TSNode n) {
        List<Stmt.Alias> result = new ArrayList<>();
        for (TSNode name : childrenWithField(n, "name")) {
            if ("aliased_import".equals(name.getType())) {
                TSNode alias = field(name, "alias");
                result.add(new Stmt.Alias(text(field(name, "name")), alias != null ? text(alias) : null));
            } else {
                result.add(new Stmt.Alias(text(name), null));
            }
        }
        return result;
    }

    private Stmt raise(TSNode n) {
        List<TSNode> parts = namedChildren(n);
        Expr exception = parts.isEmpty() ? null : expr(parts.get(0));
        Expr cause = parts.size() > 1 && hasChildOfType(n, "from") ? expr(parts.get(parts.size() - 1)) : null;
        return new Stmt.Raise(exception, cause, span(n));
    }

    private Stmt assertStatement(TSNode n) {
        List<TSNode> parts = namedChildren(n);
        Expr test = parts.isEmpty() ? null : expr(parts.get(0));
        Expr message = parts.size() > 1 ? expr(parts.get(1)) : null;
        return new Stmt.Assert(test, message, span(n));
    }

    private List<String> identifiers(TSNode n) {
        List<String> names = new ArrayList<>();
        for (TSNode child : namedChildren(n)) {
            names.add(text(child));
        }
        return names;
    }

    // ---------------------------------------------------------------- expressions

    private List<Expr> exprs(List<TSNode> nodes) {
        List<Expr> result = new ArrayList<>(nodes.size());
        for (TSNode node : nodes) {
            result.add(expr(node));
        }
        return result;
    }

    private Expr expr(TSNode n) {
        if (n == null) {
            return null;
        }
        return switch (n.getType()) {
            case "identifier", "keyword_identifier" -> new Expr.Name(text(n), span(n));
            case "integer" -> number(n, Expr.Constant.Kind.INT);
            case "float" -> number(n, Expr.Constant.Kind.FLOAT);
            case "true" -> new Expr.Constant(Expr.Constant.Kind.TRUE, text(n), span(n));
            case "false" -> new Expr.Constant(Expr.Constant.Kind.FALSE, text(n), span(n));
            case "none" -> new Expr.Constant(Expr.Constant.Kind.NONE, text(n), span(n));
            case "ellipsis" -> new Expr.Constant(Expr.Constant.Kind.ELLIPSIS, text(n), span(n));
            case "string", "concatenated_string" -> string(n);
            case "binary_operator" -> binaryOperator(n);
            case "unary_operator" -> unaryOperator(n);
            case "not_operator" -> new Expr.UnaryOp(Expr.UnaryOp.Op.NOT, expr(field(n, "argument")), span(n));
            case "boolean_operator" -> booleanOperator(n);
            case "comparison_operator" -> comparison(n);
            case "call" -> call(n);
            case "attribute" -> new Expr.Attribute(expr(field(n, "object")), text(field(n, "attribute")), span(n));
            case "subscript" -> subscript(n);
            case "slice" -> slice(n);
            case "parenthesized_expression", "type", "as_pattern_target" -> expr(firstNamed(n));
            case "tuple", "expression_list", "pattern_list", "tuple_pattern" ->
                    new Expr.Sequence(Expr.Sequence.Kind.TUPLE, exprs(namedChildren(n)), span(n));
            case "list", "list_pattern" ->
                    new Expr.Sequence(Expr.Sequence.Kind.LIST, exprs(namedChildren(n)), span(n));
            case "set" -> new Expr.Sequence(Expr.Sequence.Kind.SET, exprs(namedChildren(n)), span(n));
            case "dictionary" -> dictionary(n);
            case "list_splat", "list_splat_pattern", "dictionary_splat", "dictionary_splat_pattern" ->
                    new Expr.Starred(expr(firstNamed(n)), span(n));
            case "list_comprehension" -> comprehension(n, Expr.Comprehension.Kind.LIST);
            case "set_comprehension" -> comprehension(n, Expr.Comprehension.Kind.SET);
            case "generator_expression" -> comprehension(n, Expr.Comprehension.Kind.GENERATOR);
            case "dictionary_comprehension" -> dictComprehension(n);
            case "lambda" -> new Expr.Lambda(parameters(field(n, "parameters")), expr(field(n, "body")), span(n));
            case "conditional_expression" -> conditional(n);
            case "named_expression" -> namedExpression(n);
            case "await" -> new Expr.Await(expr(firstNamed(n)), span(n));
            case "yield" -> new Expr.Yield(expr(firstNamed(n)), hasChildOfType(n, "from"), span(n));
            default -> {
                log.trace("No model for expression node '{}' at line {}", n.getType(), line(n));
                yield new Expr.Unsupported(n.getType(), span(n));
            }
        };
    }

    private Expr number(TSNode n, Expr.Constant.Kind kind) {
        String literal = text(n);
        char last = literal.isEmpty() ? ' ' : literal.charAt(literal.length() - 1);
        Expr.Constant.Kind actual = (last == 'j' || last == 'J') ? Expr.Constant.Kind.COMPLEX : kind;
        return new Expr.Constant(actual, literal, span(n));
    }

    private Expr string(TSNode n) {
        List<Expr> interpolated = new ArrayList<>();
        collectInterpolations(n, interpolated);
        if (interpolated.isEmpty()) {
            return new Expr.Constant(Expr.Constant.Kind.STRING, text(n), span(n));
        }
        return new Expr.FormattedString(interpolated, span(n));
    }

    private void collectInterpolations(TSNode n, List<Expr> out) {
        for (TSNode child : namedChildren(n)) {
            if ("interpolation".equals(child.getType())) {
                TSNode expression = field(child, "expression");
                if (expression == null) {
                    expression = firstNamed(child);
                }
                if (expression != null) {
                    out.add(expr(expression));
                }
                TSNode spec = firstOfType(child, "format_specifier");
                if (spec != null) {
                    collectInterpolations(spec, out);
                }
            } else if ("string".equals(child.getType())) {
                collectInterpolations(child, out);
            }
        }
    }

    /**
     * Builds a left-associative chain such as {@code 1 + 2 + ... + n} bottom-up along its left spine,
     * so chain length does not consume Java stack.
     */
    private Expr binaryOperator(TSNode n) {
        Deque<TSNode> chain = leftSpine(n, "binary_operator");
        Expr result = expr(field(chain.peek(), "left"));
        while (!chain.isEmpty()) {
            TSNode node = chain.pop();
            TSNode operator = field(node, "operator");
            Optional<Expr.BinOp.Op> op = Expr.BinOp.Op.fromToken(operator != null ? text(operator) : "");
            result = op.isPresent()
                    ? new Expr.BinOp(result, op.get(), expr(field(node, "right")), span(node))
                    : new Expr.Unsupported(node.getType(), span(node));
        }
        return result;
    }

    private Expr unaryOperator(TSNode n) {
        TSNode operator = field(n, "operator");
        return Expr.UnaryOp.Op.fromToken(operator != null ? text(operator) : "")
                .<Expr>map(op -> new Expr.UnaryOp(op, expr(field(n, "argument")), span(n)))
                .orElseGet(() -> new Expr.Unsupported(n.getType(), span(n)));
    }

    private Expr booleanOperator(TSNode n) {
        Deque<TSNode> chain = leftSpine(n, "boolean_operator");
        Expr result = expr(field(chain.peek(), "left"));
        while (!chain.isEmpty()) {
            TSNode node = chain.pop();
            TSNode operator = field(node, "operator");
            Expr.BoolOp.Op op = operator != null && "or".equals(text(operator)) ? Expr.BoolOp.Op.OR : Expr.BoolOp.Op.AND;
            Expr right = expr(field(node, "right"));
            result = result != null && right != null
                    ? new Expr.BoolOp(op, List.of(result, right), span(node))
                    : new Expr.Unsupported(node.getType(), span(node));
        }
        return result;
    }

    /**
     * Returns the nodes of the given type along the left spine, innermost on top.
     */
    private static Deque<TSNode> leftSpine(TSNode n, String type) {
        Deque<TSNode> chain = new ArrayDeque<>();
        TSNode current = n;
        while (current != null && type.equals(current.getType())) {
            chain.push(current);
            current = field(current, "left");
        }
        return chain;
    }

    private Expr comparison(TSNode n) {
        List<Expr> operands = new ArrayList<>();
        List<Expr.Compare.Op> ops = new ArrayList<>();
        StringBuilder pending = new StringBuilder();
        for (int i = 0; i < n.getChildCount(); i++) {
            TSNode child = n.getChild(i);
            if (child == null || child.isNull() || isComment(child)) {
                continue;
            }
            if (child.isNamed()) {
                if (!operands.isEmpty()) {
                    var op = Expr.Compare.Op.fromToken(pending.toString());
                    if (op.isEmpty()) {
                        return new Expr.Unsupported(n.getType(), span(n));
                    }
                    ops.add(op.get());
                }
                pending.setLength(0);
                operands.add(expr(child));
            } else {
                pending.append(' ').append(text(child));
            }
        }
        if (operands.size() < 2) {
            return new Expr.Unsupported(n.getType(), span(n));
        }
        return new Expr.Compare(operands.get(0), ops, operands.subList(1, operands.size()), span(n));
    }

    private Expr call(TSNode n) {
        List<Expr> args = new ArrayList<>();
        List<Expr.Keyword> keywords = new ArrayList<>();
        TSNode arguments = field(n, "arguments");
        if (arguments != null) {
            if ("generator_expression".equals(arguments.getType())) {
                args.add(expr(arguments));
            } else {
                collectArguments(arguments, args, keywords);
            }
        }
        return new Expr.Call(expr(field(n, "function")), args, keywords, span(n));
    }

    private void collectArguments(TSNode argumentList, List<Expr> args, List<Expr.Keyword> keywords) {
        for (TSNode arg : namedChildren(argumentList)) {
            switch (arg.getType()) {
                case "keyword_argument" -> keywords.add(
                        new Expr.Keyword(text(field(arg, "name")), expr(field(arg, "value"))));
                case "dictionary_splat" -> keywords.add(new Expr.Keyword(null, expr(firstNamed(arg))));
                default -> args.add(expr(arg));
            }
        }
    }

    private Expr subscript(TSNode n) {
        List<TSNode> parts = childrenWithField(n, "subscript");
        Expr slice;
        if (parts.size() == 1) {
            slice = expr(parts.get(0));
        } else {
            slice = new Expr.Sequence(Expr.Sequence.Kind.TUPLE, exprs(parts), span(n));
        }
        return new Expr.Subscript(expr(field(n, "value")), slice, span(n));
    }

    private Expr slice(TSNode n) {
        Expr[] parts = new Expr[3];
        int index = 0;
        for (int i = 0; i < n.getChildCount(); i++) {
            TSNode child = n.getChild(i);
            if (child == null || child.isNull() || isComment(child)) {
                continue;
            }
            if (!child.isNamed()) {
                if (":".equals(child.getType()) && index < 2) {
                    index++;
                }
            } else {
                parts[index] = expr(child);
            }
        }
        return new Expr.Slice(parts[0], parts[1], parts[2], span(n));
    }

    private Expr dictionary(TSNode n) {
        List<Expr.DictEntry> entries = new ArrayList<>();
        for (TSNode child : namedChildren(n)) {
            if ("pair".equals(child.getType())) {
                entries.add(new Expr.DictEntry(expr(field(child, "key")), expr(field(child, "value"))));
            } else if ("dictionary_splat".equals(child.getType())) {
                entries.add(new Expr.DictEntry(null, expr(firstNamed(child))));
            }
        }
        return new Expr.Dict(entries, span(n));
    }

    private Expr comprehension(TSNode n, Expr.Comprehension.Kind kind) {
        return new Expr.Comprehension(kind, expr(field(n, "body")), generators(n), span(n));
    }

    private Expr dictComprehension(TSNode n) {
        TSNode pair = field(n, "body");
        Expr key = pair != null ? expr(field(pair, "key")) : null;
        Expr value = pair != null ? expr(field(pair, "value")) : null;
        return new Expr.DictComprehension(key, value, generators(n), span(n));
    }

    private List<Expr.Generator> generators(TSNode n) {
        List<Expr.Generator> result = new ArrayList<>();
        Expr target = null;
        Expr iter = null;
        boolean async = false;
        List<Expr> ifs = new ArrayList<>();
        for (TSNode child : namedChildren(n)) {
            if ("for_in_clause".equals(child.getType())) {
                if (target != null) {
                    result.add(new Expr.Generator(target, iter, ifs, async));
                    ifs = new ArrayList<>();
                }
                target = expr(field(child, "left"));
                List<TSNode> right = childrenWithField(child, "right");
                iter = right.size() == 1
                        ? expr(right.get(0))
                        : new Expr.Sequence(Expr.Sequence.Kind.TUPLE, exprs(right), span(child));
                async = hasChildOfType(child, "async");
            } else if ("if_clause".equals(child.getType())) {
                ifs.add(expr(firstNamed(child)));
            }
        }
        if (target != null) {
            result.add(new Expr.Generator(target, iter, ifs, async));
        }
        return result;
    }

    private Expr conditional(TSNode n) {
        List<TSNode> parts = namedChildren(n);
        if (parts.size() != 3) {
            return new Expr.Unsupported(n.getType(), span(n));
        }
        return new Expr.IfExp(expr(parts.get(1)), expr(parts.get(0)), expr(parts.get(2)), span(n));
    }

    private Expr namedExpression(TSNode n) {
        TSNode name = field(n, "name");
        if (name == null) {
            return new Expr.Unsupported(n.getType(), span(n));
        }
        return new Expr.NamedExpr(new Expr.Name(text(name), span(name)), expr(field(n, "value")), span(n));
    }

    private List<Expr> elementsOf(TSNode n) {
        if (n == null) {
            return List.of();
        }
        if ("expression_list".equals(n.getType())) {
            return exprs(namedChildren(n));
        }
        return List.of(expr(n));
    }

    // ---------------------------------------------------------------- parameters

    private List<Parameter> parameters(TSNode n) {
        if (n == null) {
            return List.of();
        }
        List<Parameter> result = new ArrayList<>();
        boolean keywordOnly = false;
        for (TSNode p : namedChildren(n)) {
            Parameter.Kind positional = keywordOnly ? Parameter.Kind.KEYWORD_ONLY : Parameter.Kind.POSITIONAL;
            switch (p.getType()) {
                case "identifier" -> result.add(new Parameter(text(p), positional, null, null));
                case "default_parameter" -> addNamed(result, field(p, "name"), positional, null, field(p, "value"));
                case "typed_default_parameter" ->
                        addNamed(result, field(p, "name"), positional, field(p, "type"), field(p, "value"));
                case "typed_parameter" -> {
                    TSNode target = firstNamed(p);
                    TSNode type = field(p, "type");
                    if (target != null && "list_splat_pattern".equals(target.getType())) {
                        addNamed(result, firstNamed(target), Parameter.Kind.VAR_POSITIONAL, type, null);
                        keywordOnly = true;
                    } else if (target != null && "dictionary_splat_pattern".equals(target.getType())) {
                        addNamed(result, firstNamed(target), Parameter.Kind.VAR_KEYWORD, type, null);
                    } else {
                        addNamed(result, target, positional, type, null);
                    }
                }
                case "list_splat_pattern" -> {
                    addNamed(result, firstNamed(p), Parameter.Kind.VAR_POSITIONAL, null, null);
                    keywordOnly = true;
                }
                case "dictionary_splat_pattern" ->
                        addNamed(result, firstNamed(p), Parameter.Kind.VAR_KEYWORD, null, null);
                case "keyword_separator" -> keywordOnly = true;
                default -> log.trace("Skipping parameter node '{}' at line {}", p.getType(), line(p));
            }
        }
        return result;
    }

    private void addNamed(List<Parameter> out, TSNode name, Parameter.Kind kind, TSNode type, TSNode value) {
        if (name == null || !"identifier".equals(name.getType())) {
            return;
        }
        out.add(new Parameter(text(name), kind, expr(type), expr(value)));
    }

    // ---------------------------------------------------------------- helpers

    private TSNode asPatternTarget(TSNode asPattern) {
        TSNode alias = field(asPattern, "alias");
        if (alias == null) {
            List<TSNode> parts = namedChildren(asPattern);
            alias = parts.size() > 1 ? parts.get(parts.size() - 1) : null;
        }
        return alias == null ? null : unwrapAsTarget(alias);
    }

    private TSNode unwrapAsTarget(TSNode node) {
        if ("as_pattern_target".equals(node.getType())) {
            TSNode inner = firstNamed(node);
            return inner != null ? inner : node;
        }
        return node;
    }

    private static TSNode field(TSNode n, String name) {
        TSNode child = n.getChildByFieldName(name);
        return child == null || child.isNull() ? null : child;
    }

    private static List<TSNode> childrenWithField(TSNode n, String name) {
        List<TSNode> result = new ArrayList<>();
        for (int i = 0; i < n.getChildCount(); i++) {
            if (name.equals(n.getFieldNameForChild(i))) {
                TSNode child = n.getChild(i);
                if (child != null && !child.isNull()) {
                    result.add(child);
                }
            }
        }
        return result;
    }

    private static List<TSNode> namedChildren(TSNode n) {
        List<TSNode> result = new ArrayList<>();
        for (int i = 0; i < n.getNamedChildCount(); i++) {
            TSNode child = n.getNamedChild(i);
            if (child != null && !child.isNull() && !isComment(child)) {
                result.add(child);
            }
        }
        return result;
    }

    private static TSNode firstNamed(TSNode n) {
        List<TSNode> children = namedChildren(n);
        return children.isEmpty() ? null : children.get(0);
    }

    private static TSNode firstOfType(TSNode n, String type) {
        for (TSNode child : namedChildren(n)) {
            if (type.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    private static boolean hasChildOfType(TSNode n, String type) {
        for (int i = 0; i < n.getChildCount(); i++) {
            TSNode child = n.getChild(i);
            if (child != null && !child.isNull() && type.equals(child.getType())) {
                return true;
            }
        }
        return false;
    }

    private static boolean isComment(TSNode n) {
        return "comment".equals(n.getType());
    }

    private static int line(TSNode n) {
        return n.getStartPoint().getRow() + 1;
    }

    private String text(TSNode n) {
        return n == null ? "" : source.slice(n.getStartByte(), n.getEndByte());
    }

    private Span span(TSNode n) {
        return new Span(line(n), n.getStartByte(), n.getEndByte());
    }
}
