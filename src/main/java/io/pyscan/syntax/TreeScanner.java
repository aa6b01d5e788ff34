package io.pyscan.syntax;

import java.util.List;

/**
 * Visitor that walks every child of every node in source field order.
 * Subclasses override the variants they care about and call {@code super} to keep descending.
 * {@link #scan(Node, Object)} is the single entry point for every node, so overriding it
 * sees the whole tree in pre-order.
 *
 * @param <P> parameter threaded through the traversal
 */
public abstract class TreeScanner<P> implements NodeVisitor<Void, P> {

    public void scan(Node node, P param) {
        if (node != null) {
            node.accept(this, param);
        }
    }

    public void scan(List<? extends Node> nodes, P param) {
        for (Node node : nodes) {
            scan(node, param);
        }
    }

    protected void scanParameters(List<Parameter> params, P param) {
        for (Parameter parameter : params) {
            scan(parameter.annotation(), param);
            scan(parameter.defaultValue(), param);
        }
    }

    protected void scanGenerator(Expr.Generator generator, P param) {
        scan(generator.target(), param);
        scan(generator.iter(), param);
        scan(generator.ifs(), param);
    }

    protected void scanHandler(Stmt.ExceptHandler handler, P param) {
        scan(handler.type(), param);
        scan(handler.body(), param);
    }

    protected void scanCase(Stmt.MatchCase matchCase, P param) {
        scan(matchCase.reads(), param);
        scan(matchCase.captures(), param);
        scan(matchCase.guard(), param);
        scan(matchCase.body(), param);
    }

    protected void scanKeywords(List<Expr.Keyword> keywords, P param) {
        for (Expr.Keyword keyword : keywords) {
            scan(keyword.value(), param);
        }
    }

    @Override
    public Void visitModule(Module node, P param) {
        scan(node.body(), param);
        return null;
    }

    @Override
    public Void visitFunctionDef(Stmt.FunctionDef node, P param) {
        scan(node.decorators(), param);
        scanParameters(node.params(), param);
        scan(node.returns(), param);
        scan(node.body(), param);
        return null;
    }

    @Override
    public Void visitClassDef(Stmt.ClassDef node, P param) {
        scan(node.decorators(), param);
        scan(node.bases(), param);
        scanKeywords(node.keywords(), param);
        scan(node.body(), param);
        return null;
    }

    @Override
    public Void visitReturn(Stmt.Return node, P param) {
        scan(node.value(), param);
        return null;
    }

    @Override
    public Void visitDelete(Stmt.Delete node, P param) {
        scan(node.targets(), param);
        return null;
    }

    @Override
    public Void visitAssign(Stmt.Assign node, P param) {
        scan(node.targets(), param);
        scan(node.value(), param);
        return null;
    }

    @Override
    public Void visitAugAssign(Stmt.AugAssign node, P param) {
        scan(node.target(), param);
        scan(node.value(), param);
        return null;
    }

    @Override
    public Void visitAnnAssign(Stmt.AnnAssign node, P param) {
        scan(node.target(), param);
        scan(node.annotation(), param);
        scan(node.value(), param);
        return null;
    }

    @Override
    public Void visitFor(Stmt.For node, P param) {
        scan(node.target(), param);
        scan(node.iter(), param);
        scan(node.body(), param);
        scan(node.orElse(), param);
        return null;
    }

    @Override
    public Void visitWhile(Stmt.While node, P param) {
        scan(node.test(), param);
        scan(node.body(), param);
        scan(node.orElse(), param);
        return null;
    }

    @Override
    public Void visitIf(Stmt.If node, P param) {
        scan(node.test(), param);
        scan(node.body(), param);
        scan(node.orElse(), param);
        return null;
    }

    @Override
    public Void visitWith(Stmt.With node, P param) {
        for (Stmt.WithItem item : node.items()) {
            scan(item.context(), param);
            scan(item.target(), param);
        }
        scan(node.body(), param);
        return null;
    }

    @Override
    public Void visitTry(Stmt.Try node, P param) {
        scan(node.body(), param);
        for (Stmt.ExceptHandler handler : node.handlers()) {
            scanHandler(handler, param);
        }
        scan(node.orElse(), param);
        scan(node.finalBody(), param);
        return null;
    }

    @Override
    public Void visitMatch(Stmt.Match node, P param) {
        scan(node.subject(), param);
        for (Stmt.MatchCase matchCase : node.cases()) {
            scanCase(matchCase, param);
        }
        return null;
    }

    @Override
    public Void visitRaise(Stmt.Raise node, P param) {
        scan(node.exception(), param);
        scan(node.cause(), param);
        return null;
    }

    @Override
    public Void visitAssert(Stmt.Assert node, P param) {
        scan(node.test(), param);
        scan(node.message(), param);
        return null;
    }

    @Override
    public Void visitImport(Stmt.Import node, P param) {
        return null;
    }

    @Override
    public Void visitImportFrom(Stmt.ImportFrom node, P param) {
        return null;
    }

    @Override
    public Void visitGlobal(Stmt.Global node, P param) {
        return null;
    }

    @Override
    public Void visitExprStmt(Stmt.ExprStmt node, P param) {
        scan(node.value(), param);
        return null;
    }

    @Override
    public Void visitSimple(Stmt.Simple node, P param) {
        return null;
    }

    @Override
    public Void visitUnsupported(Stmt.Unsupported node, P param) {
        return null;
    }

    @Override
    public Void visitName(Expr.Name node, P param) {
        return null;
    }

    @Override
    public Void visitConstant(Expr.Constant node, P param) {
        return null;
    }

    @Override
    public Void visitBinOp(Expr.BinOp node, P param) {
        scan(node.left(), param);
        scan(node.right(), param);
        return null;
    }

    @Override
    public Void visitUnaryOp(Expr.UnaryOp node, P param) {
        scan(node.operand(), param);
        return null;
    }

    @Override
    public Void visitBoolOp(Expr.BoolOp node, P param) {
        scan(node.values(), param);
        return null;
    }

    @Override
    public Void visitCompare(Expr.Compare node, P param) {
        scan(node.left(), param);
        scan(node.comparators(), param);
        return null;
    }

    @Override
    public Void visitCall(Expr.Call node, P param) {
        scan(node.func(), param);
        scan(node.args(), param);
        scanKeywords(node.keywords(), param);
        return null;
    }

    @Override
    public Void visitAttribute(Expr.Attribute node, P param) {
        scan(node.value(), param);
        return null;
    }

    @Override
    public Void visitSubscript(Expr.Subscript node, P param) {
        scan(node.value(), param);
        scan(node.slice(), param);
        return null;
    }

    @Override
    public Void visitSlice(Expr.Slice node, P param) {
        scan(node.lower(), param);
        scan(node.upper(), param);
        scan(node.step(), param);
        return null;
    }

    @Override
    public Void visitSequence(Expr.Sequence node, P param) {
        scan(node.elements(), param);
        return null;
    }

    @Override
    public Void visitDict(Expr.Dict node, P param) {
        for (Expr.DictEntry entry : node.entries()) {
            scan(entry.key(), param);
            scan(entry.value(), param);
        }
        return null;
    }

    @Override
    public Void visitStarred(Expr.Starred node, P param) {
        scan(node.value(), param);
        return null;
    }

    @Override
    public Void visitLambda(Expr.Lambda node, P param) {
        scanParameters(node.params(), param);
        scan(node.body(), param);
        return null;
    }

    @Override
    public Void visitComprehension(Expr.Comprehension node, P param) {
        scan(node.element(), param);
        for (Expr.Generator generator : node.generators()) {
            scanGenerator(generator, param);
        }
        return null;
    }

    @Override
    public Void visitDictComprehension(Expr.DictComprehension node, P param) {
        scan(node.key(), param);
        scan(node.value(), param);
        for (Expr.Generator generator : node.generators()) {
            scanGenerator(generator, param);
        }
        return null;
    }

    @Override
    public Void visitIfExp(Expr.IfExp node, P param) {
        scan(node.test(), param);
        scan(node.body(), param);
        scan(node.orElse(), param);
        return null;
    }

    @Override
    public Void visitNamedExpr(Expr.NamedExpr node, P param) {
        scan(node.target(), param);
        scan(node.value(), param);
        return null;
    }

    @Override
    public Void visitAwait(Expr.Await node, P param) {
        scan(node.value(), param);
        return null;
    }

    @Override
    public Void visitYield(Expr.Yield node, P param) {
        scan(node.value(), param);
        return null;
    }

    @Override
    public Void visitFormattedString(Expr.FormattedString node, P param) {
        scan(node.values(), param);
        return null;
    }

    @Override
    public Void visitUnsupported(Expr.Unsupported node, P param) {
        return null;
    }
}
