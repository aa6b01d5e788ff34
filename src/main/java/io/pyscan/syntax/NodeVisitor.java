package io.pyscan.syntax;

/**
 * Visitor over every variant of the syntax model.
 *
 * @param <R> result type
 * @param <P> parameter threaded through the traversal (e.g. the current scope)
 */
public interface NodeVisitor<R, P> {

    R visitModule(Module node, P param);

    R visitFunctionDef(Stmt.FunctionDef node, P param);

    R visitClassDef(Stmt.ClassDef node, P param);

    R visitReturn(Stmt.Return node, P param);

    R visitDelete(Stmt.Delete node, P param);

    R visitAssign(Stmt.Assign node, P param);

    R visitAugAssign(Stmt.AugAssign node, P param);

    R visitAnnAssign(Stmt.AnnAssign node, P param);

    R visitFor(Stmt.For node, P param);

    R visitWhile(Stmt.While node, P param);

    R visitIf(Stmt.If node, P param);

    R visitWith(Stmt.With node, P param);

    R visitTry(Stmt.Try node, P param);

    R visitMatch(Stmt.Match node, P param);

    R visitRaise(Stmt.Raise node, P param);

    R visitAssert(Stmt.Assert node, P param);

    R visitImport(Stmt.Import node, P param);

    R visitImportFrom(Stmt.ImportFrom node, P param);

    R visitGlobal(Stmt.Global node, P param);

    R visitExprStmt(Stmt.ExprStmt node, P param);

    R visitSimple(Stmt.Simple node, P param);

    R visitUnsupported(Stmt.Unsupported node, P param);

    R visitName(Expr.Name node, P param);

    R visitConstant(Expr.Constant node, P param);

    R visitBinOp(Expr.BinOp node, P param);

    R visitUnaryOp(Expr.UnaryOp node, P param);

    R visitBoolOp(Expr.BoolOp node, P param);

    R visitCompare(Expr.Compare node, P param);

    R visitCall(Expr.Call node, P param);

    R visitAttribute(Expr.Attribute node, P param);

    R visitSubscript(Expr.Subscript node, P param);

    R visitSlice(Expr.Slice node, P param);

    R visitSequence(Expr.Sequence node, P param);

    R visitDict(Expr.Dict node, P param);

    R visitStarred(Expr.Starred node, P param);

    R visitLambda(Expr.Lambda node, P param);

    R visitComprehension(Expr.Comprehension node, P param);

    R visitDictComprehension(Expr.DictComprehension node, P param);

    R visitIfExp(Expr.IfExp node, P param);

    R visitNamedExpr(Expr.NamedExpr node, P param);

    R visitAwait(Expr.Await node, P param);

    R visitYield(Expr.Yield node, P param);

    R visitFormattedString(Expr.FormattedString node, P param);

    R visitUnsupported(Expr.Unsupported node, P param);
}
