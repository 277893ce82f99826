package com.modelspec.expr.ast;

/**
 * Visitor pattern interface for traversing expression ASTs.
 */
public interface ExprVisitor<T> {
    T visit(LiteralExpr literal);
    T visit(SymbolExpr symbol);
    T visit(MemberExpr member);
    T visit(CallExpr call);
    T visit(ListExpr list);
    T visit(BinaryExpr binary);
    T visit(NegateExpr negate);
}
