package com.modelspec.expr.ast;

/**
 * Node of a parsed argument expression.
 */
public interface Expr {

    <T> T accept(ExprVisitor<T> visitor);

    /**
     * Source text equivalent of this node.
     */
    String toSource();
}
