package com.modelspec.expr.ast;

import lombok.NonNull;
import lombok.Value;

/**
 * Arithmetic on two operands. The operator is one of {@code + - * /}.
 */
@Value
public class BinaryExpr implements Expr {

    char operator;

    @NonNull
    Expr left;

    @NonNull
    Expr right;

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toSource() {
        return "(" + left.toSource() + " " + operator + " " + right.toSource() + ")";
    }
}
