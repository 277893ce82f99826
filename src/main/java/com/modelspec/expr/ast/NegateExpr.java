package com.modelspec.expr.ast;

import lombok.NonNull;
import lombok.Value;

@Value
public class NegateExpr implements Expr {

    @NonNull
    Expr operand;

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toSource() {
        return "-" + operand.toSource();
    }
}
