package com.modelspec.expr.ast;

import lombok.NonNull;
import lombok.Value;

@Value
public class SymbolExpr implements Expr {

    @NonNull
    String name;

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toSource() {
        return name;
    }
}
