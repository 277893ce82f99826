package com.modelspec.expr.ast;

import java.util.List;
import java.util.stream.Collectors;

import lombok.NonNull;
import lombok.Value;

@Value
public class ListExpr implements Expr {

    @NonNull
    List<Expr> elements;

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toSource() {
        return elements.stream().map(Expr::toSource).collect(Collectors.joining(", ", "[", "]"));
    }
}
