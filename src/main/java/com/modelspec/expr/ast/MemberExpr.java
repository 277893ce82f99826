package com.modelspec.expr.ast;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code target.member}; {@code target$member} parses to the same node.
 */
@Value
public class MemberExpr implements Expr {

    @NonNull
    Expr target;

    @NonNull
    String member;

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toSource() {
        return target.toSource() + "." + member;
    }
}
