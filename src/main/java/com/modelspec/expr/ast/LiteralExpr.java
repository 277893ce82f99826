package com.modelspec.expr.ast;

import lombok.Value;

/**
 * A constant: number, string, boolean or null.
 */
@Value
public class LiteralExpr implements Expr {

    Object value;

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toSource() {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Boolean b) {
            return b ? "TRUE" : "FALSE";
        }
        if (value instanceof String s) {
            return "\"" + s.replace("\"", "\\\"") + "\"";
        }
        return String.valueOf(value);
    }
}
