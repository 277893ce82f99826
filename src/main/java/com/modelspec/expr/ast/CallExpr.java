package com.modelspec.expr.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Function call with positional and named arguments, e.g. {@code f(x, n = 2)}.
 */
@Value
@Builder
public class CallExpr implements Expr {

    @NonNull
    String function;

    @NonNull
    @Singular("argument")
    List<Expr> arguments;

    /**
     * Named arguments in call order.
     */
    @NonNull
    @Singular("namedArgument")
    Map<String, Expr> namedArguments;

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toSource() {
        List<String> parts = new ArrayList<>();
        arguments.forEach(a -> parts.add(a.toSource()));
        namedArguments.forEach((name, a) -> parts.add(name + " = " + a.toSource()));
        return function + "(" + String.join(", ", parts) + ")";
    }
}
