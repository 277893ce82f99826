package com.modelspec.expr;

import java.util.List;
import java.util.Map;

/**
 * A function callable from an expression.
 */
@FunctionalInterface
public interface ExprFunction {

    Object apply(List<Object> arguments, Map<String, Object> namedArguments);
}
