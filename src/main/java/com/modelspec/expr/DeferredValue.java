package com.modelspec.expr;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.modelspec.expr.ast.Expr;
import com.modelspec.expr.ast.LiteralExpr;

/**
 * A value that is either already concrete ({@link Literal}) or an unevaluated
 * expression paired with the environment it was captured in ({@link Expression}).
 *
 * Nothing is evaluated until {@link #resolve(Map)} is called with the symbols that
 * only exist at fit or prediction time, such as {@code new_data} or {@code object}.
 */
public abstract class DeferredValue {

    DeferredValue() {
    }

    public static DeferredValue literal(Object value) {
        return new Literal(value);
    }

    /**
     * Defers {@code source}, capturing an empty environment (built-in functions only).
     */
    public static DeferredValue expression(String source) {
        return expression(source, Environment.empty());
    }

    public static DeferredValue expression(String source, Environment environment) {
        return of(ExpressionParser.parse(source), environment);
    }

    public static DeferredValue of(Expr expr, Environment environment) {
        Objects.requireNonNull(expr, "expr");
        Objects.requireNonNull(environment, "environment");
        if (expr instanceof LiteralExpr literal) {
            return new Literal(literal.getValue());
        }
        return new Expression(expr, environment);
    }

    /**
     * Wraps a raw argument value; values that are already deferred are returned as is.
     */
    public static DeferredValue wrap(Object value) {
        if (value instanceof DeferredValue deferred) {
            return deferred;
        }
        return literal(value);
    }

    public abstract boolean isLiteral();

    /**
     * Evaluates the value against {@code bindings}.
     *
     * @throws com.modelspec.exception.UnresolvedSymbolException if a referenced symbol is
     *         bound neither in {@code bindings} nor in the captured environment
     */
    public abstract Object resolve(Map<String, ?> bindings);

    public Object resolve() {
        return resolve(Map.of());
    }

    /**
     * Free symbols referenced by the value.
     */
    public abstract Set<String> symbols();

    public abstract String source();

    @Override
    public String toString() {
        return source();
    }

    public static final class Literal extends DeferredValue {

        private final Object value;

        private Literal(Object value) {
            this.value = value;
        }

        public Object getValue() {
            return value;
        }

        @Override
        public boolean isLiteral() {
            return true;
        }

        @Override
        public Object resolve(Map<String, ?> bindings) {
            return value;
        }

        @Override
        public Set<String> symbols() {
            return Set.of();
        }

        @Override
        public String source() {
            return new LiteralExpr(value).toSource();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Literal other && Objects.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(value);
        }
    }

    public static final class Expression extends DeferredValue {

        private final Expr expr;
        private final Environment environment;

        private Expression(Expr expr, Environment environment) {
            this.expr = expr;
            this.environment = environment;
        }

        public Expr getExpr() {
            return expr;
        }

        public Environment getEnvironment() {
            return environment;
        }

        @Override
        public boolean isLiteral() {
            return false;
        }

        @Override
        public Object resolve(Map<String, ?> bindings) {
            return new ExpressionEvaluator(bindings, environment).evaluate(expr);
        }

        @Override
        public Set<String> symbols() {
            SymbolCollector collector = new SymbolCollector();
            expr.accept(collector);
            return Collections.unmodifiableSet(collector.getSymbols());
        }

        @Override
        public String source() {
            return expr.toSource();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Expression other && expr.equals(other.expr) && environment == other.environment;
        }

        @Override
        public int hashCode() {
            return Objects.hash(expr, System.identityHashCode(environment));
        }
    }
}
