package com.modelspec.expr;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.modelspec.data.DataFrame;
import com.modelspec.exception.ModelSpecException;
import com.modelspec.exception.UnresolvedSymbolException;
import com.modelspec.expr.ast.BinaryExpr;
import com.modelspec.expr.ast.CallExpr;
import com.modelspec.expr.ast.Expr;
import com.modelspec.expr.ast.ExprVisitor;
import com.modelspec.expr.ast.ListExpr;
import com.modelspec.expr.ast.LiteralExpr;
import com.modelspec.expr.ast.MemberExpr;
import com.modelspec.expr.ast.NegateExpr;
import com.modelspec.expr.ast.SymbolExpr;

/**
 * Evaluates an expression. Symbols are looked up in the bindings first, then in the
 * captured environment chain.
 */
class ExpressionEvaluator implements ExprVisitor<Object> {

    private final Map<String, ?> bindings;
    private final Environment environment;

    ExpressionEvaluator(Map<String, ?> bindings, Environment environment) {
        this.bindings = bindings;
        this.environment = environment;
    }

    Object evaluate(Expr expr) {
        return expr.accept(this);
    }

    @Override
    public Object visit(LiteralExpr literal) {
        return literal.getValue();
    }

    @Override
    public Object visit(SymbolExpr symbol) {
        String name = symbol.getName();
        if (bindings.containsKey(name)) {
            return bindings.get(name);
        }
        if (environment.defines(name)) {
            return environment.get(name);
        }
        throw new UnresolvedSymbolException(name);
    }

    @Override
    public Object visit(MemberExpr member) {
        Object target = evaluate(member.getTarget());
        String name = member.getMember();

        if (target instanceof Map<?, ?> map) {
            if (!map.containsKey(name)) {
                throw new UnresolvedSymbolException(member.toSource());
            }
            return map.get(name);
        }
        if (target instanceof DataFrame df) {
            if (!df.hasColumn(name)) {
                throw new UnresolvedSymbolException(member.toSource());
            }
            return df.column(name);
        }
        if (target instanceof MemberAccessible accessible) {
            if (!accessible.memberNames().contains(name)) {
                throw new UnresolvedSymbolException(member.toSource());
            }
            return accessible.member(name);
        }
        throw new ModelSpecException("Cannot read member '" + name + "' of a value of type "
                + BuiltinFunctions.typeName(target) + " in " + member.toSource());
    }

    @Override
    public Object visit(CallExpr call) {
        ExprFunction fn = environment.function(call.getFunction())
                .orElseThrow(() -> new UnresolvedSymbolException(call.getFunction() + "()"));

        List<Object> args = new ArrayList<>();
        for (Expr a : call.getArguments()) {
            args.add(evaluate(a));
        }
        Map<String, Object> named = new LinkedHashMap<>();
        call.getNamedArguments().forEach((n, a) -> named.put(n, evaluate(a)));

        return fn.apply(args, named);
    }

    @Override
    public Object visit(ListExpr list) {
        List<Object> values = new ArrayList<>();
        for (Expr e : list.getElements()) {
            values.add(evaluate(e));
        }
        return values;
    }

    @Override
    public Object visit(BinaryExpr binary) {
        Object left = evaluate(binary.getLeft());
        Object right = evaluate(binary.getRight());
        char op = binary.getOperator();

        if (op == '+' && (left instanceof String || right instanceof String)) {
            return String.valueOf(left) + right;
        }
        if (left instanceof Integer l && right instanceof Integer r && op != '/') {
            return switch (op) {
                case '+' -> l + r;
                case '-' -> l - r;
                default -> l * r;
            };
        }
        double l = BuiltinFunctions.toDouble(left);
        double r = BuiltinFunctions.toDouble(right);
        return switch (op) {
            case '+' -> l + r;
            case '-' -> l - r;
            case '*' -> l * r;
            case '/' -> l / r;
            default -> throw new ModelSpecException("Unknown operator " + op);
        };
    }

    @Override
    public Object visit(NegateExpr negate) {
        Object value = evaluate(negate.getOperand());
        if (value instanceof Integer i) {
            return -i;
        }
        return -BuiltinFunctions.toDouble(value);
    }
}
