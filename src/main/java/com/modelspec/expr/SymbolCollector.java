package com.modelspec.expr;

import java.util.LinkedHashSet;
import java.util.Set;

import com.modelspec.expr.ast.BinaryExpr;
import com.modelspec.expr.ast.CallExpr;
import com.modelspec.expr.ast.ExprVisitor;
import com.modelspec.expr.ast.ListExpr;
import com.modelspec.expr.ast.LiteralExpr;
import com.modelspec.expr.ast.MemberExpr;
import com.modelspec.expr.ast.NegateExpr;
import com.modelspec.expr.ast.SymbolExpr;

/**
 * Collects the variable symbols an expression references, in first-use order.
 * Function names and member names are not symbols.
 */
class SymbolCollector implements ExprVisitor<Void> {

    private final Set<String> symbols = new LinkedHashSet<>();

    Set<String> getSymbols() {
        return symbols;
    }

    @Override
    public Void visit(LiteralExpr literal) {
        return null;
    }

    @Override
    public Void visit(SymbolExpr symbol) {
        symbols.add(symbol.getName());
        return null;
    }

    @Override
    public Void visit(MemberExpr member) {
        return member.getTarget().accept(this);
    }

    @Override
    public Void visit(CallExpr call) {
        call.getArguments().forEach(a -> a.accept(this));
        call.getNamedArguments().values().forEach(a -> a.accept(this));
        return null;
    }

    @Override
    public Void visit(ListExpr list) {
        list.getElements().forEach(e -> e.accept(this));
        return null;
    }

    @Override
    public Void visit(BinaryExpr binary) {
        binary.getLeft().accept(this);
        return binary.getRight().accept(this);
    }

    @Override
    public Void visit(NegateExpr negate) {
        return negate.getOperand().accept(this);
    }
}
