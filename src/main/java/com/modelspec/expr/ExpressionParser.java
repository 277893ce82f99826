package com.modelspec.expr;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelspec.exception.ExpressionParseException;
import com.modelspec.expr.ExpressionToken.TokenType;
import com.modelspec.expr.ast.BinaryExpr;
import com.modelspec.expr.ast.CallExpr;
import com.modelspec.expr.ast.Expr;
import com.modelspec.expr.ast.ListExpr;
import com.modelspec.expr.ast.LiteralExpr;
import com.modelspec.expr.ast.MemberExpr;
import com.modelspec.expr.ast.NegateExpr;
import com.modelspec.expr.ast.SymbolExpr;

/**
 * Recursive-descent parser for argument expressions.
 *
 * Grammar:
 * <pre>
 * expression     := additive
 * additive       := multiplicative (('+' | '-') multiplicative)*
 * multiplicative := unary (('*' | '/') unary)*
 * unary          := '-' unary | postfix
 * postfix        := primary (('.' | '$') IDENTIFIER)*
 * primary        := NUMBER | STRING | TRUE | FALSE | NULL
 *                 | IDENTIFIER [ '(' arguments ')' ]
 *                 | '(' expression ')' | '[' [expression (',' expression)*] ']'
 * arguments      := [argument (',' argument)*]
 * argument       := IDENTIFIER '=' expression | expression
 * </pre>
 *
 * Parsing only: nothing is evaluated here.
 */
public class ExpressionParser {
    private static final Logger log = LoggerFactory.getLogger(ExpressionParser.class);

    private final List<ExpressionToken> tokens;
    private int pos = 0;

    public ExpressionParser(List<ExpressionToken> tokens) {
        this.tokens = tokens;
    }

    /**
     * Tokenize and parse a complete expression.
     */
    public static Expr parse(String source) {
        if (source == null || source.isBlank()) {
            throw new ExpressionParseException("Expression source is empty");
        }
        Expr expr = new ExpressionParser(new ExpressionTokenizer(source).tokenize()).parseExpression();
        log.trace("Parsed expression '{}' as {}", source, expr.toSource());
        return expr;
    }

    public Expr parseExpression() {
        Expr expr = parseAdditive();
        if (!isAtEnd()) {
            ExpressionToken token = peek();
            throw new ExpressionParseException("Unexpected token '" + token.getValue() + "'",
                    token.getLine(), token.getColumn());
        }
        return expr;
    }

    private Expr parseAdditive() {
        Expr left = parseMultiplicative();
        while (!isAtEnd() && peek().isAdditive()) {
            char operator = advance().getValue().charAt(0);
            left = new BinaryExpr(operator, left, parseMultiplicative());
        }
        return left;
    }

    private Expr parseMultiplicative() {
        Expr left = parseUnary();
        while (!isAtEnd() && peek().isMultiplicative()) {
            char operator = advance().getValue().charAt(0);
            left = new BinaryExpr(operator, left, parseUnary());
        }
        return left;
    }

    private Expr parseUnary() {
        if (check(TokenType.MINUS)) {
            advance();
            Expr operand = parseUnary();
            if (operand instanceof LiteralExpr literal && literal.getValue() instanceof Number) {
                return new LiteralExpr(negate((Number) literal.getValue()));
            }
            return new NegateExpr(operand);
        }
        return parsePostfix();
    }

    private Expr parsePostfix() {
        Expr expr = parsePrimary();
        while (!isAtEnd() && peek().isMemberAccess()) {
            advance();
            String member = expect(TokenType.IDENTIFIER).getValue();
            expr = new MemberExpr(expr, member);
        }
        return expr;
    }

    private Expr parsePrimary() {
        ExpressionToken token = peek();

        switch (token.getType()) {
            case NUMBER:
                advance();
                return new LiteralExpr(parseNumber(token));
            case STRING:
                advance();
                return new LiteralExpr(token.getValue());
            case TRUE:
                advance();
                return new LiteralExpr(Boolean.TRUE);
            case FALSE:
                advance();
                return new LiteralExpr(Boolean.FALSE);
            case NULL:
                advance();
                return new LiteralExpr(null);
            case IDENTIFIER:
                advance();
                if (check(TokenType.LPAREN)) {
                    return parseCall(token.getValue());
                }
                return new SymbolExpr(token.getValue());
            case LPAREN:
                advance();
                Expr inner = parseAdditive();
                expect(TokenType.RPAREN);
                return inner;
            case LBRACKET:
                return parseList();
            default:
                throw new ExpressionParseException("Expected a value but found '" + token.getValue() + "'",
                        token.getLine(), token.getColumn());
        }
    }

    private Expr parseCall(String function) {
        expect(TokenType.LPAREN);
        CallExpr.CallExprBuilder call = CallExpr.builder().function(function);

        if (!check(TokenType.RPAREN)) {
            do {
                if (check(TokenType.IDENTIFIER) && peekNext().getType() == TokenType.EQUALS) {
                    String name = advance().getValue();
                    advance();
                    call.namedArgument(name, parseAdditive());
                } else {
                    call.argument(parseAdditive());
                }
            } while (match(TokenType.COMMA));
        }

        expect(TokenType.RPAREN);
        return call.build();
    }

    private Expr parseList() {
        expect(TokenType.LBRACKET);
        List<Expr> elements = new ArrayList<>();
        if (!check(TokenType.RBRACKET)) {
            do {
                elements.add(parseAdditive());
            } while (match(TokenType.COMMA));
        }
        expect(TokenType.RBRACKET);
        return new ListExpr(List.copyOf(elements));
    }

    private static Number parseNumber(ExpressionToken token) {
        String text = token.getValue();
        try {
            if (text.contains(".") || text.contains("e") || text.contains("E")) {
                return Double.parseDouble(text);
            }
            long value = Long.parseLong(text);
            if (value <= Integer.MAX_VALUE) {
                return (int) value;
            }
            return value;
        } catch (NumberFormatException e) {
            throw new ExpressionParseException("Malformed number '" + text + "'", token.getLine(), token.getColumn());
        }
    }

    private static Number negate(Number n) {
        if (n instanceof Integer i) return -i;
        if (n instanceof Long l) return -l;
        return -n.doubleValue();
    }

    private boolean isAtEnd() {
        return peek().getType() == TokenType.EOF;
    }

    private ExpressionToken peek() {
        return tokens.get(pos);
    }

    private ExpressionToken peekNext() {
        return pos + 1 < tokens.size() ? tokens.get(pos + 1) : tokens.get(tokens.size() - 1);
    }

    private ExpressionToken previous() {
        return tokens.get(pos - 1);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().getType() == type;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private ExpressionToken advance() {
        if (!isAtEnd()) pos++;
        return previous();
    }

    private ExpressionToken expect(TokenType type) {
        if (check(type)) {
            return advance();
        }
        throw new ExpressionParseException("Expected " + type + " but found " + peek().getType(),
                peek().getLine(), peek().getColumn());
    }
}
