package com.modelspec.expr;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token from the argument expression tokenizer.
 */
@Data
@AllArgsConstructor
public class ExpressionToken {
    private TokenType type;
    private String value;
    private int line;
    private int column;

    public enum TokenType {
        NUMBER,
        STRING,
        IDENTIFIER,
        TRUE,
        FALSE,
        NULL,
        LPAREN,
        RPAREN,
        LBRACKET,
        RBRACKET,
        COMMA,
        DOT,
        DOLLAR,
        EQUALS,
        PLUS,
        MINUS,
        STAR,
        SLASH,
        EOF,
        UNKNOWN
    }

    public boolean isAdditive() {
        return type == TokenType.PLUS || type == TokenType.MINUS;
    }

    public boolean isMultiplicative() {
        return type == TokenType.STAR || type == TokenType.SLASH;
    }

    public boolean isMemberAccess() {
        return type == TokenType.DOT || type == TokenType.DOLLAR;
    }
}
