package com.modelspec.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.modelspec.exception.ExpressionParseException;
import com.modelspec.expr.ExpressionToken.TokenType;

/**
 * Tokenizer for argument expressions such as {@code as_matrix(new_data)} or
 * {@code model_fit.spec.args.penalty}.
 */
public class ExpressionTokenizer {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
        "TRUE", TokenType.TRUE,
        "FALSE", TokenType.FALSE,
        "NULL", TokenType.NULL
    );

    private static final Map<Character, TokenType> PUNCTUATION = Map.ofEntries(
        Map.entry('(', TokenType.LPAREN),
        Map.entry(')', TokenType.RPAREN),
        Map.entry('[', TokenType.LBRACKET),
        Map.entry(']', TokenType.RBRACKET),
        Map.entry(',', TokenType.COMMA),
        Map.entry('.', TokenType.DOT),
        Map.entry('$', TokenType.DOLLAR),
        Map.entry('=', TokenType.EQUALS),
        Map.entry('+', TokenType.PLUS),
        Map.entry('-', TokenType.MINUS),
        Map.entry('*', TokenType.STAR),
        Map.entry('/', TokenType.SLASH)
    );

    private final String source;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    public ExpressionTokenizer(String source) {
        this.source = source;
    }

    /**
     * Tokenize the entire expression. The last token is always EOF.
     */
    public List<ExpressionToken> tokenize() {
        List<ExpressionToken> tokens = new ArrayList<>();

        while (pos < source.length()) {
            skipWhitespace();

            if (pos >= source.length()) {
                break;
            }

            ExpressionToken token = nextToken();
            if (token.getType() == TokenType.UNKNOWN) {
                throw new ExpressionParseException("Unexpected character '" + token.getValue() + "'",
                        token.getLine(), token.getColumn());
            }
            tokens.add(token);
        }

        tokens.add(new ExpressionToken(TokenType.EOF, "", line, column));
        return tokens;
    }

    private void skipWhitespace() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\n') {
                line++;
                column = 1;
                pos++;
            } else if (Character.isWhitespace(c)) {
                column++;
                pos++;
            } else {
                break;
            }
        }
    }

    private ExpressionToken nextToken() {
        char c = source.charAt(pos);
        int startLine = line;
        int startCol = column;

        // A leading dot followed by a digit is a number (.5), otherwise member access
        if (Character.isDigit(c) || (c == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1)))) {
            return readNumber(startLine, startCol);
        }

        if (c == '\'' || c == '"') {
            return readStringLiteral(c, startLine, startCol);
        }

        if (Character.isLetter(c) || c == '_') {
            return readIdentifierOrKeyword(startLine, startCol);
        }

        TokenType punctuation = PUNCTUATION.get(c);
        pos++;
        column++;
        if (punctuation != null) {
            return new ExpressionToken(punctuation, String.valueOf(c), startLine, startCol);
        }
        return new ExpressionToken(TokenType.UNKNOWN, String.valueOf(c), startLine, startCol);
    }

    private ExpressionToken readStringLiteral(char quote, int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        pos++; // Skip opening quote
        column++;

        while (pos < source.length()) {
            char c = source.charAt(pos);
            pos++;
            column++;
            if (c == quote) {
                return new ExpressionToken(TokenType.STRING, sb.toString(), startLine, startCol);
            }
            if (c == '\\' && pos < source.length()) {
                sb.append(source.charAt(pos));
                pos++;
                column++;
            } else if (c == '\n') {
                break;
            } else {
                sb.append(c);
            }
        }

        throw new ExpressionParseException("Unterminated string literal", startLine, startCol);
    }

    private ExpressionToken readNumber(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        boolean seenDot = false;
        boolean seenExponent = false;

        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isDigit(c)) {
                sb.append(c);
            } else if (c == '.' && !seenDot && !seenExponent) {
                seenDot = true;
                sb.append(c);
            } else if ((c == 'e' || c == 'E') && !seenExponent) {
                seenExponent = true;
                sb.append(c);
                if (pos + 1 < source.length() && (source.charAt(pos + 1) == '-' || source.charAt(pos + 1) == '+')) {
                    pos++;
                    column++;
                    sb.append(source.charAt(pos));
                }
            } else {
                break;
            }
            pos++;
            column++;
        }

        return new ExpressionToken(TokenType.NUMBER, sb.toString(), startLine, startCol);
    }

    private ExpressionToken readIdentifierOrKeyword(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();

        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_') {
                sb.append(c);
                pos++;
                column++;
            } else {
                break;
            }
        }

        String value = sb.toString();
        TokenType keywordType = KEYWORDS.get(value);
        if (keywordType != null) {
            return new ExpressionToken(keywordType, value, startLine, startCol);
        }
        return new ExpressionToken(TokenType.IDENTIFIER, value, startLine, startCol);
    }
}
