package com.modelspec.expr;

import com.modelspec.exception.ExpressionParseException;
import com.modelspec.expr.ast.BinaryExpr;
import com.modelspec.expr.ast.CallExpr;
import com.modelspec.expr.ast.Expr;
import com.modelspec.expr.ast.ListExpr;
import com.modelspec.expr.ast.LiteralExpr;
import com.modelspec.expr.ast.MemberExpr;
import com.modelspec.expr.ast.SymbolExpr;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ExpressionTokenizer and ExpressionParser.
 */
class ExpressionParserTest {

    @Test
    void testParseIntegerAndDecimalLiterals() {
        assertThat(((LiteralExpr) ExpressionParser.parse("42")).getValue()).isEqualTo(42);
        assertThat(((LiteralExpr) ExpressionParser.parse("0.25")).getValue()).isEqualTo(0.25);
        assertThat(((LiteralExpr) ExpressionParser.parse(".5")).getValue()).isEqualTo(0.5);
        assertThat(((LiteralExpr) ExpressionParser.parse("1e-3")).getValue()).isEqualTo(0.001);
    }

    @Test
    void testNegativeNumberFoldsIntoLiteral() {
        Expr expr = ExpressionParser.parse("-3");

        assertThat(expr).isInstanceOf(LiteralExpr.class);
        assertThat(((LiteralExpr) expr).getValue()).isEqualTo(-3);
    }

    @Test
    void testKeywordsAndStrings() {
        assertThat(((LiteralExpr) ExpressionParser.parse("TRUE")).getValue()).isEqualTo(Boolean.TRUE);
        assertThat(((LiteralExpr) ExpressionParser.parse("NULL")).getValue()).isNull();
        assertThat(((LiteralExpr) ExpressionParser.parse("'gaussian'")).getValue()).isEqualTo("gaussian");
        assertThat(((LiteralExpr) ExpressionParser.parse("\"a \\\"b\\\"\"")).getValue()).isEqualTo("a \"b\"");
    }

    @Test
    void testMultiplicationBindsTighterThanAddition() {
        Expr expr = ExpressionParser.parse("a + b * 2");

        assertThat(expr).isInstanceOf(BinaryExpr.class);
        BinaryExpr sum = (BinaryExpr) expr;
        assertThat(sum.getOperator()).isEqualTo('+');
        assertThat(sum.getRight()).isInstanceOf(BinaryExpr.class);
        assertThat(expr.toSource()).isEqualTo("(a + (b * 2))");
    }

    @Test
    void testParenthesesOverridePrecedence() {
        assertThat(ExpressionParser.parse("(a + b) * 2").toSource()).isEqualTo("((a + b) * 2)");
    }

    @Test
    void testMemberAccessChainsWithDotOrDollar() {
        Expr expr = ExpressionParser.parse("model_fit$spec.args.penalty");

        assertThat(expr).isInstanceOf(MemberExpr.class);
        MemberExpr member = (MemberExpr) expr;
        assertThat(member.getMember()).isEqualTo("penalty");
        assertThat(expr.toSource()).isEqualTo("model_fit.spec.args.penalty");
    }

    @Test
    void testCallWithPositionalAndNamedArguments() {
        Expr expr = ExpressionParser.parse("glm_family(x, link = 'log', n = 2)");

        assertThat(expr).isInstanceOf(CallExpr.class);
        CallExpr call = (CallExpr) expr;
        assertThat(call.getFunction()).isEqualTo("glm_family");
        assertThat(call.getArguments()).containsExactly(new SymbolExpr("x"));
        assertThat(call.getNamedArguments()).containsOnlyKeys("link", "n");
        assertThat(expr.toSource()).isEqualTo("glm_family(x, link = \"log\", n = 2)");
    }

    @Test
    void testEmptyCallAndListLiteral() {
        assertThat(((CallExpr) ExpressionParser.parse("f()")).getArguments()).isEmpty();

        Expr list = ExpressionParser.parse("[0.01, 0.1, lambda_max]");
        assertThat(list).isInstanceOf(ListExpr.class);
        assertThat(((ListExpr) list).getElements()).hasSize(3);
    }

    @Test
    void testUnexpectedCharacterReportsPosition() {
        assertThatThrownBy(() -> ExpressionParser.parse("a +\n  b # c"))
                .isInstanceOf(ExpressionParseException.class)
                .hasMessageContaining("Unexpected character '#'")
                .hasMessageContaining("line 2, column 5");
    }

    @ParameterizedTest
    @CsvSource({
            "'1 +', Expected a value",
            "'f(a', Expected",
            "'a b', Unexpected token 'b'",
            "'[1, 2', Expected",
            "'x.', Expected"
    })
    void testMalformedExpressionsAreRejected(String source, String message) {
        assertThatThrownBy(() -> ExpressionParser.parse(source))
                .isInstanceOf(ExpressionParseException.class)
                .hasMessageContaining(message);
    }

    @Test
    void testBlankSourceIsRejected() {
        assertThatThrownBy(() -> ExpressionParser.parse("  "))
                .isInstanceOf(ExpressionParseException.class);
    }
}
