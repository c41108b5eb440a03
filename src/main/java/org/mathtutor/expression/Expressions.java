package org.mathtutor.expression;

import org.mathtutor.expression.analysis.PartType;
import org.mathtutor.expression.analysis.SimplificationOpportunity;
import org.mathtutor.expression.api.ParseException;
import org.mathtutor.expression.api.SourceSpan;
import org.mathtutor.expression.evaluation.EvalResult;
import org.mathtutor.expression.frontend.lexer.Token;
import org.mathtutor.expression.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * Static entry points over an {@link ExpressionEngine} with the default options.
 *
 * @see ExpressionEngine
 */
public final class Expressions {

    private static final ExpressionEngine ENGINE = new ExpressionEngine();

    private Expressions() {}

    public static List<Token> tokenize(String input) {
        return ENGINE.tokenize(input);
    }

    public static AstNode parse(String input) throws ParseException {
        return ENGINE.parse(input);
    }

    public static AstNode tryParse(String input) {
        return ENGINE.tryParse(input);
    }

    public static EvalResult evaluate(AstNode node) {
        return ENGINE.evaluate(node);
    }

    public static Double tryEvaluate(AstNode node) {
        return ENGINE.tryEvaluate(node);
    }

    public static AstNode simplify(AstNode node) {
        return ENGINE.simplify(node);
    }

    public static String astToString(AstNode node) {
        return ENGINE.astToString(node);
    }

    public static List<SimplificationOpportunity> analyzeExpression(AstNode node) {
        return ENGINE.analyzeExpression(node);
    }

    public static List<SimplificationOpportunity> analyzeFraction(AstNode numerator, AstNode denominator) {
        return ENGINE.analyzeFraction(numerator, denominator);
    }

    public static Double evaluateString(String input) {
        return ENGINE.evaluateString(input);
    }

    public static String simplifyString(String input) {
        return ENGINE.simplifyString(input);
    }

    public static boolean isSpanHighlighted(SourceSpan span, List<SimplificationOpportunity> opportunities,
                                            PartType part) {
        return ENGINE.isSpanHighlighted(span, opportunities, part);
    }

    public static List<SimplificationOpportunity> getOpportunitiesAtSpan(SourceSpan span,
                                                                         List<SimplificationOpportunity> opportunities,
                                                                         PartType part) {
        return ENGINE.getOpportunitiesAtSpan(span, opportunities, part);
    }
}
