package org.mathtutor.expression.api;

import org.mathtutor.expression.analysis.PartType;
import org.mathtutor.expression.analysis.SimplificationOpportunity;
import org.mathtutor.expression.diagnostics.DiagnosticsEngine;
import org.mathtutor.expression.evaluation.EvalResult;
import org.mathtutor.expression.frontend.lexer.Token;
import org.mathtutor.expression.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * Defines the public interface of the expression engine: tokenizing, parsing,
 * evaluating, simplifying, printing and analyzing algebraic expressions.
 * <p>
 * Only parsing can fail. Every other operation accepts {@code null} and degrades to an
 * empty or unchanged result.
 */
public interface IExpressionEngine {

    /**
     * Splits an expression into tokens. Unrecognized characters are skipped.
     * @param input The raw expression text.
     * @return The tokens, always ending with a single EOF token.
     */
    List<Token> tokenize(String input);

    /**
     * Splits an expression into tokens, reporting each skipped character as a warning.
     * @param input The raw expression text.
     * @param diagnostics The sink for skipped-character warnings.
     * @return The tokens, always ending with a single EOF token.
     */
    List<Token> tokenize(String input, DiagnosticsEngine diagnostics);

    /**
     * Parses an expression.
     * @param input The raw expression text.
     * @return The root of the expression tree.
     * @throws ParseException if the tokens do not form an expression.
     */
    AstNode parse(String input) throws ParseException;

    /**
     * Parses an expression, returning {@code null} instead of failing.
     * @param input The raw expression text.
     * @return The root of the expression tree, or {@code null} if the input is not an expression.
     */
    AstNode tryParse(String input);

    /**
     * @param node The tree to evaluate.
     * @return The numeric value, or the tree itself if it does not fold to a number.
     */
    EvalResult evaluate(AstNode node);

    /**
     * @param node The tree to evaluate.
     * @return The numeric value, or {@code null} if the tree does not fold to a number.
     */
    Double tryEvaluate(AstNode node);

    /**
     * @param node The tree to simplify.
     * @return A simplified copy of the tree.
     */
    AstNode simplify(AstNode node);

    /**
     * @param node The tree to print.
     * @return The display text of the tree, with minimal parentheses.
     */
    String astToString(AstNode node);

    /**
     * @param node An expression.
     * @return The like terms and reducible fractions in the expression.
     */
    List<SimplificationOpportunity> analyzeExpression(AstNode node);

    /**
     * @param numerator The numerator of a fraction.
     * @param denominator The denominator of a fraction.
     * @return The common factors of both sides, then the opportunities of each side.
     */
    List<SimplificationOpportunity> analyzeFraction(AstNode numerator, AstNode denominator);

    /**
     * Parses and evaluates an expression.
     * @param input The raw expression text.
     * @return The numeric value, or {@code null} if the input does not parse or does not fold.
     */
    Double evaluateString(String input);

    /**
     * Parses, simplifies and prints an expression.
     * @param input The raw expression text.
     * @return The simplified display text, or the input unchanged if it does not parse.
     */
    String simplifyString(String input);

    /**
     * @param span A location in the source of the given part.
     * @param opportunities The opportunities of the exercise.
     * @param part The part the location belongs to.
     * @return {@code true} if any opportunity covers the location.
     */
    boolean isSpanHighlighted(SourceSpan span, List<SimplificationOpportunity> opportunities, PartType part);

    /**
     * @param span A location in the source of the given part.
     * @param opportunities The opportunities of the exercise.
     * @param part The part the location belongs to.
     * @return The opportunities covering the location.
     */
    List<SimplificationOpportunity> getOpportunitiesAtSpan(SourceSpan span,
                                                           List<SimplificationOpportunity> opportunities,
                                                           PartType part);
}
