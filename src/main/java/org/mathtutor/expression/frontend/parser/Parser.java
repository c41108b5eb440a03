package org.mathtutor.expression.frontend.parser;

import org.mathtutor.expression.api.ParseException;
import org.mathtutor.expression.api.SourceSpan;
import org.mathtutor.expression.diagnostics.DiagnosticsEngine;
import org.mathtutor.expression.frontend.lexer.Token;
import org.mathtutor.expression.frontend.lexer.TokenType;
import org.mathtutor.expression.frontend.parser.ast.AstNode;
import org.mathtutor.expression.frontend.parser.ast.BinaryNode;
import org.mathtutor.expression.frontend.parser.ast.BinaryOperator;
import org.mathtutor.expression.frontend.parser.ast.NumberNode;
import org.mathtutor.expression.frontend.parser.ast.PowerNode;
import org.mathtutor.expression.frontend.parser.ast.UnaryNode;
import org.mathtutor.expression.frontend.parser.ast.VariableNode;

import java.util.List;

/**
 * A recursive-descent parser for arithmetic expressions. It consumes the tokens
 * produced by the {@link org.mathtutor.expression.frontend.lexer.Lexer} and builds an
 * Abstract Syntax Tree (AST).
 * <p>
 * Grammar, from lowest to highest precedence:
 * <pre>
 *   Expression → Term (('+' | '-') Term)*
 *   Term       → Factor (('*' | '/') Factor)*
 *   Factor     → '-' Factor | Power
 *   Power      → Atom ('^' exponent)?
 *   Atom       → NUMBER | VARIABLE | '(' Expression ')'
 * </pre>
 * Binary operators are left-associative. Negation sits above {@code Power}, so
 * {@code -x^2} parses as {@code -(x^2)}.
 * A parser instance parses a single token list and is not thread-safe.
 */
public class Parser {

    /** Deepest nesting of parentheses and negations accepted before parsing fails. */
    public static final int MAX_NESTING_DEPTH = 500;

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final double defaultExponent;
    private int current = 0;
    private int depth = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The tokens to parse, terminated by an EOF token.
     * @param diagnostics The engine for reporting the parse error.
     * @param defaultExponent The exponent used when '^' is not followed by a number.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, double defaultExponent) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.defaultExponent = defaultExponent;
    }

    /**
     * Parses the whole token list as a single expression.
     * @return The root of the AST.
     * @throws ParseException if the tokens do not form exactly one expression.
     */
    public AstNode parse() throws ParseException {
        AstNode result = expression();
        if (!isAtEnd()) {
            throw error("Unexpected token: " + peek().text(), peek());
        }
        return result;
    }

    // Expression → Term (('+' | '-') Term)*
    private AstNode expression() throws ParseException {
        AstNode left = term();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            BinaryOperator operator = previous().type() == TokenType.PLUS ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
            AstNode right = term();
            left = new BinaryNode(operator, left, right, cover(left, right));
        }
        return left;
    }

    // Term → Factor (('*' | '/') Factor)*
    private AstNode term() throws ParseException {
        AstNode left = factor();
        while (match(TokenType.MULTIPLY, TokenType.DIVIDE)) {
            BinaryOperator operator = previous().type() == TokenType.MULTIPLY ? BinaryOperator.MULTIPLY : BinaryOperator.DIVIDE;
            AstNode right = factor();
            left = new BinaryNode(operator, left, right, cover(left, right));
        }
        return left;
    }

    // Factor → '-' Factor | Power
    private AstNode factor() throws ParseException {
        // Every nested '-' and '(' passes through here.
        if (++depth > MAX_NESTING_DEPTH) {
            throw error("Expression is nested too deeply", peek());
        }
        try {
            if (match(TokenType.MINUS)) {
                Token minus = previous();
                AstNode operand = factor();
                return new UnaryNode(operand, new SourceSpan(minus.span().start(), operand.span().end()));
            }
            return power();
        } finally {
            depth--;
        }
    }

    // Power → Atom ('^' exponent)?
    private AstNode power() throws ParseException {
        AstNode base = atom();
        if (!match(TokenType.POWER)) {
            return base;
        }

        if (match(TokenType.NUMBER)) {
            Token exponent = previous();
            return new PowerNode(base, exponent.value(), new SourceSpan(base.span().start(), exponent.span().end()));
        }
        if (match(TokenType.MINUS) && match(TokenType.NUMBER)) {
            Token exponent = previous();
            return new PowerNode(base, -exponent.value(), new SourceSpan(base.span().start(), exponent.span().end()));
        }
        // No literal after '^': fall back to the default exponent instead of failing.
        return new PowerNode(base, defaultExponent, base.span());
    }

    // Atom → NUMBER | VARIABLE | '(' Expression ')'
    private AstNode atom() throws ParseException {
        if (match(TokenType.NUMBER)) {
            Token number = previous();
            return new NumberNode(number.value(), number.span());
        }

        if (match(TokenType.VARIABLE)) {
            Token variable = previous();
            return new VariableNode(variable.text(), variable.span());
        }

        if (match(TokenType.LPAREN)) {
            Token open = previous();
            AstNode inner = expression();
            Token close = consume(TokenType.RPAREN, "Expected ')' after expression");
            // The group is highlighted together with its parentheses.
            return inner.withSpan(new SourceSpan(open.span().start(), close.span().end()));
        }

        Token unexpected = peek();
        String found = unexpected.type() == TokenType.EOF ? "end of input" : unexpected.text();
        throw error("Unexpected token: " + found, unexpected);
    }

    private SourceSpan cover(AstNode left, AstNode right) {
        return new SourceSpan(left.span().start(), right.span().end());
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private Token consume(TokenType type, String errorMessage) throws ParseException {
        if (check(type)) return advance();
        throw error(errorMessage, peek());
    }

    private ParseException error(String message, Token at) {
        int position = at.span().start();
        diagnostics.reportError(message, position);
        return new ParseException(message, position);
    }
}
