package org.mathtutor.expression.frontend.lexer;

import org.mathtutor.expression.api.SourceSpan;
import org.mathtutor.expression.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer converts an expression string into a flat sequence of tokens.
 * <p>
 * Tokenization never fails: characters that cannot start a token are skipped and
 * reported as warnings to the {@link DiagnosticsEngine}. The token list always ends
 * with exactly one {@link TokenType#EOF} token.
 * A lexer instance tokenizes a single input and is not thread-safe.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    /**
     * Creates a new Lexer.
     * @param source The expression text. The glyphs '×' and '·' are read as '*' and '÷' as '/'.
     * @param diagnostics The engine for reporting skipped characters.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this.source = normalize(source);
        this.diagnostics = diagnostics;
    }

    /**
     * Replaces the multiplication and division glyphs with their ASCII operators.
     * Every replacement is a single char, so offsets into the result match the original string.
     *
     * @param input The raw input.
     * @return The normalized input.
     */
    public static String normalize(String input) {
        return input
                .replace('×', '*')
                .replace('÷', '/')
                .replace('·', '*');
    }

    /**
     * Performs the tokenization of the entire expression.
     * @return A list of the recognized tokens, terminated by an EOF token.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            skipWhitespace();
            if (isAtEnd()) break;
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, SourceSpan.at(current)));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.MULTIPLY); break;
            case '/': addToken(TokenType.DIVIDE); break;
            case '^': addToken(TokenType.POWER); break;
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            default:
                if (isDigit(c) || (c == '.' && isDigit(peek()))) {
                    number();
                } else if (isLetter(c)) {
                    variable();
                } else {
                    diagnostics.reportWarning("Skipped unrecognized character '" + c + "'", start);
                    LOG.trace("Skipping unrecognized character '{}' at offset {}", c, start);
                }
                break;
        }
    }

    private void number() {
        // The first char was already consumed; a leading '.' is handled by the fraction loop.
        if (previous() != '.') {
            while (isDigit(peek())) advance();
            if (peek() == '.') advance();
        }
        while (isDigit(peek())) advance();

        String text = source.substring(start, current);
        addToken(TokenType.NUMBER, Double.parseDouble(text));

        // "3x": the coefficient is multiplied with the variable that follows.
        if (isLetter(peek())) {
            tokens.add(new Token(TokenType.MULTIPLY, "*", null, SourceSpan.at(current)));
        }
    }

    private void variable() {
        while (isLetter(peek())) advance();
        // Subscripts such as x1, x2
        while (isDigit(peek())) advance();
        addToken(TokenType.VARIABLE);
    }

    private void skipWhitespace() {
        while (!isAtEnd() && isWhitespace(source.charAt(current))) {
            current++;
        }
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Double value) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, value, new SourceSpan(start, current)));
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char previous() {
        return source.charAt(current - 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }
}
