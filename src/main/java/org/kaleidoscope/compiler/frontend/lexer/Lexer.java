package org.kaleidoscope.compiler.frontend.lexer;

import org.kaleidoscope.compiler.frontend.source.CharacterSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.kaleidoscope.compiler.frontend.source.CharacterClass.isAlnum;
import static org.kaleidoscope.compiler.frontend.source.CharacterClass.isAlpha;
import static org.kaleidoscope.compiler.frontend.source.CharacterClass.isDigit;
import static org.kaleidoscope.compiler.frontend.source.CharacterClass.isSpace;

/**
 * The Lexer converts the characters of a {@link CharacterSource} into tokens, one token per
 * call to {@link #nextToken()}.
 * <p>
 * The lexer keeps exactly one character of lookahead between calls: scanning an identifier or
 * a number reads one character past its end, and that character starts the next scan. The
 * lexer never rejects input; every character that is not part of a whitespace run, identifier,
 * number or comment becomes a {@link TokenType#CHARACTER} token. Instances are not thread-safe;
 * each parse session owns its own lexer.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private final CharacterSource source;

    // Primed with a space so the first call fetches from the source.
    private int lastChar = ' ';
    private int line = 1;
    private int column = 0;
    private boolean pendingNewline = false;

    /**
     * Creates a new Lexer.
     * @param source The source of input characters.
     */
    public Lexer(CharacterSource source) {
        this.source = source;
    }

    /**
     * Scans and returns the next token. After the end of input was reached, every call returns
     * an {@link TokenType#END_OF_FILE} token without reading from the source again.
     * @return The next token.
     */
    public Token nextToken() {
        Token token = scan();
        if (LOG.isTraceEnabled()) {
            LOG.trace("Token {} '{}' at {}:{}", token.type(), token.text(), token.line(), token.column());
        }
        return token;
    }

    private Token scan() {
        while (true) {
            while (isSpace(lastChar)) {
                advance();
            }

            int startLine = line;
            int startColumn = column;

            if (isAlpha(lastChar)) {
                return identifier(startLine, startColumn);
            }

            if (isDigit(lastChar) || lastChar == '.') {
                return number(startLine, startColumn);
            }

            if (lastChar == '#') {
                // Comment until end of line.
                do {
                    advance();
                } while (lastChar != CharacterSource.EOF && lastChar != '\n' && lastChar != '\r');

                if (lastChar != CharacterSource.EOF) {
                    continue;
                }
            }

            // Don't eat the end of input.
            if (lastChar == CharacterSource.EOF) {
                return new Token(TokenType.END_OF_FILE, "", 0, line, column);
            }

            char thisChar = (char) lastChar;
            advance();
            return new Token(TokenType.CHARACTER, String.valueOf(thisChar), 0, startLine, startColumn);
        }
    }

    private Token identifier(int startLine, int startColumn) {
        StringBuilder text = new StringBuilder();
        text.append((char) lastChar);
        advance();
        while (isAlnum(lastChar)) {
            text.append((char) lastChar);
            advance();
        }

        String identifier = text.toString();
        TokenType type = switch (identifier) {
            case "def" -> TokenType.DEF;
            case "extern" -> TokenType.EXTERN;
            default -> TokenType.IDENTIFIER;
        };
        return new Token(type, identifier, 0, startLine, startColumn);
    }

    private Token number(int startLine, int startColumn) {
        StringBuilder text = new StringBuilder();
        do {
            text.append((char) lastChar);
            advance();
        } while (isDigit(lastChar) || lastChar == '.');

        String numberString = text.toString();
        return new Token(TokenType.NUMBER, numberString, parseLeadingDouble(numberString), startLine, startColumn);
    }

    /**
     * Converts the longest valid decimal prefix of a run of digits and dots, the way C's
     * {@code strtod} does: {@code "3.1.4"} yields {@code 3.1}. A run without any digit before
     * the second dot (e.g. {@code "."} or {@code "..5"}) yields NaN.
     *
     * @param text A non-empty string consisting only of digits and '.'.
     * @return The value of the longest convertible prefix, or {@link Double#NaN}.
     */
    static double parseLeadingDouble(String text) {
        int end = 0;
        boolean seenDot = false;
        boolean seenDigit = false;
        while (end < text.length()) {
            char c = text.charAt(end);
            if (c == '.') {
                if (seenDot) break;
                seenDot = true;
            } else {
                seenDigit = true;
            }
            end++;
        }
        if (!seenDigit) {
            return Double.NaN;
        }
        return Double.parseDouble(text.substring(0, end));
    }

    private void advance() {
        lastChar = source.next();
        if (lastChar == CharacterSource.EOF) {
            return;
        }
        if (pendingNewline) {
            line++;
            column = 1;
        } else {
            column++;
        }
        pendingNewline = lastChar == '\n';
    }
}
