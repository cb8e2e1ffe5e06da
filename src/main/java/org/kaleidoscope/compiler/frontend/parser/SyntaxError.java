package org.kaleidoscope.compiler.frontend.parser;

import org.kaleidoscope.compiler.frontend.lexer.Token;

/**
 * A syntax error found while parsing a construct.
 *
 * @param kind The kind of error, which determines the message.
 * @param line The line of the offending token.
 * @param column The column of the offending token.
 */
public record SyntaxError(SyntaxErrorKind kind, int line, int column) {

    /**
     * Creates an error located at the given token.
     * @param kind The kind of error.
     * @param token The offending token.
     * @return The new error.
     */
    public static SyntaxError at(SyntaxErrorKind kind, Token token) {
        return new SyntaxError(kind, token.line(), token.column());
    }

    /**
     * @return The fixed diagnostic message of this error's kind.
     */
    public String message() {
        return kind.message();
    }
}
