package org.kaleidoscope.compiler.frontend.lexer;

/**
 * Represents a single token produced by the {@link Lexer}.
 * <p>
 * The token carries its own payload, so nothing has to be read back from the lexer after
 * the token was produced.
 *
 * @param type The type of the token.
 * @param text The scanned text: the identifier name, the raw number text, the keyword, or
 *             the single character. Empty for {@link TokenType#END_OF_FILE}.
 * @param numberValue The converted value if this is a {@link TokenType#NUMBER}, otherwise 0.
 * @param line The 1-based line where the token begins.
 * @param column The 1-based column where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        double numberValue,
        int line,
        int column
) {

    /**
     * Checks whether this is a {@link TokenType#CHARACTER} token for the given character.
     * @param c The character to compare with.
     * @return true if this token is exactly that character.
     */
    public boolean isCharacter(char c) {
        return type == TokenType.CHARACTER && text.charAt(0) == c;
    }

    /**
     * Returns the character of a {@link TokenType#CHARACTER} token.
     * @return The character.
     * @throws IllegalStateException if this token is not a single-character token.
     */
    public char character() {
        if (type != TokenType.CHARACTER) {
            throw new IllegalStateException("Token " + type + " is not a single character.");
        }
        return text.charAt(0);
    }
}
