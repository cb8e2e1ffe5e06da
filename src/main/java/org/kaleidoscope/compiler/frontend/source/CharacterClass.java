package org.kaleidoscope.compiler.frontend.source;

/**
 * ASCII-only character classification used by the lexer. {@link CharacterSource#EOF} is never
 * classified as anything.
 */
public final class CharacterClass {

    private CharacterClass() {}

    /**
     * @param c A character code or {@link CharacterSource#EOF}.
     * @return true for space, tab, newline, vertical tab, form feed and carriage return.
     */
    public static boolean isSpace(int c) {
        return c == ' ' || c == '\t' || c == '\n' || c == 0x0B || c == '\f' || c == '\r';
    }

    /**
     * @param c A character code or {@link CharacterSource#EOF}.
     * @return true for {@code [a-zA-Z]}.
     */
    public static boolean isAlpha(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    /**
     * @param c A character code or {@link CharacterSource#EOF}.
     * @return true for {@code [0-9]}.
     */
    public static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    /**
     * @param c A character code or {@link CharacterSource#EOF}.
     * @return true for {@code [a-zA-Z0-9]}.
     */
    public static boolean isAlnum(int c) {
        return isAlpha(c) || isDigit(c);
    }
}
