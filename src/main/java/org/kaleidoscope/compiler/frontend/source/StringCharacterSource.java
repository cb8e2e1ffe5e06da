package org.kaleidoscope.compiler.frontend.source;

/**
 * A {@link CharacterSource} over an in-memory string.
 */
public class StringCharacterSource implements CharacterSource {

    private final String text;
    private int current = 0;

    /**
     * Creates a new source.
     * @param text The complete input text.
     */
    public StringCharacterSource(String text) {
        this.text = text;
    }

    @Override
    public int next() {
        if (current >= text.length()) return EOF;
        return text.charAt(current++);
    }
}
