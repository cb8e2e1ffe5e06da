package org.kaleidoscope.compiler.frontend.source;

import java.util.List;

/**
 * A lazy, finite and non-restartable sequence of input characters consumed by the
 * {@link org.kaleidoscope.compiler.frontend.lexer.Lexer}.
 * <p>
 * Implementations may block inside {@link #next()} while waiting for data (for example when
 * reading from standard input). Once the sequence is exhausted every further call returns
 * {@link #EOF}.
 */
public interface CharacterSource {

    /** The reserved value returned once the source is exhausted. */
    int EOF = -1;

    /**
     * Returns the next character of the input.
     * @return The character code, or {@link #EOF} if no characters remain.
     */
    int next();

    /**
     * Creates a source over the given inputs, joined in order with the given separator.
     * @param inputs The individual inputs, e.g. command-line arguments.
     * @param separator The text inserted between two consecutive inputs.
     * @return A new source yielding the concatenated text.
     */
    static CharacterSource ofInputs(List<String> inputs, String separator) {
        return new StringCharacterSource(String.join(separator, inputs));
    }

    /**
     * Creates a source over the given inputs, separated by a single space.
     * @param inputs The individual inputs.
     * @return A new source yielding the concatenated text.
     */
    static CharacterSource ofInputs(List<String> inputs) {
        return ofInputs(inputs, " ");
    }
}
