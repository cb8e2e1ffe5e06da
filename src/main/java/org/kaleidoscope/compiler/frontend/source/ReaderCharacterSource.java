package org.kaleidoscope.compiler.frontend.source;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;

/**
 * A {@link CharacterSource} that pulls characters lazily from a {@link Reader}, such as a file
 * or standard input. Reading blocks until the reader delivers the next character.
 * <p>
 * The reader is not touched again after it reported end-of-stream, so an interactive reader
 * does not block a second time once input was closed.
 */
public class ReaderCharacterSource implements CharacterSource {

    private final Reader reader;
    private boolean exhausted = false;

    /**
     * Creates a new source. The caller remains responsible for closing the reader.
     * @param reader The reader to pull characters from.
     */
    public ReaderCharacterSource(Reader reader) {
        this.reader = reader;
    }

    /**
     * {@inheritDoc}
     * @throws UncheckedIOException if the underlying reader fails.
     */
    @Override
    public int next() {
        if (exhausted) return EOF;
        try {
            int c = reader.read();
            if (c < 0) {
                exhausted = true;
                return EOF;
            }
            return c;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read program input", e);
        }
    }
}
