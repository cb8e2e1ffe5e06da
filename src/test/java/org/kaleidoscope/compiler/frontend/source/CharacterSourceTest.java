package org.kaleidoscope.compiler.frontend.source;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the {@link CharacterSource} implementations and {@link CharacterClass}.
 */
@Tag("unit")
class CharacterSourceTest {

    /**
     * Verifies that separate inputs are joined with a single space.
     * This is a unit test for the character sources.
     */
    @Test
    void ofInputs_joinsInputsWithSingleSpace() {
        // Arrange
        CharacterSource source = CharacterSource.ofInputs(List.of("def", "f(x)", "x"));

        // Act
        String text = drain(source);

        // Assert
        assertThat(text).isEqualTo("def f(x) x");
    }

    /**
     * Verifies that a configured separator replaces the default space.
     * This is a unit test for the character sources.
     */
    @Test
    void ofInputs_usesCustomSeparator() {
        // Arrange
        CharacterSource source = CharacterSource.ofInputs(List.of("1", "2"), ";");

        // Act
        String text = drain(source);

        // Assert
        assertThat(text).isEqualTo("1;2");
    }

    /**
     * Verifies that no inputs give an empty stream.
     * This is a unit test for the character sources.
     */
    @Test
    void ofInputs_withoutInputsIsImmediatelyExhausted() {
        // Arrange
        CharacterSource source = CharacterSource.ofInputs(List.of());

        // Act
        int first = source.next();

        // Assert
        assertThat(first).isEqualTo(CharacterSource.EOF);
    }

    /**
     * Verifies that a string source keeps answering EOF once exhausted.
     * This is a unit test for the character sources.
     */
    @Test
    void stringSource_keepsReturningEofAfterExhaustion() {
        // Arrange
        CharacterSource source = new StringCharacterSource("a");

        // Act
        List<Integer> read = List.of(source.next(), source.next(), source.next(), source.next());

        // Assert
        assertThat(read).containsExactly((int) 'a', CharacterSource.EOF, CharacterSource.EOF, CharacterSource.EOF);
    }

    /**
     * Verifies that a reader-backed source delivers the characters in order.
     * This is a unit test for the character sources.
     */
    @Test
    void readerSource_readsCharactersInOrder() {
        // Arrange
        CharacterSource source = new ReaderCharacterSource(new StringReader("x+1\n"));

        // Act
        String text = drain(source);

        // Assert
        assertThat(text).isEqualTo("x+1\n");
        assertThat(source.next()).isEqualTo(CharacterSource.EOF);
    }

    /**
     * Verifies that the underlying reader is not touched again after it reported end of stream.
     * This is a unit test for the character sources.
     */
    @Test
    void readerSource_doesNotReadAgainAfterEndOfStream() throws IOException {
        // Arrange
        Reader reader = mock(Reader.class);
        when(reader.read()).thenReturn((int) 'a', -1);
        CharacterSource source = new ReaderCharacterSource(reader);

        // Act
        List<Integer> read = List.of(source.next(), source.next(), source.next());

        // Assert
        assertThat(read).containsExactly((int) 'a', CharacterSource.EOF, CharacterSource.EOF);
        verify(reader, times(2)).read();
    }

    /**
     * Verifies that an I/O failure surfaces as an {@link UncheckedIOException} keeping its cause.
     * This is a unit test for the character sources.
     */
    @Test
    void readerSource_wrapsIoFailures() throws IOException {
        // Arrange
        Reader reader = mock(Reader.class);
        when(reader.read()).thenThrow(new IOException("disk gone"));
        CharacterSource source = new ReaderCharacterSource(reader);

        // Act & Assert
        assertThatThrownBy(source::next)
                .isInstanceOf(UncheckedIOException.class)
                .hasRootCauseMessage("disk gone");
    }

    /**
     * Verifies that the character classes accept ASCII only and reject EOF.
     * This is a unit test for {@link CharacterClass}.
     */
    @Test
    void characterClass_isAsciiOnly() {
        // Assert
        assertThat(CharacterClass.isAlpha('q')).isTrue();
        assertThat(CharacterClass.isAlpha('Z')).isTrue();
        assertThat(CharacterClass.isAlpha('é')).isFalse();
        assertThat(CharacterClass.isAlpha('_')).isFalse();
        assertThat(CharacterClass.isDigit('7')).isTrue();
        assertThat(CharacterClass.isDigit('٣')).isFalse();
        assertThat(CharacterClass.isAlnum('9')).isTrue();
        assertThat(CharacterClass.isAlnum('.')).isFalse();
        for (char c : new char[] {' ', '\t', '\n', 0x0B, '\f', '\r'}) {
            assertThat(CharacterClass.isSpace(c)).as("code %d", (int) c).isTrue();
        }
        assertThat(CharacterClass.isSpace(CharacterSource.EOF)).isFalse();
        assertThat(CharacterClass.isAlnum(CharacterSource.EOF)).isFalse();
    }

    private static String drain(CharacterSource source) {
        StringBuilder text = new StringBuilder();
        for (int c = source.next(); c != CharacterSource.EOF; c = source.next()) {
            text.append((char) c);
        }
        return text.toString();
    }
}
