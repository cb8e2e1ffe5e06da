package org.kaleidoscope.compiler.diagnostics;

/**
 * Represents a single diagnostic message produced while processing a program.
 *
 * @param type The type of the diagnostic.
 * @param message The diagnostic message.
 * @param line The line number of the issue.
 * @param column The column number of the issue.
 */
public record Diagnostic(
        Type type,
        String message,
        int line,
        int column
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** A construct could not be parsed. */
        ERROR
    }

    @Override
    public String toString() {
        return String.format("[%s] %d:%d: %s", type, line, column, message);
    }
}
