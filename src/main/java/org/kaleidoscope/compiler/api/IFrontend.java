package org.kaleidoscope.compiler.api;

import org.kaleidoscope.compiler.frontend.source.CharacterSource;

/**
 * The public entry point of the language front-end.
 */
public interface IFrontend {

    /**
     * Parses the complete input of the given source in a fresh session.
     * <p>
     * Syntax errors do not abort the session; they are reported in the returned summary and the
     * session resumes with the next top-level construct.
     *
     * @param source The program text. It is consumed until its end.
     * @return The parsed constructs and the collected diagnostics.
     */
    ParseSummary parse(CharacterSource source);
}
