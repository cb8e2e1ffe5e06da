package org.kaleidoscope.compiler.api;

import org.kaleidoscope.compiler.diagnostics.Diagnostic;
import org.kaleidoscope.compiler.frontend.TopLevelConstruct;

import java.util.List;

/**
 * The outcome of one parse session.
 *
 * @param constructs The successfully parsed top-level constructs, in input order.
 * @param diagnostics The diagnostics reported during the session, in order.
 */
public record ParseSummary(List<TopLevelConstruct> constructs, List<Diagnostic> diagnostics) {

    public ParseSummary {
        constructs = List.copyOf(constructs);
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return true if at least one error was reported.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }
}
