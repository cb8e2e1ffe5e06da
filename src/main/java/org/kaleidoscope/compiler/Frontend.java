package org.kaleidoscope.compiler;

import org.kaleidoscope.compiler.api.IFrontend;
import org.kaleidoscope.compiler.api.ParseSummary;
import org.kaleidoscope.compiler.diagnostics.DiagnosticsEngine;
import org.kaleidoscope.compiler.frontend.TopLevelConstruct;
import org.kaleidoscope.compiler.frontend.TopLevelDriver;
import org.kaleidoscope.compiler.frontend.lexer.Lexer;
import org.kaleidoscope.compiler.frontend.parser.Parser;
import org.kaleidoscope.compiler.frontend.parser.PrecedenceTable;
import org.kaleidoscope.compiler.frontend.source.CharacterSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The front-end implementation. Every call to {@link #parse(CharacterSource)} runs an isolated
 * session with its own lexer, parser, diagnostics and copy of the operator table, so one
 * instance may serve several threads.
 */
public class Frontend implements IFrontend {

    private static final Logger LOG = LoggerFactory.getLogger(Frontend.class);

    private final PrecedenceTable operators;

    /**
     * Creates a front-end that knows the built-in binary operators.
     */
    public Frontend() {
        this(PrecedenceTable.withDefaults());
    }

    /**
     * Creates a front-end with a custom set of binary operators.
     * @param operators The operator table. It is copied; later changes do not affect this front-end.
     */
    public Frontend(PrecedenceTable operators) {
        this.operators = operators.copy();
    }

    @Override
    public ParseSummary parse(CharacterSource source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Parser parser = new Parser(new Lexer(source), operators.copy());
        TopLevelDriver driver = new TopLevelDriver(parser, diagnostics);

        List<TopLevelConstruct> constructs = driver.run();
        LOG.debug("Session finished: {} construct(s), {} error(s)", constructs.size(), diagnostics.errorCount());
        return new ParseSummary(constructs, diagnostics.getDiagnostics());
    }
}
