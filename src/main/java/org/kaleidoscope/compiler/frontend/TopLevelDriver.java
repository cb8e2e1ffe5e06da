package org.kaleidoscope.compiler.frontend;

import org.kaleidoscope.compiler.diagnostics.DiagnosticsEngine;
import org.kaleidoscope.compiler.frontend.lexer.TokenType;
import org.kaleidoscope.compiler.frontend.parser.ParseResult;
import org.kaleidoscope.compiler.frontend.parser.Parser;
import org.kaleidoscope.compiler.frontend.parser.SyntaxError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Drives a {@link Parser} over a whole input, one top-level construct at a time, until the end of
 * input.
 * <pre>top ::= definition | external | expression | ';'</pre>
 * Each construct is reported on this class's logger. After a construct fails, exactly one token
 * is skipped and dispatch resumes; inside a multi-token construct this can resume in the middle
 * of it, which then usually fails again.
 */
public class TopLevelDriver {

    private static final Logger LOG = LoggerFactory.getLogger(TopLevelDriver.class);

    private final Parser parser;
    private final DiagnosticsEngine diagnostics;
    private final List<TopLevelConstruct> constructs = new ArrayList<>();

    /**
     * Creates a new driver.
     * @param parser The parser positioned on the first token of the input.
     * @param diagnostics The engine collecting syntax errors.
     */
    public TopLevelDriver(Parser parser, DiagnosticsEngine diagnostics) {
        this.parser = parser;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses top-level constructs until the end of input.
     * @return The successfully parsed constructs, in input order.
     */
    public List<TopLevelConstruct> run() {
        while (true) {
            if (parser.current().type() == TokenType.END_OF_FILE) {
                return getConstructs();
            }
            if (parser.current().isCharacter(';')) {
                // Ignore top-level semicolons.
                parser.advance();
            } else if (parser.current().type() == TokenType.DEF) {
                handle(parser::parseDefinition, TopLevelConstruct.Definition::new, "Parsed a function definition.");
            } else if (parser.current().type() == TokenType.EXTERN) {
                handle(parser::parseExtern, TopLevelConstruct.Extern::new, "Parsed an extern");
            } else {
                handle(parser::parseTopLevelExpr, TopLevelConstruct.TopLevelExpression::new, "Parsed a top-level expr");
            }
        }
    }

    /**
     * @return The constructs parsed so far.
     */
    public List<TopLevelConstruct> getConstructs() {
        return Collections.unmodifiableList(constructs);
    }

    private <T> void handle(Supplier<ParseResult<T>> parse,
                            Function<T, TopLevelConstruct> wrap,
                            String successMessage) {
        ParseResult<T> result = parse.get();
        if (result.isSuccess()) {
            constructs.add(wrap.apply(result.value()));
            LOG.info(successMessage);
        } else {
            report(result.error());
            // Skip token for error recovery.
            parser.advance();
        }
    }

    private void report(SyntaxError error) {
        diagnostics.reportError(error.message(), error.line(), error.column());
        LOG.error("LogError: {}", error.message());
    }
}
