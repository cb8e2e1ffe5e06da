package org.kaleidoscope.compiler;

import org.kaleidoscope.compiler.api.ParseSummary;
import org.kaleidoscope.compiler.frontend.TopLevelConstruct;
import org.kaleidoscope.compiler.frontend.parser.PrecedenceTable;
import org.kaleidoscope.compiler.frontend.parser.ast.BinaryOpNode;
import org.kaleidoscope.compiler.frontend.parser.ast.FunctionNode;
import org.kaleidoscope.compiler.frontend.parser.ast.VariableRefNode;
import org.kaleidoscope.compiler.frontend.source.CharacterSource;
import org.kaleidoscope.compiler.frontend.source.StringCharacterSource;
import org.kaleidoscope.junit.extensions.logging.ExpectLog;
import org.kaleidoscope.junit.extensions.logging.FailOnLog;
import org.kaleidoscope.junit.extensions.logging.LogLevel;
import org.kaleidoscope.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests complete parse sessions through the {@link Frontend} facade.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class FrontendTest {

    /**
     * Verifies a full session over several joined inputs.
     * This is a unit test for the frontend facade.
     */
    @Test
    void parsesProgramFromJoinedInputs() {
        // Arrange
        CharacterSource source = CharacterSource.ofInputs(List.of("def", "twice(x)", "x+x", ";", "twice(2)"));

        // Act
        ParseSummary summary = new Frontend().parse(source);

        // Assert
        assertThat(summary.hasErrors()).isFalse();
        assertThat(summary.constructs()).hasSize(2);
        assertThat(summary.constructs().get(0)).isInstanceOf(TopLevelConstruct.Definition.class);
        assertThat(summary.constructs().get(1)).isInstanceOf(TopLevelConstruct.TopLevelExpression.class);
    }

    /**
     * Verifies that a session records its syntax errors and still returns the later constructs.
     * This is a unit test for the frontend facade.
     */
    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "LogError: unknown token when expecting an expression")
    void collectsDiagnosticsAndKeepsGoing() {
        // Act
        ParseSummary summary = new Frontend().parse(new StringCharacterSource("1+; 2"));

        // Assert
        assertThat(summary.hasErrors()).isTrue();
        assertThat(summary.diagnostics()).hasSize(1);
        assertThat(summary.constructs()).hasSize(1);
    }

    /**
     * Verifies that changing the caller's table after construction does not reach the sessions.
     * This is a unit test for the frontend facade.
     */
    @Test
    void operatorTableIsCopiedIntoEachSession() {
        // Arrange
        PrecedenceTable table = PrecedenceTable.withDefaults();
        table.define('/', 40);
        Frontend frontend = new Frontend(table);
        table.remove('/');

        // Act
        ParseSummary summary = frontend.parse(new StringCharacterSource("a/b"));

        // Assert
        FunctionNode function = (FunctionNode) summary.constructs().get(0).node();
        assertThat(function.body()).isEqualTo(new BinaryOpNode('/', new VariableRefNode("a"), new VariableRefNode("b")));
    }

    /**
     * Verifies that sessions running in parallel on one facade produce independent results.
     * Any error logged by a session fails the test.
     * This is a unit test for the frontend facade.
     */
    @Test
    @FailOnLog(level = LogLevel.ERROR)
    void concurrentSessionsDoNotShareState() throws Exception {
        // Arrange
        Frontend frontend = new Frontend();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        List<Callable<ParseSummary>> tasks = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            String program = "def f" + i + "(a b) a*b+" + i + "; f" + i + "(1, 2)";
            tasks.add(() -> frontend.parse(new StringCharacterSource(program)));
        }

        try {
            // Act
            List<Future<ParseSummary>> futures = executor.invokeAll(tasks);

            // Assert
            for (Future<ParseSummary> future : futures) {
                ParseSummary summary = future.get();
                assertThat(summary.hasErrors()).isFalse();
                assertThat(summary.constructs()).hasSize(2);
            }
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }
    }
}
