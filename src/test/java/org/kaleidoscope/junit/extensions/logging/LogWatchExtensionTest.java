package org.kaleidoscope.junit.extensions.logging;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Contains unit tests for the {@link LogWatchExtension}.
 * The extension is driven directly through a mocked {@link ExtensionContext}; the annotated
 * methods below only carry the annotations a test method would.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class LogWatchExtensionTest {

    private static final Logger LOG = LoggerFactory.getLogger(LogWatchExtensionTest.class);

    @Mock
    private ExtensionContext context;

    @Mock
    private ExtensionContext.Store store;

    private final LogWatchExtension extension = new LogWatchExtension();

    @ExpectLog(level = LogLevel.ERROR, messagePattern = "parse failed")
    void expectsOneError() {
    }

    @ExpectLog(level = LogLevel.WARN, messagePattern = "parse failed")
    void expectsOneWarning() {
    }

    @FailOnLog(level = LogLevel.ERROR)
    void failsOnErrorsOnly() {
    }

    @FailOnLog(disabled = true)
    void neverFails() {
    }

    /**
     * Verifies that an expectation is not satisfied by more events than it names.
     * This is a unit test for the extension.
     */
    @Test
    void expectedEventLoggedTooOftenFails() throws Exception {
        // Arrange
        watch("expectsOneError");

        // Act
        LOG.error("parse failed");
        LOG.error("parse failed");

        // Assert
        assertThatThrownBy(() -> extension.afterEach(context))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("but found 2");
    }

    /**
     * Verifies that an expectation matched exactly its number of times passes.
     * This is a unit test for the extension.
     */
    @Test
    void expectedEventLoggedOncePasses() throws Exception {
        // Arrange
        watch("expectsOneError");

        // Act
        LOG.error("parse failed");

        // Assert
        assertThatCode(() -> extension.afterEach(context)).doesNotThrowAnyException();
    }

    /**
     * Verifies that an event above the expected level neither satisfies the expectation nor
     * counts as expected.
     * This is a unit test for the extension.
     */
    @Test
    void higherLevelDoesNotSatisfyExpectation() throws Exception {
        // Arrange
        watch("expectsOneWarning");

        // Act
        LOG.error("parse failed");

        // Assert
        assertThatThrownBy(() -> extension.afterEach(context))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("Unexpected log: [ERROR]")
                .hasMessageContaining("but found 0");
    }

    /**
     * Verifies that {@link FailOnLog#level()} raises the threshold for unexpected events.
     * This is a unit test for the extension.
     */
    @Test
    void failOnLogRaisesTheThreshold() throws Exception {
        // Arrange
        watch("failsOnErrorsOnly");

        // Act
        LOG.warn("tolerated warning");
        LOG.error("unexpected error");

        // Assert
        assertThatThrownBy(() -> extension.afterEach(context))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("unexpected error")
                .message().doesNotContain("tolerated warning");
    }

    /**
     * Verifies that a disabled {@link FailOnLog} accepts any unexpected event.
     * This is a unit test for the extension.
     */
    @Test
    void disabledFailOnLogAcceptsAnything() throws Exception {
        // Arrange
        watch("neverFails");

        // Act
        LOG.error("unexpected error");

        // Assert
        assertThatCode(() -> extension.afterEach(context)).doesNotThrowAnyException();
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private void watch(String methodName) throws NoSuchMethodException {
        Method method = LogWatchExtensionTest.class.getDeclaredMethod(methodName);
        doReturn(method).when(context).getRequiredTestMethod();
        doReturn(LogWatchExtensionTest.class).when(context).getRequiredTestClass();
        when(context.getStore(any())).thenReturn(store);

        extension.beforeEach(context);

        ArgumentCaptor<Object> filter = ArgumentCaptor.forClass(Object.class);
        verify(store).put(eq("filter"), filter.capture());
        when(store.remove(eq("filter"), any(Class.class))).thenAnswer(invocation -> filter.getValue());
    }
}
