package org.kaleidoscope.compiler.frontend.parser;

import java.util.function.Function;

/**
 * The outcome of a parse function: either the fully built node or the syntax error that
 * aborted the construct. A failure never carries a partially built tree.
 *
 * @param <T> The type of the parsed node.
 */
public sealed interface ParseResult<T> permits ParseResult.Success, ParseResult.Failure {

    /**
     * A successfully parsed node.
     * @param value The node.
     */
    record Success<T>(T value) implements ParseResult<T> {}

    /**
     * A failed parse.
     * @param error The error that aborted the construct.
     */
    record Failure<T>(SyntaxError error) implements ParseResult<T> {}

    static <T> ParseResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> ParseResult<T> failure(SyntaxError error) {
        return new Failure<>(error);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isFailure() {
        return this instanceof Failure;
    }

    /**
     * @return The parsed node.
     * @throws IllegalStateException if this is a failure.
     */
    default T value() {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        throw new IllegalStateException("No value in a failed parse: " + error().message());
    }

    /**
     * @return The syntax error.
     * @throws IllegalStateException if this is a success.
     */
    default SyntaxError error() {
        if (this instanceof Failure<T> failure) {
            return failure.error();
        }
        throw new IllegalStateException("A successful parse has no error.");
    }

    /**
     * Re-types a failure so an enclosing construct can abort with the same error.
     * @param <U> The result type of the enclosing construct.
     * @return A failure carrying this result's error.
     * @throws IllegalStateException if this is a success.
     */
    default <U> ParseResult<U> propagate() {
        return new Failure<>(error());
    }

    /**
     * Transforms the node of a success; a failure is passed through unchanged.
     * @param mapper The transformation.
     * @param <U> The new node type.
     * @return The transformed result.
     */
    default <U> ParseResult<U> map(Function<? super T, ? extends U> mapper) {
        if (this instanceof Success<T> success) {
            return new Success<>(mapper.apply(success.value()));
        }
        return propagate();
    }
}
