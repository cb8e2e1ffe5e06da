package org.kaleidoscope.compiler.frontend.parser;

/**
 * The points at which the {@link Parser} can reject its input, each with its fixed message.
 */
public enum SyntaxErrorKind {
    /** The current token cannot start a primary expression. */
    UNKNOWN_TOKEN("unknown token when expecting an expression"),
    /** A parenthesized expression is not closed. */
    EXPECTED_CLOSING_PAREN("expected ')'"),
    /** A call argument is followed by neither ',' nor ')'. */
    EXPECTED_ARGUMENT_SEPARATOR("Expected ')' or ',' in argument list"),
    /** A prototype does not start with an identifier. */
    EXPECTED_FUNCTION_NAME("Expected function name in prototype"),
    /** A prototype name is not followed by '('. */
    EXPECTED_PROTOTYPE_OPEN_PAREN("Expected '(' in prototype"),
    /** A prototype parameter list is not closed by ')'. */
    EXPECTED_PROTOTYPE_CLOSE_PAREN("Expected ')' in prototype");

    private final String message;

    SyntaxErrorKind(String message) {
        this.message = message;
    }

    /**
     * @return The fixed diagnostic message for this kind.
     */
    public String message() {
        return message;
    }
}
