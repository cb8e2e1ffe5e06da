package org.kaleidoscope.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Keywords.
    /** The 'def' keyword, introducing a function definition. */
    DEF,
    /** The 'extern' keyword, introducing an external prototype. */
    EXTERN,

    // Primary.
    /** An identifier such as a variable or function name. */
    IDENTIFIER,
    /** A numeric literal. */
    NUMBER,

    /** Any other single character, e.g. '(', ',' or an operator. */
    CHARACTER,

    /** Represents the end of the input. */
    END_OF_FILE
}
