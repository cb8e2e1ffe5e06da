package org.kaleidoscope.compiler.frontend.parser;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps single-character binary operators to their precedence. A larger value binds tighter.
 * Characters without an entry, or with a non-positive entry, are not binary operators.
 * <p>
 * The table is mutable so that new operators can be installed before or between parses.
 * Each parse session should work on its own {@link #copy()}.
 */
public class PrecedenceTable {

    /** Returned by {@link #precedenceOf(char)} for characters that are not binary operators. */
    public static final int NOT_AN_OPERATOR = -1;

    private final Map<Character, Integer> precedences = new HashMap<>();

    /**
     * Creates a table seeded with the built-in operators:
     * {@code '<'} 10, {@code '+'} 20, {@code '-'} 30 and {@code '*'} 40 (highest).
     * @return A new table.
     */
    public static PrecedenceTable withDefaults() {
        PrecedenceTable table = new PrecedenceTable();
        table.define('<', 10);
        table.define('+', 20);
        table.define('-', 30);
        table.define('*', 40);
        return table;
    }

    /**
     * Installs or replaces an operator.
     * @param operator The operator character.
     * @param precedence Its precedence; values of zero or less disable the operator.
     */
    public void define(char operator, int precedence) {
        precedences.put(operator, precedence);
    }

    /**
     * Removes an operator.
     * @param operator The operator character.
     */
    public void remove(char operator) {
        precedences.remove(operator);
    }

    /**
     * @param operator The character to look up.
     * @return Its precedence, or {@link #NOT_AN_OPERATOR} if it is not a binary operator.
     */
    public int precedenceOf(char operator) {
        Integer precedence = precedences.get(operator);
        if (precedence == null || precedence <= 0) return NOT_AN_OPERATOR;
        return precedence;
    }

    /**
     * @return A read-only view of all entries, including disabled ones.
     */
    public Map<Character, Integer> entries() {
        return Collections.unmodifiableMap(precedences);
    }

    /**
     * @return An independent copy of this table.
     */
    public PrecedenceTable copy() {
        PrecedenceTable copy = new PrecedenceTable();
        copy.precedences.putAll(precedences);
        return copy;
    }
}
