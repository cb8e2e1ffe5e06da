package org.kaleidoscope.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import org.kaleidoscope.compiler.frontend.parser.PrecedenceTable;

import java.util.Map;

/**
 * Typed view of the {@code kaleidoscope.frontend} configuration block.
 * <pre>
 * kaleidoscope.frontend {
 *   input-separator = " "
 *   binary-operators { "<" = 10, "+" = 20, "-" = 30, "*" = 40 }
 * }
 * </pre>
 *
 * @param inputSeparator The text placed between consecutive command-line inputs.
 * @param operators The binary operators known to every parse session.
 */
public record FrontendSettings(String inputSeparator, PrecedenceTable operators) {

    static final String FRONTEND_PATH = "kaleidoscope.frontend";
    private static final String SEPARATOR_KEY = "input-separator";
    private static final String OPERATORS_KEY = "binary-operators";

    /**
     * Reads the settings from a resolved configuration.
     * @param config The application configuration.
     * @return The settings.
     * @throws ConfigException.Missing if the frontend block is missing.
     * @throws ConfigException.BadValue if an operator key is not a single character or its
     *                                  precedence is not an integer.
     */
    public static FrontendSettings from(final Config config) {
        final Config frontend = config.getConfig(FRONTEND_PATH);
        final String separator = frontend.getString(SEPARATOR_KEY);
        return new FrontendSettings(separator, readOperators(frontend));
    }

    private static PrecedenceTable readOperators(final Config frontend) {
        final PrecedenceTable table = new PrecedenceTable();
        if (!frontend.hasPath(OPERATORS_KEY)) {
            return table;
        }
        final String path = FRONTEND_PATH + "." + OPERATORS_KEY;
        for (final Map.Entry<String, ConfigValue> entry : frontend.getObject(OPERATORS_KEY).entrySet()) {
            final String operator = entry.getKey();
            final ConfigValue value = entry.getValue();
            if (operator.length() != 1) {
                throw new ConfigException.BadValue(value.origin(), path,
                        "Operator '" + operator + "' must be exactly one character");
            }
            if (value.valueType() != ConfigValueType.NUMBER || !(value.unwrapped() instanceof Integer)) {
                throw new ConfigException.BadValue(value.origin(), path,
                        "Precedence of '" + operator + "' must be an integer, got " + value.render());
            }
            table.define(operator.charAt(0), (Integer) value.unwrapped());
        }
        return table;
    }
}
