package org.mathtutor.expression.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Tunable behavior of the expression engine, read from the {@code mathtutor.expression}
 * block of the configuration.
 *
 * @param defaultExponent The exponent used when '^' is not followed by a number literal.
 * @param decimalPlaces The number of decimal places printed for non-integral values.
 * @param unicodeOperators Whether multiplication and division print as '×' and '÷'.
 */
public record EngineOptions(
        double defaultExponent,
        int decimalPlaces,
        boolean unicodeOperators
) {

    /** The configuration path of the engine settings. */
    public static final String CONFIG_PATH = "mathtutor.expression";

    /** The settings of {@code reference.conf}. */
    public static final EngineOptions DEFAULT = new EngineOptions(2, 2, true);

    /**
     * Validates the settings.
     */
    public EngineOptions {
        if (decimalPlaces < 0) {
            throw new IllegalArgumentException("printer.decimal-places must not be negative: " + decimalPlaces);
        }
        if (!Double.isFinite(defaultExponent)) {
            throw new IllegalArgumentException("parser.default-exponent must be finite: " + defaultExponent);
        }
    }

    /**
     * Reads the engine settings from a configuration. Missing keys fall back to the
     * values in {@code reference.conf}.
     *
     * @param config The application configuration.
     * @return The engine settings.
     * @throws com.typesafe.config.ConfigException if a value has the wrong type.
     */
    public static EngineOptions fromConfig(Config config) {
        Config engine = config.withFallback(ConfigFactory.defaultReference()).getConfig(CONFIG_PATH);
        return new EngineOptions(
                engine.getDouble("parser.default-exponent"),
                engine.getInt("printer.decimal-places"),
                engine.getBoolean("printer.unicode-operators"));
    }
}
