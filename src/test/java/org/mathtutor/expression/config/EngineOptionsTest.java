package org.mathtutor.expression.config;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for reading {@link EngineOptions} from HOCON.
 */
@Tag("unit")
class EngineOptionsTest {

    @Test
    @DisplayName("Missing keys fall back to reference.conf, which matches DEFAULT")
    void fromConfig_emptyConfigYieldsDefaults() {
        assertEquals(EngineOptions.DEFAULT, EngineOptions.fromConfig(ConfigFactory.empty()));
    }

    @Test
    @DisplayName("Values are read from the mathtutor.expression block")
    void fromConfig_readsAllKeys() {
        // Act
        EngineOptions options = EngineOptions.fromConfig(ConfigFactory.parseResources("test-engine.conf"));

        // Assert
        assertEquals(3.0, options.defaultExponent());
        assertEquals(4, options.decimalPlaces());
        assertFalse(options.unicodeOperators());
    }

    @Test
    @DisplayName("Partial configuration keeps the other defaults")
    void fromConfig_partialOverride() {
        EngineOptions options = EngineOptions.fromConfig(
                ConfigFactory.parseString("mathtutor.expression.printer.decimal-places = 0"));

        assertEquals(new EngineOptions(2, 0, true), options);
    }

    @Test
    @DisplayName("Invalid values are rejected")
    void fromConfig_rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> EngineOptions.fromConfig(
                ConfigFactory.parseString("mathtutor.expression.printer.decimal-places = -1")));
        assertThrows(ConfigException.WrongType.class, () -> EngineOptions.fromConfig(
                ConfigFactory.parseString("mathtutor.expression.printer.unicode-operators = maybe")));
    }
}
