package com.sandguard.common.infra;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvUtilsTest {

    @Nested
    class ParseBoolean {
        @ParameterizedTest
        @ValueSource(strings = { "true", "TRUE", "yes", "Y", "1", " on " })
        void truthyValues(String value) {
            assertEquals(Boolean.TRUE, EnvUtils.parseBoolean(value));
        }

        @ParameterizedTest
        @ValueSource(strings = { "false", "No", "0", "n", "OFF" })
        void falsyValues(String value) {
            assertEquals(Boolean.FALSE, EnvUtils.parseBoolean(value));
        }

        @Test
        void unknownAndBlankAreNull() {
            assertNull(EnvUtils.parseBoolean("maybe"));
            assertNull(EnvUtils.parseBoolean("  "));
            assertNull(EnvUtils.parseBoolean(null));
        }
    }

    @Nested
    class Lookups {
        @Test
        void getEnv_trimsAndDefaults() {
            Map<String, String> env = Map.of("A", "  value ", "B", "   ");
            assertEquals("value", EnvUtils.getEnv(env, "A", "x"));
            assertEquals("x", EnvUtils.getEnv(env, "B", "x"));
            assertEquals("x", EnvUtils.getEnv(env, "C", "x"));
            assertEquals("x", EnvUtils.getEnv(null, "A", "x"));
        }

        @Test
        void getEnvBoolean_fallsBackOnUnset() {
            assertTrue(EnvUtils.getEnvBoolean(Map.of(), "FLAG", true));
            assertFalse(EnvUtils.getEnvBoolean(Map.of(), "FLAG", false));
        }

        @Test
        void getEnvBoolean_parsesValue() {
            assertFalse(EnvUtils.getEnvBoolean(Map.of("FLAG", "no"), "FLAG", true));
            assertTrue(EnvUtils.getEnvBoolean(Map.of("FLAG", "Yes"), "FLAG", false));
        }

        @Test
        void getEnvBoolean_unrecognisedUsesDefault() {
            assertTrue(EnvUtils.getEnvBoolean(Map.of("FLAG", "sometimes"), "FLAG", true));
        }
    }
}
