package com.acme.vision.pipeline.util;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnvVarsTest {

    @Test
    void shouldReturnDefaultForMissingOrBlank() {
        Map<String, String> env = Map.of("EMPTY", "   ");
        assertEquals("fallback", EnvVars.getOrDefault(env, "MISSING", "fallback"));
        assertEquals("fallback", EnvVars.getOrDefault(env, "EMPTY", "fallback"));
    }

    @Test
    void shouldParseBooleanWithDefault() {
        Map<String, String> env = Map.of("ENABLED", " true ", "DISABLED", "false");
        assertTrue(EnvVars.getBoolean(env, "ENABLED", false));
        assertFalse(EnvVars.getBoolean(env, "DISABLED", true));
        assertTrue(EnvVars.getBoolean(env, "MISSING", true));
    }

    @Test
    void shouldClampIntAndFallbackOnMalformed() {
        Map<String, String> env = Map.of(
            "LOW", "-10",
            "HIGH", "9000",
            "OK", " 42 ",
            "BAD", "abc"
        );
        assertEquals(1, EnvVars.getIntClamped(env, "LOW", 10, 1, 100));
        assertEquals(100, EnvVars.getIntClamped(env, "HIGH", 10, 1, 100));
        assertEquals(42, EnvVars.getIntClamped(env, "OK", 10, 1, 100));
        assertEquals(10, EnvVars.getIntClamped(env, "BAD", 10, 1, 100));
        assertEquals(10, EnvVars.getIntClamped(env, "MISSING", 10, 1, 100));
    }

    @Test
    void shouldClampLongAndFallbackOnMalformed() {
        Map<String, String> env = Map.of(
            "LOW", "0",
            "HIGH", "99999999999",
            "BAD", "1e9"
        );
        assertEquals(1024L, EnvVars.getLongClamped(env, "LOW", 4096L, 1024L, 1L << 30));
        assertEquals(1L << 30, EnvVars.getLongClamped(env, "HIGH", 4096L, 1024L, 1L << 30));
        assertEquals(4096L, EnvVars.getLongClamped(env, "BAD", 4096L, 1024L, 1L << 30));
    }
}
