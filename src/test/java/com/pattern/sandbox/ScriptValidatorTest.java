package com.pattern.sandbox;

import com.pattern.config.SandboxConfig;
import com.pattern.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScriptValidatorTest {

    private final ScriptValidator validator = new ScriptValidator(SandboxConfig.defaults());

    @ParameterizedTest
    @ValueSource(strings = {
            "process.exit(1);",
            "return require('fs') != null;",
            "return eval('1') === 1;",
            "return Function('return 1')() === 1;",
            "return context.constructor === undefined;",
            "return context.__proto__ == null;",
            "return typeof Packages;",
            "return java.lang.System != null;",
            "return globalThis === undefined;",
            "return data.process === 1;",
            "var s = 'process'; return true;"
    })
    @DisplayName("Deny-listed identifiers are rejected wherever they appear")
    void rejectsDeniedIdentifiers(String script) {
        assertFalse(validator.isAllowed(script));
        ValidationException e = assertThrows(ValidationException.class, () -> validator.validate(script));
        assertTrue(e.getMessage().startsWith("Script contains forbidden identifier"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "return context.gender === 'male';",
            "var processing = true; return processing;",
            "var $process = 1; return $process === 1;",
            "var process_1 = 1; return process_1 === 1;",
            "return context.palaces.some(function (p) { return p.stars.length > 2; });",
            "return context['constr' + 'uctor'] === undefined;"
    })
    @DisplayName("Identifiers that only contain a denied word are allowed")
    void allowsNonMatchingTokens(String script) {
        assertTrue(validator.isAllowed(script));
        assertDoesNotThrow(() -> validator.validate(script));
    }

    @Test
    @DisplayName("Blank scripts are rejected")
    void rejectsBlank() {
        assertEquals("Script is empty", validator.findViolation("   ").orElseThrow());
        assertEquals("Script is empty", validator.findViolation(null).orElseThrow());
    }

    @Test
    @DisplayName("Scripts over the length limit are rejected")
    void rejectsTooLong() {
        String body = "return true;" + " ".repeat(1000);
        assertEquals("Script too long (max 1000 chars)", validator.findViolation(body).orElseThrow());

        String exact = "return true;" + " ".repeat(1000 - "return true;".length());
        assertTrue(validator.isAllowed(exact));
    }

    @Test
    @DisplayName("Configured deny-list replaces the default")
    void customDenyList() {
        SandboxConfig config = new SandboxConfig(100, 250, 10_000, 256, 1000, 20, List.of("fetch"));
        ScriptValidator custom = new ScriptValidator(config);

        assertFalse(custom.isAllowed("return fetch('x');"));
        assertTrue(custom.isAllowed("process.exit(1);"));
    }
}
