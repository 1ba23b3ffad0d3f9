package com.pattern.sandbox;

import com.pattern.config.SandboxConfig;
import com.pattern.exception.ValidationException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Static pre-scan of pattern scripts.
 * <p>
 * Rejects scripts that are too long or that contain a deny-listed identifier as a
 * whole token, wherever it appears (also after a dot or inside a string literal).
 * This is a cheap first filter; the guarded views are the actual safety boundary.
 */
public class ScriptValidator {

    private final int maxScriptLength;
    private final Map<String, Pattern> denied = new LinkedHashMap<>();

    public ScriptValidator(SandboxConfig config) {
        this.maxScriptLength = config.maxScriptLength();
        for (String word : config.denyList()) {
            // JavaScript identifiers also contain '$', which \b does not treat as a word character
            denied.put(word, Pattern.compile(
                    "(?<![\\p{L}\\p{N}_$])" + Pattern.quote(word) + "(?![\\p{L}\\p{N}_$])"));
        }
    }

    /**
     * Describe why a script is rejected, or empty when it passes.
     */
    public Optional<String> findViolation(String script) {
        if (script == null || script.isBlank()) {
            return Optional.of("Script is empty");
        }
        if (script.length() > maxScriptLength) {
            return Optional.of("Script too long (max " + maxScriptLength + " chars)");
        }
        for (Map.Entry<String, Pattern> entry : denied.entrySet()) {
            if (entry.getValue().matcher(script).find()) {
                return Optional.of("Script contains forbidden identifier '" + entry.getKey() + "'");
            }
        }
        return Optional.empty();
    }

    /**
     * Throw {@link ValidationException} when the script is rejected.
     */
    public void validate(String script) {
        Optional<String> violation = findViolation(script);
        if (violation.isPresent()) {
            throw new ValidationException(violation.get());
        }
    }

    public boolean isAllowed(String script) {
        return findViolation(script).isEmpty();
    }
}
