package com.pattern.core;

/**
 * A named, persisted predicate script plus descriptive metadata.
 * The script is untrusted source text, even after being read back from storage.
 *
 * @param id          Opaque identifier assigned by the store, never reused
 * @param name        Display name
 * @param script      Body of a boolean-returning predicate
 * @param description Free text, may be null
 * @param examples    Free text, may be null
 */
public record Pattern(
        String id,
        String name,
        String script,
        String description,
        String examples
) {
    /**
     * The caller-facing summary of this pattern.
     */
    public PatternMatch toMatch() {
        return new PatternMatch(name, description, id);
    }
}
