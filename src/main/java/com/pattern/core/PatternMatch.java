package com.pattern.core;

/**
 * A pattern that held true for a chart context.
 *
 * @param name        Pattern display name
 * @param description Pattern description, may be null
 * @param id          Pattern identifier
 */
public record PatternMatch(String name, String description, String id) {
}
