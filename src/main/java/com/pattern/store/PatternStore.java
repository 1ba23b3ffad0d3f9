package com.pattern.store;

import com.pattern.core.Pattern;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for pattern records. Patterns are created and listed, never
 * updated in place.
 */
public interface PatternStore {

    /**
     * Validate and persist a new pattern.
     *
     * @param name        Display name, required
     * @param script      Predicate script, required and untrusted
     * @param description Free text, optional
     * @param examples    Free text, optional
     * @return The new pattern's id
     * @throws com.pattern.exception.ValidationException if a required field is blank or the script is rejected
     * @throws com.pattern.exception.StorageException    if the record cannot be committed
     */
    String create(String name, String script, String description, String examples);

    /**
     * All committed patterns in creation order.
     *
     * @throws com.pattern.exception.StorageException if the store cannot be read
     */
    List<Pattern> list();

    /**
     * Look up one pattern by id.
     *
     * @throws com.pattern.exception.StorageException if the store cannot be read
     */
    Optional<Pattern> findById(String id);
}
