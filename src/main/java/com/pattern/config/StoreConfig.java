package com.pattern.config;

/**
 * Pattern store settings.
 *
 * @param databasePath  Path to the SQLite database file
 * @param busyTimeoutMs How long a connection waits on a locked database
 */
public record StoreConfig(
        String databasePath,
        int busyTimeoutMs
) {
    public static StoreConfig defaults() {
        return new StoreConfig("data/patterns.db", 5000);
    }

    /**
     * Default settings pointing at the given database file.
     */
    public static StoreConfig at(String databasePath) {
        return new StoreConfig(databasePath, 5000);
    }
}
