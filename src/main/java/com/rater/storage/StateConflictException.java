package com.rater.storage;

/**
 * Concurrent writers kept winning the race for one key.
 */
public class StateConflictException extends StorageException {

    public StateConflictException(String key, int attempts) {
        super("Gave up on key '" + key + "' after " + attempts + " conflicting updates");
    }
}
