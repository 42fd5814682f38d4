package com.rater.storage;

/**
 * The key exists but its value is not a timestamp.
 * Never treated as a fresh bucket, which would silently reset the quota.
 */
public class CorruptStateException extends StorageException {

    private final String key;

    public CorruptStateException(String key, String value) {
        super("ERR invalid stored rater for key '" + key + "': " + value);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
