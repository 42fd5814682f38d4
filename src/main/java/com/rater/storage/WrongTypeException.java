package com.rater.storage;

/**
 * The key already holds unrelated data of another type.
 */
public class WrongTypeException extends StorageException {

    private final String key;

    public WrongTypeException(String key, Throwable cause) {
        super("WRONGTYPE Operation against a key holding the wrong kind of value: " + key, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
