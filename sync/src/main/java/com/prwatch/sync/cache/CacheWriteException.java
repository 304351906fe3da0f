package com.prwatch.sync.cache;

/**
 * The cache file could not be written. The in-memory state is still intact.
 */
public class CacheWriteException extends RuntimeException {

    public CacheWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
