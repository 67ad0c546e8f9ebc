package com.tokenauth.server.store;

/**
 * A concurrent writer changed a refresh record first. Transient: retry against the new state.
 */
public class StorageConflictException extends RuntimeException {

    public StorageConflictException(String message) {
        super(message);
    }
}
