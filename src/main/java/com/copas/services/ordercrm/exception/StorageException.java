package com.copas.services.ordercrm.exception;

/**
 * Thrown when the database is unreachable or a unique-key conflict
 * cannot be resolved by re-reading the winning row. Never retried internally.
 */
public class StorageException extends OrderCrmException {

    public StorageException(String message) {
        super(message, "STORAGE_ERROR");
    }

    public StorageException(String message, Throwable cause) {
        super(message, "STORAGE_ERROR", cause);
    }
}
