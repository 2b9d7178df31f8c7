package io.fullerstack.factory.storage;

import io.fullerstack.factory.FactoryException;

/**
 * Thrown when a storage cell cannot be created or does not hold the requested type.
 * Not meant to be recovered from.
 */
public class StorageException extends FactoryException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
