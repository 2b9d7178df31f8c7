package io.fullerstack.factory;

/**
 * Base type of all errors raised by the factory registry.
 * <p>
 * Unchecked: the registry reports failures straight to the immediate caller and never
 * retries, suppresses or logs them itself.
 */
public class FactoryException extends RuntimeException {

    public FactoryException(String message) {
        super(message);
    }

    public FactoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
