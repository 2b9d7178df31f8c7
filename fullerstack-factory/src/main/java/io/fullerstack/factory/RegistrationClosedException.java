package io.fullerstack.factory;

/**
 * Thrown when a type is registered after registration was closed for its storage.
 *
 * @see Factory#closeRegistration(io.fullerstack.factory.storage.TypeKeyedStorage)
 */
public class RegistrationClosedException extends FactoryException {

    public RegistrationClosedException(String interfaceName, String typeId) {
        super("Cannot register type '" + typeId + "' in registry of " + interfaceName
            + ": registration is closed");
    }
}
