package io.fullerstack.factory;

/**
 * Thrown by {@link Factory#newInstance(String)} when no generator is registered under the
 * requested type id.
 * <p>
 * Recoverable: callers may retry with another id or report the id as bad input.
 */
public class UnknownTypeIdException extends FactoryException {

    private final String interfaceName;
    private final String typeId;

    public UnknownTypeIdException(String interfaceName, String typeId) {
        super("Failed to find type '" + typeId + "' in registry of " + interfaceName);
        this.interfaceName = interfaceName;
        this.typeId = typeId;
    }

    public String interfaceName() {
        return interfaceName;
    }

    public String typeId() {
        return typeId;
    }
}
