package io.fullerstack.factory;

/**
 * Thrown when a type id is registered twice for the same interface.
 * <p>
 * The existing generator is kept; the second registration has no effect.
 */
public class DuplicateTypeIdException extends FactoryException {

    private final String interfaceName;
    private final String typeId;

    public DuplicateTypeIdException(String interfaceName, String typeId) {
        super("Type '" + typeId + "' already registered in registry of " + interfaceName);
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
