package io.fullerstack.factory;

/**
 * Thrown when a generator produces an instance that does not implement the factory's
 * interface, typically a copy of the interface defined by another class loader.
 */
public class InstanceTypeMismatchException extends FactoryException {

    private final String interfaceName;
    private final String typeId;

    public InstanceTypeMismatchException(String typeId, Class<?> interfaceType, Class<?> instanceType) {
        super(
            "Type '" + typeId + "' in registry of " + interfaceType.getName() + " produced "
                + instanceType.getName() + " (loader " + instanceType.getClassLoader()
                + "), which does not implement the interface of loader " + interfaceType.getClassLoader()
        );
        this.interfaceName = interfaceType.getName();
        this.typeId = typeId;
    }

    public String interfaceName() {
        return interfaceName;
    }

    public String typeId() {
        return typeId;
    }
}
