package io.fullerstack.factory.registry;

/**
 * Storage cell value recording the type id an implementation was registered under.
 * Empty until a {@link io.fullerstack.factory.Registrator} writes it.
 */
public final class RegisteredTypeId {

    private volatile String value = "";

    public String get() {
        return value;
    }

    public void set(String typeId) {
        this.value = typeId == null ? "" : typeId;
    }

    @Override
    public String toString() {
        return value;
    }
}
