package io.fullerstack.factory.storage;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Address of one cell in a {@link TypeKeyedStorage}.
 * <p>
 * A key is a pair of (owner, value) type names. Both parts are JVM binary class names
 * ({@link Class#getName()}), never {@link Class} references: the same class loaded by two
 * different class loaders yields two distinct {@code Class} objects but one name, and both
 * must resolve to the same cell.
 * <p>
 * Parameterized owners are rendered with their arguments, so that
 * {@code Factory<Shape>} and {@code Factory<Codec>} address different cells:
 * <pre>
 * StorageKey.of(Factory.class, List.of(Shape.class), RegistryTable.class)
 * // owner = "io.fullerstack.factory.Factory&lt;com.acme.Shape&gt;"
 * </pre>
 *
 * @param owner binary name of the owner type, with optional {@code <...>} arguments
 * @param value binary name of the value type held by the cell
 */
public record StorageKey(String owner, String value) {

    public StorageKey {
        Objects.requireNonNull(owner, "owner cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        if (owner.isBlank()) {
            throw new IllegalArgumentException("owner cannot be blank");
        }
        if (value.isBlank()) {
            throw new IllegalArgumentException("value cannot be blank");
        }
    }

    /**
     * Key for a plain (owner, value) pair.
     *
     * @param owner owner type
     * @param value value type
     * @return storage key
     */
    public static StorageKey of(Class<?> owner, Class<?> value) {
        Objects.requireNonNull(owner, "owner cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        return new StorageKey(owner.getName(), value.getName());
    }

    /**
     * Key for a parameterized owner, e.g. {@code Factory<Shape>}.
     *
     * @param owner         raw owner type
     * @param ownerArguments type arguments of the owner, in declaration order
     * @param value         value type
     * @return storage key
     */
    public static StorageKey of(Class<?> owner, List<Class<?>> ownerArguments, Class<?> value) {
        Objects.requireNonNull(owner, "owner cannot be null");
        Objects.requireNonNull(ownerArguments, "ownerArguments cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        if (ownerArguments.isEmpty()) {
            return of(owner, value);
        }
        String arguments = ownerArguments.stream()
            .map(type -> Objects.requireNonNull(type, "owner argument cannot be null").getName())
            .collect(Collectors.joining(",", "<", ">"));
        return new StorageKey(owner.getName() + arguments, value.getName());
    }

    @Override
    public String toString() {
        return owner + " / " + value;
    }
}
