package io.fullerstack.factory;

import io.fullerstack.factory.registry.RegisteredTypeId;
import io.fullerstack.factory.registry.RegistrationGate;
import io.fullerstack.factory.registry.RegistryTable;
import io.fullerstack.factory.storage.StorageKey;
import io.fullerstack.factory.storage.TypeKeyedStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Creates instances of an interface by type id.
 * <p>
 * Each interface owns one {@link RegistryTable}, kept in a {@link TypeKeyedStorage} cell
 * addressed by {@code (Factory<I>, RegistryTable)}. Every {@code Factory} view of the same
 * interface over the same storage shares that table, including views built from a copy of
 * the interface defined by another class loader.
 *
 * <p><b>Usage:</b>
 * <pre>
 * Factory&lt;Shape&gt; shapes = Factory.of(Shape.class);
 * shapes.registerType("circle", Circle::new);
 *
 * Shape shape = shapes.newInstance("circle");
 * List&lt;String&gt; ids = shapes.registeredTypes();   // [circle]
 * </pre>
 *
 * <p><b>Errors:</b>
 * <ul>
 *   <li>{@link UnknownTypeIdException} - no generator under the requested id</li>
 *   <li>{@link DuplicateTypeIdException} - id already registered for this interface</li>
 *   <li>{@link RegistrationClosedException} - registration closed for the storage</li>
 * </ul>
 *
 * @param <I> the interface type
 * @see Registrator
 */
public final class Factory<I> {

    private static final Logger logger = LoggerFactory.getLogger(Factory.class);

    private final Class<I> interfaceType;
    private final TypeKeyedStorage storage;
    private final RegistryTable table;

    private Factory(TypeKeyedStorage storage, Class<I> interfaceType) {
        this.storage = storage;
        this.interfaceType = interfaceType;
        this.table = storage.cell(tableKey(interfaceType), RegistryTable.class, RegistryTable::new);
    }

    /**
     * Get the factory of {@code interfaceType} backed by the global storage.
     *
     * @param interfaceType the interface type
     * @param <I>           the interface type
     * @return factory view
     */
    public static <I> Factory<I> of(Class<I> interfaceType) {
        return of(TypeKeyedStorage.global(), interfaceType);
    }

    /**
     * Get the factory of {@code interfaceType} backed by {@code storage}.
     *
     * @param storage       storage holding the registry tables
     * @param interfaceType the interface type
     * @param <I>           the interface type
     * @return factory view
     */
    public static <I> Factory<I> of(TypeKeyedStorage storage, Class<I> interfaceType) {
        Objects.requireNonNull(storage, "storage cannot be null");
        Objects.requireNonNull(interfaceType, "interfaceType cannot be null");
        return new Factory<>(storage, interfaceType);
    }

    /**
     * Register a generator under a type id.
     *
     * @param typeId    non-blank type id, unique within this interface
     * @param generator creates instances of the implementation
     * @throws DuplicateTypeIdException     if {@code typeId} is already registered
     * @throws RegistrationClosedException  if registration is closed for the storage
     * @throws IllegalArgumentException     if {@code typeId} is blank
     */
    public void registerType(String typeId, Generator<? extends I> generator) {
        Objects.requireNonNull(typeId, "typeId cannot be null");
        Objects.requireNonNull(generator, "generator cannot be null");
        if (typeId.isBlank()) {
            throw new IllegalArgumentException("typeId cannot be blank");
        }

        RegistrationGate gate = gate(storage);
        if (!gate.enter()) {
            throw new RegistrationClosedException(interfaceType.getName(), typeId);
        }
        try {
            if (table.putIfAbsent(typeId, generator) != null) {
                throw new DuplicateTypeIdException(interfaceType.getName(), typeId);
            }
        } finally {
            gate.exit();
        }
        logger.debug("Registered type '{}' for {}", typeId, interfaceType.getName());
    }

    /**
     * Create a new instance of the type registered under {@code typeId}.
     * <p>
     * Exceptions thrown by the generator propagate unchanged. Instances extending
     * {@link AbstractTypeIdentified} are bound to this factory's storage, so they report the
     * id registered here.
     *
     * @param typeId registered type id
     * @return new instance
     * @throws UnknownTypeIdException         if {@code typeId} is not registered
     * @throws FactoryException              if the generator returns null
     * @throws InstanceTypeMismatchException if the instance does not implement this view's interface
     */
    public I newInstance(String typeId) {
        Objects.requireNonNull(typeId, "typeId cannot be null");

        Generator<?> generator = table.get(typeId);
        if (generator == null) {
            throw new UnknownTypeIdException(interfaceType.getName(), typeId);
        }

        Object instance = generator.newInstance();
        if (instance == null) {
            throw new FactoryException(
                "Generator for type '" + typeId + "' in registry of " + interfaceType.getName() + " returned null"
            );
        }
        if (!interfaceType.isInstance(instance)) {
            throw new InstanceTypeMismatchException(typeId, interfaceType, instance.getClass());
        }
        if (instance instanceof AbstractTypeIdentified<?> identified) {
            identified.bind(storage);
        }
        return interfaceType.cast(instance);
    }

    /**
     * Returns all registered type ids, sorted.
     *
     * @return immutable snapshot of type ids
     */
    public List<String> registeredTypes() {
        return table.typeIds();
    }

    /**
     * Checks if a type id is registered.
     *
     * @param typeId type id to check
     * @return true if registered
     */
    public boolean isTypeRegistered(String typeId) {
        Objects.requireNonNull(typeId, "typeId cannot be null");
        return table.contains(typeId);
    }

    /**
     * Returns the type id a {@link Registrator} recorded for {@code implementation}.
     *
     * @param implementation implementation type
     * @return the type id, or the empty string if never registered through a Registrator
     */
    public String staticTypeId(Class<? extends I> implementation) {
        Objects.requireNonNull(implementation, "implementation cannot be null");
        return storage.find(typeIdKey(implementation, interfaceType), RegisteredTypeId.class)
            .map(RegisteredTypeId::get)
            .orElse("");
    }

    public Class<I> interfaceType() {
        return interfaceType;
    }

    public TypeKeyedStorage storage() {
        return storage;
    }

    /**
     * Close registration for every interface of {@code storage}.
     * Waits for registrations in flight; afterwards {@link #registerType} fails with
     * {@link RegistrationClosedException}.
     *
     * @param storage the storage
     * @return true if this call closed registration, false if it was already closed
     */
    public static boolean closeRegistration(TypeKeyedStorage storage) {
        Objects.requireNonNull(storage, "storage cannot be null");
        boolean closed = gate(storage).close();
        if (closed) {
            logger.debug("Registration closed for {}", storage);
        }
        return closed;
    }

    /**
     * Checks if registration is closed for {@code storage}.
     *
     * @param storage the storage
     * @return true if closed
     */
    public static boolean isRegistrationClosed(TypeKeyedStorage storage) {
        Objects.requireNonNull(storage, "storage cannot be null");
        return storage.find(StorageKey.of(Factory.class, RegistrationGate.class), RegistrationGate.class)
            .map(RegistrationGate::isClosed)
            .orElse(false);
    }

    static StorageKey typeIdKey(Class<?> implementation, Class<?> interfaceType) {
        return StorageKey.of(Registrator.class, List.of(implementation, interfaceType), RegisteredTypeId.class);
    }

    private static StorageKey tableKey(Class<?> interfaceType) {
        return StorageKey.of(Factory.class, List.of(interfaceType), RegistryTable.class);
    }

    private static RegistrationGate gate(TypeKeyedStorage storage) {
        return storage.cell(Factory.class, RegistrationGate.class);
    }

    @Override
    public String toString() {
        return "Factory[" + interfaceType.getName() + ", types=" + table.typeIds() + "]";
    }
}
