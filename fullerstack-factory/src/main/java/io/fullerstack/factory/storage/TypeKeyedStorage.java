package io.fullerstack.factory.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Storage handing back one lazily created value per (owner type, value type) pair.
 *
 * <p><b>Addressing:</b>
 * Cells are addressed by {@link StorageKey}, built from binary class names. Code loaded by
 * separate class loaders (plugin jars, isolated modules) that asks for the same pair of
 * names therefore reaches the same cell, even when each loader defined its own copy of the
 * owner class.
 *
 * <p><b>Lifecycle:</b>
 * <ul>
 *   <li>A cell is created on first access and held until the storage itself is discarded</li>
 *   <li>There is no removal: the cell count only grows</li>
 *   <li>{@link #global()} is the process-wide instance; {@code new TypeKeyedStorage()}
 *       gives an isolated one (tests, embedded containers)</li>
 * </ul>
 *
 * <p><b>Thread safety:</b>
 * First creation is guarded per key with {@link ConcurrentHashMap#computeIfAbsent}, so
 * concurrent first access to one cell creates exactly one value. The values themselves are
 * not synchronized by the storage.
 *
 * <p><b>Usage:</b>
 * <pre>
 * TypeKeyedStorage storage = TypeKeyedStorage.global();
 * RegistryTable table = storage.cell(Owner.class, RegistryTable.class);
 * </pre>
 */
public final class TypeKeyedStorage {

    private static final Logger logger = LoggerFactory.getLogger(TypeKeyedStorage.class);

    private final ConcurrentMap<StorageKey, Object> cells = new ConcurrentHashMap<>();

    /**
     * Creates an empty, isolated storage.
     */
    public TypeKeyedStorage() {
    }

    /**
     * Get the process-wide storage.
     *
     * @return the global storage singleton
     */
    public static TypeKeyedStorage global() {
        return GlobalHolder.INSTANCE;
    }

    /**
     * Get the cell for (owner, valueType), default-constructing its value on first access.
     *
     * @param owner     owner type
     * @param valueType value type, must have an accessible no-arg constructor
     * @param <V>       value type
     * @return the cell value
     * @throws StorageException if the value cannot be constructed or the cell holds another type
     */
    public <V> V cell(Class<?> owner, Class<V> valueType) {
        Objects.requireNonNull(valueType, "valueType cannot be null");
        return cell(StorageKey.of(owner, valueType), valueType, () -> construct(valueType));
    }

    /**
     * Get the cell for (owner, valueType), creating its value with {@code initializer} on first access.
     *
     * @param owner       owner type
     * @param valueType   value type
     * @param initializer creates the value; called at most once per cell
     * @param <V>         value type
     * @return the cell value
     * @throws StorageException if the cell holds another type
     */
    public <V> V cell(Class<?> owner, Class<V> valueType, Supplier<? extends V> initializer) {
        return cell(StorageKey.of(owner, valueType), valueType, initializer);
    }

    /**
     * Get the cell addressed by {@code key}, creating its value with {@code initializer} on first access.
     *
     * @param key         cell address
     * @param valueType   expected value type
     * @param initializer creates the value; called at most once per cell
     * @param <V>         value type
     * @return the cell value
     * @throws StorageException if the initializer returns null or the cell holds another type
     */
    public <V> V cell(StorageKey key, Class<V> valueType, Supplier<? extends V> initializer) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(valueType, "valueType cannot be null");
        Objects.requireNonNull(initializer, "initializer cannot be null");

        Object value = cells.computeIfAbsent(key, k -> {
            V created = initializer.get();
            if (created == null) {
                throw new StorageException("Initializer returned null for cell " + k);
            }
            logger.debug("Created storage cell {}", k);
            return created;
        });
        return checkType(key, value, valueType);
    }

    /**
     * Look up an existing cell without creating it.
     *
     * @param key       cell address
     * @param valueType expected value type
     * @param <V>       value type
     * @return the cell value, or empty if the cell was never created
     * @throws StorageException if the cell holds another type
     */
    public <V> Optional<V> find(StorageKey key, Class<V> valueType) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(valueType, "valueType cannot be null");

        Object value = cells.get(key);
        if (value == null) {
            return Optional.empty();
        }
        return Optional.of(checkType(key, value, valueType));
    }

    /**
     * Check whether a cell exists.
     *
     * @param key cell address
     * @return true if the cell was created
     */
    public boolean contains(StorageKey key) {
        Objects.requireNonNull(key, "key cannot be null");
        return cells.containsKey(key);
    }

    /**
     * Returns all created cell addresses.
     *
     * @return unmodifiable view of cell keys
     */
    public Set<StorageKey> keys() {
        return Collections.unmodifiableSet(cells.keySet());
    }

    /**
     * Returns the number of created cells.
     *
     * @return cell count
     */
    public int size() {
        return cells.size();
    }

    private static <V> V checkType(StorageKey key, Object value, Class<V> valueType) {
        if (!valueType.isInstance(value)) {
            // Same binary name, different defining loader
            throw new StorageException(
                "Cell " + key + " holds " + describe(value.getClass())
                    + ", not assignable to " + describe(valueType)
            );
        }
        return valueType.cast(value);
    }

    private static <V> V construct(Class<V> valueType) {
        try {
            Constructor<V> constructor = valueType.getDeclaredConstructor();
            return constructor.newInstance();
        } catch (NoSuchMethodException e) {
            throw new StorageException(
                "Cell value type " + valueType.getName() + " has no no-arg constructor", e
            );
        } catch (InvocationTargetException e) {
            throw new StorageException(
                "Constructor of cell value type " + valueType.getName() + " failed", e.getCause()
            );
        } catch (ReflectiveOperationException | SecurityException e) {
            throw new StorageException(
                "Cannot construct cell value type " + valueType.getName(), e
            );
        }
    }

    private static String describe(Class<?> type) {
        return type.getName() + " (loader " + type.getClassLoader() + ")";
    }

    @Override
    public String toString() {
        return "TypeKeyedStorage[cells=" + cells.size() + "]";
    }

    private static final class GlobalHolder {
        private static final TypeKeyedStorage INSTANCE = new TypeKeyedStorage();
    }
}
