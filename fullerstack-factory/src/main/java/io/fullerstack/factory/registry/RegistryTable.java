package io.fullerstack.factory.registry;

import io.fullerstack.factory.Generator;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Table of generators for one interface, keyed by type id.
 *
 * <p><b>Design:</b>
 * <ul>
 *   <li>Single {@link ConcurrentSkipListMap}: ids iterate in sorted order</li>
 *   <li>Insert-only: there is no remove, entries live as long as the table</li>
 *   <li>Ids are unique; {@link #putIfAbsent} never overwrites</li>
 * </ul>
 *
 * <p>One table exists per interface, stored in a
 * {@link io.fullerstack.factory.storage.TypeKeyedStorage} cell and reached through
 * {@link io.fullerstack.factory.Factory}.
 */
public final class RegistryTable {

    private final ConcurrentNavigableMap<String, Generator<?>> generators = new ConcurrentSkipListMap<>();

    /**
     * Insert a generator unless the id is already taken.
     *
     * @param typeId    the type id
     * @param generator the generator
     * @return the generator already registered under {@code typeId}, or null if inserted
     */
    public Generator<?> putIfAbsent(String typeId, Generator<?> generator) {
        Objects.requireNonNull(typeId, "typeId");
        Objects.requireNonNull(generator, "generator");
        return generators.putIfAbsent(typeId, generator);
    }

    /**
     * Get the generator for a type id.
     *
     * @param typeId the type id
     * @return the generator, or null if not registered
     */
    public Generator<?> get(String typeId) {
        Objects.requireNonNull(typeId, "typeId");
        return generators.get(typeId);
    }

    /**
     * Checks if a type id is registered.
     *
     * @param typeId the type id
     * @return true if present
     */
    public boolean contains(String typeId) {
        Objects.requireNonNull(typeId, "typeId");
        return generators.containsKey(typeId);
    }

    /**
     * Snapshot of registered ids, sorted.
     *
     * @return immutable list of type ids
     */
    public List<String> typeIds() {
        return List.copyOf(generators.keySet());
    }

    /**
     * Returns the number of registered ids.
     *
     * @return size of table
     */
    public int size() {
        return generators.size();
    }

    @Override
    public String toString() {
        return "RegistryTable" + generators.keySet();
    }
}
