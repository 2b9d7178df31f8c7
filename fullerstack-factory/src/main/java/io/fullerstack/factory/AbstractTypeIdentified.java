package io.fullerstack.factory;

import io.fullerstack.factory.storage.TypeKeyedStorage;

import java.util.Objects;

/**
 * Base class giving implementations of {@code I} the {@link TypeIdentified} capability.
 * <p>
 * {@link #typeId()} answers the id a {@link Registrator} recorded for the runtime class,
 * or the empty string if the class was registered some other way. Instances created by
 * {@link Factory#newInstance(String)} resolve against that factory's storage; instances
 * constructed directly use the storage passed to the constructor.
 * <pre>
 * public class Circle extends AbstractTypeIdentified&lt;Shape&gt; implements Shape {
 *     public Circle() {
 *         super(Shape.class);
 *     }
 * }
 * </pre>
 *
 * @param <I> the interface type the subclass implements
 */
public abstract class AbstractTypeIdentified<I> implements TypeIdentified {

    private volatile TypeKeyedStorage storage;
    private final Class<I> interfaceType;

    /**
     * Resolve ids against the global storage unless a factory binds its own.
     *
     * @param interfaceType interface implemented by the subclass
     */
    protected AbstractTypeIdentified(Class<I> interfaceType) {
        this(TypeKeyedStorage.global(), interfaceType);
    }

    /**
     * Resolve ids against {@code storage}.
     *
     * @param storage       storage the implementation was registered in
     * @param interfaceType interface implemented by the subclass
     */
    protected AbstractTypeIdentified(TypeKeyedStorage storage, Class<I> interfaceType) {
        this.storage = Objects.requireNonNull(storage, "storage cannot be null");
        this.interfaceType = Objects.requireNonNull(interfaceType, "interfaceType cannot be null");
        if (!interfaceType.isInstance(this)) {
            throw new IllegalArgumentException(
                getClass().getName() + " does not implement " + interfaceType.getName()
            );
        }
    }

    void bind(TypeKeyedStorage storage) {
        this.storage = storage;
    }

    @Override
    public String typeId() {
        return Factory.of(storage, interfaceType).staticTypeId(getClass().asSubclass(interfaceType));
    }
}
