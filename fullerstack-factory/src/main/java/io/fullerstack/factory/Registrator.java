package io.fullerstack.factory;

import io.fullerstack.factory.registry.RegisteredTypeId;

import java.util.Objects;

/**
 * Performs one registration when constructed.
 * <p>
 * Construction (1) registers the generator with the factory and (2) records the type id for
 * the implementation, so that {@link Factory#staticTypeId(Class)} and
 * {@link AbstractTypeIdentified#typeId()} can answer it later. The object has no further
 * role; keeping or dropping it has no effect on the registry.
 *
 * <p><b>Usage:</b>
 * <pre>
 * Factory&lt;Shape&gt; shapes = Factory.of(Shape.class);
 *
 * new Registrator&lt;&gt;(shapes, "circle", Circle.class, Circle::new);
 * Registrator.register(shapes, "square", Square.class);   // public no-arg constructor
 * Registrator.register(shapes, Triangle.class);           // id from &#64;FactoryTypeId
 * </pre>
 *
 * @param <I> the interface type
 * @param <T> the implementation type
 */
public final class Registrator<I, T extends I> {

    private final Factory<I> factory;
    private final String typeId;
    private final Class<T> implementation;

    /**
     * Register {@code generator} under {@code typeId}.
     *
     * @param factory        target factory
     * @param typeId         type id
     * @param implementation implementation type the generator produces
     * @param generator      generator of {@code implementation} instances
     * @throws DuplicateTypeIdException    if {@code typeId} is already registered
     * @throws RegistrationClosedException if registration is closed
     */
    public Registrator(Factory<I> factory, String typeId, Class<T> implementation, Generator<? extends T> generator) {
        this.factory = Objects.requireNonNull(factory, "factory cannot be null");
        this.typeId = Objects.requireNonNull(typeId, "typeId cannot be null");
        this.implementation = Objects.requireNonNull(implementation, "implementation cannot be null");

        factory.registerType(typeId, generator);
        factory.storage()
            .cell(Factory.typeIdKey(implementation, factory.interfaceType()), RegisteredTypeId.class, RegisteredTypeId::new)
            .set(typeId);
    }

    /**
     * Register {@code generator} under {@code typeId}.
     *
     * @return the registrator
     */
    public static <I, T extends I> Registrator<I, T> register(
        Factory<I> factory, String typeId, Class<T> implementation, Generator<? extends T> generator) {
        return new Registrator<>(factory, typeId, implementation, generator);
    }

    /**
     * Register the public no-arg constructor of {@code implementation} under {@code typeId}.
     *
     * @return the registrator
     */
    public static <I, T extends I> Registrator<I, T> register(Factory<I> factory, String typeId, Class<T> implementation) {
        return new Registrator<>(factory, typeId, implementation, ImplementationTraits.constructorGenerator(implementation));
    }

    /**
     * Register the public no-arg constructor of {@code implementation} under the id declared
     * with {@link FactoryTypeId}.
     *
     * @return the registrator
     * @throws IllegalArgumentException if {@code implementation} declares no type id
     */
    public static <I, T extends I> Registrator<I, T> register(Factory<I> factory, Class<T> implementation) {
        return register(factory, ImplementationTraits.typeIdOf(implementation), implementation);
    }

    public Factory<I> factory() {
        return factory;
    }

    public String typeId() {
        return typeId;
    }

    public Class<T> implementation() {
        return implementation;
    }

    @Override
    public String toString() {
        return "Registrator[" + typeId + " -> " + implementation.getName() + "]";
    }
}
