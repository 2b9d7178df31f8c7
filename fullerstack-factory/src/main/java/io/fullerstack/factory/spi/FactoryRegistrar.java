package io.fullerstack.factory.spi;

import io.fullerstack.factory.storage.TypeKeyedStorage;

/**
 * Service Provider Interface for modules contributing implementations to factories.
 * <p>
 * Discovered by {@link io.fullerstack.factory.bootstrap.FactoryBootstrap} via
 * {@link java.util.ServiceLoader} and run once at startup.
 * <p>
 * <strong>Example Implementation:</strong>
 * <pre>
 * public class ShapeRegistrar implements FactoryRegistrar {
 *     &#64;Override
 *     public void registerTypes(TypeKeyedStorage storage) {
 *         Factory&lt;Shape&gt; shapes = Factory.of(storage, Shape.class);
 *         Registrator.register(shapes, Circle.class);
 *         Registrator.register(shapes, "square", Square.class);
 *     }
 * }
 * </pre>
 * <p>
 * <strong>Registration:</strong>
 * Create file: {@code META-INF/services/io.fullerstack.factory.spi.FactoryRegistrar}
 * <pre>
 * com.example.ShapeRegistrar
 * </pre>
 *
 * @see java.util.ServiceLoader
 */
public interface FactoryRegistrar {

    /**
     * Register this module's implementations.
     *
     * @param storage storage whose factories receive the registrations
     */
    void registerTypes(TypeKeyedStorage storage);

    /**
     * Name used in logs and bootstrap results.
     *
     * @return registrar name (defaults to the class name)
     */
    default String name() {
        return getClass().getName();
    }
}
