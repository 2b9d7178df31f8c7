package io.fullerstack.factory;

import lombok.experimental.UtilityClass;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.Objects;

/**
 * Reads the metadata attached to implementation classes.
 * <ul>
 *   <li>{@link #typeIdOf(Class)} - the id declared with {@link FactoryTypeId}</li>
 *   <li>{@link #constructorGenerator(Class)} - a {@link Generator} calling the public no-arg constructor</li>
 * </ul>
 */
@UtilityClass
public class ImplementationTraits {

    /**
     * Checks if {@code implementation} declares a type id.
     *
     * @param implementation implementation type
     * @return true if annotated with {@link FactoryTypeId}
     */
    public static boolean hasTypeId(Class<?> implementation) {
        Objects.requireNonNull(implementation, "implementation cannot be null");
        return implementation.isAnnotationPresent(FactoryTypeId.class);
    }

    /**
     * Returns the type id declared on {@code implementation}.
     *
     * @param implementation implementation type
     * @return declared type id
     * @throws IllegalArgumentException if the class is not annotated or the id is blank
     */
    public static String typeIdOf(Class<?> implementation) {
        Objects.requireNonNull(implementation, "implementation cannot be null");
        FactoryTypeId annotation = implementation.getAnnotation(FactoryTypeId.class);
        if (annotation == null) {
            throw new IllegalArgumentException(
                implementation.getName() + " does not declare @" + FactoryTypeId.class.getSimpleName()
            );
        }
        if (annotation.value().isBlank()) {
            throw new IllegalArgumentException(
                implementation.getName() + " declares a blank @" + FactoryTypeId.class.getSimpleName()
            );
        }
        return annotation.value();
    }

    /**
     * Build a generator calling the public no-arg constructor of {@code implementation}.
     * <p>
     * The constructor is resolved now, so a missing constructor fails at registration rather
     * than at creation. Unchecked exceptions thrown by the constructor propagate unchanged;
     * checked ones are wrapped in {@link FactoryException}.
     *
     * @param implementation concrete implementation type
     * @param <T>            implementation type
     * @return generator
     * @throws IllegalArgumentException if the type is abstract or has no public no-arg constructor
     */
    public static <T> Generator<T> constructorGenerator(Class<T> implementation) {
        Objects.requireNonNull(implementation, "implementation cannot be null");
        if (implementation.isInterface() || Modifier.isAbstract(implementation.getModifiers())) {
            throw new IllegalArgumentException(implementation.getName() + " is not a concrete class");
        }

        Constructor<T> constructor;
        try {
            constructor = implementation.getConstructor();
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException(
                implementation.getName() + " has no public no-arg constructor", e
            );
        }

        return () -> {
            try {
                return constructor.newInstance();
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                if (cause instanceof Error error) {
                    throw error;
                }
                throw new FactoryException("Constructor of " + implementation.getName() + " failed", cause);
            } catch (ReflectiveOperationException e) {
                throw new FactoryException("Cannot instantiate " + implementation.getName(), e);
            }
        };
    }
}
