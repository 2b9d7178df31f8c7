package io.fullerstack.factory;

/**
 * Zero-argument function producing a new instance of one implementation.
 * <p>
 * Stored by value in the registry and invoked once per {@link Factory#newInstance(String)}.
 * Usually a constructor reference:
 * <pre>
 * Generator&lt;Circle&gt; generator = Circle::new;
 * </pre>
 *
 * @param <T> the produced type
 */
@FunctionalInterface
public interface Generator<T> {

    /**
     * Create a new instance.
     *
     * @return a new, non-null instance
     */
    T newInstance();
}
