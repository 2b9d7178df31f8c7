package io.fullerstack.factory;

/**
 * Optional capability of an instance to report the type id it was created under.
 *
 * @see TypeIdentity#typeIdOf(Object)
 * @see AbstractTypeIdentified
 */
public interface TypeIdentified {

    /**
     * Returns the type id of this instance.
     *
     * @return the type id, or the empty string if the type was never registered
     */
    String typeId();
}
