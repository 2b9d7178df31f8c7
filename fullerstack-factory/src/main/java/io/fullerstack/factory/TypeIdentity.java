package io.fullerstack.factory;

import lombok.experimental.UtilityClass;

import java.util.Optional;

/**
 * Recovers the type id of an instance created by a {@link Factory}.
 * <p>
 * Missing capability is a normal answer, not an error: instances that do not implement
 * {@link TypeIdentified} report the empty string.
 */
@UtilityClass
public class TypeIdentity {

    /**
     * Returns the type id of {@code instance}.
     *
     * @param instance the instance, may be null
     * @return the type id, or the empty string if unknown
     */
    public static String typeIdOf(Object instance) {
        return find(instance).orElse("");
    }

    /**
     * Returns the type id of {@code instance}, if it has one.
     *
     * @param instance the instance, may be null
     * @return the non-empty type id, or empty
     */
    public static Optional<String> find(Object instance) {
        if (!(instance instanceof TypeIdentified identified)) {
            return Optional.empty();
        }
        String typeId = identified.typeId();
        return typeId == null || typeId.isEmpty() ? Optional.empty() : Optional.of(typeId);
    }
}
