package io.fullerstack.factory;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Attaches a fixed type id to an implementation class.
 * <p>
 * Lets registration code find the id of a type without the call site naming it:
 * <pre>
 * &#64;FactoryTypeId("circle")
 * public class Circle implements Shape { ... }
 *
 * Registrator.register(Factory.of(Shape.class), Circle.class);
 * </pre>
 * Generic implementations carry one id for all of their parameterizations.
 *
 * @see ImplementationTraits
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface FactoryTypeId {

    /**
     * The type id.
     *
     * @return non-blank type id
     */
    String value();
}
