package io.fullerstack.factory.example;

import io.fullerstack.factory.TypeIdentified;

/**
 * Interface the example registers implementations of.
 */
public interface Greeter extends TypeIdentified {

    String hello();
}
