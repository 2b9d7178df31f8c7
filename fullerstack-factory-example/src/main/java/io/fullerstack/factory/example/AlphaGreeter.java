package io.fullerstack.factory.example;

import io.fullerstack.factory.AbstractTypeIdentified;
import io.fullerstack.factory.FactoryTypeId;

@FactoryTypeId("A")
public class AlphaGreeter extends AbstractTypeIdentified<Greeter> implements Greeter {

    public AlphaGreeter() {
        super(Greeter.class);
    }

    @Override
    public String hello() {
        return "A::hello()";
    }
}
