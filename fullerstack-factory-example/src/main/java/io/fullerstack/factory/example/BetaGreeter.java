package io.fullerstack.factory.example;

import io.fullerstack.factory.AbstractTypeIdentified;
import io.fullerstack.factory.FactoryTypeId;

@FactoryTypeId("B")
public class BetaGreeter extends AbstractTypeIdentified<Greeter> implements Greeter {

    public BetaGreeter() {
        super(Greeter.class);
    }

    @Override
    public String hello() {
        return "B::hello()";
    }
}
