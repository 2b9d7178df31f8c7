package io.fullerstack.factory.example;

import io.fullerstack.factory.Factory;
import io.fullerstack.factory.Registrator;
import io.fullerstack.factory.spi.FactoryRegistrar;
import io.fullerstack.factory.storage.TypeKeyedStorage;

/**
 * Registers the example greeters under their declared ids.
 * <p>
 * Listed in {@code META-INF/services/io.fullerstack.factory.spi.FactoryRegistrar}.
 */
public class ExampleRegistrar implements FactoryRegistrar {

    @Override
    public void registerTypes(TypeKeyedStorage storage) {
        Factory<Greeter> greeters = Factory.of(storage, Greeter.class);
        Registrator.register(greeters, AlphaGreeter.class);
        Registrator.register(greeters, BetaGreeter.class);
    }

    @Override
    public String name() {
        return "example-greeters";
    }
}
