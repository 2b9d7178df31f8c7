package io.fullerstack.factory.example;

import io.fullerstack.factory.Factory;
import io.fullerstack.factory.FactoryException;
import io.fullerstack.factory.bootstrap.FactoryBootstrap;
import io.fullerstack.factory.bootstrap.FactoryBootstrap.BootstrapResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Example application: bootstraps the registrars on the classpath, then creates
 * greeters by id and logs their greetings.
 * <p>
 * Usage: {@code java -jar fullerstack-factory-example.jar [typeId...]} (default {@code A B}).
 * Exits with status 1 if any greeter cannot be created.
 */
public class FactoryExample {

    private static final Logger logger = LoggerFactory.getLogger(FactoryExample.class);

    static final List<String> DEFAULT_TYPE_IDS = List.of("A", "B");

    public static void main(String[] args) {
        List<String> typeIds = args.length > 0 ? Arrays.asList(args) : DEFAULT_TYPE_IDS;
        System.exit(run(FactoryBootstrap.builder(), typeIds));
    }

    /**
     * Bootstrap with {@code builder} and greet once per type id.
     *
     * @param builder bootstrap configuration
     * @param typeIds greeter ids, in order
     * @return process exit status
     */
    static int run(FactoryBootstrap.Builder builder, List<String> typeIds) {
        try {
            BootstrapResult result = builder.bootstrap();
            Factory<Greeter> greeters = result.factory(Greeter.class);
            logger.info("Available greeters: {}", greeters.registeredTypes());

            for (String typeId : typeIds) {
                Greeter greeter = greeters.newInstance(typeId);
                logger.info("{} says {}", greeter.typeId(), greeter.hello());
            }
            return 0;
        } catch (FactoryException e) {
            logger.error("Example failed: {}", e.getMessage(), e);
            return 1;
        }
    }
}
