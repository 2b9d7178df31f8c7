package io.fullerstack.factory.bootstrap;

import io.fullerstack.factory.Factory;
import io.fullerstack.factory.FactoryException;
import io.fullerstack.factory.config.FactoryConfig;
import io.fullerstack.factory.spi.FactoryRegistrar;
import io.fullerstack.factory.storage.TypeKeyedStorage;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Explicit startup registration for factories.
 * <p>
 * Runs every {@link FactoryRegistrar} once, in a deliberate step at process start, instead
 * of relying on static initializers whose order across classes is unspecified.
 * <p>
 * <strong>Bootstrap Flow:</strong>
 * <ol>
 *   <li>Read defaults from {@link FactoryConfig} ({@code factory.properties})</li>
 *   <li>Run explicitly added registrars, in the order added</li>
 *   <li>Load {@link FactoryRegistrar} implementations via {@link ServiceLoader} and run them</li>
 *   <li>Optionally close registration for the storage</li>
 * </ol>
 * <p>
 * <strong>Usage (Zero Configuration):</strong>
 * <pre>
 * BootstrapResult result = FactoryBootstrap.bootstrap();
 * Shape shape = Factory.of(Shape.class).newInstance("circle");
 * </pre>
 * <p>
 * <strong>Usage (Custom Configuration):</strong>
 * <pre>
 * BootstrapResult result = FactoryBootstrap.builder()
 *     .storage(new TypeKeyedStorage())
 *     .failFast(false)
 *     .closeRegistration(true)
 *     .onRegistrarApplied(name -&gt; System.out.println("Applied: " + name))
 *     .bootstrap();
 * </pre>
 *
 * @see FactoryRegistrar
 * @see FactoryConfig
 */
public class FactoryBootstrap {

    private static final Logger logger = LoggerFactory.getLogger(FactoryBootstrap.class);

    /**
     * Bootstrap the global storage with default configuration.
     *
     * @return Bootstrap result
     */
    public static BootstrapResult bootstrap() {
        return builder().bootstrap();
    }

    /**
     * Create a builder for custom bootstrap configuration.
     *
     * @return Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for customizing bootstrap behavior.
     */
    public static class Builder {

        private TypeKeyedStorage storage = TypeKeyedStorage.global();
        private ClassLoader classLoader;
        private FactoryConfig config;
        private Boolean failFast;
        private Boolean closeRegistration;
        private boolean discover = true;
        private final List<FactoryRegistrar> registrars = new ArrayList<>();

        private Consumer<String> onRegistrarApplied = name -> {};
        private BiConsumer<String, Exception> onError = (name, error) -> {
            logger.error("Bootstrap error in registrar: {}", name, error);
        };

        /**
         * Set the storage receiving registrations (default: {@link TypeKeyedStorage#global()}).
         *
         * @param storage Storage
         * @return This builder
         */
        public Builder storage(TypeKeyedStorage storage) {
            this.storage = Objects.requireNonNull(storage);
            return this;
        }

        /**
         * Set the class loader used to discover registrars
         * (default: thread context class loader).
         *
         * @param classLoader Class loader
         * @return This builder
         */
        public Builder classLoader(ClassLoader classLoader) {
            this.classLoader = Objects.requireNonNull(classLoader);
            return this;
        }

        /**
         * Set the configuration supplying defaults (default: {@link FactoryConfig#global()}).
         *
         * @param config Configuration
         * @return This builder
         */
        public Builder config(FactoryConfig config) {
            this.config = Objects.requireNonNull(config);
            return this;
        }

        /**
         * Add a registrar to run before the discovered ones.
         *
         * @param registrar Registrar
         * @return This builder
         */
        public Builder registrar(FactoryRegistrar registrar) {
            this.registrars.add(Objects.requireNonNull(registrar));
            return this;
        }

        /**
         * Enable or disable {@link ServiceLoader} discovery (default: enabled).
         *
         * @param discover true to discover registrars
         * @return This builder
         */
        public Builder discover(boolean discover) {
            this.discover = discover;
            return this;
        }

        /**
         * Rethrow the first registrar failure instead of reporting it and continuing.
         *
         * @param failFast Fail-fast flag
         * @return This builder
         */
        public Builder failFast(boolean failFast) {
            this.failFast = failFast;
            return this;
        }

        /**
         * Close registration for the storage once all registrars ran.
         *
         * @param closeRegistration Close flag
         * @return This builder
         */
        public Builder closeRegistration(boolean closeRegistration) {
            this.closeRegistration = closeRegistration;
            return this;
        }

        /**
         * Set callback invoked after a registrar ran successfully.
         *
         * @param callback Callback (registrarName) → void
         * @return This builder
         */
        public Builder onRegistrarApplied(Consumer<String> callback) {
            this.onRegistrarApplied = Objects.requireNonNull(callback);
            return this;
        }

        /**
         * Set callback invoked when a registrar fails and fail-fast is off.
         *
         * @param callback Callback (registrarName, exception) → void
         * @return This builder
         */
        public Builder onError(BiConsumer<String, Exception> callback) {
            this.onError = Objects.requireNonNull(callback);
            return this;
        }

        /**
         * Execute bootstrap process.
         *
         * @return Bootstrap result
         * @throws FactoryException if fail-fast is on and a registrar fails
         */
        public BootstrapResult bootstrap() {
            boolean effectiveFailFast = failFast != null ? failFast : config().bootstrapFailFast();
            boolean effectiveClose = closeRegistration != null ? closeRegistration : config().bootstrapCloseRegistration();

            logger.info("Starting factory bootstrap (failFast={}, closeRegistration={})", effectiveFailFast, effectiveClose);

            List<String> applied = new ArrayList<>();
            List<String> failed = new ArrayList<>();

            // Phase 1: Explicit registrars
            for (FactoryRegistrar registrar : registrars) {
                apply(registrar, effectiveFailFast, applied, failed);
            }

            // Phase 2: Registrars discovered via SPI
            if (discover) {
                ClassLoader loader = classLoader != null ? classLoader : Thread.currentThread().getContextClassLoader();
                Iterator<FactoryRegistrar> providers = ServiceLoader.load(FactoryRegistrar.class, loader).iterator();
                while (true) {
                    FactoryRegistrar registrar;
                    try {
                        if (!providers.hasNext()) {
                            break;
                        }
                        registrar = providers.next();
                    } catch (ServiceConfigurationError e) {
                        fail("<service-loader>", new FactoryException("Cannot load registrar", e), effectiveFailFast, failed);
                        continue;
                    }
                    apply(registrar, effectiveFailFast, applied, failed);
                }
            }

            // Phase 3: Close registration
            if (effectiveClose && Factory.closeRegistration(storage)) {
                logger.info("Registration closed");
            }

            logger.info("Bootstrap complete: {} registrars applied, {} failed", applied.size(), failed.size());

            return new BootstrapResult(storage, applied, failed, Factory.isRegistrationClosed(storage));
        }

        private void apply(FactoryRegistrar registrar, boolean failFast, List<String> applied, List<String> failed) {
            String name = Objects.requireNonNullElse(registrar.name(), registrar.getClass().getName());
            try {
                registrar.registerTypes(storage);
            } catch (Exception e) {
                fail(name, e, failFast, failed);
                return;
            }
            applied.add(name);
            onRegistrarApplied.accept(name);
            logger.debug("Applied registrar '{}'", name);
        }

        private void fail(String name, Exception error, boolean failFast, List<String> failed) {
            if (failFast) {
                throw new FactoryException("Registrar '" + name + "' failed", error);
            }
            failed.add(name);
            onError.accept(name, error);
        }

        private FactoryConfig config() {
            if (config == null) {
                config = FactoryConfig.global();
            }
            return config;
        }
    }

    /**
     * Result of bootstrap process.
     */
    @Getter
    public static class BootstrapResult {

        private final TypeKeyedStorage storage;
        private final List<String> appliedRegistrars;
        private final List<String> failedRegistrars;
        private final boolean registrationClosed;

        public BootstrapResult(
                TypeKeyedStorage storage,
                List<String> appliedRegistrars,
                List<String> failedRegistrars,
                boolean registrationClosed
        ) {
            this.storage = Objects.requireNonNull(storage);
            this.appliedRegistrars = List.copyOf(appliedRegistrars);
            this.failedRegistrars = List.copyOf(failedRegistrars);
            this.registrationClosed = registrationClosed;
        }

        /**
         * Get the factory of {@code interfaceType} over the bootstrapped storage.
         *
         * @param interfaceType Interface type
         * @param <I>           Interface type
         * @return Factory view
         */
        public <I> Factory<I> factory(Class<I> interfaceType) {
            return Factory.of(storage, interfaceType);
        }

        @Override
        public String toString() {
            return "BootstrapResult[applied=" + appliedRegistrars + ", failed=" + failedRegistrars
                + ", registrationClosed=" + registrationClosed + "]";
        }
    }
}
