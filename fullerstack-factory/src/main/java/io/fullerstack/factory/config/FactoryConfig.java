package io.fullerstack.factory.config;

import java.util.Locale;
import java.util.MissingResourceException;
import java.util.Objects;
import java.util.Optional;
import java.util.ResourceBundle;

/**
 * Bootstrap settings read from a {@link ResourceBundle}, overridable per key with a system
 * property of the same name.
 *
 * <p><strong>Keys:</strong>
 * <pre>
 * # Rethrow the first registrar failure instead of reporting it and continuing
 * factory.bootstrap.fail-fast=true
 *
 * # Close registration once bootstrap has run all registrars
 * factory.bootstrap.close-registration=false
 * </pre>
 */
public class FactoryConfig {

    public static final String BUNDLE_NAME = "factory";

    public static final String BOOTSTRAP_FAIL_FAST = "factory.bootstrap.fail-fast";
    public static final String BOOTSTRAP_CLOSE_REGISTRATION = "factory.bootstrap.close-registration";

    private final ResourceBundle bundle;
    private final String context;

    private FactoryConfig(ResourceBundle bundle, String context) {
        this.bundle = bundle;
        this.context = context;
    }

    /**
     * Get the default configuration ({@code factory.properties}).
     *
     * @return configuration
     * @throws ConfigurationException if the bundle is not on the classpath
     */
    public static FactoryConfig global() {
        return fromBundle(BUNDLE_NAME);
    }

    /**
     * Get configuration from a named bundle.
     *
     * @param bundleName bundle base name
     * @return configuration
     * @throws ConfigurationException if the bundle is not on the classpath
     */
    public static FactoryConfig fromBundle(String bundleName) {
        Objects.requireNonNull(bundleName, "bundleName cannot be null");
        if (bundleName.isBlank()) {
            throw new IllegalArgumentException("bundleName cannot be blank");
        }

        try {
            return new FactoryConfig(ResourceBundle.getBundle(bundleName, Locale.ROOT), "bundle:" + bundleName);
        } catch (MissingResourceException e) {
            throw new ConfigurationException("Missing configuration bundle: " + bundleName, e);
        }
    }

    /**
     * Whether bootstrap rethrows the first registrar failure.
     *
     * @return fail-fast flag (default true)
     * @throws ConfigurationException if the value is not {@code true} or {@code false}
     */
    public boolean bootstrapFailFast() {
        return flag(BOOTSTRAP_FAIL_FAST, true);
    }

    /**
     * Whether bootstrap closes registration after running all registrars.
     *
     * @return close-registration flag (default false)
     * @throws ConfigurationException if the value is not {@code true} or {@code false}
     */
    public boolean bootstrapCloseRegistration() {
        return flag(BOOTSTRAP_CLOSE_REGISTRATION, false);
    }

    public String context() {
        return context;
    }

    private Optional<String> lookup(String key) {
        String override = System.getProperty(key);
        if (override != null) {
            return Optional.of(override);
        }
        return bundle.containsKey(key) ? Optional.of(bundle.getString(key)) : Optional.empty();
    }

    // Accepts only "true" and "false", in any case
    private boolean flag(String key, boolean fallback) {
        String value = lookup(key).map(String::trim).orElse(null);
        if (value == null) {
            return fallback;
        }
        if (value.equalsIgnoreCase("true")) {
            return true;
        }
        if (value.equalsIgnoreCase("false")) {
            return false;
        }
        throw new ConfigurationException(
            "Invalid boolean value for key '" + key + "' in " + context + ": " + value
        );
    }

    @Override
    public String toString() {
        return "FactoryConfig[context=" + context + "]";
    }
}
