package io.fullerstack.factory.bootstrap;

import io.fullerstack.factory.Circle;
import io.fullerstack.factory.DuplicateTypeIdException;
import io.fullerstack.factory.Factory;
import io.fullerstack.factory.FactoryException;
import io.fullerstack.factory.RegistrationClosedException;
import io.fullerstack.factory.Shape;
import io.fullerstack.factory.Square;
import io.fullerstack.factory.bootstrap.FactoryBootstrap.BootstrapResult;
import io.fullerstack.factory.config.FactoryConfig;
import io.fullerstack.factory.spi.FactoryRegistrar;
import io.fullerstack.factory.storage.TypeKeyedStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URL;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FactoryBootstrapTest {

    private TypeKeyedStorage storage;

    @BeforeEach
    void setUp() {
        storage = new TypeKeyedStorage();
    }

    @Test
    void shouldApplyDiscoveredRegistrars() {
        BootstrapResult result = FactoryBootstrap.builder()
            .storage(storage)
            .bootstrap();

        assertThat(result.getAppliedRegistrars()).contains(TestShapeRegistrar.class.getName());
        assertThat(result.getFailedRegistrars()).isEmpty();
        assertThat(result.getStorage()).isSameAs(storage);
        assertThat(result.factory(Shape.class).newInstance(TestShapeRegistrar.TYPE_ID)).isInstanceOf(Square.class);
        assertThat(result.factory(Shape.class).staticTypeId(Square.class)).isEqualTo(TestShapeRegistrar.TYPE_ID);
    }

    @Test
    void shouldSkipDiscoveryWhenDisabled() {
        BootstrapResult result = FactoryBootstrap.builder()
            .storage(storage)
            .discover(false)
            .bootstrap();

        assertThat(result.getAppliedRegistrars()).isEmpty();
        assertThat(Factory.of(storage, Shape.class).registeredTypes()).isEmpty();
    }

    @Test
    void shouldRunExplicitRegistrarsBeforeDiscoveredOnes() {
        FactoryRegistrar explicit = mock(FactoryRegistrar.class);
        when(explicit.name()).thenReturn("explicit");

        BootstrapResult result = FactoryBootstrap.builder()
            .storage(storage)
            .registrar(explicit)
            .bootstrap();

        verify(explicit).registerTypes(storage);
        assertThat(result.getAppliedRegistrars())
            .containsExactly("explicit", TestShapeRegistrar.class.getName());
    }

    @Test
    void shouldInvokeAppliedCallbackPerRegistrar() {
        List<String> applied = new ArrayList<>();

        FactoryBootstrap.builder()
            .storage(storage)
            .discover(false)
            .registrar(named("first", s -> Factory.of(s, Shape.class).registerType("circle", Circle::new)))
            .registrar(named("second", s -> Factory.of(s, Shape.class).registerType("square", Square::new)))
            .onRegistrarApplied(applied::add)
            .bootstrap();

        assertThat(applied).containsExactly("first", "second");
        assertThat(Factory.of(storage, Shape.class).registeredTypes()).containsExactly("circle", "square");
    }

    @Test
    void shouldFallBackToClassNameWhenRegistrarHasNoName() {
        FactoryRegistrar unnamed = mock(FactoryRegistrar.class);

        BootstrapResult result = FactoryBootstrap.builder()
            .storage(storage)
            .discover(false)
            .registrar(unnamed)
            .bootstrap();

        assertThat(result.getAppliedRegistrars()).containsExactly(unnamed.getClass().getName());
    }

    @Test
    void shouldFailFastOnRegistrarFailure() {
        FactoryRegistrar failing = mock(FactoryRegistrar.class);
        when(failing.name()).thenReturn("failing");
        IllegalStateException failure = new IllegalStateException("broken registrar");
        doThrow(failure).when(failing).registerTypes(any());

        assertThatThrownBy(() -> FactoryBootstrap.builder()
                .storage(storage)
                .failFast(true)
                .registrar(failing)
                .bootstrap())
            .isInstanceOf(FactoryException.class)
            .hasMessageContaining("'failing'")
            .hasCause(failure);

        // Discovery never ran
        assertThat(Factory.of(storage, Shape.class).isTypeRegistered(TestShapeRegistrar.TYPE_ID)).isFalse();
    }

    @Test
    void shouldReportFailureAndContinueWhenNotFailFast() {
        AtomicReference<String> failedName = new AtomicReference<>();
        AtomicReference<Exception> failedWith = new AtomicReference<>();

        BootstrapResult result = FactoryBootstrap.builder()
            .storage(storage)
            .failFast(false)
            .registrar(named("duplicate", s -> {
                Factory.of(s, Shape.class).registerType("circle", Circle::new);
                Factory.of(s, Shape.class).registerType("circle", Circle::new);
            }))
            .onError((name, error) -> {
                failedName.set(name);
                failedWith.set(error);
            })
            .bootstrap();

        assertThat(result.getFailedRegistrars()).containsExactly("duplicate");
        assertThat(result.getAppliedRegistrars()).containsExactly(TestShapeRegistrar.class.getName());
        assertThat(failedName.get()).isEqualTo("duplicate");
        assertThat(failedWith.get()).isInstanceOf(DuplicateTypeIdException.class);
        // Registrations made before the failure stay
        assertThat(Factory.of(storage, Shape.class).isTypeRegistered("circle")).isTrue();
    }

    @Test
    void shouldCloseRegistrationWhenRequested() {
        BootstrapResult result = FactoryBootstrap.builder()
            .storage(storage)
            .discover(false)
            .registrar(named("circles", s -> Factory.of(s, Shape.class).registerType("circle", Circle::new)))
            .closeRegistration(true)
            .bootstrap();

        assertThat(result.isRegistrationClosed()).isTrue();
        assertThat(Factory.of(storage, Shape.class).newInstance("circle")).isInstanceOf(Circle.class);
        assertThatThrownBy(() -> Factory.of(storage, Shape.class).registerType("late", Square::new))
            .isInstanceOf(RegistrationClosedException.class);
    }

    @Test
    void shouldLeaveRegistrationOpenByDefault() {
        BootstrapResult result = FactoryBootstrap.builder()
            .storage(storage)
            .discover(false)
            .bootstrap();

        assertThat(result.isRegistrationClosed()).isFalse();
        Factory.of(storage, Shape.class).registerType("late", Square::new);
        assertThat(Factory.of(storage, Shape.class).isTypeRegistered("late")).isTrue();
    }

    @Test
    void shouldTakeDefaultsFromConfig() {
        List<String> errors = new ArrayList<>();

        BootstrapResult result = FactoryBootstrap.builder()
            .storage(storage)
            .discover(false)
            .config(FactoryConfig.fromBundle("lenient-bootstrap"))
            .registrar(named("failing", s -> {
                throw new IllegalStateException("broken");
            }))
            .onError((name, error) -> errors.add(name))
            .bootstrap();

        assertThat(errors).containsExactly("failing");
        assertThat(result.isRegistrationClosed()).isTrue();
    }

    @Test
    void explicitSettingsOverrideConfig() {
        BootstrapResult result = FactoryBootstrap.builder()
            .storage(storage)
            .discover(false)
            .config(FactoryConfig.fromBundle("lenient-bootstrap"))
            .closeRegistration(false)
            .bootstrap();

        assertThat(result.isRegistrationClosed()).isFalse();
    }

    @Test
    void shouldReportLoaderFailureForBrokenServiceEntry() {
        ClassLoader broken = new ClassLoader(getClass().getClassLoader()) {
            @Override
            public Enumeration<URL> getResources(String name) throws IOException {
                if (name.equals("META-INF/services/" + FactoryRegistrar.class.getName())) {
                    return super.getResources("broken-registrar.services");
                }
                return super.getResources(name);
            }
        };
        List<String> errors = new ArrayList<>();

        BootstrapResult result = FactoryBootstrap.builder()
            .storage(storage)
            .classLoader(broken)
            .failFast(false)
            .onError((name, error) -> errors.add(name))
            .bootstrap();

        assertThat(result.getFailedRegistrars()).containsExactly("<service-loader>");
        assertThat(errors).containsExactly("<service-loader>");
    }

    private static FactoryRegistrar named(String name, Consumer<TypeKeyedStorage> body) {
        return new FactoryRegistrar() {
            @Override
            public void registerTypes(TypeKeyedStorage storage) {
                body.accept(storage);
            }

            @Override
            public String name() {
                return name;
            }
        };
    }
}
