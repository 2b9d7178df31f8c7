package io.fullerstack.factory;

import io.fullerstack.factory.registry.RegistryTable;
import io.fullerstack.factory.storage.StorageException;
import io.fullerstack.factory.storage.TypeKeyedStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Proxy;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Registries and storage cells reached from classes defined by separate class loaders,
 * standing in for independently loaded plugin jars.
 */
class CrossClassLoaderTest {

    private TypeKeyedStorage storage;
    private ClassLoader parent;

    @BeforeEach
    void setUp() {
        storage = new TypeKeyedStorage();
        parent = getClass().getClassLoader();
    }

    @Test
    void pluginImplementationIsCreatedThroughSharedRegistry() throws Exception {
        ClassLoader pluginLoader = new ChildFirstClassLoader(parent, Set.of(PluginShape.class.getName()));
        Class<? extends Shape> pluginType = pluginLoader.loadClass(PluginShape.class.getName()).asSubclass(Shape.class);
        assertThat(pluginType).isNotSameAs(PluginShape.class);

        Registrator.register(Factory.of(storage, Shape.class), pluginType);

        Shape shape = Factory.of(storage, Shape.class).newInstance("plugin");

        assertThat(shape.name()).isEqualTo("plugin");
        assertThat(shape.getClass().getClassLoader()).isSameAs(pluginLoader);
    }

    @Test
    void sameNamedOwnersFromDifferentLoadersShareOneCell() throws Exception {
        Class<?> ownerA = new ChildFirstClassLoader(parent, Set.of(PluginContract.class.getName()))
            .loadClass(PluginContract.class.getName());
        Class<?> ownerB = new ChildFirstClassLoader(parent, Set.of(PluginContract.class.getName()))
            .loadClass(PluginContract.class.getName());
        assertThat(ownerA).isNotSameAs(ownerB);

        RegistryTable fromA = storage.cell(ownerA, RegistryTable.class);
        RegistryTable fromB = storage.cell(ownerB, RegistryTable.class);

        assertThat(fromA).isSameAs(fromB);
        assertThat(storage.size()).isEqualTo(1);
    }

    @Test
    void registrationFromOneLoaderIsVisibleFromAnother() throws Exception {
        Class<?> contractA = new ChildFirstClassLoader(parent, Set.of(PluginContract.class.getName()))
            .loadClass(PluginContract.class.getName());
        Class<?> contractB = new ChildFirstClassLoader(parent, Set.of(PluginContract.class.getName()))
            .loadClass(PluginContract.class.getName());

        Factory<Object> viewA = factory(contractA);
        Factory<Object> viewB = factory(contractB);

        viewA.registerType("x", () -> contractInstance(contractA, "x"));

        assertThat(viewB.isTypeRegistered("x")).isTrue();
        assertThat(viewB.registeredTypes()).containsExactly("x");
        assertThatThrownBy(() -> viewB.registerType("x", () -> contractInstance(contractB, "x")))
            .isInstanceOf(DuplicateTypeIdException.class);
    }

    @Test
    void instanceOfForeignCopyIsNotCastToLocalCopy() throws Exception {
        Class<?> contractA = new ChildFirstClassLoader(parent, Set.of(PluginContract.class.getName()))
            .loadClass(PluginContract.class.getName());
        Class<?> contractB = new ChildFirstClassLoader(parent, Set.of(PluginContract.class.getName()))
            .loadClass(PluginContract.class.getName());

        factory(contractA).registerType("x", () -> contractInstance(contractA, "x"));

        assertThat(factory(contractA).newInstance("x")).isInstanceOf(contractA);
        assertThatThrownBy(() -> factory(contractB).newInstance("x"))
            .isInstanceOf(InstanceTypeMismatchException.class)
            .hasMessageContaining(String.valueOf(contractA.getClassLoader()))
            .hasMessageContaining(String.valueOf(contractB.getClassLoader()));
    }

    @Test
    void sameNamedValueTypeFromAnotherLoaderIsRejected() throws Exception {
        Class<?> valueA = new ChildFirstClassLoader(parent, Set.of(Square.class.getName()))
            .loadClass(Square.class.getName());
        Class<?> valueB = new ChildFirstClassLoader(parent, Set.of(Square.class.getName()))
            .loadClass(Square.class.getName());

        storage.cell(Shape.class, valueA);

        assertThatThrownBy(() -> storage.cell(Shape.class, valueB))
            .isInstanceOf(StorageException.class)
            .hasMessageContaining("not assignable");
    }

    @SuppressWarnings("unchecked")
    private Factory<Object> factory(Class<?> interfaceType) {
        return Factory.of(storage, (Class<Object>) interfaceType);
    }

    private static Object contractInstance(Class<?> contract, String id) {
        return Proxy.newProxyInstance(contract.getClassLoader(), new Class<?>[]{contract}, (proxy, method, args) -> {
            if (method.getName().equals("id")) {
                return id;
            }
            if (method.getName().equals("toString")) {
                return "PluginContract[" + id + "]";
            }
            if (method.getName().equals("hashCode")) {
                return System.identityHashCode(proxy);
            }
            if (method.getName().equals("equals")) {
                return proxy == args[0];
            }
            throw new UnsupportedOperationException(method.getName());
        });
    }
}
