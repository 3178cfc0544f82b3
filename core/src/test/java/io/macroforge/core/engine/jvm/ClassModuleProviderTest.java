package io.macroforge.core.engine.jvm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.macroforge.core.engine.JavaIdentifierMangler;
import io.macroforge.core.engine.QualifiedResolver;
import io.macroforge.core.error.HostCallException;
import io.macroforge.core.model.ModuleHandle;
import io.macroforge.core.spi.HostFunction;
import io.macroforge.core.testkit.ExplodingModule;
import io.macroforge.core.testkit.HostModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests for {@link ClassModuleProvider} against real JVM classes. */
class ClassModuleProviderTest {

    private static final String HOST = HostModule.class.getName();

    private ClassModuleProvider provider;
    private ModuleHandle host;

    @BeforeEach
    void setUp() {
        provider = new ClassModuleProvider();
        host = provider.importModule(HOST).orElseThrow();
    }

    @Test
    void importsClassAsModule() {
        assertThat(host.path()).isEqualTo(HOST);
        assertThat(host.module()).isEqualTo(HostModule.class);
    }

    @Test
    void unknownClassIsEmpty() {
        assertThat(provider.importModule("io.macroforge.core.testkit.Missing")).isEmpty();
        assertThat(provider.importModule("io.macroforge")).isEmpty();
    }

    @Test
    void unlinkableClassIsEmpty() {
        ClassLoader wrongCase = new ClassLoader(ClassModuleProviderTest.class.getClassLoader()) {
            @Override
            public Class<?> loadClass(String name) throws ClassNotFoundException {
                if (name.equals("io.macroforge.core.testkit.hostmodule")) {
                    throw new NoClassDefFoundError(
                            "io/macroforge/core/testkit/hostmodule (wrong name: io/macroforge/core/testkit/HostModule)");
                }
                return super.loadClass(name);
            }
        };

        assertThat(new ClassModuleProvider(wrongCase).importModule("io.macroforge.core.testkit.hostmodule"))
                .isEmpty();
    }

    @Test
    void failingClassInitializerPropagates() {
        assertThatThrownBy(() -> provider.importModule(ExplodingModule.class.getName()))
                .isInstanceOf(ExceptionInInitializerError.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void staticFieldIsAttribute() {
        assertThat(provider.getAttribute(host, "GREETING")).hasValue("hello");
    }

    @Test
    void nullFieldReadsAsAbsent() {
        assertThat(provider.getAttribute(host, "NOTHING")).isEmpty();
    }

    @Test
    void nestedClassIsSubmodule() {
        Object units = provider.getAttribute(host, "Units").orElseThrow();

        assertThat(units).isInstanceOf(ModuleHandle.class);
        assertThat(((ModuleHandle) units).path()).isEqualTo(HOST + ".Units");
        assertThat(provider.getAttribute(units, "METER")).hasValue(1.0);
    }

    @Test
    void staticMethodsAreCallable() {
        HostFunction shout = (HostFunction) provider.getAttribute(host, "shout").orElseThrow();

        assertThat(shout.call("hey")).isEqualTo("HEY!");
    }

    @Test
    void overloadIsPickedByArgumentType() {
        HostFunction twice = (HostFunction) provider.getAttribute(host, "twice").orElseThrow();

        assertThat(twice.call(21L)).isEqualTo(42L);
        assertThat(twice.call("ab")).isEqualTo("abab");
        assertThat(twice.call(21)).isEqualTo(42L);
    }

    @Test
    void noMatchingOverloadFails() {
        HostFunction twice = (HostFunction) provider.getAttribute(host, "twice").orElseThrow();

        assertThatThrownBy(() -> twice.call(true))
                .isInstanceOf(HostCallException.class)
                .hasMessageContaining("No overload");
    }

    @Test
    void hostFailureIsWrappedWithCause() {
        HostFunction fail = (HostFunction) provider.getAttribute(host, "fail").orElseThrow();

        assertThatThrownBy(() -> fail.call())
                .isInstanceOf(HostCallException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void instanceMembersAreBoundToTheValue() {
        HostModule value = new HostModule(3);

        assertThat(provider.getAttribute(value, "size")).hasValue(3);
        HostFunction grow = (HostFunction) provider.getAttribute(value, "grow").orElseThrow();
        assertThat(grow.call(4)).isEqualTo(7);
    }

    @Test
    void instanceMembersAreNotModuleAttributes() {
        assertThat(provider.getAttribute(host, "grow")).isEmpty();
        assertThat(provider.getAttribute(host, "size")).isEmpty();
    }

    @Test
    void resolverReachesJdkClasses() {
        QualifiedResolver resolver = new QualifiedResolver(provider, new JavaIdentifierMangler());

        Object sqrt = resolver.resolveAttribute("java/lang/Math", "sqrt");

        assertThat(resolver.call(sqrt, 4)).isEqualTo(2.0);
        assertThat(resolver.call(resolver.member(resolver.resolveLiteral("java.lang.Math"), "sqrt"), 4))
                .isEqualTo(2.0);
    }
}
