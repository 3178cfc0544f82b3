package io.macroforge.core.engine.jvm;

import io.macroforge.core.error.HostCallException;
import io.macroforge.core.model.ModuleHandle;
import io.macroforge.core.spi.ModuleProvider;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ModuleProvider} backed by JVM classes. A module is a class: importing {@code a.b.C}
 * loads and initializes class {@code a.b.C}, so a module's top-level initialization runs once per
 * class loader, exactly like the JVM's own class initialization.
 *
 * <p>Attributes of a class module are its public static fields, public nested classes (returned
 * as modules) and public static methods (returned as one {@link MethodGroup} per name). Attributes
 * of any other value are its public instance fields and methods, bound to that value.
 *
 * <p>Thread-safe; caching is left to the class loader.
 */
public final class ClassModuleProvider implements ModuleProvider {

    private static final Logger LOG = LoggerFactory.getLogger(ClassModuleProvider.class);

    private final ClassLoader loader;

    public ClassModuleProvider() {
        this(ClassModuleProvider.class.getClassLoader());
    }

    public ClassModuleProvider(ClassLoader loader) {
        this.loader = Objects.requireNonNull(loader, "loader must not be null");
    }

    @Override
    public Optional<ModuleHandle> importModule(String path) {
        try {
            Class<?> type = Class.forName(path, true, loader);
            return Optional.of(new ModuleHandle(path, type));
        } catch (ClassNotFoundException e) {
            LOG.trace("No class for module path {}", path);
            return Optional.empty();
        } catch (ExceptionInInitializerError e) {
            throw e;
        } catch (LinkageError e) {
            LOG.debug("Class for module path {} cannot be linked: {}", path, e.toString());
            return Optional.empty();
        }
    }

    @Override
    public Optional<Object> getAttribute(Object target, String name) {
        if (target == null) {
            return Optional.empty();
        }
        if (target instanceof ModuleHandle handle && handle.module() instanceof Class<?> type) {
            return staticMember(handle.path(), type, name);
        }
        return instanceMember(target, name);
    }

    private static Optional<Object> staticMember(String path, Class<?> type, String name) {
        Optional<Field> field = publicField(type, name, true);
        if (field.isPresent()) {
            return Optional.ofNullable(read(field.get(), null));
        }
        for (Class<?> nested : type.getClasses()) {
            if (nested.getSimpleName().equals(name)) {
                return Optional.of(new ModuleHandle(path + "." + name, nested));
            }
        }
        List<Method> methods = methods(type, name, true);
        if (!methods.isEmpty()) {
            return Optional.of(new MethodGroup(type.getName() + "." + name, null, methods));
        }
        return Optional.empty();
    }

    private static Optional<Object> instanceMember(Object target, String name) {
        Class<?> type = target.getClass();
        Optional<Field> field = publicField(type, name, false);
        if (field.isPresent()) {
            return Optional.ofNullable(read(field.get(), target));
        }
        List<Method> methods = methods(type, name, false);
        if (!methods.isEmpty()) {
            return Optional.of(new MethodGroup(type.getName() + "#" + name, target, methods));
        }
        return Optional.empty();
    }

    private static Optional<Field> publicField(Class<?> type, String name, boolean wantStatic) {
        try {
            Field field = type.getField(name);
            return Modifier.isStatic(field.getModifiers()) == wantStatic ? Optional.of(field) : Optional.empty();
        } catch (NoSuchFieldException e) {
            return Optional.empty();
        }
    }

    private static List<Method> methods(Class<?> type, String name, boolean wantStatic) {
        return Arrays.stream(type.getMethods())
                .filter(m -> m.getName().equals(name))
                .filter(m -> Modifier.isStatic(m.getModifiers()) == wantStatic)
                .collect(Collectors.toList());
    }

    private static Object read(Field field, Object target) {
        try {
            return field.get(target);
        } catch (IllegalAccessException e) {
            throw new HostCallException("Cannot read field " + field.getName(), e);
        }
    }
}
