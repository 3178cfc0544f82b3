package io.macroforge.core.engine.jvm;

import io.macroforge.core.error.HostCallException;
import io.macroforge.core.spi.HostFunction;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * All public overloads of one method name, optionally bound to a receiver. A call picks the first
 * overload whose parameters accept the arguments as they are (boxing included); failing that, the
 * first overload that accepts them after numeric conversion.
 */
final class MethodGroup implements HostFunction {

    private static final Map<Class<?>, Class<?>> BOXES = Map.of(
            boolean.class, Boolean.class,
            byte.class, Byte.class,
            short.class, Short.class,
            char.class, Character.class,
            int.class, Integer.class,
            long.class, Long.class,
            float.class, Float.class,
            double.class, Double.class);

    private final String name;
    private final Object receiver;
    private final List<Method> overloads;

    MethodGroup(String name, Object receiver, List<Method> overloads) {
        this.name = name;
        this.receiver = receiver;
        this.overloads = List.copyOf(overloads);
    }

    @Override
    public Object call(Object... args) {
        Object[] actual = args == null ? new Object[0] : args;
        Method method = select(actual, true);
        if (method == null) {
            method = select(actual, false);
        }
        if (method == null) {
            throw new HostCallException("No overload of " + name + " accepts " + describe(actual));
        }
        try {
            return method.invoke(receiver, coerce(method.getParameterTypes(), actual));
        } catch (IllegalAccessException e) {
            throw new HostCallException("Cannot access " + name, e);
        } catch (InvocationTargetException e) {
            throw new HostCallException(name + " failed: " + e.getCause(), e.getCause());
        }
    }

    private Method select(Object[] args, boolean strict) {
        for (Method method : overloads) {
            Class<?>[] params = method.getParameterTypes();
            if (method.isVarArgs() || params.length != args.length) {
                continue;
            }
            boolean ok = true;
            for (int i = 0; i < params.length && ok; i++) {
                ok = accepts(params[i], args[i], strict);
            }
            if (ok) {
                return method;
            }
        }
        return null;
    }

    private static boolean accepts(Class<?> param, Object arg, boolean strict) {
        if (arg == null) {
            return !param.isPrimitive();
        }
        Class<?> boxed = BOXES.getOrDefault(param, param);
        if (boxed.isInstance(arg)) {
            return true;
        }
        return !strict && arg instanceof Number && isNumeric(boxed);
    }

    private static boolean isNumeric(Class<?> boxed) {
        return Number.class.isAssignableFrom(boxed) && boxed.getPackageName().equals("java.lang");
    }

    private static Object[] coerce(Class<?>[] params, Object[] args) {
        Object[] out = args.clone();
        for (int i = 0; i < params.length; i++) {
            Class<?> boxed = BOXES.getOrDefault(params[i], params[i]);
            if (out[i] instanceof Number n && !boxed.isInstance(n)) {
                out[i] = convert(n, boxed);
            }
        }
        return out;
    }

    private static Object convert(Number n, Class<?> target) {
        if (target == Double.class) return n.doubleValue();
        if (target == Float.class) return n.floatValue();
        if (target == Long.class) return n.longValue();
        if (target == Integer.class) return n.intValue();
        if (target == Short.class) return n.shortValue();
        if (target == Byte.class) return n.byteValue();
        return n;
    }

    private static String describe(Object[] args) {
        return Arrays.stream(args)
                .map(a -> a == null ? "null" : a.getClass().getSimpleName())
                .collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public String toString() {
        return "<function " + name + ">";
    }
}
