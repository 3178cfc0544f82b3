package io.macroforge.core.spi;

/** A callable value obtained from a module or object through the {@link ModuleProvider}. */
@FunctionalInterface
public interface HostFunction {

    /**
     * Invokes the function.
     *
     * @param args positional arguments
     * @return the result, possibly {@code null} for void functions
     * @throws io.macroforge.core.error.HostCallException if no overload accepts the arguments or
     *     the call fails
     */
    Object call(Object... args);
}
