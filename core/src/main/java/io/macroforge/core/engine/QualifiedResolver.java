package io.macroforge.core.engine;

import io.macroforge.core.error.AttributeNotFoundException;
import io.macroforge.core.error.HostCallException;
import io.macroforge.core.error.ModuleNotFoundException;
import io.macroforge.core.error.ModuleNotFoundException.PathForm;
import io.macroforge.core.model.ModuleHandle;
import io.macroforge.core.spi.HostFunction;
import io.macroforge.core.spi.Mangler;
import io.macroforge.core.spi.ModuleProvider;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves qualified module members in expression position.
 *
 * <p>Two entry points with different normalization:
 * <ul>
 * <li>{@link #resolveAttribute(String...)} takes identifiers as written in source and mangles
 * every component. A segment may fold further components in with {@link #PATH_SEPARATOR}, so
 * {@code ("os/path", "join")} resolves {@code os.path.join}.</li>
 * <li>{@link #resolveLiteral(String)} imports a dotted path exactly as given.</li>
 * </ul>
 *
 * <p>The resolver keeps no cache and creates no bindings. Importing runs a module's initialization
 * the first time; repeat imports rely on the provider's own caching.
 */
public final class QualifiedResolver {

    private static final Logger LOG = LoggerFactory.getLogger(QualifiedResolver.class);

    /** Separator folding several dotted components into one attribute-chain segment. */
    public static final String PATH_SEPARATOR = "/";

    private final ModuleProvider provider;
    private final Mangler mangler;

    public QualifiedResolver(ModuleProvider provider, Mangler mangler) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.mangler = Objects.requireNonNull(mangler, "mangler must not be null");
    }

    /** @see #resolveAttribute(List) */
    public Object resolveAttribute(String... segments) {
        return resolveAttribute(Arrays.asList(segments));
    }

    /**
     * Resolves an attribute chain left to right. At each component the accumulated dotted path is
     * imported if possible; otherwise the component is looked up as an attribute of the last
     * resolved value. Components before the first importable path are treated as a package
     * prefix.
     *
     * @param segments the chain, as written in source
     * @return the resolved module handle or member value
     * @throws ModuleNotFoundException with the mangled dotted path if the chain cannot be resolved
     */
    public Object resolveAttribute(List<String> segments) {
        Objects.requireNonNull(segments, "segments must not be null");
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("attribute chain must not be empty");
        }

        List<String> components = new ArrayList<>();
        for (String segment : segments) {
            for (String part : segment.split(PATH_SEPARATOR, -1)) {
                if (part.isEmpty()) {
                    throw new IllegalArgumentException("empty component in path segment '" + segment + "'");
                }
                components.add(mangler.mangle(part));
            }
        }
        String attempted = String.join(".", components);

        StringBuilder path = new StringBuilder();
        Object current = null;
        boolean resolved = false;
        for (String component : components) {
            if (path.length() > 0) {
                path.append('.');
            }
            path.append(component);

            Optional<ModuleHandle> module = provider.importModule(path.toString());
            if (module.isPresent()) {
                current = module.get();
                resolved = true;
                continue;
            }
            if (!resolved) {
                continue;
            }
            Optional<Object> attribute = provider.getAttribute(current, component);
            if (attribute.isEmpty()) {
                LOG.debug("Attribute chain failed: path={}, component={}", attempted, component);
                throw new ModuleNotFoundException(attempted, PathForm.MANGLED);
            }
            current = attribute.get();
        }

        if (!resolved) {
            LOG.debug("Attribute chain failed: path={}, no importable prefix", attempted);
            throw new ModuleNotFoundException(attempted, PathForm.MANGLED);
        }
        LOG.debug("Resolved attribute chain: path={}", attempted);
        return current;
    }

    /**
     * Imports exactly the given dotted path, with no mangling.
     *
     * @param path the module path
     * @return the module handle
     * @throws ModuleNotFoundException with the literal path if the import fails
     */
    public ModuleHandle resolveLiteral(String path) {
        Objects.requireNonNull(path, "path must not be null");
        ModuleHandle handle =
                provider.importModule(path).orElseThrow(() -> new ModuleNotFoundException(path, PathForm.LITERAL));
        LOG.debug("Resolved literal path: path={}", path);
        return handle;
    }

    /**
     * Looks up a member of an already resolved value. The name is mangled, as attribute symbols
     * in source always are.
     *
     * @throws AttributeNotFoundException if the target has no such member
     */
    public Object member(Object target, String name) {
        Objects.requireNonNull(name, "name must not be null");
        return provider.getAttribute(target, mangler.mangle(name))
                .orElseThrow(() -> new AttributeNotFoundException(name, target));
    }

    /**
     * Calls a resolved function value.
     *
     * @throws HostCallException if the value is not callable or the call fails
     */
    public Object call(Object function, Object... args) {
        if (!(function instanceof HostFunction f)) {
            throw new HostCallException("'" + function + "' is not callable");
        }
        return f.call(args);
    }
}
