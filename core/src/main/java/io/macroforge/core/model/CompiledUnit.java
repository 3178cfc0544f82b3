package io.macroforge.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Output of the host compiler: the structural intermediate representation of one compilation
 * unit. The IR is a Jackson tree whose objects carry a {@code _type} discriminator.
 *
 * @param moduleName the module the unit was compiled for
 * @param ir         the structural IR, rooted at a {@code Module} object
 */
public record CompiledUnit(String moduleName, JsonNode ir) {

    public CompiledUnit {
        Objects.requireNonNull(moduleName, "moduleName must not be null");
        Objects.requireNonNull(ir, "ir must not be null");
    }
}
