package io.macroforge.core.config;

/**
 * Runtime configuration of the macro core.
 *
 * <p>Use {@link #builder()} to construct instances; every field has a default, so
 * {@link #defaults()} is a complete configuration.
 *
 * @param expansionMaxSteps  ceiling on expansion steps per form; {@code 0} means unbounded
 * @param disassemblerModule module the disassembler compiles trees in
 * @param stdlibModule       module named by the injected standard-library import
 */
public record MacroforgeConfig(int expansionMaxSteps, String disassemblerModule, String stdlibModule) {

    public MacroforgeConfig {
        if (expansionMaxSteps < 0) {
            throw new IllegalArgumentException("expansionMaxSteps must not be negative, got " + expansionMaxSteps);
        }
        if (disassemblerModule == null || disassemblerModule.isBlank()) {
            throw new IllegalArgumentException("disassemblerModule must not be blank");
        }
        if (stdlibModule == null || stdlibModule.isBlank()) {
            throw new IllegalArgumentException("stdlibModule must not be blank");
        }
    }

    /** Configuration with every default applied. */
    public static MacroforgeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link MacroforgeConfig}. */
    public static final class Builder {
        private int expansionMaxSteps = 0;
        private String disassemblerModule = "__main__";
        private String stdlibModule = "macroforge.core";

        Builder() {}

        public Builder expansionMaxSteps(int expansionMaxSteps) {
            this.expansionMaxSteps = expansionMaxSteps;
            return this;
        }

        public Builder disassemblerModule(String disassemblerModule) {
            this.disassemblerModule = disassemblerModule;
            return this;
        }

        public Builder stdlibModule(String stdlibModule) {
            this.stdlibModule = stdlibModule;
            return this;
        }

        public MacroforgeConfig build() {
            return new MacroforgeConfig(expansionMaxSteps, disassemblerModule, stdlibModule);
        }
    }
}
