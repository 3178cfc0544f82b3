package io.macroforge.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link MacroforgeConfig} from a YAML file with an environment variable overlay.
 *
 * <p>Recognized keys:
 * <pre>
 * expansion:
 *   max-steps: 0
 * disassembler:
 *   module: __main__
 * compiler:
 *   stdlib-module: macroforge.core
 * </pre>
 *
 * <p>Missing keys receive the defaults of {@link MacroforgeConfig.Builder}. Environment variables
 * take precedence over YAML values. An env var is "set" only if it is defined and its trimmed value
 * is non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Conventional file name, looked up in the working directory by callers. */
    public static final String DEFAULT_CONFIG_FILE = "macroforge.yaml";

    static final String ENV_MAX_STEPS = "MACROFORGE_EXPANSION_MAX_STEPS";
    static final String ENV_DISASSEMBLER_MODULE = "MACROFORGE_DISASSEMBLER_MODULE";
    static final String ENV_STDLIB_MODULE = "MACROFORGE_COMPILER_STDLIB_MODULE";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a configuration file, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file cannot be read or holds invalid values
     */
    public static MacroforgeConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a configuration file, applying overrides from {@code envLookup}. A {@code null} result
     * from the lookup means the variable is not defined.
     *
     * @throws ConfigLoadException if the file cannot be read or holds invalid values
     */
    public static MacroforgeConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? YAML_MAPPER.missingNode() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from " + configPath + ": " + e.getMessage(), e);
        }
    }

    /** Builds a configuration from defaults plus environment overrides only. */
    public static MacroforgeConfig fromEnvironment(Function<String, String> envLookup) {
        try {
            return mapToConfig(YAML_MAPPER.missingNode(), envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Invalid environment configuration: " + e.getMessage(), e);
        }
    }

    private static MacroforgeConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        MacroforgeConfig.Builder builder = MacroforgeConfig.builder();

        // --- YAML mapping ---

        JsonNode expansion = root.path("expansion");
        if (expansion.has("max-steps")) {
            JsonNode maxSteps = expansion.get("max-steps");
            if (!maxSteps.canConvertToInt() || !maxSteps.isIntegralNumber()) {
                throw new ConfigLoadException("expansion.max-steps must be an integer, got: " + maxSteps.asText());
            }
            builder.expansionMaxSteps(maxSteps.asInt());
        }

        JsonNode disassembler = root.path("disassembler");
        if (disassembler.has("module")) builder.disassemblerModule(disassembler.get("module").asText());

        JsonNode compiler = root.path("compiler");
        if (compiler.has("stdlib-module")) builder.stdlibModule(compiler.get("stdlib-module").asText());

        // --- Environment variable overlay ---

        envInt(envLookup, ENV_MAX_STEPS, builder::expansionMaxSteps);
        envString(envLookup, ENV_DISASSEMBLER_MODULE, builder::disassemblerModule);
        envString(envLookup, ENV_STDLIB_MODULE, builder::stdlibModule);

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got: " + raw, e);
            }
        }
    }
}
