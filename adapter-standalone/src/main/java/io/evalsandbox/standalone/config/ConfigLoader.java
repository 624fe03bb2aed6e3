package io.evalsandbox.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link ReplConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code evalsandbox.yaml} from the current directory if it exists, otherwise starts from
 * the defaults</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path, which must exist</li>
 * </ul>
 *
 * <p>
 * Layout:
 *
 * <pre>
 * session:
 *   runtime: datalog
 *   memory-limit-bytes: 16777216
 *   capture-capacity-bytes: 65536
 *   startup-timeout-ms: 10000
 * policy:
 *   working-directory: .
 *   read-roots: [ "../.." ]
 *   write-roots: [ ]
 *   network: false
 *   process: false
 * logging:
 *   format: text
 *   level: WARN
 * </pre>
 *
 * <p>
 * Every key can be overridden by an environment variable. An env var is considered "set" if and only if it is
 * defined AND its trimmed value is non-empty; empty or whitespace-only values are treated as "unset" and the
 * YAML value is used. List-valued variables are comma-separated.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "evalsandbox.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link ReplConfig} from the given YAML file path, applying environment variable overrides from
     * {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static ReplConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link ReplConfig} from the given YAML file path, applying environment variable overrides from
     * the supplied lookup function. Returning {@code null} from {@code envLookup} means the variable is not
     * defined.
     *
     * @throws ConfigLoadException if the file is missing, contains invalid YAML or an invalid value
     */
    public static ReplConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root != null ? root : YAML_MAPPER.createObjectNode(), envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads the configuration selected by the command line: the {@code --config} file when given, else the
     * default file if present, else the defaults. Environment overrides apply in every case.
     */
    public static ReplConfig loadFromArgs(String[] args, Function<String, String> envLookup) {
        Path explicit = resolveConfigPath(args);
        if (explicit != null) {
            return load(explicit, envLookup);
        }
        Path fallback = Path.of(DEFAULT_CONFIG_FILE);
        if (Files.exists(fallback)) {
            return load(fallback, envLookup);
        }
        return mapToConfig(YAML_MAPPER.createObjectNode(), envLookup);
    }

    /**
     * Resolves the {@code --config} argument.
     *
     * @return the given path, or {@code null} when the flag is absent
     * @throws IllegalArgumentException if the flag has no value
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return null;
    }

    /** Maps a parsed YAML tree to a {@link ReplConfig} via the builder, then overlays environment overrides. */
    private static ReplConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        ReplConfig.Builder builder = ReplConfig.builder();

        // --- YAML mapping ---

        JsonNode session = root.path("session");
        if (session.has("runtime")) builder.runtime(session.get("runtime").asText());
        if (session.has("memory-limit-bytes"))
            builder.memoryLimitBytes(session.get("memory-limit-bytes").asLong());
        if (session.has("capture-capacity-bytes"))
            builder.captureCapacityBytes(session.get("capture-capacity-bytes").asInt());
        if (session.has("startup-timeout-ms"))
            builder.startupTimeoutMs(session.get("startup-timeout-ms").asInt());

        JsonNode policy = root.path("policy");
        if (policy.has("working-directory"))
            builder.workingDirectory(policy.get("working-directory").asText());
        if (policy.has("read-roots")) builder.readRoots(textList(policy.get("read-roots"), "policy.read-roots"));
        if (policy.has("write-roots"))
            builder.writeRoots(textList(policy.get("write-roots"), "policy.write-roots"));
        if (policy.has("network")) builder.networkAllowed(policy.get("network").asBoolean());
        if (policy.has("process")) builder.processAllowed(policy.get("process").asBoolean());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---
        applyEnvOverrides(builder, envLookup);

        return builder.build();
    }

    /**
     * Applies environment variable overrides to the builder.
     *
     * <p>
     * An env var is "set" if {@code envLookup.apply(name)} returns a non-null, non-empty (after trim) string.
     * Otherwise the YAML/default value stands.
     */
    private static void applyEnvOverrides(ReplConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "EVALSANDBOX_RUNTIME", builder::runtime);
        envString(envLookup, "EVALSANDBOX_WORKING_DIRECTORY", builder::workingDirectory);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        envLong(envLookup, "EVALSANDBOX_MEMORY_LIMIT_BYTES", builder::memoryLimitBytes);
        envInt(envLookup, "EVALSANDBOX_CAPTURE_CAPACITY_BYTES", builder::captureCapacityBytes);
        envInt(envLookup, "EVALSANDBOX_STARTUP_TIMEOUT_MS", builder::startupTimeoutMs);

        envList(envLookup, "EVALSANDBOX_READ_ROOTS", builder::readRoots);
        envList(envLookup, "EVALSANDBOX_WRITE_ROOTS", builder::writeRoots);

        envBool(envLookup, "EVALSANDBOX_NETWORK_ALLOWED", builder::networkAllowed);
        envBool(envLookup, "EVALSANDBOX_PROCESS_ALLOWED", builder::processAllowed);
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

    private static void envInt(
            Function<String, String> envLookup, String envVar, java.util.function.IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(parseNumber(envVar, envLookup.apply(envVar)).intValue());
        }
    }

    private static void envLong(
            Function<String, String> envLookup, String envVar, java.util.function.LongConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(parseNumber(envVar, envLookup.apply(envVar)));
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    /** Comma-separated list; blank elements are dropped. */
    private static void envList(Function<String, String> envLookup, String envVar, Consumer<List<String>> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Arrays.stream(envLookup.apply(envVar).split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList());
        }
    }

    private static Long parseNumber(String envVar, String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("Environment variable " + envVar + " is not a number: '" + raw + "'", e);
        }
    }

    // --- YAML helpers ---

    private static List<String> textList(JsonNode node, String field) {
        if (!node.isArray()) {
            throw new ConfigLoadException(field + " must be a list of paths");
        }
        List<String> values = new ArrayList<>();
        node.forEach(element -> values.add(element.asText()));
        return values;
    }
}
