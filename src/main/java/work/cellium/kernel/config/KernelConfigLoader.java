package work.cellium.kernel.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlTable;
import work.cellium.kernel.api.KernelConfiguration;
import work.cellium.kernel.api.LoadPolicy;
import work.cellium.kernel.shared.DurationParser;

/**
 * Reads a {@link KernelConfiguration} from a TOML, YAML or JSON file.
 *
 * <pre>
 * cells = ["work.cellium.kernel.demo.GreeterCell"]
 *
 * [kernel]
 * load_policy = "lenient"
 * builtin_cells = true
 *
 * [process]
 * workers = 2
 * queue_capacity = 16
 * default_timeout = "30s"
 * shutdown_grace = "5s"
 * jvm_options = ["-Xmx128m"]
 * </pre>
 *
 * The YAML form uses the same keys. Absent keys keep the builder defaults.
 */
public final class KernelConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(KernelConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private KernelConfigLoader() {}

    public static KernelConfiguration load(Path path) {
        return builder(path).build();
    }

    /**
     * Returns a builder pre-filled from {@code path}, for callers that override some values.
     */
    public static KernelConfiguration.Builder builder(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Configuration file not found: " + path);
        }
        var name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        Map<String, Object> document;
        if (name.endsWith(".toml")) {
            document = readToml(path);
        } else if (name.endsWith(".yaml") || name.endsWith(".yml") || name.endsWith(".json")) {
            document = readYaml(path);
        } else {
            throw new IllegalArgumentException("Unsupported configuration format: " + path + " (expected .toml, .yaml, .yml or .json)");
        }
        log.debug("Loaded configuration from {}", path);
        return fromDocument(document, path.toString());
    }

    static KernelConfiguration.Builder fromDocument(Map<String, Object> document, String source) {
        var builder = KernelConfiguration.builder();
        var cells = document.get("cells");
        if (cells != null) {
            builder.cells(stringList(cells, source, "cells"));
        }

        var kernel = section(document, "kernel", source);
        if (kernel.containsKey("load_policy")) {
            builder.loadPolicy(read(source, "kernel.load_policy", () -> LoadPolicy.from(String.valueOf(kernel.get("load_policy")))));
        }
        if (kernel.containsKey("builtin_cells")) {
            builder.builtinCells(bool(kernel.get("builtin_cells"), source, "kernel.builtin_cells"));
        }

        var process = section(document, "process", source);
        if (process.containsKey("workers")) {
            builder.workers(integer(process.get("workers"), source, "process.workers"));
        }
        if (process.containsKey("queue_capacity")) {
            builder.queueCapacity(integer(process.get("queue_capacity"), source, "process.queue_capacity"));
        }
        if (process.get("default_timeout") != null) {
            builder.defaultTimeout(read(source, "process.default_timeout", () -> DurationParser.fromValue(process.get("default_timeout")).orElseThrow()));
        }
        if (process.get("shutdown_grace") != null) {
            builder.shutdownGrace(read(source, "process.shutdown_grace", () -> DurationParser.fromValue(process.get("shutdown_grace")).orElseThrow()));
        }
        if (process.get("jvm_options") != null) {
            builder.workerJvmOptions(stringList(process.get("jvm_options"), source, "process.jvm_options"));
        }
        return builder;
    }

    private static Map<String, Object> readToml(Path path) {
        try {
            var result = Toml.parse(Files.readString(path));
            if (result.hasErrors()) {
                var first = result.errors().get(0);
                throw new IllegalArgumentException("Invalid TOML in " + path + ": " + first.toString());
            }
            return convertTomlMap(result.toMap());
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to read " + path + ": " + ex.getMessage(), ex);
        }
    }

    private static Map<String, Object> readYaml(Path path) {
        try {
            Map<String, Object> document = YAML_MAPPER.readValue(path.toFile(), MAP_TYPE);
            return document == null ? Map.of() : document;
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid configuration in " + path + ": " + ex.getMessage(), ex);
        }
    }

    private static Map<String, Object> convertTomlMap(Map<String, Object> source) {
        var converted = new LinkedHashMap<String, Object>();
        for (var entry : source.entrySet()) {
            converted.put(entry.getKey(), convertTomlValue(entry.getValue()));
        }
        return converted;
    }

    private static Object convertTomlValue(Object value) {
        if (value instanceof TomlTable table) {
            return convertTomlMap(table.toMap());
        }
        if (value instanceof TomlArray array) {
            var items = new ArrayList<Object>(array.size());
            for (int i = 0; i < array.size(); i++) {
                items.add(convertTomlValue(array.get(i)));
            }
            return items;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> document, String key, String source) {
        var value = document.get(key);
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw invalid(source, key, "expected a table");
    }

    private static List<String> stringList(Object value, String source, String key) {
        if (!(value instanceof List<?> list)) {
            throw invalid(source, key, "expected a list of strings");
        }
        var strings = new ArrayList<String>(list.size());
        for (Object item : list) {
            if (!(item instanceof String text) || text.isBlank()) {
                throw invalid(source, key, "expected non-empty strings but found " + item);
            }
            strings.add(text.trim());
        }
        return strings;
    }

    private static int integer(Object value, String source, String key) {
        if (value instanceof Number number) {
            long raw = number.longValue();
            if (raw < 0 || raw > Integer.MAX_VALUE) {
                throw invalid(source, key, "out of range: " + raw);
            }
            return (int) raw;
        }
        throw invalid(source, key, "expected an integer but found " + value);
    }

    private static boolean bool(Object value, String source, String key) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        throw invalid(source, key, "expected true or false but found " + value);
    }

    private static <T> T read(String source, String key, Supplier<T> reader) {
        try {
            return reader.get();
        } catch (RuntimeException ex) {
            throw invalid(source, key, ex.getMessage());
        }
    }

    private static IllegalArgumentException invalid(String source, String key, String detail) {
        return new IllegalArgumentException("Invalid '" + key + "' in " + source + ": " + detail);
    }
}
