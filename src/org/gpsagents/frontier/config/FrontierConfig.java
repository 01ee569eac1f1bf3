package org.gpsagents.frontier.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.gpsagents.frontier.store.Backend;
import org.gpsagents.frontier.util.DurationDeserializer;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Settings for opening a frontier and supervising it.
 *
 * @param path          directory holding the frontier state
 * @param backend       which store to use, {@code auto} prefers SQLite
 * @param stallTimeout  lease age after which a processing item is considered abandoned
 * @param sweepInterval how often the stall sweeper runs
 */
public record FrontierConfig(
        String path,
        Backend backend,
        @JsonDeserialize(using = DurationDeserializer.class) Duration stallTimeout,
        @JsonDeserialize(using = DurationDeserializer.class) Duration sweepInterval
) {
    private static final String DEFAULTS = "defaults.yaml";

    public FrontierConfig {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(backend, "backend");
        Objects.requireNonNull(stallTimeout, "stallTimeout");
        Objects.requireNonNull(sweepInterval, "sweepInterval");
        if (stallTimeout.isNegative()) throw new IllegalArgumentException("stallTimeout must not be negative");
        if (sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("sweepInterval must be positive");
        }
    }

    public Path directory() {
        return Path.of(path);
    }

    public FrontierConfig withPath(Path path) {
        return new FrontierConfig(path.toString(), backend, stallTimeout, sweepInterval);
    }

    public static FrontierConfig defaults() {
        try {
            return load(null);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Reads the built-in defaults and overlays the given YAML file on them, if any.
     */
    public static FrontierConfig load(@Nullable Path configFile) throws IOException {
        ObjectMapper mapper = mapper();
        JsonNode tree;
        try (InputStream stream = FrontierConfig.class.getResourceAsStream(DEFAULTS)) {
            if (stream == null) throw new IOException("Missing built-in " + DEFAULTS);
            tree = mapper.readTree(stream);
        }
        if (configFile != null) {
            JsonNode override = mapper.readTree(configFile.toFile());
            if (override != null && !override.isMissingNode() && !override.isNull()) {
                tree = deepMerge(tree, override);
            }
        }
        return mapper.treeToValue(tree, FrontierConfig.class);
    }

    private static ObjectMapper mapper() {
        return YAMLMapper.builder()
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .build();
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode value = entry.getValue();
            merged.set(key, merged.has(key) ? deepMerge(merged.get(key), value) : value);
        });
        return merged;
    }
}
