package com.obelisk.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.obelisk.config.ObeliskConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory model catalog. Loaded from a JSON array of {@link ModelCapability} objects,
 * either from OBELISK_MODELS_FILE or from the bundled classpath resource {@value #DEFAULT_RESOURCE}.
 */
public final class StaticModelCapabilityResolver implements ModelCapabilityResolver {

    private static final Logger log = LoggerFactory.getLogger(StaticModelCapabilityResolver.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    public static final String DEFAULT_RESOURCE = "models.json";

    private final Map<String, ModelCapability> models;

    public StaticModelCapabilityResolver(List<ModelCapability> models) {
        Map<String, ModelCapability> byId = new LinkedHashMap<>();
        for (ModelCapability m : Objects.requireNonNull(models, "models")) {
            if (byId.putIfAbsent(m.modelId(), m) != null) {
                throw new IllegalArgumentException("Duplicate model id in catalog: " + m.modelId());
            }
        }
        this.models = Map.copyOf(byId);
    }

    /** Uses the configured models file when set, else the bundled catalog. */
    public static StaticModelCapabilityResolver load(ObeliskConfig config) {
        String file = config.getModelsFile();
        if (file != null) {
            return fromFile(Path.of(file));
        }
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public static StaticModelCapabilityResolver fromFile(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            StaticModelCapabilityResolver resolver = new StaticModelCapabilityResolver(parse(in));
            log.info("Loaded {} model capabilities from {}", resolver.models.size(), path);
            return resolver;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read model catalog " + path, e);
        }
    }

    public static StaticModelCapabilityResolver fromClasspath(String resource) {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = StaticModelCapabilityResolver.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Model catalog resource not found: " + resource);
            }
            StaticModelCapabilityResolver resolver = new StaticModelCapabilityResolver(parse(in));
            log.info("Loaded {} model capabilities from classpath:{}", resolver.models.size(), resource);
            return resolver;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read model catalog classpath:" + resource, e);
        }
    }

    private static List<ModelCapability> parse(InputStream in) throws IOException {
        return MAPPER.readValue(in, new TypeReference<List<ModelCapability>>() {});
    }

    @Override
    public Optional<ModelCapability> resolve(String modelId) {
        if (modelId == null) return Optional.empty();
        return Optional.ofNullable(models.get(modelId));
    }

    @Override
    public List<ModelCapability> allModels() {
        List<ModelCapability> all = new ArrayList<>(models.values());
        all.sort(Comparator.comparing(ModelCapability::name));
        return all;
    }
}
