package com.obelisk.registry;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Source of model capabilities. Implementations may be backed by a static catalog, a model
 * provider API, or a database; the core only depends on this port.
 */
public interface ModelCapabilityResolver {

    /** Capability of the given model, or empty when the model is unknown. */
    Optional<ModelCapability> resolve(String modelId);

    /** Every known model, sorted by display name. */
    List<ModelCapability> allModels();

    default boolean supportsToolCalls(String modelId) {
        return resolve(modelId).map(ModelCapability::supportsToolCalls).orElse(false);
    }

    /** Known models that support tool calls, sorted by display name. */
    default List<ModelCapability> toolCapableModels() {
        return allModels().stream()
                .filter(ModelCapability::supportsToolCalls)
                .sorted(Comparator.comparing(ModelCapability::name))
                .collect(Collectors.toList());
    }
}
