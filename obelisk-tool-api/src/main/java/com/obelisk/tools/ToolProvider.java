package com.obelisk.tools;

import java.util.Collections;
import java.util.Map;

/**
 * SPI for pluggable tools. Built-in providers are listed explicitly at startup; community
 * providers are discovered via {@link java.util.ServiceLoader}
 * (META-INF/services/com.obelisk.tools.ToolProvider).
 */
public interface ToolProvider {

    /** Tool id; equals the definition name of {@link #getTool()}. */
    String getToolId();

    /** Tool instance, typically created in the provider constructor. */
    Tool getTool();

    /** Human-readable description for discovery. */
    String getDescription();

    ToolCategory getCategory();

    default String getVersion() {
        return getTool().definition().getVersion();
    }

    /** Optional capability metadata for audit (e.g. supported operations). */
    default Map<String, Object> getCapabilityMetadata() {
        return Collections.emptyMap();
    }

    /** Whether this provider should be registered. */
    default boolean isEnabled() {
        return true;
    }
}
