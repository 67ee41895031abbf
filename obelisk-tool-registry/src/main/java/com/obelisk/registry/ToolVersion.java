package com.obelisk.registry;

import com.obelisk.tools.Tool;

/**
 * One entry of a tool's version history.
 *
 * @param version      semantic version of the definition
 * @param tool         implementation registered under that version
 * @param registeredAt registration time (epoch millis)
 */
public record ToolVersion(String version, Tool tool, long registeredAt) {
}
