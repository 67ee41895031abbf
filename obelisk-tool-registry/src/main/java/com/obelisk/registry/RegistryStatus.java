package com.obelisk.registry;

import java.util.List;

/** Aggregate registry counts. */
public record RegistryStatus(int totalTools, int enabledTools, int disabledTools, long totalUsage, List<String> tools) {
}
