package com.obelisk.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Record of one model switch in a session and its effect on the available tool set.
 */
public record ModelChangeEvent(
        @JsonProperty("sessionId") String sessionId,
        @JsonProperty("oldModel") String oldModel,
        @JsonProperty("newModel") String newModel,
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("toolsBefore") Set<String> toolsBefore,
        @JsonProperty("toolsAfter") Set<String> toolsAfter,
        @JsonProperty("toolsAdded") Set<String> toolsAdded,
        @JsonProperty("toolsRemoved") Set<String> toolsRemoved) {

    @JsonCreator
    public ModelChangeEvent {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(newModel, "newModel");
        toolsBefore = sorted(toolsBefore);
        toolsAfter = sorted(toolsAfter);
        toolsAdded = sorted(toolsAdded);
        toolsRemoved = sorted(toolsRemoved);
    }

    /** Builds the event, deriving added (after minus before) and removed (before minus after). */
    public static ModelChangeEvent create(String sessionId, String oldModel, String newModel, long timestamp,
                                          Set<String> toolsBefore, Set<String> toolsAfter) {
        Set<String> added = new TreeSet<>(toolsAfter);
        added.removeAll(toolsBefore);
        Set<String> removed = new TreeSet<>(toolsBefore);
        removed.removeAll(toolsAfter);
        return new ModelChangeEvent(sessionId, oldModel, newModel, timestamp, toolsBefore, toolsAfter, added, removed);
    }

    private static Set<String> sorted(Set<String> tools) {
        SortedSet<String> copy = tools != null ? new TreeSet<>(tools) : new TreeSet<>();
        return Collections.unmodifiableSortedSet(copy);
    }
}
