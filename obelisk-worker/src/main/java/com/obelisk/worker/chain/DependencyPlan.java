package com.obelisk.worker.chain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered batches of call ids. {@code cycleBreaks} lists the ids that were scheduled while
 * their prerequisites were still unresolved; it is empty for an acyclic graph.
 */
public record DependencyPlan(List<List<String>> batches, List<String> cycleBreaks) {

    public DependencyPlan {
        List<List<String>> copy = new ArrayList<>(batches.size());
        for (List<String> batch : batches) {
            copy.add(List.copyOf(batch));
        }
        batches = Collections.unmodifiableList(copy);
        cycleBreaks = List.copyOf(cycleBreaks);
    }

    public boolean cycleDetected() {
        return !cycleBreaks.isEmpty();
    }
}
