package com.obelisk.worker.chain;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Topological sort of a prerequisite graph into batches: each batch holds the ids whose
 * prerequisites all appear in earlier batches. Ids keep request order inside a batch. When
 * no id is ready the first remaining id is scheduled alone to break the cycle. Prerequisites
 * that are not ids of the chain are ignored.
 */
public final class DependencyResolver {

    private DependencyResolver() {
    }

    public static DependencyPlan resolve(List<String> ids, Map<String, List<String>> dependencies) {
        Set<String> known = new LinkedHashSet<>(ids);
        Map<String, Set<String>> pending = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (String id : known) {
            Set<String> prerequisites = new LinkedHashSet<>();
            List<String> declared = dependencies != null ? dependencies.get(id) : null;
            if (declared != null) {
                for (String p : declared) {
                    if (known.contains(p) && !p.equals(id)) {
                        prerequisites.add(p);
                        dependents.computeIfAbsent(p, k -> new ArrayList<>()).add(id);
                    } else if (p.equals(id)) {
                        // self-dependency is unsatisfiable; keep it so it surfaces as a cycle
                        prerequisites.add(p);
                    }
                }
            }
            pending.put(id, prerequisites);
        }

        List<List<String>> batches = new ArrayList<>();
        List<String> cycleBreaks = new ArrayList<>();
        while (!pending.isEmpty()) {
            List<String> ready = new ArrayList<>();
            for (Map.Entry<String, Set<String>> e : pending.entrySet()) {
                if (e.getValue().isEmpty()) ready.add(e.getKey());
            }
            if (ready.isEmpty()) {
                String forced = pending.keySet().iterator().next();
                ready.add(forced);
                cycleBreaks.add(forced);
            }
            for (String id : ready) {
                pending.remove(id);
                for (String dependent : dependents.getOrDefault(id, List.of())) {
                    Set<String> remaining = pending.get(dependent);
                    if (remaining != null) remaining.remove(id);
                }
            }
            batches.add(ready);
        }
        return new DependencyPlan(batches, cycleBreaks);
    }
}
