package sdline.it.validation.clustering;

import sdline.it.model.ClusteringResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Clusters with stable ids. Rejected clusters are deactivated rather than renumbered; dense
 * ids are assigned only when the final category array is produced.
 */
final class ClusterArena {
    private final Map<Integer, List<Integer>> members = new TreeMap<>();
    private final Set<Integer> active = new TreeSet<>();

    static ClusterArena fromLabels(int[] labels) {
        ClusterArena arena = new ClusterArena();
        for (int i = 0; i < labels.length; i++) {
            arena.members.computeIfAbsent(labels[i], k -> new ArrayList<>()).add(i);
            arena.active.add(labels[i]);
        }
        return arena;
    }

    Set<Integer> activeIds() {
        return Collections.unmodifiableSet(active);
    }

    List<Integer> members(int id) {
        return members.getOrDefault(id, Collections.emptyList());
    }

    void deactivate(int id) {
        active.remove(id);
    }

    /**
     * Category per point: active clusters numbered 0.. in ascending id order, members of
     * inactive clusters get {@link ClusteringResult#NO_CLUSTER}.
     */
    int[] denseCategory(int n) {
        int[] category = new int[n];
        Arrays.fill(category, ClusteringResult.NO_CLUSTER);
        int dense = 0;
        for (int id : active) {
            for (int i : members.get(id)) category[i] = dense;
            dense++;
        }
        return category;
    }
}
