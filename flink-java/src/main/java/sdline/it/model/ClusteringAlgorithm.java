package sdline.it.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public enum ClusteringAlgorithm {
    KMEAN("kmean"),
    HIERARCHY("hierarchy"),
    BOTH("both");

    private final String label;

    ClusteringAlgorithm(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Concrete algorithms to run, in execution order.
     */
    public List<ClusteringAlgorithm> expand() {
        if (this == BOTH) return Arrays.asList(KMEAN, HIERARCHY);
        return Collections.singletonList(this);
    }

    /**
     * @return matching algorithm, or null when the name is unknown
     */
    public static ClusteringAlgorithm fromName(String name) {
        for (ClusteringAlgorithm a : values()) {
            if (a.label.equals(name)) return a;
        }
        return null;
    }
}
