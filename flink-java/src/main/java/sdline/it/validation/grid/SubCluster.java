package sdline.it.validation.grid;

import java.util.ArrayList;
import java.util.List;

/**
 * Spatially connected set of grid cells belonging to one line cluster.
 */
public class SubCluster {
    public final List<int[]> cells = new ArrayList<>();
    // cells above the Valid threshold
    public int realMember;

    public int size() {
        return cells.size();
    }

    @Override
    public String toString() {
        return "SubCluster{cells=" + cells.size() + ", realMember=" + realMember + '}';
    }
}
