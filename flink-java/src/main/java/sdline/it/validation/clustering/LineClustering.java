package sdline.it.validation.clustering;

import sdline.it.model.ClusterInfo;
import sdline.it.model.ClusteringResult;
import sdline.it.model.RegionEntry;

import java.util.List;

/**
 * Groups detected line ranges in (width, center) space.
 */
public interface LineClustering {

    /**
     * @param points  whitened {@code [width, center]} per region entry, aligned with {@code regions}
     * @param regions entries whose {@code valid} flag is cleared for outliers
     * @param info    diagnostics collector updated with this run
     */
    ClusteringResult cluster(double[][] points, List<RegionEntry> regions, ClusterInfo info);
}
