package sdline.it.model;

import java.util.List;

/**
 * Outcome of one clustering algorithm. {@code category[i]} is the cluster id of
 * {@code regions.get(i)}, or {@link #NO_CLUSTER} when the point belongs to no surviving cluster.
 */
public class ClusteringResult {
    public static final int NO_CLUSTER = -1;

    public ClusteringAlgorithm algorithm;
    public int ncluster;
    public List<LineCluster> lines;
    public int[] category;
    public List<RegionEntry> regions;

    public ClusteringResult(ClusteringAlgorithm algorithm, int ncluster, List<LineCluster> lines, int[] category,
                            List<RegionEntry> regions) {
        this.algorithm = algorithm;
        this.ncluster = ncluster;
        this.lines = lines;
        this.category = category;
        this.regions = regions;
    }

    @Override
    public String toString() {
        return String.format("ClusteringResult{algorithm=%s, ncluster=%d, lines=%s}", algorithm, ncluster, lines);
    }
}
