package sdline.it.validation.clustering;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sdline.it.model.ClusterInfo;
import sdline.it.model.ClusteringAlgorithm;
import sdline.it.model.ClusteringResult;
import sdline.it.model.LineCluster;
import sdline.it.model.RegionEntry;
import smile.clustering.HierarchicalClustering;
import smile.clustering.linkage.CompleteLinkage;
import smile.clustering.linkage.Linkage;
import smile.clustering.linkage.SingleLinkage;
import smile.clustering.linkage.UPGMALinkage;
import smile.clustering.linkage.UPGMCLinkage;
import smile.clustering.linkage.WPGMCLinkage;
import smile.clustering.linkage.WardLinkage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Two-level agglomerative clustering. The first cut is scaled by link heights of the data
 * augmented with artificial points at both ends of the band, each resulting cluster is then
 * split again by its own link statistics, and finally clusters are cleaned of outliers.
 */
public class HierarchicalLineClustering implements LineClustering {
    private static final Logger LOG = LoggerFactory.getLogger(HierarchicalLineClustering.class);

    static final int REPEAT = 3;
    static final int MIN_MEMBERS = 3;

    private final int nchan;
    private final double nThreshold;
    private final double nThreshold2;
    private final String method;
    private final StandardDeviation std = new StandardDeviation(false);
    private final Median median = new Median();

    public HierarchicalLineClustering(int nchan, double nThreshold, double nThreshold2, String method) {
        this.nchan = nchan;
        this.nThreshold = nThreshold;
        this.nThreshold2 = nThreshold2;
        this.method = method == null ? "single" : method.toLowerCase();
    }

    @Override
    public ClusteringResult cluster(double[][] points, List<RegionEntry> regions, ClusterInfo info) {
        int n = points.length;
        LOG.debug("Ndata = {}", n);
        ClusterArena arena;
        if (n < MIN_MEMBERS) {
            arena = ClusterArena.fromLabels(new int[n]);
        } else {
            arena = ClusterArena.fromLabels(split(points));
        }
        List<LineCluster> lines = clean(points, regions, arena);
        int[] category = arena.denseCategory(n);

        info.mergeClustering(ClusteringAlgorithm.HIERARCHY, Arrays.asList(1, 2, 3, 4, 5),
                Arrays.asList(1.0, 2.0, 3.0, 4.0, 5.0), points, lines, RegionEntry.WHITEN);
        LOG.info("Final: Ncluster = {}, lines = {}", lines.size(), lines);
        return new ClusteringResult(ClusteringAlgorithm.HIERARCHY, lines.size(), lines, category, regions);
    }

    /**
     * First and second level cuts. Returns labels starting at 1.
     */
    int[] split(double[][] data) {
        double[][] augmented = new double[data.length + REPEAT * 2][];
        for (int i = 0; i < REPEAT; i++) {
            augmented[i] = new double[]{nchan / 2, 0.0};
            augmented[REPEAT + i] = new double[]{nchan / 2, nchan - 1};
        }
        for (int i = 0; i < data.length; i++) augmented[REPEAT * 2 + i] = data[i].clone();
        double[] heights = fit(augmented).height();
        double threshold = StatUtils.mean(heights) + nThreshold * std.evaluate(heights);
        LOG.debug("MedianDistance = {}, MeanDistance = {}, Stddev = {}", median.evaluate(heights),
                StatUtils.mean(heights), std.evaluate(heights));

        int[] category = cut(data, threshold);
        int ncluster = max(category);
        LOG.debug("nThreshold = {}, nThreshold2 = {}, method = {}", nThreshold, nThreshold2, method);
        LOG.debug("Init Threshold = {}, Init Ncluster = {}", threshold, ncluster);

        for (int k = 1; k <= ncluster; k++) {
            int c = max(category);
            List<Integer> index = new ArrayList<>();
            for (int i = 0; i < category.length; i++) if (category[i] == k) index.add(i);
            if (index.size() < 2) continue;
            double[][] sub = new double[index.size()][];
            for (int m = 0; m < sub.length; m++) sub[m] = data[index.get(m)];
            double[] subHeights = fit(sub).height();
            double newThreshold = StatUtils.mean(subHeights) + nThreshold2 * std.evaluate(subHeights);
            int[] newCategory = cut(sub, newThreshold);
            int newNcluster = max(newCategory);
            LOG.debug("Threshold({}) = {}, NewNcluster({}) = {}", k, newThreshold, k, newNcluster);
            if (newNcluster > 1) {
                for (int m = 0; m < sub.length; m++) {
                    if (newCategory[m] > 1) category[index.get(m)] = c + newCategory[m] - 1;
                }
            }
        }
        return category;
    }

    /**
     * Drops members far from the cluster centroid and rejects clusters left with fewer than
     * {@link #MIN_MEMBERS} members. One line per surviving cluster, in ascending id order.
     */
    List<LineCluster> clean(double[][] data, List<RegionEntry> regions, ClusterArena arena) {
        List<LineCluster> lines = new ArrayList<>();
        for (int id : new ArrayList<>(arena.activeIds())) {
            List<Integer> members = arena.members(id);
            double[] widths = new double[members.size()];
            double[] centers = new double[members.size()];
            for (int m = 0; m < widths.length; m++) {
                widths[m] = data[members.get(m)][0];
                centers[m] = data[members.get(m)][1];
            }
            double meanWidth = StatUtils.mean(widths);
            double meanCenter = StatUtils.mean(centers);
            double[] dist = new double[members.size()];
            for (int m = 0; m < dist.length; m++) {
                dist[m] = Math.hypot(widths[m] - meanWidth, centers[m] - meanCenter);
            }
            double threshold = median.evaluate(dist) + std.evaluate(dist) * nThreshold2;
            LOG.trace("Threshold({}) = {}", id, threshold);

            int out = 0;
            for (double d : dist) if (d > threshold) out++;
            if (members.size() - out < MIN_MEMBERS) {
                LOG.trace("Non Cluster: {}", members.size());
                for (int i : members) regions.get(i).valid = false;
                arena.deactivate(id);
                continue;
            }
            for (int m = 0; m < dist.length; m++) {
                if (dist[m] > threshold) regions.get(members.get(m)).valid = false;
            }
            lines.add(new LineCluster(meanCenter, meanWidth, true, threshold));
        }
        return lines;
    }

    private HierarchicalClustering fit(double[][] data) {
        return HierarchicalClustering.fit(linkage(data));
    }

    private Linkage linkage(double[][] data) {
        switch (method) {
            case "single":
                return SingleLinkage.of(data);
            case "complete":
                return CompleteLinkage.of(data);
            case "average":
                return UPGMALinkage.of(data);
            case "centroid":
                return UPGMCLinkage.of(data);
            case "median":
                return WPGMCLinkage.of(data);
            default:
                return WardLinkage.of(data);
        }
    }

    /**
     * Flat clusters such that no merge above {@code threshold} is taken, the equivalent of a
     * distance criterion cut. Labels start at 1 in order of first appearance.
     */
    int[] cut(double[][] data, double threshold) {
        int n = data.length;
        int[] labels = new int[n];
        if (n < 2) {
            Arrays.fill(labels, 1);
            return labels;
        }
        HierarchicalClustering hc = fit(data);
        int[][] tree = hc.tree();
        double[] height = hc.height();

        // highest merge inside each subtree, for linkages whose heights are not monotone
        double[] subtreeMax = new double[tree.length];
        int[] parent = new int[n];
        for (int i = 0; i < n; i++) parent[i] = i;
        for (int i = 0; i < tree.length; i++) {
            double h = height[i];
            for (int child : tree[i]) if (child >= n) h = Math.max(h, subtreeMax[child - n]);
            subtreeMax[i] = h;
        }
        // representative leaf of every node
        int[] leaf = new int[n + tree.length];
        for (int i = 0; i < n; i++) leaf[i] = i;
        for (int i = 0; i < tree.length; i++) {
            leaf[n + i] = leaf[tree[i][0]];
            if (subtreeMax[i] <= threshold) union(parent, leaf[tree[i][0]], leaf[tree[i][1]]);
        }

        int next = 1;
        int[] rootLabel = new int[n];
        for (int i = 0; i < n; i++) {
            int root = find(parent, i);
            if (rootLabel[root] == 0) rootLabel[root] = next++;
            labels[i] = rootLabel[root];
        }
        return labels;
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int a, int b) {
        int ra = find(parent, a);
        int rb = find(parent, b);
        if (ra != rb) parent[rb] = ra;
    }

    private static int max(int[] values) {
        int m = 0;
        for (int v : values) m = Math.max(m, v);
        return m;
    }
}
