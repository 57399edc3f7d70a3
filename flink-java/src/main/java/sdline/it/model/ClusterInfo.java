package sdline.it.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Diagnostics of the clustering analysis, kept for plotting only.
 */
public class ClusterInfo {
    public Map<String, Double> grid;
    public List<Integer> scoreNcluster;
    public List<Double> scoreValue;
    public double[][] detectedLines;
    public List<LineCluster> clusterProperty;
    public Double clusterScale;
    public Map<String, double[]> stageThresholds = new LinkedHashMap<>();
    public int[][][] clusterFlag;

    public ClusterInfo() {
    }

    public boolean isEmpty() {
        return grid == null && clusterProperty == null && clusterFlag == null;
    }

    /**
     * Registers the diagnostics of one clustering run: the k-means score wins over any other,
     * detected lines and scale are written once, cluster properties accumulate.
     */
    public void mergeClustering(ClusteringAlgorithm algorithm, List<Integer> ncluster, List<Double> score,
                                double[][] detected, List<LineCluster> property, double scale) {
        if (scoreNcluster == null || algorithm == ClusteringAlgorithm.KMEAN) {
            scoreNcluster = ncluster;
            scoreValue = score;
        }
        if (detectedLines == null) detectedLines = detected;
        if (clusterProperty == null) clusterProperty = new ArrayList<>();
        for (LineCluster c : property) clusterProperty.add(c.copy());
        if (clusterScale == null) clusterScale = scale;
    }

    public void registerGrid(double raMin, double decMin, double gridRa, double gridDec) {
        if (grid != null) return;
        grid = new LinkedHashMap<>();
        grid.put("ra_min", raMin);
        grid.put("dec_min", decMin);
        grid.put("grid_ra", gridRa);
        grid.put("grid_dec", gridDec);
    }
}
