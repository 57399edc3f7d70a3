package sdline.it.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of line validation. Defaults follow the single-dish clustering rules.
 */
public class ValidationConfig implements Serializable {
    private static final long serialVersionUID = 1L;

    // spatial grid, degrees (RA spacing without declination correction)
    public double gridRa = 0.0025;
    public double gridDec = 0.0025;
    public int[] edge = {0, 0};
    public double nsigma = 3.0;
    public int xorder = -1;
    public int yorder = -1;
    public boolean broadComponent = false;
    public String clusteringAlgorithm = "hierarchy";
    public List<ChannelRange> window = new ArrayList<>();
    public String windowMode = "replace";

    // cluster rule
    public double thresholdValid = 0.7;
    public double thresholdMarginal = 0.5;
    public double thresholdQuestionable = 0.2;
    public int maxCluster = 40;
    public double blurRatio = 0.1;
    public double thresholdHierarchy = 8.0;
    public double thresholdHierarchy2 = 2.5;
    public String linkage = "single";
    public int minFwhm = 5;
    public double detectionRate = 0.7;

    public ValidationConfig() {
    }

    public WindowMode windowMode() {
        return WindowMode.fromName(windowMode);
    }

    /**
     * Fails fast on malformed manual windows or window modes.
     */
    public void check() {
        windowMode();
        if (window == null) throw new IllegalArgumentException("window must not be null");
        for (ChannelRange w : window) {
            if (w == null || w.start < 0 || w.end < 0 || w.start > w.end) {
                throw new IllegalArgumentException("Invalid line window: " + w);
            }
        }
        if (edge == null || edge.length != 2) {
            throw new IllegalArgumentException("edge must have two elements");
        }
    }

    /**
     * Maximum plausible line width in channels: a third of the non-edge channels.
     */
    public int maxFwhm(int nchan) {
        return Math.max(0, nchan - edge[0] - edge[1]) / 3;
    }

    @Override
    public String toString() {
        return String.format("ValidationConfig{grid=(%s,%s), edge=[%d,%d], nsigma=%s, order=(%d,%d), algorithm=%s, window=%s, windowmode=%s}",
                gridRa, gridDec, edge[0], edge[1], nsigma, xorder, yorder, clusteringAlgorithm, window, windowMode);
    }
}
