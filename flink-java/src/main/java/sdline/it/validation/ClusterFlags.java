package sdline.it.validation;

import java.util.List;

/**
 * Quantised stage history of every grid cell of every cluster. Each stage owns one decimal
 * digit (detection 1, validation 10, smoothing 100, final 1000) and adds the digit once per
 * threshold the cell value exceeds.
 */
public final class ClusterFlags {
    public static final int DETECTION = 1;
    public static final int VALIDATION = 10;
    public static final int SMOOTHING = 100;
    public static final int FINAL = 1000;

    private final int[][][] flags;

    public ClusterFlags(int ncluster, int nra, int ndec) {
        this.flags = new int[ncluster][nra][ndec];
    }

    private ClusterFlags(int[][][] flags) {
        this.flags = flags;
    }

    public ClusterFlags accumulate(GridClusterTensor tensor, double[] thresholds, int digit) {
        int[][][] out = toArray();
        for (int c = 0; c < out.length; c++) {
            for (int x = 0; x < out[c].length; x++) {
                for (int y = 0; y < out[c][x].length; y++) {
                    for (double t : thresholds) {
                        if (tensor.get(c, x, y) > t) out[c][x][y] += digit;
                    }
                }
            }
        }
        return new ClusterFlags(out);
    }

    public int get(int c, int x, int y) {
        return flags[c][x][y];
    }

    public int ncluster() {
        return flags.length;
    }

    public int[][][] toArray() {
        int[][][] out = new int[flags.length][][];
        for (int c = 0; c < flags.length; c++) {
            out[c] = new int[flags[c].length][];
            for (int x = 0; x < flags[c].length; x++) out[c][x] = flags[c][x].clone();
        }
        return out;
    }

    /**
     * Flags of several clustering runs stacked along the cluster axis.
     */
    public static int[][][] concat(List<ClusterFlags> parts) {
        int total = 0;
        for (ClusterFlags p : parts) total += p.flags.length;
        int[][][] out = new int[total][][];
        int i = 0;
        for (ClusterFlags p : parts) {
            for (int[][] plane : p.toArray()) out[i++] = plane;
        }
        return out;
    }
}
