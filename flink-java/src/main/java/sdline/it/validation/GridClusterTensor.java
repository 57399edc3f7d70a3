package sdline.it.validation;

/**
 * Per-cluster spatial planes, indexed [cluster][ra cell][dec cell]. Stages never modify
 * the tensor they receive; they build a new one.
 */
public final class GridClusterTensor {
    private final double[][][] values;

    public GridClusterTensor(int ncluster, int nra, int ndec) {
        this.values = new double[ncluster][nra][ndec];
    }

    private GridClusterTensor(double[][][] values) {
        this.values = values;
    }

    public GridClusterTensor copy() {
        double[][][] out = new double[values.length][][];
        for (int c = 0; c < values.length; c++) out[c] = copyPlane(values[c]);
        return new GridClusterTensor(out);
    }

    public int ncluster() {
        return values.length;
    }

    public int nra() {
        return values.length == 0 ? 0 : values[0].length;
    }

    public int ndec() {
        return values.length == 0 || values[0].length == 0 ? 0 : values[0][0].length;
    }

    public double get(int c, int x, int y) {
        return values[c][x][y];
    }

    void set(int c, int x, int y, double value) {
        values[c][x][y] = value;
    }

    void add(int c, int x, int y, double value) {
        values[c][x][y] += value;
    }

    void setPlane(int c, double[][] plane) {
        values[c] = copyPlane(plane);
    }

    public double[][] plane(int c) {
        return copyPlane(values[c]);
    }

    public int countAbove(int c, double threshold) {
        int count = 0;
        for (double[] column : values[c]) {
            for (double v : column) if (v > threshold) count++;
        }
        return count;
    }

    private static double[][] copyPlane(double[][] plane) {
        double[][] out = new double[plane.length][];
        for (int x = 0; x < plane.length; x++) out[x] = plane[x].clone();
        return out;
    }
}
