package sdline.it.validation.grid;

import sdline.it.model.Sample;

import java.util.ArrayList;
import java.util.List;

/**
 * Regular tiling of the bounding box of all sample positions. Extents are odd so that
 * the map center falls on the center of a cell.
 */
public class GridGeometry {
    public final double x0;
    public final double y0;
    // RA spacing already corrected by 1/cos(dec)
    public final double gridRa;
    public final double gridDec;
    public final int nra;
    public final int ndec;

    public GridGeometry(double x0, double y0, double gridRa, double gridDec, int nra, int ndec) {
        this.x0 = x0;
        this.y0 = y0;
        this.gridRa = gridRa;
        this.gridDec = gridDec;
        this.nra = nra;
        this.ndec = ndec;
    }

    /**
     * @param gridRa  RA spacing in degrees without declination correction
     * @param gridDec Dec spacing in degrees
     */
    public static GridGeometry fromSamples(List<Sample> samples, double gridRa, double gridDec) {
        if (samples.isEmpty()) throw new IllegalArgumentException("No sample positions to grid");
        if (gridRa <= 0.0 || gridDec <= 0.0) {
            throw new IllegalArgumentException("Grid spacing must be positive: " + gridRa + ", " + gridDec);
        }
        double decCorrection = 1.0 / Math.cos(Math.toRadians(samples.get(0).dec));
        double spacingRa = gridRa * decCorrection;

        double raMin = Double.POSITIVE_INFINITY, raMax = Double.NEGATIVE_INFINITY;
        double decMin = Double.POSITIVE_INFINITY, decMax = Double.NEGATIVE_INFINITY;
        for (Sample s : samples) {
            raMin = Math.min(raMin, s.ra);
            raMax = Math.max(raMax, s.ra);
            decMin = Math.min(decMin, s.dec);
            decMax = Math.max(decMax, s.dec);
        }
        double wra = raMax - raMin;
        double wdec = decMax - decMin;
        double cra = raMin + wra / 2.0;
        double cdec = decMin + wdec / 2.0;
        int nra = 2 * ((int) ((wra / 2.0 - spacingRa / 2.0) / spacingRa) + 1) + 1;
        int ndec = 2 * ((int) ((wdec / 2.0 - gridDec / 2.0) / gridDec) + 1) + 1;
        double x0 = cra - spacingRa / 2.0 - spacingRa * (nra - 1) / 2.0;
        double y0 = cdec - gridDec / 2.0 - gridDec * (ndec - 1) / 2.0;
        return new GridGeometry(x0, y0, spacingRa, gridDec, nra, ndec);
    }

    public int raIndex(double ra) {
        return clamp((int) ((ra - x0) / gridRa), nra);
    }

    public int decIndex(double dec) {
        return clamp((int) ((dec - y0) / gridDec), ndec);
    }

    private static int clamp(int index, int n) {
        return Math.min(Math.max(index, 0), n - 1);
    }

    public boolean inside(double ra, double dec) {
        double fx = (ra - x0) / gridRa;
        double fy = (dec - y0) / gridDec;
        return fx >= 0.0 && fx < nra && fy >= 0.0 && fy < ndec;
    }

    public double cellCenterRa(int ix) {
        return x0 + gridRa * (ix + 0.5);
    }

    public double cellCenterDec(int iy) {
        return y0 + gridDec * (iy + 0.5);
    }

    /**
     * Maps each cell to the indices (into {@code samples}) of the samples it contains.
     */
    public GridIndex index(List<Sample> samples) {
        GridIndex index = new GridIndex(nra, ndec);
        for (int i = 0; i < samples.size(); i++) {
            Sample s = samples.get(i);
            index.add(raIndex(s.ra), decIndex(s.dec), i);
        }
        return index;
    }

    @Override
    public String toString() {
        return String.format("Grid = %d x %d (x0=%.6f, y0=%.6f, spacing=%.6f x %.6f)", nra, ndec, x0, y0, gridRa, gridDec);
    }

    public static class GridIndex {
        private final List<List<List<Integer>>> cells;

        GridIndex(int nra, int ndec) {
            cells = new ArrayList<>(nra);
            for (int x = 0; x < nra; x++) {
                List<List<Integer>> column = new ArrayList<>(ndec);
                for (int y = 0; y < ndec; y++) column.add(new ArrayList<>());
                cells.add(column);
            }
        }

        void add(int ix, int iy, int sampleIndex) {
            cells.get(ix).get(iy).add(sampleIndex);
        }

        public List<Integer> get(int ix, int iy) {
            return cells.get(ix).get(iy);
        }
    }
}
