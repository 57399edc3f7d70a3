package sdline.it.model;

/**
 * One (sample, range) pair flattened for clustering. The list of entries is never
 * reordered or shrunk: membership arrays are aligned to it by position.
 */
public class RegionEntry {
    // width scale applied before clustering
    public static final double WHITEN = 1.0;

    public final int sampleId;
    public final int start;
    public final int end;
    public final double ra;
    public final double dec;
    public final int binning;
    public boolean valid;

    public RegionEntry(int sampleId, int start, int end, double ra, double dec, boolean valid, int binning) {
        this.sampleId = sampleId;
        this.start = start;
        this.end = end;
        this.ra = ra;
        this.dec = dec;
        this.valid = valid;
        this.binning = binning;
    }

    public RegionEntry copy() {
        return new RegionEntry(sampleId, start, end, ra, dec, valid, binning);
    }

    public double width() {
        return end - start;
    }

    public double center() {
        return 0.5 * (start + end);
    }

    /**
     * Point in clustering space: {@code [width / WHITEN, center]}.
     */
    public double[] whitened() {
        return new double[]{width() / WHITEN, center()};
    }

    @Override
    public String toString() {
        return String.format("%d %d %d %f %f %d %d", sampleId, start, end, ra, dec, valid ? 1 : 0, binning);
    }
}
