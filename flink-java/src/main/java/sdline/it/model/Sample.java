package sdline.it.model;

public class Sample {
    public int row;
    public double ra;
    public double dec;

    public Sample(int row, double ra, double dec) {
        this.row = row;
        this.ra = ra;
        this.dec = dec;
    }

    @Override
    public String toString() {
        return String.format("Sample{row=%d, ra=%.6f, dec=%.6f}", row, ra, dec);
    }
}
