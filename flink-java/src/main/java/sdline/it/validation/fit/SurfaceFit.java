package sdline.it.validation.fit;

/**
 * Result of fitting the two channel-range endpoints of a line as polynomial surfaces over
 * the sky plane: either both coefficient sets at the order that succeeded, or singular.
 */
public class SurfaceFit {
    private static final SurfaceFit SINGULAR = new SurfaceFit(-1, -1, null, null);

    public final int xorder;
    public final int yorder;
    public final double[] upper;
    public final double[] lower;

    private SurfaceFit(int xorder, int yorder, double[] upper, double[] lower) {
        this.xorder = xorder;
        this.yorder = yorder;
        this.upper = upper;
        this.lower = lower;
    }

    public static SurfaceFit of(int xorder, int yorder, double[] upper, double[] lower) {
        return new SurfaceFit(xorder, yorder, upper, lower);
    }

    public static SurfaceFit singular() {
        return SINGULAR;
    }

    public boolean isSingular() {
        return upper == null;
    }

    public double upperAt(double x, double y) {
        return SVDSolver2D.evaluate(xorder, yorder, upper, x, y);
    }

    public double lowerAt(double x, double y) {
        return SVDSolver2D.evaluate(xorder, yorder, lower, x, y);
    }

    @Override
    public String toString() {
        return isSingular() ? "SurfaceFit{singular}" : String.format("SurfaceFit{order=(%d,%d)}", xorder, yorder);
    }
}
