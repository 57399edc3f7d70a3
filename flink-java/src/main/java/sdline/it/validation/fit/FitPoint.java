package sdline.it.validation.fit;

public class FitPoint {
    public final double lower;
    public final double upper;
    public final double x;
    public final double y;
    public boolean effective = true;

    public FitPoint(double lower, double upper, double x, double y) {
        this.lower = lower;
        this.upper = upper;
        this.x = x;
        this.y = y;
    }

    @Override
    public String toString() {
        return String.format("[%.1f, %.1f, %.6f, %.6f, %d]", lower, upper, x, y, effective ? 1 : 0);
    }
}
