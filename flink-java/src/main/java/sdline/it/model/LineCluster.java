package sdline.it.model;

/**
 * Line property of a cluster found in (width, center) space. Validity only ever moves
 * from true to false.
 */
public class LineCluster {
    public double center;
    public double width;
    public double extra;
    private boolean valid;

    public LineCluster(double center, double width, boolean valid, double extra) {
        this.center = center;
        this.width = width;
        this.valid = valid;
        this.extra = extra;
    }

    public static LineCluster fromWindow(ChannelRange window) {
        int lo = Math.min(window.start, window.end);
        int hi = Math.max(window.start, window.end);
        return new LineCluster(0.5 * (window.start + window.end), hi - lo, true, 0.0);
    }

    public boolean isValid() {
        return valid;
    }

    public void invalidate() {
        valid = false;
    }

    public LineCluster copy() {
        return new LineCluster(center, width, valid, extra);
    }

    @Override
    public String toString() {
        return String.format("[%.2f, %.2f, %s, %.3f]", center, width, valid, extra);
    }
}
