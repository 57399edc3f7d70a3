package sdline.it.validation.grid;

public class BlurResult {
    // cells used for fitting
    public final boolean[][] validPlane;
    // cells that only receive the nearest fitted value
    public final boolean[][] blurPlane;

    public BlurResult(boolean[][] validPlane, boolean[][] blurPlane) {
        this.validPlane = validPlane;
        this.blurPlane = blurPlane;
    }
}
