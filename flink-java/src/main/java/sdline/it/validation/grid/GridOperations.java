package sdline.it.validation.grid;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Plane operations on [nra][ndec] grids: direct convolution, connected-component
 * cleaning and blurring of cluster sub-planes.
 */
public final class GridOperations {

    private GridOperations() {
    }

    /**
     * Direct 2-D convolution; cells beyond the edge take the value of the nearest edge cell.
     * Returns an array with the same shape as {@code data}.
     */
    public static double[][] convolve2d(double[][] data, double[][] kernel) {
        int ndx = data.length;
        int ndy = data[0].length;
        int nkx = kernel.length;
        int nky = kernel[0].length;
        int edgex = (nkx - 1) / 2;
        int edgey = (nky - 1) / 2;
        double[][] out = new double[ndx][ndy];
        for (int ix = 0; ix < ndx; ix++) {
            for (int iy = 0; iy < ndy; iy++) {
                double sum = 0.0;
                for (int jx = 0; jx < nkx; jx++) {
                    int px = clamp(ix + jx - edgex, ndx);
                    for (int jy = 0; jy < nky; jy++) {
                        int py = clamp(iy + jy - edgey, ndy);
                        sum += kernel[jx][jy] * data[px][py];
                    }
                }
                out[ix][iy] = sum;
            }
        }
        return out;
    }

    private static int clamp(int i, int n) {
        return i < 0 ? 0 : (i >= n ? n - 1 : i);
    }

    /**
     * Splits the occupied cells of {@code plane} into 8-connected components and drops the
     * ones that are too small. A component survives when its size is at least
     * {@code min(0.5 * max(realMember), 3)}; a single-cell component whose cell holds at most
     * one spectrum never survives.
     *
     * @param original   per-cell detection score
     * @param plane      occupied cells
     * @param gridMember number of candidate spectra per cell
     * @param valid      score above which a cell counts as a real member
     */
    public static List<SubCluster> cleanIsolation(double[][] original, boolean[][] plane, int[][] gridMember, double valid) {
        int nra = plane.length;
        int ndec = plane[0].length;
        boolean[][] visited = new boolean[nra][ndec];
        List<SubCluster> components = new ArrayList<>();

        for (int x = 0; x < nra; x++) {
            for (int y = 0; y < ndec; y++) {
                if (!plane[x][y] || visited[x][y]) continue;
                SubCluster sub = new SubCluster();
                Deque<int[]> queue = new ArrayDeque<>();
                visited[x][y] = true;
                queue.add(new int[]{x, y});
                while (!queue.isEmpty()) {
                    int[] c = queue.poll();
                    sub.cells.add(c);
                    if (original[c[0]][c[1]] > valid) sub.realMember++;
                    for (int dx = -1; dx <= 1; dx++) {
                        for (int dy = -1; dy <= 1; dy++) {
                            int nx = c[0] + dx;
                            int ny = c[1] + dy;
                            if (nx < 0 || nx >= nra || ny < 0 || ny >= ndec) continue;
                            if (plane[nx][ny] && !visited[nx][ny]) {
                                visited[nx][ny] = true;
                                queue.add(new int[]{nx, ny});
                            }
                        }
                    }
                }
                components.add(sub);
            }
        }
        if (components.isEmpty()) return components;

        int maxReal = 0;
        for (SubCluster sub : components) maxReal = Math.max(maxReal, sub.realMember);
        double threshold = Math.min(0.5 * maxReal, 3.0);

        List<SubCluster> kept = new ArrayList<>();
        for (SubCluster sub : components) {
            int nmember = sub.size();
            if (nmember == 1) {
                int[] c = sub.cells.get(0);
                if (gridMember[c[0]][c[1]] <= 1) nmember = 0;
            }
            if (nmember >= threshold) kept.add(sub);
        }
        return kept;
    }

    /**
     * Blurs a component sub-plane with a disc kernel whose radius grows with the number of
     * real members.
     */
    public static BlurResult doBlur(int realMember, double[][] subPlane, double ratio, double valid, double marginal) {
        int nra = subPlane.length;
        int ndec = subPlane[0].length;
        double blurF = Math.sqrt(realMember / Math.PI) * ratio + 1.5;
        int blur = (int) blurF;
        if (nra < blur * 2 + 1 && ndec < blur * 2 + 1) blur = (Math.max(nra, ndec) - 1) / 2;

        int size = blur * 2 + 1;
        double[][] kernel = new double[size][size];
        for (int x = 0; x < size; x++) {
            int dx = blur - x;
            for (int y = 0; y < size; y++) {
                int dy = blur - y;
                if (Math.sqrt(dx * dx + dy * dy) <= blurF) kernel[x][y] = 1.0;
            }
        }

        double[][] blurred = convolve2d(subPlane, kernel);
        boolean[][] validPlane = new boolean[nra][ndec];
        boolean[][] blurPlane = new boolean[nra][ndec];
        for (int x = 0; x < nra; x++) {
            for (int y = 0; y < ndec; y++) {
                validPlane[x][y] = subPlane[x][y] > valid;
                blurPlane[x][y] = blurred[x][y] > marginal;
            }
        }
        return new BlurResult(validPlane, blurPlane);
    }
}
