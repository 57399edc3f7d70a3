package sdline.it.validation.fit;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SVDSolver2DTest {

    private static final double[] X = {0.0, 1.0, 0.0, 1.0, 2.0, 1.0, 3.0, -1.5};
    private static final double[] Y = {0.0, 0.0, 1.0, 1.0, 1.0, 3.0, 2.0, 0.5};

    private static double[] plane(double[] x, double[] y) {
        double[] z = new double[x.length];
        for (int k = 0; k < x.length; k++) z[k] = 2.0 + 3.0 * x[k] - y[k];
        return z;
    }

    @Test
    public void testPlanarSurfaceIsRecovered() {
        SVDSolver2D solver = new SVDSolver2D(1, 1);
        solver.setDataPoints(X, Y);
        double[] z = plane(X, Y);

        double[] coeff = solver.findGoodSolution(z);

        assertEquals(4, coeff.length);
        assertEquals(2.0, coeff[0], 1e-6);
        assertEquals(3.0, coeff[1], 1e-6);
        assertEquals(-1.0, coeff[2], 1e-6);
        assertEquals(0.0, coeff[3], 1e-6);
        assertTrue(solver.score(coeff, z) < 1e-3);
    }

    @Test
    public void testEvaluateMatchesCoefficientLayout() {
        // a[j + (xorder + 1) * i] multiplies x^j y^i
        double[] coeff = {1.0, 2.0, 3.0, 4.0, 5.0, 6.0};
        double x = 2.0;
        double y = 3.0;
        double expected = 1 + 2 * x + 3 * x * x + 4 * y + 5 * x * y + 6 * x * x * y;
        assertEquals(expected, SVDSolver2D.evaluate(2, 1, coeff, x, y), 1e-12);
    }

    @Test
    public void testSolveWithMaskOfZeroIsLeastSquares() {
        SVDSolver2D solver = new SVDSolver2D(1, 0);
        solver.setDataPoints(new double[]{0, 1, 2, 3}, new double[]{0, 0, 0, 0});
        double[] coeff = solver.solveWithMask(new double[]{1, 3, 5, 7}, 0);
        assertEquals(1.0, coeff[0], 1e-9);
        assertEquals(2.0, coeff[1], 1e-9);
    }

    @Test
    public void testTooFewPointsRejected() {
        SVDSolver2D solver = new SVDSolver2D(2, 2);
        assertThrows(IllegalArgumentException.class,
                () -> solver.setDataPoints(new double[]{0, 1, 2}, new double[]{0, 1, 2}));
    }

    @Test
    public void testMismatchedLengthsRejected() {
        SVDSolver2D solver = new SVDSolver2D(0, 0);
        assertThrows(IllegalArgumentException.class,
                () -> solver.setDataPoints(new double[]{0, 1}, new double[]{0}));
    }

    @Test
    public void testNoGoodSolutionThrows() {
        // constant model cannot follow values of alternating sign
        SVDSolver2D solver = new SVDSolver2D(0, 0);
        solver.setDataPoints(new double[]{0, 1, 2, 3}, new double[]{0, 0, 0, 0});
        assertThrows(SingularFitException.class, () -> solver.findGoodSolution(new double[]{1, -1, 1, -1}));
    }

    @Test
    public void testUnmaskedSolutionMatchesLeastSquares() {
        SVDSolver2D solver = new SVDSolver2D(1, 1);
        solver.setDataPoints(X, Y);
        double[] z = plane(X, Y);
        double[] noise = {0.1, -0.2, 0.05, 0.3, -0.1, 0.15, -0.25, 0.2};
        double[][] rows = new double[X.length][];
        for (int k = 0; k < X.length; k++) {
            z[k] += noise[k];
            rows[k] = new double[]{1.0, X[k], Y[k], X[k] * Y[k]};
        }

        double[] coeff = solver.solveWithEps(z, 0.0);
        RealVector expected = new SingularValueDecomposition(new Array2DRowRealMatrix(rows))
                .getSolver().solve(new ArrayRealVector(z));

        for (int i = 0; i < coeff.length; i++) assertEquals(expected.getEntry(i), coeff[i], 1e-9);
    }
}
