package sdline.it.validation.fit;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Least-squares solver for two-dimensional polynomials
 *
 * <pre>
 *   z = sum_{i <= yorder, j <= xorder} a[j + (xorder + 1) * i] * x^j * y^i
 * </pre>
 *
 * based on singular value decomposition of the design matrix. Small singular values
 * are masked to keep the solution stable where sample density is very uneven.
 */
public class SVDSolver2D {
    private static final Logger LOG = LoggerFactory.getLogger(SVDSolver2D.class);

    public static final double DEFAULT_THRESHOLD = 0.05;

    private final int xorder;
    private final int yorder;
    private final int numCoeff;

    private int numData;
    private RealMatrix design;

    // cached decomposition: U (N x L), s (L, descending), V (L x L)
    private RealMatrix u;
    private double[] s;
    private RealMatrix v;

    public SVDSolver2D(int xorder, int yorder) {
        if (xorder < 0 || yorder < 0) {
            throw new IllegalArgumentException("Polynomial orders must be 0 or positive: " + xorder + ", " + yorder);
        }
        this.xorder = xorder;
        this.yorder = yorder;
        this.numCoeff = (xorder + 1) * (yorder + 1);
    }

    /**
     * Configures the design matrix from the sample positions.
     *
     * @throws IllegalArgumentException if lengths differ or there are fewer points than coefficients
     */
    public void setDataPoints(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("x and y must have the same length: " + x.length + " != " + y.length);
        }
        if (x.length < numCoeff) {
            throw new IllegalArgumentException(String.format(
                    "Too few data points (%d) for polynomial order (%d, %d)", x.length, xorder, yorder));
        }
        numData = x.length;
        double[][] rows = new double[numData][numCoeff];
        for (int k = 0; k < numData; k++) {
            double yp = 1.0;
            for (int i = 0; i <= yorder; i++) {
                double xp = 1.0;
                for (int j = 0; j <= xorder; j++) {
                    rows[k][j + (xorder + 1) * i] = xp * yp;
                    xp *= x[k];
                }
                yp *= y[k];
            }
        }
        design = new Array2DRowRealMatrix(rows, false);
        u = null;
        s = null;
        v = null;
    }

    private void decompose() {
        if (design == null) throw new IllegalStateException("Data points are not set");
        if (s != null) return;
        SingularValueDecomposition svd = new SingularValueDecomposition(design);
        u = svd.getU();
        v = svd.getV();
        s = svd.getSingularValues();
        if (LOG.isTraceEnabled()) LOG.trace("singular values = {}", Arrays.toString(s));
    }

    /**
     * Solves with singular values below {@code eps * max(s)} masked.
     */
    public double[] solveWithEps(double[] z, double eps) {
        if (eps < 0.0) throw new IllegalArgumentException("eps must be 0 or positive");
        checkRhs(z);
        decompose();
        double threshold = s[0] * eps;
        double[] sinv = new double[s.length];
        for (int i = 0; i < s.length; i++) {
            sinv[i] = s[i] < threshold || s[i] == 0.0 ? 0.0 : 1.0 / s[i];
        }
        return solve(z, sinv);
    }

    /**
     * Solves with the {@code nmask} smallest singular values masked.
     */
    public double[] solveWithMask(double[] z, int nmask) {
        checkRhs(z);
        decompose();
        if (nmask < 0 || nmask >= s.length) {
            throw new IllegalArgumentException("nmask must be in [0, " + s.length + "): " + nmask);
        }
        double[] sinv = new double[s.length];
        for (int i = 0; i < s.length; i++) {
            sinv[i] = (s.length - 1 - i < nmask || s[i] == 0.0) ? 0.0 : 1.0 / s[i];
        }
        return solve(z, sinv);
    }

    // a = V * diag(sinv) * U^T * z
    private double[] solve(double[] z, double[] sinv) {
        RealVector b = u.transpose().operate(new ArrayRealVector(z, false));
        RealVector a = v.operate(MatrixUtils.createRealDiagonalMatrix(sinv).operate(b));
        return a.toArray();
    }

    public double[] findGoodSolution(double[] z) {
        return findGoodSolution(z, DEFAULT_THRESHOLD);
    }

    /**
     * Examines truncation thresholds from 1e-11 to 1e-4 and returns the solution with the
     * smallest mean fractional deviation from {@code z}.
     *
     * @throws SingularFitException if even the best solution deviates by 100% or more
     */
    public double[] findGoodSolution(double[] z, double threshold) {
        if (threshold < 0.0) throw new IllegalArgumentException("threshold must be 0 or positive");
        double bestScore = 1e30;
        double bestEps = 0.0;
        double[] best = null;
        for (int e = -11; e < -3; e++) {
            double eps = Math.pow(10.0, e);
            double[] ans = solveWithEps(z, eps);
            double score = score(ans, z);
            LOG.trace("eps=1e{}, score={}", e, score);
            if (best == null || score < bestScore) {
                best = ans;
                bestScore = score;
                bestEps = eps;
            }
        }
        if (!(bestScore < 1.0)) {
            throw new SingularFitException("No good solution is found (score " + bestScore + ")");
        } else if (threshold < bestScore) {
            LOG.debug("Score is higher than given threshold (threshold {}, score {})", threshold, bestScore);
        }
        LOG.trace("best eps: {} (score {})", bestEps, bestScore);
        return best;
    }

    /**
     * Mean fractional residual of the fit, raw residual where the data is zero.
     */
    double score(double[] coeff, double[] z) {
        double[] fit = design.operate(coeff);
        double sum = 0.0;
        for (int k = 0; k < numData; k++) {
            sum += z[k] != 0.0 ? Math.abs((fit[k] - z[k]) / z[k]) : Math.abs(fit[k]);
        }
        return sum / numData;
    }

    public double evaluate(double[] coeff, double x, double y) {
        return evaluate(xorder, yorder, coeff, x, y);
    }

    public static double evaluate(int xorder, int yorder, double[] coeff, double x, double y) {
        double poly = 0.0;
        double yk = 1.0;
        int idx = 0;
        for (int i = 0; i <= yorder; i++) {
            double xjyk = yk;
            for (int j = 0; j <= xorder; j++) {
                poly += xjyk * coeff[idx++];
                xjyk *= x;
            }
            yk *= y;
        }
        return poly;
    }

    private void checkRhs(double[] z) {
        if (z.length != numData) {
            throw new IllegalArgumentException("RHS length " + z.length + " does not match data points " + numData);
        }
    }
}
