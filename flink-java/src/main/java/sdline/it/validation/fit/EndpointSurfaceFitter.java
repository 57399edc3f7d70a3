package sdline.it.validation.fit;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Fits line range endpoints over the sky plane with iterative n-sigma clipping. A failing
 * solve is retried at a lower polynomial order down to (0, 0).
 */
public class EndpointSurfaceFitter {
    private static final Logger LOG = LoggerFactory.getLogger(EndpointSurfaceFitter.class);

    static final int MAX_CLIP_ITERATIONS = 3;

    private final double nsigma;
    private final StandardDeviation std = new StandardDeviation(false);

    public EndpointSurfaceFitter(double nsigma) {
        this.nsigma = nsigma;
    }

    /**
     * Clipping fit over {@code points}; effective flags of the points are updated in place.
     */
    public SurfaceFit fit(List<FitPoint> points, int xorder, int yorder) {
        if (points.isEmpty()) return SurfaceFit.singular();
        for (FitPoint p : points) p.effective = true;

        SurfaceFit fit = SurfaceFit.singular();
        int xo = xorder;
        int yo = yorder;
        int flaggedFirst = -1;
        for (int iteration = 0; iteration < MAX_CLIP_ITERATIONS; iteration++) {
            List<FitPoint> effective = new ArrayList<>();
            for (FitPoint p : points) if (p.effective) effective.add(p);

            fit = fitWithOrderReduction(effective, xo, yo);
            if (fit.isSingular()) return fit;
            xo = fit.xorder;
            yo = fit.yorder;

            double[] diff = new double[points.size()];
            for (int i = 0; i < points.size(); i++) {
                FitPoint p = points.get(i);
                double d0 = fit.upperAt(p.x, p.y) - p.upper;
                double d1 = fit.lowerAt(p.x, p.y) - p.lower;
                diff[i] = Math.sqrt(d0 * d0 + d1 * d1);
            }
            double threshold = clipThreshold(points, diff, effective.size());
            LOG.trace("2D Fit Threshold = {}", threshold);

            int flagged = 0;
            for (int i = 0; i < points.size(); i++) {
                boolean keep = diff[i] <= threshold;
                points.get(i).effective = keep;
                if (!keep) flagged++;
            }
            int number = points.size();
            LOG.trace("2D Fit Flagged/All = ({}, {})", flagged, number);
            if (number - flagged <= Math.max(xo, yo) || number == flagged) {
                return SurfaceFit.singular();
            }
            if (flagged == 0) break;
            if (iteration == 0) {
                flaggedFirst = flagged;
            } else if (flaggedFirst == flagged) {
                break;
            }
        }
        return fit;
    }

    private double clipThreshold(List<FitPoint> points, double[] diff, int numEffective) {
        double[] effective = new double[numEffective];
        int k = 0;
        for (int i = 0; i < diff.length; i++) if (points.get(i).effective) effective[k++] = diff[i];
        if (numEffective > 1) {
            return StatUtils.mean(effective) + std.evaluate(effective) * nsigma;
        }
        return numEffective == 1 ? effective[0] * 2.0 : 0.0;
    }

    /**
     * Tries order (xorder, yorder) and on failure the next lower order on both axes.
     */
    public static SurfaceFit fitWithOrderReduction(List<FitPoint> points, int xorder, int yorder) {
        LOG.trace("2D Fit Order: xorder={} yorder={}", xorder, yorder);
        int n = points.size();
        double[] x = new double[n];
        double[] y = new double[n];
        double[] upper = new double[n];
        double[] lower = new double[n];
        for (int i = 0; i < n; i++) {
            FitPoint p = points.get(i);
            x[i] = p.x;
            y[i] = p.y;
            upper[i] = p.upper;
            lower[i] = p.lower;
        }
        try {
            SVDSolver2D solver = new SVDSolver2D(xorder, yorder);
            solver.setDataPoints(x, y);
            double[] a0 = solver.findGoodSolution(upper);
            double[] a1 = solver.findGoodSolution(lower);
            return SurfaceFit.of(xorder, yorder, a0, a1);
        } catch (SingularFitException | IllegalArgumentException e) {
            LOG.trace("2D fit failed at order ({}, {})", xorder, yorder, e);
            if (xorder == 0 && yorder == 0) {
                return SurfaceFit.singular();
            }
            int xo = Math.max(xorder - 1, 0);
            int yo = Math.max(yorder - 1, 0);
            LOG.info("Fit failed. Trying lower order ({}, {})", xo, yo);
            return fitWithOrderReduction(points, xo, yo);
        }
    }
}
