package sdline.it.validation.clustering;

import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sdline.it.model.ClusterInfo;
import sdline.it.model.ClusteringAlgorithm;
import sdline.it.model.ClusteringResult;
import sdline.it.model.LineCluster;
import sdline.it.model.RegionEntry;
import smile.clustering.KMeans;
import smile.math.MathEx;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * K-means clustering with a search over the number of clusters. Every candidate count is
 * tried with several restarts and rated by {@link #score}; the lowest score wins.
 */
public class KMeansLineClustering implements LineClustering {
    private static final Logger LOG = LoggerFactory.getLogger(KMeansLineClustering.class);

    static final long SEED = 1234L;
    static final int MAX_ITER = 50;
    static final double TOLERANCE = 1.0E-4;
    static final int MAX_RESTARTS = 10;
    static final int PATIENCE = 10;

    private final int maxCluster;
    private final double nsigma;
    private final EuclideanDistance metric = new EuclideanDistance();
    private final StandardDeviation std = new StandardDeviation(false);
    private final Median median = new Median();

    public KMeansLineClustering(int maxCluster, double nsigma) {
        this.maxCluster = maxCluster;
        this.nsigma = nsigma;
    }

    @Override
    public ClusteringResult cluster(double[][] points, List<RegionEntry> regions, ClusterInfo info) {
        int n = points.length;
        double[] widths = new double[n];
        for (int i = 0; i < n; i++) widths[i] = points[i][0];
        double medianWidth = median.evaluate(widths);
        LOG.trace("MedianWidth = {}", medianWidth);
        LOG.info("Maximum number of clusters (MaxCluster) = {}", maxCluster);

        List<Integer> listNcluster = new ArrayList<>();
        List<Double> listScore = new ArrayList<>();
        Trial best = null;
        double bestOfCounts = Double.POSITIVE_INFINITY;
        int sinceImprovement = 0;
        boolean converged = false;

        int upper = Math.min(maxCluster, distinctCount(points));
        for (int ncluster = 1; ncluster <= upper; ncluster++) {
            MathEx.setSeed(SEED);
            double bestOfThisCount = Double.POSITIVE_INFINITY;
            int restarts = Math.min(ncluster + 1, MAX_RESTARTS);
            for (int multi = 0; multi < restarts; multi++) {
                double[][] codebook = codebook(points, ncluster);
                if (codebook == null) continue;
                Trial trial = quantize(points, codebook, medianWidth);
                listNcluster.add(ncluster);
                listScore.add(trial.score);
                LOG.debug("NclusterNew = {}, Score = {}", trial.ncluster, trial.score);
                bestOfThisCount = Math.min(bestOfThisCount, trial.score);
                if (best == null || trial.score < best.score) best = trial;
            }
            if (bestOfThisCount == Double.POSITIVE_INFINITY) continue;
            LOG.debug("Ncluster = {}, BestScore = {}", ncluster, bestOfThisCount);

            if (bestOfThisCount < bestOfCounts) {
                bestOfCounts = bestOfThisCount;
                sinceImprovement = 0;
            } else if (++sinceImprovement >= PATIENCE) {
                converged = true;
                break;
            }
        }

        if (best == null) {
            LOG.warn("K-means produced no clustering for {} points", n);
            return new ClusteringResult(ClusteringAlgorithm.KMEAN, 0, new ArrayList<>(), emptyCategory(n), regions);
        }
        if (converged) {
            LOG.info("Determined the Number of Clusters to be {}", best.ncluster);
        } else {
            LOG.warn("Clustering analysis not converged. Number of clusters may be greater than upper limit (MaxCluster={})",
                    maxCluster);
        }

        for (int i = 0; i < regions.size(); i++) regions.get(i).valid = best.flags[i];
        info.mergeClustering(ClusteringAlgorithm.KMEAN, listNcluster, listScore, points, best.lines, RegionEntry.WHITEN);
        LOG.info("Final: Ncluster = {}, Score = {}, lines = {}", best.ncluster, best.score, best.lines);
        return new ClusteringResult(ClusteringAlgorithm.KMEAN, best.ncluster, best.lines, best.category, regions);
    }

    /**
     * Codebook of one k-means restart, or null when the run could not be fitted.
     */
    private static double[][] codebook(double[][] points, int k) {
        if (k == 1) {
            double[] mean = new double[points[0].length];
            for (double[] p : points) {
                for (int j = 0; j < mean.length; j++) mean[j] += p[j] / points.length;
            }
            return new double[][]{mean};
        }
        try {
            return KMeans.fit(points, k, MAX_ITER, TOLERANCE).centroids;
        } catch (IllegalArgumentException e) {
            LOG.debug("k-means with k={} failed: {}", k, e.getMessage());
            return null;
        }
    }

    /**
     * Vector-quantises the points against {@code codebook}, dropping codewords that attract no
     * point until every codeword is used, then clips and rates the clusters.
     */
    Trial quantize(double[][] points, double[][] codebook, double medianWidth) {
        int n = points.length;
        int[] category = new int[n];
        double[] distance = new double[n];
        int nclusterNew = -1;
        while (nclusterNew != codebook.length) {
            nclusterNew = codebook.length;
            for (int i = 0; i < n; i++) {
                int nearest = 0;
                double d = metric.compute(points[i], codebook[0]);
                for (int c = 1; c < codebook.length; c++) {
                    double dc = metric.compute(points[i], codebook[c]);
                    if (dc < d) {
                        d = dc;
                        nearest = c;
                    }
                }
                category[i] = nearest;
                distance[i] = d;
            }
            boolean[] used = new boolean[codebook.length];
            for (int c : category) used[c] = true;
            List<double[]> kept = new ArrayList<>();
            for (int c = 0; c < codebook.length; c++) if (used[c]) kept.add(codebook[c]);
            codebook = kept.toArray(new double[0][]);
        }

        boolean[] flags = new boolean[n];
        Arrays.fill(flags, true);
        double outlier = 0.0;
        List<LineCluster> lines = new ArrayList<>();
        for (int nc = 0; nc < nclusterNew; nc++) {
            List<Integer> members = new ArrayList<>();
            for (int i = 0; i < n; i++) if (category[i] == nc) members.add(i);
            double[] values = new double[members.size()];
            for (int m = 0; m < values.length; m++) values[m] = distance[members.get(m)];
            double threshold = StatUtils.mean(values) + std.evaluate(values) * nsigma;
            LOG.trace("Cluster Clipping Threshold = {}", threshold);

            double maxDistance = 0.0;
            List<Integer> survivors = new ArrayList<>();
            for (int i : members) {
                if (distance[i] > threshold) {
                    flags[i] = false;
                    outlier += 1.0;
                } else {
                    survivors.add(i);
                    if (distance[i] < threshold) maxDistance = Math.max(maxDistance, distance[i]);
                }
            }
            double[] widths = new double[survivors.size()];
            double[] centers = new double[survivors.size()];
            for (int m = 0; m < widths.length; m++) {
                widths[m] = points[survivors.get(m)][0];
                centers[m] = points[survivors.get(m)][1];
            }
            lines.add(new LineCluster(median.evaluate(centers), median.evaluate(widths), true, maxDistance));
        }

        double memberRate = (n - outlier) / n;
        double meanDistance = 0.0;
        for (int i = 0; i < n; i++) if (flags[i]) meanDistance += distance[i];
        meanDistance /= n;
        double score = score(meanDistance, medianWidth, nclusterNew, memberRate);
        return new Trial(nclusterNew, score, lines, category, flags);
    }

    static double score(double meanDistance, double medianWidth, int ncluster, double memberRate) {
        return Math.sqrt(meanDistance * meanDistance + (medianWidth / 2.0) * (medianWidth / 2.0))
                * (ncluster + 1.0 / ncluster)
                * ((1.0 - memberRate) * 100.0 + 1.0);
    }

    private static int distinctCount(double[][] points) {
        Set<List<Double>> distinct = new HashSet<>();
        for (double[] p : points) distinct.add(Arrays.asList(p[0], p[1]));
        return distinct.size();
    }

    private static int[] emptyCategory(int n) {
        int[] category = new int[n];
        Arrays.fill(category, ClusteringResult.NO_CLUSTER);
        return category;
    }

    static class Trial {
        final int ncluster;
        final double score;
        final List<LineCluster> lines;
        final int[] category;
        final boolean[] flags;

        Trial(int ncluster, double score, List<LineCluster> lines, int[] category, boolean[] flags) {
            this.ncluster = ncluster;
            this.score = score;
            this.lines = lines;
            this.category = category;
            this.flags = flags;
        }
    }
}
