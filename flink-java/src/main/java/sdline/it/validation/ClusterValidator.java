package sdline.it.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sdline.it.model.Candidate;
import sdline.it.model.ChannelRange;
import sdline.it.model.ClusterInfo;
import sdline.it.model.ClusteringResult;
import sdline.it.model.LineCluster;
import sdline.it.model.RegionEntry;
import sdline.it.model.Sample;
import sdline.it.model.ValidationConfig;
import sdline.it.validation.fit.EndpointSurfaceFitter;
import sdline.it.validation.fit.FitPoint;
import sdline.it.validation.fit.SurfaceFit;
import sdline.it.validation.grid.BlurResult;
import sdline.it.validation.grid.GridGeometry;
import sdline.it.validation.grid.GridGeometry.GridIndex;
import sdline.it.validation.grid.GridOperations;
import sdline.it.validation.grid.SubCluster;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Validates line clusters by the spatial distribution of their members and distributes the
 * surviving lines to every sample through a polynomial fit of the channel range over the sky.
 * <p>
 * The work is split in four stages, each a function from one {@link GridClusterTensor} to a
 * new one: detection, validation, smoothing and final. A cluster may be invalidated by any
 * stage and never becomes valid again.
 */
public class ClusterValidator {
    private static final Logger LOG = LoggerFactory.getLogger(ClusterValidator.class);

    static final double MIN_CHAN_BIN_SPACING = 50.0;
    static final double[] DETECTION_THRESHOLDS = {1.5, 0.5};
    static final double[] FINAL_THRESHOLDS = {1.5, 0.5, 0.5, 0.5};
    static final double CENTER_RATING = 6.0;
    static final int MAX_AUTO_ORDER = 5;

    private final ValidationConfig config;
    private final int nchan;
    private final GridGeometry geometry;
    private final List<Sample> samples;
    private final GridIndex gridIndex;
    private final EndpointSurfaceFitter fitter;

    public ClusterValidator(ValidationConfig config, int nchan, GridGeometry geometry, List<Sample> samples) {
        this.config = config;
        this.nchan = nchan;
        this.geometry = geometry;
        this.samples = samples;
        this.gridIndex = geometry.index(samples);
        this.fitter = new EndpointSurfaceFitter(config.nsigma);
    }

    /**
     * Runs the four stages over one clustering result.
     *
     * @param candidates all candidate positions, used to count spectra per cell
     */
    public ClusterValidation validateClusters(ClusteringResult clustering, Collection<Candidate> candidates, ClusterInfo info) {
        int ncluster = clustering.ncluster;
        Integer[] order = new Integer[ncluster];
        for (int i = 0; i < ncluster; i++) order[i] = i;
        Arrays.sort(order, Comparator.comparingDouble(i -> clustering.lines.get(i).center));
        List<LineCluster> lines = new ArrayList<>(ncluster);
        int[] rank = new int[ncluster];
        for (int i = 0; i < ncluster; i++) {
            LineCluster line = clustering.lines.get(order[i]).copy();
            line.width *= RegionEntry.WHITEN;
            lines.add(line);
            rank[order[i]] = i;
        }
        int[] category = new int[clustering.category.length];
        for (int i = 0; i < category.length; i++) {
            int c = clustering.category[i];
            category[i] = c < 0 || c >= ncluster ? ClusteringResult.NO_CLUSTER : rank[c];
        }
        List<RegionEntry> regions = clustering.regions;
        LOG.debug("{}", geometry);

        long start = System.currentTimeMillis();
        LOG.info("Clustering: Detection Stage Start");
        int[][] gridMember = gridMember(candidates);
        GridClusterTensor detected = detect(ncluster, category, regions);
        ClusterFlags flags = new ClusterFlags(ncluster, geometry.nra, geometry.ndec)
                .accumulate(detected, DETECTION_THRESHOLDS, ClusterFlags.DETECTION);
        info.stageThresholds.put("detection", DETECTION_THRESHOLDS.clone());
        LOG.info("Clustering: Detection Stage End: Elapsed time = {} sec", elapsed(start));

        start = System.currentTimeMillis();
        LOG.info("Clustering: Validation Stage Start");
        GridClusterTensor validated = validate(detected, gridMember, lines);
        flags = flags.accumulate(validated, stageThresholds(), ClusterFlags.VALIDATION);
        info.stageThresholds.put("validation", stageThresholds());
        LOG.info("Clustering: Validation Stage End: Elapsed time = {} sec", elapsed(start));

        start = System.currentTimeMillis();
        LOG.info("Clustering: Smoothing Stage Start");
        GridClusterTensor smoothed = smooth(validated, lines);
        flags = flags.accumulate(smoothed, stageThresholds(), ClusterFlags.SMOOTHING);
        info.stageThresholds.put("smoothing", stageThresholds());
        LOG.info("Clustering: Smoothing Stage End: Elapsed time = {} sec", elapsed(start));

        start = System.currentTimeMillis();
        LOG.info("Clustering: Final Stage Start");
        FinalOutcome outcome = finalStage(smoothed, gridMember, regions, category, lines);
        flags = flags.accumulate(outcome.tensor, FINAL_THRESHOLDS, ClusterFlags.FINAL);
        info.stageThresholds.put("final", FINAL_THRESHOLDS.clone());
        LOG.info("Clustering: Final Stage End: Elapsed time = {} sec", elapsed(start));

        return new ClusterValidation(outcome.realSignal, lines, outcome.channelmapRange, flags);
    }

    private static double elapsed(long start) {
        return (System.currentTimeMillis() - start) / 1000.0;
    }

    private double[] stageThresholds() {
        return new double[]{config.thresholdValid, config.thresholdMarginal, config.thresholdQuestionable};
    }

    int binningVariation() {
        int variation = 1 + (int) Math.ceil(Math.log(nchan / MIN_CHAN_BIN_SPACING) / Math.log(4.0));
        return Math.max(variation, 1);
    }

    /**
     * Number of candidate spectra per cell.
     */
    int[][] gridMember(Collection<Candidate> candidates) {
        int[][] member = new int[geometry.nra][geometry.ndec];
        for (Candidate c : candidates) member[geometry.raIndex(c.ra)][geometry.decIndex(c.dec)]++;
        return member;
    }

    /**
     * Detection stage: valid members of each cluster summed per cell and binning level, then
     * the maximum over binning levels. Members found at a coarser binning count one half.
     */
    GridClusterTensor detect(int ncluster, int[] category, List<RegionEntry> regions) {
        int variation = binningVariation();
        double[][][][] withBinning = new double[ncluster][variation][geometry.nra][geometry.ndec];
        for (int i = 0; i < category.length; i++) {
            RegionEntry r = regions.get(i);
            if (!r.valid || category[i] < 0) continue;
            int n = (int) (Math.log(r.binning) / Math.log(4.0) + 0.1);
            if (n < 0 || n >= variation) continue;
            double weight = n == 0 ? 1.0 : 0.5;
            withBinning[category[i]][n][geometry.raIndex(r.ra)][geometry.decIndex(r.dec)] += weight;
        }
        GridClusterTensor tensor = new GridClusterTensor(ncluster, geometry.nra, geometry.ndec);
        for (int c = 0; c < ncluster; c++) {
            for (int x = 0; x < geometry.nra; x++) {
                for (int y = 0; y < geometry.ndec; y++) {
                    double max = 0.0;
                    for (int b = 0; b < variation; b++) max = Math.max(max, withBinning[c][b][x][y]);
                    tensor.set(c, x, y, max);
                }
            }
        }
        return tensor;
    }

    /**
     * Validation stage: detection counts normalised by the number of spectra in the cell.
     * A cluster with no cell above Questionable is invalidated.
     */
    GridClusterTensor validate(GridClusterTensor detected, int[][] gridMember, List<LineCluster> lines) {
        GridClusterTensor out = detected.copy();
        for (int c = 0; c < out.ncluster(); c++) {
            for (int x = 0; x < out.nra(); x++) {
                for (int y = 0; y < out.ndec(); y++) {
                    double v = detected.get(c, x, y);
                    if (gridMember[x][y] == 0) {
                        out.set(c, x, y, 0.0);
                    } else if (gridMember[x][y] == 1 && v > 0.9) {
                        out.set(c, x, y, 1.0);
                    } else {
                        out.set(c, x, y, Math.min(v / gridMember[x][y], 1.0));
                    }
                }
            }
            if (out.countAbove(c, config.thresholdQuestionable) == 0) lines.get(c).invalidate();
        }
        return out;
    }

    /**
     * Smoothing stage over valid clusters. The kernel weighs the center 6, the axis
     * neighbours at distance d by 1/d^2 and the off-axis neighbours with |dx|+|dy| &lt;= 3 by
     * 1/(dx^2+dy^2), out to two cells; the weighted mean is doubled.
     */
    GridClusterTensor smooth(GridClusterTensor validated, List<LineCluster> lines) {
        GridClusterTensor out = validated.copy();
        int nra = validated.nra();
        int ndec = validated.ndec();
        for (int c = 0; c < validated.ncluster(); c++) {
            if (lines.get(c).isValid()) {
                for (int x = 0; x < nra; x++) {
                    for (int y = 0; y < ndec; y++) {
                        double score = CENTER_RATING * validated.get(c, x, y);
                        double weight = CENTER_RATING;
                        for (int d = -2; d <= 2; d++) {
                            if (d == 0) continue;
                            double rating = 1.0 / (d * d);
                            if (y + d >= 0 && y + d < ndec) {
                                score += rating * validated.get(c, x, y + d);
                                weight += rating;
                            }
                            if (x + d >= 0 && x + d < nra) {
                                score += rating * validated.get(c, x + d, y);
                                weight += rating;
                            }
                        }
                        for (int dx = -2; dx <= 2; dx++) {
                            if (dx == 0 || x + dx < 0 || x + dx >= nra) continue;
                            for (int dy = -2; dy <= 2; dy++) {
                                if (dy == 0 || y + dy < 0 || y + dy >= ndec) continue;
                                if (Math.abs(dx) + Math.abs(dy) > 3) continue;
                                double rating = 1.0 / (dx * dx + dy * dy);
                                score += rating * validated.get(c, x + dx, y + dy);
                                weight += rating;
                            }
                        }
                        out.set(c, x, y, score / weight * 2.0);
                    }
                }
            }
            if (out.countAbove(c, config.thresholdQuestionable) == 0) lines.get(c).invalidate();
        }
        return out;
    }

    /**
     * Final stage: fits the channel range of every valid cluster over each of its spatially
     * connected sub-clusters and converts the fit into protected channel ranges per sample.
     */
    FinalOutcome finalStage(GridClusterTensor smoothed, int[][] gridMember, List<RegionEntry> regions,
                            int[] category, List<LineCluster> lines) {
        int nra = smoothed.nra();
        int ndec = smoothed.ndec();
        int minFwhm = config.minFwhm;
        int maxFwhm = config.maxFwhm(nchan);
        RealSignal realSignal = new RealSignal();
        List<LineCluster> channelmapRange = new ArrayList<>();
        for (LineCluster line : lines) channelmapRange.add(line.copy());
        GridClusterTensor out = smoothed.copy();
        LOG.info("Ncluster={}", lines.size());

        for (int nc = 0; nc < lines.size(); nc++) {
            LineCluster line = lines.get(nc);
            if (!line.isValid()) continue;
            double[][] original = smoothed.plane(nc);
            boolean[][] plane = new boolean[nra][ndec];
            boolean any = false;
            for (int x = 0; x < nra; x++) {
                for (int y = 0; y < ndec; y++) {
                    plane[x][y] = original[x][y] > config.thresholdMarginal;
                    any |= plane[x][y];
                }
            }
            if (!any) {
                line.invalidate();
                channelmapRange.get(nc).invalidate();
                continue;
            }

            double[][] coverage = new double[nra][ndec];
            double maskMin = 10000.0;
            double maskMax = 0.0;
            List<SubCluster> subClusters = GridOperations.cleanIsolation(original, plane, gridMember, config.thresholdValid);
            for (SubCluster sub : subClusters) {
                double[][] subPlane = new double[nra][ndec];
                for (int[] cell : sub.cells) subPlane[cell[0]][cell[1]] = original[cell[0]][cell[1]];
                BlurResult blur = GridOperations.doBlur(sub.realMember, subPlane, config.blurRatio,
                        config.thresholdValid, config.thresholdMarginal);
                int xorder = config.xorder < 0 ? autoOrder(blur.validPlane, true) : config.xorder;
                int yorder = config.yorder < 0 ? autoOrder(blur.validPlane, false) : config.yorder;

                List<FitPoint> fitData = fitData(nc, category, regions, subPlane);
                if (fitData.isEmpty()) continue;
                SurfaceFit fit = fitter.fit(fitData, xorder, yorder);
                if (fit.isSingular()) {
                    LOG.debug("Skip sub-cluster {} of cluster {}: no usable fit", sub, nc);
                    continue;
                }

                for (int x = 0; x < nra; x++) {
                    for (int y = 0; y < ndec; y++) {
                        if (blur.validPlane[x][y]) {
                            for (int sampleIndex : gridIndex.get(x, y)) {
                                Sample s = samples.get(sampleIndex);
                                double chan1 = fit.upperAt(s.ra, s.dec);
                                double chan0 = fit.lowerAt(s.ra, s.dec);
                                double center = 0.5 * (chan0 + chan1);
                                double width = chan1 - chan0 + 1.0;
                                if (width < minFwhm) {
                                    LOG.trace("out of range Fit0={} Fit1={}", center, width);
                                    continue;
                                }
                                ChannelRange mask = calcProtectMask(center, width, nchan, minFwhm, maxFwhm);
                                double maskCenter = (mask.start + mask.end) / 2.0;
                                if (maskMin > maskCenter) maskMin = Math.max(0.0, maskCenter);
                                if (maskMax < maskCenter) maskMax = Math.min(nchan - 1, maskCenter);
                                realSignal.add(s.row, s.ra, s.dec, mask);
                            }
                        } else if (blur.blurPlane[x][y]) {
                            int[] nearest = nearestValidCell(blur.validPlane, x, y);
                            if (nearest == null) continue;
                            double ra1 = geometry.cellCenterRa(nearest[0]);
                            double dec1 = geometry.cellCenterDec(nearest[1]);
                            double chan1 = fit.upperAt(ra1, dec1);
                            double chan0 = fit.lowerAt(ra1, dec1);
                            double center = 0.5 * (chan0 + chan1);
                            double width = chan1 - chan0;
                            if (width < minFwhm) {
                                LOG.trace("out of range Fit0={} Fit1={}", center, width);
                                continue;
                            }
                            ChannelRange mask = calcProtectMask(center, width, nchan, minFwhm, maxFwhm);
                            for (int sampleIndex : gridIndex.get(x, y)) {
                                Sample s = samples.get(sampleIndex);
                                realSignal.add(s.row, s.ra, s.dec, new ChannelRange(mask.start, mask.end));
                            }
                        }
                    }
                }
                for (int x = 0; x < nra; x++) {
                    for (int y = 0; y < ndec; y++) if (blur.blurPlane[x][y]) coverage[x][y] += 1.0;
                }
            }

            int covered = 0;
            for (double[] column : coverage) for (double v : column) if (v > 0.5) covered++;
            if (covered == 0 || maskMax == 0.0) {
                line.invalidate();
                channelmapRange.get(nc).invalidate();
            } else {
                channelmapRange.get(nc).width = maskMax - maskMin + line.width;
                LOG.info("Nc, MaskMax, Min: {}, {}, {}", nc, maskMax, maskMin);
                LOG.info("channelmap_range[Nc]: {}", channelmapRange.get(nc));
            }
            for (int x = 0; x < nra; x++) {
                for (int y = 0; y < ndec; y++) {
                    if (original[x][y] > config.thresholdValid) {
                        coverage[x][y] = 2.0;
                    } else if (coverage[x][y] > 0.5) {
                        coverage[x][y] = 1.0;
                    }
                }
            }
            out.setPlane(nc, coverage);
        }
        return new FinalOutcome(out, realSignal, channelmapRange);
    }

    /**
     * Channel ranges of the members of cluster {@code nc} lying in valid cells of the
     * sub-plane; consecutive ranges of the same sample are combined.
     */
    private List<FitPoint> fitData(int nc, int[] category, List<RegionEntry> regions, double[][] subPlane) {
        List<FitPoint> points = new ArrayList<>();
        RegionEntry head = null;
        int lmin = 0;
        int lmax = 0;
        for (int i = 0; i < category.length; i++) {
            if (category[i] != nc) continue;
            RegionEntry r = regions.get(i);
            if (subPlane[geometry.raIndex(r.ra)][geometry.decIndex(r.dec)] <= config.thresholdValid) continue;
            if (head != null && head.sampleId == r.sampleId) {
                lmin = Math.min(lmin, r.start);
                lmax = Math.max(lmax, r.end);
                continue;
            }
            if (head != null) points.add(new FitPoint(lmin, lmax, head.ra, head.dec));
            head = r;
            lmin = r.start;
            lmax = r.end;
        }
        if (head != null) points.add(new FitPoint(lmin, lmax, head.ra, head.dec));
        LOG.trace("FitData = {}", points);
        return points;
    }

    /**
     * Largest number of valid cells on one line along RA ({@code alongRa}) or Dec, minus one,
     * bounded to [0, 5].
     */
    static int autoOrder(boolean[][] validPlane, boolean alongRa) {
        int nra = validPlane.length;
        int ndec = validPlane[0].length;
        int best = 0;
        int outer = alongRa ? ndec : nra;
        int inner = alongRa ? nra : ndec;
        for (int o = 0; o < outer; o++) {
            int count = 0;
            for (int i = 0; i < inner; i++) {
                if (alongRa ? validPlane[i][o] : validPlane[o][i]) count++;
            }
            best = Math.max(best, count);
        }
        return Math.max(Math.min(best - 1, MAX_AUTO_ORDER), 0);
    }

    private int[] nearestValidCell(boolean[][] validPlane, int x, int y) {
        double aspect = geometry.gridRa / geometry.gridDec;
        aspect *= aspect;
        double best = Double.POSITIVE_INFINITY;
        int[] nearest = null;
        for (int xx = 0; xx < validPlane.length; xx++) {
            for (int yy = 0; yy < validPlane[xx].length; yy++) {
                if (!validPlane[xx][yy]) continue;
                double d = (xx - x) * (xx - x) * aspect + (yy - y) * (yy - y);
                if (d < best) {
                    best = d;
                    nearest = new int[]{xx, yy};
                }
            }
        }
        return nearest;
    }

    /**
     * Channel range to protect for a line of the given center and width. Narrow lines get a
     * margin of roughly MinFWHM + 5 channels, lines near MaxFWHM about their own width.
     */
    public static ChannelRange calcProtectMask(double center, double width, int nchan, int minFwhm, int maxFwhm) {
        double allowance;
        if (maxFwhm > minFwhm) {
            allowance = ((maxFwhm - width) * (2.0 * minFwhm + 10.0) + (width - minFwhm) * maxFwhm)
                    / (maxFwhm - minFwhm) / 2.0;
        } else {
            allowance = width / 2.0;
        }
        int start = Math.min(Math.max((int) (center - allowance), 0), nchan - 1);
        int end = Math.min((int) (center + allowance), nchan - 1);
        LOG.trace("Allowance = {} ProtectMask = [{}, {}]", allowance, start, end);
        return new ChannelRange(start, end);
    }

    static class FinalOutcome {
        final GridClusterTensor tensor;
        final RealSignal realSignal;
        final List<LineCluster> channelmapRange;

        FinalOutcome(GridClusterTensor tensor, RealSignal realSignal, List<LineCluster> channelmapRange) {
            this.tensor = tensor;
            this.realSignal = realSignal;
            this.channelmapRange = channelmapRange;
        }
    }
}
