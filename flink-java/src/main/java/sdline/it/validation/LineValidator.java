package sdline.it.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sdline.it.model.Candidate;
import sdline.it.model.ChannelRange;
import sdline.it.model.ClusterInfo;
import sdline.it.model.ClusteringAlgorithm;
import sdline.it.model.ClusteringResult;
import sdline.it.model.LineCluster;
import sdline.it.model.LineRange;
import sdline.it.model.RegionEntry;
import sdline.it.model.Sample;
import sdline.it.model.SampleMask;
import sdline.it.model.ValidationConfig;
import sdline.it.model.ValidationRequest;
import sdline.it.model.ValidationResult;
import sdline.it.model.WindowMode;
import sdline.it.validation.clustering.HierarchicalLineClustering;
import sdline.it.validation.clustering.KMeansLineClustering;
import sdline.it.validation.clustering.LineClustering;
import sdline.it.validation.grid.GridGeometry;
import sdline.it.validation.table.MaskTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point of line validation for one reduction group member. Chooses between the manual
 * window, the no-line, the single/multi pointing and the raster paths, and writes the
 * resulting per-sample mask to the {@link MaskTable}.
 */
public class LineValidator {
    private static final Logger LOG = LoggerFactory.getLogger(LineValidator.class);

    private final ValidationConfig config;
    private final MaskTable maskTable;

    public LineValidator(ValidationConfig config, MaskTable maskTable) {
        config.check();
        this.config = config;
        this.maskTable = maskTable;
    }

    public ValidationResult validate(ValidationRequest request) {
        config.check();
        WindowMode windowMode = config.windowMode();
        List<ChannelRange> window = config.window;
        List<Sample> samples = samplesOf(request);
        LOG.debug("{}: window={}, windowmode={}", getClass().getSimpleName(), window, windowMode);

        if (!window.isEmpty() && windowMode == WindowMode.REPLACE) {
            LOG.info("Skip clustering analysis since predefined line window is set.");
            writeAll(samples, window);
            List<LineCluster> lines = linesFromRanges(window);
            return result(request, lines, copyOf(lines), new ClusterInfo());
        }

        List<LineCluster> manualWindow = new ArrayList<>();
        for (ChannelRange w : window) manualWindow.add(LineCluster.fromWindow(w));

        if (!hasUsableCandidate(request.candidates)) {
            return noLine(request, samples, window, manualWindow);
        }

        if (request.pattern == null) {
            throw new IllegalArgumentException("Invalid observing pattern: null");
        }
        if (!request.pattern.isRaster()) {
            return acceptAll(request, samples, manualWindow);
        }
        return validateRaster(request, samples, window, manualWindow);
    }

    /**
     * Single and multi pointing: every detection of the first position is accepted as is.
     */
    private ValidationResult acceptAll(ValidationRequest request, List<Sample> samples, List<LineCluster> manualWindow) {
        LOG.info("Accept all detected lines without clustering analysis.");
        Candidate first = request.candidates.values().iterator().next();
        List<ChannelRange> mask = new ArrayList<>();
        for (LineRange r : first.ranges) mask.add(r.toChannelRange());
        for (Sample s : samples) {
            if (request.iteration == 0) {
                maskTable.put(s.row, new SampleMask(copyRanges(mask), SampleMask.CHANGED));
            } else {
                writeIfChanged(s.row, mask, request.iteration);
            }
        }
        return result(request, manualWindow, copyOf(manualWindow), new ClusterInfo());
    }

    private ValidationResult validateRaster(ValidationRequest request, List<Sample> samples, List<ChannelRange> window,
                                            List<LineCluster> manualWindow) {
        long start = System.currentTimeMillis();
        LOG.info("2D fit the line characteristics...");
        int nchan = request.nchan;

        Map<Integer, Candidate> candidates = new DetectionCleaner(config.detectionRate)
                .cleanDetectSignal(request.candidates);
        List<RegionEntry> regions = buildRegions(candidates);
        if (regions.isEmpty()) {
            return noLine(request, samples, window, manualWindow);
        }
        double[][] points = new double[regions.size()][];
        for (int i = 0; i < points.length; i++) points[i] = regions.get(i).whitened();
        GridGeometry geometry = GridGeometry.fromSamples(samples, config.gridRa, config.gridDec);
        ClusterInfo info = new ClusterInfo();
        info.registerGrid(geometry.x0, geometry.y0, geometry.gridRa, geometry.gridDec);
        LOG.info("Clustering: Initialization End: Elapsed time = {} sec", elapsed(start));

        start = System.currentTimeMillis();
        LOG.info("Clustering Analysis Start");
        List<ClusteringResult> clusterings = cluster(points, regions, nchan, info);
        LOG.info("Clustering Analysis End: Elapsed time = {} sec", elapsed(start));
        int total = 0;
        for (ClusteringResult c : clusterings) total += c.ncluster;
        if (total == 0) {
            return noLine(request, samples, window, manualWindow);
        }

        ClusterValidator validator = new ClusterValidator(config, nchan, geometry, samples);
        RealSignal realSignal = new RealSignal();
        List<LineCluster> lines = new ArrayList<>();
        List<LineCluster> channelmapRange = new ArrayList<>();
        List<ClusterFlags> flags = new ArrayList<>();
        for (ClusteringResult clustering : clusterings) {
            ClusterValidation v = validator.validateClusters(clustering, candidates.values(), info);
            realSignal.mergeFrom(v.realSignal);
            lines.addAll(v.lines);
            channelmapRange.addAll(v.channelmapRange);
            flags.add(v.flags);
        }
        info.clusterFlag = ClusterFlags.concat(flags);

        start = System.currentTimeMillis();
        LOG.info("Clustering: Merging Start");
        for (Sample s : samples) {
            List<ChannelRange> mask;
            if (realSignal.contains(s.row)) {
                mask = LineMaskMerger.mergeLines(realSignal.ranges(s.row));
                mask.addAll(copyRanges(window));
            } else {
                mask = window.isEmpty() ? ChannelRange.noLineMask() : copyRanges(window);
            }
            writeIfChanged(s.row, mask, request.iteration);
        }
        LOG.info("Clustering: Merging End: Elapsed time = {} sec", elapsed(start));

        lines.addAll(manualWindow);
        channelmapRange.addAll(copyOf(manualWindow));
        return result(request, lines, channelmapRange, info);
    }

    /**
     * Runs the configured algorithms, each on its own copy of the region entries. An unknown
     * algorithm name yields no result.
     */
    List<ClusteringResult> cluster(double[][] points, List<RegionEntry> regions, int nchan, ClusterInfo info) {
        List<ClusteringResult> results = new ArrayList<>();
        ClusteringAlgorithm algorithm = ClusteringAlgorithm.fromName(config.clusteringAlgorithm);
        LOG.info("clustering algorithm is '{}'", config.clusteringAlgorithm);
        if (algorithm == null) {
            LOG.error("Invalid clustering algorithm: {}", config.clusteringAlgorithm);
            return results;
        }
        for (ClusteringAlgorithm a : algorithm.expand()) {
            List<RegionEntry> copy = new ArrayList<>(regions.size());
            for (RegionEntry r : regions) copy.add(r.copy());
            results.add(clustering(a, nchan).cluster(points, copy, info));
        }
        return results;
    }

    private LineClustering clustering(ClusteringAlgorithm algorithm, int nchan) {
        switch (algorithm) {
            case KMEAN:
                return new KMeansLineClustering(config.maxCluster, config.nsigma);
            case HIERARCHY:
                return new HierarchicalLineClustering(nchan, config.thresholdHierarchy, config.thresholdHierarchy2,
                        config.linkage);
            default:
                throw new IllegalArgumentException("Not a concrete clustering algorithm: " + algorithm);
        }
    }

    private ValidationResult noLine(ValidationRequest request, List<Sample> samples, List<ChannelRange> window,
                                    List<LineCluster> manualWindow) {
        List<ChannelRange> mask = window.isEmpty() ? ChannelRange.noLineMask() : window;
        writeAll(samples, mask);
        return result(request, manualWindow, copyOf(manualWindow), new ClusterInfo());
    }

    private void writeAll(List<Sample> samples, List<ChannelRange> mask) {
        for (Sample s : samples) maskTable.put(s.row, new SampleMask(copyRanges(mask), SampleMask.CHANGED));
    }

    /**
     * Writes {@code mask} unless it equals the stored one; an unchanged mask records the
     * iteration it was first seen unchanged at.
     */
    private void writeIfChanged(int row, List<ChannelRange> mask, int iteration) {
        SampleMask stored = maskTable.get(row);
        if (stored.maskList.equals(mask)) {
            if (!stored.isStable()) maskTable.put(row, new SampleMask(stored.maskList, iteration));
        } else {
            maskTable.put(row, new SampleMask(copyRanges(mask), SampleMask.CHANGED));
        }
    }

    static boolean hasUsableCandidate(Map<Integer, Candidate> candidates) {
        for (Candidate c : candidates.values()) {
            if (!c.hasLines()) continue;
            for (LineRange r : c.ranges) if (r.start != r.end) return true;
        }
        return false;
    }

    /**
     * One entry per non-degenerate line range of every position that reports lines.
     */
    static List<RegionEntry> buildRegions(Map<Integer, Candidate> candidates) {
        List<RegionEntry> regions = new ArrayList<>();
        for (Map.Entry<Integer, Candidate> e : candidates.entrySet()) {
            Candidate c = e.getValue();
            if (!c.hasLines()) continue;
            for (LineRange r : c.ranges) {
                if (r.start == r.end) continue;
                regions.add(new RegionEntry(e.getKey(), r.start, r.end, c.ra, c.dec, true, r.binning));
            }
        }
        LOG.debug("Npos = {}, Nregion = {}", candidates.size(), regions.size());
        return regions;
    }

    /**
     * {@code [start, end]} ranges as valid lines, duplicates dropped.
     */
    public static List<LineCluster> linesFromRanges(List<ChannelRange> ranges) {
        List<ChannelRange> distinct = new ArrayList<>();
        for (ChannelRange r : ranges) if (!distinct.contains(r)) distinct.add(r);
        List<LineCluster> lines = new ArrayList<>();
        for (ChannelRange r : distinct) lines.add(new LineCluster(0.5 * (r.start + r.end), r.end - r.start, true, 0.0));
        return lines;
    }

    private static List<Sample> samplesOf(ValidationRequest request) {
        if (!request.samples.isEmpty()) return request.samples;
        List<Sample> samples = new ArrayList<>();
        for (Map.Entry<Integer, Candidate> e : request.candidates.entrySet()) {
            samples.add(new Sample(e.getKey(), e.getValue().ra, e.getValue().dec));
        }
        return samples;
    }

    private static List<ChannelRange> copyRanges(List<ChannelRange> ranges) {
        List<ChannelRange> out = new ArrayList<>(ranges.size());
        for (ChannelRange r : ranges) out.add(new ChannelRange(r.start, r.end));
        return out;
    }

    private static List<LineCluster> copyOf(List<LineCluster> lines) {
        List<LineCluster> out = new ArrayList<>(lines.size());
        for (LineCluster l : lines) out.add(l.copy());
        return out;
    }

    private static double elapsed(long start) {
        return (System.currentTimeMillis() - start) / 1000.0;
    }

    private static ValidationResult result(ValidationRequest request, List<LineCluster> lines,
                                           List<LineCluster> channelmapRange, ClusterInfo info) {
        return new ValidationResult(request.groupId, request.memberId, request.iteration, lines, channelmapRange, info);
    }
}
