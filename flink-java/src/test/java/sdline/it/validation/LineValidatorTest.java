package sdline.it.validation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import sdline.it.model.Candidate;
import sdline.it.model.ChannelRange;
import sdline.it.model.LineCluster;
import sdline.it.model.LineRange;
import sdline.it.model.ObservingPattern;
import sdline.it.model.Sample;
import sdline.it.model.SampleMask;
import sdline.it.model.ValidationConfig;
import sdline.it.model.ValidationRequest;
import sdline.it.model.ValidationResult;
import sdline.it.validation.table.InMemoryMaskTable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LineValidatorTest {

    private static final int NCHAN = 1024;

    private ValidationConfig config;
    private InMemoryMaskTable table;

    @BeforeEach
    public void setUp() {
        config = new ValidationConfig();
        config.xorder = 1;
        config.yorder = 1;
        table = new InMemoryMaskTable();
    }

    private static List<LineRange> ranges(LineRange... ranges) {
        return new ArrayList<>(Arrays.asList(ranges));
    }

    /**
     * 7 x 7 raster spaced by one grid cell, every position reporting the same line.
     */
    private static ValidationRequest raster(int iteration, LineRange line) {
        List<Sample> samples = new ArrayList<>();
        Map<Integer, Candidate> candidates = new LinkedHashMap<>();
        int row = 0;
        for (int i = 0; i < 7; i++) {
            for (int j = 0; j < 7; j++) {
                double ra = 10.0 + i * 0.0025;
                double dec = j * 0.0025;
                samples.add(new Sample(row, ra, dec));
                candidates.put(row, new Candidate(ra, dec, ranges(line.copy())));
                row++;
            }
        }
        return new ValidationRequest(1, 0, iteration, NCHAN, ObservingPattern.RASTER, samples, candidates);
    }

    private static ValidationRequest pointing(int iteration, LineRange... lines) {
        List<Sample> samples = new ArrayList<>();
        Map<Integer, Candidate> candidates = new LinkedHashMap<>();
        for (int row = 0; row < 3; row++) {
            samples.add(new Sample(row, 10.0, 0.0));
            candidates.put(row, new Candidate(10.0, 0.0, ranges(lines)));
        }
        return new ValidationRequest(2, 0, iteration, NCHAN, ObservingPattern.SINGLE_POINT, samples, candidates);
    }

    @Test
    public void testNoCandidateGivesNoLineMask() {
        ValidationRequest request = pointing(0, new LineRange(-1, -1));
        request.pattern = ObservingPattern.RASTER;

        ValidationResult result = new LineValidator(config, table).validate(request);

        assertTrue(result.lines.isEmpty());
        assertEquals(3, table.size());
        for (int row = 0; row < 3; row++) {
            assertEquals(ChannelRange.noLineMask(), table.get(row).maskList);
            assertEquals(SampleMask.CHANGED, table.get(row).noChange);
        }
    }

    @Test
    public void testDegenerateRangesAreNotUsable() {
        ValidationResult result = new LineValidator(config, table).validate(pointing(0, new LineRange(50, 50)));
        assertTrue(result.lines.isEmpty());
        assertEquals(ChannelRange.noLineMask(), table.get(0).maskList);
    }

    @Test
    public void testNoCandidateKeepsManualWindowInMergeMode() {
        config.window = new ArrayList<>(Collections.singletonList(new ChannelRange(200, 220)));
        config.windowMode = "merge";
        ValidationResult result = new LineValidator(config, table).validate(pointing(0, new LineRange(-1, -1)));

        assertEquals(1, result.lines.size());
        assertEquals(210.0, result.lines.get(0).center, 1e-12);
        assertEquals(Collections.singletonList(new ChannelRange(200, 220)), table.get(1).maskList);
    }

    @Test
    public void testReplaceWindowSkipsClustering() {
        config.window = new ArrayList<>(Collections.singletonList(new ChannelRange(100, 120)));
        config.windowMode = "replace";
        ValidationRequest request = raster(0, new LineRange(500, 510));

        ValidationResult result = new LineValidator(config, table).validate(request);

        assertEquals(1, result.lines.size());
        LineCluster line = result.lines.get(0);
        assertEquals(110.0, line.center, 1e-12);
        assertEquals(20.0, line.width, 1e-12);
        assertTrue(line.isValid());
        assertTrue(result.clusterInfo.isEmpty());
        for (Sample s : request.samples) {
            assertEquals(Collections.singletonList(new ChannelRange(100, 120)), table.get(s.row).maskList);
        }
    }

    @Test
    public void testReplaceWindowIsIdempotent() {
        config.window = new ArrayList<>(Collections.singletonList(new ChannelRange(100, 120)));
        LineValidator validator = new LineValidator(config, table);
        ValidationResult first = validator.validate(raster(0, new LineRange(500, 510)));
        SampleMask stored = table.get(3);
        ValidationResult second = validator.validate(raster(1, new LineRange(500, 510)));

        assertEquals(first.lines.size(), second.lines.size());
        assertEquals(first.lines.get(0).center, second.lines.get(0).center, 0.0);
        assertEquals(stored.maskList, table.get(3).maskList);
    }

    @Test
    public void testSinglePointingAcceptsFirstPosition() {
        config.window = new ArrayList<>();
        ValidationResult result = new LineValidator(config, table)
                .validate(pointing(0, new LineRange(100, 110), new LineRange(300, 320)));

        assertTrue(result.lines.isEmpty());
        assertEquals(Arrays.asList(new ChannelRange(100, 110), new ChannelRange(300, 320)), table.get(2).maskList);
        assertEquals(SampleMask.CHANGED, table.get(2).noChange);
    }

    @Test
    public void testUnchangedMaskRecordsIteration() {
        LineValidator validator = new LineValidator(config, table);
        validator.validate(pointing(0, new LineRange(100, 110)));
        assertEquals(SampleMask.CHANGED, table.get(0).noChange);

        validator.validate(pointing(1, new LineRange(100, 110)));
        assertEquals(1, table.get(0).noChange);

        validator.validate(pointing(2, new LineRange(100, 110)));
        assertEquals(1, table.get(0).noChange);

        validator.validate(pointing(3, new LineRange(130, 140)));
        assertEquals(SampleMask.CHANGED, table.get(0).noChange);
        assertEquals(Collections.singletonList(new ChannelRange(130, 140)), table.get(0).maskList);
    }

    @Test
    public void testInvalidWindowModeRejected() {
        config.windowMode = "append";
        assertThrows(IllegalArgumentException.class, () -> new LineValidator(config, table));
    }

    @Test
    public void testInvalidWindowRejected() {
        config.window = new ArrayList<>(Collections.singletonList(new ChannelRange(120, 100)));
        assertThrows(IllegalArgumentException.class, () -> new LineValidator(config, table));
    }

    @Test
    public void testMissingPatternRejected() {
        ValidationRequest request = pointing(0, new LineRange(100, 110));
        request.pattern = null;
        assertThrows(IllegalArgumentException.class, () -> new LineValidator(config, table).validate(request));
    }

    @Test
    public void testUnknownAlgorithmGivesNoLine() {
        config.clusteringAlgorithm = "dbscan";
        ValidationRequest request = raster(0, new LineRange(100, 110));

        ValidationResult result = new LineValidator(config, table).validate(request);

        assertTrue(result.lines.isEmpty());
        assertEquals(ChannelRange.noLineMask(), table.get(10).maskList);
    }

    @Test
    public void testRasterLineIsProtectedAtEverySample() {
        config.clusteringAlgorithm = "kmean";
        ValidationRequest request = raster(0, new LineRange(100, 110));

        ValidationResult result = new LineValidator(config, table).validate(request);

        assertEquals(1, result.lines.size());
        assertTrue(result.lines.get(0).isValid());
        assertEquals(105.0, result.lines.get(0).center, 1e-9);
        assertEquals(1, result.validLineCount());
        assertNotNull(result.clusterInfo.grid);
        assertEquals(1, result.clusterInfo.clusterFlag.length);
        for (Sample s : request.samples) {
            assertEquals(Collections.singletonList(new ChannelRange(92, 117)), table.get(s.row).maskList);
        }
    }

    @Test
    public void testBothAlgorithmsReportTheirOwnLines() {
        config.clusteringAlgorithm = "both";
        config.window = new ArrayList<>(Collections.singletonList(new ChannelRange(600, 610)));
        config.windowMode = "merge";
        ValidationRequest request = raster(0, new LineRange(100, 110));

        ValidationResult result = new LineValidator(config, table).validate(request);

        // one line per algorithm plus the manual window
        assertEquals(3, result.lines.size());
        assertEquals(3, result.channelmapRange.size());
        assertEquals(2, result.clusterInfo.clusterFlag.length);
        assertEquals(Arrays.asList(new ChannelRange(92, 117), new ChannelRange(600, 610)), table.get(0).maskList);
    }

    @Test
    public void testRasterRerunMarksMasksUnchanged() {
        config.clusteringAlgorithm = "hierarchy";
        LineValidator validator = new LineValidator(config, table);
        validator.validate(raster(0, new LineRange(100, 110)));
        assertEquals(SampleMask.CHANGED, table.get(5).noChange);

        validator.validate(raster(1, new LineRange(100, 110)));
        assertEquals(1, table.get(5).noChange);
    }

    @Test
    public void testLinesFromRangesDropsDuplicates() {
        List<LineCluster> lines = LineValidator.linesFromRanges(Arrays.asList(
                new ChannelRange(10, 20), new ChannelRange(10, 20), new ChannelRange(30, 34)));
        assertEquals(2, lines.size());
        assertEquals(15.0, lines.get(0).center, 1e-12);
        assertEquals(4.0, lines.get(1).width, 1e-12);
    }

    @Test
    public void testReplacingWithValidatedLinesKeepsThem() {
        config.clusteringAlgorithm = "kmean";
        ValidationResult clustered = new LineValidator(config, table).validate(raster(0, new LineRange(100, 110)));

        List<ChannelRange> window = new ArrayList<>();
        for (LineCluster line : clustered.lines) {
            if (!line.isValid()) continue;
            window.add(new ChannelRange((int) Math.round(line.center - line.width / 2.0),
                    (int) Math.round(line.center + line.width / 2.0)));
        }
        ValidationConfig replace = new ValidationConfig();
        replace.xorder = 1;
        replace.yorder = 1;
        replace.window = window;
        replace.windowMode = "replace";
        InMemoryMaskTable replaced = new InMemoryMaskTable();
        ValidationRequest request = raster(1, new LineRange(500, 510));

        ValidationResult result = new LineValidator(replace, replaced).validate(request);

        assertEquals(clustered.lines.size(), result.lines.size());
        for (int i = 0; i < result.lines.size(); i++) {
            assertEquals(clustered.lines.get(i).center, result.lines.get(i).center, 1e-9);
            assertEquals(clustered.lines.get(i).width, result.lines.get(i).width, 1e-9);
            assertEquals(clustered.lines.get(i).isValid(), result.lines.get(i).isValid());
        }
        for (Sample s : request.samples) {
            assertEquals(Collections.singletonList(new ChannelRange(100, 110)), replaced.get(s.row).maskList);
        }
    }
}
