package sdline.it.validation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import sdline.it.model.Candidate;
import sdline.it.model.ChannelRange;
import sdline.it.model.ClusterInfo;
import sdline.it.model.ClusteringAlgorithm;
import sdline.it.model.ClusteringResult;
import sdline.it.model.LineCluster;
import sdline.it.model.LineRange;
import sdline.it.model.RegionEntry;
import sdline.it.model.Sample;
import sdline.it.model.ValidationConfig;
import sdline.it.validation.grid.GridGeometry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ClusterValidatorTest {

    private static final int NCHAN = 1024;
    private static final int SIDE = 7;
    private static final double SPACING = 0.0025;

    private ValidationConfig config;
    private List<Sample> samples;
    private List<Candidate> candidates;
    private GridGeometry geometry;

    @BeforeEach
    public void setUp() {
        config = new ValidationConfig();
        config.xorder = 1;
        config.yorder = 1;
        samples = new ArrayList<>();
        candidates = new ArrayList<>();
        int row = 0;
        for (int i = 0; i < SIDE; i++) {
            for (int j = 0; j < SIDE; j++) {
                double ra = 10.0 + i * SPACING;
                double dec = j * SPACING;
                samples.add(new Sample(row++, ra, dec));
                candidates.add(new Candidate(ra, dec, new ArrayList<>(Collections.singletonList(new LineRange(100, 110)))));
            }
        }
        geometry = GridGeometry.fromSamples(samples, SPACING, SPACING);
    }

    private ClusterValidator validator() {
        return new ClusterValidator(config, NCHAN, geometry, samples);
    }

    @Test
    public void testOneSamplePerCell() {
        assertEquals(SIDE, geometry.nra);
        assertEquals(SIDE, geometry.ndec);
        int[][] member = validator().gridMember(candidates);
        for (int[] column : member) {
            for (int m : column) assertEquals(1, m);
        }
    }

    @Test
    public void testBinningVariation() {
        assertEquals(4, validator().binningVariation());
    }

    @Test
    public void testValidationNormalisesByCellPopulation() {
        GridClusterTensor detected = new GridClusterTensor(1, 1, 3);
        detected.set(0, 0, 0, 2.0);
        detected.set(0, 0, 1, 1.0);
        detected.set(0, 0, 2, 3.0);
        int[][] gridMember = {{4, 1, 0}};
        List<LineCluster> lines = new ArrayList<>();
        lines.add(new LineCluster(105.0, 10.0, true, 0.0));

        GridClusterTensor validated = validator().validate(detected, gridMember, lines);

        assertEquals(0.5, validated.get(0, 0, 0), 1e-12);
        assertEquals(1.0, validated.get(0, 0, 1), 1e-12);
        assertEquals(0.0, validated.get(0, 0, 2), 1e-12);
        assertEquals(2.0, detected.get(0, 0, 0), 1e-12);
        assertTrue(lines.get(0).isValid());
    }

    @Test
    public void testValidationInvalidatesSparseCluster() {
        GridClusterTensor detected = new GridClusterTensor(1, 2, 2);
        detected.set(0, 0, 0, 1.0);
        int[][] gridMember = {{10, 10}, {10, 10}};
        List<LineCluster> lines = new ArrayList<>();
        lines.add(new LineCluster(105.0, 10.0, true, 0.0));

        validator().validate(detected, gridMember, lines);
        assertFalse(lines.get(0).isValid());
    }

    @Test
    public void testSmoothingOfUniformPlaneDoublesIt() {
        GridClusterTensor validated = new GridClusterTensor(1, 4, 4);
        for (int x = 0; x < 4; x++) {
            for (int y = 0; y < 4; y++) validated.set(0, x, y, 1.0);
        }
        List<LineCluster> lines = new ArrayList<>();
        lines.add(new LineCluster(105.0, 10.0, true, 0.0));

        GridClusterTensor smoothed = validator().smooth(validated, lines);
        for (int x = 0; x < 4; x++) {
            for (int y = 0; y < 4; y++) assertEquals(2.0, smoothed.get(0, x, y), 1e-12);
        }
        assertTrue(lines.get(0).isValid());
    }

    @Test
    public void testSmoothingSkipsInvalidCluster() {
        GridClusterTensor validated = new GridClusterTensor(1, 3, 3);
        validated.set(0, 1, 1, 1.0);
        List<LineCluster> lines = new ArrayList<>();
        LineCluster line = new LineCluster(105.0, 10.0, true, 0.0);
        line.invalidate();
        lines.add(line);

        GridClusterTensor smoothed = validator().smooth(validated, lines);
        assertEquals(1.0, smoothed.get(0, 1, 1), 1e-12);
        assertEquals(0.0, smoothed.get(0, 0, 0), 1e-12);
        assertFalse(lines.get(0).isValid());
    }

    @Test
    public void testAutoOrderCountsLongestRun() {
        boolean[][] plane = new boolean[5][5];
        plane[1][2] = true;
        plane[2][2] = true;
        plane[3][2] = true;
        assertEquals(2, ClusterValidator.autoOrder(plane, true));
        assertEquals(0, ClusterValidator.autoOrder(plane, false));

        boolean[][] full = new boolean[9][9];
        for (boolean[] column : full) Arrays.fill(column, true);
        assertEquals(5, ClusterValidator.autoOrder(full, true));
    }

    @Test
    public void testProtectMaskForNarrowLine() {
        ChannelRange mask = ClusterValidator.calcProtectMask(100.0, 10.0, NCHAN, 5, 341);
        assertEquals(87, mask.start);
        assertEquals(112, mask.end);
    }

    @Test
    public void testProtectMaskClippedToBand() {
        ChannelRange low = ClusterValidator.calcProtectMask(2.0, 10.0, NCHAN, 5, 341);
        assertEquals(0, low.start);
        ChannelRange high = ClusterValidator.calcProtectMask(1020.0, 10.0, NCHAN, 5, 341);
        assertEquals(NCHAN - 1, high.end);
    }

    @Test
    public void testProtectMaskWithoutUsableWidthRange() {
        ChannelRange mask = ClusterValidator.calcProtectMask(50.0, 10.0, NCHAN, 5, 5);
        assertEquals(45, mask.start);
        assertEquals(55, mask.end);
    }

    @Test
    public void testUniformLineIsProtectedEverywhere() {
        List<RegionEntry> regions = new ArrayList<>();
        for (Sample s : samples) regions.add(new RegionEntry(s.row, 100, 110, s.ra, s.dec, true, 1));
        int[] category = new int[regions.size()];
        List<LineCluster> lines = new ArrayList<>();
        lines.add(new LineCluster(105.0, 10.0, true, 0.0));
        // second cluster has no member at all
        lines.add(new LineCluster(600.0, 20.0, true, 0.0));
        ClusteringResult clustering = new ClusteringResult(ClusteringAlgorithm.KMEAN, 2, lines, category, regions);
        ClusterInfo info = new ClusterInfo();

        ClusterValidation validation = validator().validateClusters(clustering, candidates, info);

        assertEquals(2, validation.lines.size());
        assertTrue(validation.lines.get(0).isValid());
        assertFalse(validation.lines.get(1).isValid());
        assertFalse(validation.channelmapRange.get(1).isValid());
        assertEquals(10.0, validation.channelmapRange.get(0).width, 1e-6);

        assertEquals(samples.size(), validation.realSignal.rows().size());
        for (Sample s : samples) {
            List<ChannelRange> ranges = validation.realSignal.ranges(s.row);
            assertFalse(ranges.isEmpty());
            for (ChannelRange r : ranges) {
                assertEquals(92, r.start);
                assertEquals(117, r.end);
            }
        }

        assertEquals(2, validation.flags.ncluster());
        // one detection, three validation, three smoothing and four final thresholds passed
        assertEquals(4331, validation.flags.get(0, 3, 3));
        assertEquals(0, validation.flags.get(1, 3, 3));
        assertTrue(info.stageThresholds.containsKey("detection"));
        assertTrue(info.stageThresholds.containsKey("final"));
        // input lines are not touched
        assertTrue(lines.get(1).isValid());
    }

    @Test
    public void testInvalidatedClusterStaysInvalid() {
        GridClusterTensor detected = new GridClusterTensor(1, 2, 2);
        detected.set(0, 0, 0, 1.0);
        int[][] gridMember = {{10, 10}, {10, 10}};
        List<LineCluster> lines = new ArrayList<>();
        lines.add(new LineCluster(105.0, 10.0, true, 0.0));
        ClusterValidator validator = validator();

        GridClusterTensor validated = validator.validate(detected, gridMember, lines);
        assertFalse(lines.get(0).isValid());

        // a later stage seeing a strong cell must not bring the cluster back
        validated.set(0, 0, 0, 5.0);
        GridClusterTensor smoothed = validator.smooth(validated, lines);
        assertFalse(lines.get(0).isValid());
        assertEquals(5.0, smoothed.get(0, 0, 0), 1e-12);
        assertEquals(0.0, smoothed.get(0, 1, 1), 1e-12);

        ClusterValidator.FinalOutcome outcome = validator.finalStage(smoothed, gridMember,
                new ArrayList<>(), new int[0], lines);
        assertFalse(lines.get(0).isValid());
        assertFalse(outcome.channelmapRange.get(0).isValid());
        assertTrue(outcome.realSignal.rows().isEmpty());
    }
}
