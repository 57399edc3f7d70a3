package sdline.it.validation.clustering;

import org.junit.jupiter.api.Test;
import sdline.it.model.ClusterInfo;
import sdline.it.model.ClusteringAlgorithm;
import sdline.it.model.ClusteringResult;
import sdline.it.model.RegionEntry;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HierarchicalLineClusteringTest {

    private static HierarchicalLineClustering clustering() {
        return new HierarchicalLineClustering(1024, 8.0, 2.5, "single");
    }

    @Test
    public void testSeparatedLinesAreSplit() {
        List<RegionEntry> regions = LineClusteringFixtures.twoLines();
        ClusterInfo info = new ClusterInfo();
        ClusteringResult result = clustering().cluster(LineClusteringFixtures.points(regions), regions, info);

        assertEquals(ClusteringAlgorithm.HIERARCHY, result.algorithm);
        assertEquals(2, result.ncluster);
        assertEquals(2, result.lines.size());
        assertEquals(102.0, result.lines.get(0).center, 3.0);
        assertEquals(402.0, result.lines.get(1).center, 3.0);
        assertEquals(0, result.category[0]);
        assertEquals(1, result.category[10]);
        assertEquals(2, info.clusterProperty.size());
    }

    @Test
    public void testFewerThanThreePointsGiveNoCluster() {
        List<RegionEntry> regions = new ArrayList<>();
        regions.add(new RegionEntry(0, 10, 20, 0.0, 0.0, true, 1));
        regions.add(new RegionEntry(1, 11, 21, 0.0, 0.0, true, 1));
        ClusteringResult result = clustering().cluster(LineClusteringFixtures.points(regions), regions, new ClusterInfo());

        assertEquals(0, result.ncluster);
        assertTrue(result.lines.isEmpty());
        for (int c : result.category) assertEquals(ClusteringResult.NO_CLUSTER, c);
        for (RegionEntry r : regions) assertFalse(r.valid);
    }

    @Test
    public void testCutLabelsStartAtOne() {
        double[][] data = {
                {10, 100}, {10, 101}, {10, 400}, {10, 401}
        };
        int[] labels = clustering().cut(data, 5.0);
        assertArrayEquals(new int[]{1, 1, 2, 2}, labels);

        int[] merged = clustering().cut(data, 1000.0);
        assertArrayEquals(new int[]{1, 1, 1, 1}, merged);
    }

    @Test
    public void testUnknownLinkageFallsBackToWard() {
        List<RegionEntry> regions = LineClusteringFixtures.twoLines();
        ClusteringResult result = new HierarchicalLineClustering(1024, 8.0, 2.5, "bogus")
                .cluster(LineClusteringFixtures.points(regions), regions, new ClusterInfo());
        assertEquals(result.ncluster, result.lines.size());
    }
}
