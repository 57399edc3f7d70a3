package sdline.it.validation;

import sdline.it.model.LineCluster;

import java.util.List;

/**
 * Outcome of validating the clusters of one clustering algorithm.
 */
public class ClusterValidation {
    public final RealSignal realSignal;
    public final List<LineCluster> lines;
    public final List<LineCluster> channelmapRange;
    public final ClusterFlags flags;

    public ClusterValidation(RealSignal realSignal, List<LineCluster> lines, List<LineCluster> channelmapRange,
                             ClusterFlags flags) {
        this.realSignal = realSignal;
        this.lines = lines;
        this.channelmapRange = channelmapRange;
        this.flags = flags;
    }
}
