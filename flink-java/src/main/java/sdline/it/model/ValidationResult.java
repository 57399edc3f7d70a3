package sdline.it.model;

import java.util.List;

public class ValidationResult {
    public int groupId;
    public int memberId;
    public int iteration;
    public List<LineCluster> lines;
    public List<LineCluster> channelmapRange;
    public ClusterInfo clusterInfo;

    public ValidationResult(int groupId, int memberId, int iteration, List<LineCluster> lines,
                            List<LineCluster> channelmapRange, ClusterInfo clusterInfo) {
        this.groupId = groupId;
        this.memberId = memberId;
        this.iteration = iteration;
        this.lines = lines;
        this.channelmapRange = channelmapRange;
        this.clusterInfo = clusterInfo;
    }

    public long validLineCount() {
        return lines.stream().filter(LineCluster::isValid).count();
    }

    @Override
    public String toString() {
        return String.format("ValidationResult{group=%d, member=%d, iteration=%d, lines=%s}",
                groupId, memberId, iteration, lines);
    }
}
