package sdline.it.csvUtils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.flink.api.common.functions.MapFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sdline.it.model.ClusterInfo;
import sdline.it.model.LineCluster;
import sdline.it.model.ValidationResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One JSON line per validation result.
 */
public class ExtractResultFields implements MapFunction<ValidationResult, String> {
    private static final Logger LOG = LoggerFactory.getLogger(ExtractResultFields.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    @Override
    public String map(ValidationResult row) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("group_id", row.groupId);
        json.put("member_id", row.memberId);
        json.put("iteration", row.iteration);
        json.put("lines", toLists(row.lines));
        json.put("channelmap_range", toLists(row.channelmapRange));
        json.put("valid_lines", row.validLineCount());
        json.put("cluster_info", clusterInfo(row.clusterInfo));
        try {
            return mapper.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            LOG.error("Cannot serialize result of group {} member {}: {}", row.groupId, row.memberId, e.getMessage());
            return String.format("{\"group_id\":%d,\"member_id\":%d,\"iteration\":%d,\"lines\":[]}",
                    row.groupId, row.memberId, row.iteration);
        }
    }

    private static List<List<Object>> toLists(List<LineCluster> lines) {
        List<List<Object>> out = new ArrayList<>();
        for (LineCluster l : lines) {
            List<Object> entry = new ArrayList<>();
            entry.add(l.center);
            entry.add(l.width);
            entry.add(l.isValid());
            out.add(entry);
        }
        return out;
    }

    private static Map<String, Object> clusterInfo(ClusterInfo info) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (info == null || info.isEmpty()) return out;
        if (info.grid != null) out.put("grid", info.grid);
        if (info.scoreNcluster != null) {
            List<Object> score = new ArrayList<>();
            score.add(info.scoreNcluster);
            score.add(info.scoreValue);
            out.put("cluster_score", score);
        }
        if (info.clusterProperty != null) out.put("cluster_property", toLists(info.clusterProperty));
        if (info.clusterScale != null) out.put("cluster_scale", info.clusterScale);
        for (Map.Entry<String, double[]> e : info.stageThresholds.entrySet()) {
            out.put(e.getKey() + "_threshold", e.getValue());
        }
        return out;
    }
}
