package sdline.it.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to validate the detections of one reduction group member.
 */
public class ValidationRequest {
    public int groupId;
    public int memberId;
    public int iteration;
    public int nchan;
    public ObservingPattern pattern;
    public List<Sample> samples;
    public Map<Integer, Candidate> candidates;

    public ValidationRequest(int groupId, int memberId, int iteration, int nchan, ObservingPattern pattern,
                             List<Sample> samples, Map<Integer, Candidate> candidates) {
        this.groupId = groupId;
        this.memberId = memberId;
        this.iteration = iteration;
        this.nchan = nchan;
        this.pattern = pattern;
        this.samples = samples;
        this.candidates = candidates;
    }

    public static ValidationRequest empty() {
        return new ValidationRequest(-1, -1, -1, 0, null, new ArrayList<>(), new LinkedHashMap<>());
    }

    public boolean isEmpty() {
        return pattern == null;
    }

    @Override
    public String toString() {
        return String.format("ValidationRequest{group=%d, member=%d, iteration=%d, nchan=%d, pattern=%s, samples=%d, candidates=%d}",
                groupId, memberId, iteration, nchan, pattern, samples.size(), candidates.size());
    }
}
