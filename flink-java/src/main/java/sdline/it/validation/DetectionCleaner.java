package sdline.it.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sdline.it.model.Candidate;
import sdline.it.model.LineRange;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Removes false detections before clustering. Spectra taken at the same sky position (the
 * time-split copies of one grid position) must agree on a line for it to be kept.
 */
public class DetectionCleaner {
    private static final Logger LOG = LoggerFactory.getLogger(DetectionCleaner.class);

    // one arcsec, degrees
    static final double POSITION_TOLERANCE = 1.0 / 3600.0;
    static final double IDENTITY_OVERLAP = 0.7;

    private final double detectionRate;

    public DetectionCleaner(double detectionRate) {
        this.detectionRate = detectionRate;
    }

    /**
     * Groups candidates by position and cleans every group holding more than two copies.
     * Returns a new map; the input candidates are not modified.
     */
    public Map<Integer, Candidate> cleanDetectSignal(Map<Integer, Candidate> candidates) {
        Map<Integer, Candidate> cleaned = new LinkedHashMap<>();
        for (Map.Entry<Integer, Candidate> e : candidates.entrySet()) cleaned.put(e.getKey(), e.getValue().copy());

        List<List<Integer>> groups = new ArrayList<>();
        List<Integer> remaining = new ArrayList<>(cleaned.keySet());
        while (!remaining.isEmpty()) {
            Integer id = remaining.remove(0);
            Candidate ref = cleaned.get(id);
            List<Integer> group = new ArrayList<>();
            group.add(id);
            for (Integer other : new ArrayList<>(remaining)) {
                Candidate c = cleaned.get(other);
                if (Math.abs(ref.ra - c.ra) < POSITION_TOLERANCE && Math.abs(ref.dec - c.dec) < POSITION_TOLERANCE) {
                    remaining.remove(other);
                    group.add(other);
                }
            }
            groups.add(group);
        }
        LOG.debug("clean_detect_signal: PosGroup = {}", groups);

        for (List<Integer> group : groups) {
            if (group.size() <= 2) continue;
            Map<Integer, List<LineRange>> data = new LinkedHashMap<>();
            for (Integer id : group) data.put(id, cleaned.get(id).ranges);
            Map<Integer, List<LineRange>> kept = cleanDetectLine(data, detectionRate);
            for (Integer id : group) cleaned.get(id).ranges = kept.get(id);
        }
        return cleaned;
    }

    /**
     * Keeps a line when an identical line (same binning, enough overlap) is found in at least
     * {@code threshold} of the spectra. Identical lines are replaced by their average in every
     * spectrum they were found in; spectra left with nothing get the {@code [-1,-1]} marker.
     */
    public Map<Integer, List<LineRange>> cleanDetectLine(Map<Integer, List<LineRange>> data, double threshold) {
        Map<Integer, List<LineRange>> work = new LinkedHashMap<>();
        Map<Integer, List<LineRange>> result = new LinkedHashMap<>();
        for (Map.Entry<Integer, List<LineRange>> e : data.entrySet()) {
            List<LineRange> copied = new ArrayList<>();
            for (LineRange r : e.getValue()) copied.add(r.copy());
            work.put(e.getKey(), copied);
            result.put(e.getKey(), new ArrayList<>());
        }
        double nsp = work.size();

        for (List<LineRange> lines : work.values()) {
            for (int i = 0; i < lines.size(); i++) {
                if (lines.get(i).start == -1) continue;
                LineRange ref = lines.get(i).copy();
                Map<Integer, LineRange> matches = new LinkedHashMap<>();
                for (Map.Entry<Integer, List<LineRange>> other : work.entrySet()) {
                    double sumStart = 0.0;
                    double sumEnd = 0.0;
                    int count = 0;
                    List<LineRange> candidates = other.getValue();
                    for (int j = 0; j < candidates.size(); j++) {
                        LineRange c = candidates.get(j);
                        if (c.binning == ref.binning && checkLineIdentity(ref, c, IDENTITY_OVERLAP)) {
                            sumStart += c.start;
                            sumEnd += c.end;
                            count++;
                            candidates.set(j, new LineRange(-1, -1, 1));
                        }
                    }
                    if (count > 0) {
                        matches.put(other.getKey(), new LineRange((int) Math.round(sumStart / count),
                                (int) Math.round(sumEnd / count), ref.binning));
                    }
                }
                if (matches.size() / nsp >= threshold) {
                    for (Map.Entry<Integer, LineRange> m : matches.entrySet()) result.get(m.getKey()).add(m.getValue());
                }
            }
        }
        for (List<LineRange> lines : result.values()) {
            if (lines.isEmpty()) lines.add(new LineRange(-1, -1, 1));
        }
        return result;
    }

    /**
     * True when the two ranges intersect and the shared channels cover at least
     * {@code overlap} of the longer range.
     */
    public static boolean checkLineIdentity(LineRange old, LineRange other, double overlap) {
        boolean intersects = (old.start <= other.start && other.start < old.end)
                || (old.start < other.end && other.end <= old.end)
                || (other.start <= old.start && old.start < other.end)
                || (other.start < old.end && old.end <= other.end);
        if (!intersects) return false;
        double shared = Math.min(old.end, other.end) - Math.max(old.start, other.start) + 1;
        double longest = Math.max(old.end - old.start + 1, other.end - other.start + 1);
        return shared / longest >= overlap;
    }
}
