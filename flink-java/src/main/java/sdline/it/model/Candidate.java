package sdline.it.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Unvalidated line detections at one spatial position.
 */
public class Candidate {
    public double ra;
    public double dec;
    public List<LineRange> ranges;

    public Candidate(double ra, double dec, List<LineRange> ranges) {
        this.ra = ra;
        this.dec = dec;
        this.ranges = ranges;
    }

    public Candidate copy() {
        List<LineRange> copied = new ArrayList<>(ranges.size());
        for (LineRange r : ranges) copied.add(r.copy());
        return new Candidate(ra, dec, copied);
    }

    public boolean hasLines() {
        return !ranges.isEmpty() && ranges.get(0).start != -1;
    }

    @Override
    public String toString() {
        return String.format("Candidate{ra=%.6f, dec=%.6f, ranges=%s}", ra, dec, ranges);
    }
}
