package sdline.it.model;

import java.util.Objects;

/**
 * Channel range of a line candidate as reported by the line finder, together with
 * the spectral binning the detection was made at.
 */
public class LineRange {
    public int start;
    public int end;
    public int binning;

    public LineRange(int start, int end, int binning) {
        this.start = start;
        this.end = end;
        this.binning = binning;
    }

    public LineRange(int start, int end) {
        this(start, end, 1);
    }

    public LineRange copy() {
        return new LineRange(start, end, binning);
    }

    public ChannelRange toChannelRange() {
        return new ChannelRange(start, end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LineRange)) return false;
        LineRange other = (LineRange) o;
        return start == other.start && end == other.end && binning == other.binning;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, binning);
    }

    @Override
    public String toString() {
        return String.format("[%d,%d,%d]", start, end, binning);
    }
}
