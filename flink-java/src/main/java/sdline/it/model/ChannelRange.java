package sdline.it.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class ChannelRange {
    public int start;
    public int end;

    public ChannelRange() {
    }

    public ChannelRange(int start, int end) {
        this.start = start;
        this.end = end;
    }

    /**
     * Fresh {@code [[-1,-1]]} mask, the "no line" marker stored in MASKLIST.
     */
    public static List<ChannelRange> noLineMask() {
        List<ChannelRange> mask = new ArrayList<>(1);
        mask.add(new ChannelRange(-1, -1));
        return mask;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChannelRange)) return false;
        ChannelRange other = (ChannelRange) o;
        return start == other.start && end == other.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + "," + end + "]";
    }
}
