package sdline.it.validation;

import sdline.it.model.ChannelRange;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public final class LineMaskMerger {

    private LineMaskMerger() {
    }

    /**
     * Collapses overlapping channel ranges into a minimal covering set ordered by start channel.
     * The input list is left untouched.
     */
    public static List<ChannelRange> mergeLines(List<ChannelRange> lines) {
        List<ChannelRange> sorted = new ArrayList<>(lines);
        sorted.sort(Comparator.comparingInt((ChannelRange r) -> r.start).thenComparingInt(r -> r.end));
        List<ChannelRange> merged = new ArrayList<>();
        ChannelRange current = null;
        for (ChannelRange r : sorted) {
            if (current != null && r.start <= current.end) {
                current.end = Math.max(current.end, r.end);
            } else {
                current = new ChannelRange(r.start, r.end);
                merged.add(current);
            }
        }
        return merged;
    }
}
