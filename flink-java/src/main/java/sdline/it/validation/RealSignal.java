package sdline.it.validation;

import sdline.it.model.ChannelRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Accepted channel ranges per sample row. Ranges are only ever appended.
 */
public class RealSignal {
    private final Map<Integer, Entry> entries = new LinkedHashMap<>();

    public void add(int row, double ra, double dec, ChannelRange range) {
        entries.computeIfAbsent(row, r -> new Entry(ra, dec)).ranges.add(range);
    }

    public boolean contains(int row) {
        return entries.containsKey(row);
    }

    public List<ChannelRange> ranges(int row) {
        Entry e = entries.get(row);
        return e == null ? Collections.emptyList() : Collections.unmodifiableList(e.ranges);
    }

    public Set<Integer> rows() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Union of the ranges of both signals, row by row.
     */
    public void mergeFrom(RealSignal other) {
        for (Map.Entry<Integer, Entry> e : other.entries.entrySet()) {
            Entry mine = entries.computeIfAbsent(e.getKey(), r -> new Entry(e.getValue().ra, e.getValue().dec));
            mine.ranges.addAll(e.getValue().ranges);
        }
    }

    @Override
    public String toString() {
        return "RealSignal{rows=" + entries.size() + '}';
    }

    static class Entry {
        final double ra;
        final double dec;
        final List<ChannelRange> ranges = new ArrayList<>();

        Entry(double ra, double dec) {
            this.ra = ra;
            this.dec = dec;
        }
    }
}
