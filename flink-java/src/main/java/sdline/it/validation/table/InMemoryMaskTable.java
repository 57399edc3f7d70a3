package sdline.it.validation.table;

import sdline.it.model.ChannelRange;
import sdline.it.model.SampleMask;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

public class InMemoryMaskTable implements MaskTable {
    private final Map<Integer, SampleMask> rows = new LinkedHashMap<>();

    @Override
    public SampleMask get(int row) {
        SampleMask mask = rows.get(row);
        return mask == null ? new SampleMask() : copy(mask);
    }

    @Override
    public void put(int row, SampleMask mask) {
        rows.put(row, copy(mask));
    }

    public int size() {
        return rows.size();
    }

    private static SampleMask copy(SampleMask mask) {
        SampleMask out = new SampleMask(new ArrayList<>(), mask.noChange);
        for (ChannelRange r : mask.maskList) out.maskList.add(new ChannelRange(r.start, r.end));
        return out;
    }
}
