package sdline.it.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-sample MASKLIST / NOCHANGE record of the external data table.
 */
public class SampleMask {
    public static final int CHANGED = -1;

    public List<ChannelRange> maskList;
    // iteration since which the mask is unchanged, CHANGED otherwise
    public int noChange;

    public SampleMask() {
        this(new ArrayList<>(), CHANGED);
    }

    public SampleMask(List<ChannelRange> maskList, int noChange) {
        this.maskList = maskList;
        this.noChange = noChange;
    }

    public boolean isStable() {
        return noChange >= 0;
    }

    @Override
    public String toString() {
        return "SampleMask{maskList=" + maskList + ", noChange=" + noChange + '}';
    }
}
