package sdline.it.model;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ChannelRangeTest {

    @Test
    public void testNoLineMaskIsFreshEachCall() {
        List<ChannelRange> first = ChannelRange.noLineMask();
        first.get(0).end = 40;
        first.add(new ChannelRange(10, 20));

        List<ChannelRange> second = ChannelRange.noLineMask();
        assertEquals(Collections.singletonList(new ChannelRange(-1, -1)), second);
        assertNotSame(first.get(0), second.get(0));
    }
}
