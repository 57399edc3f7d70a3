package sdline.it.maps;

import org.junit.jupiter.api.Test;
import org.msgpack.core.MessageBufferPacker;
import org.msgpack.core.MessagePack;
import sdline.it.model.Candidate;
import sdline.it.model.LineRange;
import sdline.it.model.ObservingPattern;
import sdline.it.model.ValidationRequest;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class MsgpackBytesToRequestMapperTest {

    private static byte[] request() throws Exception {
        MessageBufferPacker packer = MessagePack.newDefaultBufferPacker();
        packer.packMapHeader(8);
        packer.packString("pattern").packString("RASTER");
        packer.packString("group_id").packInt(3);
        packer.packString("member_id").packInt(1);
        packer.packString("iteration").packInt(2);
        packer.packString("nchan").packInt(4096);
        packer.packString("comment").packString("ignored");

        packer.packString("samples").packArrayHeader(2);
        packer.packArrayHeader(3).packInt(0).packDouble(150.1).packDouble(2.2);
        packer.packArrayHeader(3).packInt(1).packInt(150).packDouble(2.3);

        packer.packString("candidates").packMapHeader(1);
        packer.packInt(0);
        packer.packArrayHeader(3).packDouble(150.1).packDouble(2.2);
        packer.packArrayHeader(2);
        packer.packArrayHeader(3).packInt(100).packInt(120).packInt(4);
        packer.packArrayHeader(2).packInt(300).packInt(310);
        packer.close();
        return packer.toByteArray();
    }

    @Test
    public void testDecodeRequest() throws Exception {
        ValidationRequest request = new MsgpackBytesToRequestMapper().map(request());

        assertFalse(request.isEmpty());
        assertEquals(3, request.groupId);
        assertEquals(1, request.memberId);
        assertEquals(2, request.iteration);
        assertEquals(4096, request.nchan);
        assertEquals(ObservingPattern.RASTER, request.pattern);
        assertEquals(2, request.samples.size());
        assertEquals(150.0, request.samples.get(1).ra, 0.0);

        Candidate candidate = request.candidates.get(0);
        assertEquals(150.1, candidate.ra, 0.0);
        assertEquals(Arrays.asList(new LineRange(100, 120, 4), new LineRange(300, 310, 1)), candidate.ranges);
    }

    @Test
    public void testMalformedRecordGivesEmptyRequest() {
        ValidationRequest request = new MsgpackBytesToRequestMapper().map(new byte[]{(byte) 0xc1, 0x01});
        assertTrue(request.isEmpty());
    }

    @Test
    public void testUnknownPatternGivesEmptyRequest() throws Exception {
        MessageBufferPacker packer = MessagePack.newDefaultBufferPacker();
        packer.packMapHeader(2);
        packer.packString("group_id").packInt(1);
        packer.packString("pattern").packString("SPIRAL");
        packer.close();
        assertTrue(new MsgpackBytesToRequestMapper().map(packer.toByteArray()).isEmpty());
    }

    @Test
    public void testSampleWithExtraValueGivesEmptyRequest() throws Exception {
        MessageBufferPacker packer = MessagePack.newDefaultBufferPacker();
        packer.packMapHeader(3);
        packer.packString("pattern").packString("RASTER");
        packer.packString("group_id").packInt(1);
        packer.packString("samples").packArrayHeader(1);
        packer.packArrayHeader(4).packInt(0).packDouble(150.1).packDouble(2.2).packInt(7);
        packer.close();
        assertTrue(new MsgpackBytesToRequestMapper().map(packer.toByteArray()).isEmpty());
    }

    @Test
    public void testShortSampleGivesEmptyRequest() throws Exception {
        MessageBufferPacker packer = MessagePack.newDefaultBufferPacker();
        packer.packMapHeader(3);
        packer.packString("pattern").packString("RASTER");
        packer.packString("group_id").packInt(1);
        packer.packString("samples").packArrayHeader(1);
        packer.packArrayHeader(2).packInt(0).packDouble(150.1);
        packer.close();
        assertTrue(new MsgpackBytesToRequestMapper().map(packer.toByteArray()).isEmpty());
    }

    @Test
    public void testShortLineRangeGivesEmptyRequest() throws Exception {
        MessageBufferPacker packer = MessagePack.newDefaultBufferPacker();
        packer.packMapHeader(3);
        packer.packString("pattern").packString("RASTER");
        packer.packString("group_id").packInt(1);
        packer.packString("candidates").packMapHeader(1);
        packer.packInt(0);
        packer.packArrayHeader(3).packDouble(150.1).packDouble(2.2);
        packer.packArrayHeader(1);
        packer.packArrayHeader(1).packInt(100);
        packer.close();
        assertTrue(new MsgpackBytesToRequestMapper().map(packer.toByteArray()).isEmpty());
    }
}
