package sdline.it.maps;

import org.apache.flink.api.common.functions.MapFunction;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessageUnpacker;
import org.msgpack.value.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sdline.it.model.Candidate;
import sdline.it.model.LineRange;
import sdline.it.model.ObservingPattern;
import sdline.it.model.Sample;
import sdline.it.model.ValidationRequest;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes one msgpack validation request. Malformed records become an empty request.
 */
public class MsgpackBytesToRequestMapper implements MapFunction<byte[], ValidationRequest> {
    private static final Logger LOG = LoggerFactory.getLogger(MsgpackBytesToRequestMapper.class);

    @Override
    public ValidationRequest map(byte[] value) {
        try (MessageUnpacker unpacker = MessagePack.newDefaultUnpacker(value)) {
            int groupId = -1;
            int memberId = -1;
            int iteration = 0;
            int nchan = 0;
            String pattern = null;
            List<Sample> samples = new ArrayList<>();
            Map<Integer, Candidate> candidates = new LinkedHashMap<>();

            int size = unpacker.unpackMapHeader();
            for (int i = 0; i < size; i++) {
                String key = unpacker.unpackString();
                switch (key) {
                    case "group_id":
                        groupId = unpacker.unpackInt();
                        break;
                    case "member_id":
                        memberId = unpacker.unpackInt();
                        break;
                    case "iteration":
                        iteration = unpacker.unpackInt();
                        break;
                    case "nchan":
                        nchan = unpacker.unpackInt();
                        break;
                    case "pattern":
                        pattern = unpacker.unpackString();
                        break;
                    case "samples":
                        int nsample = unpacker.unpackArrayHeader();
                        for (int s = 0; s < nsample; s++) {
                            expectArity(unpacker.unpackArrayHeader(), 3, "sample");
                            samples.add(new Sample(unpacker.unpackInt(), unpackNumber(unpacker), unpackNumber(unpacker)));
                        }
                        break;
                    case "candidates":
                        int ncandidate = unpacker.unpackMapHeader();
                        for (int c = 0; c < ncandidate; c++) {
                            int id = unpacker.unpackInt();
                            candidates.put(id, unpackCandidate(unpacker));
                        }
                        break;
                    default:
                        unpacker.skipValue();
                }
            }
            return new ValidationRequest(groupId, memberId, iteration, nchan, ObservingPattern.fromName(pattern),
                    samples, candidates);
        } catch (Exception e) {
            LOG.error("Cannot decode validation request: {}", e.toString());
            return ValidationRequest.empty();
        }
    }

    private static Candidate unpackCandidate(MessageUnpacker unpacker) throws IOException {
        expectArity(unpacker.unpackArrayHeader(), 3, "candidate");
        double ra = unpackNumber(unpacker);
        double dec = unpackNumber(unpacker);
        int nrange = unpacker.unpackArrayHeader();
        List<LineRange> ranges = new ArrayList<>(nrange);
        for (int r = 0; r < nrange; r++) {
            int len = unpacker.unpackArrayHeader();
            if (len < 2) throw new IllegalArgumentException("line range needs [start, end(, binning)], got " + len + " values");
            int start = unpacker.unpackInt();
            int end = unpacker.unpackInt();
            int binning = 1;
            if (len > 2) binning = unpacker.unpackInt();
            for (int extra = 3; extra < len; extra++) unpacker.skipValue();
            ranges.add(new LineRange(start, end, binning));
        }
        return new Candidate(ra, dec, ranges);
    }

    private static void expectArity(int actual, int expected, String what) {
        if (actual != expected) {
            throw new IllegalArgumentException(what + " needs " + expected + " values, got " + actual);
        }
    }

    private static double unpackNumber(MessageUnpacker unpacker) throws IOException {
        if (unpacker.getNextFormat().getValueType() == ValueType.INTEGER) {
            return unpacker.unpackLong();
        }
        return unpacker.unpackDouble();
    }
}
