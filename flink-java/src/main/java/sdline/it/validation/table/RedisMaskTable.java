package sdline.it.validation.table;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import sdline.it.model.ChannelRange;
import sdline.it.model.SampleMask;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mask table kept in one Redis hash per reduction group: {@code masktable:<group>}, field is
 * the sample row, value a JSON object {@code {"masklist": [[s,e],...], "nochange": n}}.
 */
public class RedisMaskTable implements MaskTable {
    private static final Logger LOG = LoggerFactory.getLogger(RedisMaskTable.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    public static final String KEY_PREFIX = "masktable:";

    private final Jedis jedis;
    private final String key;

    public RedisMaskTable(Jedis jedis, int groupId) {
        this.jedis = jedis;
        this.key = KEY_PREFIX + groupId;
    }

    @Override
    public SampleMask get(int row) {
        String value = jedis.hget(key, Integer.toString(row));
        if (value == null) return new SampleMask();
        try {
            return decode(value);
        } catch (JsonProcessingException e) {
            LOG.warn("Unreadable mask for row {} in {}: {}", row, key, e.getMessage());
            return new SampleMask();
        }
    }

    @Override
    public void put(int row, SampleMask mask) {
        try {
            jedis.hset(key, Integer.toString(row), encode(mask));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode mask for row " + row, e);
        }
    }

    static String encode(SampleMask mask) throws JsonProcessingException {
        List<int[]> ranges = new ArrayList<>();
        for (ChannelRange r : mask.maskList) ranges.add(new int[]{r.start, r.end});
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("masklist", ranges);
        value.put("nochange", mask.noChange);
        return mapper.writeValueAsString(value);
    }

    static SampleMask decode(String value) throws JsonProcessingException {
        JsonNode node = mapper.readTree(value);
        List<ChannelRange> ranges = new ArrayList<>();
        for (JsonNode r : node.path("masklist")) ranges.add(new ChannelRange(r.get(0).asInt(), r.get(1).asInt()));
        return new SampleMask(ranges, node.path("nochange").asInt(SampleMask.CHANGED));
    }
}
