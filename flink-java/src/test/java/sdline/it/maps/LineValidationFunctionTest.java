package sdline.it.maps;

import org.apache.flink.api.common.functions.DefaultOpenContext;
import org.junit.jupiter.api.Test;
import redis.clients.jedis.exceptions.JedisConnectionException;
import sdline.it.model.Candidate;
import sdline.it.model.ChannelRange;
import sdline.it.model.LineRange;
import sdline.it.model.ObservingPattern;
import sdline.it.model.Sample;
import sdline.it.model.ValidationConfig;
import sdline.it.model.ValidationRequest;
import sdline.it.model.ValidationResult;
import sdline.it.validation.table.InMemoryMaskTable;
import sdline.it.validation.table.MaskTable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LineValidationFunctionTest {

    private static class InMemoryValidationFunction extends LineValidationFunction {
        final InMemoryMaskTable table = new InMemoryMaskTable();

        InMemoryValidationFunction(ValidationConfig config) {
            super(config, "localhost", 6379, 0);
        }

        @Override
        protected MaskTable maskTable(int groupId) {
            return table;
        }
    }

    private static ValidationRequest pointing(ObservingPattern pattern) {
        List<Sample> samples = new ArrayList<>(Collections.singletonList(new Sample(0, 10.0, 0.0)));
        Map<Integer, Candidate> candidates = new LinkedHashMap<>();
        candidates.put(0, new Candidate(10.0, 0.0, new ArrayList<>(Arrays.asList(new LineRange(100, 110)))));
        return new ValidationRequest(4, 2, 0, 1024, pattern, samples, candidates);
    }

    @Test
    public void testValidatesAgainstMaskTable() {
        InMemoryValidationFunction function = new InMemoryValidationFunction(new ValidationConfig());
        ValidationResult result = function.map(pointing(ObservingPattern.SINGLE_POINT));

        assertEquals(4, result.groupId);
        assertEquals(2, result.memberId);
        assertEquals(Collections.singletonList(new ChannelRange(100, 110)), function.table.get(0).maskList);
    }

    @Test
    public void testFailureGivesEmptyResult() {
        InMemoryValidationFunction function = new InMemoryValidationFunction(new ValidationConfig());
        ValidationResult result = function.map(pointing(null));

        assertEquals(4, result.groupId);
        assertTrue(result.lines.isEmpty());
        assertTrue(result.clusterInfo.isEmpty());
        assertEquals(0, function.table.size());
    }

    @Test
    public void testInvalidConfigRejectedAtConstruction() {
        ValidationConfig config = new ValidationConfig();
        config.windowMode = "prepend";
        assertThrows(IllegalArgumentException.class, () -> new LineValidationFunction(config, "localhost", 6379, 0));
    }

    @Test
    public void testOpenFailsWhenRedisIsUnreachable() {
        LineValidationFunction function = new LineValidationFunction(new ValidationConfig(), "localhost", 1, 2);
        assertThrows(JedisConnectionException.class, () -> function.open(DefaultOpenContext.INSTANCE));
    }
}
