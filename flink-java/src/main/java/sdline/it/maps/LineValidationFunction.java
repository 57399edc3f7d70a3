package sdline.it.maps;

import org.apache.flink.api.common.functions.OpenContext;
import org.apache.flink.api.common.functions.RichMapFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import sdline.it.model.ClusterInfo;
import sdline.it.model.ValidationConfig;
import sdline.it.model.ValidationRequest;
import sdline.it.model.ValidationResult;
import sdline.it.validation.LineValidator;
import sdline.it.validation.table.MaskTable;
import sdline.it.validation.table.RedisMaskTable;

import java.util.ArrayList;

/**
 * Validates each request against the Redis-backed mask table of its reduction group.
 */
public class LineValidationFunction extends RichMapFunction<ValidationRequest, ValidationResult> {
    private static final Logger LOG = LoggerFactory.getLogger(LineValidationFunction.class);

    private final ValidationConfig config;
    private final String redisHost;
    private final int redisPort;
    private final int redisDb;

    private transient Jedis jedis;

    public LineValidationFunction(ValidationConfig config, String redisHost, int redisPort, int redisDb) {
        config.check();
        this.config = config;
        this.redisHost = redisHost;
        this.redisPort = redisPort;
        this.redisDb = redisDb;
    }

    @Override
    public void open(OpenContext openContext) throws Exception {
        super.open(openContext);
        this.jedis = new Jedis(redisHost, redisPort);
        try {
            this.jedis.select(redisDb);
            this.jedis.ping();
            LOG.info("Redis mask table connection established at {}:{}", redisHost, redisPort);
        } catch (Exception e) {
            LOG.error("Error connecting to Redis: {}", e.getMessage());
            throw e;
        }
    }

    @Override
    public ValidationResult map(ValidationRequest request) {
        try {
            LOG.info("Validating {}", request);
            return new LineValidator(config, maskTable(request.groupId)).validate(request);
        } catch (RuntimeException e) {
            LOG.error("Line validation failed for group {} member {}: {}", request.groupId, request.memberId, e.toString());
            return new ValidationResult(request.groupId, request.memberId, request.iteration, new ArrayList<>(),
                    new ArrayList<>(), new ClusterInfo());
        }
    }

    protected MaskTable maskTable(int groupId) {
        if (jedis == null) throw new IllegalStateException("Redis client not initialized");
        return new RedisMaskTable(jedis, groupId);
    }

    @Override
    public void close() throws Exception {
        if (jedis != null) {
            jedis.close();
            LOG.info("Redis mask table connection closed");
        }
    }
}
