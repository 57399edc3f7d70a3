package sdline.it.maps;

import org.apache.flink.api.common.functions.OpenContext;
import org.apache.flink.api.common.functions.RichMapFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;

/**
 * Publishes every record's string form on a Redis channel and passes it on unchanged.
 */
public class RedisPublishMapFunction<T> extends RichMapFunction<T, T> {
    private static final Logger LOG = LoggerFactory.getLogger(RedisPublishMapFunction.class);

    private final String channelName;
    private final String redisHost;
    private final int redisPort;
    private final int redisDb;

    private transient Jedis jedis;

    public RedisPublishMapFunction(String channelName, String redisHost, int redisPort, int redisDb) {
        this.channelName = channelName;
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
            LOG.info("Redis connection established for channel: {}", channelName);
        } catch (Exception e) {
            LOG.error("Error connecting to Redis: {}", e.getMessage());
            throw e;
        }
    }

    @Override
    public T map(T value) {
        try {
            if (jedis == null) throw new IllegalStateException("Redis client not initialized");
            long subscribers = jedis.publish(channelName, value.toString());
            LOG.debug("Published to {} ({} subscribers)", channelName, subscribers);
            return value;
        } catch (Exception e) {
            LOG.error("Error publishing to Redis channel {}: {}", channelName, e.getMessage());
            try {
                this.jedis = new Jedis(redisHost, redisPort);
                this.jedis.select(redisDb);
                this.jedis.publish(channelName, value.toString());
            } catch (Exception reconnectError) {
                LOG.error("Failed to reconnect and publish: {}", reconnectError.getMessage());
            }
            return value;
        }
    }

    @Override
    public void close() throws Exception {
        if (jedis != null) {
            jedis.close();
            LOG.info("Redis connection closed for channel: {}", channelName);
        }
    }
}
