package sdline.it;

import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.java.utils.ParameterTool;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.connector.kafka.source.reader.deserializer.KafkaRecordDeserializationSchema;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.SingleOutputStreamOperator;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;

import sdline.it.csvUtils.ExtractResultFields;
import sdline.it.maps.*;
import sdline.it.model.*;

import java.util.ArrayList;
import java.util.List;

public class Main {
    public static void main(String[] args) throws Exception {
        final ParameterTool params = ParameterTool.fromArgs(args);
        final ValidationConfig config = configFrom(params);
        config.check();

        final String redisHost = params.get("redis-host", "redis");
        final int redisPort = params.getInt("redis-port", 6379);
        final int redisDb = params.getInt("redis-db", 0);

        final StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        env.getConfig().setGlobalJobParameters(params);

        // Kafka source
        KafkaSource<byte[]> source = KafkaSource.<byte[]>builder()
                .setBootstrapServers(params.get("kafka-bootstrap", "kafka:9092"))
                .setTopics(params.get("kafka-topic", "line-candidates"))
                .setGroupId(params.get("kafka-group", "flink-line-validation"))
                .setStartingOffsets(OffsetsInitializer.earliest())
                .setDeserializer(KafkaRecordDeserializationSchema.valueOnly(ByteArrayDeserializer.class))
                .build();

        DataStream<byte[]> byteStream = env.fromSource(
                source,
                WatermarkStrategy.noWatermarks(),
                "KafkaSource"
        );

        var redisSink = new RedisPublishMapFunction<String>(params.get("redis-channel", "validated-lines"),
                redisHost, redisPort, redisDb);

        DataStream<ValidationRequest> requests = byteStream
                .map(new MsgpackBytesToRequestMapper())
                .name("decode-request")
                .filter(request -> !request.isEmpty())
                .name("drop-malformed");

        SingleOutputStreamOperator<ValidationResult> results = requests
                .keyBy(request -> request.groupId)
                .map(new LineValidationFunction(config, redisHost, redisPort, redisDb))
                .name("line-validation");

        SingleOutputStreamOperator<String> jsonData = results
                .map(new ExtractResultFields())
                .name("extract-result-fields");

        jsonData.map(redisSink).name("redis-sink");

        jsonData.print();

        env.execute("Spectral Line Validation");
    }

    /**
     * Validation parameters from command line arguments; absent keys keep their defaults.
     */
    static ValidationConfig configFrom(ParameterTool params) {
        ValidationConfig config = new ValidationConfig();
        config.gridRa = params.getDouble("grid-ra", config.gridRa);
        config.gridDec = params.getDouble("grid-dec", config.gridDec);
        config.edge = parseEdge(params.get("edge", config.edge[0] + "," + config.edge[1]));
        config.nsigma = params.getDouble("nsigma", config.nsigma);
        config.xorder = params.getInt("xorder", config.xorder);
        config.yorder = params.getInt("yorder", config.yorder);
        config.broadComponent = params.getBoolean("broad-component", config.broadComponent);
        config.clusteringAlgorithm = params.get("clustering", config.clusteringAlgorithm);
        config.window = parseWindow(params.get("window", ""));
        config.windowMode = params.get("windowmode", config.windowMode);
        config.thresholdValid = params.getDouble("threshold-valid", config.thresholdValid);
        config.thresholdMarginal = params.getDouble("threshold-marginal", config.thresholdMarginal);
        config.thresholdQuestionable = params.getDouble("threshold-questionable", config.thresholdQuestionable);
        config.maxCluster = params.getInt("max-cluster", config.maxCluster);
        config.blurRatio = params.getDouble("blur-ratio", config.blurRatio);
        config.thresholdHierarchy = params.getDouble("threshold-hierarchy", config.thresholdHierarchy);
        config.thresholdHierarchy2 = params.getDouble("threshold-hierarchy2", config.thresholdHierarchy2);
        config.linkage = params.get("linkage", config.linkage);
        config.minFwhm = params.getInt("min-fwhm", config.minFwhm);
        config.detectionRate = params.getDouble("detection-rate", config.detectionRate);
        return config;
    }

    private static int[] parseEdge(String value) {
        String[] parts = value.split(",");
        if (parts.length != 2) throw new IllegalArgumentException("edge must be given as <start>,<end>: " + value);
        return new int[]{Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim())};
    }

    // "100:120,300:310"
    private static List<ChannelRange> parseWindow(String value) {
        List<ChannelRange> window = new ArrayList<>();
        if (value.isBlank()) return window;
        for (String part : value.split(",")) {
            String[] range = part.split(":");
            if (range.length != 2) throw new IllegalArgumentException("Invalid line window: " + part);
            window.add(new ChannelRange(Integer.parseInt(range[0].trim()), Integer.parseInt(range[1].trim())));
        }
        return window;
    }
}
