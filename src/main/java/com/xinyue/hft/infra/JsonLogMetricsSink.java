package com.xinyue.hft.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 把快照序列化成一行 JSON 写到 metrics 日志。
 */
public final class JsonLogMetricsSink implements MetricsSink {

    private static final Logger METRICS = LoggerFactory.getLogger("metrics");
    private static final Logger LOG = LoggerFactory.getLogger(JsonLogMetricsSink.class);

    private final ObjectMapper objectMapper;

    public JsonLogMetricsSink() {
        this(new ObjectMapper());
    }

    public JsonLogMetricsSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void publish(PerformanceSnapshot snapshot) {
        METRICS.info(toJson(snapshot));
    }

    String toJson(PerformanceSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            LOG.warn("快照序列化失败，改用 toString 输出: {}", snapshot.name(), e);
            return snapshot.toString();
        }
    }
}
