package com.xinyue.hft.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("性能计数器")
class PerformanceMonitorTest {

    @Test
    @DisplayName("计数和分阶段延迟")
    void testCountersAndLatency() {
        PerformanceMonitor monitor = new PerformanceMonitor("XYZ");
        monitor.recordQuote();
        monitor.recordQuote();
        monitor.recordOrder();
        monitor.recordRejection();
        monitor.recordFill();
        monitor.recordPnl(12.345);
        monitor.recordQuoteToDecision(2_000);
        monitor.recordQuoteToDecision(4_000);
        monitor.recordDecisionToFill(10_000);
        monitor.recordDecisionToFill(-5);

        PerformanceSnapshot snapshot = monitor.snapshot();
        assertEquals("XYZ", snapshot.name());
        assertEquals(2, snapshot.quotesProcessed());
        assertEquals(1, snapshot.ordersSent());
        assertEquals(1, snapshot.ordersRejected());
        assertEquals(1, snapshot.fillsReceived());
        assertEquals(12.345, snapshot.cumulativePnl(), 1e-8);
        assertEquals(2, snapshot.latencySamples());
        assertEquals(3.0, snapshot.avgLatencyMicros(), 1e-9);
        assertEquals(4.0, snapshot.maxLatencyMicros(), 1e-9);
        assertEquals(1, snapshot.fillLatencySamples(), "负的耗时被忽略");
        assertEquals(10.0, snapshot.maxFillLatencyMicros(), 1e-9);
        assertTrue(snapshot.uptimeSeconds() >= 0);
    }

    @Test
    @DisplayName("并发写入不丢计数")
    void testConcurrentIncrements() throws Exception {
        PerformanceMonitor monitor = new PerformanceMonitor("XYZ");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        for (int t = 0; t < 4; t++) {
            pool.execute(() -> {
                for (int i = 0; i < 10_000; i++) {
                    monitor.recordQuote();
                    monitor.recordQuoteToDecision(i);
                }
            });
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        PerformanceSnapshot snapshot = monitor.snapshot();
        assertEquals(40_000, snapshot.quotesProcessed());
        assertEquals(40_000, snapshot.latencySamples());
        assertEquals(9.999, snapshot.maxLatencyMicros(), 1e-9);
    }

    @Test
    @DisplayName("汇总快照：计数相加，平均延迟按样本加权")
    void testAggregate() {
        PerformanceSnapshot a = new PerformanceSnapshot("A", 10, 4, 1, 4, 5.0, 2, 1.0, 2.0, 4, 10.0, 20.0, 2.0);
        PerformanceSnapshot b = new PerformanceSnapshot("B", 30, 6, 3, 5, -1.5, 6, 3.0, 9.0, 0, 0.0, 0.0, 4.0);
        PerformanceSnapshot all = PerformanceSnapshot.aggregate("ALL", List.of(a, b));
        assertEquals("ALL", all.name());
        assertEquals(40, all.quotesProcessed());
        assertEquals(10, all.ordersSent());
        assertEquals(4, all.ordersRejected());
        assertEquals(9, all.fillsReceived());
        assertEquals(3.5, all.cumulativePnl(), 1e-9);
        assertEquals(8, all.latencySamples());
        assertEquals(2.5, all.avgLatencyMicros(), 1e-9);
        assertEquals(9.0, all.maxLatencyMicros(), 1e-9);
        assertEquals(10.0, all.avgFillLatencyMicros(), 1e-9);
        assertEquals(4.0, all.uptimeSeconds(), 1e-9);
        assertEquals(10.0, all.quotesPerSecond(), 1e-9);
    }

    @Test
    @DisplayName("JSON 输出包含快照全部字段")
    void testJsonSink() throws Exception {
        PerformanceSnapshot snapshot = new PerformanceSnapshot("XYZ", 1, 2, 3, 4, 5.5, 6, 7.0, 8.0, 9, 10.0, 11.0, 12.0);
        String json = new JsonLogMetricsSink().toJson(snapshot);
        JsonNode node = new ObjectMapper().readTree(json);
        assertEquals("XYZ", node.get("name").asText());
        assertEquals(1, node.get("quotesProcessed").asLong());
        assertEquals(3, node.get("ordersRejected").asLong());
        assertEquals(5.5, node.get("cumulativePnl").asDouble());
        assertEquals(11.0, node.get("maxFillLatencyMicros").asDouble());
        assertEquals(13, node.size());
    }
}
