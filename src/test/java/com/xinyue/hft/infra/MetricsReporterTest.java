package com.xinyue.hft.infra;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("指标上报")
class MetricsReporterTest {

    @Test
    @DisplayName("多条流水线时额外推送汇总快照")
    void testFlush_WithAggregate() {
        List<PerformanceSnapshot> published = new CopyOnWriteArrayList<>();
        MetricsReporter reporter = new MetricsReporter(published::add, 1_000);
        PerformanceMonitor a = new PerformanceMonitor("A");
        PerformanceMonitor b = new PerformanceMonitor("B");
        reporter.register(a).register(b);
        a.recordQuote();
        b.recordQuote();
        b.recordQuote();

        reporter.flush();
        assertEquals(3, published.size());
        assertEquals("A", published.get(0).name());
        assertEquals("B", published.get(1).name());
        assertEquals(MetricsReporter.AGGREGATE_NAME, published.get(2).name());
        assertEquals(3, published.get(2).quotesProcessed());
    }

    @Test
    @DisplayName("单条流水线不推送汇总")
    void testFlush_SinglePipeline() {
        List<PerformanceSnapshot> published = new CopyOnWriteArrayList<>();
        MetricsReporter reporter = new MetricsReporter(published::add, 1_000);
        reporter.register(new PerformanceMonitor("A"));
        reporter.flush();
        assertEquals(1, published.size());
    }

    @Test
    @DisplayName("按周期推送，停止时再推送一次")
    void testScheduledFlush() throws Exception {
        List<PerformanceSnapshot> published = new CopyOnWriteArrayList<>();
        MetricsReporter reporter = new MetricsReporter(published::add, 10);
        reporter.register(new PerformanceMonitor("A"));
        reporter.start();
        long deadline = System.currentTimeMillis() + 5_000;
        while (published.size() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertTrue(published.size() >= 2);

        reporter.stop();
        int afterStop = published.size();
        Thread.sleep(50);
        assertEquals(afterStop, published.size(), "停止后不再推送");
    }

    @Test
    @DisplayName("周期必须为正")
    void testInvalidInterval() {
        assertThrows(IllegalArgumentException.class, () -> new MetricsReporter(s -> {
        }, 0));
    }
}
