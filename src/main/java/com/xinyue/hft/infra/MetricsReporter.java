package com.xinyue.hft.infra;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 按固定周期读取所有流水线的计数器并推送给观测端。
 * <p>
 * 多于一条流水线时额外推送一条名为 {@value #AGGREGATE_NAME} 的汇总快照。
 */
public final class MetricsReporter {

    private static final Logger LOG = LoggerFactory.getLogger(MetricsReporter.class);

    public static final String AGGREGATE_NAME = "ALL";

    private final MetricsSink sink;
    private final long flushIntervalMs;
    private final List<PerformanceMonitor> monitors = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledExecutorService scheduler;

    public MetricsReporter(MetricsSink sink, long flushIntervalMs) {
        if (flushIntervalMs <= 0) {
            throw new IllegalArgumentException("flushIntervalMs 必须大于 0: " + flushIntervalMs);
        }
        this.sink = sink;
        this.flushIntervalMs = flushIntervalMs;
    }

    public MetricsReporter register(PerformanceMonitor monitor) {
        monitors.add(monitor);
        return this;
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            LOG.warn("MetricsReporter 已经启动");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "metrics-reporter");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(() -> {
            try {
                flush();
            } catch (Exception e) {
                LOG.error("指标上报失败", e);
            }
        }, flushIntervalMs, flushIntervalMs, TimeUnit.MILLISECONDS);
        LOG.info("MetricsReporter 启动，周期 {}ms，监控 {} 条流水线", flushIntervalMs, monitors.size());
    }

    /**
     * 立即推送一次所有快照。
     */
    public void flush() {
        List<PerformanceSnapshot> snapshots = new ArrayList<>(monitors.size());
        for (PerformanceMonitor monitor : monitors) {
            PerformanceSnapshot snapshot = monitor.snapshot();
            snapshots.add(snapshot);
            sink.publish(snapshot);
        }
        if (snapshots.size() > 1) {
            sink.publish(PerformanceSnapshot.aggregate(AGGREGATE_NAME, snapshots));
        }
    }

    /**
     * 停止定时上报，并做最后一次推送。
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(1, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        flush();
        LOG.info("MetricsReporter 已停止");
    }
}
