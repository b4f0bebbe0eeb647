package com.xinyue.hft.infra;

import java.util.List;

/**
 * 某一时刻性能计数器的只读拷贝，周期性推送给观测端。
 * <p>
 * avgLatencyMicros / maxLatencyMicros 为“行情 -> 决策”阶段；fill 前缀的字段为“决策 -> 成交”阶段。
 */
public record PerformanceSnapshot(String name,
                                  long quotesProcessed,
                                  long ordersSent,
                                  long ordersRejected,
                                  long fillsReceived,
                                  double cumulativePnl,
                                  long latencySamples,
                                  double avgLatencyMicros,
                                  double maxLatencyMicros,
                                  long fillLatencySamples,
                                  double avgFillLatencyMicros,
                                  double maxFillLatencyMicros,
                                  double uptimeSeconds) {

    public double quotesPerSecond() {
        return rate(quotesProcessed);
    }

    public double ordersPerSecond() {
        return rate(ordersSent);
    }

    public double fillsPerSecond() {
        return rate(fillsReceived);
    }

    private double rate(long count) {
        return uptimeSeconds > 0 ? count / uptimeSeconds : 0.0;
    }

    /**
     * 汇总多条流水线各自独立的计数器，平均延迟按样本数加权，运行时长取最大值。
     */
    public static PerformanceSnapshot aggregate(String name, List<PerformanceSnapshot> snapshots) {
        long quotes = 0;
        long orders = 0;
        long rejected = 0;
        long fills = 0;
        double pnl = 0;
        long latencySamples = 0;
        double latencyTotal = 0;
        double latencyMax = 0;
        long fillSamples = 0;
        double fillTotal = 0;
        double fillMax = 0;
        double uptime = 0;
        for (PerformanceSnapshot s : snapshots) {
            quotes += s.quotesProcessed;
            orders += s.ordersSent;
            rejected += s.ordersRejected;
            fills += s.fillsReceived;
            pnl += s.cumulativePnl;
            latencySamples += s.latencySamples;
            latencyTotal += s.avgLatencyMicros * s.latencySamples;
            latencyMax = Math.max(latencyMax, s.maxLatencyMicros);
            fillSamples += s.fillLatencySamples;
            fillTotal += s.avgFillLatencyMicros * s.fillLatencySamples;
            fillMax = Math.max(fillMax, s.maxFillLatencyMicros);
            uptime = Math.max(uptime, s.uptimeSeconds);
        }
        return new PerformanceSnapshot(name, quotes, orders, rejected, fills, pnl,
                latencySamples, latencySamples > 0 ? latencyTotal / latencySamples : 0.0, latencyMax,
                fillSamples, fillSamples > 0 ? fillTotal / fillSamples : 0.0, fillMax,
                uptime);
    }
}
