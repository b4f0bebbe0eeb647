package com.xinyue.hft.infra;

/**
 * 观测端：接收周期性的性能快照，后续可接入 Micrometer/Prometheus 等指标后端。
 */
public interface MetricsSink {

    void publish(PerformanceSnapshot snapshot);
}
