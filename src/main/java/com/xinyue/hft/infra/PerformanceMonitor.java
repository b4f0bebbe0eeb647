package com.xinyue.hft.infra;

import com.xinyue.hft.common.ScaleConstants;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 单条流水线的性能计数器。
 * <p>
 * 只由该流水线的消费线程写入，指标上报线程只读；全部使用原子变量，读写无锁且无竞态。
 * 只做计数，不参与任何交易决策。
 */
public final class PerformanceMonitor {

    private final String name;
    private final long startNanos;

    private final AtomicLong quotesProcessed = new AtomicLong();
    private final AtomicLong ordersSent = new AtomicLong();
    private final AtomicLong ordersRejected = new AtomicLong();
    private final AtomicLong fillsReceived = new AtomicLong();
    private final AtomicLong cumulativePnlE8 = new AtomicLong();

    private final LatencyStage quoteToDecision = new LatencyStage();
    private final LatencyStage decisionToFill = new LatencyStage();

    public PerformanceMonitor(String name) {
        this.name = name;
        this.startNanos = System.nanoTime();
    }

    public void recordQuote() {
        quotesProcessed.incrementAndGet();
    }

    public void recordOrder() {
        ordersSent.incrementAndGet();
    }

    public void recordRejection() {
        ordersRejected.incrementAndGet();
    }

    public void recordFill() {
        fillsReceived.incrementAndGet();
    }

    public void recordPnl(double cumulativePnl) {
        cumulativePnlE8.set(ScaleConstants.toE8(cumulativePnl));
    }

    public void recordQuoteToDecision(long nanos) {
        quoteToDecision.record(nanos);
    }

    public void recordDecisionToFill(long nanos) {
        decisionToFill.record(nanos);
    }

    public String name() {
        return name;
    }

    public PerformanceSnapshot snapshot() {
        return new PerformanceSnapshot(
                name,
                quotesProcessed.get(),
                ordersSent.get(),
                ordersRejected.get(),
                fillsReceived.get(),
                ScaleConstants.fromE8(cumulativePnlE8.get()),
                quoteToDecision.count(),
                quoteToDecision.averageMicros(),
                quoteToDecision.maxMicros(),
                decisionToFill.count(),
                decisionToFill.averageMicros(),
                decisionToFill.maxMicros(),
                (System.nanoTime() - startNanos) / 1_000_000_000.0
        );
    }

    /**
     * 单个阶段的延迟累加器：样本数、总耗时、最大值。
     */
    static final class LatencyStage {
        private final AtomicLong count = new AtomicLong();
        private final AtomicLong totalNanos = new AtomicLong();
        private final AtomicLong maxNanos = new AtomicLong();

        void record(long nanos) {
            if (nanos < 0) {
                return;
            }
            count.incrementAndGet();
            totalNanos.addAndGet(nanos);
            maxNanos.accumulateAndGet(nanos, Math::max);
        }

        long count() {
            return count.get();
        }

        double averageMicros() {
            long n = count.get();
            return n == 0 ? 0.0 : totalNanos.get() / (double) n / 1_000.0;
        }

        double maxMicros() {
            return maxNanos.get() / 1_000.0;
        }
    }
}
