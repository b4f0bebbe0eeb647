package com.xinyue.hft.risk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 熔断器状态机：NORMAL -> (价格冲击 / 回撤超限) -> TRIPPED -> (到期后惰性检查) -> NORMAL。
 * <p>
 * 没有外部复位接口，到期自动恢复。到期只在下一次 {@link #isTripped(long)} 调用时判定，不依赖定时器。
 */
public final class CircuitBreaker {

    private static final Logger LOG = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        NORMAL,
        TRIPPED
    }

    public enum TripReason {
        PRICE_SHOCK,
        DRAWDOWN
    }

    private final String symbol;
    private final long durationNanos;

    private State state = State.NORMAL;
    private long expiryNanos;
    private TripReason lastReason;
    private long tripCount;

    public CircuitBreaker(String symbol, long durationNanos) {
        if (durationNanos < 0) {
            throw new IllegalArgumentException("熔断时长不能为负: " + durationNanos);
        }
        this.symbol = symbol;
        this.durationNanos = durationNanos;
    }

    /**
     * 触发熔断。已处于熔断状态时，到期时间取两者中较晚的一个。
     */
    public void trip(long nowNanos, TripReason reason) {
        long newExpiry = nowNanos + durationNanos;
        if (state == State.TRIPPED) {
            expiryNanos = Math.max(expiryNanos, newExpiry);
        } else {
            state = State.TRIPPED;
            expiryNanos = newExpiry;
        }
        lastReason = reason;
        tripCount++;
        LOG.warn("[{}] 熔断触发: reason={}, 持续 {}ms", symbol, reason, durationNanos / 1_000_000L);
    }

    /**
     * 判断是否仍处于熔断中，到期则顺带恢复为 NORMAL。
     */
    public boolean isTripped(long nowNanos) {
        if (state == State.TRIPPED && nowNanos - expiryNanos >= 0) {
            state = State.NORMAL;
            LOG.info("[{}] 熔断到期恢复: reason={}", symbol, lastReason);
        }
        return state == State.TRIPPED;
    }

    public State state() {
        return state;
    }

    public long expiryNanos() {
        return expiryNanos;
    }

    public TripReason lastReason() {
        return lastReason;
    }

    public long tripCount() {
        return tripCount;
    }
}
