package com.xinyue.hft.risk;

/**
 * 风控状态的只读拷贝。
 */
public record RiskSnapshot(double position,
                           int ordersThisWindow,
                           long windowStartNanos,
                           double cumulativePnl,
                           double peakPnl,
                           CircuitBreaker.State circuitBreakerState,
                           long circuitBreakerExpiryNanos,
                           long circuitBreakerTrips,
                           double lastPrice,
                           long acceptedOrders,
                           long rejectedOrders) {

    public double drawdown() {
        return peakPnl - cumulativePnl;
    }
}
