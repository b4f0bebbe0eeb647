package com.xinyue.hft.risk;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("熔断器状态机")
class CircuitBreakerTest {

    @Test
    @DisplayName("触发后在到期时刻自动恢复")
    void testTripAndExpire() {
        CircuitBreaker breaker = new CircuitBreaker("XYZ", 1_000);
        assertFalse(breaker.isTripped(0));

        breaker.trip(100, CircuitBreaker.TripReason.PRICE_SHOCK);
        assertEquals(CircuitBreaker.State.TRIPPED, breaker.state());
        assertEquals(1_100, breaker.expiryNanos());
        assertTrue(breaker.isTripped(1_099));
        assertFalse(breaker.isTripped(1_100));
        assertEquals(CircuitBreaker.State.NORMAL, breaker.state());
    }

    @Test
    @DisplayName("熔断中再次触发取较晚的到期时间")
    void testRetrip_KeepsLaterExpiry() {
        CircuitBreaker breaker = new CircuitBreaker("XYZ", 1_000);
        breaker.trip(0, CircuitBreaker.TripReason.PRICE_SHOCK);
        breaker.trip(500, CircuitBreaker.TripReason.DRAWDOWN);
        assertEquals(1_500, breaker.expiryNanos());
        assertEquals(CircuitBreaker.TripReason.DRAWDOWN, breaker.lastReason());
        assertEquals(2, breaker.tripCount());
        assertTrue(breaker.isTripped(1_200));
    }

    @Test
    @DisplayName("熔断时长为 0 时下一次检查即恢复")
    void testZeroDuration() {
        CircuitBreaker breaker = new CircuitBreaker("XYZ", 0);
        breaker.trip(10, CircuitBreaker.TripReason.PRICE_SHOCK);
        assertFalse(breaker.isTripped(10));
    }

    @Test
    @DisplayName("负的熔断时长非法")
    void testNegativeDuration_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> new CircuitBreaker("XYZ", -1));
    }
}
