package com.xinyue.hft.risk;

/**
 * 准入检查结果。除 ACCEPTED 外均为拒单原因，按检查顺序排列。
 */
public enum RiskDecision {
    ACCEPTED,
    CIRCUIT_BREAKER,
    RATE_LIMIT,
    POSITION_LIMIT,
    ORDER_VALUE;

    public boolean isAccepted() {
        return this == ACCEPTED;
    }
}
