package com.xinyue.hft.config;

/**
 * 流水线启动时选定的策略变体。
 */
public enum StrategyType {
    MARKET_MAKING,
    ARBITRAGE;

    public static StrategyType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("strategy 不能为空");
        }
        String normalized = value.trim().toUpperCase().replace('-', '_');
        for (StrategyType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知的策略类型: " + value);
    }
}
