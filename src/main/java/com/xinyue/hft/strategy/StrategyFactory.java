package com.xinyue.hft.strategy;

import com.xinyue.hft.config.PipelineConfig;

public final class StrategyFactory {

    private StrategyFactory() {
    }

    public static TradingStrategy create(PipelineConfig config) {
        return switch (config.strategyType()) {
            case MARKET_MAKING -> new MarketMakingStrategy(config);
            case ARBITRAGE -> new ArbitrageStrategy(config);
        };
    }
}
