package com.xinyue.hft.strategy;

import com.xinyue.hft.common.Fill;
import com.xinyue.hft.common.Order;
import com.xinyue.hft.common.Quote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 包装选定的策略，并提供紧急停止开关。
 * <p>
 * 开关打开后不再产生新订单，但成交照常记账，保证库存不失真。
 */
public final class StrategyEngine {

    private static final Logger LOG = LoggerFactory.getLogger(StrategyEngine.class);

    private final TradingStrategy strategy;
    private volatile boolean killSwitch;

    public StrategyEngine(TradingStrategy strategy) {
        this.strategy = strategy;
    }

    public Order onQuote(Quote quote) {
        if (killSwitch) {
            return null;
        }
        return strategy.onQuote(quote);
    }

    public void onFill(Fill fill) {
        strategy.onFill(fill);
    }

    public void killSwitch() {
        if (!killSwitch) {
            killSwitch = true;
            LOG.error("策略 {} 已紧急停止，不再产生新订单", strategy.type());
        }
    }

    public boolean isKilled() {
        return killSwitch;
    }

    public TradingStrategy strategy() {
        return strategy;
    }
}
