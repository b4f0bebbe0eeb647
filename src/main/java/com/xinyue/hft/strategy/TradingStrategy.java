package com.xinyue.hft.strategy;

import com.xinyue.hft.common.Fill;
import com.xinyue.hft.common.Order;
import com.xinyue.hft.common.Quote;
import com.xinyue.hft.config.StrategyType;

/**
 * 策略接口，流水线启动时选定一个实现。
 * <p>
 * 策略自己的库存是敞口的唯一真相来源；风控的仓位检查是独立的第二道防线，两者按顺序而非事务同步。
 * 所有方法只在流水线消费线程上调用。
 */
public interface TradingStrategy {

    /**
     * 在每笔行情到达时调用。
     *
     * @param quote 最新报价
     * @return 至多一笔候选订单，本次不下单时返回 null
     */
    Order onQuote(Quote quote);

    /**
     * 在每笔成交回报到达时调用，更新库存和盈亏。
     *
     * @param fill 成交
     */
    void onFill(Fill fill);

    StrategyType type();

    /**
     * 已成交的带符号库存。
     */
    double inventory();

    double realizedPnl();
}
