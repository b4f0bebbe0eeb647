package com.xinyue.hft.config;

/**
 * 已实现盈亏的计算口径。
 */
public enum PnlMode {
    /** 按持仓平均成本逐笔计算已实现盈亏，仓位翻转时剩余部分按成交价重新开仓 */
    AVERAGE_COST,
    /** 按现金流累计：买入记 -qty*px，卖出记 +qty*px */
    CASH_FLOW;

    public static PnlMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("pnl_mode 不能为空");
        }
        try {
            return PnlMode.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("未知的 pnl_mode: " + value, e);
        }
    }
}
