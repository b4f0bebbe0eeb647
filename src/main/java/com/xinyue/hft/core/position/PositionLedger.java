package com.xinyue.hft.core.position;

import com.xinyue.hft.common.Fill;
import com.xinyue.hft.common.ScaleConstants;
import com.xinyue.hft.config.PnlMode;

/**
 * 单品种的带符号仓位账本（正数为净多头），只在成交时更新。
 * <p>
 * 非线程安全：只允许流水线消费线程访问。策略和风控各自持有一份，由同一串成交驱动。
 */
public final class PositionLedger {

    private final PnlMode pnlMode;

    private double position;
    private double averageCost;     // 当前持仓的平均成本，空仓时为 0
    private double realizedPnl;
    private long tradeCount;

    public PositionLedger(PnlMode pnlMode) {
        if (pnlMode == null) {
            throw new IllegalArgumentException("pnlMode 不能为空");
        }
        this.pnlMode = pnlMode;
    }

    /**
     * 记一笔成交。
     *
     * @return 本笔成交带来的已实现盈亏变动
     */
    public double apply(Fill fill) {
        double signed = fill.signedQuantity();
        double price = fill.price();
        double realizedDelta = pnlMode == PnlMode.CASH_FLOW
                ? applyCashFlow(signed, price)
                : applyAverageCost(signed, price);
        realizedPnl += realizedDelta;
        tradeCount++;
        return realizedDelta;
    }

    private double applyCashFlow(double signed, double price) {
        updateCostBasis(signed, price);
        return -signed * price;
    }

    private double applyAverageCost(double signed, double price) {
        if (position == 0 || Math.signum(position) == Math.signum(signed)) {
            // 开仓或加仓
            updateCostBasis(signed, price);
            return 0.0;
        }
        // 减仓，可能翻转
        double closeQty = Math.min(Math.abs(signed), Math.abs(position));
        double realized = closeQty * (price - averageCost) * Math.signum(position);
        double remaining = Math.abs(signed) - closeQty;
        position += signed;
        if (Math.abs(position) < ScaleConstants.QTY_EPSILON) {
            position = 0;
            averageCost = 0;
        } else if (remaining > ScaleConstants.QTY_EPSILON) {
            // 翻转后剩余部分按成交价开新仓
            averageCost = price;
        }
        return realized;
    }

    private void updateCostBasis(double signed, double price) {
        double newPosition = position + signed;
        if (Math.abs(newPosition) < ScaleConstants.QTY_EPSILON) {
            position = 0;
            averageCost = 0;
            return;
        }
        if (position == 0 || Math.signum(position) == Math.signum(signed)) {
            averageCost = (averageCost * Math.abs(position) + price * Math.abs(signed)) / Math.abs(newPosition);
        } else if (Math.signum(newPosition) != Math.signum(position)) {
            averageCost = price;
        }
        position = newPosition;
    }

    /**
     * 按标记价格估算的浮动盈亏。
     */
    public double unrealizedPnl(double markPrice) {
        if (pnlMode == PnlMode.CASH_FLOW) {
            // 现金流口径下持仓按市值计入
            return position * markPrice;
        }
        return (markPrice - averageCost) * position;
    }

    public double position() {
        return position;
    }

    public double averageCost() {
        return averageCost;
    }

    public double realizedPnl() {
        return realizedPnl;
    }

    public long tradeCount() {
        return tradeCount;
    }

    public PnlMode pnlMode() {
        return pnlMode;
    }
}
