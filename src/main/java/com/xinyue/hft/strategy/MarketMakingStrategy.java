package com.xinyue.hft.strategy;

import com.xinyue.hft.common.Fill;
import com.xinyue.hft.common.Order;
import com.xinyue.hft.common.Quote;
import com.xinyue.hft.common.ScaleConstants;
import com.xinyue.hft.common.Side;
import com.xinyue.hft.config.PipelineConfig;
import com.xinyue.hft.config.StrategyType;
import com.xinyue.hft.core.position.PositionLedger;

/**
 * 库存感知做市策略。
 * <p>
 * 策略逻辑：
 * - 半价差 = 基础半价差 × (1 + k × 近期波动率)
 * - 库存偏移：报价中点向远离库存的方向平移，偏移量 ∝ -库存 / max_position，引导成交把仓位拉回目标
 * - 每个 tick 至多挂一边：库存超出目标带宽时挂减仓方向，否则买卖交替
 * - 加仓方向的数量随库存占用率线性缩小，并截断到不超过 max_position
 */
public final class MarketMakingStrategy implements TradingStrategy {

    private final double tickSize;
    private final double maxPosition;
    private final double orderSize;
    private final double baseHalfSpread;
    private final double volatilityMultiplier;
    private final double skewFactor;
    private final double inventoryBand;
    private final double targetInventory = 0.0;

    private final PositionLedger ledger;
    private final VolatilityEstimator volatilityEstimator;

    private Side lastSide;
    private long quotesReceived;
    private long ordersEmitted;

    public MarketMakingStrategy(PipelineConfig config) {
        this.tickSize = config.tickSize();
        this.maxPosition = config.maxPosition();
        this.orderSize = config.orderSize();
        this.baseHalfSpread = config.mmBaseSpreadTicks() * config.tickSize();
        this.volatilityMultiplier = config.mmVolatilityMultiplier();
        this.skewFactor = config.mmSkewFactor();
        this.inventoryBand = config.mmInventoryBand() * config.maxPosition();
        this.ledger = new PositionLedger(config.pnlMode());
        this.volatilityEstimator = new VolatilityEstimator(config.mmVolatilityWindow());
    }

    @Override
    public Order onQuote(Quote quote) {
        quotesReceived++;
        double mid = quote.mid();
        volatilityEstimator.update(mid);

        double halfSpread = dynamicHalfSpread();
        double inventory = ledger.position();
        double skewedMid = mid + inventorySkew(inventory, halfSpread);

        Side side = chooseSide(inventory);
        double price = side == Side.BUY
                ? roundDown(skewedMid - halfSpread)
                : roundUp(skewedMid + halfSpread);
        if (!(price > 0)) {
            return null;
        }

        double quantity = Math.min(orderSizeFor(side, inventory), capacity(side, inventory));
        if (quantity <= ScaleConstants.QTY_EPSILON) {
            return null;
        }
        lastSide = side;
        ordersEmitted++;
        return new Order(side, quantity, price);
    }

    @Override
    public void onFill(Fill fill) {
        ledger.apply(fill);
    }

    double dynamicHalfSpread() {
        return baseHalfSpread * (1.0 + volatilityMultiplier * volatilityEstimator.volatility());
    }

    /**
     * 多头时向下平移（卖单更容易成交），空头时向上平移。
     */
    double inventorySkew(double inventory, double halfSpread) {
        return -((inventory - targetInventory) / maxPosition) * skewFactor * halfSpread;
    }

    private Side chooseSide(double inventory) {
        double excess = inventory - targetInventory;
        if (excess > inventoryBand) {
            return Side.SELL;
        }
        if (excess < -inventoryBand) {
            return Side.BUY;
        }
        return lastSide == null ? Side.BUY : lastSide.opposite();
    }

    private double orderSizeFor(Side side, double inventory) {
        boolean increasing = side.sign() * (inventory - targetInventory) >= 0;
        if (!increasing) {
            return orderSize;
        }
        double usage = Math.min(1.0, Math.abs(inventory - targetInventory) / maxPosition);
        return orderSize * (1.0 - usage * 0.5);
    }

    /**
     * 保证 |库存 + 本单| 不超过 max_position 的最大数量。
     */
    private double capacity(Side side, double inventory) {
        return side == Side.BUY ? maxPosition - inventory : maxPosition + inventory;
    }

    private double roundDown(double price) {
        return Math.floor(price / tickSize + 1e-9) * tickSize;
    }

    private double roundUp(double price) {
        return Math.ceil(price / tickSize - 1e-9) * tickSize;
    }

    @Override
    public StrategyType type() {
        return StrategyType.MARKET_MAKING;
    }

    @Override
    public double inventory() {
        return ledger.position();
    }

    @Override
    public double realizedPnl() {
        return ledger.realizedPnl();
    }

    public double volatility() {
        return volatilityEstimator.volatility();
    }

    public long quotesReceived() {
        return quotesReceived;
    }

    public long ordersEmitted() {
        return ordersEmitted;
    }
}
