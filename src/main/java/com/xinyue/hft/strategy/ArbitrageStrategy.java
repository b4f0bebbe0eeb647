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
 * 统计套利策略：行情中间价偏离公允价值超过阈值时，反向吃单捕捉回归。
 * <p>
 * - 偏离 = 中间价 - 公允价值（默认取本笔行情之前的 EMA，也可以由外部推送，见 {@link FairValueSource}）
 * - 低估买入（吃卖一），高估卖出（吃买一）
 * - 数量随偏离幅度放大（最多 5 倍），随仓位占用率缩小，并向行情更新更快的时段倾斜
 * - 仓位优先：成交后仓位逼近 max_position 时，后续行情无视偏离信号直接减仓
 */
public final class ArbitrageStrategy implements TradingStrategy {

    private static final double MAX_DEVIATION_FACTOR = 5.0;
    private static final double MIN_POSITION_FACTOR = 0.1;
    private static final double MIN_LATENCY_FACTOR = 0.5;
    private static final double MAX_LATENCY_FACTOR = 1.5;
    private static final double INTERVAL_EMA_ALPHA = 0.1;

    private final double maxPosition;
    private final double orderSize;
    private final double minProfitThreshold;
    private final double reduceThreshold;

    private final PositionLedger ledger;
    private final FairValueSource fairValue;

    private boolean flattenRequested;
    private long quotesProcessed;

    // 行情间隔统计
    private long lastQuoteNanos;
    private boolean hasLastQuote;
    private double lastIntervalNanos;
    private double averageIntervalNanos;
    private long maxIntervalNanos;

    public ArbitrageStrategy(PipelineConfig config) {
        this(config, new FairValueEstimator(config.arbFairValueAlpha(), config.arbWarmupQuotes()));
    }

    public ArbitrageStrategy(PipelineConfig config, FairValueSource fairValue) {
        this.maxPosition = config.maxPosition();
        this.orderSize = config.orderSize();
        this.minProfitThreshold = config.arbMinProfitThreshold();
        this.reduceThreshold = config.arbPositionReduceRatio() * config.maxPosition();
        this.ledger = new PositionLedger(config.pnlMode());
        this.fairValue = fairValue;
    }

    @Override
    public Order onQuote(Quote quote) {
        quotesProcessed++;
        updateLatencyStats(quote.timestampNanos());

        double mid = quote.mid();
        double position = ledger.position();
        Order order = null;

        if (flattenRequested && position != 0) {
            order = reducingOrder(quote, position);
        } else if (fairValue.isReady()) {
            double deviation = mid - fairValue.fairValue();
            if (Math.abs(deviation) > minProfitThreshold) {
                Side side = deviation > 0 ? Side.SELL : Side.BUY;
                double quantity = Math.min(sizeFor(deviation, position), capacity(side, position));
                if (quantity > ScaleConstants.QTY_EPSILON) {
                    order = new Order(side, quantity, side == Side.BUY ? quote.ask() : quote.bid());
                }
            }
        }

        fairValue.onMid(mid);
        return order;
    }

    @Override
    public void onFill(Fill fill) {
        ledger.apply(fill);
        flattenRequested = Math.abs(ledger.position()) >= reduceThreshold;
    }

    private Order reducingOrder(Quote quote, double position) {
        Side side = Side.reducing(position);
        double quantity = Math.min(Math.abs(position), orderSize);
        return new Order(side, quantity, side == Side.BUY ? quote.ask() : quote.bid());
    }

    double sizeFor(double deviation, double position) {
        double deviationFactor = Math.min(Math.abs(deviation) / minProfitThreshold, MAX_DEVIATION_FACTOR);
        double positionFactor = Math.max((maxPosition - Math.abs(position)) / maxPosition, MIN_POSITION_FACTOR);
        return orderSize * deviationFactor * positionFactor * latencyFactor();
    }

    /**
     * 最近一次行情间隔短于平均值时放大数量，长于平均值时缩小。
     */
    double latencyFactor() {
        if (lastIntervalNanos <= 0 || averageIntervalNanos <= 0) {
            return 1.0;
        }
        double factor = averageIntervalNanos / lastIntervalNanos;
        return Math.max(MIN_LATENCY_FACTOR, Math.min(MAX_LATENCY_FACTOR, factor));
    }

    private double capacity(Side side, double position) {
        return side == Side.BUY ? maxPosition - position : maxPosition + position;
    }

    private void updateLatencyStats(long timestampNanos) {
        if (hasLastQuote) {
            long interval = timestampNanos - lastQuoteNanos;
            if (interval > 0) {
                lastIntervalNanos = interval;
                averageIntervalNanos = averageIntervalNanos == 0
                        ? interval
                        : averageIntervalNanos + INTERVAL_EMA_ALPHA * (interval - averageIntervalNanos);
                maxIntervalNanos = Math.max(maxIntervalNanos, interval);
            }
        }
        lastQuoteNanos = timestampNanos;
        hasLastQuote = true;
    }

    @Override
    public StrategyType type() {
        return StrategyType.ARBITRAGE;
    }

    @Override
    public double inventory() {
        return ledger.position();
    }

    @Override
    public double realizedPnl() {
        return ledger.realizedPnl();
    }

    public double fairValue() {
        return fairValue.fairValue();
    }

    public boolean isFlattenRequested() {
        return flattenRequested;
    }

    public long quotesProcessed() {
        return quotesProcessed;
    }

    public double averageQuoteIntervalNanos() {
        return averageIntervalNanos;
    }

    public long maxQuoteIntervalNanos() {
        return maxIntervalNanos;
    }
}
