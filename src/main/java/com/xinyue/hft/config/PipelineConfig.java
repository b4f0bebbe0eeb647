package com.xinyue.hft.config;

import java.util.ArrayList;
import java.util.List;

/**
 * 单品种流水线的不可变配置。
 * <p>
 * 启动时构造一次，之后只读，按引用共享给风控、策略、行情源和场所。
 * 任何字段非法都会在 {@link Builder#build()} 时抛出 {@link IllegalArgumentException}，流水线不会启动。
 */
public final class PipelineConfig {

    // === 标识 ===
    private final String symbol;
    private final StrategyType strategyType;

    // === 风控 ===
    private final double maxPosition;
    private final int maxOrdersPerSecond;
    private final double maxOrderValue;
    private final double maxDrawdown;
    private final double circuitBreakerPct;
    private final long circuitBreakerDurationMs;
    private final PnlMode pnlMode;

    // === 行情节奏 ===
    private final long tickIntervalMs;
    private final double tickSize;
    private final double initialPrice;
    private final long maxTicks;          // 0 表示无限
    private final Long randomSeed;        // null 表示不固定随机种子

    // === 引擎 ===
    private final int ringBufferSize;

    // === 策略参数 ===
    private final double orderSize;
    private final double mmBaseSpreadTicks;
    private final double mmVolatilityMultiplier;
    private final int mmVolatilityWindow;
    private final double mmSkewFactor;
    private final double mmInventoryBand;
    private final double arbMinProfitThreshold;
    private final double arbFairValueAlpha;
    private final int arbWarmupQuotes;
    private final double arbPositionReduceRatio;

    private PipelineConfig(Builder b) {
        this.symbol = b.symbol;
        this.strategyType = b.strategyType;
        this.maxPosition = b.maxPosition;
        this.maxOrdersPerSecond = b.maxOrdersPerSecond;
        this.maxOrderValue = b.maxOrderValue;
        this.maxDrawdown = b.maxDrawdown;
        this.circuitBreakerPct = b.circuitBreakerPct;
        this.circuitBreakerDurationMs = b.circuitBreakerDurationMs;
        this.pnlMode = b.pnlMode;
        this.tickIntervalMs = b.tickIntervalMs;
        this.tickSize = b.tickSize;
        this.initialPrice = b.initialPrice;
        this.maxTicks = b.maxTicks;
        this.randomSeed = b.randomSeed;
        this.ringBufferSize = b.ringBufferSize;
        this.orderSize = b.orderSize;
        this.mmBaseSpreadTicks = b.mmBaseSpreadTicks;
        this.mmVolatilityMultiplier = b.mmVolatilityMultiplier;
        this.mmVolatilityWindow = b.mmVolatilityWindow;
        this.mmSkewFactor = b.mmSkewFactor;
        this.mmInventoryBand = b.mmInventoryBand;
        this.arbMinProfitThreshold = b.arbMinProfitThreshold;
        this.arbFairValueAlpha = b.arbFairValueAlpha;
        this.arbWarmupQuotes = b.arbWarmupQuotes;
        this.arbPositionReduceRatio = b.arbPositionReduceRatio;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 以当前配置为模板复制出一个 Builder。
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.symbol = symbol;
        b.strategyType = strategyType;
        b.maxPosition = maxPosition;
        b.maxOrdersPerSecond = maxOrdersPerSecond;
        b.maxOrderValue = maxOrderValue;
        b.maxDrawdown = maxDrawdown;
        b.circuitBreakerPct = circuitBreakerPct;
        b.circuitBreakerDurationMs = circuitBreakerDurationMs;
        b.pnlMode = pnlMode;
        b.tickIntervalMs = tickIntervalMs;
        b.tickSize = tickSize;
        b.initialPrice = initialPrice;
        b.maxTicks = maxTicks;
        b.randomSeed = randomSeed;
        b.ringBufferSize = ringBufferSize;
        b.orderSize = orderSize;
        b.mmBaseSpreadTicks = mmBaseSpreadTicks;
        b.mmVolatilityMultiplier = mmVolatilityMultiplier;
        b.mmVolatilityWindow = mmVolatilityWindow;
        b.mmSkewFactor = mmSkewFactor;
        b.mmInventoryBand = mmInventoryBand;
        b.arbMinProfitThreshold = arbMinProfitThreshold;
        b.arbFairValueAlpha = arbFairValueAlpha;
        b.arbWarmupQuotes = arbWarmupQuotes;
        b.arbPositionReduceRatio = arbPositionReduceRatio;
        return b;
    }

    public String symbol() {
        return symbol;
    }

    public StrategyType strategyType() {
        return strategyType;
    }

    public double maxPosition() {
        return maxPosition;
    }

    public int maxOrdersPerSecond() {
        return maxOrdersPerSecond;
    }

    public double maxOrderValue() {
        return maxOrderValue;
    }

    public double maxDrawdown() {
        return maxDrawdown;
    }

    public double circuitBreakerPct() {
        return circuitBreakerPct;
    }

    public long circuitBreakerDurationMs() {
        return circuitBreakerDurationMs;
    }

    public PnlMode pnlMode() {
        return pnlMode;
    }

    public long tickIntervalMs() {
        return tickIntervalMs;
    }

    public double tickSize() {
        return tickSize;
    }

    public double initialPrice() {
        return initialPrice;
    }

    public long maxTicks() {
        return maxTicks;
    }

    public Long randomSeed() {
        return randomSeed;
    }

    public int ringBufferSize() {
        return ringBufferSize;
    }

    public double orderSize() {
        return orderSize;
    }

    public double mmBaseSpreadTicks() {
        return mmBaseSpreadTicks;
    }

    public double mmVolatilityMultiplier() {
        return mmVolatilityMultiplier;
    }

    public int mmVolatilityWindow() {
        return mmVolatilityWindow;
    }

    public double mmSkewFactor() {
        return mmSkewFactor;
    }

    public double mmInventoryBand() {
        return mmInventoryBand;
    }

    public double arbMinProfitThreshold() {
        return arbMinProfitThreshold;
    }

    public double arbFairValueAlpha() {
        return arbFairValueAlpha;
    }

    public int arbWarmupQuotes() {
        return arbWarmupQuotes;
    }

    public double arbPositionReduceRatio() {
        return arbPositionReduceRatio;
    }

    @Override
    public String toString() {
        return "PipelineConfig{symbol=" + symbol
                + ", strategy=" + strategyType
                + ", maxPosition=" + maxPosition
                + ", maxOrdersPerSecond=" + maxOrdersPerSecond
                + ", maxOrderValue=" + maxOrderValue
                + ", maxDrawdown=" + maxDrawdown
                + ", circuitBreakerPct=" + circuitBreakerPct
                + ", circuitBreakerDurationMs=" + circuitBreakerDurationMs
                + ", pnlMode=" + pnlMode
                + ", tickIntervalMs=" + tickIntervalMs
                + ", tickSize=" + tickSize
                + ", maxTicks=" + maxTicks
                + '}';
    }

    /**
     * 默认值：
     * <ul>
     *     <li>风控：最大仓位 10000，每秒 50000 单，单笔金额上限 100000，最大回撤 1000，5% 跳变熔断 60 秒</li>
     *     <li>行情：初始价 100，最小价位 0.01，每 1 毫秒一笔，不限笔数，RingBuffer 1024</li>
     *     <li>策略：做市，基础下单量 10，平均成本法盈亏</li>
     * </ul>
     */
    public static final class Builder {
        private String symbol = "XYZ";
        private StrategyType strategyType = StrategyType.MARKET_MAKING;
        private double maxPosition = 10_000.0;
        private int maxOrdersPerSecond = 50_000;
        private double maxOrderValue = 100_000.0;
        private double maxDrawdown = 1_000.0;
        private double circuitBreakerPct = 5.0;
        private long circuitBreakerDurationMs = 60_000L;
        private PnlMode pnlMode = PnlMode.AVERAGE_COST;
        private long tickIntervalMs = 1L;
        private double tickSize = 0.01;
        private double initialPrice = 100.0;
        private long maxTicks = 0L;
        private Long randomSeed;
        private int ringBufferSize = 1024;
        private double orderSize = 10.0;
        private double mmBaseSpreadTicks = 2.0;
        private double mmVolatilityMultiplier = 100.0;
        private int mmVolatilityWindow = 100;
        private double mmSkewFactor = 1.0;
        private double mmInventoryBand = 0.1;
        private double arbMinProfitThreshold = 0.01;
        private double arbFairValueAlpha = 0.05;
        private int arbWarmupQuotes = 20;
        private double arbPositionReduceRatio = 0.8;

        private Builder() {
        }

        public Builder symbol(String symbol) {
            this.symbol = symbol;
            return this;
        }

        public Builder strategyType(StrategyType strategyType) {
            this.strategyType = strategyType;
            return this;
        }

        public Builder maxPosition(double maxPosition) {
            this.maxPosition = maxPosition;
            return this;
        }

        public Builder maxOrdersPerSecond(int maxOrdersPerSecond) {
            this.maxOrdersPerSecond = maxOrdersPerSecond;
            return this;
        }

        public Builder maxOrderValue(double maxOrderValue) {
            this.maxOrderValue = maxOrderValue;
            return this;
        }

        public Builder maxDrawdown(double maxDrawdown) {
            this.maxDrawdown = maxDrawdown;
            return this;
        }

        public Builder circuitBreakerPct(double circuitBreakerPct) {
            this.circuitBreakerPct = circuitBreakerPct;
            return this;
        }

        public Builder circuitBreakerDurationMs(long circuitBreakerDurationMs) {
            this.circuitBreakerDurationMs = circuitBreakerDurationMs;
            return this;
        }

        public Builder pnlMode(PnlMode pnlMode) {
            this.pnlMode = pnlMode;
            return this;
        }

        public Builder tickIntervalMs(long tickIntervalMs) {
            this.tickIntervalMs = tickIntervalMs;
            return this;
        }

        public Builder tickSize(double tickSize) {
            this.tickSize = tickSize;
            return this;
        }

        public Builder initialPrice(double initialPrice) {
            this.initialPrice = initialPrice;
            return this;
        }

        public Builder maxTicks(long maxTicks) {
            this.maxTicks = maxTicks;
            return this;
        }

        public Builder randomSeed(Long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public Builder ringBufferSize(int ringBufferSize) {
            this.ringBufferSize = ringBufferSize;
            return this;
        }

        public Builder orderSize(double orderSize) {
            this.orderSize = orderSize;
            return this;
        }

        public Builder mmBaseSpreadTicks(double mmBaseSpreadTicks) {
            this.mmBaseSpreadTicks = mmBaseSpreadTicks;
            return this;
        }

        public Builder mmVolatilityMultiplier(double mmVolatilityMultiplier) {
            this.mmVolatilityMultiplier = mmVolatilityMultiplier;
            return this;
        }

        public Builder mmVolatilityWindow(int mmVolatilityWindow) {
            this.mmVolatilityWindow = mmVolatilityWindow;
            return this;
        }

        public Builder mmSkewFactor(double mmSkewFactor) {
            this.mmSkewFactor = mmSkewFactor;
            return this;
        }

        public Builder mmInventoryBand(double mmInventoryBand) {
            this.mmInventoryBand = mmInventoryBand;
            return this;
        }

        public Builder arbMinProfitThreshold(double arbMinProfitThreshold) {
            this.arbMinProfitThreshold = arbMinProfitThreshold;
            return this;
        }

        public Builder arbFairValueAlpha(double arbFairValueAlpha) {
            this.arbFairValueAlpha = arbFairValueAlpha;
            return this;
        }

        public Builder arbWarmupQuotes(int arbWarmupQuotes) {
            this.arbWarmupQuotes = arbWarmupQuotes;
            return this;
        }

        public Builder arbPositionReduceRatio(double arbPositionReduceRatio) {
            this.arbPositionReduceRatio = arbPositionReduceRatio;
            return this;
        }

        /**
         * 校验全部字段，收集所有错误后一次性抛出。
         */
        public PipelineConfig build() {
            List<String> errors = new ArrayList<>();
            if (symbol == null || symbol.isBlank()) {
                errors.add("symbol 不能为空");
            }
            if (strategyType == null) {
                errors.add("strategy 不能为空");
            }
            if (pnlMode == null) {
                errors.add("pnl_mode 不能为空");
            }
            requirePositive(errors, "max_position", maxPosition);
            if (maxOrdersPerSecond <= 0) {
                errors.add("max_orders_per_second 必须大于 0: " + maxOrdersPerSecond);
            }
            requirePositive(errors, "max_order_value", maxOrderValue);
            requirePositive(errors, "max_drawdown", maxDrawdown);
            requirePositive(errors, "circuit_breaker_pct", circuitBreakerPct);
            if (circuitBreakerDurationMs < 0) {
                errors.add("circuit_breaker_duration_ms 不能为负: " + circuitBreakerDurationMs);
            }
            if (tickIntervalMs <= 0) {
                errors.add("tick_interval_ms 必须大于 0: " + tickIntervalMs);
            }
            requirePositive(errors, "tick_size", tickSize);
            requirePositive(errors, "initial_price", initialPrice);
            if (maxTicks < 0) {
                errors.add("max_ticks 不能为负: " + maxTicks);
            }
            if (ringBufferSize <= 0 || Integer.bitCount(ringBufferSize) != 1) {
                errors.add("ring_buffer_size 必须是 2 的幂: " + ringBufferSize);
            }
            requirePositive(errors, "order_size", orderSize);
            requirePositive(errors, "mm.base_spread_ticks", mmBaseSpreadTicks);
            requireNonNegative(errors, "mm.volatility_multiplier", mmVolatilityMultiplier);
            if (mmVolatilityWindow < 2) {
                errors.add("mm.volatility_window 至少为 2: " + mmVolatilityWindow);
            }
            requireNonNegative(errors, "mm.skew_factor", mmSkewFactor);
            if (!(mmInventoryBand >= 0 && mmInventoryBand < 1)) {
                errors.add("mm.inventory_band 必须在 [0, 1) 之间: " + mmInventoryBand);
            }
            requirePositive(errors, "arb.min_profit_threshold", arbMinProfitThreshold);
            if (!(arbFairValueAlpha > 0 && arbFairValueAlpha <= 1)) {
                errors.add("arb.fair_value_alpha 必须在 (0, 1] 之间: " + arbFairValueAlpha);
            }
            if (arbWarmupQuotes < 1) {
                errors.add("arb.warmup_quotes 至少为 1: " + arbWarmupQuotes);
            }
            if (!(arbPositionReduceRatio > 0 && arbPositionReduceRatio <= 1)) {
                errors.add("arb.position_reduce_ratio 必须在 (0, 1] 之间: " + arbPositionReduceRatio);
            }
            if (!errors.isEmpty()) {
                throw new IllegalArgumentException("流水线配置非法 [" + symbol + "]: " + String.join("; ", errors));
            }
            return new PipelineConfig(this);
        }

        private static void requirePositive(List<String> errors, String key, double value) {
            if (!(value > 0) || Double.isInfinite(value)) {
                errors.add(key + " 必须大于 0: " + value);
            }
        }

        private static void requireNonNegative(List<String> errors, String key, double value) {
            if (!(value >= 0) || Double.isInfinite(value)) {
                errors.add(key + " 不能为负: " + value);
            }
        }
    }
}
