package com.xinyue.hft.io.input;

import com.xinyue.hft.common.Quote;
import com.xinyue.hft.config.PipelineConfig;

import java.util.Random;

/**
 * 合成行情的价格模型。
 * <p>
 * mid += mid × (噪声 × 波动率 + 趋势 + 周期)：
 * - 波动率做缓慢均值回归的随机游走（波动率聚集）
 * - 趋势缓慢漂移且有界
 * - 周期为有界的正弦项
 * - 低概率的跳跃事件以较大步长冲击价格
 * 买卖价为 mid ∓ 半个价差，价差随当前波动率放大。状态只在内部演进，不可重置。
 */
public final class SyntheticQuoteGenerator {

    private static final double MIN_VOLATILITY = 0.001;
    private static final double MAX_VOLATILITY = 0.1;
    private static final double LONG_RUN_VOLATILITY = 0.01;
    private static final double VOLATILITY_REVERSION = 0.01;
    private static final double VOLATILITY_STEP = 0.001;
    private static final double TREND_STEP = 0.0001;
    private static final double TREND_DECAY = 0.99;
    private static final double MAX_TREND = 0.001;
    private static final double CYCLE_STEP = 0.1;
    private static final double CYCLE_AMPLITUDE = 0.0001;
    private static final int JUMP_ODDS = 1000;       // 每 tick 1/1000 概率
    private static final double MAX_JUMP = 0.05;     // 跳跃幅度 ±2.5%

    private final Random random;
    private final double tickSize;
    private final double minMid;

    private double mid;
    private double volatility = LONG_RUN_VOLATILITY;
    private double trend;
    private double cycle;
    private long ticks;
    private long jumps;

    public SyntheticQuoteGenerator(PipelineConfig config) {
        this(config.initialPrice(), config.tickSize(),
                config.randomSeed() == null ? new Random() : new Random(config.randomSeed()));
    }

    public SyntheticQuoteGenerator(double initialPrice, double tickSize, Random random) {
        this.mid = initialPrice;
        this.tickSize = tickSize;
        this.minMid = tickSize * 10;
        this.random = random;
    }

    public Quote next(long timestampNanos) {
        ticks++;

        volatility += VOLATILITY_REVERSION * (LONG_RUN_VOLATILITY - volatility)
                + (random.nextDouble() - 0.5) * VOLATILITY_STEP;
        volatility = clamp(volatility, MIN_VOLATILITY, MAX_VOLATILITY);

        trend = trend * TREND_DECAY + (random.nextDouble() - 0.5) * TREND_STEP;
        trend = clamp(trend, -MAX_TREND, MAX_TREND);

        cycle += CYCLE_STEP;
        double cycleEffect = Math.sin(cycle * 0.01) * CYCLE_AMPLITUDE;

        double change = (random.nextDouble() - 0.5) * volatility + trend + cycleEffect;
        mid += change * mid;

        if (random.nextInt(JUMP_ODDS) == 0) {
            mid *= 1.0 + (random.nextDouble() - 0.5) * MAX_JUMP;
            jumps++;
        }
        mid = Math.max(mid, minMid);

        double halfSpread = tickSize * (1.0 + volatility * 100.0) / 2.0;
        return new Quote(mid - halfSpread, mid + halfSpread, timestampNanos);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public double mid() {
        return mid;
    }

    public double volatility() {
        return volatility;
    }

    public long ticks() {
        return ticks;
    }

    public long jumps() {
        return jumps;
    }
}
