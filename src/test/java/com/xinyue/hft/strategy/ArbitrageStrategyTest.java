package com.xinyue.hft.strategy;

import com.xinyue.hft.common.Fill;
import com.xinyue.hft.common.Order;
import com.xinyue.hft.common.Quote;
import com.xinyue.hft.common.Side;
import com.xinyue.hft.config.PipelineConfig;
import com.xinyue.hft.config.StrategyType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("统计套利策略")
class ArbitrageStrategyTest {

    private static final long MS = 1_000_000L;

    private ArbitrageStrategy strategy;
    private long ts;

    private static PipelineConfig config() {
        return PipelineConfig.builder()
                .strategyType(StrategyType.ARBITRAGE)
                .maxPosition(100)
                .orderSize(10)
                .arbMinProfitThreshold(0.1)
                .arbFairValueAlpha(0.5)
                .arbWarmupQuotes(3)
                .arbPositionReduceRatio(0.8)
                .build();
    }

    @BeforeEach
    void setUp() {
        strategy = new ArbitrageStrategy(config());
        ts = 0;
    }

    private Order quote(double mid) {
        ts += MS;
        return strategy.onQuote(new Quote(mid - 0.5, mid + 0.5, ts));
    }

    @Test
    @DisplayName("预热完成前不下单")
    void testWarmup() {
        assertNull(quote(100));
        assertNull(quote(100));
        assertNull(quote(120));
        assertEquals(3, strategy.quotesProcessed());
    }

    @Test
    @DisplayName("低估买入吃卖一，数量随偏离放大、随仓位缩小")
    void testDeviationSignalAndSizing() {
        quote(100);
        quote(100);
        quote(100);

        Order buy = quote(99);
        assertNotNull(buy);
        assertEquals(Side.BUY, buy.side());
        assertEquals(99.5, buy.price(), 1e-9);
        // 10 × min(1 / 0.1, 5) × 1 × 1
        assertEquals(50, buy.quantity(), 1e-9);
        assertEquals(99.5, strategy.fairValue(), 1e-9);

        strategy.onFill(new Fill(1, Side.BUY, 50, 99.5, ts));
        Order second = quote(99);
        assertEquals(Side.BUY, second.side());
        // 仓位占用 50% → 数量减半
        assertEquals(25, second.quantity(), 1e-9);
    }

    @Test
    @DisplayName("高估卖出吃买一")
    void testOverpricedSells() {
        quote(100);
        quote(100);
        quote(100);
        Order sell = quote(100.3);
        assertEquals(Side.SELL, sell.side());
        assertEquals(99.8, sell.price(), 1e-9);
    }

    @Test
    @DisplayName("偏离不超过阈值时不下单")
    void testWithinThreshold() {
        quote(100);
        quote(100);
        quote(100);
        assertNull(quote(100.05));
    }

    @Test
    @DisplayName("仓位逼近上限后无视偏离信号直接减仓")
    void testPositionFirstOverride() {
        quote(100);
        quote(100);
        quote(100);
        strategy.onFill(new Fill(1, Side.BUY, 80, 100, ts));
        assertTrue(strategy.isFlattenRequested());

        // 偏离信号要求继续买入，但仓位优先
        Order order = quote(98);
        assertEquals(Side.SELL, order.side());
        assertEquals(10, order.quantity(), 1e-9);
        assertEquals(97.5, order.price(), 1e-9);

        strategy.onFill(new Fill(2, Side.SELL, 10, 97.5, ts));
        assertFalse(strategy.isFlattenRequested());
        assertEquals(70, strategy.inventory(), 1e-9);
    }

    @Test
    @DisplayName("行情间隔变短时放大数量，变长时缩小，限制在 [0.5, 1.5]")
    void testLatencyFactor() {
        assertEquals(1.0, strategy.latencyFactor());
        strategy.onQuote(new Quote(99.5, 100.5, 0));
        strategy.onQuote(new Quote(99.5, 100.5, 1_000));
        strategy.onQuote(new Quote(99.5, 100.5, 2_000));
        assertEquals(1.0, strategy.latencyFactor(), 1e-9);

        strategy.onQuote(new Quote(99.5, 100.5, 2_500));
        assertEquals(1.5, strategy.latencyFactor(), 1e-9);
        assertEquals(950, strategy.averageQuoteIntervalNanos(), 1e-9);

        strategy.onQuote(new Quote(99.5, 100.5, 6_500));
        assertEquals(0.5, strategy.latencyFactor(), 1e-9);
        assertEquals(4_000, strategy.maxQuoteIntervalNanos());
    }

    @Test
    @DisplayName("外部推送的公允价值：收到价格前不下单，之后按外部价格判断偏离且不被行情改写")
    void testExternalFairValue() {
        ExternalFairValue external = new ExternalFairValue();
        strategy = new ArbitrageStrategy(config(), external);

        assertNull(quote(100), "尚无外部价格");
        external.update(101);
        assertEquals(101, strategy.fairValue(), 1e-9);

        Order buy = quote(100);
        assertNotNull(buy);
        assertEquals(Side.BUY, buy.side());
        assertEquals(100.5, buy.price(), 1e-9);
        // 10 × min(1 / 0.1, 5) × 1 × 1
        assertEquals(50, buy.quantity(), 1e-9);
        assertEquals(101, strategy.fairValue(), 1e-9, "行情不改写外部公允价值");

        external.update(100.02);
        assertNull(quote(100), "偏离回到阈值以内");
        assertThrows(IllegalArgumentException.class, () -> external.update(0));
    }
}
