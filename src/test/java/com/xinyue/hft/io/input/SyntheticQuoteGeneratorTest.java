package com.xinyue.hft.io.input;

import com.xinyue.hft.common.Quote;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("合成行情价格模型")
class SyntheticQuoteGeneratorTest {

    @Test
    @DisplayName("相同随机种子产生相同的报价序列")
    void testSeededDeterminism() {
        SyntheticQuoteGenerator a = new SyntheticQuoteGenerator(100, 0.01, new Random(42));
        SyntheticQuoteGenerator b = new SyntheticQuoteGenerator(100, 0.01, new Random(42));
        for (int i = 0; i < 1_000; i++) {
            assertEquals(a.next(i), b.next(i));
        }
    }

    @Test
    @DisplayName("长时间运行后报价始终合法，波动率在区间内")
    void testLongRunStaysValid() {
        SyntheticQuoteGenerator generator = new SyntheticQuoteGenerator(100, 0.01, new Random(7));
        for (int i = 0; i < 50_000; i++) {
            Quote quote = generator.next(i);
            assertTrue(quote.bid() > 0);
            assertTrue(quote.spread() >= 0.01 - 1e-12);
            assertEquals(i, quote.timestampNanos());
            assertTrue(generator.volatility() >= 0.001 && generator.volatility() <= 0.1);
        }
        assertEquals(50_000, generator.ticks());
        assertTrue(generator.jumps() > 0, "五万个 tick 内应出现跳跃事件");
    }

    @Test
    @DisplayName("价差随波动率放大")
    void testSpreadTracksVolatility() {
        SyntheticQuoteGenerator generator = new SyntheticQuoteGenerator(100, 0.01, new Random(1));
        Quote quote = generator.next(0);
        assertEquals(0.01 * (1 + generator.volatility() * 100), quote.spread(), 1e-9);
        assertEquals(generator.mid(), quote.mid(), 1e-9);
    }
}
