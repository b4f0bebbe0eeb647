package com.xinyue.hft.io.output;

import com.xinyue.hft.common.Fill;
import com.xinyue.hft.common.Order;
import com.xinyue.hft.config.PipelineConfig;
import com.xinyue.hft.core.gateway.ExecutionVenue;
import com.xinyue.hft.core.gateway.FillSink;

import java.util.Random;
import java.util.function.LongSupplier;

/**
 * 模拟撮合场所：在 {@link #submit} 调用内同步回报成交。
 * <p>
 * 成交价 = 下单价 × (1 + 滑点)：
 * - 5% 概率出现 ±0.5% 以内的随机大滑点
 * - 其余情况滑点与数量成正比，方向对下单方不利，幅度不超过 1%，保证成交价为正
 * 10% 概率拆成两笔部分成交，两笔数量之和等于下单数量。
 * 成交时间取流水线事件时钟，保证回放结果可复现。
 */
public final class SimulatedVenue implements ExecutionVenue {

    private static final double LARGE_SLIPPAGE_PROBABILITY = 0.05;
    private static final double LARGE_SLIPPAGE_RANGE = 0.01;
    private static final double SIZE_SLIPPAGE_PER_UNIT = 0.001 / 1000.0;
    private static final double MAX_SIZE_SLIPPAGE = LARGE_SLIPPAGE_RANGE;
    private static final double PARTIAL_FILL_PROBABILITY = 0.10;

    private final Random random;
    private final LongSupplier clock;
    private long ordersReceived;
    private long fillsSent;

    public SimulatedVenue(PipelineConfig config, LongSupplier clock) {
        this(config.randomSeed() == null ? new Random() : new Random(config.randomSeed() * 31 + 17), clock);
    }

    public SimulatedVenue(Random random, LongSupplier clock) {
        this.random = random;
        this.clock = clock;
    }

    @Override
    public void submit(long orderId, Order order, FillSink sink) {
        ordersReceived++;
        long now = clock.getAsLong();
        if (random.nextDouble() < PARTIAL_FILL_PROBABILITY) {
            double first = order.quantity() * (0.2 + random.nextDouble() * 0.6);
            double second = order.quantity() - first;
            emit(orderId, order, first, now, sink);
            emit(orderId, order, second, now, sink);
        } else {
            emit(orderId, order, order.quantity(), now, sink);
        }
    }

    private void emit(long orderId, Order order, double quantity, long now, FillSink sink) {
        double price = order.price() * (1.0 + slippage(order));
        fillsSent++;
        sink.onFill(new Fill(orderId, order.side(), quantity, price, now));
    }

    double slippage(Order order) {
        if (random.nextDouble() < LARGE_SLIPPAGE_PROBABILITY) {
            return (random.nextDouble() - 0.5) * LARGE_SLIPPAGE_RANGE;
        }
        return order.side().sign() * Math.min(order.quantity() * SIZE_SLIPPAGE_PER_UNIT, MAX_SIZE_SLIPPAGE);
    }

    public long ordersReceived() {
        return ordersReceived;
    }

    public long fillsSent() {
        return fillsSent;
    }
}
