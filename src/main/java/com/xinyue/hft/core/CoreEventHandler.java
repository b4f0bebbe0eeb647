package com.xinyue.hft.core;

import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.LifecycleAware;
import com.xinyue.hft.common.CoreEvent;
import com.xinyue.hft.common.Fill;
import com.xinyue.hft.common.Order;
import com.xinyue.hft.common.Quote;
import com.xinyue.hft.common.Side;
import com.xinyue.hft.core.gateway.ExecutionVenue;
import com.xinyue.hft.core.gateway.FillSink;
import com.xinyue.hft.core.oms.OrderTracker;
import com.xinyue.hft.infra.PerformanceMonitor;
import com.xinyue.hft.io.EventPublisher;
import com.xinyue.hft.risk.RiskDecision;
import com.xinyue.hft.risk.RiskEngine;
import com.xinyue.hft.strategy.StrategyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 单品种流水线的单线程热路径。
 * <p>
 * 报价：风控观察价格 → 策略决策 → 风控准入 → 下单到场所。
 * 成交：订单追踪 → 策略持仓 → 风控持仓与盈亏 → 性能统计。
 * <p>
 * 消费线程上同步回报的成交先放入本地队列，当前事件处理完再依次处理，
 * 避免消费线程向自己的 RingBuffer 写入而卡死；其他线程的成交写回 RingBuffer。
 * 场所下单失败（同步抛出或经 {@link FillSink#onSubmitFailed} 回报）时撤销在途订单，并归还未成交部分的预占仓位。
 * 通道关闭且没有在途订单后才视为排空完成。
 */
public final class CoreEventHandler implements EventHandler<CoreEvent>, LifecycleAware {

    private static final Logger LOG = LoggerFactory.getLogger(CoreEventHandler.class);

    private final String symbol;
    private final StrategyEngine strategyEngine;
    private final RiskEngine riskEngine;
    private final ExecutionVenue venue;
    private final OrderTracker orderTracker;
    private final PerformanceMonitor monitor;
    private final EventPublisher publisher;
    private final EventClock clock;

    private final ArrayDeque<Fill> localFills = new ArrayDeque<>();
    private final FillSink fillSink = new FillSink() {
        @Override
        public void onFill(Fill fill) {
            acceptFill(fill);
        }

        @Override
        public void onSubmitFailed(long orderId, Throwable cause) {
            acceptSubmitFailure(orderId, cause);
        }
    };
    private final CountDownLatch drained = new CountDownLatch(1);

    private volatile Thread consumerThread;
    private boolean streamClosed;

    public CoreEventHandler(String symbol,
                            StrategyEngine strategyEngine,
                            RiskEngine riskEngine,
                            ExecutionVenue venue,
                            OrderTracker orderTracker,
                            PerformanceMonitor monitor,
                            EventPublisher publisher,
                            EventClock clock) {
        this.symbol = symbol;
        this.strategyEngine = strategyEngine;
        this.riskEngine = riskEngine;
        this.venue = venue;
        this.orderTracker = orderTracker;
        this.monitor = monitor;
        this.publisher = publisher;
        this.clock = clock;
    }

    @Override
    public void onStart() {
        consumerThread = Thread.currentThread();
    }

    @Override
    public void onShutdown() {
        LOG.info("[{}] 消费线程退出，完成订单 {} 笔，在途 {} 笔", symbol,
                orderTracker.completedOrders(), orderTracker.inFlightCount());
    }

    @Override
    public void onEvent(CoreEvent event, long sequence, boolean endOfBatch) {
        try {
            switch (event.type) {
                case MARKET_DATA_TICK -> handleQuote(event.toQuote());
                case EXECUTION_REPORT -> handleFill(event.toFill());
                case SUBMIT_FAILED -> handleSubmitFailure(event.orderId);
                case END_OF_STREAM -> handleEndOfStream();
                default -> {
                }
            }
            drainLocalFills();
        } catch (Throwable t) {
            LOG.error("[{}] 事件处理异常，触发紧急停止: type={}, seq={}", symbol, event.type, sequence, t);
            strategyEngine.killSwitch();
        } finally {
            event.reset();
            checkDrained();
        }
    }

    private void handleQuote(Quote quote) {
        long startNanos = System.nanoTime();
        clock.advance(quote.timestampNanos());
        monitor.recordQuote();
        riskEngine.onQuote(quote);

        Order order = strategyEngine.onQuote(quote);
        if (order == null) {
            monitor.recordQuoteToDecision(System.nanoTime() - startNanos);
            return;
        }

        RiskDecision decision = riskEngine.check(order);
        monitor.recordQuoteToDecision(System.nanoTime() - startNanos);
        if (!decision.isAccepted()) {
            monitor.recordRejection();
            LOG.info("[{}] 订单被风控拒绝: reason={}, {} {} @ {}", symbol, decision,
                    order.side(), order.quantity(), order.price());
            return;
        }

        long orderId = orderTracker.register(order, System.nanoTime());
        monitor.recordOrder();
        if (LOG.isDebugEnabled()) {
            LOG.debug("[{}] 下单 #{}: {} {} @ {}", symbol, orderId, order.side(), order.quantity(), order.price());
        }
        try {
            venue.submit(orderId, order, fillSink);
        } catch (RuntimeException e) {
            LOG.error("[{}] 订单 #{} 提交到场所失败: {} {} @ {}", symbol, orderId,
                    order.side(), order.quantity(), order.price(), e);
            // 失败前已同步回报的成交先记账，剩余部分才是需要归还的预占
            drainLocalFills();
            handleSubmitFailure(orderId);
        }
    }

    private void handleFill(Fill fill) {
        clock.advance(fill.timestampNanos());
        long submittedAt = orderTracker.onFill(fill);
        if (submittedAt == OrderTracker.UNKNOWN) {
            LOG.warn("[{}] 收到未知订单的成交: {}", symbol, fill);
        } else {
            monitor.recordDecisionToFill(System.nanoTime() - submittedAt);
        }

        strategyEngine.onFill(fill);
        riskEngine.onFill(fill);
        monitor.recordFill();
        monitor.recordPnl(riskEngine.cumulativePnl());
        if (LOG.isDebugEnabled()) {
            LOG.debug("[{}] 成交 #{}: {} {} @ {}，仓位 {}，累计盈亏 {}", symbol, fill.orderId(), fill.side(),
                    fill.quantity(), fill.price(), riskEngine.position(), riskEngine.cumulativePnl());
        }
    }

    private void handleSubmitFailure(long orderId) {
        Side side = orderTracker.side(orderId);
        if (side == null) {
            LOG.warn("[{}] 下单失败回报对应的订单 #{} 已不在途", symbol, orderId);
            return;
        }
        double unfilled = orderTracker.cancel(orderId);
        riskEngine.release(side, unfilled);
        LOG.warn("[{}] 订单 #{} 已撤销，归还未成交数量 {}，风控仓位 {}", symbol, orderId, unfilled, riskEngine.position());
    }

    private void handleEndOfStream() {
        if (streamClosed) {
            return;
        }
        streamClosed = true;
        LOG.info("[{}] 行情通道已关闭，等待 {} 笔在途订单成交", symbol, orderTracker.inFlightCount());
    }

    private void acceptFill(Fill fill) {
        if (Thread.currentThread() == consumerThread) {
            localFills.addLast(fill);
        } else {
            publisher.publishFill(fill);
        }
    }

    private void acceptSubmitFailure(long orderId, Throwable cause) {
        if (Thread.currentThread() == consumerThread) {
            LOG.error("[{}] 订单 #{} 提交到场所失败", symbol, orderId, cause);
            drainLocalFills();
            handleSubmitFailure(orderId);
        } else {
            publisher.publishSubmitFailure(orderId);
        }
    }

    private void drainLocalFills() {
        Fill fill;
        while ((fill = localFills.pollFirst()) != null) {
            handleFill(fill);
        }
    }

    private void checkDrained() {
        if (streamClosed && localFills.isEmpty() && orderTracker.inFlightCount() == 0 && drained.getCount() > 0) {
            drained.countDown();
            LOG.info("[{}] 流水线排空完成，仓位 {}，累计盈亏 {}", symbol, riskEngine.position(), riskEngine.cumulativePnl());
        }
    }

    /**
     * 等待通道关闭且所有在途订单成交。
     */
    public boolean awaitDrained(long timeout, TimeUnit unit) throws InterruptedException {
        return drained.await(timeout, unit);
    }

    public boolean isDrained() {
        return drained.getCount() == 0;
    }

    public boolean isStreamClosed() {
        return streamClosed;
    }

    public FillSink fillSink() {
        return fillSink;
    }

    public OrderTracker orderTracker() {
        return orderTracker;
    }
}
