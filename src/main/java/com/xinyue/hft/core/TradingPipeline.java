package com.xinyue.hft.core;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.xinyue.hft.common.CoreEvent;
import com.xinyue.hft.config.PipelineConfig;
import com.xinyue.hft.core.gateway.ExecutionVenue;
import com.xinyue.hft.core.oms.OrderTracker;
import com.xinyue.hft.infra.PerformanceMonitor;
import com.xinyue.hft.io.EventPublisher;
import com.xinyue.hft.io.MarketDataConnector;
import com.xinyue.hft.io.input.SyntheticMarketDataFeed;
import com.xinyue.hft.io.output.SimulatedVenue;
import com.xinyue.hft.risk.RiskEngine;
import com.xinyue.hft.strategy.StrategyEngine;
import com.xinyue.hft.strategy.StrategyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * 单品种流水线：把行情源、Disruptor 事件通道、热路径处理器和执行场所对接起来。
 * <p>
 * 每个品种独占一条流水线，品种之间不共享任何可变状态。
 */
public final class TradingPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(TradingPipeline.class);

    /**
     * 创建行情源，行情源通过 publisher 写入本流水线。
     */
    @FunctionalInterface
    public interface FeedFactory {
        MarketDataConnector create(PipelineConfig config, EventPublisher publisher);
    }

    /**
     * 创建执行场所，eventClock 为流水线事件时钟。
     */
    @FunctionalInterface
    public interface VenueFactory {
        ExecutionVenue create(PipelineConfig config, LongSupplier eventClock);
    }

    private final PipelineConfig config;
    private final Disruptor<CoreEvent> disruptor;
    private final CoreEventHandler handler;
    private final MarketDataConnector feed;
    private final ExecutionVenue venue;
    private final StrategyEngine strategyEngine;
    private final RiskEngine riskEngine;
    private final PerformanceMonitor monitor;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public TradingPipeline(PipelineConfig config, short symbolId, FeedFactory feedFactory, VenueFactory venueFactory) {
        this.config = config;
        this.strategyEngine = new StrategyEngine(StrategyFactory.create(config));
        this.riskEngine = new RiskEngine(config);
        this.monitor = new PerformanceMonitor(config.symbol());

        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "pipeline-" + config.symbol());
            t.setDaemon(true);
            return t;
        };
        EventClock clock = new EventClock();
        this.disruptor = bootstrapDisruptor(new CoreEventFactory(), config.ringBufferSize(), threadFactory);
        EventPublisher publisher = new EventPublisher(disruptor.getRingBuffer(), symbolId);
        this.venue = venueFactory.create(config, clock);
        this.handler = new CoreEventHandler(config.symbol(), strategyEngine, riskEngine, venue,
                new OrderTracker(), monitor, publisher, clock);
        disruptor.handleEventsWith(handler);
        this.feed = feedFactory.create(config, publisher);
    }

    /**
     * 默认组合：合成行情源 + 同步模拟撮合。
     */
    public static TradingPipeline simulated(PipelineConfig config, short symbolId) {
        return new TradingPipeline(config, symbolId, SyntheticMarketDataFeed::new, SimulatedVenue::new);
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            LOG.warn("[{}] 流水线已启动", config.symbol());
            return;
        }
        disruptor.start();
        feed.start();
        LOG.info("[{}] 流水线启动: strategy={}, ringBuffer={}", config.symbol(), config.strategyType(),
                config.ringBufferSize());
    }

    /**
     * 停止行情源并关闭通道，不等待排空。
     */
    public void stop() {
        feed.stop();
    }

    /**
     * 等待排空；排空后释放场所和消费线程。
     *
     * @return 超时前是否排空
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        boolean drained = handler.awaitDrained(timeout, unit);
        if (drained) {
            shutdown();
        }
        return drained;
    }

    /**
     * 停止行情、等待排空、释放资源。超时未排空时强制停止消费线程。
     *
     * @return 超时前是否排空
     */
    public boolean close(long timeout, TimeUnit unit) throws InterruptedException {
        stop();
        boolean drained = handler.awaitDrained(timeout, unit);
        if (!drained) {
            LOG.warn("[{}] {} {} 内未排空，仍有 {} 笔在途订单", config.symbol(), timeout, unit,
                    handler.orderTracker().inFlightCount());
        }
        shutdown();
        return drained;
    }

    private void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        venue.close();
        if (!started.get()) {
            return;
        }
        try {
            disruptor.shutdown(1, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            LOG.warn("[{}] Disruptor 关闭超时，强制停止", config.symbol());
            disruptor.halt();
        }
    }

    public static Disruptor<CoreEvent> bootstrapDisruptor(CoreEventFactory factory,
                                                          int ringBufferSize,
                                                          ThreadFactory threadFactory) {
        return new Disruptor<>(factory, ringBufferSize, threadFactory, ProducerType.MULTI, new BlockingWaitStrategy());
    }

    public RingBuffer<CoreEvent> ringBuffer() {
        return disruptor.getRingBuffer();
    }

    public PipelineConfig config() {
        return config;
    }

    public String symbol() {
        return config.symbol();
    }

    public boolean isDrained() {
        return handler.isDrained();
    }

    public PerformanceMonitor monitor() {
        return monitor;
    }

    public RiskEngine riskEngine() {
        return riskEngine;
    }

    public StrategyEngine strategyEngine() {
        return strategyEngine;
    }

    public MarketDataConnector feed() {
        return feed;
    }
}
