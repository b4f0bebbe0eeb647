package com.xinyue.hft.io.input;

import com.xinyue.hft.common.Quote;
import com.xinyue.hft.config.PipelineConfig;
import com.xinyue.hft.io.EventPublisher;
import com.xinyue.hft.io.MarketDataConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 合成行情源：按固定 tick 间隔驱动 {@link SyntheticQuoteGenerator}，把报价写入流水线。
 * <p>
 * max_ticks 大于 0 时发完指定数量后自动关闭通道；否则一直运行到 {@link #stop()}。
 */
public final class SyntheticMarketDataFeed implements MarketDataConnector {

    private static final Logger LOG = LoggerFactory.getLogger(SyntheticMarketDataFeed.class);

    private final String symbol;
    private final SyntheticQuoteGenerator generator;
    private final EventPublisher publisher;
    private final long tickIntervalMs;
    private final long maxTicks;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private Thread feedThread;

    public SyntheticMarketDataFeed(PipelineConfig config, EventPublisher publisher) {
        this(config, new SyntheticQuoteGenerator(config), publisher);
    }

    public SyntheticMarketDataFeed(PipelineConfig config, SyntheticQuoteGenerator generator, EventPublisher publisher) {
        this.symbol = config.symbol();
        this.generator = generator;
        this.publisher = publisher;
        this.tickIntervalMs = config.tickIntervalMs();
        this.maxTicks = config.maxTicks();
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            LOG.warn("[{}] 行情源不可重复启动", symbol);
            return;
        }
        running.set(true);
        feedThread = new Thread(this::runLoop, "md-feed-" + symbol);
        feedThread.setDaemon(true);
        feedThread.start();
    }

    private void runLoop() {
        LOG.info("[{}] 合成行情源启动，tick 间隔 {}ms，最大 tick 数 {}", symbol, tickIntervalMs,
                maxTicks == 0 ? "无限" : maxTicks);
        long published = 0;
        try {
            while (running.get() && (maxTicks == 0 || published < maxTicks)) {
                Quote quote = generator.next(System.nanoTime());
                publisher.publishQuote(quote);
                published++;
                TimeUnit.MILLISECONDS.sleep(tickIntervalMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("[{}] 行情源被中断", symbol);
        } finally {
            closeChannel();
            running.set(false);
            LOG.info("[{}] 行情源停止，共发布 {} 笔报价，跳跃事件 {} 次", symbol, published, generator.jumps());
        }
    }

    @Override
    public void stop() {
        running.set(false);
        Thread thread = feedThread;
        if (thread == null) {
            // 从未启动过，直接关闭通道
            closeChannel();
            return;
        }
        thread.interrupt();
        try {
            thread.join(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void closeChannel() {
        if (closed.compareAndSet(false, true)) {
            publisher.publishEndOfStream();
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }
}
