package com.xinyue.hft.io.input;

import com.xinyue.hft.common.Quote;
import com.xinyue.hft.io.EventPublisher;
import com.xinyue.hft.io.MarketDataConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 回放一段录制好的报价序列，发完后关闭通道。用于确定性重放和集成测试。
 */
public final class ReplayMarketDataFeed implements MarketDataConnector {

    private static final Logger LOG = LoggerFactory.getLogger(ReplayMarketDataFeed.class);

    private final String symbol;
    private final List<Quote> quotes;
    private final EventPublisher publisher;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private Thread replayThread;

    public ReplayMarketDataFeed(String symbol, List<Quote> quotes, EventPublisher publisher) {
        this.symbol = symbol;
        this.quotes = List.copyOf(quotes);
        this.publisher = publisher;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            LOG.warn("[{}] 回放源不可重复启动", symbol);
            return;
        }
        running.set(true);
        replayThread = new Thread(() -> {
            int published = 0;
            try {
                for (Quote quote : quotes) {
                    if (!running.get()) {
                        break;
                    }
                    publisher.publishQuote(quote);
                    published++;
                }
            } finally {
                closeChannel();
                running.set(false);
                LOG.info("[{}] 回放结束，共 {}/{} 笔报价", symbol, published, quotes.size());
            }
        }, "md-replay-" + symbol);
        replayThread.setDaemon(true);
        replayThread.start();
    }

    @Override
    public void stop() {
        running.set(false);
        Thread thread = replayThread;
        if (thread == null) {
            closeChannel();
            return;
        }
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
