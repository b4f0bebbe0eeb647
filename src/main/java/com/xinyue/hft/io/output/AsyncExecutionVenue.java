package com.xinyue.hft.io.output;

import com.xinyue.hft.common.Order;
import com.xinyue.hft.core.gateway.ExecutionVenue;
import com.xinyue.hft.core.gateway.FillSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 把任意场所包装成异步场所：下单立即返回，成交在独立的回报线程上产生。
 * <p>
 * 回报线程通过 {@link FillSink} 把成交写回流水线通道，模拟真实交易所的回报链路。
 * 被包装场所在回报线程上抛出的异常转成 {@link FillSink#onSubmitFailed} 回报。
 */
public final class AsyncExecutionVenue implements ExecutionVenue {

    private static final Logger LOG = LoggerFactory.getLogger(AsyncExecutionVenue.class);

    private final ExecutionVenue delegate;
    private final ExecutorService executor;
    private final String name;

    public AsyncExecutionVenue(String symbol, ExecutionVenue delegate) {
        this.delegate = delegate;
        this.name = "venue-" + symbol;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void submit(long orderId, Order order, FillSink sink) {
        try {
            executor.execute(() -> submitOnVenueThread(orderId, order, sink));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException(name + " 已关闭，无法接收订单 " + orderId, e);
        }
    }

    private void submitOnVenueThread(long orderId, Order order, FillSink sink) {
        try {
            delegate.submit(orderId, order, sink);
        } catch (RuntimeException e) {
            LOG.error("[{}] 订单 #{} 下单失败: {} {} @ {}", name, orderId, order.side(), order.quantity(), order.price(), e);
            sink.onSubmitFailed(orderId, e);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("[{}] 回报线程未在 5 秒内退出，强制关闭", name);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        delegate.close();
    }
}
