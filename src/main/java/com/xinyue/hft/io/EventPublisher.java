package com.xinyue.hft.io;

import com.lmax.disruptor.RingBuffer;
import com.xinyue.hft.common.CoreEvent;
import com.xinyue.hft.common.CoreEventType;
import com.xinyue.hft.common.Fill;
import com.xinyue.hft.common.Quote;

/**
 * 把行情、成交、下单失败和通道关闭信号写入流水线的 RingBuffer。
 * <p>
 * RingBuffer 就是有界通道：写满时 {@code next()} 阻塞生产者，不丢弃任何事件。
 * 允许多个生产者线程（行情源、异步场所）并发调用，每个生产者自身的顺序保持不变。
 */
public final class EventPublisher {

    private final RingBuffer<CoreEvent> ringBuffer;
    private final short symbolId;

    public EventPublisher(RingBuffer<CoreEvent> ringBuffer, short symbolId) {
        this.ringBuffer = ringBuffer;
        this.symbolId = symbolId;
    }

    public void publishQuote(Quote quote) {
        long seq = ringBuffer.next();
        try {
            CoreEvent event = ringBuffer.get(seq);
            event.reset();
            event.setQuote(quote);
            event.symbolId = symbolId;
            event.recvTime = System.nanoTime();
        } finally {
            ringBuffer.publish(seq);
        }
    }

    public void publishFill(Fill fill) {
        long seq = ringBuffer.next();
        try {
            CoreEvent event = ringBuffer.get(seq);
            event.reset();
            event.setFill(fill);
            event.symbolId = symbolId;
            event.recvTime = System.nanoTime();
        } finally {
            ringBuffer.publish(seq);
        }
    }

    /**
     * 通知消费者场所无法完成该订单。
     */
    public void publishSubmitFailure(long orderId) {
        long seq = ringBuffer.next();
        try {
            CoreEvent event = ringBuffer.get(seq);
            event.reset();
            event.type = CoreEventType.SUBMIT_FAILED;
            event.orderId = orderId;
            event.symbolId = symbolId;
            event.recvTime = System.nanoTime();
        } finally {
            ringBuffer.publish(seq);
        }
    }

    /**
     * 通知消费者上游行情通道已关闭。
     */
    public void publishEndOfStream() {
        long seq = ringBuffer.next();
        try {
            CoreEvent event = ringBuffer.get(seq);
            event.reset();
            event.type = CoreEventType.END_OF_STREAM;
            event.symbolId = symbolId;
            event.recvTime = System.nanoTime();
        } finally {
            ringBuffer.publish(seq);
        }
    }
}
