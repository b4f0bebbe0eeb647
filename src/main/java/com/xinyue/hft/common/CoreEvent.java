package com.xinyue.hft.common;

/**
 * 单品种流水线 RingBuffer 中流转的核心事件载体。
 * <p>
 * 特性：
 * 1. 预分配内存，由 Disruptor 启动时一次性创建
 * 2. 联合体模式：同一个对象复用于行情和成交两种场景
 * 3. 公有字段，生产者直接写入
 */
public final class CoreEvent {

    // === 元数据 ===
    public CoreEventType type = CoreEventType.NONE;
    public long timestamp;      // 事件时间（纳秒）
    public long recvTime;       // 写入 RingBuffer 的本地时间（System.nanoTime）
    public short symbolId;      // 品种 ID

    // === 行情数据 ===
    public double bid;
    public double ask;

    // === 成交数据 ===
    public long orderId;
    public Side side;
    public double quantity;
    public double price;

    /**
     * 消费完成后调用，防止脏数据污染下一轮。
     */
    public void reset() {
        type = CoreEventType.NONE;
        timestamp = 0;
        recvTime = 0;
        symbolId = 0;
        bid = 0;
        ask = 0;
        orderId = 0;
        side = null;
        quantity = 0;
        price = 0;
    }

    public void setQuote(Quote quote) {
        this.type = CoreEventType.MARKET_DATA_TICK;
        this.timestamp = quote.timestampNanos();
        this.bid = quote.bid();
        this.ask = quote.ask();
    }

    public void setFill(Fill fill) {
        this.type = CoreEventType.EXECUTION_REPORT;
        this.timestamp = fill.timestampNanos();
        this.orderId = fill.orderId();
        this.side = fill.side();
        this.quantity = fill.quantity();
        this.price = fill.price();
    }

    public Quote toQuote() {
        return new Quote(bid, ask, timestamp);
    }

    public Fill toFill() {
        return new Fill(orderId, side, quantity, price, timestamp);
    }
}
