package com.xinyue.hft.core;

import java.util.function.LongSupplier;

/**
 * 流水线事件时钟：取最近一次处理的事件时间戳，只前进不后退。
 * <p>
 * 消费线程写入，场所回报线程可读取。
 */
public final class EventClock implements LongSupplier {

    private volatile long nowNanos;

    void advance(long timestampNanos) {
        if (timestampNanos > nowNanos) {
            nowNanos = timestampNanos;
        }
    }

    @Override
    public long getAsLong() {
        return nowNanos;
    }
}
