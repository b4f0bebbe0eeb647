package com.xinyue.hft.common;

/**
 * 某一时刻的买一 / 卖一报价，创建后不可变。
 *
 * @param bid            买一价
 * @param ask            卖一价，必须严格大于 bid
 * @param timestampNanos 事件时间（纳秒）
 */
public record Quote(double bid, double ask, long timestampNanos) {

    public Quote {
        if (!(bid > 0) || !(ask > 0)) {
            throw new IllegalArgumentException("报价必须为正: bid=" + bid + ", ask=" + ask);
        }
        if (!(bid < ask)) {
            throw new IllegalArgumentException("bid 必须小于 ask: bid=" + bid + ", ask=" + ask);
        }
    }

    public double mid() {
        return (bid + ask) / 2.0;
    }

    public double spread() {
        return ask - bid;
    }
}
