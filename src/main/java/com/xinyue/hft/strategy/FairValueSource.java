package com.xinyue.hft.strategy;

/**
 * 套利策略的公允价值来源。
 * <p>
 * 策略在每笔行情判断完信号后调用 {@link #onMid(double)}，来源可以据此自行推算（例如 EMA），
 * 也可以忽略中间价、只使用外部给出的价格。只在流水线消费线程上被策略读取。
 */
public interface FairValueSource {

    void onMid(double mid);

    boolean isReady();

    double fairValue();
}
