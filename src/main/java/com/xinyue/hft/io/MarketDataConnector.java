package com.xinyue.hft.io;

/**
 * 抽象出的行情源：按 tick 节奏产生报价，直到被显式停止。
 * <p>
 * 停止后必须发布一次通道关闭信号，且不能重新启动。
 */
public interface MarketDataConnector {

    String symbol();

    void start();

    void stop();

    boolean isRunning();
}
