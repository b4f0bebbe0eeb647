package com.xinyue.hft.strategy;

/**
 * 由外部（定价服务、参考市场等）推送的公允价值。收到第一笔价格前不可用。
 * <p>
 * {@link #update(double)} 可以从任意线程调用，策略读取的总是最近一次推送的价格。
 */
public final class ExternalFairValue implements FairValueSource {

    private volatile double fairValue = Double.NaN;

    public void update(double price) {
        if (!(price > 0) || Double.isInfinite(price)) {
            throw new IllegalArgumentException("公允价值必须为正数: " + price);
        }
        fairValue = price;
    }

    @Override
    public void onMid(double mid) {
        // 只使用外部价格
    }

    @Override
    public boolean isReady() {
        return !Double.isNaN(fairValue);
    }

    @Override
    public double fairValue() {
        return fairValue;
    }
}
