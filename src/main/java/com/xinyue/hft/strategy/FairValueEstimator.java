package com.xinyue.hft.strategy;

/**
 * 以中间价的指数移动平均作为公允价值，比行情本身变化更慢。
 */
public final class FairValueEstimator implements FairValueSource {

    private final double alpha;
    private final int warmupQuotes;
    private double fairValue = Double.NaN;
    private long samples;

    public FairValueEstimator(double alpha, int warmupQuotes) {
        this.alpha = alpha;
        this.warmupQuotes = warmupQuotes;
    }

    @Override
    public void onMid(double mid) {
        if (Double.isNaN(fairValue)) {
            fairValue = mid;
        } else {
            fairValue += alpha * (mid - fairValue);
        }
        samples++;
    }

    /**
     * 样本数达到预热数量后才可用于交易判断。
     */
    @Override
    public boolean isReady() {
        return samples >= warmupQuotes;
    }

    @Override
    public double fairValue() {
        return fairValue;
    }

    public long samples() {
        return samples;
    }
}
