package com.xinyue.hft.strategy;

import it.unimi.dsi.fastutil.doubles.DoubleArrayFIFOQueue;

/**
 * 滚动窗口内中间价收益率的标准差。
 * <p>
 * 用 fastutil 的原始类型队列维护窗口，增量维护和与平方和，每次更新 O(1)。
 */
public final class VolatilityEstimator {

    private final int windowSize;
    private final DoubleArrayFIFOQueue returns;
    private double sum;
    private double sumSquares;
    private double lastMid = Double.NaN;

    public VolatilityEstimator(int windowSize) {
        if (windowSize < 2) {
            throw new IllegalArgumentException("windowSize 至少为 2: " + windowSize);
        }
        this.windowSize = windowSize;
        this.returns = new DoubleArrayFIFOQueue(windowSize + 1);
    }

    public void update(double mid) {
        if (!Double.isNaN(lastMid)) {
            double r = (mid - lastMid) / lastMid;
            returns.enqueue(r);
            sum += r;
            sumSquares += r * r;
            if (returns.size() > windowSize) {
                double old = returns.dequeueDouble();
                sum -= old;
                sumSquares -= old * old;
            }
        }
        lastMid = mid;
    }

    /**
     * 样本不足两个时返回 0。
     */
    public double volatility() {
        int n = returns.size();
        if (n < 2) {
            return 0.0;
        }
        double mean = sum / n;
        double variance = sumSquares / n - mean * mean;
        // 浮点误差可能让方差略小于 0
        return variance > 0 ? Math.sqrt(variance) : 0.0;
    }

    public int sampleCount() {
        return returns.size();
    }
}
