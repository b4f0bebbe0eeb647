package com.xinyue.hft.common;

/**
 * 定点数精度缩放常量。
 * <p>
 * 需要跨线程原子读写的金额（例如指标里的累计盈亏）使用 long 存储，通过固定缩放因子（1e8）保证精度。
 */
public final class ScaleConstants {

    /** 精度缩放因子（1e8，即 100,000,000） */
    public static final long SCALE_E8 = 100_000_000L;

    /** 判定数量已耗尽时使用的容差 */
    public static final double QTY_EPSILON = 1e-9;

    private ScaleConstants() {
        // 工具类，禁止实例化
    }

    public static long toE8(double value) {
        return Math.round(value * SCALE_E8);
    }

    public static double fromE8(long valueE8) {
        return valueE8 / (double) SCALE_E8;
    }
}
