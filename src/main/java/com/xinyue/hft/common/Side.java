package com.xinyue.hft.common;

/**
 * 买卖方向。
 */
public enum Side {
    BUY(1),
    SELL(-1);

    private final int sign;

    Side(int sign) {
        this.sign = sign;
    }

    /**
     * 方向符号：买为 +1，卖为 -1。
     */
    public int sign() {
        return sign;
    }

    public Side opposite() {
        return this == BUY ? SELL : BUY;
    }

    /**
     * 返回能把给定仓位推向 0 的方向（仓位为 0 时返回 null）。
     */
    public static Side reducing(double position) {
        if (position > 0) {
            return SELL;
        }
        if (position < 0) {
            return BUY;
        }
        return null;
    }
}
