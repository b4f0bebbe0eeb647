package com.xinyue.hft.common;

/**
 * 成交回报。一笔订单可能被拆成多笔成交，每笔都按完整的库存变动处理。
 *
 * @param orderId        本地订单号（由准入时分配）
 * @param side           方向
 * @param quantity       成交数量
 * @param price          成交价格
 * @param timestampNanos 成交时间（纳秒）
 */
public record Fill(long orderId, Side side, double quantity, double price, long timestampNanos) {

    public Fill {
        if (side == null) {
            throw new IllegalArgumentException("side 不能为空");
        }
        if (!(quantity > 0)) {
            throw new IllegalArgumentException("成交数量必须为正: " + quantity);
        }
        if (!(price > 0)) {
            throw new IllegalArgumentException("成交价格必须为正: " + price);
        }
    }

    public double signedQuantity() {
        return side.sign() * quantity;
    }

    public double notional() {
        return quantity * price;
    }
}
