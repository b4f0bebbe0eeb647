package com.xinyue.hft.common;

/**
 * 策略产生的候选订单。被风控拒绝则直接丢弃，不做重试。
 *
 * @param side     方向
 * @param quantity 数量，必须为正
 * @param price    限价，必须为正
 */
public record Order(Side side, double quantity, double price) {

    public Order {
        if (side == null) {
            throw new IllegalArgumentException("side 不能为空");
        }
        if (!(quantity > 0) || Double.isInfinite(quantity)) {
            throw new IllegalArgumentException("quantity 必须为正: " + quantity);
        }
        if (!(price > 0) || Double.isInfinite(price)) {
            throw new IllegalArgumentException("price 必须为正: " + price);
        }
    }

    public static Order buy(double quantity, double price) {
        return new Order(Side.BUY, quantity, price);
    }

    public static Order sell(double quantity, double price) {
        return new Order(Side.SELL, quantity, price);
    }

    /**
     * 带方向的数量（买为正，卖为负）。
     */
    public double signedQuantity() {
        return side.sign() * quantity;
    }

    public double notional() {
        return quantity * price;
    }
}
