package com.xinyue.hft.core.oms;

import com.xinyue.hft.common.Fill;
import com.xinyue.hft.common.Order;
import com.xinyue.hft.common.ScaleConstants;
import com.xinyue.hft.common.Side;
import it.unimi.dsi.fastutil.longs.Long2DoubleOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2LongOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;

/**
 * 通过原始类型索引追踪已准入订单的剩余数量。
 * <p>
 * 一笔订单可以被拆成多笔成交，累计数量达到下单数量即视为完成并移出。
 * 在途订单数用于停机前的排空判断。只允许流水线消费线程访问。
 */
public final class OrderTracker {

    /** 未知订单的提交时间返回值 */
    public static final long UNKNOWN = -1L;

    private final Long2DoubleOpenHashMap remainingQty = new Long2DoubleOpenHashMap();
    private final Long2LongOpenHashMap submitNanos = new Long2LongOpenHashMap();
    private final Long2ObjectOpenHashMap<Side> sides = new Long2ObjectOpenHashMap<>();
    private long nextOrderId = 1;
    private long completedOrders;
    private long cancelledOrders;

    public OrderTracker() {
        submitNanos.defaultReturnValue(UNKNOWN);
    }

    /**
     * 为刚准入的订单分配本地订单号并登记。
     */
    public long register(Order order, long nowNanos) {
        long orderId = nextOrderId++;
        remainingQty.put(orderId, order.quantity());
        submitNanos.put(orderId, nowNanos);
        sides.put(orderId, order.side());
        return orderId;
    }

    /**
     * 扣减剩余数量。
     *
     * @return 该订单的提交时间；订单未知时返回 {@link #UNKNOWN}
     */
    public long onFill(Fill fill) {
        long orderId = fill.orderId();
        if (!remainingQty.containsKey(orderId)) {
            return UNKNOWN;
        }
        long submittedAt = submitNanos.get(orderId);
        double remaining = remainingQty.get(orderId) - fill.quantity();
        if (remaining <= ScaleConstants.QTY_EPSILON) {
            remainingQty.remove(orderId);
            submitNanos.remove(orderId);
            sides.remove(orderId);
            completedOrders++;
        } else {
            remainingQty.put(orderId, remaining);
        }
        return submittedAt;
    }

    /**
     * 撤销在途订单，之后到达的成交按未知订单处理。
     *
     * @return 撤销时尚未成交的数量；订单未知时返回 0
     */
    public double cancel(long orderId) {
        if (!remainingQty.containsKey(orderId)) {
            return 0.0;
        }
        double remaining = remainingQty.remove(orderId);
        submitNanos.remove(orderId);
        sides.remove(orderId);
        cancelledOrders++;
        return remaining;
    }

    /**
     * @return 在途订单的方向；订单未知时返回 null
     */
    public Side side(long orderId) {
        return sides.get(orderId);
    }

    public boolean isInFlight(long orderId) {
        return remainingQty.containsKey(orderId);
    }

    public double remaining(long orderId) {
        return remainingQty.get(orderId);
    }

    public int inFlightCount() {
        return remainingQty.size();
    }

    public long completedOrders() {
        return completedOrders;
    }

    public long cancelledOrders() {
        return cancelledOrders;
    }
}
