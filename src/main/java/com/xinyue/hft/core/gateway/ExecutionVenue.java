package com.xinyue.hft.core.gateway;

import com.xinyue.hft.common.Order;

/**
 * 执行场所（模拟撮合或真实交易所）的接入契约。
 */
public interface ExecutionVenue {

    /**
     * 提交一笔已通过风控的订单。
     * 要求：不阻塞调用线程；成交可以在本次调用内同步回报，也可以稍后从其他线程异步回报。
     * 所有成交数量之和必须等于订单数量。
     *
     * @param orderId 本地订单号，成交回报必须带回
     * @param order   订单
     * @param sink    成交回报入口
     */
    void submit(long orderId, Order order, FillSink sink);

    /**
     * 流水线排空后调用，释放场所持有的资源。
     */
    default void close() {
    }
}
