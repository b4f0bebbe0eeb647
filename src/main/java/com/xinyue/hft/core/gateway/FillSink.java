package com.xinyue.hft.core.gateway;

import com.xinyue.hft.common.Fill;

/**
 * 成交回报入口。可以从任意线程调用；通道满时调用方阻塞，不会丢弃成交。
 */
@FunctionalInterface
public interface FillSink {

    void onFill(Fill fill);

    /**
     * 场所无法完成订单时回报失败，调用方撤销在途订单中未成交的部分。
     * 失败前已经回报的成交仍然有效。默认实现不处理失败，直接抛出。
     */
    default void onSubmitFailed(long orderId, Throwable cause) {
        throw new IllegalStateException("订单 " + orderId + " 提交失败", cause);
    }
}
