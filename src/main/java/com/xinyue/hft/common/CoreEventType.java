package com.xinyue.hft.common;

public enum CoreEventType {
    NONE,
    MARKET_DATA_TICK,
    EXECUTION_REPORT,
    SUBMIT_FAILED,       // 场所回报下单失败，释放在途订单
    END_OF_STREAM        // 上游行情通道关闭，触发优雅停机
}
