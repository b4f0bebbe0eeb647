package com.xinyue.hft.core.position;

import com.xinyue.hft.common.Fill;
import com.xinyue.hft.common.Side;
import com.xinyue.hft.config.PnlMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("仓位账本")
class PositionLedgerTest {

    private static Fill buy(double qty, double px) {
        return new Fill(1, Side.BUY, qty, px, 0);
    }

    private static Fill sell(double qty, double px) {
        return new Fill(1, Side.SELL, qty, px, 0);
    }

    @Test
    @DisplayName("平均成本：加仓摊薄成本，减仓按成本实现盈亏")
    void testAverageCost_OpenAddReduce() {
        PositionLedger ledger = new PositionLedger(PnlMode.AVERAGE_COST);
        assertEquals(0, ledger.apply(buy(10, 100)));
        assertEquals(0, ledger.apply(buy(10, 110)));
        assertEquals(20, ledger.position(), 1e-9);
        assertEquals(105, ledger.averageCost(), 1e-9);

        assertEquals(50, ledger.apply(sell(5, 115)), 1e-9);
        assertEquals(15, ledger.position(), 1e-9);
        assertEquals(105, ledger.averageCost(), 1e-9, "减仓不改变成本");
        assertEquals(50, ledger.realizedPnl(), 1e-9);
        assertEquals(3, ledger.tradeCount());
    }

    @Test
    @DisplayName("平均成本：翻转时实现平仓部分，剩余按成交价开新仓")
    void testAverageCost_Flip() {
        PositionLedger ledger = new PositionLedger(PnlMode.AVERAGE_COST);
        ledger.apply(buy(10, 100));
        double realized = ledger.apply(sell(15, 90));
        assertEquals(-100, realized, 1e-9);
        assertEquals(-5, ledger.position(), 1e-9);
        assertEquals(90, ledger.averageCost(), 1e-9);

        // 空头在更低价平仓获利
        assertEquals(25, ledger.apply(buy(5, 85)), 1e-9);
        assertEquals(0, ledger.position(), 1e-9);
        assertEquals(0, ledger.averageCost(), 1e-9);
        assertEquals(-75, ledger.realizedPnl(), 1e-9);
    }

    @Test
    @DisplayName("现金流口径：买入记负、卖出记正")
    void testCashFlow() {
        PositionLedger ledger = new PositionLedger(PnlMode.CASH_FLOW);
        assertEquals(-1000, ledger.apply(buy(10, 100)), 1e-9);
        assertEquals(1020, ledger.apply(sell(10, 102)), 1e-9);
        assertEquals(20, ledger.realizedPnl(), 1e-9);
        assertEquals(0, ledger.position(), 1e-9);
    }

    @Test
    @DisplayName("浮动盈亏按标记价格计算")
    void testUnrealizedPnl() {
        PositionLedger ledger = new PositionLedger(PnlMode.AVERAGE_COST);
        ledger.apply(sell(4, 50));
        assertEquals(8, ledger.unrealizedPnl(48), 1e-9);
        assertEquals(-8, ledger.unrealizedPnl(52), 1e-9);
    }

    @Test
    @DisplayName("两种口径在完全平仓后结果一致")
    void testModesAgreeWhenFlat() {
        PositionLedger avg = new PositionLedger(PnlMode.AVERAGE_COST);
        PositionLedger cash = new PositionLedger(PnlMode.CASH_FLOW);
        Fill[] fills = {buy(3, 10), buy(7, 12), sell(4, 13), sell(8, 11), buy(2, 9)};
        for (Fill fill : fills) {
            avg.apply(fill);
            cash.apply(fill);
        }
        assertEquals(0, avg.position(), 1e-9);
        assertEquals(avg.realizedPnl(), cash.realizedPnl(), 1e-9);
    }
}
