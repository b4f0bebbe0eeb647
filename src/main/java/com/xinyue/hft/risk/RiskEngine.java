package com.xinyue.hft.risk;

import com.xinyue.hft.common.Fill;
import com.xinyue.hft.common.Order;
import com.xinyue.hft.common.Quote;
import com.xinyue.hft.common.Side;
import com.xinyue.hft.config.PipelineConfig;
import com.xinyue.hft.core.position.PositionLedger;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 唯一的下单准入闸门。每笔订单发往场所前都必须经过 {@link #allow(Order)}。
 * <p>
 * 规则按固定顺序检查，第一条失败即拒绝且不留下任何副作用：
 * <ol>
 *     <li>熔断中</li>
 *     <li>当前 1 秒窗口内已准入订单数达到上限（窗口在下一次检查时惰性重置）</li>
 *     <li>|仓位 + 本单方向数量| 超过 max_position</li>
 *     <li>数量 × 价格 超过 max_order_value</li>
 * </ol>
 * 全部通过后先预占仓位、窗口计数加一，再返回准入。预占发生在成交之前，保证下一笔订单看到的仓位已包含本单。
 * <p>
 * 风控的“当前时间”取它观察到的最新事件时间（行情 / 成交），同一串事件重放得到相同的判定。
 * 非线程安全：只允许流水线消费线程访问。
 */
public final class RiskEngine {

    private static final long WINDOW_NANOS = TimeUnit.SECONDS.toNanos(1);

    private final String symbol;
    private final double maxPosition;
    private final int maxOrdersPerSecond;
    private final double maxOrderValue;
    private final double maxDrawdown;
    private final double circuitBreakerPct;

    private final CircuitBreaker circuitBreaker;
    private final PositionLedger pnlLedger;
    private final Map<RiskDecision, Long> decisionCounts = new EnumMap<>(RiskDecision.class);

    private double position;            // 已准入订单的预占仓位
    private int ordersThisWindow;
    private long windowStartNanos;
    private boolean windowStarted;
    private double peakPnl;
    private double lastPrice = Double.NaN;
    private long nowNanos;
    private boolean clockStarted;

    public RiskEngine(PipelineConfig config) {
        this.symbol = config.symbol();
        this.maxPosition = config.maxPosition();
        this.maxOrdersPerSecond = config.maxOrdersPerSecond();
        this.maxOrderValue = config.maxOrderValue();
        this.maxDrawdown = config.maxDrawdown();
        this.circuitBreakerPct = config.circuitBreakerPct();
        this.circuitBreaker = new CircuitBreaker(symbol,
                TimeUnit.MILLISECONDS.toNanos(config.circuitBreakerDurationMs()));
        this.pnlLedger = new PositionLedger(config.pnlMode());
        for (RiskDecision decision : RiskDecision.values()) {
            decisionCounts.put(decision, 0L);
        }
    }

    public boolean allow(Order order) {
        return check(order).isAccepted();
    }

    /**
     * 与 {@link #allow(Order)} 相同，但返回具体的拒单原因。
     */
    public RiskDecision check(Order order) {
        RiskDecision decision = evaluate(order);
        decisionCounts.merge(decision, 1L, Long::sum);
        if (decision.isAccepted()) {
            position += order.signedQuantity();
            ordersThisWindow++;
        }
        return decision;
    }

    /**
     * 归还已准入但不会成交的数量占用的预占仓位。窗口计数不回退：该订单确实发出过。
     */
    public void release(Side side, double quantity) {
        if (quantity <= 0) {
            return;
        }
        position -= side.sign() * quantity;
    }

    private RiskDecision evaluate(Order order) {
        if (circuitBreaker.isTripped(nowNanos)) {
            return RiskDecision.CIRCUIT_BREAKER;
        }
        rollWindow();
        if (ordersThisWindow >= maxOrdersPerSecond) {
            return RiskDecision.RATE_LIMIT;
        }
        if (Math.abs(position + order.signedQuantity()) > maxPosition) {
            return RiskDecision.POSITION_LIMIT;
        }
        if (order.notional() > maxOrderValue) {
            return RiskDecision.ORDER_VALUE;
        }
        return RiskDecision.ACCEPTED;
    }

    private void rollWindow() {
        if (!windowStarted || nowNanos - windowStartNanos >= WINDOW_NANOS) {
            windowStartNanos = nowNanos;
            windowStarted = true;
            ordersThisWindow = 0;
        }
    }

    /**
     * 行情输入：中间价相对上一笔的变动超过 circuit_breaker_pct 则触发熔断。第一笔行情只记录价格。
     */
    public void onQuote(Quote quote) {
        advanceClock(quote.timestampNanos());
        circuitBreaker.isTripped(nowNanos);
        double mid = quote.mid();
        if (!Double.isNaN(lastPrice)) {
            double changePct = Math.abs((mid - lastPrice) / lastPrice) * 100.0;
            if (changePct > circuitBreakerPct) {
                circuitBreaker.trip(nowNanos, CircuitBreaker.TripReason.PRICE_SHOCK);
            }
        }
        lastPrice = mid;
    }

    /**
     * 成交输入：更新累计盈亏，回撤（峰值 - 当前）超过 max_drawdown 则触发熔断。
     */
    public void onFill(Fill fill) {
        advanceClock(fill.timestampNanos());
        pnlLedger.apply(fill);
        double pnl = pnlLedger.realizedPnl();
        if (pnl > peakPnl) {
            peakPnl = pnl;
        }
        if (peakPnl - pnl > maxDrawdown) {
            circuitBreaker.trip(nowNanos, CircuitBreaker.TripReason.DRAWDOWN);
        }
    }

    private void advanceClock(long timestampNanos) {
        // 时间只前进不后退，乱序的异步成交不会让窗口倒退
        if (!clockStarted || timestampNanos - nowNanos > 0) {
            nowNanos = timestampNanos;
            clockStarted = true;
        }
    }

    public double position() {
        return position;
    }

    public double cumulativePnl() {
        return pnlLedger.realizedPnl();
    }

    public boolean isCircuitBreakerActive() {
        return circuitBreaker.state() == CircuitBreaker.State.TRIPPED;
    }

    public CircuitBreaker circuitBreaker() {
        return circuitBreaker;
    }

    public long decisionCount(RiskDecision decision) {
        return decisionCounts.get(decision);
    }

    public RiskSnapshot snapshot() {
        long accepted = decisionCounts.get(RiskDecision.ACCEPTED);
        long total = 0;
        for (long count : decisionCounts.values()) {
            total += count;
        }
        return new RiskSnapshot(
                position,
                ordersThisWindow,
                windowStartNanos,
                pnlLedger.realizedPnl(),
                peakPnl,
                circuitBreaker.state(),
                circuitBreaker.expiryNanos(),
                circuitBreaker.tripCount(),
                lastPrice,
                accepted,
                total - accepted
        );
    }
}
