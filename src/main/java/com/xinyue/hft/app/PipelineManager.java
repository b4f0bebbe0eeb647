package com.xinyue.hft.app;

import com.xinyue.hft.common.SymbolRegistry;
import com.xinyue.hft.config.PipelineConfig;
import com.xinyue.hft.core.TradingPipeline;
import com.xinyue.hft.infra.MetricsReporter;
import org.agrona.collections.Int2ObjectHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;

/**
 * 多品种流水线管理：每个品种一条独立流水线，按 symbolId 索引。
 * <p>
 * 所有流水线在启动前一次性构建完成，任一品种配置有误则一条都不启动。
 */
public final class PipelineManager {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineManager.class);

    private final SymbolRegistry symbolRegistry = new SymbolRegistry();
    private final Int2ObjectHashMap<TradingPipeline> pipelines = new Int2ObjectHashMap<>();
    private final List<TradingPipeline> ordered = new ArrayList<>();

    public PipelineManager(List<PipelineConfig> configs, MetricsReporter reporter) {
        this(configs, reporter, TradingPipeline::simulated);
    }

    public PipelineManager(List<PipelineConfig> configs,
                           MetricsReporter reporter,
                           BiFunction<PipelineConfig, Short, TradingPipeline> pipelineFactory) {
        if (configs.isEmpty()) {
            throw new IllegalArgumentException("至少需要配置一个品种");
        }
        for (PipelineConfig config : configs) {
            if (symbolRegistry.get(config.symbol()) != -1) {
                throw new IllegalArgumentException("品种重复配置: " + config.symbol());
            }
            short symbolId = symbolRegistry.register(config.symbol());
            TradingPipeline pipeline = pipelineFactory.apply(config, symbolId);
            pipelines.put(symbolId, pipeline);
            ordered.add(pipeline);
            reporter.register(pipeline.monitor());
        }
    }

    public void startAll() {
        for (TradingPipeline pipeline : ordered) {
            pipeline.start();
        }
        LOG.info("已启动 {} 条流水线", ordered.size());
    }

    /**
     * 停止全部行情源，各流水线随后自行排空。
     */
    public void stopAll() {
        for (TradingPipeline pipeline : ordered) {
            pipeline.stop();
        }
    }

    /**
     * 等待全部流水线排空，timeout 为总时长。
     *
     * @return 全部排空返回 true
     */
    public boolean awaitAll(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        boolean allDrained = true;
        for (TradingPipeline pipeline : ordered) {
            long remaining = Math.max(0, deadline - System.nanoTime());
            if (!pipeline.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                LOG.warn("[{}] 流水线未在时限内排空", pipeline.symbol());
                allDrained = false;
            }
        }
        return allDrained;
    }

    /**
     * 停止、排空并释放全部流水线。
     */
    public boolean closeAll(long timeout, TimeUnit unit) throws InterruptedException {
        stopAll();
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        boolean allDrained = true;
        for (TradingPipeline pipeline : ordered) {
            long remaining = Math.max(0, deadline - System.nanoTime());
            allDrained &= pipeline.close(remaining, TimeUnit.NANOSECONDS);
        }
        return allDrained;
    }

    public TradingPipeline pipeline(String symbol) {
        short symbolId = symbolRegistry.get(symbol);
        return symbolId == -1 ? null : pipelines.get(symbolId);
    }

    public List<TradingPipeline> pipelines() {
        return Collections.unmodifiableList(ordered);
    }

    public SymbolRegistry symbolRegistry() {
        return symbolRegistry;
    }
}
