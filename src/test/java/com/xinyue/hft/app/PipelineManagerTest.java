package com.xinyue.hft.app;

import com.xinyue.hft.config.PipelineConfig;
import com.xinyue.hft.config.StrategyType;
import com.xinyue.hft.core.TradingPipeline;
import com.xinyue.hft.infra.MetricsReporter;
import com.xinyue.hft.infra.PerformanceSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("多品种流水线管理")
class PipelineManagerTest {

    @Test
    @DisplayName("每个品种独立运行，指标汇总包含全部品种")
    void testMultiplePipelines() throws Exception {
        List<PerformanceSnapshot> published = new CopyOnWriteArrayList<>();
        MetricsReporter reporter = new MetricsReporter(published::add, 60_000);
        PipelineManager manager = new PipelineManager(List.of(
                PipelineConfig.builder().symbol("AAA").maxTicks(50).randomSeed(1L).build(),
                PipelineConfig.builder().symbol("BBB").strategyType(StrategyType.ARBITRAGE)
                        .maxTicks(80).randomSeed(2L).arbWarmupQuotes(5).build()
        ), reporter);

        assertEquals(2, manager.pipelines().size());
        assertEquals(1, manager.symbolRegistry().get("AAA"));
        assertEquals(2, manager.symbolRegistry().get("BBB"));
        assertNull(manager.pipeline("CCC"));

        manager.startAll();
        assertTrue(manager.awaitAll(10, TimeUnit.SECONDS));

        TradingPipeline aaa = manager.pipeline("AAA");
        TradingPipeline bbb = manager.pipeline("BBB");
        assertEquals(50, aaa.monitor().snapshot().quotesProcessed());
        assertEquals(80, bbb.monitor().snapshot().quotesProcessed());
        assertNotSame(aaa.riskEngine(), bbb.riskEngine());

        reporter.flush();
        assertEquals(3, published.size());
        assertEquals(130, published.get(2).quotesProcessed());
    }

    @Test
    @DisplayName("品种重复时一条流水线都不创建")
    void testDuplicateSymbol_Rejected() {
        MetricsReporter reporter = new MetricsReporter(s -> {
        }, 1_000);
        PipelineConfig config = PipelineConfig.builder().symbol("AAA").build();
        assertThrows(IllegalArgumentException.class,
                () -> new PipelineManager(List.of(config, config), reporter));
    }

    @Test
    @DisplayName("closeAll 停止无限行情并排空")
    void testCloseAll() throws Exception {
        MetricsReporter reporter = new MetricsReporter(s -> {
        }, 1_000);
        PipelineManager manager = new PipelineManager(List.of(
                PipelineConfig.builder().symbol("AAA").randomSeed(1L).build()), reporter);
        manager.startAll();
        Thread.sleep(30);
        assertTrue(manager.closeAll(10, TimeUnit.SECONDS));
        assertTrue(manager.pipeline("AAA").isDrained());
    }
}
