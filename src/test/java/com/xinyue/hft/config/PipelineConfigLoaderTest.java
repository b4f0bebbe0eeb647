package com.xinyue.hft.config;

import com.xinyue.hft.config.PipelineConfigLoader.Settings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("配置文件读取")
class PipelineConfigLoaderTest {

    @Test
    @DisplayName("读取默认值和品种覆盖，编号不连续处停止")
    void testLoadFromClasspath_MultipleInstruments() {
        Settings settings = PipelineConfigLoader.loadFromClasspath("pipeline-test.properties");
        assertEquals(250, settings.metricsFlushIntervalMs());
        assertEquals(2, settings.pipelines().size());

        PipelineConfig aaa = settings.pipelines().get(0);
        assertEquals("AAA", aaa.symbol());
        assertEquals(StrategyType.MARKET_MAKING, aaa.strategyType());
        assertEquals(500, aaa.maxPosition());
        assertEquals(100, aaa.maxOrdersPerSecond());
        assertEquals(2_000, aaa.circuitBreakerDurationMs());
        assertEquals(0.5, aaa.mmSkewFactor());
        assertEquals(7L, aaa.randomSeed());

        PipelineConfig bbb = settings.pipelines().get(1);
        assertEquals("BBB", bbb.symbol());
        assertEquals(StrategyType.ARBITRAGE, bbb.strategyType());
        assertEquals(50, bbb.maxPosition());
        assertEquals(PnlMode.CASH_FLOW, bbb.pnlMode());
        assertEquals(0.02, bbb.arbMinProfitThreshold());
        assertEquals(100, bbb.maxOrdersPerSecond());
    }

    @Test
    @DisplayName("classpath 上没有配置文件时退化为默认品种")
    void testLoadFromClasspath_MissingResource() {
        Settings settings = PipelineConfigLoader.loadFromClasspath("does-not-exist.properties");
        assertEquals(1, settings.pipelines().size());
        assertEquals("XYZ", settings.pipelines().get(0).symbol());
        assertEquals(PipelineConfigLoader.DEFAULT_FLUSH_INTERVAL_MS, settings.metricsFlushIntervalMs());
    }

    @Test
    @DisplayName("显式指定的文件不存在属于配置错误")
    void testLoadFromFile_Missing(@TempDir Path dir) {
        assertThrows(IllegalArgumentException.class,
                () -> PipelineConfigLoader.loadFromFile(dir.resolve("missing.properties")));
    }

    @Test
    @DisplayName("从文件读取")
    void testLoadFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("pipeline.properties");
        Files.writeString(file, "instrument.1.symbol=FILE\ninstrument.1.max_ticks=5\n");
        Settings settings = PipelineConfigLoader.loadFromFile(file);
        assertEquals("FILE", settings.pipelines().get(0).symbol());
        assertEquals(5, settings.pipelines().get(0).maxTicks());
    }

    @Test
    @DisplayName("数字格式错误属于配置错误")
    void testMalformedNumber_Rejected() {
        Properties props = new Properties();
        props.setProperty("instrument.1.symbol", "XYZ");
        props.setProperty("instrument.1.max_position", "abc");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> PipelineConfigLoader.fromProperties(props));
        assertTrue(e.getMessage().contains("max_position"));
    }

    @Test
    @DisplayName("配置值非法时不产生任何配置")
    void testInvalidValue_Rejected() {
        Properties props = new Properties();
        props.setProperty("default.circuit_breaker_duration_ms", "-10");
        assertThrows(IllegalArgumentException.class, () -> PipelineConfigLoader.fromProperties(props));
    }

    @Test
    @DisplayName("未知策略类型被拒绝")
    void testUnknownStrategy_Rejected() {
        Properties props = new Properties();
        props.setProperty("instrument.1.symbol", "XYZ");
        props.setProperty("instrument.1.strategy", "MOMENTUM");
        assertThrows(IllegalArgumentException.class, () -> PipelineConfigLoader.fromProperties(props));
    }
}
