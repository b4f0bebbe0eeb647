package com.xinyue.hft.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.TreeSet;

/**
 * 流水线配置读取器。
 * 从 pipeline.properties 读取全局默认值和多个品种的配置：
 * <pre>
 * default.max_position=10000
 * instrument.1.symbol=XYZ
 * instrument.1.strategy=MARKET_MAKING
 * instrument.1.max_position=500
 * </pre>
 * 品种编号从 1 开始，遇到第一个缺失的编号即停止。数值格式错误属于致命配置错误。
 */
public final class PipelineConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "pipeline.properties";
    public static final long DEFAULT_FLUSH_INTERVAL_MS = 5_000L;

    private static final String DEFAULT_PREFIX = "default.";
    private static final String INSTRUMENT_PREFIX = "instrument.";

    /**
     * 读取结果：全部品种配置 + 全局参数。
     */
    public record Settings(List<PipelineConfig> pipelines, long metricsFlushIntervalMs) {
        public Settings {
            pipelines = List.copyOf(pipelines);
        }
    }

    private PipelineConfigLoader() {
    }

    /**
     * 从 classpath 读取配置；文件不存在时退化为单个默认品种。
     */
    public static Settings loadFromClasspath(String resource) {
        try (InputStream is = PipelineConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                LOG.warn("{} 未找到，使用默认品种配置", resource);
                return new Settings(List.of(PipelineConfig.builder().build()), DEFAULT_FLUSH_INTERVAL_MS);
            }
            Properties props = new Properties();
            props.load(is);
            return fromProperties(props);
        } catch (IOException e) {
            throw new UncheckedIOException("读取配置失败: " + resource, e);
        }
    }

    /**
     * 从显式指定的文件读取配置，文件不存在视为配置错误。
     */
    public static Settings loadFromFile(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("配置文件不存在: " + path);
        }
        Properties props = new Properties();
        try (InputStream is = Files.newInputStream(path)) {
            props.load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("读取配置失败: " + path, e);
        }
        return fromProperties(props);
    }

    public static Settings fromProperties(Properties props) {
        List<PipelineConfig> pipelines = new ArrayList<>();

        int index = 1;
        while (true) {
            String prefix = INSTRUMENT_PREFIX + index + ".";
            String symbol = props.getProperty(prefix + "symbol");
            if (symbol == null) {
                // 没有更多品种了
                break;
            }
            PipelineConfig.Builder builder = PipelineConfig.builder();
            applyPrefixed(builder, props, DEFAULT_PREFIX);
            applyPrefixed(builder, props, prefix);
            pipelines.add(builder.build());
            index++;
        }

        if (pipelines.isEmpty()) {
            LOG.warn("配置中没有任何 instrument.<n>.symbol，使用默认品种");
            PipelineConfig.Builder builder = PipelineConfig.builder();
            applyPrefixed(builder, props, DEFAULT_PREFIX);
            pipelines.add(builder.build());
        }

        long flushIntervalMs = parseLong("metrics.flush_interval_ms",
                props.getProperty("metrics.flush_interval_ms", String.valueOf(DEFAULT_FLUSH_INTERVAL_MS)));
        if (flushIntervalMs <= 0) {
            throw new IllegalArgumentException("metrics.flush_interval_ms 必须大于 0: " + flushIntervalMs);
        }
        LOG.info("加载了 {} 个品种配置", pipelines.size());
        return new Settings(pipelines, flushIntervalMs);
    }

    private static void applyPrefixed(PipelineConfig.Builder builder, Properties props, String prefix) {
        // 排序保证同一份配置每次应用顺序一致
        for (String name : new TreeSet<>(props.stringPropertyNames())) {
            if (name.startsWith(prefix)) {
                apply(builder, name.substring(prefix.length()), props.getProperty(name).trim());
            }
        }
    }

    static void apply(PipelineConfig.Builder b, String key, String value) {
        switch (key) {
            case "symbol" -> b.symbol(value);
            case "strategy" -> b.strategyType(StrategyType.parse(value));
            case "max_position" -> b.maxPosition(parseDouble(key, value));
            case "max_orders_per_second" -> b.maxOrdersPerSecond(parseInt(key, value));
            case "max_order_value" -> b.maxOrderValue(parseDouble(key, value));
            case "max_drawdown" -> b.maxDrawdown(parseDouble(key, value));
            case "circuit_breaker_pct" -> b.circuitBreakerPct(parseDouble(key, value));
            case "circuit_breaker_duration_ms" -> b.circuitBreakerDurationMs(parseLong(key, value));
            case "pnl_mode" -> b.pnlMode(PnlMode.parse(value));
            case "tick_interval_ms" -> b.tickIntervalMs(parseLong(key, value));
            case "tick_size" -> b.tickSize(parseDouble(key, value));
            case "initial_price" -> b.initialPrice(parseDouble(key, value));
            case "max_ticks" -> b.maxTicks(parseLong(key, value));
            case "random_seed" -> b.randomSeed(value.isEmpty() ? null : parseLong(key, value));
            case "ring_buffer_size" -> b.ringBufferSize(parseInt(key, value));
            case "order_size" -> b.orderSize(parseDouble(key, value));
            case "mm.base_spread_ticks" -> b.mmBaseSpreadTicks(parseDouble(key, value));
            case "mm.volatility_multiplier" -> b.mmVolatilityMultiplier(parseDouble(key, value));
            case "mm.volatility_window" -> b.mmVolatilityWindow(parseInt(key, value));
            case "mm.skew_factor" -> b.mmSkewFactor(parseDouble(key, value));
            case "mm.inventory_band" -> b.mmInventoryBand(parseDouble(key, value));
            case "arb.min_profit_threshold" -> b.arbMinProfitThreshold(parseDouble(key, value));
            case "arb.fair_value_alpha" -> b.arbFairValueAlpha(parseDouble(key, value));
            case "arb.warmup_quotes" -> b.arbWarmupQuotes(parseInt(key, value));
            case "arb.position_reduce_ratio" -> b.arbPositionReduceRatio(parseDouble(key, value));
            default -> LOG.warn("忽略未知配置项: {}={}", key, value);
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("配置项 " + key + " 不是合法数字: " + value, e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("配置项 " + key + " 不是合法整数: " + value, e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("配置项 " + key + " 不是合法整数: " + value, e);
        }
    }
}
