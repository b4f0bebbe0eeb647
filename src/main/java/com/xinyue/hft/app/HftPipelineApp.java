package com.xinyue.hft.app;

import com.xinyue.hft.config.PipelineConfig;
import com.xinyue.hft.config.PipelineConfigLoader;
import com.xinyue.hft.config.PipelineConfigLoader.Settings;
import com.xinyue.hft.core.TradingPipeline;
import com.xinyue.hft.infra.JsonLogMetricsSink;
import com.xinyue.hft.infra.MetricsReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 启动多品种风控流水线。
 * <p>
 * 用法：{@code HftPipelineApp [pipeline.properties 路径]}，不传参数时读取 classpath 上的默认配置。
 */
public final class HftPipelineApp {

    private static final Logger LOG = LoggerFactory.getLogger(HftPipelineApp.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private HftPipelineApp() {
    }

    public static void main(String[] args) throws InterruptedException {
        fixConsoleEncoding();

        Settings settings;
        try {
            settings = args.length > 0
                    ? PipelineConfigLoader.loadFromFile(Path.of(args[0]))
                    : PipelineConfigLoader.loadFromClasspath(PipelineConfigLoader.DEFAULT_RESOURCE);
        } catch (IllegalArgumentException e) {
            LOG.error("配置错误，流水线未启动: {}", e.getMessage());
            System.exit(1);
            return;
        }

        MetricsReporter reporter = new MetricsReporter(new JsonLogMetricsSink(), settings.metricsFlushIntervalMs());
        PipelineManager manager = new PipelineManager(settings.pipelines(), reporter);

        CountDownLatch finished = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (finished.getCount() == 0) {
                return;
            }
            LOG.info("收到退出信号，停止行情并排空在途订单");
            try {
                manager.closeAll(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                reporter.stop();
            }
        }, "shutdown-hook"));

        reporter.start();
        manager.startAll();

        boolean finite = settings.pipelines().stream().allMatch(c -> c.maxTicks() > 0);
        if (!finite) {
            LOG.info("无限行情模式，按 Ctrl+C 退出");
            // 无限模式由 shutdown hook 负责收尾
            Thread.currentThread().join();
            return;
        }

        manager.awaitAll(1, TimeUnit.DAYS);
        finished.countDown();
        reporter.stop();
        for (TradingPipeline pipeline : manager.pipelines()) {
            PipelineConfig config = pipeline.config();
            LOG.info("[{}] 运行结束: strategy={}, position={}, pnl={}", config.symbol(), config.strategyType(),
                    pipeline.riskEngine().position(), pipeline.riskEngine().cumulativePnl());
        }
    }

    private static void fixConsoleEncoding() {
        try {
            System.setOut(new PrintStream(System.out, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(System.err, true, StandardCharsets.UTF_8));
        } catch (Exception e) {
            System.err.println("Warning: Failed to set console encoding to UTF-8: " + e.getMessage());
        }
    }
}
