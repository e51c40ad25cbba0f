package com.phillippitts.liverelay.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes executor gauges via Micrometer for both pools:
 * <ul>
 *   <li>{@code pipeline.pool.size}, {@code pipeline.pool.active}, {@code pipeline.pool.completed}</li>
 *   <li>{@code device.pool.size}, {@code device.pool.active}, {@code device.pool.queued},
 *       {@code device.pool.completed}</li>
 * </ul>
 *
 * <p>Additionally logs a health summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> pipelineExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> deviceExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("pipelineExecutor") ObjectProvider<ThreadPoolTaskExecutor> pipelineExecutorProvider,
            @Qualifier("deviceExecutor") ObjectProvider<ThreadPoolTaskExecutor> deviceExecutorProvider) {
        this.pipelineExecutorProvider = pipelineExecutorProvider;
        this.deviceExecutorProvider = deviceExecutorProvider;
    }

    @Bean
    public MeterBinder executorMetrics() {
        return registry -> {
            bind(registry, "pipeline", pipelineExecutorProvider.getObject().getThreadPoolExecutor());
            bind(registry, "device", deviceExecutorProvider.getObject().getThreadPoolExecutor());
            LOG.info("Executor metrics registered: pipeline.pool.*, device.pool.*");
        };
    }

    private static void bind(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Gauge.builder(pool + ".pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the " + pool + " pool")
                .register(registry);

        Gauge.builder(pool + ".pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing " + pool + " tasks")
                .register(registry);

        Gauge.builder(pool + ".pool.queued", executor, e -> e.getQueue().size())
                .description("Number of " + pool + " tasks waiting in the queue")
                .register(registry);

        Gauge.builder(pool + ".pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed " + pool + " tasks")
                .register(registry);

        Gauge.builder(pool + ".pool.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                .description("Configured maximum pool size for the " + pool + " executor")
                .register(registry);
    }

    /**
     * Logs executor health every 5 minutes.
     */
    @Scheduled(fixedRate = 300_000)
    public void logThreadPoolHealth() {
        log("Pipeline", pipelineExecutorProvider.getObject().getThreadPoolExecutor());
        log("Device", deviceExecutorProvider.getObject().getThreadPoolExecutor());
    }

    private static void log(String pool, ThreadPoolExecutor executor) {
        LOG.info("{} Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                pool,
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
