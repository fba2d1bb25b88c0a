package com.phillippitts.sermonflow.config;

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
 * Exposes the processing and job pools through Micrometer.
 *
 * <p>For each pool ({@code processing}, {@code jobs}):
 * <ul>
 *   <li>sermonflow.pool.&lt;name&gt;.size - current number of threads</li>
 *   <li>sermonflow.pool.&lt;name&gt;.active - threads executing tasks</li>
 *   <li>sermonflow.pool.&lt;name&gt;.queued - tasks waiting in the queue</li>
 *   <li>sermonflow.pool.&lt;name&gt;.completed - cumulative completed tasks</li>
 * </ul>
 *
 * <p>Available via {@code GET /actuator/metrics/sermonflow.pool.jobs.active}. A health summary is logged
 * every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);
    private static final String METRIC_PREFIX = "sermonflow.pool.";

    private final ObjectProvider<ThreadPoolTaskExecutor> processingExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> jobExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("processingExecutor") ObjectProvider<ThreadPoolTaskExecutor> processingExecutorProvider,
            @Qualifier("jobExecutor") ObjectProvider<ThreadPoolTaskExecutor> jobExecutorProvider) {
        this.processingExecutorProvider = processingExecutorProvider;
        this.jobExecutorProvider = jobExecutorProvider;
    }

    /**
     * Binds pool gauges to the Micrometer registry.
     *
     * @return MeterBinder registering the gauges
     */
    @Bean
    public MeterBinder sermonFlowPoolMetrics() {
        return registry -> {
            bind(registry, "processing", processingExecutorProvider.getObject().getThreadPoolExecutor());
            bind(registry, "jobs", jobExecutorProvider.getObject().getThreadPoolExecutor());
            LOG.info("Thread pool metrics registered: {}* available via /actuator/metrics", METRIC_PREFIX);
        };
    }

    /**
     * Logs pool health every 5 minutes.
     */
    @Scheduled(fixedRate = 300_000)
    public void logThreadPoolHealth() {
        log("processing", processingExecutorProvider.getObject().getThreadPoolExecutor());
        log("jobs", jobExecutorProvider.getObject().getThreadPoolExecutor());
    }

    private static void bind(MeterRegistry registry, String name, ThreadPoolExecutor executor) {
        Gauge.builder(METRIC_PREFIX + name + ".size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the " + name + " pool")
                .register(registry);
        Gauge.builder(METRIC_PREFIX + name + ".active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Threads actively executing " + name + " tasks")
                .register(registry);
        Gauge.builder(METRIC_PREFIX + name + ".queued", executor, e -> e.getQueue().size())
                .description("Tasks waiting in the " + name + " queue")
                .register(registry);
        Gauge.builder(METRIC_PREFIX + name + ".completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed " + name + " tasks")
                .register(registry);
    }

    private static void log(String name, ThreadPoolExecutor executor) {
        LOG.info("{} pool health: size={}/{}, active={}, queued={}, completed={}",
                name,
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
