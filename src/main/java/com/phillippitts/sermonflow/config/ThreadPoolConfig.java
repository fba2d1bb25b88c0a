package com.phillippitts.sermonflow.config;

import com.phillippitts.sermonflow.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors for the flow's background work.
 *
 * <p>Pool sizes come from {@link ThreadPoolProperties} ({@code sermon.thread-pool.*}).
 * All pools use {@link ThreadPoolExecutor.CallerRunsPolicy} for backpressure and copy the submitting
 * thread's Log4j2 ThreadContext to the worker so {@code sermonId} and {@code requestId} survive the hop.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Runs one processing cycle per task: persist, upload, enqueue, follow progress.
     *
     * @return executor for processing cycles
     */
    @Bean(name = "processingExecutor")
    public ThreadPoolTaskExecutor processingExecutor() {
        return newExecutor(threadPoolProperties.getProcessing());
    }

    /**
     * Runs the level metering loop while recording. Small on purpose: one recording at a time.
     *
     * @return executor for level metering
     */
    @Bean(name = "meteringExecutor")
    public ThreadPoolTaskExecutor meteringExecutor() {
        return newExecutor(threadPoolProperties.getMetering());
    }

    /**
     * Runs in-process transcription and study guide jobs. Concurrency is capped again by the job queue.
     *
     * @return executor for processing jobs
     */
    @Bean(name = "jobExecutor")
    public ThreadPoolTaskExecutor jobExecutor() {
        return newExecutor(threadPoolProperties.getJobs());
    }

    /**
     * Drives the recording duration timer and the processing timeout.
     *
     * @return single-threaded daemon scheduler
     */
    @Bean(name = "flowScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService flowScheduler() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "flow-timer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private static ThreadPoolTaskExecutor newExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(5);
        executor.setTaskDecorator(threadContextPropagation());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitting thread's ThreadContext to the worker and restores the worker's own context
     * afterwards.
     */
    static TaskDecorator threadContextPropagation() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
