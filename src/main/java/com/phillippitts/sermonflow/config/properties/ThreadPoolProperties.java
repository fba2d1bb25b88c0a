package com.phillippitts.sermonflow.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Thread pool sizing for the flow's background work.
 *
 * <ul>
 *   <li>{@code processing}: one upload/enqueue/stream task per processing cycle</li>
 *   <li>{@code metering}: level meter consumer while recording</li>
 *   <li>{@code jobs}: the in-process transcription and study guide jobs</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "sermon.thread-pool")
public class ThreadPoolProperties {

    private PoolProperties processing = new PoolProperties(2, 4, 10, "processing-");
    private PoolProperties metering = new PoolProperties(1, 2, 2, "metering-");
    private PoolProperties jobs = new PoolProperties(2, 2, 100, "job-");

    public PoolProperties getProcessing() {
        return processing;
    }

    public void setProcessing(PoolProperties processing) {
        this.processing = processing;
    }

    public PoolProperties getMetering() {
        return metering;
    }

    public void setMetering(PoolProperties metering) {
        this.metering = metering;
    }

    public PoolProperties getJobs() {
        return jobs;
    }

    public void setJobs(PoolProperties jobs) {
        this.jobs = jobs;
    }

    /**
     * Sizing of one executor.
     */
    public static class PoolProperties {
        private int corePoolSize;
        private int maxPoolSize;
        private int queueCapacity;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        public PoolProperties() {
            this(1, 1, 10, "pool-");
        }

        PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
