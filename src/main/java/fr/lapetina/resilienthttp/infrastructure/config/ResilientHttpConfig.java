package fr.lapetina.resilienthttp.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the resilient HTTP client.
 * Designed to be populated from YAML.
 */
public class ResilientHttpConfig {

    private RetryConfig retry = new RetryConfig();
    private BatchConfig batch = new BatchConfig();
    private TransportConfig transport = new TransportConfig();
    private MetricsConfig metrics = new MetricsConfig();

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public BatchConfig getBatch() { return batch; }
    public void setBatch(BatchConfig batch) { this.batch = batch; }

    public TransportConfig getTransport() { return transport; }
    public void setTransport(TransportConfig transport) { this.transport = transport; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Retry coordinator settings.
     */
    public static class RetryConfig {
        private int maxRetries = 3;
        private List<Integer> failureCodes = new ArrayList<>(List.of(500, 503));
        private String delayStrategy = "exponential";
        private String delayUnit = "seconds";

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public List<Integer> getFailureCodes() { return failureCodes; }
        public void setFailureCodes(List<Integer> failureCodes) { this.failureCodes = failureCodes; }

        public String getDelayStrategy() { return delayStrategy; }
        public void setDelayStrategy(String delayStrategy) { this.delayStrategy = delayStrategy; }

        public String getDelayUnit() { return delayUnit; }
        public void setDelayUnit(String delayUnit) { this.delayUnit = delayUnit; }
    }

    /**
     * Batch pool (ring buffer) settings.
     */
    public static class BatchConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private long pollIntervalMs = 100;

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
    }

    /**
     * HTTP transport timeouts.
     */
    public static class TransportConfig {
        private long connectTimeoutMs = 5_000;
        private long requestTimeoutMs = 30_000;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private String prefix = "resilient_http";

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
