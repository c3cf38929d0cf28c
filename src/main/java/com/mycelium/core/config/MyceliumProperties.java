package com.mycelium.core.config;

import com.mycelium.core.runtime.RuntimeSettings;
import com.mycelium.core.strategic.CoordinatorSettings;
import com.mycelium.core.supervisor.CircuitBreakerSettings;
import com.mycelium.core.supervisor.RetryOwnership;
import com.mycelium.core.supervisor.RetryPolicy;
import com.mycelium.core.supervisor.SupervisorSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything under {@code mycelium.*}. The nested sections are plain mutable beans for
 * binding; components receive the immutable settings records built from them.
 */
@Component
@ConfigurationProperties(prefix = "mycelium")
public class MyceliumProperties {

    private Bus bus = new Bus();
    private Runtime runtime = new Runtime();
    private Health health = new Health();
    private Supervisor supervisor = new Supervisor();
    private Strategic strategic = new Strategic();
    private String gatewayId = "gateway";
    private Map<String, Domain> domains = new LinkedHashMap<>();

    public RuntimeSettings toRuntimeSettings() {
        return new RuntimeSettings(Duration.ofMillis(runtime.heartbeatIntervalMs), bus.mailboxCapacity);
    }

    public SupervisorSettings toSupervisorSettings() {
        return new SupervisorSettings(
                new RetryPolicy(supervisor.maxRetries,
                        Duration.ofMillis(supervisor.baseDelayMs),
                        Duration.ofMillis(supervisor.maxDelayMs)),
                new CircuitBreakerSettings(supervisor.failureThreshold, Duration.ofMillis(supervisor.openTimeoutMs)),
                supervisor.queueDepth,
                supervisor.summaryEvery,
                Duration.ofMillis(supervisor.summaryWindowMs),
                supervisor.maxRestarts,
                supervisor.retryOwnership);
    }

    public CoordinatorSettings toCoordinatorSettings() {
        return new CoordinatorSettings(
                strategic.minSuccessRate,
                strategic.maxAvgLatencyMs,
                strategic.maxQueueDepth,
                Duration.ofMillis(strategic.silenceThresholdMs),
                strategic.alternates);
    }

    public Bus getBus() { return bus; }
    public void setBus(Bus bus) { this.bus = bus; }
    public Runtime getRuntime() { return runtime; }
    public void setRuntime(Runtime runtime) { this.runtime = runtime; }
    public Health getHealth() { return health; }
    public void setHealth(Health health) { this.health = health; }
    public Supervisor getSupervisor() { return supervisor; }
    public void setSupervisor(Supervisor supervisor) { this.supervisor = supervisor; }
    public Strategic getStrategic() { return strategic; }
    public void setStrategic(Strategic strategic) { this.strategic = strategic; }
    public String getGatewayId() { return gatewayId; }
    public void setGatewayId(String gatewayId) { this.gatewayId = gatewayId; }
    public Map<String, Domain> getDomains() { return domains; }
    public void setDomains(Map<String, Domain> domains) { this.domains = domains; }

    public static class Bus {
        private int mailboxCapacity = 256;
        private int deadLetterRetention = 1000;

        public int getMailboxCapacity() { return mailboxCapacity; }
        public void setMailboxCapacity(int mailboxCapacity) { this.mailboxCapacity = mailboxCapacity; }
        public int getDeadLetterRetention() { return deadLetterRetention; }
        public void setDeadLetterRetention(int deadLetterRetention) { this.deadLetterRetention = deadLetterRetention; }
    }

    public static class Runtime {
        private long heartbeatIntervalMs = 1000;

        public long getHeartbeatIntervalMs() { return heartbeatIntervalMs; }
        public void setHeartbeatIntervalMs(long heartbeatIntervalMs) { this.heartbeatIntervalMs = heartbeatIntervalMs; }
    }

    public static class Health {
        private long stalenessMs = 5000;
        private long intervalMs = 1000;

        public long getStalenessMs() { return stalenessMs; }
        public void setStalenessMs(long stalenessMs) { this.stalenessMs = stalenessMs; }
        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }
    }

    public static class Supervisor {
        private int maxRetries = 3;
        private long baseDelayMs = 200;
        private long maxDelayMs = 10_000;
        private int failureThreshold = 5;
        private long openTimeoutMs = 30_000;
        private int queueDepth = 64;
        private int summaryEvery = 20;
        private long summaryWindowMs = 10_000;
        private int maxRestarts = 3;
        private Map<String, RetryOwnership> retryOwnership = new LinkedHashMap<>();

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public long getBaseDelayMs() { return baseDelayMs; }
        public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }
        public long getMaxDelayMs() { return maxDelayMs; }
        public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }
        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
        public long getOpenTimeoutMs() { return openTimeoutMs; }
        public void setOpenTimeoutMs(long openTimeoutMs) { this.openTimeoutMs = openTimeoutMs; }
        public int getQueueDepth() { return queueDepth; }
        public void setQueueDepth(int queueDepth) { this.queueDepth = queueDepth; }
        public int getSummaryEvery() { return summaryEvery; }
        public void setSummaryEvery(int summaryEvery) { this.summaryEvery = summaryEvery; }
        public long getSummaryWindowMs() { return summaryWindowMs; }
        public void setSummaryWindowMs(long summaryWindowMs) { this.summaryWindowMs = summaryWindowMs; }
        public int getMaxRestarts() { return maxRestarts; }
        public void setMaxRestarts(int maxRestarts) { this.maxRestarts = maxRestarts; }
        public Map<String, RetryOwnership> getRetryOwnership() { return retryOwnership; }
        public void setRetryOwnership(Map<String, RetryOwnership> retryOwnership) { this.retryOwnership = retryOwnership; }
    }

    public static class Strategic {
        private String id = "strategic";
        private double minSuccessRate = 0.8;
        private double maxAvgLatencyMs = 5000;
        private int maxQueueDepth = 32;
        private long silenceThresholdMs = 30_000;
        private Map<String, String> alternates = new LinkedHashMap<>();

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public double getMinSuccessRate() { return minSuccessRate; }
        public void setMinSuccessRate(double minSuccessRate) { this.minSuccessRate = minSuccessRate; }
        public double getMaxAvgLatencyMs() { return maxAvgLatencyMs; }
        public void setMaxAvgLatencyMs(double maxAvgLatencyMs) { this.maxAvgLatencyMs = maxAvgLatencyMs; }
        public int getMaxQueueDepth() { return maxQueueDepth; }
        public void setMaxQueueDepth(int maxQueueDepth) { this.maxQueueDepth = maxQueueDepth; }
        public long getSilenceThresholdMs() { return silenceThresholdMs; }
        public void setSilenceThresholdMs(long silenceThresholdMs) { this.silenceThresholdMs = silenceThresholdMs; }
        public Map<String, String> getAlternates() { return alternates; }
        public void setAlternates(Map<String, String> alternates) { this.alternates = alternates; }
    }

    /** One tactical supervisor and the pools it owns, keyed by capability. */
    public static class Domain {
        private Map<String, Integer> pools = new LinkedHashMap<>();

        public Map<String, Integer> getPools() { return pools; }
        public void setPools(Map<String, Integer> pools) { this.pools = pools; }
    }
}
