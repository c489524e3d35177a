package com.fauxcloud.core.lifecycle;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "fauxcloud.lifecycle")
public class LifecycleProperties {

    private int maxTtlHours = 168;
    private Sweep sweep = new Sweep();
    private Ready ready = new Ready();

    // -- Sweep accessors (delegate to nested) --
    public boolean isSweepEnabled() { return sweep.enabled; }
    public Duration getSweepInterval() { return sweep.interval; }
    public Duration getSweepShutdownTimeout() { return sweep.shutdownTimeout; }

    // -- Ready accessors (delegate to nested) --
    public Duration getReadyPollInterval() { return ready.pollInterval; }
    public Duration getReadyTimeout() { return ready.timeout; }

    public int getMaxTtlHours() { return maxTtlHours; }
    public void setMaxTtlHours(int maxTtlHours) { this.maxTtlHours = maxTtlHours; }
    public Sweep getSweep() { return sweep; }
    public void setSweep(Sweep sweep) { this.sweep = sweep; }
    public Ready getReady() { return ready; }
    public void setReady(Ready ready) { this.ready = ready; }

    public static class Sweep {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(5);
        private Duration shutdownTimeout = Duration.ofMinutes(2);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
        public Duration getShutdownTimeout() { return shutdownTimeout; }
        public void setShutdownTimeout(Duration shutdownTimeout) { this.shutdownTimeout = shutdownTimeout; }
    }

    public static class Ready {
        private Duration pollInterval = Duration.ofSeconds(5);
        private Duration timeout = Duration.ofSeconds(300);

        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }
}
