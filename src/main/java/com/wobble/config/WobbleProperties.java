package com.wobble.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "wobble")
public class WobbleProperties {

    private Discovery discovery = new Discovery();
    private Writer writer = new Writer();
    private Duration interruptGrace = Duration.ofSeconds(10);

    public String getPattern() { return discovery.pattern; }
    public int getQueueCapacity() { return writer.queueCapacity; }
    public Duration getEnqueueWait() { return writer.enqueueWait; }
    public Duration getShutdownTimeout() { return writer.shutdownTimeout; }

    public Discovery getDiscovery() { return discovery; }
    public void setDiscovery(Discovery discovery) { this.discovery = discovery; }
    public Writer getWriter() { return writer; }
    public void setWriter(Writer writer) { this.writer = writer; }

    /** How long an interrupted run may take to finish the current test and close its outputs. */
    public Duration getInterruptGrace() { return interruptGrace; }
    public void setInterruptGrace(Duration interruptGrace) { this.interruptGrace = interruptGrace; }

    /**
     * How long the shutdown hook holds the JVM after an interrupt: the grace for the test in flight plus
     * the time the file writer may take to drain, so the JVM never halts while a file is still open.
     */
    public Duration getInterruptWait() {
        return interruptGrace.plus(writer.shutdownTimeout);
    }

    public static class Discovery {
        private String pattern = "*Test.class";

        public String getPattern() { return pattern; }
        public void setPattern(String pattern) { this.pattern = pattern; }
    }

    public static class Writer {
        private int queueCapacity = 16384;
        private Duration enqueueWait = Duration.ofSeconds(5);
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public Duration getEnqueueWait() { return enqueueWait; }
        public void setEnqueueWait(Duration enqueueWait) { this.enqueueWait = enqueueWait; }
        public Duration getShutdownTimeout() { return shutdownTimeout; }
        public void setShutdownTimeout(Duration shutdownTimeout) { this.shutdownTimeout = shutdownTimeout; }
    }
}
