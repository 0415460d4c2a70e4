package com.ivamare.messagebus;

import com.ivamare.messagebus.support.RuntimeEnvironment;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the message bus.
 *
 * <p>Example configuration:
 * <pre>
 * messagebus:
 *   enabled: true
 *   environment: production
 *   unit-of-work:
 *     auto-commit: false
 *   broker:
 *     mode: concurrent
 *     concurrency: 4
 *     shutdown-timeout: 5s
 * </pre>
 */
@ConfigurationProperties(prefix = "messagebus")
public class MessageBusProperties {

    /**
     * Enable/disable message bus auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Runtime environment name. Falls back to the ENV variable when unset.
     */
    private String environment;

    /**
     * Default unit of work configuration.
     */
    private UnitOfWorkProperties unitOfWork = new UnitOfWorkProperties();

    /**
     * Broker configuration.
     */
    private BrokerProperties broker = new BrokerProperties();

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getEnvironment() {
        return environment;
    }

    public void setEnvironment(String environment) {
        this.environment = environment;
    }

    public UnitOfWorkProperties getUnitOfWork() {
        return unitOfWork;
    }

    public void setUnitOfWork(UnitOfWorkProperties unitOfWork) {
        this.unitOfWork = unitOfWork;
    }

    public BrokerProperties getBroker() {
        return broker;
    }

    public void setBroker(BrokerProperties broker) {
        this.broker = broker;
    }

    /**
     * Resolve the configured environment, falling back to the ENV variable.
     *
     * @return runtime environment (never null)
     */
    public RuntimeEnvironment resolveEnvironment() {
        if (environment == null || environment.isBlank()) {
            return RuntimeEnvironment.current();
        }
        return RuntimeEnvironment.fromName(environment);
    }

    /**
     * Unit of work configuration properties.
     */
    public static class UnitOfWorkProperties {

        /**
         * Commit automatically when the unit of work exits without an error.
         */
        private boolean autoCommit = false;

        public boolean isAutoCommit() {
            return autoCommit;
        }

        public void setAutoCommit(boolean autoCommit) {
            this.autoCommit = autoCommit;
        }
    }

    /**
     * Broker configuration properties.
     */
    public static class BrokerProperties {

        /**
         * Delivery mode.
         */
        private BrokerMode mode = BrokerMode.IN_PROCESS;

        /**
         * Delivery threads of the concurrent broker.
         */
        private int concurrency = 4;

        /**
         * How long closing the concurrent broker waits for in-flight deliveries.
         */
        private Duration shutdownTimeout = Duration.ofSeconds(5);

        public BrokerMode getMode() {
            return mode;
        }

        public void setMode(BrokerMode mode) {
            this.mode = mode;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }

    /**
     * Broker delivery modes.
     */
    public enum BrokerMode {
        /** Subscribers run on the publishing thread. */
        IN_PROCESS,
        /** Subscribers run on a bounded worker pool. */
        CONCURRENT
    }
}
