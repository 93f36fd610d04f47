package com.ivamare.architecture;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the architecture core.
 *
 * <p>Example configuration:
 * <pre>
 * architecture:
 *   enabled: true
 *   cache:
 *     enabled: true
 *     maximum-size: 10000
 *     expire-after-write: 10m
 *   dispatcher:
 *     validation-enabled: true
 *     logging-enabled: true
 * </pre>
 */
@ConfigurationProperties(prefix = "architecture")
public class ArchitectureProperties {

    /**
     * Enable/disable auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Query cache configuration.
     */
    private CacheProperties cache = new CacheProperties();

    /**
     * Dispatcher middleware configuration.
     */
    private DispatcherProperties dispatcher = new DispatcherProperties();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public CacheProperties getCache() {
        return cache;
    }

    public void setCache(CacheProperties cache) {
        this.cache = cache;
    }

    public DispatcherProperties getDispatcher() {
        return dispatcher;
    }

    public void setDispatcher(DispatcherProperties dispatcher) {
        this.dispatcher = dispatcher;
    }

    /**
     * Query cache configuration properties.
     */
    public static class CacheProperties {

        /**
         * Memoize cacheable requests.
         */
        private boolean enabled = true;

        /**
         * Maximum number of cached results.
         */
        private long maximumSize = 10_000;

        /**
         * Validity window of a cached result.
         */
        private Duration expireAfterWrite = Duration.ofMinutes(10);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getMaximumSize() {
            return maximumSize;
        }

        public void setMaximumSize(long maximumSize) {
            this.maximumSize = maximumSize;
        }

        public Duration getExpireAfterWrite() {
            return expireAfterWrite;
        }

        public void setExpireAfterWrite(Duration expireAfterWrite) {
            this.expireAfterWrite = expireAfterWrite;
        }
    }

    /**
     * Dispatcher configuration properties.
     */
    public static class DispatcherProperties {

        /**
         * Run request validators before handlers.
         */
        private boolean validationEnabled = true;

        /**
         * Log each dispatch with its elapsed time.
         */
        private boolean loggingEnabled = true;

        public boolean isValidationEnabled() {
            return validationEnabled;
        }

        public void setValidationEnabled(boolean validationEnabled) {
            this.validationEnabled = validationEnabled;
        }

        public boolean isLoggingEnabled() {
            return loggingEnabled;
        }

        public void setLoggingEnabled(boolean loggingEnabled) {
            this.loggingEnabled = loggingEnabled;
        }
    }
}
