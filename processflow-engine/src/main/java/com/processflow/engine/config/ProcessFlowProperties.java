package com.processflow.engine.config;

import com.processflow.core.lifecycle.BusinessKeyGenerator;
import com.processflow.core.model.Priority;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the {@code processflow} prefix.
 */
@ConfigurationProperties(prefix = "processflow")
public class ProcessFlowProperties {

    private final Persistence persistence = new Persistence();
    private final Catalog catalog = new Catalog();
    private final Query query = new Query();

    /**
     * Prefix of generated business keys.
     */
    private String businessKeyPrefix = BusinessKeyGenerator.DEFAULT_PREFIX;

    /**
     * Priority of instances started without one.
     */
    private Priority defaultPriority = Priority.MEDIUM;

    public Persistence getPersistence() {
        return persistence;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public Query getQuery() {
        return query;
    }

    public String getBusinessKeyPrefix() {
        return businessKeyPrefix;
    }

    public void setBusinessKeyPrefix(String businessKeyPrefix) {
        this.businessKeyPrefix = businessKeyPrefix;
    }

    public Priority getDefaultPriority() {
        return defaultPriority;
    }

    public void setDefaultPriority(Priority defaultPriority) {
        this.defaultPriority = defaultPriority;
    }

    public static class Persistence {

        /**
         * Storage backend: memory or jdbc.
         */
        private String mode = "memory";

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }
    }

    public static class Catalog {

        /**
         * Register the bundled process templates at startup. Off unless configured.
         */
        private boolean enabled;

        private String location = "classpath:templates/process-definitions.json";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }
    }

    public static class Query {

        /**
         * Upper bound on the page size of list operations.
         */
        private int maxLimit = 100;

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }
    }
}
