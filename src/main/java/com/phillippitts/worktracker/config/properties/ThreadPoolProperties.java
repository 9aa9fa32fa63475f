package com.phillippitts.worktracker.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for thread pools.
 *
 * <p>Provides tuneable sizing for the verification timer scheduler and the notification executor.
 */
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private VerificationPoolProperties verification = new VerificationPoolProperties();
    private NotificationPoolProperties notification = new NotificationPoolProperties();

    public VerificationPoolProperties getVerification() {
        return verification;
    }

    public void setVerification(VerificationPoolProperties verification) {
        this.verification = verification;
    }

    public NotificationPoolProperties getNotification() {
        return notification;
    }

    public void setNotification(NotificationPoolProperties notification) {
        this.notification = notification;
    }

    /**
     * Verification timer scheduler configuration.
     */
    public static class VerificationPoolProperties {
        private int poolSize = 2;
        private String threadNamePrefix = "verify-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Notification executor pool configuration.
     */
    public static class NotificationPoolProperties {
        private int corePoolSize = 1;
        private int maxPoolSize = 2;
        private int queueCapacity = 50;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "notify-";

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
