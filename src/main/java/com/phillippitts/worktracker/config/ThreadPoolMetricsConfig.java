package com.phillippitts.worktracker.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes pool metrics for the notification executor and the verification scheduler via Micrometer.
 *
 * <ul>
 *   <li>notify.pool.active / notify.pool.queued / notify.pool.completed</li>
 *   <li>verify.timers.queued - verification checks waiting to fire</li>
 * </ul>
 *
 * <p>Available via {@code GET /actuator/metrics/verify.timers.queued} and Prometheus.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> notificationExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskScheduler> verificationSchedulerProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("notificationExecutor") ObjectProvider<ThreadPoolTaskExecutor> notificationExecutorProvider,
            @Qualifier("verificationScheduler") ObjectProvider<ThreadPoolTaskScheduler> verificationSchedulerProvider) {
        this.notificationExecutorProvider = notificationExecutorProvider;
        this.verificationSchedulerProvider = verificationSchedulerProvider;
    }

    @Bean
    public MeterBinder trackingPoolMetrics() {
        return registry -> {
            ThreadPoolExecutor notify = notificationExecutorProvider.getObject().getThreadPoolExecutor();
            ScheduledThreadPoolExecutor verify =
                    verificationSchedulerProvider.getObject().getScheduledThreadPoolExecutor();

            Gauge.builder("notify.pool.active", notify, ThreadPoolExecutor::getActiveCount)
                    .description("Notification tasks currently executing")
                    .register(registry);

            Gauge.builder("notify.pool.queued", notify, e -> e.getQueue().size())
                    .description("Notification tasks waiting in the queue")
                    .register(registry);

            Gauge.builder("notify.pool.completed", notify, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of dispatched notifications")
                    .register(registry);

            Gauge.builder("verify.timers.queued", verify, e -> e.getQueue().size())
                    .description("Verification checks (and sweeps) waiting to fire")
                    .register(registry);

            LOG.info("Tracking pool metrics registered: notify.pool.*, verify.timers.queued");
        };
    }

    /**
     * Logs pool health every 5 minutes for operational visibility.
     */
    @Scheduled(fixedRate = 300_000)
    public void logThreadPoolHealth() {
        ThreadPoolExecutor notify = notificationExecutorProvider.getObject().getThreadPoolExecutor();
        ScheduledThreadPoolExecutor verify = verificationSchedulerProvider.getObject().getScheduledThreadPoolExecutor();

        LOG.info("Pool health: notify active={}, queued={}, completed={}; verify timers queued={}",
                notify.getActiveCount(),
                notify.getQueue().size(),
                notify.getCompletedTaskCount(),
                verify.getQueue().size());
    }
}
