package com.phillippitts.worktracker.config;

import com.phillippitts.worktracker.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools behind exit verification timers and notification offload.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Scheduler that fires exit verification checks and the periodic reconciliation sweep.
     *
     * <p>Timers held here are volatile: if the process dies they are lost. Pending exits are
     * persisted and reconciled on restart, so nothing relies on a timer actually firing.
     *
     * <p>The scheduler carries no task decorator; callers that need the scheduling thread's
     * ThreadContext wrap their tasks with {@link #mdcPropagatingDecorator()}.
     *
     * @return scheduler for verification checks
     */
    @Bean(name = "verificationScheduler", destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler verificationScheduler() {
        ThreadPoolProperties.VerificationPoolProperties props = threadPoolProperties.getVerification();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Bounded pool for fire-and-forget user notifications.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.DiscardOldestPolicy}. A notification must
     * never block a state transition, so under overload the oldest queued notification is dropped.
     *
     * @return executor for notification dispatch
     */
    @Bean(name = "notificationExecutor")
    public ThreadPoolTaskExecutor notificationExecutor() {
        ThreadPoolProperties.NotificationPoolProperties props = threadPoolProperties.getNotification();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardOldestPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitting thread's Log4j2 ThreadContext into the task and restores the worker's
     * own context afterwards.
     *
     * @return decorator shared by the notification executor and verification checks
     */
    public static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
