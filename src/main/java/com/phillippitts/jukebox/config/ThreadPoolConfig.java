package com.phillippitts.jukebox.config;

import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;

/**
 * Thread pools outside the dedicated backend worker threads.
 *
 * <p>The workers own their threads; the only pooled work is the debounced write of the current
 * source index.
 */
@Configuration
public class ThreadPoolConfig {

    /**
     * Single-threaded scheduler for debounced persistence.
     *
     * <p>One thread keeps writes ordered. Pending writes run before shutdown completes so the last
     * rotation is not lost.
     *
     * <p>{@code ThreadPoolTaskScheduler} has no task decorator hook in Spring 6.1, so callers
     * wrap their tasks with {@link #mdcPropagatingDecorator()} before scheduling.
     */
    @Bean(name = "persistenceScheduler")
    public TaskScheduler persistenceScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("persist-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(5);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Copies the Log4j2 ThreadContext (MDC) of the scheduling thread into the task, so a save
     * triggered by an HTTP request logs with that request's id. The executing thread's own
     * context is restored afterwards.
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
