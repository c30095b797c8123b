package com.phillippitts.voicedispatch.config;

import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Configuration for the thread running the dispatch loop.
 */
@Configuration
public class ThreadPoolConfig {

    /**
     * Single-thread executor for the main dispatch loop.
     *
     * <p>The loop occupies its thread for the lifetime of the application, so the pool has
     * exactly one thread and no queue. Stopping the loop is the job of
     * {@link com.phillippitts.voicedispatch.service.dispatch.DispatcherLifecycle}; the
     * executor only waits briefly for the thread to exit.
     *
     * <p>Thread naming: {@code dispatch-N} for easy identification in logs.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext from the starting thread to the loop.
     *
     * @return executor for the dispatch loop
     */
    @Bean(name = "dispatchExecutor")
    public Executor dispatchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagating() {
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
