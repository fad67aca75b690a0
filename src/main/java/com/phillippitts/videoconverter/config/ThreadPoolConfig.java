package com.phillippitts.videoconverter.config;

import com.phillippitts.videoconverter.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for thread pools used outside the conversion workers.
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
     * Executor that runs server-sent event streams.
     *
     * <p>A stream occupies its thread until the client disconnects, so the queue defaults to 0:
     * once {@code max-pool-size} streams are open, new ones are rejected
     * ({@link ThreadPoolExecutor.AbortPolicy}) instead of waiting behind streams that never end.
     *
     * <p>Thread naming: configured via {@code threadpool.event-stream.thread-name-prefix}.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the request thread so the stream's
     * logs keep the request id.
     *
     * @return Configured executor for event streaming
     */
    @Bean(name = "eventStreamExecutor")
    public ThreadPoolTaskExecutor eventStreamExecutor() {
        ThreadPoolProperties.EventStreamPoolProperties props = threadPoolProperties.getEventStream();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(threadContextPropagator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitting thread's ThreadContext onto the worker and restores the worker's own
     * context afterwards.
     */
    static TaskDecorator threadContextPropagator() {
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
