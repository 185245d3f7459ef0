package com.phillippitts.spoofstream.config;

import com.phillippitts.spoofstream.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools used off the WebSocket transport threads.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and classifier latency.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Bounded pool running classifier calls for all connections.
     *
     * <p>Pool sizing via {@code threadpool.detection.*}:
     * <ul>
     *   <li>Core pool: default 4</li>
     *   <li>Max pool: default 16, for bursts of completed windows</li>
     *   <li>Queue: default 100 tasks</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When pool and queue
     * are full the submitting connection runs its own detection, which slows that client's
     * reads instead of dropping windows.
     *
     * <p>MDC propagation: the submitting thread's Log4j2 ThreadContext (carrying
     * {@code clientId}) is copied to the worker.
     *
     * @return executor for detection calls
     */
    @Bean(name = "detectionExecutor")
    public Executor detectionExecutor() {
        ThreadPoolProperties.DetectionPoolProperties detectionProps = threadPoolProperties.getDetection();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(detectionProps.getCorePoolSize());
        executor.setMaxPoolSize(detectionProps.getMaxPoolSize());
        executor.setQueueCapacity(detectionProps.getQueueCapacity());
        executor.setThreadNamePrefix(detectionProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(detectionProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(threadContextPropagator());
        executor.initialize();
        return executor;
    }

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
