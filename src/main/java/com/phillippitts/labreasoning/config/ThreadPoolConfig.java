package com.phillippitts.labreasoning.config;

import com.phillippitts.labreasoning.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pool used by concurrent model calls.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on provider rate limits and workload.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates a bounded thread pool for the fusion layer's concurrent model calls.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.model.*} properties:
     * <ul>
     *   <li>Core pool: default 4</li>
     *   <li>Max pool: default 16 - handles bursts of concurrent analyses</li>
     *   <li>Queue: default 100 tasks - prevents unbounded memory growth</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}
     * When the pool and queue are full, the caller thread executes the call,
     * providing backpressure instead of failing the analysis.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext from the submitting thread to
     * the worker thread so that {@code analysisId} appears in the model call logs.
     *
     * @return configured executor for model calls
     */
    @Bean(name = "modelExecutor")
    public ThreadPoolTaskExecutor modelExecutor() {
        ThreadPoolProperties.ModelPoolProperties modelProps = threadPoolProperties.getModel();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(modelProps.getCorePoolSize());
        executor.setMaxPoolSize(modelProps.getMaxPoolSize());
        executor.setQueueCapacity(modelProps.getQueueCapacity());
        executor.setThreadNamePrefix(modelProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(modelProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        // Propagate MDC to worker threads
        executor.setTaskDecorator(runnable -> {
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
        });

        executor.initialize();
        return executor;
    }
}
