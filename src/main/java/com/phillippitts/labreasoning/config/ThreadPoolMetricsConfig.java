package com.phillippitts.labreasoning.config;

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

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the model call pool via Micrometer.
 *
 * <ul>
 *   <li>model.pool.size - current number of threads</li>
 *   <li>model.pool.active - threads executing a model call</li>
 *   <li>model.pool.queued - calls waiting in the queue</li>
 *   <li>model.pool.completed - cumulative completed calls</li>
 * </ul>
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> modelExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("modelExecutor") ObjectProvider<ThreadPoolTaskExecutor> modelExecutorProvider) {
        this.modelExecutorProvider = modelExecutorProvider;
    }

    @Bean
    public MeterBinder modelExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = modelExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("model.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the model call pool")
                    .register(registry);

            Gauge.builder("model.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads executing model calls")
                    .register(registry);

            Gauge.builder("model.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of model calls waiting in the queue")
                    .register(registry);

            Gauge.builder("model.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed model calls")
                    .register(registry);

            LOG.info("Model thread pool metrics registered: model.pool.*");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = modelExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Model Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
