package com.phillippitts.callintel.config;

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
 * Exposes pipeline executor gauges via Micrometer:
 * <ul>
 *   <li>callintel.pool.size</li>
 *   <li>callintel.pool.active</li>
 *   <li>callintel.pool.queued</li>
 *   <li>callintel.pool.completed</li>
 * </ul>
 * and logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> pipelineExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("pipelineExecutor") ObjectProvider<ThreadPoolTaskExecutor> pipelineExecutorProvider) {
        this.pipelineExecutorProvider = pipelineExecutorProvider;
    }

    @Bean
    public MeterBinder pipelineExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = pipelineExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("callintel.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of pipeline threads")
                    .register(registry);
            Gauge.builder("callintel.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Pipeline threads currently processing a call")
                    .register(registry);
            Gauge.builder("callintel.pool.queued", executor, e -> e.getQueue().size())
                    .description("Calls waiting for a pipeline thread")
                    .register(registry);
            Gauge.builder("callintel.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of processed calls")
                    .register(registry);

            LOG.info("Pipeline pool metrics registered: callintel.pool.*");
        };
    }

    @Scheduled(fixedRate = 300_000)
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = pipelineExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Pipeline pool health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
