package com.phillippitts.callintel.config;

import com.phillippitts.callintel.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for asynchronous call processing.
 *
 * <p>Pool sizes come from {@link ThreadPoolProperties} ({@code threadpool.pipeline.*} and
 * {@code threadpool.timeout.*}).
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor that runs one transcription-then-extraction task per submitted call.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When the pool and queue
     * are full the submitting thread runs the task, so webhook bursts slow the producer instead
     * of dropping calls.
     *
     * <p>Log4j2 ThreadContext is copied from the submitting thread, so {@code callId} keeps
     * flowing into worker logs.
     */
    @Bean(name = "pipelineExecutor")
    public ThreadPoolTaskExecutor pipelineExecutor() {
        return build(threadPoolProperties.getPipeline(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Executor for individually bounded upstream attempts. A timed-out attempt's task is
     * cancelled, which interrupts its thread; blocking I/O that ignores interrupts holds the
     * thread until the client read timeout. The caller moves on to the next retry meanwhile.
     *
     * <p>Uses a direct hand-off queue; when every thread is busy the caller runs the attempt
     * itself, which only loses the per-attempt bound under saturation.
     */
    @Bean(name = "timeoutExecutor")
    public ThreadPoolTaskExecutor timeoutExecutor() {
        return build(threadPoolProperties.getTimeout(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props,
                                                RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextPropagation());
        executor.initialize();
        return executor;
    }

    static TaskDecorator threadContextPropagation() {
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
