package com.phillippitts.liverelay.config;

import com.phillippitts.liverelay.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the executors behind the streaming pipeline.
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
     * Executor running the long-lived pipeline tasks.
     *
     * <p>Each running pipeline holds one worker per task for its whole lifetime, so the queue
     * capacity defaults to 0 and the rejection policy is {@link ThreadPoolExecutor.AbortPolicy}:
     * a start that cannot get its workers fails instead of silently waiting behind other tasks.
     *
     * <p>Tasks are cancelled by interruption during pipeline stop, so the executor does not wait
     * for them on context shutdown.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the submitting thread to
     * the worker thread.
     *
     * @return executor for pipeline tasks
     */
    @Bean(name = "pipelineExecutor")
    public ThreadPoolTaskExecutor pipelineExecutor() {
        ThreadPoolTaskExecutor executor = newExecutor(threadPoolProperties.getPipeline(),
                new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Bounded pool for blocking device calls: frame grabs, microphone reads, speaker writes
     * and console reads.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}
     * When the pool and queue are full, the calling pipeline task performs the call itself,
     * providing backpressure instead of failing.
     *
     * <p>A console read abandoned by {@code stop()} keeps its worker blocked on stdin until the
     * next line arrives, so after a console run one worker is lost for the rest of the process.
     * Console mode is one-shot; do not size a later pipeline run on the assumption of a full pool.
     *
     * @return executor for device I/O
     */
    @Bean(name = "deviceExecutor")
    public ThreadPoolTaskExecutor deviceExecutor() {
        ThreadPoolTaskExecutor executor = newExecutor(threadPoolProperties.getDevice(),
                new ThreadPoolExecutor.CallerRunsPolicy());
        // Console reads never return on their own; workers must not keep the JVM alive
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    private static ThreadPoolTaskExecutor newExecutor(ThreadPoolProperties.PoolProperties props,
                                                      RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        return executor;
    }

    /**
     * Copies the submitting thread's ThreadContext into the worker for the duration of the task.
     */
    static TaskDecorator mdcPropagatingDecorator() {
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
