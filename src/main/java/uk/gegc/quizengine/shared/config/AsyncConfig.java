package uk.gegc.quizengine.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.aop.interceptor.SimpleAsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Arrays;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;

/**
 * Asynchronous processing configuration.
 * <p>
 * The progress executor is the bounded outbound queue for completed quiz results: a single worker
 * drains it in the background, and when the queue is full new records are dropped with a warning
 * instead of blocking or failing the request that produced them.
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig implements AsyncConfigurer {

    @Value("${quiz.progress.core-pool-size:1}")
    private int progressCorePoolSize;

    @Value("${quiz.progress.max-pool-size:1}")
    private int progressMaxPoolSize;

    @Value("${quiz.progress.queue-capacity:500}")
    private int progressQueueCapacity;

    @Value("${quiz.progress.await-termination-seconds:10}")
    private int progressAwaitTerminationSeconds;

    @Bean(name = "progressTaskExecutor")
    public ThreadPoolTaskExecutor progressTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(progressCorePoolSize);
        executor.setMaxPoolSize(Math.max(progressCorePoolSize, progressMaxPoolSize));
        executor.setQueueCapacity(progressQueueCapacity);
        executor.setThreadNamePrefix("progress-");
        executor.setRejectedExecutionHandler(dropWithWarning());

        // Drain queued records on shutdown, bounded by the await timeout
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(progressAwaitTerminationSeconds);

        executor.initialize();

        log.info("Progress Task Executor configured - Core: {}, Max: {}, Queue: {}",
                progressCorePoolSize, executor.getMaxPoolSize(), progressQueueCapacity);

        return executor;
    }

    static RejectedExecutionHandler dropWithWarning() {
        return (task, pool) -> log.warn(
                "Progress queue full ({} pending), dropping quiz result record",
                pool.getQueue().size());
    }

    @Override
    public Executor getAsyncExecutor() {
        return progressTaskExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return new SimpleAsyncUncaughtExceptionHandler() {
            @Override
            public void handleUncaughtException(Throwable ex, java.lang.reflect.Method method, Object... params) {
                log.error("Uncaught exception in async method: {}.{}() with parameters: {}",
                        method.getDeclaringClass().getSimpleName(),
                        method.getName(),
                        Arrays.toString(params), ex);
                super.handleUncaughtException(ex, method, params);
            }
        };
    }
}
