package uk.gegc.quizengine.shared.config;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class AsyncConfigTest {

    @Autowired
    private AsyncConfig asyncConfig;

    @Autowired
    @Qualifier("progressTaskExecutor")
    private ThreadPoolTaskExecutor progressTaskExecutor;

    @Test
    void shouldCreateSingleWorkerProgressExecutor() {
        assertEquals(1, progressTaskExecutor.getCorePoolSize());
        assertEquals(1, progressTaskExecutor.getMaxPoolSize());
        assertEquals(500, progressTaskExecutor.getQueueCapacity());
        assertTrue(progressTaskExecutor.getThreadNamePrefix().startsWith("progress-"));
    }

    @Test
    void shouldReturnProgressExecutorAsDefault() {
        assertSame(progressTaskExecutor, asyncConfig.getAsyncExecutor());
    }

    @Test
    void shouldProvideUncaughtExceptionHandler() {
        assertNotNull(asyncConfig.getAsyncUncaughtExceptionHandler());
    }

    @Test
    void fullQueueDropsInsteadOfThrowing() {
        RejectedExecutionHandler handler = AsyncConfig.dropWithWarning();
        ThreadPoolExecutor pool = new ThreadPoolExecutor(1, 1, 0, TimeUnit.SECONDS, new ArrayBlockingQueue<>(1));
        try {
            assertDoesNotThrow(() -> handler.rejectedExecution(() -> { }, pool));
        } finally {
            pool.shutdownNow();
        }
    }
}
