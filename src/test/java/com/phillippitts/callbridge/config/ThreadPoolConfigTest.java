package com.phillippitts.callbridge.config;

import com.phillippitts.callbridge.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void callExecutorUsesDefaults() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        ThreadPoolTaskExecutor executor = config.callExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(4);
        assertThat(executor.getMaxPoolSize()).isEqualTo(16);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("call-pool-");
        executor.shutdown();
    }

    @Test
    void streamExecutorHandsOffDirectlyAndRejectsWhenFull() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getStream().setCorePoolSize(1);
        properties.getStream().setMaxPoolSize(1);
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(properties).streamExecutor();
        CountDownLatch release = new CountDownLatch(1);
        try {
            executor.execute(() -> {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });

            // Spring wraps the pool's RejectedExecutionException in its own subclass
            assertThatThrownBy(() -> executor.execute(() -> { }))
                    .isInstanceOf(RejectedExecutionException.class);
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    void streamThreadsUseConfiguredPrefix() throws InterruptedException {
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new ThreadPoolProperties()).streamExecutor();
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> threadName = new AtomicReference<>();

        executor.execute(() -> {
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertThat(latch.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(threadName.get()).startsWith("stream-pool-");
        executor.shutdown();
    }

    @Test
    void decoratorCopiesContextToWorkerAndRestoresIt() {
        ThreadContext.put("callId", "rtc_1");
        Runnable decorated = ThreadPoolConfig.mdcPropagatingDecorator().decorate(() ->
                assertThat(ThreadContext.get("callId")).isEqualTo("rtc_1"));
        ThreadContext.clearAll();
        ThreadContext.put("requestId", "worker-own");

        decorated.run();

        assertThat(ThreadContext.get("callId")).isNull();
        assertThat(ThreadContext.get("requestId")).isEqualTo("worker-own");
    }
}
