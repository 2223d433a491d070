package com.calai.portion.config;

import com.calai.portion.volume.config.VolumeEstimationProperties;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class AsyncConfigTest {

    @Test
    void saturated_pool_rejects_instead_of_using_caller_thread() throws Exception {
        VolumeEstimationProperties props = new VolumeEstimationProperties();
        props.getExecutor().setCorePoolSize(1);
        props.getExecutor().setMaxPoolSize(1);
        props.getExecutor().setQueueCapacity(0);

        ThreadPoolTaskExecutor ex = new AsyncConfig().volumeEvidenceExecutor(props);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        try {
            ex.execute(() -> {
                started.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            AtomicReference<Thread> ranOn = new AtomicReference<>();
            assertThatThrownBy(() -> ex.execute(() -> ranOn.set(Thread.currentThread())))
                    .isInstanceOf(RejectedExecutionException.class);
            assertThat(ranOn.get()).isNull();
        } finally {
            release.countDown();
            ex.shutdown();
        }
    }
}
