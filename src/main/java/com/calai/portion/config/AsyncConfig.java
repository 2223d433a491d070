package com.calai.portion.config;

import com.calai.portion.volume.config.VolumeEstimationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    /**
     * 參考物偵測 / 深度估計並行用。
     * 滿了直接拒絕（預設 AbortPolicy）：不能讓呼叫端執行緒自己跑，否則 evidence-timeout 就管不住。
     * 被拒絕的證據當作缺席。
     */
    @Bean("volumeEvidenceExecutor")
    public ThreadPoolTaskExecutor volumeEvidenceExecutor(VolumeEstimationProperties props) {
        VolumeEstimationProperties.Executor cfg = props.getExecutor();
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(cfg.getCorePoolSize());
        ex.setMaxPoolSize(Math.max(cfg.getCorePoolSize(), cfg.getMaxPoolSize()));
        ex.setQueueCapacity(cfg.getQueueCapacity());
        ex.setThreadNamePrefix("volume-evidence-");
        ex.setWaitForTasksToCompleteOnShutdown(false);
        ex.initialize();
        return ex;
    }
}
