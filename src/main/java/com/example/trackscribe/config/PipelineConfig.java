package com.example.trackscribe.config;

import com.example.trackscribe.service.ArtifactPaths;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Path;

@EnableConfigurationProperties(PipelineProperties.class)
@Configuration
public class PipelineConfig {

    @Bean
    public ArtifactPaths artifactPaths(PipelineProperties properties) {
        Path base = Path.of(properties.getWorkDir());
        var paths = new ArtifactPaths(base, properties.getAudioDir(), properties.getTranscriptDir(), properties.getAudioFormat());
        paths.init();
        LoggerFactory.getLogger(PipelineConfig.class)
                .info("Artifacts wired: base={}, audioDir={}, transcriptDir={}", base, properties.getAudioDir(), properties.getTranscriptDir());
        return paths;
    }

    /**
     * Runs playlist entries when {@code pipeline.max-concurrency} is above one.
     */
    @Bean(name = "pipelineTaskExecutor")
    public ThreadPoolTaskExecutor pipelineTaskExecutor(PipelineProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getMaxConcurrency());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("pipeline-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
