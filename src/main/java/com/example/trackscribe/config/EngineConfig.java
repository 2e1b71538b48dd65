package com.example.trackscribe.config;

import com.example.trackscribe.engine.DummyTranscriptionEngine;
import com.example.trackscribe.engine.Interfaces.AudioSource;
import com.example.trackscribe.engine.Interfaces.TranscriptionEngine;
import com.example.trackscribe.engine.WhisperXApiTranscriptionEngine;
import com.example.trackscribe.engine.YtDlpAudioSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Chooses the capability adapters. {@code engine.asr} selects the transcription provider.
 */
@Configuration
@EnableConfigurationProperties(DownloaderProperties.class)
public class EngineConfig {

    @Bean
    public AudioSource audioSource(DownloaderProperties properties, ObjectMapper objectMapper) {
        return new YtDlpAudioSource(properties, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "engine.asr", havingValue = "whisperx-api", matchIfMissing = true)
    public TranscriptionEngine whisperXApiEngine(@Qualifier("asrWebClient") WebClient asrWebClient,
                                                 AsrProperties props,
                                                 ObjectMapper objectMapper) {
        return new WhisperXApiTranscriptionEngine(asrWebClient, props, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "engine.asr", havingValue = "dummy")
    public TranscriptionEngine dummyTranscriptionEngine(ObjectMapper objectMapper) {
        return new DummyTranscriptionEngine(objectMapper);
    }
}
