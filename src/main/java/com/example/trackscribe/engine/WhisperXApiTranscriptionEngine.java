package com.example.trackscribe.engine;

import com.example.trackscribe.config.AsrProperties;
import com.example.trackscribe.engine.Interfaces.TranscriptionEngine;
import com.example.trackscribe.exception.AsrException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpStatusCode;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.PrematureCloseException;
import reactor.util.retry.Retry;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Talks to a WhisperX HTTP service: {@code POST /transcribe} for batched Whisper inference and
 * {@code POST /align} for the wav2vec2 forced-alignment pass.
 */
public class WhisperXApiTranscriptionEngine implements TranscriptionEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(WhisperXApiTranscriptionEngine.class);
    private static final int RETRY_MAX_ATTEMPTS = 2;
    private static final Duration RETRY_BACKOFF = Duration.ofSeconds(2);

    private final WebClient client;
    private final AsrProperties props;
    private final ObjectMapper objectMapper;

    public WhisperXApiTranscriptionEngine(WebClient client, AsrProperties props, ObjectMapper objectMapper) {
        this.client = client;
        this.props = props;
        this.objectMapper = objectMapper;
    }

    @Override
    public Transcription transcribe(Path audio, String languageHint) {
        requireAudio(audio);
        var form = new LinkedMultiValueMap<String, Object>();
        form.add("file", new FileSystemResource(audio));
        form.add("model", props.getModel());
        form.add("batch_size", String.valueOf(props.getBatchSize()));
        if (languageHint != null && !languageHint.isBlank()) {
            form.add("language", languageHint.toLowerCase(Locale.ROOT));
        }

        long start = System.currentTimeMillis();
        JsonNode root = post("/transcribe", form, audio);
        String language = text(root, "language");
        List<Segment> segments = new ArrayList<>();
        for (JsonNode seg : root.path("segments")) {
            segments.add(new Segment(
                    seg.path("start").asDouble(0.0),
                    seg.path("end").asDouble(0.0),
                    seg.path("text").asText("")));
        }
        LOGGER.info("WhisperX transcribe file={} language={} segments={} in={}ms",
                audio.getFileName(), language, segments.size(), System.currentTimeMillis() - start);
        return new Transcription(language, segments);
    }

    @Override
    public JsonNode align(Transcription transcription, Path audio) {
        requireAudio(audio);
        String segmentsJson;
        try {
            segmentsJson = objectMapper.writeValueAsString(transcription.segments());
        } catch (JsonProcessingException e) {
            throw new AsrException("Unable to serialise segments for alignment", e);
        }
        var form = new LinkedMultiValueMap<String, Object>();
        form.add("file", new FileSystemResource(audio));
        if (transcription.language() != null && !transcription.language().isBlank()) {
            form.add("language", transcription.language());
        }
        form.add("segments", segmentsJson);
        form.add("return_char_alignments", "false");

        long start = System.currentTimeMillis();
        JsonNode aligned = post("/align", form, audio);
        LOGGER.info("WhisperX align file={} segments={} in={}ms",
                audio.getFileName(), aligned.path("segments").size(), System.currentTimeMillis() - start);
        return aligned;
    }

    @Override
    public String provider() {
        return "whisperx";
    }

    private JsonNode post(String path, MultiValueMap<String, Object> form, Path audio) {
        Duration blockTimeout = Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds()));
        JsonNode root = client.post()
                .uri(path)
                .body(BodyInserters.fromMultipartData(form))
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .flatMap(body -> Mono.error(new AsrException(
                                        "WhisperX %s error %s: %s".formatted(path, resp.statusCode(), body)))))
                .bodyToMono(JsonNode.class)
                .retryWhen(Retry.backoff(RETRY_MAX_ATTEMPTS, RETRY_BACKOFF)
                        .filter(WhisperXApiTranscriptionEngine::isRetryable)
                        .doBeforeRetry(signal -> LOGGER.warn("WhisperX retry attempt={} path={} file={} cause={}",
                                signal.totalRetriesInARow() + 1, path, audio.getFileName(),
                                signal.failure() == null ? "unknown" : signal.failure().toString()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .block(blockTimeout);
        if (root == null) {
            throw new AsrException("Empty response from WhisperX " + path);
        }
        return root;
    }

    private static boolean isRetryable(Throwable throwable) {
        Throwable cursor = throwable;
        while (cursor != null) {
            if (cursor instanceof PrematureCloseException) {
                return true;
            }
            cursor = cursor.getCause();
        }
        return false;
    }

    private static void requireAudio(Path audio) {
        if (audio == null || !Files.exists(audio)) {
            throw new IllegalArgumentException("audio not found: " + audio);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode n = node.path(field);
        return (n.isMissingNode() || n.isNull()) ? null : n.asText();
    }
}
