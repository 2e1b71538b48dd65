package com.example.trackscribe.service;

import com.example.trackscribe.config.PipelineProperties;
import com.example.trackscribe.dto.TranscribedTrack;
import com.example.trackscribe.engine.Interfaces.TranscriptionEngine;
import com.example.trackscribe.engine.Interfaces.TranscriptionEngine.Transcription;
import com.example.trackscribe.exception.AsrException;
import com.example.trackscribe.exception.MissingArtifactException;
import com.example.trackscribe.model.Track;
import com.example.trackscribe.model.Transcript;
import com.example.trackscribe.util.TrackStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Turns a downloaded track into an aligned transcript. With disk persistence on, a cached
 * {@code <id>.json} short-circuits the engine entirely.
 */
@Service
public class TranscribeStage {
    private static final Logger LOGGER = LoggerFactory.getLogger(TranscribeStage.class);

    private final TranscriptionEngine engine;
    private final TranscriptCache cache;
    private final ObjectMapper objectMapper;
    private final String languageHint;

    public TranscribeStage(TranscriptionEngine engine, TranscriptCache cache, ObjectMapper objectMapper,
                           PipelineProperties properties) {
        this.engine = engine;
        this.cache = cache;
        this.objectMapper = objectMapper;
        this.languageHint = properties.getLanguageHint();
    }

    /**
     * @throws MissingArtifactException when the track has no audio artifact on disk
     * @throws AsrException             when transcription or alignment fails
     */
    public TranscribedTrack transcribeTrack(Track track, boolean persistToDisk) {
        Path audio = track.getAudioFilePath() == null ? null : Path.of(track.getAudioFilePath());
        if (audio == null || !Files.exists(audio)) {
            throw new MissingArtifactException(track.getId(), audio);
        }

        ObjectNode aligned = null;
        if (persistToDisk) {
            Optional<JsonNode> cached = cache.load(track.getId());
            if (cached.isPresent()) {
                LOGGER.info("Using cached transcript track={}", track.getId());
                aligned = normalise(cached.get(), null);
                if (!cache.hasText(track.getId())) {
                    cache.storeText(track.getId(), render(aligned));
                }
            }
        }
        if (aligned == null) {
            aligned = runEngine(track, audio);
            if (persistToDisk) {
                cache.storeJson(track.getId(), aligned);
                cache.storeText(track.getId(), render(aligned));
            }
        }

        String language = aligned.hasNonNull("language") ? aligned.get("language").asText() : null;
        Transcript transcript = new Transcript(track.getId(), language, aligned, render(aligned));
        track.advanceTo(TrackStatus.TRANSCRIBED);
        return new TranscribedTrack(track, transcript);
    }

    private ObjectNode runEngine(Track track, Path audio) {
        long start = System.currentTimeMillis();
        try {
            Transcription transcription = engine.transcribe(audio, languageHint);
            JsonNode aligned;
            if (transcription.segments() == null || transcription.segments().isEmpty()) {
                LOGGER.warn("No speech segments, skipping alignment track={}", track.getId());
                aligned = objectMapper.createObjectNode().set("segments", objectMapper.createArrayNode());
            } else {
                aligned = engine.align(transcription, audio);
            }
            ObjectNode normalised = normalise(aligned, transcription.language());
            LOGGER.info("Transcribed track={} provider={} language={} segments={} in={}ms", track.getId(),
                    engine.provider(), normalised.path("language").asText(null), normalised.path("segments").size(),
                    System.currentTimeMillis() - start);
            return normalised;
        } catch (AsrException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AsrException("Transcription interrupted for track " + track.getId(), e);
        } catch (Exception e) {
            throw new AsrException("Transcription failed for track " + track.getId() + ": " + e.getMessage(), e);
        }
    }

    /** Adds the language field, a segments array and a {@code chars} key on every segment. */
    ObjectNode normalise(JsonNode source, String fallbackLanguage) {
        ObjectNode doc = source != null && source.isObject()
                ? ((ObjectNode) source).deepCopy()
                : objectMapper.createObjectNode();
        if (!doc.hasNonNull("language")) {
            doc.put("language", fallbackLanguage);
        }
        if (!doc.path("segments").isArray()) {
            doc.set("segments", objectMapper.createArrayNode());
        }
        for (JsonNode segment : (ArrayNode) doc.get("segments")) {
            if (segment.isObject() && !segment.has("chars")) {
                ((ObjectNode) segment).putNull("chars");
            }
        }
        return doc;
    }

    /** One trimmed segment text per line. */
    static String render(JsonNode aligned) {
        StringJoiner lines = new StringJoiner("\n");
        for (JsonNode segment : aligned.path("segments")) {
            lines.add(segment.path("text").asText("").trim());
        }
        return lines.toString();
    }
}
