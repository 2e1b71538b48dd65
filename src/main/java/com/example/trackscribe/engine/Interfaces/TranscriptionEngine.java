package com.example.trackscribe.engine.Interfaces;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.util.List;

public interface TranscriptionEngine {
    record Segment(double start, double end, String text) {}
    record Transcription(String language, List<Segment> segments) {}

    Transcription transcribe(Path audio, String languageHint) throws Exception;

    /**
     * Forced alignment of the segments against the audio. The result is a JSON object with a
     * {@code segments} array; segments may carry {@code words} and {@code chars} timings.
     */
    JsonNode align(Transcription transcription, Path audio) throws Exception;

    String provider();
}
