package com.example.trackscribe.engine;

import com.example.trackscribe.engine.Interfaces.TranscriptionEngine;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.file.Path;
import java.util.List;

/**
 * Offline stand-in for local runs without a transcription service. Produces one segment per
 * file and echoes it back as the alignment.
 */
public class DummyTranscriptionEngine implements TranscriptionEngine {
    private final ObjectMapper objectMapper;

    public DummyTranscriptionEngine(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Transcription transcribe(Path audio, String languageHint) {
        String lang = (languageHint == null || languageHint.isBlank()) ? "en" : languageHint;
        return new Transcription(lang, List.of(new Segment(0.0, 1.0, "Transcript of " + audio.getFileName())));
    }

    @Override
    public JsonNode align(Transcription transcription, Path audio) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode segments = root.putArray("segments");
        for (Segment s : transcription.segments()) {
            ObjectNode seg = segments.addObject();
            seg.put("start", s.start());
            seg.put("end", s.end());
            seg.put("text", s.text());
            seg.putArray("words");
        }
        root.putArray("word_segments");
        return root;
    }

    @Override
    public String provider() {
        return "dummy";
    }
}
