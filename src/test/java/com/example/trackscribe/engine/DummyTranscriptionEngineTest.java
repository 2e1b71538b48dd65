package com.example.trackscribe.engine;

import com.example.trackscribe.engine.Interfaces.TranscriptionEngine;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DummyTranscriptionEngineTest {

    @Test
    void echoesOneSegmentPerFile() {
        var engine = new DummyTranscriptionEngine(new ObjectMapper());
        Path audio = Path.of("abc.wav");

        TranscriptionEngine.Transcription t = engine.transcribe(audio, null);
        JsonNode aligned = engine.align(t, audio);

        assertEquals("en", t.language());
        assertEquals(1, aligned.path("segments").size());
        assertEquals("Transcript of abc.wav", aligned.path("segments").get(0).path("text").asText());
        assertTrue(aligned.path("segments").get(0).path("words").isArray());
        assertEquals("dummy", engine.provider());
    }
}
