package com.example.trackscribe.dto.web;

import com.example.trackscribe.model.Transcript;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

public record TranscriptResponse(UUID trackId, String language, String text, JsonNode alignedResult, Instant updatedAt) {

    public static TranscriptResponse from(Transcript t) {
        return new TranscriptResponse(t.getId(), t.getLanguage(), t.getPlainText() == null ? "" : t.getPlainText(),
                t.getAlignedResult(), t.getUpdatedAt());
    }
}
