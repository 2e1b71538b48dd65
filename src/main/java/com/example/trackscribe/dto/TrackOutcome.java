package com.example.trackscribe.dto;

import java.util.UUID;

public record TrackOutcome(int position, String webpageUrl, UUID trackId, Status status, String error) {

    public enum Status {
        PROCESSED,
        ALREADY_TRANSCRIBED,
        INVALID_METADATA,
        FAILED
    }

    public static TrackOutcome processed(int position, String webpageUrl, UUID trackId) {
        return new TrackOutcome(position, webpageUrl, trackId, Status.PROCESSED, null);
    }

    public static TrackOutcome alreadyTranscribed(int position, String webpageUrl, UUID trackId) {
        return new TrackOutcome(position, webpageUrl, trackId, Status.ALREADY_TRANSCRIBED, null);
    }

    public static TrackOutcome invalid(int position, String webpageUrl, String reason) {
        return new TrackOutcome(position, webpageUrl, null, Status.INVALID_METADATA, reason);
    }

    public static TrackOutcome failed(int position, String webpageUrl, UUID trackId, Throwable error) {
        return new TrackOutcome(position, webpageUrl, trackId, Status.FAILED, String.valueOf(error.getMessage()));
    }
}
