package com.example.trackscribe.exception;

import java.nio.file.Path;
import java.util.UUID;

/** Transcription was requested for a track whose audio artifact is not on disk. */
public class MissingArtifactException extends IllegalStateException {
    private final UUID trackId;

    public MissingArtifactException(UUID trackId, Path expected) {
        super("Audio artifact missing for track " + trackId + (expected == null ? "" : " at " + expected));
        this.trackId = trackId;
    }

    public UUID getTrackId() {
        return trackId;
    }
}
