package com.example.trackscribe.dto.web;

import com.example.trackscribe.model.Track;

import java.time.Instant;
import java.util.UUID;

public record TrackResponse(
        UUID id,
        String title,
        String webpageUrl,
        String uploader,
        Double durationSeconds,
        String playlistTitle,
        String playlistUrl,
        Integer trackNumberInPlaylist,
        String status,
        String audioFilePath,
        Instant createdAt,
        Instant updatedAt
) {
    public static TrackResponse from(Track t) {
        return new TrackResponse(t.getId(), t.getTitle(), t.getWebpageUrl(), t.getUploader(), t.getDurationSeconds(),
                t.getPlaylistTitle(), t.getPlaylistUrl(), t.getTrackNumberInPlaylist(), t.getStatus().name(),
                t.getAudioFilePath(), t.getCreatedAt(), t.getUpdatedAt());
    }
}
