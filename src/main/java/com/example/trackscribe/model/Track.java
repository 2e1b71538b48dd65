package com.example.trackscribe.model;

import com.example.trackscribe.dto.TrackMetadata;
import com.example.trackscribe.util.TrackIdResolver;
import com.example.trackscribe.util.TrackStatus;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "tracks")
public class Track {
    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "title", nullable = false, length = 512)
    private String title;

    @Column(name = "webpage_url", nullable = false, unique = true, length = 1024)
    private String webpageUrl;

    // last resolved media link; informational only, never used to re-download
    @Column(name = "download_url", length = 2048)
    private String downloadUrl;

    @Column(name = "uploader", length = 255)
    private String uploader;

    @Column(name = "duration_seconds")
    private Double durationSeconds;

    @Column(name = "playlist_title", length = 512)
    private String playlistTitle;

    @Column(name = "playlist_url", length = 1024)
    private String playlistUrl;

    @Column(name = "track_number_in_playlist")
    private Integer trackNumberInPlaylist;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private TrackStatus status = TrackStatus.PENDING;

    @Column(name = "audio_file_path", length = 1024)
    private String audioFilePath;

    @Column(name = "created_at", insertable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", insertable = false, updatable = false)
    private Instant updatedAt;

    public Track() {}

    public Track(String title, String webpageUrl, String downloadUrl) {
        this.id = TrackIdResolver.resolveId(webpageUrl);
        this.title = title;
        this.webpageUrl = webpageUrl;
        this.downloadUrl = downloadUrl;
    }

    /** New in-memory track for a discovered entry, status PENDING. */
    public static Track discovered(TrackMetadata metadata) {
        Track track = new Track(metadata.title(), metadata.webpageUrl(), metadata.mediaUrl());
        track.setUploader(metadata.uploader());
        track.setDurationSeconds(metadata.durationSeconds());
        track.setPlaylistTitle(metadata.playlistTitle());
        track.setPlaylistUrl(metadata.playlistUrl());
        track.setTrackNumberInPlaylist(metadata.trackNumberInPlaylist());
        return track;
    }

    /**
     * Moves the status forward. Requests to go back are ignored so a stage can never regress a
     * track.
     */
    public void advanceTo(TrackStatus next) {
        this.status = TrackStatus.furthest(this.status, next);
    }

    public UUID getId() { return id; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public String getWebpageUrl() { return webpageUrl; }
    public String getDownloadUrl() { return downloadUrl; }
    public void setDownloadUrl(String downloadUrl) { this.downloadUrl = downloadUrl; }
    public String getUploader() { return uploader; }
    public void setUploader(String uploader) { this.uploader = uploader; }
    public Double getDurationSeconds() { return durationSeconds; }
    public void setDurationSeconds(Double durationSeconds) { this.durationSeconds = durationSeconds; }
    public String getPlaylistTitle() { return playlistTitle; }
    public void setPlaylistTitle(String playlistTitle) { this.playlistTitle = playlistTitle; }
    public String getPlaylistUrl() { return playlistUrl; }
    public void setPlaylistUrl(String playlistUrl) { this.playlistUrl = playlistUrl; }
    public Integer getTrackNumberInPlaylist() { return trackNumberInPlaylist; }
    public void setTrackNumberInPlaylist(Integer trackNumberInPlaylist) { this.trackNumberInPlaylist = trackNumberInPlaylist; }
    public TrackStatus getStatus() { return status; }
    public String getAudioFilePath() { return audioFilePath; }
    public void setAudioFilePath(String audioFilePath) { this.audioFilePath = audioFilePath; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    @Override
    public String toString() {
        String shortTitle = title == null ? "" : title.substring(0, Math.min(30, title.length()));
        return "Track{id=" + id + ", title='" + shortTitle + "', webpageUrl='" + webpageUrl + "', status=" + status + '}';
    }
}
