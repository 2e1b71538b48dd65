package com.example.trackscribe.service;

import com.example.trackscribe.model.Track;
import com.example.trackscribe.model.Transcript;
import com.example.trackscribe.service.Interfaces.TrackStore;
import com.example.trackscribe.util.TrackIdResolver;
import com.example.trackscribe.util.TrackStatus;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/** Map-backed store with the same status rules as the PostgreSQL one. */
class InMemoryTrackStore implements TrackStore {
    final Map<UUID, Track> tracks = new ConcurrentHashMap<>();
    final Map<UUID, Transcript> transcripts = new ConcurrentHashMap<>();
    final AtomicInteger writes = new AtomicInteger();

    @Override
    public boolean isTranscribed(String canonicalUrl) {
        Track track = tracks.get(TrackIdResolver.resolveId(canonicalUrl));
        return track != null && track.getStatus().isAtLeast(TrackStatus.TRANSCRIBED);
    }

    @Override
    public synchronized void upsertTrack(Track track) {
        if (track.getStatus().isAtLeast(TrackStatus.TRANSCRIBED) && !transcripts.containsKey(track.getId())) {
            throw new IllegalStateException("no transcript for " + track.getId());
        }
        Track copy = new Track(track.getTitle(), track.getWebpageUrl(), track.getDownloadUrl());
        copy.setUploader(track.getUploader());
        copy.setDurationSeconds(track.getDurationSeconds());
        copy.setPlaylistTitle(track.getPlaylistTitle());
        copy.setPlaylistUrl(track.getPlaylistUrl());
        copy.setTrackNumberInPlaylist(track.getTrackNumberInPlaylist());
        copy.advanceTo(track.getStatus());
        Track existing = tracks.get(track.getId());
        copy.setAudioFilePath(track.getAudioFilePath());
        if (existing != null) {
            copy.advanceTo(existing.getStatus());
            if (copy.getAudioFilePath() == null) {
                copy.setAudioFilePath(existing.getAudioFilePath());
            }
        }
        tracks.put(copy.getId(), copy);
        writes.incrementAndGet();
    }

    @Override
    public synchronized void upsertTranscript(Transcript transcript) {
        if (!tracks.containsKey(transcript.getId())) {
            throw new IllegalStateException("no track for transcript " + transcript.getId());
        }
        transcripts.put(transcript.getId(), transcript);
        writes.incrementAndGet();
    }

    @Override
    public synchronized void saveTranscribed(Track track, Transcript transcript) {
        if (!tracks.containsKey(track.getId())) {
            Track pending = new Track(track.getTitle(), track.getWebpageUrl(), track.getDownloadUrl());
            upsertTrack(pending);
        }
        upsertTranscript(transcript);
        upsertTrack(track);
    }

    @Override
    public Optional<Track> findTrack(UUID id) {
        return Optional.ofNullable(tracks.get(id));
    }

    @Override
    public Optional<Transcript> findTranscript(UUID trackId) {
        return Optional.ofNullable(transcripts.get(trackId));
    }

    @Override
    public long countTracks() {
        return tracks.size();
    }

    @Override
    public synchronized boolean deleteTrack(UUID id) {
        transcripts.remove(id);
        return tracks.remove(id) != null;
    }
}
