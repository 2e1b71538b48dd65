package com.example.trackscribe.service.Interfaces;

import com.example.trackscribe.model.Track;
import com.example.trackscribe.model.Transcript;

import java.util.Optional;
import java.util.UUID;

/**
 * Durable track and transcript records. Writes are single-row upserts keyed by the track id;
 * storage failures surface as Spring {@code DataAccessException}s.
 */
public interface TrackStore {

    /** True when the track for this canonical URL has been transcribed (or has gone further). */
    boolean isTranscribed(String canonicalUrl);

    /**
     * Insert-or-update by id. Metadata is overwritten; the stored status never moves backwards.
     *
     * @throws IllegalStateException when the status is TRANSCRIBED or later but no transcript
     *                               row exists for the track
     */
    void upsertTrack(Track track);

    /** Insert-or-update keyed by the owning track id, which must already be stored. */
    void upsertTranscript(Transcript transcript);

    /** Stores the transcript and the TRANSCRIBED track in one transaction. */
    void saveTranscribed(Track track, Transcript transcript);

    Optional<Track> findTrack(UUID id);

    Optional<Transcript> findTranscript(UUID trackId);

    long countTracks();

    /** Deletes the track and its transcript. Returns false when the track did not exist. */
    boolean deleteTrack(UUID id);
}
