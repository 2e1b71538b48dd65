package com.example.trackscribe.service;

import com.example.trackscribe.model.Track;
import com.example.trackscribe.model.Transcript;
import com.example.trackscribe.repository.TrackRepository;
import com.example.trackscribe.repository.TranscriptRepository;
import com.example.trackscribe.service.Interfaces.TrackStore;
import com.example.trackscribe.util.TrackIdResolver;
import com.example.trackscribe.util.TrackStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Types;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * {@link TrackStore} on PostgreSQL. Reads go through the JPA repositories; every write is one
 * {@code insert ... on conflict do update} statement so a failure leaves either the old or the
 * new row.
 */
@Service
public class PostgresTrackStore implements TrackStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresTrackStore.class);
    private static final List<TrackStatus> TRANSCRIBED_OR_LATER = List.of(TrackStatus.TRANSCRIBED, TrackStatus.EMBEDDED);

    private static final String STATUS_ORDER = Arrays.stream(TrackStatus.values())
            .map(s -> "'" + s.name() + "'")
            .collect(Collectors.joining(",", "array[", "]::varchar[]"));

    private static final String UPSERT_TRACK = """
            insert into tracks (id, title, webpage_url, download_url, uploader, duration_seconds,
                                playlist_title, playlist_url, track_number_in_playlist, status,
                                audio_file_path, created_at, updated_at)
            values (:id, :title, :webpageUrl, :downloadUrl, :uploader, :durationSeconds,
                    :playlistTitle, :playlistUrl, :trackNumber, :status,
                    :audioFilePath, now(), now())
            on conflict (id) do update set
                title = excluded.title,
                webpage_url = excluded.webpage_url,
                download_url = excluded.download_url,
                uploader = excluded.uploader,
                duration_seconds = excluded.duration_seconds,
                playlist_title = excluded.playlist_title,
                playlist_url = excluded.playlist_url,
                track_number_in_playlist = excluded.track_number_in_playlist,
                status = case
                    when array_position(%1$s, excluded.status) > array_position(%1$s, tracks.status)
                    then excluded.status else tracks.status end,
                audio_file_path = coalesce(excluded.audio_file_path, tracks.audio_file_path),
                updated_at = now()
            """.formatted(STATUS_ORDER);

    private static final String UPSERT_TRANSCRIPT = """
            insert into transcripts (id, language, aligned_result, plain_text, embedding, created_at, updated_at)
            values (:id, :language, cast(:alignedResult as jsonb), :plainText, cast(:embedding as jsonb), now(), now())
            on conflict (id) do update set
                language = excluded.language,
                aligned_result = excluded.aligned_result,
                plain_text = excluded.plain_text,
                embedding = excluded.embedding,
                updated_at = now()
            """;

    private final JdbcClient db;
    private final TrackRepository trackRepository;
    private final TranscriptRepository transcriptRepository;
    private final ObjectMapper objectMapper;

    public PostgresTrackStore(JdbcClient db, TrackRepository trackRepository,
                              TranscriptRepository transcriptRepository, ObjectMapper objectMapper) {
        this.db = db;
        this.trackRepository = trackRepository;
        this.transcriptRepository = transcriptRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isTranscribed(String canonicalUrl) {
        UUID id = TrackIdResolver.resolveId(canonicalUrl);
        return trackRepository.existsByIdAndStatusIn(id, TRANSCRIBED_OR_LATER);
    }

    @Override
    @Transactional
    public void upsertTrack(Track track) {
        writeTrack(track, track.getStatus());
    }

    @Override
    @Transactional
    public void upsertTranscript(Transcript transcript) {
        Objects.requireNonNull(transcript.getId(), "transcript id");
        Objects.requireNonNull(transcript.getAlignedResult(), "aligned result");
        String embedding = transcript.getEmbedding() == null ? null
                : objectMapper.valueToTree(transcript.getEmbedding()).toString();
        db.sql(UPSERT_TRANSCRIPT)
                .param("id", transcript.getId())
                .param("language", transcript.getLanguage(), Types.VARCHAR)
                .param("alignedResult", transcript.getAlignedResult().toString(), Types.VARCHAR)
                .param("plainText", transcript.getPlainText(), Types.VARCHAR)
                .param("embedding", embedding, Types.VARCHAR)
                .update();
        LOGGER.debug("Transcript upsert track={} language={}", transcript.getId(), transcript.getLanguage());
    }

    @Override
    @Transactional
    public void saveTranscribed(Track track, Transcript transcript) {
        if (!track.getId().equals(transcript.getId())) {
            throw new IllegalArgumentException("transcript " + transcript.getId() + " does not belong to track " + track.getId());
        }
        // the transcript row needs its track row first; DOWNLOADED at most until the transcript exists
        TrackStatus beforeTranscript = track.getStatus().isAtLeast(TrackStatus.TRANSCRIBED) ? TrackStatus.DOWNLOADED : track.getStatus();
        writeTrack(track, beforeTranscript);
        upsertTranscript(transcript);
        writeTrack(track, track.getStatus());
        LOGGER.info("Track persisted track={} status={}", track.getId(), track.getStatus());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Track> findTrack(UUID id) {
        return trackRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Transcript> findTranscript(UUID trackId) {
        return transcriptRepository.findById(trackId);
    }

    @Override
    @Transactional(readOnly = true)
    public long countTracks() {
        return trackRepository.count();
    }

    @Override
    @Transactional
    public boolean deleteTrack(UUID id) {
        Optional<Track> track = trackRepository.findById(id);
        if (track.isEmpty()) {
            return false;
        }
        transcriptRepository.findById(id).ifPresent(transcriptRepository::delete);
        trackRepository.delete(track.get());
        LOGGER.info("Track deleted track={}", id);
        return true;
    }

    private void writeTrack(Track track, TrackStatus status) {
        Objects.requireNonNull(track.getId(), "track id");
        if (status.isAtLeast(TrackStatus.TRANSCRIBED) && !transcriptExists(track.getId())) {
            throw new IllegalStateException("Track " + track.getId() + " cannot be " + status + " without a transcript");
        }
        db.sql(UPSERT_TRACK)
                .param("id", track.getId())
                .param("title", track.getTitle(), Types.VARCHAR)
                .param("webpageUrl", track.getWebpageUrl(), Types.VARCHAR)
                .param("downloadUrl", track.getDownloadUrl(), Types.VARCHAR)
                .param("uploader", track.getUploader(), Types.VARCHAR)
                .param("durationSeconds", track.getDurationSeconds(), Types.DOUBLE)
                .param("playlistTitle", track.getPlaylistTitle(), Types.VARCHAR)
                .param("playlistUrl", track.getPlaylistUrl(), Types.VARCHAR)
                .param("trackNumber", track.getTrackNumberInPlaylist(), Types.INTEGER)
                .param("status", status.name(), Types.VARCHAR)
                .param("audioFilePath", track.getAudioFilePath(), Types.VARCHAR)
                .update();
        LOGGER.debug("Track upsert track={} status={}", track.getId(), status);
    }

    private boolean transcriptExists(UUID id) {
        return db.sql("select exists(select 1 from transcripts where id = :id)")
                .param("id", id)
                .query(Boolean.class)
                .single();
    }
}
