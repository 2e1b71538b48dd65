package com.example.trackscribe.service;

import com.example.trackscribe.config.PipelineProperties;
import com.example.trackscribe.dto.PipelineReport;
import com.example.trackscribe.dto.TrackMetadata;
import com.example.trackscribe.dto.TrackOutcome;
import com.example.trackscribe.dto.TranscribedTrack;
import com.example.trackscribe.engine.Interfaces.AudioSource;
import com.example.trackscribe.exception.MetadataException;
import com.example.trackscribe.exception.PipelineAbortedException;
import com.example.trackscribe.model.Track;
import com.example.trackscribe.service.Interfaces.TrackStore;
import com.example.trackscribe.util.TrackIdResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs tracks through discovery, fetch, transcription and persistence. Every stage is skipped
 * when its result already exists, so re-running the same URL is cheap and side-effect free.
 */
@Service
public class PipelineOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineOrchestrator.class);
    static final String MDC_TRACK_ID = "trackId";

    private final AudioSource audioSource;
    private final TrackStore store;
    private final FetchStage fetchStage;
    private final TranscribeStage transcribeStage;
    private final TrackLocks trackLocks;
    private final PipelineProperties properties;
    private final Executor executor;

    public PipelineOrchestrator(AudioSource audioSource, TrackStore store, FetchStage fetchStage,
                                TranscribeStage transcribeStage, TrackLocks trackLocks, PipelineProperties properties,
                                @Qualifier("pipelineTaskExecutor") Executor executor) {
        this.audioSource = audioSource;
        this.store = store;
        this.fetchStage = fetchStage;
        this.transcribeStage = transcribeStage;
        this.trackLocks = trackLocks;
        this.properties = properties;
        this.executor = executor;
    }

    /** Processes {@code pipeline.url} as a playlist or a single track, per {@code pipeline.playlist}. */
    public PipelineReport run() {
        String url = properties.getUrl();
        if (url == null || url.isBlank()) {
            throw new IllegalStateException("pipeline.url is not configured");
        }
        return properties.isPlaylist() ? processPlaylist(url) : processTrack(url);
    }

    public PipelineReport processTrack(String trackUrl) {
        LOGGER.info("Processing single track url={}", trackUrl);
        Optional<TrackMetadata> metadata = audioSource.resolveTrack(trackUrl);
        if (metadata.isEmpty()) {
            LOGGER.warn("No metadata for track url={}, nothing to do", trackUrl);
            return new PipelineReport(trackUrl, false, List.of(TrackOutcome.invalid(1, trackUrl, "no metadata")));
        }
        EntryResult result = runEntry(1, metadata.get());
        List<TrackOutcome> outcomes = List.of(result.outcome());
        if (result.error() != null && !properties.isContinueOnError()) {
            throw new PipelineAbortedException("Pipeline aborted for " + trackUrl, result.error(),
                    new PipelineReport(trackUrl, false, outcomes));
        }
        return summarise(new PipelineReport(trackUrl, false, outcomes));
    }

    public PipelineReport processPlaylist(String playlistUrl) {
        LOGGER.info("Processing playlist url={}", playlistUrl);
        List<TrackMetadata> entries = audioSource.resolvePlaylist(playlistUrl);
        LOGGER.info("Playlist url={} entries={}", playlistUrl, entries.size());
        if (properties.getMaxConcurrency() > 1 && entries.size() > 1) {
            return processConcurrently(playlistUrl, entries);
        }

        List<TrackOutcome> outcomes = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            EntryResult result = runEntry(i + 1, entries.get(i));
            outcomes.add(result.outcome());
            if (result.error() != null && !properties.isContinueOnError()) {
                throw new PipelineAbortedException("Pipeline aborted at entry " + (i + 1) + " of " + playlistUrl,
                        result.error(), new PipelineReport(playlistUrl, true, outcomes));
            }
        }
        return summarise(new PipelineReport(playlistUrl, true, outcomes));
    }

    private PipelineReport processConcurrently(String playlistUrl, List<TrackMetadata> entries) {
        AtomicBoolean aborted = new AtomicBoolean(false);
        boolean continueOnError = properties.isContinueOnError();
        List<CompletableFuture<EntryResult>> futures = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            int position = i + 1;
            TrackMetadata entry = entries.get(i);
            futures.add(CompletableFuture.supplyAsync(() -> {
                if (aborted.get()) {
                    return null;
                }
                EntryResult result = runEntry(position, entry);
                if (result.error() != null && !continueOnError) {
                    aborted.set(true);
                }
                return result;
            }, executor));
        }

        List<TrackOutcome> outcomes = new ArrayList<>(entries.size());
        RuntimeException firstError = null;
        int failedAt = 0;
        for (CompletableFuture<EntryResult> future : futures) {
            EntryResult result = future.join();
            if (result == null) {
                continue;
            }
            outcomes.add(result.outcome());
            if (result.error() != null && firstError == null) {
                firstError = result.error();
                failedAt = result.outcome().position();
            }
        }
        PipelineReport report = new PipelineReport(playlistUrl, true, outcomes);
        if (firstError != null && !continueOnError) {
            throw new PipelineAbortedException("Pipeline aborted at entry " + failedAt + " of " + playlistUrl,
                    firstError, report);
        }
        return summarise(report);
    }

    private EntryResult runEntry(int position, TrackMetadata metadata) {
        if (!metadata.hasLocators()) {
            LOGGER.warn("Skipping entry {} '{}': missing webpage or media url", position, metadata.title());
            return new EntryResult(TrackOutcome.invalid(position, metadata.webpageUrl(), "missing webpage or media url"), null);
        }
        UUID trackId = TrackIdResolver.resolveId(metadata.webpageUrl());
        MDC.put(MDC_TRACK_ID, trackId.toString());
        try {
            TrackOutcome outcome = trackLocks.withLock(trackId, () -> processEntry(position, metadata, trackId));
            return new EntryResult(outcome, null);
        } catch (MetadataException e) {
            LOGGER.warn("Skipping entry {} track={}: {}", position, trackId, e.getMessage());
            return new EntryResult(TrackOutcome.invalid(position, metadata.webpageUrl(), e.getMessage()), null);
        } catch (RuntimeException e) {
            LOGGER.error("Track failed entry={} track={} url={}", position, trackId, metadata.webpageUrl(), e);
            return new EntryResult(TrackOutcome.failed(position, metadata.webpageUrl(), trackId, e), e);
        } finally {
            MDC.remove(MDC_TRACK_ID);
        }
    }

    private TrackOutcome processEntry(int position, TrackMetadata metadata, UUID trackId) {
        if (store.isTranscribed(metadata.webpageUrl())) {
            LOGGER.info("Already transcribed, skipping track={} title='{}'", trackId, metadata.title());
            return TrackOutcome.alreadyTranscribed(position, metadata.webpageUrl(), trackId);
        }
        Track track = Track.discovered(metadata);
        fetchStage.fetchTrack(track);
        store.upsertTrack(track);

        TranscribedTrack transcribed = transcribeStage.transcribeTrack(track, properties.isPersistTranscripts());
        store.saveTranscribed(transcribed.track(), transcribed.transcript());
        LOGGER.info("Track done track={} title='{}' status={}", trackId, track.getTitle(), track.getStatus());
        return TrackOutcome.processed(position, metadata.webpageUrl(), trackId);
    }

    private static PipelineReport summarise(PipelineReport report) {
        LOGGER.info("Pipeline finished url={} processed={} skipped={} failed={}",
                report.sourceUrl(), report.processed(), report.skipped(), report.failed());
        return report;
    }

    private record EntryResult(TrackOutcome outcome, RuntimeException error) { }
}
