package com.example.trackscribe.controller;

import com.example.trackscribe.dto.PipelineReport;
import com.example.trackscribe.dto.web.IngestRequest;
import com.example.trackscribe.dto.web.IngestResponse;
import com.example.trackscribe.dto.web.PageResponse;
import com.example.trackscribe.dto.web.TrackResponse;
import com.example.trackscribe.dto.web.TranscriptResponse;
import com.example.trackscribe.exception.PipelineAbortedException;
import com.example.trackscribe.model.Track;
import com.example.trackscribe.repository.TrackRepository;
import com.example.trackscribe.service.Interfaces.TrackStore;
import com.example.trackscribe.service.PipelineOrchestrator;
import com.example.trackscribe.util.TrackIdResolver;
import com.example.trackscribe.util.TrackStatus;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.Locale;
import java.util.UUID;

@RestController
@RequestMapping("/v1")
public class TrackController {
    private static final Logger LOGGER = LoggerFactory.getLogger(TrackController.class);
    private static final int MAX_PAGE_SIZE = 200;

    private final PipelineOrchestrator orchestrator;
    private final TrackStore store;
    private final TrackRepository trackRepo;

    public TrackController(PipelineOrchestrator orchestrator, TrackStore store, TrackRepository trackRepo) {
        this.orchestrator = orchestrator;
        this.store = store;
        this.trackRepo = trackRepo;
    }

    /** Runs the pipeline for one track or playlist and returns the per-entry outcomes. */
    @PostMapping("/ingest")
    public IngestResponse ingest(@Valid @RequestBody IngestRequest request) {
        try {
            PipelineReport report = request.playlist()
                    ? orchestrator.processPlaylist(request.url())
                    : orchestrator.processTrack(request.url());
            return IngestResponse.from(report);
        } catch (PipelineAbortedException e) {
            LOGGER.warn("Ingest aborted url={} cause={}", request.url(), e.getCause() == null ? "-" : e.getCause().getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, e.getMessage(), e);
        }
    }

    @GetMapping("/tracks/{id}")
    public TrackResponse get(@PathVariable UUID id) {
        return store.findTrack(id).map(TrackResponse::from)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Track not found: " + id));
    }

    @GetMapping("/tracks/{id}/transcript")
    public TranscriptResponse transcript(@PathVariable UUID id) {
        return store.findTranscript(id).map(TranscriptResponse::from)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Transcript not found for track: " + id));
    }

    /** Looks a track up by its canonical page url; the id is derived, not searched. */
    @GetMapping("/tracks/lookup")
    public TrackResponse lookup(@RequestParam String url) {
        UUID id;
        try {
            id = TrackIdResolver.resolveId(url);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        return get(id);
    }

    @GetMapping("/tracks")
    public PageResponse<TrackResponse> list(@RequestParam(required = false) String status,
                                            @RequestParam(required = false) String playlistUrl,
                                            @RequestParam(defaultValue = "0") int page,
                                            @RequestParam(defaultValue = "20") int size) {
        if (page < 0 || size < 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "page must be >= 0 and size >= 1");
        }
        PageRequest pageable = PageRequest.of(page, Math.min(size, MAX_PAGE_SIZE));
        Page<Track> tracks;
        if (playlistUrl != null && !playlistUrl.isBlank()) {
            tracks = trackRepo.findByPlaylistUrlOrderByTrackNumberInPlaylistAsc(playlistUrl, pageable);
        } else if (status != null && !status.isBlank()) {
            tracks = trackRepo.findByStatusOrderByUpdatedAtDesc(parseStatus(status), pageable);
        } else {
            tracks = trackRepo.findAll(pageable.withSort(Sort.by(Sort.Direction.DESC, "updatedAt")));
        }
        return new PageResponse<>(tracks.map(TrackResponse::from).getContent(), tracks.getNumber(), tracks.getSize(),
                tracks.getTotalElements());
    }

    @DeleteMapping("/tracks/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        if (!store.deleteTrack(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Track not found: " + id);
        }
        return ResponseEntity.noContent().build();
    }

    private static TrackStatus parseStatus(String raw) {
        try {
            return TrackStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown status: " + raw);
        }
    }
}
