package com.example.trackscribe.service;

import com.example.trackscribe.engine.Interfaces.AudioSource;
import com.example.trackscribe.exception.FetchException;
import com.example.trackscribe.exception.MetadataException;
import com.example.trackscribe.model.Track;
import com.example.trackscribe.util.TrackStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Produces the local audio artifact of a track. The artifact location depends on the track id
 * only, so an artifact left by an earlier run is picked up instead of being fetched again.
 */
@Service
public class FetchStage {
    private static final Logger LOGGER = LoggerFactory.getLogger(FetchStage.class);

    private final AudioSource audioSource;
    private final ArtifactPaths paths;

    public FetchStage(AudioSource audioSource, ArtifactPaths paths) {
        this.audioSource = audioSource;
        this.paths = paths;
    }

    /**
     * Ensures the audio artifact exists and marks the track DOWNLOADED.
     *
     * @throws MetadataException when the track carries no media locator
     * @throws FetchException    when the fetch fails or leaves no artifact behind
     */
    public Track fetchTrack(Track track) {
        Path target = paths.audioFile(track.getId());
        if (Files.exists(target)) {
            LOGGER.info("Audio already present, skipping fetch track={} path={}", track.getId(), target);
            return markDownloaded(track, target);
        }
        String mediaUrl = track.getDownloadUrl();
        if (mediaUrl == null || mediaUrl.isBlank()) {
            throw new MetadataException("Track " + track.getId() + " has no media locator");
        }

        LOGGER.info("Fetching audio track={} title='{}'", track.getId(), track.getTitle());
        long start = System.currentTimeMillis();
        if (!audioSource.fetchToPath(mediaUrl, target)) {
            throw new FetchException("Fetch failed for track " + track.getId() + " url=" + track.getWebpageUrl());
        }
        if (!Files.exists(target)) {
            throw new FetchException("Fetch produced no artifact for track " + track.getId() + " at " + target);
        }
        LOGGER.info("Audio fetched track={} path={} in={}ms", track.getId(), target, System.currentTimeMillis() - start);
        return markDownloaded(track, target);
    }

    private static Track markDownloaded(Track track, Path artifact) {
        track.setAudioFilePath(artifact.toString());
        track.advanceTo(TrackStatus.DOWNLOADED);
        return track;
    }
}
