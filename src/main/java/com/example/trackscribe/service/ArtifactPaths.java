package com.example.trackscribe.service;

import com.example.trackscribe.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.UUID;

/**
 * Local working directories and the file names derived from a track id. Every artifact of a
 * track is named after its id only, never after its title.
 */
public class ArtifactPaths {
    private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactPaths.class);

    private final Path baseDir;
    private final Path audioDir;
    private final Path transcriptDir;
    private final String audioFormat;

    public ArtifactPaths(Path baseDir, String audioPrefix, String transcriptPrefix, String audioFormat) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.audioDir = this.baseDir.resolve(audioPrefix).normalize();
        this.transcriptDir = this.baseDir.resolve(transcriptPrefix).normalize();
        this.audioFormat = (audioFormat == null || audioFormat.isBlank()) ? "wav" : audioFormat.toLowerCase(Locale.ROOT);
    }

    /** Creates the working directories if they do not exist yet. */
    public void init() {
        try {
            Files.createDirectories(baseDir);
            Files.createDirectories(audioDir);
            Files.createDirectories(transcriptDir);
            LOGGER.info("Working directories ready. base={}, audio={}, transcripts={}", baseDir, audioDir, transcriptDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create working directories under " + baseDir, e);
        }
    }

    public Path audioFile(UUID trackId) {
        return audioDir.resolve(key(trackId) + "." + audioFormat);
    }

    public Path transcriptJson(UUID trackId) {
        return transcriptDir.resolve(key(trackId) + ".json");
    }

    public Path transcriptText(UUID trackId) {
        return transcriptDir.resolve(key(trackId) + ".txt");
    }

    public Path audioDir() { return audioDir; }
    public Path transcriptDir() { return transcriptDir; }

    private static String key(UUID trackId) {
        if (trackId == null) {
            throw new StorageException("track id is null");
        }
        return trackId.toString();
    }
}
