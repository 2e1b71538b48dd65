package com.example.trackscribe.service;

import com.example.trackscribe.exception.StorageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.UUID;

/**
 * On-disk copies of aligned transcripts: {@code <id>.json} holds the aligned document and
 * {@code <id>.txt} its plain rendering. Files are written to a temporary sibling first and then
 * moved into place, so readers never see a half-written file.
 */
@Component
public class TranscriptCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptCache.class);

    private final ArtifactPaths paths;
    private final ObjectMapper objectMapper;

    public TranscriptCache(ArtifactPaths paths, ObjectMapper objectMapper) {
        this.paths = paths;
        this.objectMapper = objectMapper;
    }

    /**
     * Returns the cached aligned document. A file that does not parse, or is not an object with
     * a {@code segments} array, counts as a miss so the track is transcribed again.
     */
    public Optional<JsonNode> load(UUID trackId) {
        Path json = paths.transcriptJson(trackId);
        if (!Files.exists(json)) {
            return Optional.empty();
        }
        JsonNode doc;
        try {
            doc = objectMapper.readTree(json.toFile());
        } catch (JsonProcessingException e) {
            LOGGER.warn("Ignoring unparseable transcript cache track={} path={}: {}", trackId, json, e.getOriginalMessage());
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Unreadable transcript cache " + json, e);
        }
        if (doc == null || !doc.isObject() || !doc.path("segments").isArray()) {
            LOGGER.warn("Ignoring invalid transcript cache track={} path={}", trackId, json);
            return Optional.empty();
        }
        LOGGER.debug("Transcript cache hit track={} path={}", trackId, json);
        return Optional.of(doc);
    }

    public boolean hasText(UUID trackId) {
        return Files.exists(paths.transcriptText(trackId));
    }

    public void storeJson(UUID trackId, JsonNode aligned) {
        try {
            byte[] bytes = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(aligned);
            writeAtomically(paths.transcriptJson(trackId), bytes);
        } catch (IOException e) {
            throw new StorageException("Cannot write transcript cache for track " + trackId, e);
        }
    }

    public void storeText(UUID trackId, String plainText) {
        try {
            writeAtomically(paths.transcriptText(trackId), plainText.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new StorageException("Cannot write transcript text for track " + trackId, e);
        }
    }

    private static void writeAtomically(Path target, byte[] bytes) throws IOException {
        Files.createDirectories(target.getParent());
        Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            LOGGER.debug("Wrote {} bytes to {}", bytes.length, target);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
