package com.example.trackscribe.engine.Interfaces;

import com.example.trackscribe.dto.TrackMetadata;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Discovery and download capability of one audio provider.
 */
public interface AudioSource {

    /** All entries of a playlist in source order, with playlist context filled in. */
    List<TrackMetadata> resolvePlaylist(String playlistUrl);

    Optional<TrackMetadata> resolveTrack(String trackUrl);

    /**
     * Downloads the audio behind {@code mediaUrl} to exactly {@code destination}.
     *
     * @return false when the provider reports a failed download
     */
    boolean fetchToPath(String mediaUrl, Path destination);
}
