package com.example.trackscribe.model;

import com.example.trackscribe.dto.TrackMetadata;
import com.example.trackscribe.util.TrackIdResolver;
import com.example.trackscribe.util.TrackStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TrackTest {

    @Test
    void discoveredTrackIsPendingAndKeyedByUrl() {
        TrackMetadata md = new TrackMetadata("Song", "https://soundcloud.com/a/song", "https://cdn/x.mp3",
                "a", 12.5, "Mix", "https://soundcloud.com/a/sets/mix", 3);

        Track track = Track.discovered(md);

        assertThat(track.getId()).isEqualTo(TrackIdResolver.resolveId("https://soundcloud.com/a/song"));
        assertThat(track.getStatus()).isEqualTo(TrackStatus.PENDING);
        assertThat(track.getDownloadUrl()).isEqualTo("https://cdn/x.mp3");
        assertThat(track.getTrackNumberInPlaylist()).isEqualTo(3);
        assertThat(track.getPlaylistTitle()).isEqualTo("Mix");
    }

    @Test
    void statusNeverMovesBackwards() {
        Track track = new Track("t", "https://soundcloud.com/a/song", null);
        track.advanceTo(TrackStatus.TRANSCRIBED);
        track.advanceTo(TrackStatus.DOWNLOADED);
        track.advanceTo(TrackStatus.PENDING);

        assertThat(track.getStatus()).isEqualTo(TrackStatus.TRANSCRIBED);
    }
}
