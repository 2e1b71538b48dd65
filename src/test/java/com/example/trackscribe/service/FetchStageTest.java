package com.example.trackscribe.service;

import com.example.trackscribe.engine.Interfaces.AudioSource;
import com.example.trackscribe.exception.FetchException;
import com.example.trackscribe.exception.MetadataException;
import com.example.trackscribe.model.Track;
import com.example.trackscribe.util.TrackStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FetchStageTest {

    @Mock
    private AudioSource audioSource;

    @TempDir
    Path workDir;

    private ArtifactPaths paths;
    private FetchStage stage;

    @BeforeEach
    void setUp() {
        paths = new ArtifactPaths(workDir, "audio", "transcripts", "wav");
        paths.init();
        stage = new FetchStage(audioSource, paths);
    }

    private static Track track() {
        return new Track("Song", "https://soundcloud.com/a/song", "https://cdn/song.mp3");
    }

    @Test
    void existingArtifactSkipsTheFetch() throws Exception {
        Track track = track();
        Path artifact = paths.audioFile(track.getId());
        Files.writeString(artifact, "audio");

        Track result = stage.fetchTrack(track);

        verify(audioSource, never()).fetchToPath(anyString(), any());
        assertThat(result.getStatus()).isEqualTo(TrackStatus.DOWNLOADED);
        assertThat(result.getAudioFilePath()).isEqualTo(artifact.toString());
    }

    @Test
    void fetchesToIdDerivedPath() {
        Track track = track();
        Path expected = paths.audioFile(track.getId());
        when(audioSource.fetchToPath(eq("https://cdn/song.mp3"), eq(expected))).thenAnswer(inv -> {
            Files.writeString(expected, "audio");
            return true;
        });

        Track result = stage.fetchTrack(track);

        assertThat(expected.getFileName().toString()).isEqualTo(track.getId() + ".wav");
        assertThat(result.getStatus()).isEqualTo(TrackStatus.DOWNLOADED);
        assertThat(result.getAudioFilePath()).isEqualTo(expected.toString());
    }

    @Test
    void reportedFailureRaisesFetchException() {
        when(audioSource.fetchToPath(anyString(), any())).thenReturn(false);

        Track track = track();
        assertThrows(FetchException.class, () -> stage.fetchTrack(track));
        assertThat(track.getStatus()).isEqualTo(TrackStatus.PENDING);
    }

    @Test
    void successWithoutArtifactRaisesFetchException() {
        when(audioSource.fetchToPath(anyString(), any())).thenReturn(true);

        FetchException ex = assertThrows(FetchException.class, () -> stage.fetchTrack(track()));
        assertThat(ex.getMessage()).contains("no artifact");
    }

    @Test
    void missingMediaLocatorRaisesMetadataException() {
        Track track = new Track("Song", "https://soundcloud.com/a/song", null);

        assertThrows(MetadataException.class, () -> stage.fetchTrack(track));
        verify(audioSource, never()).fetchToPath(anyString(), any());
    }
}
