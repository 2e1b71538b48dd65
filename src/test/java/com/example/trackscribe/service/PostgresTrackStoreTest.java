package com.example.trackscribe.service;

import com.example.trackscribe.model.Track;
import com.example.trackscribe.model.Transcript;
import com.example.trackscribe.repository.TrackRepository;
import com.example.trackscribe.repository.TranscriptRepository;
import com.example.trackscribe.util.TrackStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.test.context.TestPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Testcontainers(disabledWithoutDocker = true)
@TestPropertySource(properties = "spring.jpa.hibernate.ddl-auto=none")
class PostgresTrackStoreTest {

    @Container
    @ServiceConnection
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine");

    @Autowired
    private DataSource dataSource;

    @Autowired
    private TrackRepository trackRepository;

    @Autowired
    private TranscriptRepository transcriptRepository;

    @Autowired
    private TestEntityManager em;

    private final ObjectMapper om = new ObjectMapper();
    private JdbcClient jdbc;
    private PostgresTrackStore store;

    @BeforeEach
    void setUp() {
        jdbc = JdbcClient.create(dataSource);
        store = new PostgresTrackStore(jdbc, trackRepository, transcriptRepository, om);
    }

    private static Track track(String url) {
        return new Track("Title", url, url + "/media.mp3");
    }

    private Transcript transcript(UUID id, String text) throws Exception {
        return new Transcript(id, "en",
                om.readTree("{\"language\":\"en\",\"segments\":[{\"start\":0,\"end\":1,\"text\":\"" + text + "\",\"chars\":null}]}"),
                text);
    }

    private String storedStatus(UUID id) {
        return jdbc.sql("select status from tracks where id = :id").param("id", id).query(String.class).single();
    }

    @Test
    void upsertInsertsThenOverwritesMetadata() {
        Track first = track("https://soundcloud.com/a/one");
        store.upsertTrack(first);

        Track again = track("https://soundcloud.com/a/one");
        again.setTitle("Renamed");
        again.setUploader("someone");
        store.upsertTrack(again);
        em.clear();

        Track stored = store.findTrack(first.getId()).orElseThrow();
        assertThat(stored.getTitle()).isEqualTo("Renamed");
        assertThat(stored.getUploader()).isEqualTo("someone");
        assertThat(stored.getCreatedAt()).isNotNull();
        assertThat(store.countTracks()).isEqualTo(1);
    }

    @Test
    void statusNeverRegressesAndAudioPathIsKept() {
        Track downloaded = track("https://soundcloud.com/a/two");
        downloaded.setAudioFilePath("/tmp/audio/x.wav");
        downloaded.advanceTo(TrackStatus.DOWNLOADED);
        store.upsertTrack(downloaded);

        store.upsertTrack(track("https://soundcloud.com/a/two"));

        assertThat(storedStatus(downloaded.getId())).isEqualTo("DOWNLOADED");
        em.clear();
        assertThat(store.findTrack(downloaded.getId()).orElseThrow().getAudioFilePath()).isEqualTo("/tmp/audio/x.wav");
    }

    @Test
    void transcribedStatusRequiresTranscriptRow() {
        Track track = track("https://soundcloud.com/a/three");
        track.advanceTo(TrackStatus.TRANSCRIBED);

        assertThrows(IllegalStateException.class, () -> store.upsertTrack(track));
        assertThat(jdbc.sql("select count(*) from tracks").query(Long.class).single()).isZero();
    }

    @Test
    void saveTranscribedMakesTrackTranscribed() throws Exception {
        String url = "https://soundcloud.com/a/four";
        assertThat(store.isTranscribed(url)).isFalse();

        Track track = track(url);
        track.advanceTo(TrackStatus.TRANSCRIBED);
        store.saveTranscribed(track, transcript(track.getId(), "hello"));

        assertThat(store.isTranscribed(url)).isTrue();
        assertThat(storedStatus(track.getId())).isEqualTo("TRANSCRIBED");
        em.clear();
        Transcript stored = store.findTranscript(track.getId()).orElseThrow();
        assertThat(stored.getPlainText()).isEqualTo("hello");
        assertThat(stored.getAlignedResult().path("segments").get(0).has("chars")).isTrue();
    }

    @Test
    void transcriptUpsertOverwrites() throws Exception {
        Track track = track("https://soundcloud.com/a/five");
        store.upsertTrack(track);
        store.upsertTranscript(transcript(track.getId(), "first"));

        Transcript second = transcript(track.getId(), "second");
        second.setEmbedding(List.of(0.5f, 0.25f));
        store.upsertTranscript(second);
        em.clear();

        Transcript stored = store.findTranscript(track.getId()).orElseThrow();
        assertThat(stored.getPlainText()).isEqualTo("second");
        assertThat(stored.getEmbedding()).containsExactly(0.5f, 0.25f);
        assertThat(jdbc.sql("select count(*) from transcripts").query(Long.class).single()).isEqualTo(1L);
    }

    @Test
    void transcriptWithoutTrackViolatesForeignKey() {
        assertThrows(DataIntegrityViolationException.class,
                () -> store.upsertTranscript(transcript(UUID.randomUUID(), "orphan")));
    }

    @Test
    void deletingTrackRowCascadesToTranscript() throws Exception {
        Track track = track("https://soundcloud.com/a/six");
        track.advanceTo(TrackStatus.TRANSCRIBED);
        store.saveTranscribed(track, transcript(track.getId(), "bye"));

        jdbc.sql("delete from tracks where id = :id").param("id", track.getId()).update();

        assertThat(jdbc.sql("select count(*) from transcripts").query(Long.class).single()).isZero();
    }

    @Test
    void deleteTrackRemovesTrackAndTranscript() throws Exception {
        Track track = track("https://soundcloud.com/a/seven");
        track.advanceTo(TrackStatus.TRANSCRIBED);
        store.saveTranscribed(track, transcript(track.getId(), "gone"));
        em.clear();

        assertThat(store.deleteTrack(track.getId())).isTrue();
        em.flush();

        assertThat(jdbc.sql("select count(*) from tracks").query(Long.class).single()).isZero();
        assertThat(store.deleteTrack(track.getId())).isFalse();
    }
}
