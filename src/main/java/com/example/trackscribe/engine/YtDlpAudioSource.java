package com.example.trackscribe.engine;

import com.example.trackscribe.config.DownloaderProperties;
import com.example.trackscribe.dto.TrackMetadata;
import com.example.trackscribe.engine.Interfaces.AudioSource;
import com.example.trackscribe.exception.FetchException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;

/**
 * {@link AudioSource} backed by the yt-dlp command line tool. Works for any site yt-dlp has an
 * extractor for (SoundCloud, YouTube, Bandcamp, ...).
 */
public class YtDlpAudioSource implements AudioSource {
    private static final Logger LOGGER = LoggerFactory.getLogger(YtDlpAudioSource.class);
    private static final int LOG_SNIPPET_MAX = 4_000;

    private final String ytdlp;
    private final long timeoutMinutes;
    private final String cookiesFile;
    private final ObjectMapper objectMapper;

    public YtDlpAudioSource(DownloaderProperties properties, ObjectMapper objectMapper) {
        this.ytdlp = properties.getYtdlpBin() != null ? properties.getYtdlpBin() : "yt-dlp";
        this.timeoutMinutes = Math.max(1, properties.getTimeoutMinutes());
        this.cookiesFile = properties.getCookiesFile();
        this.objectMapper = objectMapper;
    }

    @Override
    public List<TrackMetadata> resolvePlaylist(String playlistUrl) {
        LOGGER.debug("Retrieving tracks from playlist url={}", playlistUrl);
        JsonNode info = dumpJson(playlistUrl, true);
        JsonNode entries = info.path("entries");
        if (!entries.isArray() || entries.isEmpty()) {
            LOGGER.warn("No entries found in playlist url={}", playlistUrl);
            return List.of();
        }

        String playlistTitle = text(info, "title");
        String canonicalPlaylistUrl = Optional.ofNullable(text(info, "webpage_url")).orElse(playlistUrl);
        List<TrackMetadata> tracks = new ArrayList<>(entries.size());
        int index = 0;
        for (JsonNode entry : entries) {
            index++;
            if (entry == null || entry.isNull()) {
                // yt-dlp emits null for entries it could not extract
                tracks.add(new TrackMetadata("Unknown Title Track " + index, null, null, null, null,
                        playlistTitle, canonicalPlaylistUrl, index));
                continue;
            }
            tracks.add(toMetadata(entry, index).inPlaylist(playlistTitle, canonicalPlaylistUrl, index));
        }
        LOGGER.debug("Retrieved entries={} from playlist url={}", tracks.size(), playlistUrl);
        return tracks;
    }

    @Override
    public Optional<TrackMetadata> resolveTrack(String trackUrl) {
        JsonNode info = dumpJson(trackUrl, false);
        if (info == null || info.isMissingNode() || info.isNull()) {
            return Optional.empty();
        }
        return Optional.of(toMetadata(info, 1));
    }

    /**
     * yt-dlp writes to a {@code <stem>.tmp.*} sibling; only a clean exit moves the result to
     * {@code destination}, so a failed or killed download never leaves a file there.
     */
    @Override
    public boolean fetchToPath(String mediaUrl, Path destination) {
        String fileName = destination.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String format = dot > 0 ? fileName.substring(dot + 1) : "wav";
        String tmpStem = stem + ".tmp";
        Path tmp = destination.resolveSibling(tmpStem + "." + format);

        List<String> cmd = new ArrayList<>(List.of(
                ytdlp,
                "--no-progress", "--newline", "--no-playlist",
                "-f", "bestaudio/best",
                "-x", "--audio-format", format
        ));
        maybeAddCookies(cmd);
        cmd.add("-o");
        cmd.add(destination.resolveSibling(tmpStem + ".%(ext)s").toString());
        cmd.add(mediaUrl);

        ProcessResult result = run(cmd);
        if (result.timedOut()) {
            String partialNote = cleanupPartials(destination.getParent(), tmpStem);
            throw new FetchException("yt-dlp timeout after " + timeoutMinutes + "m for " + destination + partialNote
                    + " log=" + truncateLog(result.stderr()));
        }
        if (result.code() != 0) {
            String partialNote = cleanupPartials(destination.getParent(), tmpStem);
            if (isAuthWall(result.stderr())) {
                throw new FetchException("Download requires authentication/cookies for " + destination + partialNote
                        + " log=" + truncateLog(result.stderr()));
            }
            LOGGER.warn("yt-dlp exit={} target={}{} log={}", result.code(), destination, partialNote, truncateLog(result.stderr()));
            return false;
        }
        if (!Files.exists(tmp)) {
            String partialNote = cleanupPartials(destination.getParent(), tmpStem);
            LOGGER.warn("yt-dlp exit=0 but no output at {}{} log={}", tmp, partialNote, truncateLog(result.stderr()));
            return false;
        }
        try {
            Files.move(tmp, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            cleanupPartials(destination.getParent(), tmpStem);
            throw new FetchException("Cannot move " + tmp + " to " + destination, e);
        }
        LOGGER.info("yt-dlp download OK target={}", destination);
        return true;
    }

    private JsonNode dumpJson(String url, boolean playlist) {
        List<String> cmd = new ArrayList<>(List.of(
                ytdlp,
                "-J", "--no-warnings",
                "-f", "bestaudio/best",
                playlist ? "--yes-playlist" : "--no-playlist"
        ));
        maybeAddCookies(cmd);
        cmd.add(url);

        ProcessResult result = run(cmd);
        if (result.timedOut()) {
            throw new FetchException("yt-dlp metadata timeout after " + timeoutMinutes + "m for " + url);
        }
        if (result.code() != 0 || result.stdout().isBlank()) {
            throw new FetchException("yt-dlp metadata exit=" + result.code() + " for " + url
                    + " log=" + truncateLog(result.stderr()));
        }
        try {
            return objectMapper.readTree(result.stdout());
        } catch (IOException e) {
            throw new FetchException("yt-dlp returned unreadable metadata for " + url, e);
        }
    }

    private TrackMetadata toMetadata(JsonNode entry, int index) {
        String title = Optional.ofNullable(text(entry, "title")).orElse("Unknown Title Track " + index);
        JsonNode duration = entry.path("duration");
        return TrackMetadata.single(
                title,
                text(entry, "webpage_url"),
                text(entry, "url"),
                text(entry, "uploader"),
                duration.isNumber() ? duration.asDouble() : null
        );
    }

    private ProcessResult run(List<String> cmd) {
        try {
            return runProcess(cmd, timeoutMinutes);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("Interrupted while running yt-dlp", e);
        } catch (IOException e) {
            throw new FetchException("Unable to start " + ytdlp + ": " + e.getMessage(), e);
        }
    }

    protected ProcessResult runProcess(List<String> cmd, long timeoutMinutes) throws IOException, InterruptedException {
        LOGGER.debug("Exec: {}", String.join(" ", cmd));
        Process p = new ProcessBuilder(cmd).start();
        StringJoiner out = new StringJoiner(System.lineSeparator());
        StringJoiner err = new StringJoiner(System.lineSeparator());
        Thread outReader = drain(p.getInputStream(), out);
        Thread errReader = drain(p.getErrorStream(), err);

        boolean finished = p.waitFor(timeoutMinutes, TimeUnit.MINUTES);
        if (!finished) {
            // ffmpeg runs as a child of yt-dlp
            p.descendants().forEach(ProcessHandle::destroyForcibly);
            p.destroyForcibly();
            p.waitFor(5, TimeUnit.SECONDS);
        }
        outReader.join();
        errReader.join();
        int code = finished ? p.exitValue() : -1;
        return new ProcessResult(code, out.toString(), err.toString(), !finished);
    }

    private static Thread drain(InputStream stream, StringJoiner sink) {
        Thread reader = new Thread(() -> {
            try (var buffered = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = buffered.readLine()) != null) {
                    synchronized (sink) {
                        sink.add(line);
                    }
                }
            } catch (IOException e) {
                LOGGER.debug("yt-dlp output stream closed early: {}", e.getMessage());
            }
        });
        reader.setDaemon(true);
        reader.start();
        return reader;
    }

    private void maybeAddCookies(List<String> cmd) {
        if (cookiesFile == null || cookiesFile.isBlank()) {
            return;
        }
        Path cookiesPath = Path.of(cookiesFile).toAbsolutePath();
        if (Files.exists(cookiesPath)) {
            cmd.add("--cookies");
            cmd.add(cookiesPath.toString());
        } else {
            LOGGER.warn("yt-dlp cookies file configured but missing path={}", cookiesPath);
        }
    }

    /** Deletes every {@code <tmpStem>.*} file yt-dlp left behind, finished or not. */
    private String cleanupPartials(Path dir, String tmpStem) {
        if (dir == null || !Files.isDirectory(dir)) {
            return "";
        }
        StringJoiner removed = new StringJoiner(",");
        try (var files = Files.list(dir)) {
            for (Path candidate : files.toList()) {
                if (candidate.getFileName().toString().startsWith(tmpStem + ".")) {
                    Files.deleteIfExists(candidate);
                    removed.add(candidate.toString());
                }
            }
        } catch (IOException e) {
            LOGGER.warn("Failed to delete yt-dlp partial files dir={} stem={}", dir, tmpStem, e);
        }
        return removed.length() == 0 ? "" : " partial=" + removed;
    }

    private static boolean isAuthWall(String output) {
        if (output == null) {
            return false;
        }
        String normalized = output.toLowerCase(Locale.ROOT).replace('\u2019', '\'');
        return normalized.contains("sign in to confirm you're not a bot")
                || normalized.contains("--cookies-from-browser")
                || normalized.contains("use --cookies");
    }

    private static String truncateLog(String output) {
        if (output == null || output.isBlank()) {
            return "<no output>";
        }
        if (output.length() <= LOG_SNIPPET_MAX) {
            return output;
        }
        return output.substring(0, LOG_SNIPPET_MAX) + "...";
    }

    private static String text(JsonNode node, String field) {
        JsonNode n = node.path(field);
        return (n.isMissingNode() || n.isNull() || n.asText().isBlank()) ? null : n.asText();
    }

    protected record ProcessResult(int code, String stdout, String stderr, boolean timedOut) { }
}
