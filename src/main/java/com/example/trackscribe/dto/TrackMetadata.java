package com.example.trackscribe.dto;

/**
 * What discovery knows about one remote track. {@code mediaUrl} is the provider-resolved direct
 * link to the audio bytes; it expires and is only valid for the fetch that follows this
 * discovery call.
 */
public record TrackMetadata(
        String title,
        String webpageUrl,
        String mediaUrl,
        String uploader,
        Double durationSeconds,
        String playlistTitle,
        String playlistUrl,
        Integer trackNumberInPlaylist
) {

    public static TrackMetadata single(String title, String webpageUrl, String mediaUrl, String uploader, Double durationSeconds) {
        return new TrackMetadata(title, webpageUrl, mediaUrl, uploader, durationSeconds, null, null, null);
    }

    public boolean hasLocators() {
        return webpageUrl != null && !webpageUrl.isBlank()
                && mediaUrl != null && !mediaUrl.isBlank();
    }

    public TrackMetadata inPlaylist(String playlistTitle, String playlistUrl, int trackNumber) {
        return new TrackMetadata(title, webpageUrl, mediaUrl, uploader, durationSeconds, playlistTitle, playlistUrl, trackNumber);
    }
}
