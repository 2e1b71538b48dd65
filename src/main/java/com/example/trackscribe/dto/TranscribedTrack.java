package com.example.trackscribe.dto;

import com.example.trackscribe.model.Track;
import com.example.trackscribe.model.Transcript;

/** A track together with the transcript produced for it; both share the same id. */
public record TranscribedTrack(Track track, Transcript transcript) {
}
