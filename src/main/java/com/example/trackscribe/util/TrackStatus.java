package com.example.trackscribe.util;

/**
 * Processing stage of a track. Declaration order is the pipeline order; a track never moves
 * backwards through it.
 */
public enum TrackStatus {
    PENDING,
    DOWNLOADED,
    TRANSCRIBED,
    EMBEDDED;

    public boolean isAtLeast(TrackStatus other) {
        return this.ordinal() >= other.ordinal();
    }

    /** Returns whichever of the two statuses is further along. */
    public static TrackStatus furthest(TrackStatus a, TrackStatus b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAtLeast(b) ? a : b;
    }
}
