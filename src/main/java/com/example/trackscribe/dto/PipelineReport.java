package com.example.trackscribe.dto;

import java.util.List;

/** Per-entry outcomes of one pipeline run, in source order. */
public record PipelineReport(String sourceUrl, boolean playlist, List<TrackOutcome> outcomes) {

    public PipelineReport {
        outcomes = List.copyOf(outcomes);
    }

    public long count(TrackOutcome.Status status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    public long processed() {
        return count(TrackOutcome.Status.PROCESSED);
    }

    public long skipped() {
        return count(TrackOutcome.Status.ALREADY_TRANSCRIBED) + count(TrackOutcome.Status.INVALID_METADATA);
    }

    public long failed() {
        return count(TrackOutcome.Status.FAILED);
    }
}
