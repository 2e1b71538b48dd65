package com.example.trackscribe.dto.web;

import com.example.trackscribe.dto.PipelineReport;
import com.example.trackscribe.dto.TrackOutcome;

import java.util.List;

public record IngestResponse(String url, boolean playlist, long processed, long skipped, long failed,
                             List<TrackOutcome> outcomes) {

    public static IngestResponse from(PipelineReport report) {
        return new IngestResponse(report.sourceUrl(), report.playlist(), report.processed(), report.skipped(),
                report.failed(), report.outcomes());
    }
}
