package com.example.trackscribe.exception;

import com.example.trackscribe.dto.PipelineReport;

/**
 * Thrown when a fatal track error stops a batch. Carries the outcomes recorded up to that
 * point; the cause is the exception of the failing track.
 */
public class PipelineAbortedException extends RuntimeException {
    private final transient PipelineReport partialReport;

    public PipelineAbortedException(String message, Throwable cause, PipelineReport partialReport) {
        super(message, cause);
        this.partialReport = partialReport;
    }

    public PipelineReport getPartialReport() {
        return partialReport;
    }
}
