package com.example.trackscribe.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * What the pipeline processes and where it keeps its working files.
 */
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {
    private String url;
    private boolean playlist = false;
    private boolean runOnStartup = false;
    /** false: the first fatal track error aborts the rest of the batch. */
    private boolean continueOnError = false;
    private boolean persistTranscripts = true;
    private String languageHint;
    private int maxConcurrency = 1;
    private String workDir = "./tmp";
    private String audioDir = "audio";
    private String transcriptDir = "transcripts";
    private String audioFormat = "wav";

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public boolean isPlaylist() {
        return playlist;
    }

    public void setPlaylist(boolean playlist) {
        this.playlist = playlist;
    }

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
        this.runOnStartup = runOnStartup;
    }

    public boolean isContinueOnError() {
        return continueOnError;
    }

    public void setContinueOnError(boolean continueOnError) {
        this.continueOnError = continueOnError;
    }

    public boolean isPersistTranscripts() {
        return persistTranscripts;
    }

    public void setPersistTranscripts(boolean persistTranscripts) {
        this.persistTranscripts = persistTranscripts;
    }

    public String getLanguageHint() {
        return languageHint;
    }

    public void setLanguageHint(String languageHint) {
        this.languageHint = languageHint;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public String getWorkDir() {
        return workDir;
    }

    public void setWorkDir(String workDir) {
        this.workDir = workDir;
    }

    public String getAudioDir() {
        return audioDir;
    }

    public void setAudioDir(String audioDir) {
        this.audioDir = audioDir;
    }

    public String getTranscriptDir() {
        return transcriptDir;
    }

    public void setTranscriptDir(String transcriptDir) {
        this.transcriptDir = transcriptDir;
    }

    public String getAudioFormat() {
        return audioFormat;
    }

    public void setAudioFormat(String audioFormat) {
        this.audioFormat = audioFormat;
    }
}
