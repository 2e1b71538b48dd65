package com.example.trackscribe.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "downloader")
public class DownloaderProperties {
    private String ytdlpBin = "yt-dlp";
    private long timeoutMinutes = 15;
    private String cookiesFile;

    public String getYtdlpBin() {
        return ytdlpBin;
    }

    public void setYtdlpBin(String ytdlpBin) {
        this.ytdlpBin = ytdlpBin;
    }

    public long getTimeoutMinutes() {
        return timeoutMinutes;
    }

    public void setTimeoutMinutes(long timeoutMinutes) {
        this.timeoutMinutes = timeoutMinutes;
    }

    public String getCookiesFile() {
        return cookiesFile;
    }

    public void setCookiesFile(String cookiesFile) {
        this.cookiesFile = cookiesFile;
    }
}
