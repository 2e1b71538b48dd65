package com.example.trackscribe.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Aligned transcription of exactly one track. The primary key is the owning track's id, which
 * makes the one-to-one relationship structural.
 */
@Entity
@Table(name = "transcripts")
public class Transcript {
    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "id", insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_transcript_track"))
    private Track track;

    @Column(name = "language", length = 16)
    private String language;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "aligned_result", columnDefinition = "jsonb", nullable = false)
    private JsonNode alignedResult;

    @Column(name = "plain_text", columnDefinition = "text")
    private String plainText;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "embedding", columnDefinition = "jsonb")
    private List<Float> embedding;

    @Column(name = "created_at", insertable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", insertable = false, updatable = false)
    private Instant updatedAt;

    public Transcript() {}

    public Transcript(UUID trackId, String language, JsonNode alignedResult, String plainText) {
        this.id = trackId;
        this.language = language;
        this.alignedResult = alignedResult;
        this.plainText = plainText;
    }

    public UUID getId() { return id; }
    public Track getTrack() { return track; }
    public String getLanguage() { return language; }
    public void setLanguage(String language) { this.language = language; }
    public JsonNode getAlignedResult() { return alignedResult; }
    public void setAlignedResult(JsonNode alignedResult) { this.alignedResult = alignedResult; }
    public String getPlainText() { return plainText; }
    public void setPlainText(String plainText) { this.plainText = plainText; }
    public List<Float> getEmbedding() { return embedding; }
    public void setEmbedding(List<Float> embedding) { this.embedding = embedding; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
