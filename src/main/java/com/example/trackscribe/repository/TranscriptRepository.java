package com.example.trackscribe.repository;

import com.example.trackscribe.model.Transcript;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface TranscriptRepository extends JpaRepository<Transcript, UUID> {
}
