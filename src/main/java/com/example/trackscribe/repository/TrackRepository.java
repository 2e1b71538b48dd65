package com.example.trackscribe.repository;

import com.example.trackscribe.model.Track;
import com.example.trackscribe.util.TrackStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

public interface TrackRepository extends JpaRepository<Track, UUID> {
    boolean existsByIdAndStatusIn(UUID id, Collection<TrackStatus> statuses);
    Optional<Track> findByWebpageUrl(String webpageUrl);
    Page<Track> findByPlaylistUrlOrderByTrackNumberInPlaylistAsc(String playlistUrl, Pageable pageable);
    Page<Track> findByStatusOrderByUpdatedAtDesc(TrackStatus status, Pageable pageable);
}
