package com.example.notemake_backend.repository;

import com.example.notemake_backend.model.VideoMetadataCacheEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;

public interface VideoMetadataCacheEntryRepository extends JpaRepository<VideoMetadataCacheEntry, String> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from VideoMetadataCacheEntry e where e.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
