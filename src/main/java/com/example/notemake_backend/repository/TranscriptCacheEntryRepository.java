package com.example.notemake_backend.repository;

import com.example.notemake_backend.model.TranscriptCacheEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface TranscriptCacheEntryRepository extends JpaRepository<TranscriptCacheEntry, String> {

    List<TranscriptCacheEntry> findAllByVideoId(String videoId);

    List<TranscriptCacheEntry> findAllByExpiresAtLessThanEqual(Instant now);

    @Query("select coalesce(sum(e.payloadSize), 0) from TranscriptCacheEntry e")
    long totalPayloadSize();

    @Query("select min(e.createdAt) from TranscriptCacheEntry e")
    Instant oldestCreatedAt();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from TranscriptCacheEntry e where e.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
