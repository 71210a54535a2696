package com.example.notemake_backend.config;

import com.example.notemake_backend.repository.TranscriptCacheEntryRepository;
import com.example.notemake_backend.repository.VideoMetadataCacheEntryRepository;
import com.example.notemake_backend.service.cache.InMemoryTranscriptCache;
import com.example.notemake_backend.service.cache.JpaTranscriptCache;
import com.example.notemake_backend.service.cache.TranscriptCache;
import com.example.notemake_backend.service.cache.TranscriptPayloadCodec;
import com.example.notemake_backend.service.metadata.InMemoryMetadataCache;
import com.example.notemake_backend.service.metadata.JpaMetadataCache;
import com.example.notemake_backend.service.metadata.MetadataCache;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

@Configuration
public class CacheConfig {

    @Bean
    @ConditionalOnProperty(name = "notemake.cache.store", havingValue = "jpa", matchIfMissing = true)
    public TranscriptCache jpaTranscriptCache(TranscriptCacheEntryRepository repository,
                                              PlatformTransactionManager transactionManager,
                                              TranscriptPayloadCodec codec,
                                              Clock clock,
                                              CacheProperties properties) {
        return new JpaTranscriptCache(repository, new TransactionTemplate(transactionManager), codec, clock,
                properties.getTtl());
    }

    @Bean
    @ConditionalOnProperty(name = "notemake.cache.store", havingValue = "memory")
    public TranscriptCache inMemoryTranscriptCache(TranscriptPayloadCodec codec, Clock clock, CacheProperties properties) {
        return new InMemoryTranscriptCache(clock, properties.getTtl(), codec);
    }

    @Bean
    @ConditionalOnProperty(name = "notemake.cache.store", havingValue = "jpa", matchIfMissing = true)
    public MetadataCache jpaMetadataCache(VideoMetadataCacheEntryRepository repository,
                                          PlatformTransactionManager transactionManager,
                                          ObjectMapper objectMapper,
                                          Clock clock,
                                          CacheProperties properties) {
        return new JpaMetadataCache(repository, new TransactionTemplate(transactionManager), objectMapper, clock,
                properties.getMetadataTtl());
    }

    @Bean
    @ConditionalOnProperty(name = "notemake.cache.store", havingValue = "memory")
    public MetadataCache inMemoryMetadataCache(Clock clock, CacheProperties properties) {
        return new InMemoryMetadataCache(clock, properties.getMetadataTtl());
    }
}
