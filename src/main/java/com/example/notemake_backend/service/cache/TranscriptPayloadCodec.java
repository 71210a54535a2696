package com.example.notemake_backend.service.cache;

import com.example.notemake_backend.dto.pipeline.TranscriptResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * JSON form of a cached transcript.
 */
@Component
public class TranscriptPayloadCodec {

    private final ObjectMapper mapper;

    public TranscriptPayloadCodec(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public static TranscriptPayloadCodec standalone() {
        return new TranscriptPayloadCodec(new ObjectMapper().findAndRegisterModules());
    }

    public String encode(TranscriptResult payload) {
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize transcript: " + e.getOriginalMessage(), e);
        }
    }

    public TranscriptResult decode(String json) {
        try {
            return mapper.readValue(json, TranscriptResult.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot read cached transcript: " + e.getOriginalMessage(), e);
        }
    }

    public long sizeOf(TranscriptResult payload) {
        return payload == null ? 0 : encode(payload).getBytes(StandardCharsets.UTF_8).length;
    }
}
