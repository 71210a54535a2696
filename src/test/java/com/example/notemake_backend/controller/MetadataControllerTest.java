package com.example.notemake_backend.controller;

import com.example.notemake_backend.dto.pipeline.CaptionTrack;
import com.example.notemake_backend.dto.pipeline.VideoRef;
import com.example.notemake_backend.engine.Interfaces.CaptionEngine;
import com.example.notemake_backend.exception.PipelineException;
import com.example.notemake_backend.service.metadata.MetadataService;
import com.example.notemake_backend.support.Transcripts;
import com.example.notemake_backend.util.ErrorKind;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = MetadataController.class)
@AutoConfigureMockMvc(addFilters = false)
class MetadataControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private MetadataService metadataService;

    @MockitoBean
    private CaptionEngine captionEngine;

    @Test
    void metadataForUrl() throws Exception {
        String url = "https://youtu.be/dQw4w9WgXcQ";
        when(metadataService.resolveUrl(url)).thenReturn(Transcripts.metadata("dQw4w9WgXcQ"));

        mockMvc.perform(get("/v1/metadata").param("url", url))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.videoId").value("dQw4w9WgXcQ"))
                .andExpect(jsonPath("$.title").exists());
    }

    @Test
    void metadataForUnparseableUrlIsBadRequest() throws Exception {
        when(metadataService.resolveUrl("nope"))
                .thenThrow(new PipelineException(ErrorKind.INVALID_REFERENCE, "Not a video URL or id: nope"));

        mockMvc.perform(get("/v1/metadata").param("url", "nope"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_REFERENCE"))
                .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    void metadataNetworkFailureIsBadGateway() throws Exception {
        when(metadataService.resolveUrl("dQw4w9WgXcQ"))
                .thenThrow(new PipelineException(ErrorKind.NETWORK, "noembed unreachable"));

        mockMvc.perform(get("/v1/metadata").param("url", "dQw4w9WgXcQ"))
                .andExpect(status().isBadGateway());
    }

    @Test
    void captionTracksForVideo() throws Exception {
        when(captionEngine.listTracks(VideoRef.of("dQw4w9WgXcQ"))).thenReturn(List.of(
                new CaptionTrack("en", "English", false),
                new CaptionTrack("de", "German", true)));

        mockMvc.perform(get("/v1/videos/dQw4w9WgXcQ/captions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].languageCode").value("en"))
                .andExpect(jsonPath("$[1].autoGenerated").value(true));
    }

    @Test
    void captionTracksRejectInvalidId() throws Exception {
        mockMvc.perform(get("/v1/videos/short/captions"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(captionEngine);
    }
}
