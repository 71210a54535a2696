package com.example.notemake_backend.controller;

import com.example.notemake_backend.dto.pipeline.CaptionTrack;
import com.example.notemake_backend.dto.pipeline.VideoRef;
import com.example.notemake_backend.dto.web.MetadataResponse;
import com.example.notemake_backend.engine.Interfaces.CaptionEngine;
import com.example.notemake_backend.service.metadata.MetadataService;
import com.example.notemake_backend.util.VideoIdParser;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1")
public class MetadataController {

    private final MetadataService metadataService;
    private final CaptionEngine captionEngine;

    public MetadataController(MetadataService metadataService, CaptionEngine captionEngine) {
        this.metadataService = metadataService;
        this.captionEngine = captionEngine;
    }

    @GetMapping("/metadata")
    public MetadataResponse getMetadata(@RequestParam("url") String url) {
        return MetadataResponse.from(metadataService.resolveUrl(url));
    }

    @GetMapping("/videos/{id}/captions")
    public List<CaptionTrack> captions(@PathVariable String id) {
        return captionEngine.listTracks(VideoRef.of(VideoIdParser.requireVideoId(id)));
    }
}
