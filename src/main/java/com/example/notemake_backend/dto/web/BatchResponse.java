package com.example.notemake_backend.dto.web;

import java.util.List;

/**
 * @param invalid inputs that were neither a video nor a playlist/channel reference; they are skipped.
 */
public record BatchResponse(String batchId, int total, List<String> invalid) {
}
