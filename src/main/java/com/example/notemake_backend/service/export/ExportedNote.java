package com.example.notemake_backend.service.export;

public record ExportedNote(String fileName, String contentType, byte[] content) {
}
