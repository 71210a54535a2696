package com.example.notemake_backend.dto.pipeline;

public record Chapter(String title, double startSec, double endSec) {
}
