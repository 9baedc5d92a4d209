package io.blogapi.server.core.dto;

import java.time.Instant;

public record HealthResponse(String status, Instant timestamp) {}
