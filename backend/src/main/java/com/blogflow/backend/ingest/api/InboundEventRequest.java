package com.blogflow.backend.ingest.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/** Normalised inbound event. {@code timestamp} is epoch milliseconds and optional. */
public record InboundEventRequest(
    @NotBlank @Size(max = 128) String userId,
    @NotBlank
        @Pattern(
            regexp = "(?i)\\s*(text|image|video)\\s*",
            message = "kind must be one of text, image, video")
        String kind,
    @NotBlank @Size(max = 20000) String payload,
    Long timestamp) {}
