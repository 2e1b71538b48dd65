package com.example.trackscribe.dto.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record IngestRequest(
        @NotBlank @Pattern(regexp = "^https?://.+", message = "must be an http(s) url") String url,
        boolean playlist
) {
}
