package com.phillippitts.sermonflow.domain;

import java.time.Instant;
import java.util.UUID;

public record Transcript(UUID sermonId, String content, String language, String modelUsed, Instant createdAt) {

    public int wordCount() {
        if (content == null || content.isBlank()) {
            return 0;
        }
        return content.trim().split("\\s+").length;
    }
}
