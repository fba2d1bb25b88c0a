package com.phillippitts.sermonflow.domain;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Generated study material for a sermon. The generation itself happens outside this service.
 */
public record StudyGuide(
        UUID sermonId,
        String summary,
        List<String> keyPoints,
        List<String> scriptureReferences,
        List<String> discussionQuestions,
        String modelUsed,
        Instant createdAt) {

    public StudyGuide {
        keyPoints = keyPoints == null ? List.of() : List.copyOf(keyPoints);
        scriptureReferences = scriptureReferences == null ? List.of() : List.copyOf(scriptureReferences);
        discussionQuestions = discussionQuestions == null ? List.of() : List.copyOf(discussionQuestions);
    }
}
