package com.phillippitts.sermonflow.presentation.controller;

import com.phillippitts.sermonflow.domain.Sermon;
import com.phillippitts.sermonflow.domain.SermonStatus;
import com.phillippitts.sermonflow.domain.StudyGuide;
import com.phillippitts.sermonflow.domain.Transcript;
import com.phillippitts.sermonflow.service.repository.SermonRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.NoSuchElementException;
import java.util.UUID;

/**
 * Read-only view of a persisted sermon and its processing results.
 */
@RestController
@RequestMapping("/api/sermons")
class SermonController {

    private final SermonRepository repository;

    SermonController(SermonRepository repository) {
        this.repository = repository;
    }

    @GetMapping("/{id}")
    ResponseEntity<SermonDetailView> sermon(@PathVariable("id") UUID id) {
        Sermon sermon = repository.fetchSermon(id)
                .orElseThrow(() -> new NoSuchElementException("Unknown sermon " + id));
        SermonStatus status = sermon.status();
        return ResponseEntity.ok(new SermonDetailView(
                sermon,
                status,
                status.getDisplayName(),
                status.isViewable(),
                status.canRetryStudyGuide(),
                sermon.formattedDuration(),
                repository.fetchChunks(id).size(),
                repository.fetchTranscript(id).orElse(null),
                repository.fetchStudyGuide(id).orElse(null)));
    }

    record SermonDetailView(
            Sermon sermon,
            SermonStatus status,
            String statusName,
            boolean viewable,
            boolean canRetryStudyGuide,
            String formattedDuration,
            int chunkCount,
            Transcript transcript,
            StudyGuide studyGuide
    ) {}
}
