package com.phillippitts.sermonflow.presentation.controller;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request bodies accepted by {@link SermonFlowController}.
 */
final class SermonFlowRequests {

    private SermonFlowRequests() {
    }

    /**
     * @param title optional title, defaults to "Untitled Sermon"
     * @param speakerName optional speaker
     */
    record StartRecording(@Size(max = 200) String title, @Size(max = 200) String speakerName) {
    }

    /**
     * @param path file on the server's file system to import
     * @param title optional title, defaults to the file name
     * @param speakerName optional speaker
     */
    record ImportAudio(@NotBlank String path, @Size(max = 200) String title, @Size(max = 200) String speakerName) {
    }
}
