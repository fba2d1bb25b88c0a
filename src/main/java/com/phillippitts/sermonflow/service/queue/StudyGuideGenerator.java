package com.phillippitts.sermonflow.service.queue;

import com.phillippitts.sermonflow.domain.Sermon;
import com.phillippitts.sermonflow.domain.StudyGuide;
import com.phillippitts.sermonflow.domain.Transcript;

/**
 * Study guide back end used by {@link LocalProcessingJobQueue}.
 */
@FunctionalInterface
public interface StudyGuideGenerator {

    StudyGuide generate(Sermon sermon, Transcript transcript);
}
