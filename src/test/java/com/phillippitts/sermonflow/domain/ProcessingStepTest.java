package com.phillippitts.sermonflow.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ProcessingStepTest {

    @Test
    void uploadingCoversFirstFifth() {
        assertThat(ProcessingStep.uploading(0.0).overallProgress()).isEqualTo(0.0);
        assertThat(ProcessingStep.uploading(0.5).overallProgress()).isCloseTo(0.1, within(1e-9));
        assertThat(ProcessingStep.uploading(1.0).overallProgress()).isCloseTo(0.2, within(1e-9));
    }

    @Test
    void transcribingCoversNextHalf() {
        assertThat(ProcessingStep.transcribing(0.0, 1, 3).overallProgress()).isCloseTo(0.2, within(1e-9));
        assertThat(ProcessingStep.transcribing(0.5, 2, 3).overallProgress()).isCloseTo(0.45, within(1e-9));
        assertThat(ProcessingStep.transcribing(1.0, 3, 3).overallProgress()).isCloseTo(0.7, within(1e-9));
    }

    @Test
    void laterStagesHaveFixedProgress() {
        assertThat(ProcessingStep.moderating().overallProgress()).isEqualTo(0.75);
        assertThat(ProcessingStep.analyzing().overallProgress()).isEqualTo(0.85);
        assertThat(ProcessingStep.saving().overallProgress()).isEqualTo(0.95);
    }

    @Test
    void clampsFraction() {
        assertThat(ProcessingStep.uploading(1.7).fraction()).isEqualTo(1.0);
        assertThat(ProcessingStep.uploading(-0.3).fraction()).isEqualTo(0.0);
        assertThat(ProcessingStep.uploading(Double.NaN).fraction()).isEqualTo(0.0);
    }

    @Test
    void displayNameMentionsChunkOnlyForMultiChunkSermons() {
        assertThat(ProcessingStep.transcribing(0.4, 2, 3).displayName())
                .isEqualTo("Transcribing (chunk 2 of 3)...");
        assertThat(ProcessingStep.transcribing(0.4, 1, 1).displayName()).isEqualTo("Transcribing audio...");
        assertThat(ProcessingStep.analyzing().displayName()).isEqualTo("Generating study guide...");
    }
}
