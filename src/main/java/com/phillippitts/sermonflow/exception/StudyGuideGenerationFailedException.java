package com.phillippitts.sermonflow.exception;

/**
 * Study guide generation failed. When the transcript succeeded the sermon stays viewable.
 */
public class StudyGuideGenerationFailedException extends SermonFlowException {

    private final String reason;

    public StudyGuideGenerationFailedException(String reason) {
        super(ErrorKind.STUDY_GUIDE_GENERATION_FAILED, "Study guide generation failed: " + reason);
        this.reason = reason;
    }

    public StudyGuideGenerationFailedException(String reason, Throwable cause) {
        super(ErrorKind.STUDY_GUIDE_GENERATION_FAILED, "Study guide generation failed: " + reason, ErrorKind.STUDY_GUIDE_GENERATION_FAILED.isRetryableByDefault(), cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
