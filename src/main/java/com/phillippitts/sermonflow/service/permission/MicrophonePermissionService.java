package com.phillippitts.sermonflow.service.permission;

/**
 * Microphone access check performed before a recording starts.
 */
public interface MicrophonePermissionService {

    /**
     * @return whether the microphone may be used
     */
    boolean requestMicrophonePermission();
}
