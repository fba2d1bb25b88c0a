package com.phillippitts.sermonflow.service.permission;

import com.phillippitts.sermonflow.service.audio.CaptureFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.TargetDataLine;

/**
 * Grants access when the platform exposes a capture line for the recording format and the security
 * policy allows opening it.
 */
@Service
public class JavaSoundMicrophonePermissionService implements MicrophonePermissionService {

    private static final Logger LOG = LogManager.getLogger(JavaSoundMicrophonePermissionService.class);

    @Override
    public boolean requestMicrophonePermission() {
        DataLine.Info info = new DataLine.Info(TargetDataLine.class, CaptureFormat.toJavaSound());
        try {
            boolean supported = AudioSystem.isLineSupported(info);
            if (!supported) {
                LOG.warn("No capture line supports {}", CaptureFormat.toJavaSound());
            }
            return supported;
        } catch (SecurityException e) {
            LOG.warn("Microphone access denied: {}", e.getMessage());
            return false;
        }
    }
}
