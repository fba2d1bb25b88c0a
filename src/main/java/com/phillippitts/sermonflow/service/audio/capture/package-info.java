/**
 * Microphone capture: chunked WAV recording, pause/resume, and the live level meter.
 */
package com.phillippitts.sermonflow.service.audio.capture;
