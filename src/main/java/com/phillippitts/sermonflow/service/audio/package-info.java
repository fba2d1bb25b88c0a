/**
 * Audio formats and WAV container handling shared by capture, import and analysis.
 */
package com.phillippitts.sermonflow.service.audio;
