/**
 * Transcript stage: claim, bounded wait for the recording URL, download and speech-to-text
 * with not-yet-available backoff, terminal write.
 */
package com.phillippitts.callintel.service.transcription;
