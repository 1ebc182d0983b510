package com.phillippitts.callintel.service.transcription;

import com.phillippitts.callintel.exception.UpstreamException;

/**
 * Downloads a call recording and converts it to text.
 *
 * <p>Implementations classify every failure into an {@link UpstreamException} whose
 * {@link com.phillippitts.callintel.exception.ErrorCategory} tells the caller whether the
 * recording is merely not downloadable yet
 * ({@link com.phillippitts.callintel.exception.ErrorCategory#NOT_YET_AVAILABLE}).
 */
public interface SpeechToTextClient {

    /**
     * @param recordingUrl HTTP(S) location of the recording
     * @return transcript text, possibly empty for silent recordings
     * @throws UpstreamException if the download or the transcription request fails
     */
    String transcribe(String recordingUrl);
}
