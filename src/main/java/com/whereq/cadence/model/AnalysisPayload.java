package com.whereq.cadence.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * What the analyzer needs for one job. The queue stores it but never looks inside.
 */
@Value
@Builder
@AllArgsConstructor
public class AnalysisPayload {
    /**
     * Upload folder of the session
     */
    String folder;

    /**
     * Path of the recorded answer
     */
    String videoPath;

    /**
     * Question the candidate answered, used in the analysis prompt
     */
    String questionText;

    /**
     * Recording length in seconds, null when unknown
     */
    Integer durationSeconds;
}
