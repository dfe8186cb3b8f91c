package com.whereq.cadence.analyzer;

import com.whereq.cadence.model.AnalysisOutcome;
import com.whereq.cadence.model.AnalysisPayload;

/**
 * External video analysis service
 */
public interface VideoAnalyzer {
    /**
     * Analyze one recorded answer synchronously (blocking, upload + inference).
     * Failures are reported in the outcome; implementations should not throw.
     *
     * @param payload video and question to analyze
     * @return analysis result or failure
     */
    AnalysisOutcome analyze(AnalysisPayload payload);
}
