package com.whereq.cadence.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Structured output of one video analysis
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResult {
    /**
     * Word-for-word transcript of the answer
     */
    private String transcript;

    /**
     * How well the answer addresses the question (0-100)
     */
    @JsonAlias("match_score")
    private int matchScore;

    private String feedback;

    private String emotion;

    @JsonAlias("emotion_score")
    private int emotionScore;

    /**
     * Speaking pace in words per minute
     */
    @JsonAlias("pace_wpm")
    private int paceWpm;

    @JsonAlias("pace_label")
    private String paceLabel;
}
