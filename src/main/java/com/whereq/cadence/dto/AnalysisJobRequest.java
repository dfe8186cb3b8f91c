package com.whereq.cadence.dto;

import com.whereq.cadence.model.AnalysisPayload;
import com.whereq.cadence.model.JobKey;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to analyze (or re-analyze) one recorded answer
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Analysis job submission")
public class AnalysisJobRequest {

    @NotBlank(message = "Session token is required")
    @Schema(description = "Interview session token", example = "T1")
    private String token;

    @NotNull(message = "Question index is required")
    @Min(value = 0, message = "Question index must not be negative")
    @Schema(description = "0-based question index", example = "0")
    private Integer questionIndex;

    @NotBlank(message = "Folder is required")
    @Schema(description = "Upload folder of the session", example = "uploads/jane_doe_T1")
    private String folder;

    @NotBlank(message = "Video path is required")
    @Schema(description = "Path of the recorded answer", example = "uploads/jane_doe_T1/Q1.webm")
    private String videoPath;

    @NotBlank(message = "Question text is required")
    @Schema(description = "Question the candidate answered")
    private String questionText;

    @Min(value = 0, message = "Duration must not be negative")
    @Schema(description = "Recording length in seconds", example = "42")
    private Integer durationSeconds;

    public JobKey toJobKey() {
        return JobKey.of(token, questionIndex);
    }

    public AnalysisPayload toPayload() {
        return AnalysisPayload.builder()
            .folder(folder)
            .videoPath(videoPath)
            .questionText(questionText)
            .durationSeconds(durationSeconds)
            .build();
    }
}
