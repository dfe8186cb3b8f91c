package com.whereq.cadence.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * Result of one analysis call: either a result or an error kind with its message.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class AnalysisOutcome {

    private final AnalysisResult result;

    private final ErrorKind errorKind;

    private final String errorMessage;

    public static AnalysisOutcome success(AnalysisResult result) {
        return new AnalysisOutcome(Objects.requireNonNull(result, "result"), null, null);
    }

    public static AnalysisOutcome failure(ErrorKind errorKind, String errorMessage) {
        return new AnalysisOutcome(null, Objects.requireNonNull(errorKind, "errorKind"), errorMessage);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }
}
