package com.whereq.cadence.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Identity of an analysis job: one question of one interview session.
 * The text form is {@code <token>:q<questionIndex>}, e.g. {@code T1:q0}.
 */
@Getter
@EqualsAndHashCode
public final class JobKey {

    private static final String SEPARATOR = ":q";

    private final String token;

    private final int questionIndex;

    private JobKey(String token, int questionIndex) {
        this.token = token;
        this.questionIndex = questionIndex;
    }

    public static JobKey of(String token, int questionIndex) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Session token must not be blank");
        }
        if (questionIndex < 0) {
            throw new IllegalArgumentException("Question index must not be negative: " + questionIndex);
        }
        return new JobKey(token, questionIndex);
    }

    /**
     * Parse the text form produced by {@link #toString()}.
     *
     * @throws IllegalArgumentException if the text is not a job id
     */
    public static JobKey parse(String jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("Job id must not be null");
        }
        int separator = jobId.lastIndexOf(SEPARATOR);
        if (separator <= 0 || separator + SEPARATOR.length() == jobId.length()) {
            throw new IllegalArgumentException("Malformed job id: " + jobId);
        }
        String index = jobId.substring(separator + SEPARATOR.length());
        for (int i = 0; i < index.length(); i++) {
            char c = index.charAt(i);
            if (c < '0' || c > '9') {
                throw new IllegalArgumentException("Malformed job id: " + jobId);
            }
        }
        try {
            return of(jobId.substring(0, separator), Integer.parseInt(index));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed job id: " + jobId, e);
        }
    }

    @Override
    public String toString() {
        return token + SEPARATOR + questionIndex;
    }
}
