package com.uchion.domain.validation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Whether a judge actually looked at the batch.
 * <p>
 * Lets callers tell "checked and clean" apart from "could not check" without
 * inspecting the reserved {@code -1} verdict.
 *
 * @param status CHECKED or UNAVAILABLE
 * @param reason judge-level code for UNAVAILABLE, {@code null} otherwise
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JudgeOutcome(Status status, IssueCode reason) {

    public enum Status {
        CHECKED,
        UNAVAILABLE
    }

    private static final JudgeOutcome CHECKED = new JudgeOutcome(Status.CHECKED, null);

    public static JudgeOutcome checked() {
        return CHECKED;
    }

    public static JudgeOutcome unavailable(IssueCode reason) {
        return new JudgeOutcome(Status.UNAVAILABLE, reason);
    }

    @JsonIgnore
    public boolean isAvailable() {
        return status == Status.CHECKED;
    }
}
