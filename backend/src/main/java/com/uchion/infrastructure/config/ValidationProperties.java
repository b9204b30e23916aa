package com.uchion.infrastructure.config;

import com.uchion.domain.validation.model.IssueCode;
import com.uchion.domain.worksheet.model.Subject;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Configuration properties for the validation pipeline: judge timeouts,
 * batch limits and the automatic remediation policy.
 */
@Data
@Component
@ConfigurationProperties(prefix = "validation")
public class ValidationProperties {

    /**
     * Upper bound for one judge's round trip, measured at the fan-in (in seconds).
     * Default: 90 seconds
     */
    private long judgeTimeoutSeconds = 90;

    /**
     * Largest batch accepted by the API.
     * Default: 40 items
     */
    private int maxBatchSize = 40;

    /**
     * Whether the local structure judge runs alongside the oracle judges.
     * Default: true
     */
    private boolean structureJudgeEnabled = true;

    /**
     * Automatic remediation policy
     */
    private Remediation remediation = new Remediation();

    @Data
    public static class Remediation {
        /**
         * Maximum number of items repaired in one run.
         * Default: 10
         */
        private int budget = 10;

        /**
         * Subjects never repaired automatically; their issues are only reported.
         * Default: none
         */
        private Set<Subject> excludedSubjects = EnumSet.noneOf(Subject.class);

        /**
         * Warning codes that still qualify an item for repair.
         * Default: DIFFICULTY_MISMATCH
         */
        private Set<IssueCode> remediableWarnings = EnumSet.of(IssueCode.DIFFICULTY_MISMATCH);

        /**
         * When the re-verification judge is unavailable, revert the repairs instead of
         * committing them unverified.
         * Default: false
         */
        private boolean revertUnverified = false;
    }
}
