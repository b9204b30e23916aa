package com.uchion.domain.validation.service;

import com.uchion.domain.validation.model.ValidationOptions;
import com.uchion.domain.validation.model.ValidationReport;
import com.uchion.domain.worksheet.model.DomainContext;
import com.uchion.domain.worksheet.model.GeneratedItem;

import java.util.List;

/**
 * Domain service interface for judging a generated batch and repairing what can be repaired.
 */
public interface ValidationService {

    /**
     * Runs every configured judge over the batch, aggregates their verdicts and, when
     * {@code options.autoFix()} is set, repairs a bounded subset of flagged items.
     * <p>
     * Never throws for oracle failures: an unavailable judge or a failed repair is
     * reported inside the returned report.
     *
     * @param items   the generated batch, addressed by position
     * @param context subject, grade, topic and difficulty of the batch
     * @param options run options
     * @return the complete report, including the possibly repaired items
     */
    ValidationReport validate(List<GeneratedItem> items, DomainContext context, ValidationOptions options);
}
