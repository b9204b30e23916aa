package com.uchion.infrastructure.ai.validation;

import com.uchion.domain.validation.model.JudgeResult;
import com.uchion.domain.worksheet.model.DomainContext;
import com.uchion.domain.worksheet.model.GeneratedItem;

import java.util.List;

/**
 * One independent check over a whole batch.
 * <p>
 * Implementations never throw: any failure is reported as an unavailable {@link JudgeResult}.
 */
public interface Judge {

    String name();

    JudgeResult run(List<GeneratedItem> items, DomainContext context);
}
