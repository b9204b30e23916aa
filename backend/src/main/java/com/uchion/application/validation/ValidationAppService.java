package com.uchion.application.validation;

import com.uchion.application.validation.exception.BatchTooLargeException;
import com.uchion.domain.validation.model.ValidationOptions;
import com.uchion.domain.validation.model.ValidationReport;
import com.uchion.domain.validation.service.ValidationService;
import com.uchion.domain.worksheet.model.DomainContext;
import com.uchion.domain.worksheet.model.GeneratedItem;
import com.uchion.infrastructure.config.ValidationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ValidationAppService {

    private final ValidationService validationService;
    private final ValidationProperties properties;

    /**
     * Request-level limits, then the full validation pipeline.
     */
    public ValidationReport validate(List<GeneratedItem> items, DomainContext context, boolean autoFix) {
        if (items.size() > properties.getMaxBatchSize()) {
            log.warn("[ValidationAppService] Rejected batch of {} items (max {})", items.size(), properties.getMaxBatchSize());
            throw new BatchTooLargeException(items.size(), properties.getMaxBatchSize());
        }
        return validationService.validate(items, context, new ValidationOptions(autoFix));
    }
}
