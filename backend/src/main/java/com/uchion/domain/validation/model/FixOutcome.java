package com.uchion.domain.validation.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.uchion.domain.worksheet.model.GeneratedItem;

/**
 * Result of one repair attempt. Exactly one of {@code fixedItem} and {@code error} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FixOutcome(
        int itemIndex,
        boolean success,
        GeneratedItem fixedItem,
        String description,
        String error,
        OracleUsage usage
) {
    public FixOutcome {
        if (success && (fixedItem == null || error != null)) {
            throw new IllegalArgumentException("Successful fix must carry a fixed item and no error");
        }
        if (!success && (fixedItem != null || error == null)) {
            throw new IllegalArgumentException("Failed fix must carry an error and no fixed item");
        }
        usage = usage == null ? OracleUsage.NONE : usage;
    }

    public static FixOutcome fixed(int itemIndex, GeneratedItem fixedItem, String description, OracleUsage usage) {
        return new FixOutcome(itemIndex, true, fixedItem, description, null, usage);
    }

    public static FixOutcome failed(int itemIndex, String error, OracleUsage usage) {
        return new FixOutcome(itemIndex, false, null, null, error, usage);
    }

    /**
     * Copy used when re-verification rejects the replacement.
     */
    public FixOutcome reverted(String reason) {
        return new FixOutcome(itemIndex, false, null, description, reason, usage);
    }

    public FixOutcome withDescription(String newDescription) {
        return new FixOutcome(itemIndex, success, fixedItem, newDescription, error, usage);
    }
}
