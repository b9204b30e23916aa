package com.uchion.domain.validation.model;

/**
 * @param autoFix whether flagged items may be repaired automatically
 */
public record ValidationOptions(boolean autoFix) {

    public static ValidationOptions defaults() {
        return new ValidationOptions(true);
    }
}
