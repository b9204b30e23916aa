package com.uchion.domain.validation.model;

/**
 * An issue together with the item it concerns and the judge that raised it.
 */
public record AttributedIssue(int itemIndex, String judgeName, Issue issue) {}
