package com.uchion.application.validation.exception;

public class BatchTooLargeException extends RuntimeException {
    public BatchTooLargeException(int size, int max) {
        super(String.format("Слишком много заданий: %d (максимум %d).", size, max));
    }
}
