package com.uchion.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
