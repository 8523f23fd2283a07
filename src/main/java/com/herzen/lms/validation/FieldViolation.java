package com.herzen.lms.validation;

public record FieldViolation(String field, String message) {}
