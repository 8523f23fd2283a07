package com.herzen.lms.common;

import com.herzen.lms.validation.FieldViolation;
import org.springframework.http.HttpStatus;

import java.util.List;

public class ValidationFailedException extends LmsException {
    private final List<FieldViolation> violations;

    public ValidationFailedException(List<FieldViolation> violations) {
        super(violations.isEmpty() ? "Validation failed" : violations.get(0).message());
        this.violations = List.copyOf(violations);
    }

    public List<FieldViolation> violations() {
        return violations;
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.BAD_REQUEST;
    }

    public static void throwIfAny(List<FieldViolation> violations) {
        if (!violations.isEmpty()) {
            throw new ValidationFailedException(violations);
        }
    }
}
