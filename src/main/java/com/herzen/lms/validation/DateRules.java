package com.herzen.lms.validation;

import com.herzen.lms.common.ResponseMessages;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

@Component
public class DateRules {
    public List<FieldViolation> validateRange(OffsetDateTime start, OffsetDateTime end) {
        return validateRange(start, end, "startDatetime", "endDatetime");
    }

    public List<FieldViolation> validateRange(OffsetDateTime start, OffsetDateTime end, String startField, String endField) {
        List<FieldViolation> errors = new ArrayList<>();
        if (start != null && end != null && !end.isAfter(start)) {
            errors.add(new FieldViolation(startField, ResponseMessages.START_DATE_INVALID));
            errors.add(new FieldViolation(endField, ResponseMessages.END_DATE_INVALID));
        }
        return errors;
    }

    public List<FieldViolation> validateCertificateDate(OffsetDateTime certGenDate, OffsetDateTime endDatetime, OffsetDateTime now) {
        List<FieldViolation> errors = new ArrayList<>();
        if (certGenDate == null) return errors;
        if (endDatetime != null) {
            if (!certGenDate.isAfter(now) || !certGenDate.isAfter(endDatetime)) {
                errors.add(new FieldViolation("certGenDate", ResponseMessages.CERT_DATE_AFTER_END));
            }
        } else if (!certGenDate.isAfter(now)) {
            errors.add(new FieldViolation("certGenDate", ResponseMessages.CERT_DATE_IN_FUTURE));
        }
        return errors;
    }
}
