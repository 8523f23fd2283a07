package com.herzen.lms.validation;

import com.herzen.lms.common.ResponseMessages;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DateRulesTest {
    private static final OffsetDateTime NOW = OffsetDateTime.of(2025, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    private final DateRules rules = new DateRules();

    @Test
    void acceptsOrderedOrHalfOpenRanges() {
        assertTrue(rules.validateRange(NOW, NOW.plusDays(1)).isEmpty());
        assertTrue(rules.validateRange(NOW, null).isEmpty());
        assertTrue(rules.validateRange(null, NOW).isEmpty());
        assertTrue(rules.validateRange(null, null).isEmpty());
    }

    @Test
    void rejectsEndNotAfterStart() {
        List<FieldViolation> equal = rules.validateRange(NOW, NOW);
        assertEquals(2, equal.size());
        assertEquals("startDatetime", equal.get(0).field());
        assertEquals(ResponseMessages.END_DATE_INVALID, equal.get(1).message());

        List<FieldViolation> reversed = rules.validateRange(NOW, NOW.minusHours(1), "from", "to");
        assertEquals(List.of("from", "to"), reversed.stream().map(FieldViolation::field).toList());
    }

    @Test
    void certificateDateMustFollowNowAndCourseEnd() {
        OffsetDateTime end = NOW.plusDays(10);
        assertTrue(rules.validateCertificateDate(null, end, NOW).isEmpty());
        assertTrue(rules.validateCertificateDate(end.plusSeconds(1), end, NOW).isEmpty());

        assertEquals(ResponseMessages.CERT_DATE_AFTER_END,
                rules.validateCertificateDate(end, end, NOW).get(0).message());
        assertEquals(ResponseMessages.CERT_DATE_AFTER_END,
                rules.validateCertificateDate(NOW.plusDays(1), end, NOW).get(0).message());
        assertEquals(ResponseMessages.CERT_DATE_AFTER_END,
                rules.validateCertificateDate(NOW.minusDays(1), NOW.minusDays(2), NOW).get(0).message());
    }

    @Test
    void certificateDateWithoutCourseEndOnlyNeedsToBeInFuture() {
        assertTrue(rules.validateCertificateDate(NOW.plusMinutes(1), null, NOW).isEmpty());
        List<FieldViolation> past = rules.validateCertificateDate(NOW, null, NOW);
        assertEquals(1, past.size());
        assertEquals(ResponseMessages.CERT_DATE_IN_FUTURE, past.get(0).message());
    }
}
