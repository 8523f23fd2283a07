package com.herzen.lms.tracking;

import com.herzen.lms.domain.DomainModels.LessonTrack;
import com.herzen.lms.domain.DomainModels.TrackingStatus;
import com.herzen.lms.tracking.TrackingModels.UpdateProgressRequest;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProgressCalculatorTest {
    private static final OffsetDateTime NOW = OffsetDateTime.of(2025, 6, 1, 9, 0, 0, 0, ZoneOffset.UTC);

    @Test
    void percentageRoundsAndCaps() {
        assertEquals(0, ProgressCalculator.percentage(3, 0));
        assertEquals(33, ProgressCalculator.percentage(1, 3));
        assertEquals(67, ProgressCalculator.percentage(2, 3));
        assertEquals(100, ProgressCalculator.percentage(5, 4));
    }

    @Test
    void aggregateNeedsAtLeastOneLesson() {
        assertEquals(TrackingStatus.INCOMPLETE, ProgressCalculator.aggregateStatus(0, 0));
        assertEquals(TrackingStatus.INCOMPLETE, ProgressCalculator.aggregateStatus(1, 2));
        assertEquals(TrackingStatus.COMPLETED, ProgressCalculator.aggregateStatus(2, 2));
    }

    @Test
    void partialProgressMovesStartedAttemptToIncomplete() {
        LessonTrack updated = ProgressCalculator.applyProgress(attempt(TrackingStatus.STARTED),
                new UpdateProgressRequest(10, 4, null, null, Map.of("page", 4), null, 30), "user", NOW);

        assertEquals(TrackingStatus.INCOMPLETE, updated.status());
        assertEquals(40, updated.completionPercentage());
        assertEquals(30, updated.timeSpent());
        assertNull(updated.endDatetime());
        assertEquals(4, updated.params().get("page"));
    }

    @Test
    void reachingTheEndCompletesTheAttempt() {
        LessonTrack updated = ProgressCalculator.applyProgress(attempt(TrackingStatus.INCOMPLETE),
                new UpdateProgressRequest(10, 10, 7, null, null, null, null), "user", NOW);

        assertEquals(TrackingStatus.COMPLETED, updated.status());
        assertEquals(100, updated.completionPercentage());
        assertEquals(NOW, updated.endDatetime());
        assertEquals(7, updated.score());
    }

    @Test
    void explicitStatusOrPercentageCompletes() {
        assertEquals(TrackingStatus.COMPLETED, ProgressCalculator.applyProgress(attempt(TrackingStatus.STARTED),
                new UpdateProgressRequest(null, null, null, 100, null, null, null), "user", NOW).status());
        assertEquals(TrackingStatus.COMPLETED, ProgressCalculator.applyProgress(attempt(TrackingStatus.STARTED),
                new UpdateProgressRequest(null, null, null, 20, null, TrackingStatus.COMPLETED, null), "user", NOW).status());
    }

    @Test
    void absentFieldsKeepCurrentValuesAndCompletedStaysCompleted() {
        LessonTrack current = new LessonTrack("a", "t", "o", "l", "c", "u", 1, TrackingStatus.COMPLETED,
                NOW.minusHours(1), NOW.minusMinutes(5), 8, 10, 10, 100, 120, Map.of("k", "v"), "u", NOW.minusMinutes(5));

        LessonTrack updated = ProgressCalculator.applyProgress(current,
                new UpdateProgressRequest(null, 3, null, null, null, TrackingStatus.INCOMPLETE, null), "u", NOW);

        assertEquals(TrackingStatus.COMPLETED, updated.status());
        assertEquals(10, updated.totalContent());
        assertEquals(8, updated.score());
        assertEquals(NOW.minusMinutes(5), updated.endDatetime());
        assertEquals("v", updated.params().get("k"));
    }

    private static LessonTrack attempt(TrackingStatus status) {
        return new LessonTrack("a", "t", "o", "l", "c", "u", 1, status, NOW.minusHours(1), null,
                0, 0, 0, 0, 0, null, "u", NOW.minusHours(1));
    }
}
