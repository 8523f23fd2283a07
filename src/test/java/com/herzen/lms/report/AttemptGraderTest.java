package com.herzen.lms.report;

import com.herzen.lms.domain.DomainModels.AttemptsGradeMethod;
import com.herzen.lms.domain.DomainModels.LessonTrack;
import com.herzen.lms.domain.DomainModels.TrackingStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AttemptGraderTest {
    private final List<LessonTrack> attempts = List.of(scored(1, 40), scored(2, 90), scored(3, 75));

    @Test
    void gradesByConfiguredMethod() {
        assertEquals(40, AttemptGrader.grade(attempts, AttemptsGradeMethod.FIRST_ATTEMPT));
        assertEquals(75, AttemptGrader.grade(attempts, AttemptsGradeMethod.LAST_ATTEMPT));
        assertEquals(68, AttemptGrader.grade(attempts, AttemptsGradeMethod.AVERAGE));
        assertEquals(90, AttemptGrader.grade(attempts, AttemptsGradeMethod.HIGHEST));
    }

    @Test
    void noAttemptsGradeToZeroAndMissingMethodMeansLast() {
        assertEquals(0, AttemptGrader.grade(List.of(), AttemptsGradeMethod.HIGHEST));
        assertEquals(75, AttemptGrader.grade(attempts, null));
    }

    private static LessonTrack scored(int attempt, int score) {
        return new LessonTrack("id-" + attempt, "t", "o", "l", "c", "u", attempt, TrackingStatus.COMPLETED,
                null, null, score, 0, 0, 100, 0, null, "u", null);
    }
}
