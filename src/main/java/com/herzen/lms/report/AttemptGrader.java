package com.herzen.lms.report;

import com.herzen.lms.domain.DomainModels.AttemptsGradeMethod;
import com.herzen.lms.domain.DomainModels.LessonTrack;

import java.util.Comparator;
import java.util.List;

public final class AttemptGrader {
    private AttemptGrader() {
    }

    /**
     * Grades a user's attempts at a lesson. Attempts must be ordered by attempt number.
     */
    public static int grade(List<LessonTrack> attempts, AttemptsGradeMethod method) {
        if (attempts == null || attempts.isEmpty()) return 0;
        AttemptsGradeMethod effective = method == null ? AttemptsGradeMethod.LAST_ATTEMPT : method;
        return switch (effective) {
            case FIRST_ATTEMPT -> attempts.get(0).score();
            case LAST_ATTEMPT -> attempts.get(attempts.size() - 1).score();
            case AVERAGE -> (int) Math.round(attempts.stream().mapToInt(LessonTrack::score).average().orElse(0));
            case HIGHEST -> attempts.stream().max(Comparator.comparingInt(LessonTrack::score)).map(LessonTrack::score).orElse(0);
        };
    }
}
