package com.herzen.lms.tracking;

import com.herzen.lms.common.Patch;
import com.herzen.lms.domain.DomainModels.LessonTrack;
import com.herzen.lms.domain.DomainModels.TrackingStatus;
import com.herzen.lms.tracking.TrackingModels.UpdateProgressRequest;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;

public final class ProgressCalculator {
    private ProgressCalculator() {
    }

    public static int percentage(int completed, int total) {
        if (total <= 0) return 0;
        return (int) Math.min(100, Math.round(completed * 100.0 / total));
    }

    public static TrackingStatus aggregateStatus(int completed, int total) {
        return total > 0 && completed >= total ? TrackingStatus.COMPLETED : TrackingStatus.INCOMPLETE;
    }

    /**
     * Applies a progress report to an attempt. A completed attempt stays completed.
     */
    public static LessonTrack applyProgress(LessonTrack current, UpdateProgressRequest request, String userId, OffsetDateTime now) {
        int total = Patch.or(request.totalContent(), current.totalContent());
        int position = Patch.or(request.currentPosition(), current.currentPosition());
        int percentage = request.completionPercentage() != null
                ? request.completionPercentage()
                : percentage(position, total);

        boolean completed = current.status() == TrackingStatus.COMPLETED
                || (total > 0 && position == total)
                || percentage >= 100
                || request.status() == TrackingStatus.COMPLETED;

        TrackingStatus status = completed ? TrackingStatus.COMPLETED : TrackingStatus.INCOMPLETE;
        OffsetDateTime end = completed ? Patch.or(current.endDatetime(), now) : current.endDatetime();

        return new LessonTrack(current.lessonTrackId(), current.tenantId(), current.organisationId(),
                current.lessonId(), current.courseId(), current.userId(), current.attempt(), status,
                current.startDatetime(), end,
                Patch.or(request.score(), current.score()), total, position,
                completed ? 100 : percentage,
                Patch.or(request.timeSpent(), current.timeSpent()),
                mergeParams(current.params(), request.params()), userId, now);
    }

    public static Map<String, Object> mergeParams(Map<String, Object> current, Map<String, Object> incoming) {
        if (incoming == null) return current;
        Map<String, Object> merged = current == null ? new HashMap<>() : new HashMap<>(current);
        merged.putAll(incoming);
        return merged;
    }
}
