package com.herzen.lms.tracking;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.herzen.lms.common.Ids;
import com.herzen.lms.domain.DomainModels.TrackingStatus;
import com.herzen.lms.domain.DomainModels.Valued;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

import java.time.OffsetDateTime;
import java.util.Map;

public class TrackingModels {
    public record UpdateCourseTrackingRequest(TrackingStatus status,
                                              OffsetDateTime startDatetime,
                                              OffsetDateTime endDatetime,
                                              @Min(0) Integer noOfLessons,
                                              @Min(0) Integer completedLessons,
                                              OffsetDateTime lastAccessedDate,
                                              OffsetDateTime certGenDate,
                                              Boolean certificateIssued) {}

    public record UpdateProgressRequest(@Min(0) Integer totalContent,
                                        @Min(0) Integer currentPosition,
                                        @Min(0) Integer score,
                                        @Min(0) @Max(100) Integer completionPercentage,
                                        Map<String, Object> params,
                                        TrackingStatus status,
                                        @Min(0) Integer timeSpent) {}

    public record EventProgressRequest(@NotBlank @Pattern(regexp = Ids.UUID_REGEX, message = Ids.UUID_MESSAGE) String userId,
                                       TrackingStatus status,
                                       @Min(0) Integer timeSpent,
                                       Map<String, Object> params) {}

    public record LessonStatus(String lessonId, boolean canResume, boolean canReattempt,
                               TrackingStatus lastAttemptStatus, String lastAttemptId, int attemptsUsed, int maxAttempts) {}

    public record RecalculationResult(boolean success, String message, int courseTrackUpdated, int moduleTrackUpdated) {}

    public enum AttemptAction implements Valued {
        START("start"), RESUME("resume");

        private final String value;

        AttemptAction(String value) { this.value = value; }

        @JsonValue
        @Override
        public String value() { return value; }

        @JsonCreator
        public static AttemptAction fromValue(String value) { return Valued.parse(values(), value, "action"); }
    }
}
