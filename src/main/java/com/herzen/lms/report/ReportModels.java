package com.herzen.lms.report;

import com.herzen.lms.common.Ids;
import com.herzen.lms.domain.DomainModels.EnrollmentStatus;
import com.herzen.lms.domain.DomainModels.LessonFormat;
import com.herzen.lms.domain.DomainModels.LessonSubFormat;
import com.herzen.lms.domain.DomainModels.TrackingStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.time.OffsetDateTime;
import java.util.List;

public class ReportModels {
    public record CourseReportRequest(@NotBlank @Pattern(regexp = Ids.UUID_REGEX, message = Ids.UUID_MESSAGE) String courseId,
                                      String cohortId,
                                      @Pattern(regexp = Ids.UUID_REGEX, message = Ids.UUID_MESSAGE) String lessonId,
                                      @Min(0) Integer offset,
                                      @Min(1) @Max(1000) Integer limit,
                                      String sortBy,
                                      @Pattern(regexp = "(?i)asc|desc", message = "must be asc or desc") String orderBy,
                                      TrackingStatus status,
                                      EnrollmentStatus enrollmentStatus,
                                      Boolean certificateIssued) {
        public CourseReportRequest {
            if (offset == null) offset = 0;
            if (limit == null) limit = 10;
            if (sortBy == null) sortBy = "progress";
            if (orderBy == null) orderBy = "desc";
        }
    }

    /** One row of either report level. */
    public interface ReportRow {
        String userId();
    }

    public record CourseReportRow(String userId, String name, String email, String cohortId,
                                  String courseId, String courseTitle,
                                  int progress, int completedLessons, int totalLessons,
                                  TrackingStatus status, EnrollmentStatus enrollmentStatus, OffsetDateTime enrolledOnTime,
                                  OffsetDateTime lastAccessed, boolean certificateIssued, OffsetDateTime certGenDate) implements ReportRow {}

    public record LessonReportRow(String userId, String name, String email,
                                  String courseId, String courseTitle, String lessonId, String lessonTitle, LessonFormat type,
                                  int progress, int score, int timeSpentMins, int attempt,
                                  TrackingStatus status, OffsetDateTime lastAccessed) implements ReportRow {}

    public record UserProfile(String userId, String name, String email) {}

    public record LessonCompletionRequest(@NotBlank String cohortId,
                                          @NotBlank @Pattern(regexp = Ids.UUID_REGEX, message = Ids.UUID_MESSAGE) String userId,
                                          @NotEmpty List<@Valid CompletionCriterion> criteria) {}

    public record CompletionCriterion(LessonFormat lessonFormat, LessonSubFormat lessonSubFormat,
                                      @NotNull @Min(0) Integer completionRule) {}

    public record CriterionResult(CompletionCriterion criterion, boolean status, int totalLessons, int completedLessons,
                                  String message) {}

    public record LessonCompletionResponse(boolean overallStatus, List<CriterionResult> criteriaResults) {}

    public record TestProgressRequest(@NotBlank String testId,
                                      @NotBlank @Pattern(regexp = Ids.UUID_REGEX, message = Ids.UUID_MESSAGE) String userId,
                                      @NotNull @Min(0) Integer score,
                                      @NotBlank @Pattern(regexp = "pass|fail", message = "must be pass or fail") String result,
                                      @Pattern(regexp = Ids.UUID_REGEX, message = Ids.UUID_MESSAGE) String reviewedBy) {}

    public record TestProgressResponse(String lessonId, String attemptId, int attempt, TrackingStatus status,
                                       int score, String result, int gradedScore) {}
}
