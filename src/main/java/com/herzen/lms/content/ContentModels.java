package com.herzen.lms.content;

import com.herzen.lms.common.Ids;
import com.herzen.lms.domain.DomainModels.*;
import com.herzen.lms.domain.DomainModels.Module;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

public class ContentModels {
    public record CreateCourseRequest(@NotBlank @Size(max = 255) String title,
                                      @Size(max = 255) String alias,
                                      @Size(max = 1000) String shortDescription,
                                      String description,
                                      String image,
                                      Boolean featured,
                                      Boolean free,
                                      ContentStatus status,
                                      Boolean adminApproval,
                                      Boolean autoEnroll,
                                      OffsetDateTime startDatetime,
                                      OffsetDateTime endDatetime,
                                      Map<String, Object> certificateTerm,
                                      @Pattern(regexp = Ids.UUID_REGEX, message = Ids.UUID_MESSAGE) String certificateId,
                                      Map<String, Object> params) {}

    public record UpdateCourseRequest(@Size(max = 255) String title,
                                      @Size(max = 255) String alias,
                                      @Size(max = 1000) String shortDescription,
                                      String description,
                                      String image,
                                      Boolean featured,
                                      Boolean free,
                                      ContentStatus status,
                                      Boolean adminApproval,
                                      Boolean autoEnroll,
                                      OffsetDateTime startDatetime,
                                      OffsetDateTime endDatetime,
                                      Map<String, Object> certificateTerm,
                                      @Pattern(regexp = Ids.UUID_REGEX, message = Ids.UUID_MESSAGE) String certificateId,
                                      @Min(0) Integer ordering,
                                      Map<String, Object> params) {}

    public record CourseSearch(String query,
                               ContentStatus status,
                               String cohortId,
                               Boolean featured,
                               Boolean free,
                               String createdBy,
                               OffsetDateTime startDateFrom,
                               OffsetDateTime startDateTo,
                               OffsetDateTime endDateFrom,
                               OffsetDateTime endDateTo) {
        public static CourseSearch empty() {
            return new CourseSearch(null, null, null, null, null, null, null, null, null, null);
        }
    }

    public record CourseHierarchy(Course course, List<ModuleNode> modules) {}

    public record ModuleNode(Module module, List<ModuleNode> submodules, List<Lesson> lessons) {}

    public record CourseHierarchyWithTracking(Course course, TrackingSummary tracking, List<TrackedModule> modules) {}

    public record TrackingSummary(TrackingStatus status, int progress, int completedLessons, int totalLessons,
                                  LastAccessedLesson lastAccessedLesson) {}

    public record LastAccessedLesson(String lessonId, String attemptId, OffsetDateTime lastAccessed) {}

    public record TrackedModule(Module module, ModuleTrack tracking, List<TrackedModule> submodules, List<TrackedLesson> lessons) {}

    public record TrackedLesson(Lesson lesson, LessonTrack latestAttempt) {}

    public record CreateModuleRequest(@NotBlank @Pattern(regexp = Ids.UUID_REGEX, message = Ids.UUID_MESSAGE) String courseId,
                                      @Pattern(regexp = Ids.UUID_REGEX, message = Ids.UUID_MESSAGE) String parentId,
                                      @NotBlank @Size(max = 255) String title,
                                      String description,
                                      String image,
                                      @Min(0) Integer ordering,
                                      ContentStatus status,
                                      OffsetDateTime startDatetime,
                                      OffsetDateTime endDatetime,
                                      Map<String, Object> params) {}

    public record UpdateModuleRequest(@Size(max = 255) String title,
                                      String description,
                                      String image,
                                      @Min(0) Integer ordering,
                                      ContentStatus status,
                                      OffsetDateTime startDatetime,
                                      OffsetDateTime endDatetime,
                                      Map<String, Object> params) {}

    public record ModuleSearch(String query, String courseId, String parentId, ContentStatus status,
                               String sortBy, String orderBy) {}

    public record ModuleWithLessonCount(Module module, int lessonCount) {}

    public record CreateLessonRequest(@NotBlank @Pattern(regexp = Ids.UUID_REGEX, message = Ids.UUID_MESSAGE) String courseId,
                                      @NotBlank @Pattern(regexp = Ids.UUID_REGEX, message = Ids.UUID_MESSAGE) String moduleId,
                                      @NotBlank @Size(max = 255) String title,
                                      @Size(max = 255) String alias,
                                      String description,
                                      String image,
                                      ContentStatus status,
                                      @NotNull LessonFormat format,
                                      LessonSubFormat mediaContentSubFormat,
                                      String mediaContentSource,
                                      String mediaContentPath,
                                      String storage,
                                      OffsetDateTime startDatetime,
                                      OffsetDateTime endDatetime,
                                      @Min(0) Integer noOfAttempts,
                                      AttemptsGradeMethod attemptsGrade,
                                      @Min(0) Integer idealTime,
                                      Boolean resume,
                                      @Min(0) Integer totalMarks,
                                      @Min(0) Integer passingMarks,
                                      Boolean considerForPassing,
                                      Boolean sampleLesson,
                                      Boolean allowResubmission,
                                      @Min(0) Integer ordering,
                                      @Pattern(regexp = Ids.UUID_REGEX, message = Ids.UUID_MESSAGE) String associatedLesson,
                                      Map<String, Object> params) {}

    public record UpdateLessonRequest(@Size(max = 255) String title,
                                      @Size(max = 255) String alias,
                                      String description,
                                      String image,
                                      ContentStatus status,
                                      String mediaContentSource,
                                      String mediaContentPath,
                                      OffsetDateTime startDatetime,
                                      OffsetDateTime endDatetime,
                                      @Min(0) Integer noOfAttempts,
                                      AttemptsGradeMethod attemptsGrade,
                                      @Min(0) Integer idealTime,
                                      Boolean resume,
                                      @Min(0) Integer totalMarks,
                                      @Min(0) Integer passingMarks,
                                      Boolean considerForPassing,
                                      Boolean sampleLesson,
                                      Boolean allowResubmission,
                                      @Min(0) Integer ordering,
                                      Map<String, Object> params) {}

    public record LessonSearch(String query, ContentStatus status, LessonFormat format, String courseId, String moduleId) {}

    public record LessonDetails(Lesson lesson, Media media, List<Lesson> associatedLessons) {}
}
