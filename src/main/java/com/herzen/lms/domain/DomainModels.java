package com.herzen.lms.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.herzen.lms.common.BadRequestException;

import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.Map;

public class DomainModels {
    public record Course(String courseId, String tenantId, String organisationId,
                         String title, String alias, String shortDescription, String description, String image,
                         boolean featured, boolean free, ContentStatus status,
                         boolean adminApproval, boolean autoEnroll,
                         OffsetDateTime startDatetime, OffsetDateTime endDatetime,
                         Map<String, Object> certificateTerm, String certificateId,
                         Map<String, Object> params, String cohortId, int ordering,
                         String createdBy, OffsetDateTime createdAt, String updatedBy, OffsetDateTime updatedAt) {}

    public record Module(String moduleId, String tenantId, String organisationId,
                         String courseId, String parentId, String title, String description, String image,
                         int ordering, ContentStatus status,
                         OffsetDateTime startDatetime, OffsetDateTime endDatetime, Map<String, Object> params,
                         String createdBy, OffsetDateTime createdAt, String updatedBy, OffsetDateTime updatedAt) {}

    public record Lesson(String lessonId, String tenantId, String organisationId,
                         String courseId, String moduleId, String parentId,
                         String title, String alias, String description, String image,
                         ContentStatus status, LessonFormat format, String mediaId,
                         OffsetDateTime startDatetime, OffsetDateTime endDatetime, String storage,
                         int noOfAttempts, AttemptsGradeMethod attemptsGrade, Integer idealTime, boolean resume,
                         Integer totalMarks, Integer passingMarks, boolean considerForPassing, boolean sampleLesson,
                         boolean allowResubmission, int ordering, Map<String, Object> params,
                         String createdBy, OffsetDateTime createdAt, String updatedBy, OffsetDateTime updatedAt) {}

    public record Media(String mediaId, String tenantId, String organisationId,
                        LessonFormat format, LessonSubFormat subFormat, String source, String path,
                        String storage, ContentStatus status, String createdBy, OffsetDateTime createdAt) {}

    public record Enrollment(String enrollmentId, String tenantId, String organisationId,
                             String courseId, String userId, EnrollmentStatus status,
                             OffsetDateTime enrolledOnTime, OffsetDateTime endTime,
                             boolean unlimitedPlan, boolean beforeExpiryMail, boolean afterExpiryMail,
                             Map<String, Object> params, String enrolledBy, OffsetDateTime enrolledAt,
                             String updatedBy, OffsetDateTime updatedAt) {}

    public record CourseTrack(String courseTrackId, String tenantId, String organisationId,
                              String courseId, String userId, TrackingStatus status,
                              OffsetDateTime startDatetime, OffsetDateTime endDatetime,
                              int noOfLessons, int completedLessons, int completionPercentage,
                              OffsetDateTime lastAccessedDate, OffsetDateTime certGenDate, boolean certificateIssued) {}

    public record ModuleTrack(String moduleTrackId, String tenantId, String organisationId,
                              String moduleId, String userId, TrackingStatus status,
                              int completedLessons, int totalLessons, int progress, OffsetDateTime updatedAt) {}

    public record LessonTrack(String lessonTrackId, String tenantId, String organisationId,
                              String lessonId, String courseId, String userId, int attempt, TrackingStatus status,
                              OffsetDateTime startDatetime, OffsetDateTime endDatetime,
                              int score, int totalContent, int currentPosition, int completionPercentage, int timeSpent,
                              Map<String, Object> params, String updatedBy, OffsetDateTime updatedAt) {}

    public enum ContentStatus implements Valued {
        UNPUBLISHED("unpublished"), PUBLISHED("published"), ARCHIVED("archived");

        private final String value;

        ContentStatus(String value) { this.value = value; }

        @JsonValue
        @Override
        public String value() { return value; }

        @JsonCreator
        public static ContentStatus fromValue(String value) { return Valued.parse(values(), value, "status"); }
    }

    public enum LessonFormat implements Valued {
        VIDEO("video"), DOCUMENT("document"), TEST("test"), EVENT("event");

        private final String value;

        LessonFormat(String value) { this.value = value; }

        @JsonValue
        @Override
        public String value() { return value; }

        @JsonCreator
        public static LessonFormat fromValue(String value) { return Valued.parse(values(), value, "format"); }
    }

    public enum LessonSubFormat implements Valued {
        YOUTUBE_URL("youtube.url"), PDF("pdf"), QUIZ("quiz"), EVENT("event"), VIDEO_URL("video.url");

        private final String value;

        LessonSubFormat(String value) { this.value = value; }

        @JsonValue
        @Override
        public String value() { return value; }

        @JsonCreator
        public static LessonSubFormat fromValue(String value) { return Valued.parse(values(), value, "subFormat"); }
    }

    public enum AttemptsGradeMethod implements Valued {
        FIRST_ATTEMPT("first_attempt"), LAST_ATTEMPT("last_attempt"), AVERAGE("average"), HIGHEST("highest");

        private final String value;

        AttemptsGradeMethod(String value) { this.value = value; }

        @JsonValue
        @Override
        public String value() { return value; }

        @JsonCreator
        public static AttemptsGradeMethod fromValue(String value) { return Valued.parse(values(), value, "attemptsGrade"); }
    }

    public enum EnrollmentStatus implements Valued {
        PUBLISHED("published"), UNPUBLISHED("unpublished"), CANCELLED("cancelled"), ARCHIVED("archived");

        private final String value;

        EnrollmentStatus(String value) { this.value = value; }

        @JsonValue
        @Override
        public String value() { return value; }

        @JsonCreator
        public static EnrollmentStatus fromValue(String value) { return Valued.parse(values(), value, "status"); }

        public boolean active() {
            return this == PUBLISHED || this == UNPUBLISHED;
        }
    }

    public enum TrackingStatus implements Valued {
        NOT_STARTED("not-started"), STARTED("started"), INCOMPLETE("incomplete"), COMPLETED("completed");

        private final String value;

        TrackingStatus(String value) { this.value = value; }

        @JsonValue
        @Override
        public String value() { return value; }

        @JsonCreator
        public static TrackingStatus fromValue(String value) { return Valued.parse(values(), value, "status"); }
    }

    public enum UploadEntityType implements Valued {
        COURSE("course"), MODULE("module"), LESSON("lesson"),
        LESSON_MEDIA("lessonMedia"), LESSON_ASSOCIATED_MEDIA("lessonAssociatedMedia");

        private final String value;

        UploadEntityType(String value) { this.value = value; }

        @JsonValue
        @Override
        public String value() { return value; }

        @JsonCreator
        public static UploadEntityType fromValue(String value) { return Valued.parse(values(), value, "type"); }
    }

    public enum StorageProvider implements Valued {
        LOCAL("local"), AWS("aws"), AZURE("azure"), GCP("gcp");

        private final String value;

        StorageProvider(String value) { this.value = value; }

        @JsonValue
        @Override
        public String value() { return value; }

        @JsonCreator
        public static StorageProvider fromValue(String value) { return Valued.parse(values(), value, "storageProvider"); }
    }

    /**
     * Enum carried on the wire and in the database by its lowercase value rather than its name.
     */
    public interface Valued {
        String value();

        static <E extends Enum<E> & Valued> E parse(E[] values, String value, String field) {
            if (value == null) return null;
            return Arrays.stream(values)
                    .filter(v -> v.value().equals(value))
                    .findFirst()
                    .orElseThrow(() -> new BadRequestException("Invalid " + field + ": " + value));
        }

        static String of(Valued v) {
            return v == null ? null : v.value();
        }
    }
}
