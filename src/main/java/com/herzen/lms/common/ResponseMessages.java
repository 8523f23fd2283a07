package com.herzen.lms.common;

public final class ResponseMessages {
    public static final String TENANT_ID_REQUIRED = "tenantid header is required";
    public static final String ORGANISATION_ID_REQUIRED = "organisationid header is required";

    public static final String COURSE_NOT_FOUND = "Course not found";
    public static final String COURSE_DELETED = "Course archived successfully";
    public static final String MODULE_NOT_FOUND = "Module not found";
    public static final String MODULE_ALREADY_EXISTS = "Module with this title already exists";
    public static final String MODULE_COURSE_REQUIRED = "courseId is required to create a module";
    public static final String PARENT_MODULE_INVALID = "Parent module not found or belongs to a different course";
    public static final String MODULE_DELETED = "Module archived successfully";
    public static final String LESSON_NOT_FOUND = "Lesson not found";
    public static final String LESSON_DELETED = "Lesson archived successfully";
    public static final String LESSON_NOT_IN_COURSE = "Lesson is not associated with a course";
    public static final String ASSOCIATED_LESSON_NOT_FOUND = "Associated lesson not found";
    public static final String ASSOCIATED_LESSON_HAS_PARENT = "Associated lesson already belongs to another lesson";
    public static final String TEST_NOT_FOUND = "No lesson found for this test";
    public static final String EVENT_NOT_FOUND = "No lesson found for this event";

    public static final String ENROLLMENT_NOT_FOUND = "Enrollment not found";
    public static final String ALREADY_ENROLLED = "User is already enrolled in this course";
    public static final String ENROLLMENT_CANCELLED = "Enrollment cancelled successfully";
    public static final String ENROLLMENT_DELETED = "Enrollment and tracking data deleted successfully";
    public static final String ENROLLMENT_HAS_ATTEMPTS = "Cannot delete enrollment: user has lesson attempts in this course";

    public static final String COURSE_TRACKING_NOT_FOUND = "Course tracking not found";
    public static final String ATTEMPT_NOT_FOUND = "Lesson attempt not found";
    public static final String NO_ATTEMPTS_FOUND = "No attempts found for this lesson";
    public static final String COURSE_COMPLETED = "Course is already completed";
    public static final String MAX_ATTEMPTS_REACHED = "Maximum number of attempts reached";
    public static final String RESUME_NOT_ALLOWED = "Resume is not allowed for this lesson";
    public static final String ATTEMPT_ALREADY_COMPLETED = "The latest attempt is already completed";
    public static final String RESUBMISSION_NOT_ALLOWED = "Resubmission is not allowed for this test";
    public static final String PROGRESS_RECALCULATED = "Progress recalculated successfully";

    public static final String COHORT_COURSE_NOT_FOUND = "No course found for this cohort";
    public static final String MIDDLEWARE_URL_NOT_CONFIGURED = "MIDDLEWARE_URL_NOT_CONFIGURED";
    public static final String FAILED_TO_FETCH_USER_DATA = "FAILED_TO_FETCH_USER_DATA";

    public static final String CONFIG_NOT_FOUND = "CONFIG_NOT_FOUND";
    public static final String MAX_FILE_SIZE_NOT_FOUND = "MAX_FILE_SIZE_NOT_FOUND";
    public static final String ALLOWED_MIME_TYPES_NOT_FOUND = "ALLOWED_MIME_TYPES_NOT_FOUND";
    public static final String FILE_TOO_LARGE = "FILE_TOO_LARGE";
    public static final String INVALID_FILE_TYPE = "INVALID_FILE_TYPE";
    public static final String FILE_REQUIRED = "FILE_REQUIRED";
    public static final String FILE_UPLOAD_FAILED = "FILE_UPLOAD_FAILED";
    public static final String FILE_DELETION_NOT_IMPLEMENTED = "FILE_DELETION_NOT_IMPLEMENTED";
    public static final String INVALID_FILE_PATH = "INVALID_FILE_PATH";

    public static final String START_DATE_INVALID = "Start date is invalid or conflicts with end date";
    public static final String END_DATE_INVALID = "End date is invalid or must be greater than start date";
    public static final String CERT_DATE_AFTER_END = "Certificate generation date must be in the future and greater than course end date";
    public static final String CERT_DATE_IN_FUTURE = "Certificate generation date must be in the future";

    private ResponseMessages() {
    }
}
