package com.herzen.lms.enrollment;

import com.herzen.lms.common.Ids;
import com.herzen.lms.domain.DomainModels.Course;
import com.herzen.lms.domain.DomainModels.EnrollmentStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

import java.time.OffsetDateTime;
import java.util.Map;

public class EnrollmentModels {
    public record CreateEnrollmentRequest(@NotBlank @Pattern(regexp = Ids.UUID_REGEX, message = Ids.UUID_MESSAGE) String courseId,
                                          @NotBlank @Pattern(regexp = Ids.UUID_REGEX, message = Ids.UUID_MESSAGE) String userId,
                                          EnrollmentStatus status,
                                          OffsetDateTime endTime,
                                          Boolean unlimitedPlan,
                                          Boolean beforeExpiryMail,
                                          Boolean afterExpiryMail,
                                          Map<String, Object> params) {}

    public record UpdateEnrollmentRequest(EnrollmentStatus status,
                                          OffsetDateTime endTime,
                                          Boolean unlimitedPlan,
                                          Boolean beforeExpiryMail,
                                          Boolean afterExpiryMail,
                                          Map<String, Object> params) {}

    public record EnrollmentFilter(String learnerId, String courseId, EnrollmentStatus status) {}

    public record EnrolledCourse(String enrollmentId, String userId, EnrollmentStatus enrollmentStatus,
                                 OffsetDateTime enrolledOnTime, Course course) {}
}
