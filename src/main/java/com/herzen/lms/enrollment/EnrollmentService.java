package com.herzen.lms.enrollment;

import com.herzen.lms.common.*;
import com.herzen.lms.config.LmsProperties;
import com.herzen.lms.content.CourseService;
import com.herzen.lms.domain.DomainModels.*;
import com.herzen.lms.domain.DomainModels.Module;
import com.herzen.lms.enrollment.EnrollmentModels.*;
import com.herzen.lms.repository.EnrollmentJdbcRepository;
import com.herzen.lms.repository.LessonJdbcRepository;
import com.herzen.lms.repository.ModuleJdbcRepository;
import com.herzen.lms.repository.TrackingJdbcRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

@Slf4j
@Service
public class EnrollmentService {
    private final EnrollmentJdbcRepository enrollments;
    private final TrackingJdbcRepository tracking;
    private final ModuleJdbcRepository modules;
    private final LessonJdbcRepository lessons;
    private final CourseService courseService;
    private final LmsProperties properties;
    private final Clock clock;

    public EnrollmentService(EnrollmentJdbcRepository enrollments,
                             TrackingJdbcRepository tracking,
                             ModuleJdbcRepository modules,
                             LessonJdbcRepository lessons,
                             CourseService courseService,
                             LmsProperties properties,
                             Clock clock) {
        this.enrollments = enrollments;
        this.tracking = tracking;
        this.modules = modules;
        this.lessons = lessons;
        this.courseService = courseService;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional
    public Enrollment enroll(CreateEnrollmentRequest request, String actingUserId, TenantOrg tenant) {
        Course course = courseService.activeCourse(request.courseId(), tenant);
        if (enrollments.findByCourseAndUser(tenant, course.courseId(), request.userId()).isPresent()) {
            throw new ConflictException(ResponseMessages.ALREADY_ENROLLED);
        }

        EnrollmentStatus status = course.adminApproval()
                ? EnrollmentStatus.UNPUBLISHED
                : Patch.or(request.status(), EnrollmentStatus.PUBLISHED);
        OffsetDateTime now = OffsetDateTime.now(clock);
        Enrollment enrollment = new Enrollment(Ids.newId(), tenant.tenantId(), tenant.organisationId(),
                course.courseId(), request.userId(), status, now,
                Patch.or(course.endDatetime(), request.endTime()),
                Boolean.TRUE.equals(request.unlimitedPlan()),
                Boolean.TRUE.equals(request.beforeExpiryMail()),
                Boolean.TRUE.equals(request.afterExpiryMail()),
                request.params(), actingUserId, now, actingUserId, now);
        enrollments.insert(enrollment);

        tracking.insertCourseTrack(new CourseTrack(Ids.newId(), tenant.tenantId(), tenant.organisationId(),
                course.courseId(), request.userId(), TrackingStatus.STARTED, now, null,
                lessons.countCountableLessons(tenant, course.courseId()), 0, 0, now, null, false));

        List<Module> published = modules.findPublishedByCourse(tenant, course.courseId());
        for (Module module : published) {
            int total = lessons.findModuleCountableLessonIds(tenant, module.moduleId()).size();
            tracking.upsertModuleTrack(new ModuleTrack(Ids.newId(), tenant.tenantId(), tenant.organisationId(),
                    module.moduleId(), request.userId(), TrackingStatus.INCOMPLETE, 0, total, 0, now));
        }
        log.info("Enrolled user={} course={} status={} modules={} tenant={}",
                request.userId(), course.courseId(), status.value(), published.size(), tenant.tenantId());
        return enrollment;
    }

    public PageResult<Enrollment> findAll(EnrollmentFilter filter, Pagination pagination, TenantOrg tenant) {
        return PageResult.of(enrollments.search(tenant, filter, pagination), enrollments.count(tenant, filter), pagination);
    }

    public Enrollment findOne(String enrollmentId, TenantOrg tenant) {
        return enrollments.findById(tenant, enrollmentId)
                .orElseThrow(() -> new NotFoundException(ResponseMessages.ENROLLMENT_NOT_FOUND));
    }

    public Enrollment update(String enrollmentId, UpdateEnrollmentRequest request, String userId, TenantOrg tenant) {
        Enrollment current = findOne(enrollmentId, tenant);
        Enrollment updated = new Enrollment(current.enrollmentId(), current.tenantId(), current.organisationId(),
                current.courseId(), current.userId(),
                Patch.or(request.status(), current.status()),
                current.enrolledOnTime(),
                Patch.or(request.endTime(), current.endTime()),
                Patch.or(request.unlimitedPlan(), current.unlimitedPlan()),
                Patch.or(request.beforeExpiryMail(), current.beforeExpiryMail()),
                Patch.or(request.afterExpiryMail(), current.afterExpiryMail()),
                Patch.or(request.params(), current.params()),
                current.enrolledBy(), current.enrolledAt(), userId, OffsetDateTime.now(clock));
        enrollments.update(updated);
        log.info("Enrollment updated id={} status={} tenant={}", enrollmentId, updated.status().value(), tenant.tenantId());
        return updated;
    }

    public OperationResult cancel(String enrollmentId, String userId, TenantOrg tenant) {
        Enrollment current = findOne(enrollmentId, tenant);
        enrollments.update(new Enrollment(current.enrollmentId(), current.tenantId(), current.organisationId(),
                current.courseId(), current.userId(), EnrollmentStatus.CANCELLED, current.enrolledOnTime(),
                current.endTime(), current.unlimitedPlan(), current.beforeExpiryMail(), current.afterExpiryMail(),
                current.params(), current.enrolledBy(), current.enrolledAt(), userId, OffsetDateTime.now(clock)));
        log.info("Enrollment cancelled id={} tenant={}", enrollmentId, tenant.tenantId());
        return OperationResult.ok(ResponseMessages.ENROLLMENT_CANCELLED);
    }

    @Transactional
    public OperationResult hardDelete(String courseId, String userId, TenantOrg tenant) {
        Enrollment enrollment = enrollments.findByCourseAndUser(tenant, courseId, userId)
                .orElseThrow(() -> new NotFoundException(ResponseMessages.ENROLLMENT_NOT_FOUND));
        if (tracking.countAttemptsForCourse(tenant, courseId, userId) > 0) {
            throw new BadRequestException(ResponseMessages.ENROLLMENT_HAS_ATTEMPTS);
        }
        int moduleTracks = tracking.deleteModuleTracksForCourse(tenant, courseId, userId);
        tracking.deleteCourseTrack(tenant, courseId, userId);
        enrollments.delete(tenant, enrollment.enrollmentId());
        log.info("Enrollment hard-deleted course={} user={} moduleTracks={} tenant={}",
                courseId, userId, moduleTracks, tenant.tenantId());
        return OperationResult.ok(ResponseMessages.ENROLLMENT_DELETED);
    }

    public PageResult<EnrolledCourse> enrolledCourses(String userId, String cohortId, Integer offset, Integer limit, TenantOrg tenant) {
        int max = properties.getEnrollment().getMaxPageSize();
        int clampedLimit = Math.max(1, Math.min(limit == null ? Pagination.DEFAULT_LIMIT : limit, max));
        int skip = Math.max(0, offset == null ? 0 : offset);
        return new PageResult<>(enrollments.enrolledCourses(tenant, userId, cohortId, skip, clampedLimit),
                enrollments.countEnrolledCourses(tenant, userId, cohortId), skip, clampedLimit);
    }
}
