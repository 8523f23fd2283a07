package com.herzen.lms.enrollment;

import com.herzen.lms.TestData;
import com.herzen.lms.common.*;
import com.herzen.lms.content.CourseService;
import com.herzen.lms.content.LessonService;
import com.herzen.lms.content.ModuleService;
import com.herzen.lms.domain.DomainModels.*;
import com.herzen.lms.domain.DomainModels.Module;
import com.herzen.lms.enrollment.EnrollmentModels.EnrolledCourse;
import com.herzen.lms.enrollment.EnrollmentModels.EnrollmentFilter;
import com.herzen.lms.enrollment.EnrollmentModels.UpdateEnrollmentRequest;
import com.herzen.lms.repository.TrackingJdbcRepository;
import com.herzen.lms.tracking.TrackingService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class EnrollmentServiceTest {
    private static final String ADMIN = "6f1c2d3e-0000-4000-8000-0000000000aa";

    @Autowired
    private CourseService courseService;

    @Autowired
    private ModuleService moduleService;

    @Autowired
    private LessonService lessonService;

    @Autowired
    private EnrollmentService enrollmentService;

    @Autowired
    private TrackingService trackingService;

    @Autowired
    private TrackingJdbcRepository trackingRepository;

    @Test
    void enrollCreatesCourseAndModuleTracking() {
        TenantOrg tenant = TestData.newTenant();
        Course course = courseService.create(TestData.course("Economics"), ADMIN, tenant);
        Module micro = moduleService.create(TestData.module(course.courseId(), "Micro"), ADMIN, tenant);
        Module macro = moduleService.create(TestData.module(course.courseId(), "Macro"), ADMIN, tenant);
        lessonService.create(TestData.lesson(course.courseId(), micro.moduleId(), "Supply"), ADMIN, tenant);
        lessonService.create(TestData.lesson(course.courseId(), micro.moduleId(), "Demand"), ADMIN, tenant);
        lessonService.create(TestData.lesson(course.courseId(), macro.moduleId(), "GDP"), ADMIN, tenant);
        lessonService.create(TestData.draftLesson(course.courseId(), micro.moduleId(), "Elasticity"), ADMIN, tenant);
        String learner = Ids.newId();

        Enrollment enrollment = enrollmentService.enroll(TestData.enrollment(course.courseId(), learner), ADMIN, tenant);

        assertEquals(EnrollmentStatus.PUBLISHED, enrollment.status());
        CourseTrack track = trackingService.getCourseTracking(course.courseId(), learner, tenant);
        assertEquals(TrackingStatus.STARTED, track.status());
        assertEquals(3, track.noOfLessons());
        assertEquals(0, track.completedLessons());

        var moduleTracks = trackingRepository.findModuleTracksForCourse(tenant, course.courseId(), learner);
        assertEquals(2, moduleTracks.size());
        assertTrue(moduleTracks.stream().allMatch(m -> m.status() == TrackingStatus.INCOMPLETE));
        assertTrue(moduleTracks.stream().anyMatch(m -> m.moduleId().equals(micro.moduleId()) && m.totalLessons() == 2));
    }

    @Test
    void duplicateEnrollmentIsConflict() {
        TenantOrg tenant = TestData.newTenant();
        Course course = courseService.create(TestData.course("Art"), ADMIN, tenant);
        String learner = Ids.newId();
        enrollmentService.enroll(TestData.enrollment(course.courseId(), learner), ADMIN, tenant);

        ConflictException ex = assertThrows(ConflictException.class,
                () -> enrollmentService.enroll(TestData.enrollment(course.courseId(), learner), ADMIN, tenant));
        assertEquals(ResponseMessages.ALREADY_ENROLLED, ex.getMessage());
    }

    @Test
    void adminApprovalCoursesStartUnpublished() {
        TenantOrg tenant = TestData.newTenant();
        Course course = courseService.create(TestData.course("Gated", null, true), ADMIN, tenant);
        Enrollment enrollment = enrollmentService.enroll(TestData.enrollment(course.courseId(), Ids.newId()), ADMIN, tenant);
        assertEquals(EnrollmentStatus.UNPUBLISHED, enrollment.status());
    }

    @Test
    void archivedCourseCannotBeJoined() {
        TenantOrg tenant = TestData.newTenant();
        Course course = courseService.create(TestData.course("Closed"), ADMIN, tenant);
        courseService.remove(course.courseId(), ADMIN, tenant);
        assertThrows(NotFoundException.class,
                () -> enrollmentService.enroll(TestData.enrollment(course.courseId(), Ids.newId()), ADMIN, tenant));
    }

    @Test
    void listsUpdatesAndCancels() {
        TenantOrg tenant = TestData.newTenant();
        Course course = courseService.create(TestData.course("Music"), ADMIN, tenant);
        String learner = Ids.newId();
        Enrollment enrollment = enrollmentService.enroll(TestData.enrollment(course.courseId(), learner), ADMIN, tenant);
        enrollmentService.enroll(TestData.enrollment(course.courseId(), Ids.newId()), ADMIN, tenant);

        PageResult<Enrollment> byLearner = enrollmentService.findAll(new EnrollmentFilter(learner, null, null),
                new Pagination(1, null, 10), tenant);
        assertEquals(1, byLearner.totalElements());

        Enrollment updated = enrollmentService.update(enrollment.enrollmentId(),
                new UpdateEnrollmentRequest(null, null, true, null, null, Map.of("source", "import")), ADMIN, tenant);
        assertTrue(updated.unlimitedPlan());
        assertEquals("import", updated.params().get("source"));
        assertEquals(EnrollmentStatus.PUBLISHED, updated.status());

        assertTrue(enrollmentService.cancel(enrollment.enrollmentId(), ADMIN, tenant).success());
        assertEquals(EnrollmentStatus.CANCELLED, enrollmentService.findOne(enrollment.enrollmentId(), tenant).status());
        assertEquals(1, enrollmentService.findAll(new EnrollmentFilter(null, course.courseId(), EnrollmentStatus.CANCELLED),
                new Pagination(1, null, 10), tenant).totalElements());
    }

    @Test
    void hardDeleteRemovesTrackingUnlessAttemptsExist() {
        TenantOrg tenant = TestData.newTenant();
        Course course = courseService.create(TestData.course("Geography"), ADMIN, tenant);
        Module module = moduleService.create(TestData.module(course.courseId(), "Maps"), ADMIN, tenant);
        Lesson lesson = lessonService.create(TestData.lesson(course.courseId(), module.moduleId(), "Scale"), ADMIN, tenant).lesson();
        String idle = Ids.newId();
        String active = Ids.newId();
        enrollmentService.enroll(TestData.enrollment(course.courseId(), idle), ADMIN, tenant);
        enrollmentService.enroll(TestData.enrollment(course.courseId(), active), ADMIN, tenant);
        trackingService.startLessonAttempt(lesson.lessonId(), active, tenant);

        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> enrollmentService.hardDelete(course.courseId(), active, tenant));
        assertEquals(ResponseMessages.ENROLLMENT_HAS_ATTEMPTS, ex.getMessage());

        assertTrue(enrollmentService.hardDelete(course.courseId(), idle, tenant).success());
        assertThrows(NotFoundException.class, () -> trackingService.getCourseTracking(course.courseId(), idle, tenant));
        assertTrue(trackingRepository.findModuleTracksForCourse(tenant, course.courseId(), idle).isEmpty());
        assertThrows(NotFoundException.class, () -> enrollmentService.hardDelete(course.courseId(), idle, tenant));
    }

    @Test
    void enrolledCoursesClampsLimitAndFiltersByCohort() {
        TenantOrg tenant = TestData.newTenant();
        String learner = Ids.newId();
        Course a = courseService.create(TestData.course("Cohort course", "cohort-x", false), ADMIN, tenant);
        Course b = courseService.create(TestData.course("Loose course"), ADMIN, tenant);
        enrollmentService.enroll(TestData.enrollment(a.courseId(), learner), ADMIN, tenant);
        enrollmentService.enroll(TestData.enrollment(b.courseId(), learner), ADMIN, tenant);

        PageResult<EnrolledCourse> all = enrollmentService.enrolledCourses(learner, null, null, 5000, tenant);
        assertEquals(100, all.limit());
        assertEquals(2, all.totalElements());

        PageResult<EnrolledCourse> cohort = enrollmentService.enrolledCourses(learner, "cohort-x", 0, 0, tenant);
        assertEquals(1, cohort.limit());
        assertEquals(1, cohort.data().size());
        assertEquals(a.courseId(), cohort.data().get(0).course().courseId());
    }
}
