package com.herzen.lms.tracking;

import com.herzen.lms.TestData;
import com.herzen.lms.common.*;
import com.herzen.lms.content.ContentModels.CourseHierarchyWithTracking;
import com.herzen.lms.content.CourseService;
import com.herzen.lms.content.LessonService;
import com.herzen.lms.content.ModuleService;
import com.herzen.lms.domain.DomainModels.*;
import com.herzen.lms.domain.DomainModels.Module;
import com.herzen.lms.enrollment.EnrollmentService;
import com.herzen.lms.repository.TrackingJdbcRepository;
import com.herzen.lms.tracking.TrackingModels.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.OffsetDateTime;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class TrackingServiceTest {
    private static final String ADMIN = "6f1c2d3e-0000-4000-8000-0000000000bb";

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

    private TenantOrg tenant;
    private Course course;
    private Module module;
    private Lesson video;
    private Lesson reading;
    private String learner;

    @BeforeEach
    void setUp() {
        tenant = TestData.newTenant();
        course = courseService.create(TestData.course("Astronomy"), ADMIN, tenant);
        module = moduleService.create(TestData.module(course.courseId(), "Planets"), ADMIN, tenant);
        video = lessonService.create(TestData.lesson(course.courseId(), module.moduleId(), "Mars"), ADMIN, tenant).lesson();
        reading = lessonService.create(TestData.lesson(course.courseId(), module.moduleId(), "Venus"), ADMIN, tenant).lesson();
        learner = Ids.newId();
        enrollmentService.enroll(TestData.enrollment(course.courseId(), learner), ADMIN, tenant);
    }

    @Test
    void completingEveryLessonCompletesCourseAndModule() {
        LessonTrack first = trackingService.startLessonAttempt(video.lessonId(), learner, tenant);
        assertEquals(1, first.attempt());
        assertEquals(TrackingStatus.STARTED, first.status());

        LessonTrack done = trackingService.updateProgress(first.lessonTrackId(),
                new UpdateProgressRequest(20, 20, null, null, null, null, 300), learner, tenant);
        assertEquals(TrackingStatus.COMPLETED, done.status());

        CourseTrack halfway = trackingService.getCourseTracking(course.courseId(), learner, tenant);
        assertEquals(TrackingStatus.INCOMPLETE, halfway.status());
        assertEquals(1, halfway.completedLessons());
        assertEquals(50, halfway.completionPercentage());

        LessonTrack second = trackingService.startLessonAttempt(reading.lessonId(), learner, tenant);
        trackingService.updateProgress(second.lessonTrackId(),
                new UpdateProgressRequest(null, null, null, null, null, TrackingStatus.COMPLETED, null), learner, tenant);

        CourseTrack finished = trackingService.getCourseTracking(course.courseId(), learner, tenant);
        assertEquals(TrackingStatus.COMPLETED, finished.status());
        assertEquals(100, finished.completionPercentage());
        assertNotNull(finished.endDatetime());

        ModuleTrack moduleTrack = trackingRepository.findModuleTrack(tenant, module.moduleId(), learner).orElseThrow();
        assertEquals(TrackingStatus.COMPLETED, moduleTrack.status());
        assertEquals(100, moduleTrack.progress());

        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> trackingService.startLessonAttempt(video.lessonId(), learner, tenant));
        assertEquals(ResponseMessages.COURSE_COMPLETED, ex.getMessage());

        CourseHierarchyWithTracking hierarchy = courseService.hierarchyWithTracking(course.courseId(), learner, tenant);
        assertEquals(TrackingStatus.COMPLETED, hierarchy.tracking().status());
        assertNull(hierarchy.tracking().lastAccessedLesson());
    }

    @Test
    void resumesIncompleteAttemptInsteadOfCreatingNewOne() {
        LessonTrack first = trackingService.startLessonAttempt(video.lessonId(), learner, tenant);
        trackingService.updateProgress(first.lessonTrackId(),
                new UpdateProgressRequest(10, 3, null, null, null, null, null), learner, tenant);

        LessonTrack again = trackingService.startLessonAttempt(video.lessonId(), learner, tenant);
        assertEquals(first.lessonTrackId(), again.lessonTrackId());
        assertEquals(TrackingStatus.INCOMPLETE, again.status());
        assertEquals(30, again.completionPercentage());

        LessonStatus status = trackingService.getLessonStatus(video.lessonId(), learner, tenant);
        assertTrue(status.canResume());
        assertFalse(status.canReattempt());
        assertEquals(first.lessonTrackId(), status.lastAttemptId());
    }

    @Test
    void enforcesMaxAttempts() {
        Lesson quiz = lessonService.create(TestData.lesson(course.courseId(), module.moduleId(), "Quiz", LessonFormat.TEST,
                LessonSubFormat.QUIZ, "quiz-1", 1, false), ADMIN, tenant).lesson();
        LessonTrack attempt = trackingService.startLessonAttempt(quiz.lessonId(), learner, tenant);
        trackingService.updateProgress(attempt.lessonTrackId(),
                new UpdateProgressRequest(null, null, 80, 100, null, null, null), learner, tenant);

        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> trackingService.startLessonAttempt(quiz.lessonId(), learner, tenant));
        assertEquals(ResponseMessages.MAX_ATTEMPTS_REACHED, ex.getMessage());
        assertFalse(trackingService.getLessonStatus(quiz.lessonId(), learner, tenant).canReattempt());
    }

    @Test
    void unenrolledUserCannotStartAttempts() {
        String stranger = Ids.newId();
        NotFoundException ex = assertThrows(NotFoundException.class,
                () -> trackingService.startLessonAttempt(video.lessonId(), stranger, tenant));
        assertEquals(ResponseMessages.COURSE_TRACKING_NOT_FOUND, ex.getMessage());
        assertTrue(trackingRepository.findLatestAttempt(tenant, video.lessonId(), stranger).isEmpty());

        Lesson event = lessonService.create(TestData.lesson(course.courseId(), module.moduleId(), "Eclipse watch", LessonFormat.EVENT,
                LessonSubFormat.EVENT, "event-" + stranger, 0, false), ADMIN, tenant).lesson();
        assertThrows(NotFoundException.class, () -> trackingService.updateEventProgress("event-" + stranger,
                new EventProgressRequest(stranger, null, null, null), tenant));
        assertTrue(trackingRepository.findLatestAttempt(tenant, event.lessonId(), stranger).isEmpty());
    }

    @Test
    void startOverIsRefusedOnceAttemptsAreUsedUp() {
        Lesson quiz = lessonService.create(TestData.lesson(course.courseId(), module.moduleId(), "Single try", LessonFormat.TEST,
                LessonSubFormat.QUIZ, "quiz-single", 1, false), ADMIN, tenant).lesson();
        LessonTrack attempt = trackingService.startLessonAttempt(quiz.lessonId(), learner, tenant);
        trackingService.updateProgress(attempt.lessonTrackId(),
                new UpdateProgressRequest(10, 4, null, null, null, null, null), learner, tenant);

        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> trackingService.manageLessonAttempt(quiz.lessonId(), AttemptAction.START, learner, tenant));
        assertEquals(ResponseMessages.MAX_ATTEMPTS_REACHED, ex.getMessage());
        LessonTrack unchanged = trackingService.getAttempt(attempt.lessonTrackId(), learner, tenant);
        assertEquals(4, unchanged.currentPosition());
        assertEquals(TrackingStatus.INCOMPLETE, unchanged.status());
    }

    @Test
    void completedAttemptLeadsToNewAttemptNumber() {
        LessonTrack first = trackingService.startLessonAttempt(video.lessonId(), learner, tenant);
        trackingService.updateProgress(first.lessonTrackId(),
                new UpdateProgressRequest(null, null, null, 100, null, null, null), learner, tenant);

        LessonTrack second = trackingService.startLessonAttempt(video.lessonId(), learner, tenant);
        assertEquals(2, second.attempt());
        assertNotEquals(first.lessonTrackId(), second.lessonTrackId());
    }

    @Test
    void manageAttemptResumesOrResets() {
        NotFoundException none = assertThrows(NotFoundException.class,
                () -> trackingService.manageLessonAttempt(video.lessonId(), AttemptAction.RESUME, learner, tenant));
        assertEquals(ResponseMessages.NO_ATTEMPTS_FOUND, none.getMessage());

        LessonTrack first = trackingService.startLessonAttempt(video.lessonId(), learner, tenant);
        trackingService.updateProgress(first.lessonTrackId(),
                new UpdateProgressRequest(10, 6, null, null, null, null, 40), learner, tenant);

        LessonTrack resumed = trackingService.manageLessonAttempt(video.lessonId(), AttemptAction.RESUME, learner, tenant);
        assertEquals(60, resumed.completionPercentage());

        LessonTrack reset = trackingService.manageLessonAttempt(video.lessonId(), AttemptAction.START, learner, tenant);
        assertEquals(first.lessonTrackId(), reset.lessonTrackId());
        assertEquals(TrackingStatus.STARTED, reset.status());
        assertEquals(0, reset.completionPercentage());
        assertEquals(0, reset.currentPosition());

        trackingService.updateProgress(first.lessonTrackId(),
                new UpdateProgressRequest(null, null, null, null, null, TrackingStatus.COMPLETED, null), learner, tenant);
        BadRequestException done = assertThrows(BadRequestException.class,
                () -> trackingService.manageLessonAttempt(video.lessonId(), AttemptAction.RESUME, learner, tenant));
        assertEquals(ResponseMessages.ATTEMPT_ALREADY_COMPLETED, done.getMessage());
    }

    @Test
    void attemptsAreScopedToTheirUser() {
        LessonTrack attempt = trackingService.startLessonAttempt(video.lessonId(), learner, tenant);
        assertEquals(attempt.lessonTrackId(), trackingService.getAttempt(attempt.lessonTrackId(), learner, tenant).lessonTrackId());
        assertThrows(NotFoundException.class, () -> trackingService.getAttempt(attempt.lessonTrackId(), Ids.newId(), tenant));
    }

    @Test
    void updateCourseTrackingValidatesDatesAndRecomputesPercentage() {
        OffsetDateTime end = OffsetDateTime.now().plusDays(30);
        UpdateCourseTrackingRequest early = new UpdateCourseTrackingRequest(null, null, end, null, null, null,
                end.minusDays(1), null);
        ValidationFailedException ex = assertThrows(ValidationFailedException.class,
                () -> trackingService.updateCourseTracking(course.courseId(), learner, early, tenant));
        assertEquals(ResponseMessages.CERT_DATE_AFTER_END, ex.getMessage());

        UpdateCourseTrackingRequest valid = new UpdateCourseTrackingRequest(TrackingStatus.INCOMPLETE, null, end, 4, 1,
                null, end.plusDays(1), true);
        CourseTrack updated = trackingService.updateCourseTracking(course.courseId(), learner, valid, tenant);
        assertEquals(25, updated.completionPercentage());
        assertTrue(updated.certificateIssued());
        assertEquals(TrackingStatus.INCOMPLETE, updated.status());

        assertThrows(NotFoundException.class,
                () -> trackingService.getCourseTracking(course.courseId(), Ids.newId(), tenant));
    }

    @Test
    void eventAttendanceCompletesEventLesson() {
        Lesson event = lessonService.create(TestData.lesson(course.courseId(), module.moduleId(), "Star party", LessonFormat.EVENT,
                LessonSubFormat.EVENT, "event-42", 0, false), ADMIN, tenant).lesson();

        LessonTrack absent = trackingService.updateEventProgress("event-42",
                new EventProgressRequest(learner, TrackingStatus.INCOMPLETE, 10, null), tenant);
        assertEquals(TrackingStatus.INCOMPLETE, absent.status());

        LessonTrack attended = trackingService.updateEventProgress("event-42",
                new EventProgressRequest(learner, null, 90, Map.of("room", "B")), tenant);
        assertEquals(event.lessonId(), attended.lessonId());
        assertEquals(absent.lessonTrackId(), attended.lessonTrackId());
        assertEquals(TrackingStatus.COMPLETED, attended.status());
        assertEquals(90, attended.timeSpent());

        assertEquals(ResponseMessages.EVENT_NOT_FOUND, assertThrows(NotFoundException.class,
                () -> trackingService.updateEventProgress("nope", new EventProgressRequest(learner, null, null, null), tenant)).getMessage());
    }

    @Test
    void recalculationCatchesUpWithNewLessons() {
        LessonTrack a = trackingService.startLessonAttempt(video.lessonId(), learner, tenant);
        trackingService.updateProgress(a.lessonTrackId(), new UpdateProgressRequest(null, null, null, 100, null, null, null), learner, tenant);
        LessonTrack b = trackingService.startLessonAttempt(reading.lessonId(), learner, tenant);
        trackingService.updateProgress(b.lessonTrackId(), new UpdateProgressRequest(null, null, null, 100, null, null, null), learner, tenant);
        assertEquals(TrackingStatus.COMPLETED, trackingService.getCourseTracking(course.courseId(), learner, tenant).status());

        lessonService.create(TestData.lesson(course.courseId(), module.moduleId(), "Jupiter"), ADMIN, tenant);
        RecalculationResult result = trackingService.recalculateProgress(course.courseId(), tenant);

        assertTrue(result.success());
        assertEquals(1, result.courseTrackUpdated());
        assertEquals(1, result.moduleTrackUpdated());
        CourseTrack track = trackingService.getCourseTracking(course.courseId(), learner, tenant);
        assertEquals(3, track.noOfLessons());
        assertEquals(2, track.completedLessons());
        assertEquals(67, track.completionPercentage());
        assertEquals(TrackingStatus.INCOMPLETE, track.status());
    }
}
