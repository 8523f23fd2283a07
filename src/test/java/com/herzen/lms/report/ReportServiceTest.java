package com.herzen.lms.report;

import com.herzen.lms.TestData;
import com.herzen.lms.common.*;
import com.herzen.lms.content.CourseService;
import com.herzen.lms.content.LessonService;
import com.herzen.lms.content.ModuleService;
import com.herzen.lms.domain.DomainModels.*;
import com.herzen.lms.domain.DomainModels.Module;
import com.herzen.lms.enrollment.EnrollmentService;
import com.herzen.lms.report.ReportModels.*;
import com.herzen.lms.tracking.TrackingModels.UpdateProgressRequest;
import com.herzen.lms.tracking.TrackingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest
class ReportServiceTest {
    private static final String ADMIN = "6f1c2d3e-0000-4000-8000-0000000000cc";

    @MockBean
    private UserDirectoryClient userDirectory;

    @Autowired
    private ReportService reportService;

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

    private TenantOrg tenant;
    private String cohortId;
    private Course course;
    private Lesson video;
    private Lesson quiz;
    private String ada;
    private String alan;

    @BeforeEach
    void setUp() {
        tenant = TestData.newTenant();
        cohortId = Ids.newId();
        course = courseService.create(TestData.course("Computing", cohortId, false), ADMIN, tenant);
        Module module = moduleService.create(TestData.module(course.courseId(), "Machines"), ADMIN, tenant);
        video = lessonService.create(TestData.lesson(course.courseId(), module.moduleId(), "Engines"), ADMIN, tenant).lesson();
        quiz = lessonService.create(TestData.lesson(course.courseId(), module.moduleId(), "Checkpoint", LessonFormat.TEST,
                LessonSubFormat.QUIZ, "test-" + cohortId, 0, false), ADMIN, tenant).lesson();

        ada = Ids.newId();
        alan = Ids.newId();
        enrollmentService.enroll(TestData.enrollment(course.courseId(), ada), ADMIN, tenant);
        enrollmentService.enroll(TestData.enrollment(course.courseId(), alan), ADMIN, tenant);

        LessonTrack attempt = trackingService.startLessonAttempt(video.lessonId(), ada, tenant);
        trackingService.updateProgress(attempt.lessonTrackId(),
                new UpdateProgressRequest(null, null, null, 100, null, null, 150), ada, tenant);

        when(userDirectory.fetch(anyCollection(), any(), any()))
                .thenReturn(Map.of(ada, new UserProfile(ada, "Ada Lovelace", "ada@example.org")));
    }

    @Test
    void courseReportSortsByProgressAndFillsUserDetails() {
        PageResult<? extends ReportRow> page = reportService.courseReport(request(cohortId, null, 0, 10), tenant, "Bearer token");

        assertEquals(2, page.totalElements());
        CourseReportRow first = (CourseReportRow) page.data().get(0);
        CourseReportRow second = (CourseReportRow) page.data().get(1);
        assertEquals(ada, first.userId());
        assertEquals("Ada Lovelace", first.name());
        assertEquals(50, first.progress());
        assertEquals(TrackingStatus.INCOMPLETE, first.status());
        assertEquals(cohortId, first.cohortId());
        assertEquals(alan, second.userId());
        assertNull(second.name());
        assertNull(second.email());
        assertEquals(0, second.progress());
        verify(userDirectory).fetch(anyCollection(), eq(tenant), eq("Bearer token"));
    }

    @Test
    void courseReportPagesResults() {
        PageResult<? extends ReportRow> page = reportService.courseReport(request(null, null, 1, 1), tenant, null);
        assertEquals(2, page.totalElements());
        assertEquals(1, page.data().size());
        assertEquals(alan, page.data().get(0).userId());
    }

    @Test
    void lessonReportShowsLatestAttemptInMinutes() {
        PageResult<? extends ReportRow> page = reportService.courseReport(request(null, video.lessonId(), 0, 10), tenant, null);

        assertEquals(2, page.totalElements());
        LessonReportRow row = (LessonReportRow) page.data().get(0);
        assertEquals(ada, row.userId());
        assertEquals(100, row.progress());
        assertEquals(3, row.timeSpentMins());
        assertEquals(TrackingStatus.COMPLETED, row.status());
        assertEquals(LessonFormat.VIDEO, row.type());
        assertEquals(TrackingStatus.NOT_STARTED, ((LessonReportRow) page.data().get(1)).status());
    }

    @Test
    void reportRejectsForeignCohortAndLesson() {
        NotFoundException cohort = assertThrows(NotFoundException.class,
                () -> reportService.courseReport(request(Ids.newId(), null, 0, 10), tenant, null));
        assertEquals(ResponseMessages.COHORT_COURSE_NOT_FOUND, cohort.getMessage());

        NotFoundException lesson = assertThrows(NotFoundException.class,
                () -> reportService.courseReport(request(null, Ids.newId(), 0, 10), tenant, null));
        assertEquals(ResponseMessages.LESSON_NOT_FOUND, lesson.getMessage());
    }

    @Test
    void emptyReportSkipsUserDirectory() {
        Course empty = courseService.create(TestData.course("Empty"), ADMIN, tenant);
        PageResult<? extends ReportRow> page = reportService.courseReport(
                new CourseReportRequest(empty.courseId(), null, null, null, null, null, null, null, null, null), tenant, null);
        assertEquals(0, page.totalElements());
        assertTrue(page.data().isEmpty());
        verify(userDirectory, never()).fetch(anyCollection(), any(), any());
    }

    @Test
    void lessonCompletionEvaluatesEachCriterion() {
        LessonCompletionResponse response = reportService.lessonCompletionStatus(new LessonCompletionRequest(cohortId, ada, List.of(
                new CompletionCriterion(LessonFormat.VIDEO, null, 1),
                new CompletionCriterion(LessonFormat.TEST, LessonSubFormat.QUIZ, 1))), tenant);

        assertFalse(response.overallStatus());
        CriterionResult videos = response.criteriaResults().get(0);
        assertTrue(videos.status());
        assertEquals(1, videos.totalLessons());
        assertEquals("1 of 1 required lessons completed", videos.message());
        CriterionResult quizzes = response.criteriaResults().get(1);
        assertFalse(quizzes.status());
        assertEquals(0, quizzes.completedLessons());

        assertThrows(NotFoundException.class, () -> reportService.lessonCompletionStatus(
                new LessonCompletionRequest(Ids.newId(), ada, List.of(new CompletionCriterion(null, null, 0))), tenant));
    }

    @Test
    void passingTestCompletesAttemptAndBlocksResubmission() {
        trackingService.startLessonAttempt(quiz.lessonId(), ada, tenant);
        TestProgressResponse passed = reportService.updateTestProgress(
                new TestProgressRequest("test-" + cohortId, ada, 80, "pass", ADMIN), tenant);

        assertEquals(TrackingStatus.COMPLETED, passed.status());
        assertEquals(80, passed.score());
        assertEquals(80, passed.gradedScore());
        LessonTrack attempt = trackingService.getAttempt(passed.attemptId(), ada, tenant);
        assertEquals("pass", attempt.params().get("result"));
        assertEquals(ADMIN, attempt.params().get("reviewedBy"));
        assertEquals(100, trackingService.getCourseTracking(course.courseId(), ada, tenant).completionPercentage());

        BadRequestException again = assertThrows(BadRequestException.class, () -> reportService.updateTestProgress(
                new TestProgressRequest("test-" + cohortId, ada, 90, "pass", null), tenant));
        assertEquals(ResponseMessages.RESUBMISSION_NOT_ALLOWED, again.getMessage());
    }

    @Test
    void failingTestLeavesAttemptIncomplete() {
        trackingService.startLessonAttempt(quiz.lessonId(), alan, tenant);
        TestProgressResponse failed = reportService.updateTestProgress(
                new TestProgressRequest("test-" + cohortId, alan, 20, "fail", null), tenant);

        assertEquals(TrackingStatus.INCOMPLETE, failed.status());
        assertEquals(20, failed.gradedScore());
        assertEquals("fail", failed.result());
    }

    @Test
    void testProgressNeedsKnownTestAndAttempt() {
        assertEquals(ResponseMessages.TEST_NOT_FOUND, assertThrows(NotFoundException.class, () -> reportService.updateTestProgress(
                new TestProgressRequest("missing", ada, 10, "pass", null), tenant)).getMessage());
        assertEquals(ResponseMessages.NO_ATTEMPTS_FOUND, assertThrows(NotFoundException.class, () -> reportService.updateTestProgress(
                new TestProgressRequest("test-" + cohortId, alan, 10, "pass", null), tenant)).getMessage());
    }

    private CourseReportRequest request(String cohort, String lessonId, int offset, int limit) {
        return new CourseReportRequest(course.courseId(), cohort, lessonId, offset, limit, null, null, null, null, null);
    }
}
