package com.herzen.lms.report;

import com.herzen.lms.common.*;
import com.herzen.lms.content.CourseService;
import com.herzen.lms.domain.DomainModels.*;
import com.herzen.lms.report.ReportModels.*;
import com.herzen.lms.repository.CourseJdbcRepository;
import com.herzen.lms.repository.LessonJdbcRepository;
import com.herzen.lms.repository.ReportJdbcRepository;
import com.herzen.lms.repository.ReportJdbcRepository.CourseProgressRow;
import com.herzen.lms.repository.ReportJdbcRepository.LessonAttemptRow;
import com.herzen.lms.repository.TrackingJdbcRepository;
import com.herzen.lms.tracking.ProgressCalculator;
import com.herzen.lms.tracking.TrackingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.*;

@Slf4j
@Service
public class ReportService {
    private final ReportJdbcRepository reports;
    private final CourseJdbcRepository courses;
    private final LessonJdbcRepository lessons;
    private final TrackingJdbcRepository tracking;
    private final CourseService courseService;
    private final TrackingService trackingService;
    private final UserDirectoryClient userDirectory;
    private final Clock clock;

    public ReportService(ReportJdbcRepository reports,
                         CourseJdbcRepository courses,
                         LessonJdbcRepository lessons,
                         TrackingJdbcRepository tracking,
                         CourseService courseService,
                         TrackingService trackingService,
                         UserDirectoryClient userDirectory,
                         Clock clock) {
        this.reports = reports;
        this.courses = courses;
        this.lessons = lessons;
        this.tracking = tracking;
        this.courseService = courseService;
        this.trackingService = trackingService;
        this.userDirectory = userDirectory;
        this.clock = clock;
    }

    public PageResult<? extends ReportRow> courseReport(CourseReportRequest request, TenantOrg tenant, String authorization) {
        Course course = courseService.activeCourse(request.courseId(), tenant);
        if (request.cohortId() != null && !request.cohortId().equals(course.cohortId())) {
            throw new NotFoundException(ResponseMessages.COHORT_COURSE_NOT_FOUND);
        }
        if (request.lessonId() != null) {
            return lessonReport(course, request, tenant, authorization);
        }

        List<CourseProgressRow> rows = reports.courseProgress(tenant, request);
        long total = reports.countCourseProgress(tenant, request);
        Map<String, UserProfile> users = profiles(rows.stream().map(CourseProgressRow::userId).toList(), tenant, authorization);

        List<CourseReportRow> data = rows.stream().map(r -> {
            UserProfile user = users.get(r.userId());
            return new CourseReportRow(r.userId(), user == null ? null : user.name(), user == null ? null : user.email(),
                    course.cohortId(), course.courseId(), course.title(),
                    ProgressCalculator.percentage(r.completedLessons(), r.noOfLessons()), r.completedLessons(), r.noOfLessons(),
                    r.status(), r.enrollmentStatus(), r.enrolledOnTime(), r.lastAccessed(), r.certificateIssued(), r.certGenDate());
        }).toList();
        log.info("Course report course={} rows={} total={} tenant={}", course.courseId(), data.size(), total, tenant.tenantId());
        return new PageResult<>(data, total, request.offset(), request.limit());
    }

    private PageResult<LessonReportRow> lessonReport(Course course, CourseReportRequest request, TenantOrg tenant, String authorization) {
        Lesson lesson = lessons.findActive(tenant, request.lessonId())
                .filter(l -> course.courseId().equals(l.courseId()))
                .orElseThrow(() -> new NotFoundException(ResponseMessages.LESSON_NOT_FOUND));

        List<LessonAttemptRow> rows = reports.lessonProgress(tenant, request);
        long total = reports.countLessonProgress(tenant, request);
        Map<String, UserProfile> users = profiles(rows.stream().map(LessonAttemptRow::userId).toList(), tenant, authorization);

        List<LessonReportRow> data = rows.stream().map(r -> {
            UserProfile user = users.get(r.userId());
            return new LessonReportRow(r.userId(), user == null ? null : user.name(), user == null ? null : user.email(),
                    course.courseId(), course.title(), lesson.lessonId(), lesson.title(), lesson.format(),
                    r.completionPercentage(), r.score(), Math.round(r.timeSpent() / 60f), r.attempt(), r.status(), r.updatedAt());
        }).toList();
        log.info("Lesson report course={} lesson={} rows={} total={}", course.courseId(), lesson.lessonId(), data.size(), total);
        return new PageResult<>(data, total, request.offset(), request.limit());
    }

    private Map<String, UserProfile> profiles(List<String> userIds, TenantOrg tenant, String authorization) {
        if (userIds.isEmpty()) return Map.of();
        return userDirectory.fetch(new LinkedHashSet<>(userIds), tenant, authorization);
    }

    public LessonCompletionResponse lessonCompletionStatus(LessonCompletionRequest request, TenantOrg tenant) {
        List<String> courseIds = courses.findActiveByCohort(tenant, request.cohortId()).stream()
                .map(Course::courseId)
                .toList();
        if (courseIds.isEmpty()) {
            throw new NotFoundException(ResponseMessages.COHORT_COURSE_NOT_FOUND);
        }

        List<CriterionResult> results = new ArrayList<>();
        for (CompletionCriterion criterion : request.criteria()) {
            int total = lessons.countPublishedMatching(tenant, courseIds, criterion.lessonFormat(), criterion.lessonSubFormat());
            int completed = lessons.countCompletedMatching(tenant, courseIds, criterion.lessonFormat(),
                    criterion.lessonSubFormat(), request.userId());
            boolean met = completed >= criterion.completionRule();
            results.add(new CriterionResult(criterion, met, total, completed,
                    completed + " of " + criterion.completionRule() + " required lessons completed"));
        }
        boolean overall = results.stream().allMatch(CriterionResult::status);
        log.info("Lesson completion checked cohort={} user={} criteria={} overall={}",
                request.cohortId(), request.userId(), results.size(), overall);
        return new LessonCompletionResponse(overall, results);
    }

    @Transactional
    public TestProgressResponse updateTestProgress(TestProgressRequest request, TenantOrg tenant) {
        Lesson lesson = lessons.findByMediaSource(tenant, request.testId(), LessonFormat.TEST)
                .orElseThrow(() -> new NotFoundException(ResponseMessages.TEST_NOT_FOUND));
        if (lesson.courseId() == null) {
            throw new NotFoundException(ResponseMessages.LESSON_NOT_IN_COURSE);
        }
        String userId = request.userId();
        LessonTrack latest = tracking.findLatestAttempt(tenant, lesson.lessonId(), userId)
                .orElseThrow(() -> new NotFoundException(ResponseMessages.NO_ATTEMPTS_FOUND));
        if (latest.status() == TrackingStatus.COMPLETED && !lesson.allowResubmission()) {
            throw new BadRequestException(ResponseMessages.RESUBMISSION_NOT_ALLOWED);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        boolean passed = "pass".equals(request.result());
        Map<String, Object> review = new HashMap<>();
        review.put("result", request.result());
        review.put("reviewedAt", now.toString());
        if (request.reviewedBy() != null) {
            review.put("reviewedBy", request.reviewedBy());
        }
        String updatedBy = Patch.or(request.reviewedBy(), userId);
        LessonTrack graded = new LessonTrack(latest.lessonTrackId(), latest.tenantId(), latest.organisationId(),
                latest.lessonId(), latest.courseId(), latest.userId(), latest.attempt(),
                passed ? TrackingStatus.COMPLETED : TrackingStatus.INCOMPLETE,
                latest.startDatetime(), passed ? now : latest.endDatetime(),
                request.score(), latest.totalContent(), latest.currentPosition(),
                passed ? 100 : latest.completionPercentage(), latest.timeSpent(),
                ProgressCalculator.mergeParams(latest.params(), review), updatedBy, now);
        tracking.updateLessonTrack(graded);

        List<LessonTrack> gradedAttempts = tracking.findAttempts(tenant, lesson.lessonId(), userId).stream()
                .filter(t -> t.params() != null && t.params().containsKey("result"))
                .toList();
        int gradedScore = AttemptGrader.grade(gradedAttempts, lesson.attemptsGrade());
        trackingService.refreshCourseAndModule(lesson, userId, passed, tenant);

        log.info("Test progress updated test={} lesson={} user={} result={} gradedScore={}",
                request.testId(), lesson.lessonId(), userId, request.result(), gradedScore);
        return new TestProgressResponse(lesson.lessonId(), graded.lessonTrackId(), graded.attempt(), graded.status(),
                graded.score(), request.result(), gradedScore);
    }
}
