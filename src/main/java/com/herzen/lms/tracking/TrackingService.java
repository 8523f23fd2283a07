package com.herzen.lms.tracking;

import com.herzen.lms.common.*;
import com.herzen.lms.content.CourseService;
import com.herzen.lms.domain.DomainModels.*;
import com.herzen.lms.domain.DomainModels.Module;
import com.herzen.lms.repository.LessonJdbcRepository;
import com.herzen.lms.repository.ModuleJdbcRepository;
import com.herzen.lms.repository.TrackingJdbcRepository;
import com.herzen.lms.tracking.TrackingModels.*;
import com.herzen.lms.validation.DateRules;
import com.herzen.lms.validation.FieldViolation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class TrackingService {
    private final TrackingJdbcRepository tracking;
    private final LessonJdbcRepository lessons;
    private final ModuleJdbcRepository modules;
    private final CourseService courseService;
    private final DateRules dateRules;
    private final Clock clock;

    public TrackingService(TrackingJdbcRepository tracking,
                           LessonJdbcRepository lessons,
                           ModuleJdbcRepository modules,
                           CourseService courseService,
                           DateRules dateRules,
                           Clock clock) {
        this.tracking = tracking;
        this.lessons = lessons;
        this.modules = modules;
        this.courseService = courseService;
        this.dateRules = dateRules;
        this.clock = clock;
    }

    public CourseTrack getCourseTracking(String courseId, String userId, TenantOrg tenant) {
        return tracking.findCourseTrack(tenant, courseId, userId)
                .orElseThrow(() -> new NotFoundException(ResponseMessages.COURSE_TRACKING_NOT_FOUND));
    }

    public CourseTrack updateCourseTracking(String courseId, String userId, UpdateCourseTrackingRequest request, TenantOrg tenant) {
        CourseTrack current = getCourseTracking(courseId, userId, tenant);
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime start = Patch.or(request.startDatetime(), current.startDatetime());
        OffsetDateTime end = Patch.or(request.endDatetime(), current.endDatetime());

        List<FieldViolation> violations = new ArrayList<>(dateRules.validateRange(start, end));
        violations.addAll(dateRules.validateCertificateDate(request.certGenDate(), end, now));
        ValidationFailedException.throwIfAny(violations);

        int noOfLessons = Patch.or(request.noOfLessons(), current.noOfLessons());
        int completedLessons = Patch.or(request.completedLessons(), current.completedLessons());
        CourseTrack updated = new CourseTrack(current.courseTrackId(), current.tenantId(), current.organisationId(),
                current.courseId(), current.userId(),
                Patch.or(request.status(), current.status()),
                start, end, noOfLessons, completedLessons,
                ProgressCalculator.percentage(completedLessons, noOfLessons),
                Patch.or(request.lastAccessedDate(), current.lastAccessedDate()),
                Patch.or(request.certGenDate(), current.certGenDate()),
                Patch.or(request.certificateIssued(), current.certificateIssued()));
        tracking.updateCourseTrack(updated);
        log.info("Course tracking updated course={} user={} status={}", courseId, userId, updated.status().value());
        return updated;
    }

    @Transactional
    public LessonTrack startLessonAttempt(String lessonId, String userId, TenantOrg tenant) {
        Lesson lesson = trackableLesson(lessonId, tenant);
        if (getCourseTracking(lesson.courseId(), userId, tenant).status() == TrackingStatus.COMPLETED) {
            throw new BadRequestException(ResponseMessages.COURSE_COMPLETED);
        }

        List<LessonTrack> attempts = tracking.findAttempts(tenant, lessonId, userId);
        LessonTrack latest = attempts.isEmpty() ? null : attempts.get(attempts.size() - 1);
        if (latest != null && latest.status() != TrackingStatus.COMPLETED && lesson.resume()) {
            return latest;
        }
        if (lesson.noOfAttempts() > 0 && attempts.size() >= lesson.noOfAttempts()) {
            throw new BadRequestException(ResponseMessages.MAX_ATTEMPTS_REACHED);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        LessonTrack attempt = new LessonTrack(Ids.newId(), tenant.tenantId(), tenant.organisationId(),
                lessonId, lesson.courseId(), userId, latest == null ? 1 : latest.attempt() + 1, TrackingStatus.STARTED,
                now, null, 0, 0, 0, 0, 0, null, userId, now);
        tracking.insertLessonTrack(attempt);
        refreshCourseAndModule(lesson, userId, false, tenant);
        log.info("Lesson attempt started lesson={} user={} attempt={}", lessonId, userId, attempt.attempt());
        return attempt;
    }

    @Transactional
    public LessonTrack manageLessonAttempt(String lessonId, AttemptAction action, String userId, TenantOrg tenant) {
        Lesson lesson = trackableLesson(lessonId, tenant);
        LessonTrack latest = tracking.findLatestAttempt(tenant, lessonId, userId)
                .orElseThrow(() -> new NotFoundException(ResponseMessages.NO_ATTEMPTS_FOUND));
        if (latest.status() == TrackingStatus.COMPLETED) {
            throw new BadRequestException(ResponseMessages.ATTEMPT_ALREADY_COMPLETED);
        }
        if (action == AttemptAction.RESUME) {
            if (!lesson.resume()) {
                throw new BadRequestException(ResponseMessages.RESUME_NOT_ALLOWED);
            }
            return latest;
        }
        if (lesson.noOfAttempts() > 0 && latest.attempt() >= lesson.noOfAttempts()) {
            throw new BadRequestException(ResponseMessages.MAX_ATTEMPTS_REACHED);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        LessonTrack reset = new LessonTrack(latest.lessonTrackId(), latest.tenantId(), latest.organisationId(),
                latest.lessonId(), latest.courseId(), latest.userId(), latest.attempt(), TrackingStatus.STARTED,
                now, null, 0, latest.totalContent(), 0, 0, 0, latest.params(), userId, now);
        tracking.updateLessonTrack(reset);
        refreshCourseAndModule(lesson, userId, false, tenant);
        log.info("Lesson attempt restarted lesson={} user={} attempt={}", lessonId, userId, reset.attempt());
        return reset;
    }

    public LessonStatus getLessonStatus(String lessonId, String userId, TenantOrg tenant) {
        Lesson lesson = trackableLesson(lessonId, tenant);
        Optional<LessonTrack> latest = tracking.findLatestAttempt(tenant, lessonId, userId);
        if (latest.isEmpty()) {
            return new LessonStatus(lessonId, false, true, TrackingStatus.NOT_STARTED, null, 0, lesson.noOfAttempts());
        }
        LessonTrack last = latest.get();
        boolean canResume = lesson.resume()
                && (last.status() == TrackingStatus.STARTED || last.status() == TrackingStatus.INCOMPLETE);
        boolean canReattempt = last.status() == TrackingStatus.COMPLETED
                && (lesson.noOfAttempts() == 0 || last.attempt() < lesson.noOfAttempts());
        return new LessonStatus(lessonId, canResume, canReattempt, last.status(), last.lessonTrackId(),
                last.attempt(), lesson.noOfAttempts());
    }

    public LessonTrack getAttempt(String attemptId, String userId, TenantOrg tenant) {
        return tracking.findAttempt(tenant, attemptId, userId)
                .orElseThrow(() -> new NotFoundException(ResponseMessages.ATTEMPT_NOT_FOUND));
    }

    @Transactional
    public LessonTrack updateProgress(String attemptId, UpdateProgressRequest request, String userId, TenantOrg tenant) {
        LessonTrack current = getAttempt(attemptId, userId, tenant);
        Lesson lesson = lessons.findById(tenant, current.lessonId())
                .orElseThrow(() -> new NotFoundException(ResponseMessages.LESSON_NOT_FOUND));

        LessonTrack updated = ProgressCalculator.applyProgress(current, request, userId, OffsetDateTime.now(clock));
        tracking.updateLessonTrack(updated);
        refreshCourseAndModule(lesson, userId, updated.status() == TrackingStatus.COMPLETED, tenant);
        log.info("Lesson progress updated attempt={} status={} percentage={}",
                attemptId, updated.status().value(), updated.completionPercentage());
        return updated;
    }

    @Transactional
    public LessonTrack updateEventProgress(String eventId, EventProgressRequest request, TenantOrg tenant) {
        Lesson lesson = lessons.findByMediaSource(tenant, eventId, LessonFormat.EVENT)
                .orElseThrow(() -> new NotFoundException(ResponseMessages.EVENT_NOT_FOUND));
        if (lesson.courseId() == null) {
            throw new NotFoundException(ResponseMessages.LESSON_NOT_IN_COURSE);
        }
        String userId = request.userId();
        getCourseTracking(lesson.courseId(), userId, tenant);
        OffsetDateTime now = OffsetDateTime.now(clock);
        boolean attended = request.status() == null || request.status() == TrackingStatus.COMPLETED;

        Optional<LessonTrack> latest = tracking.findLatestAttempt(tenant, lesson.lessonId(), userId);
        LessonTrack base = latest.orElseGet(() -> new LessonTrack(Ids.newId(), tenant.tenantId(), tenant.organisationId(),
                lesson.lessonId(), lesson.courseId(), userId, 1, TrackingStatus.STARTED, now, null,
                0, 0, 0, 0, 0, null, userId, now));
        LessonTrack updated = new LessonTrack(base.lessonTrackId(), base.tenantId(), base.organisationId(),
                base.lessonId(), base.courseId(), base.userId(), base.attempt(),
                attended ? TrackingStatus.COMPLETED : TrackingStatus.INCOMPLETE,
                base.startDatetime(), attended ? now : base.endDatetime(),
                base.score(), base.totalContent(), base.currentPosition(), attended ? 100 : base.completionPercentage(),
                Patch.or(request.timeSpent(), base.timeSpent()),
                ProgressCalculator.mergeParams(base.params(), request.params()), userId, now);
        if (latest.isPresent()) {
            tracking.updateLessonTrack(updated);
        } else {
            tracking.insertLessonTrack(updated);
        }
        refreshCourseAndModule(lesson, userId, attended, tenant);
        log.info("Event progress recorded event={} lesson={} user={} status={}",
                eventId, lesson.lessonId(), userId, updated.status().value());
        return updated;
    }

    @Transactional
    public RecalculationResult recalculateProgress(String courseId, TenantOrg tenant) {
        courseService.activeCourse(courseId, tenant);
        int countable = lessons.countCountableLessons(tenant, courseId);
        OffsetDateTime now = OffsetDateTime.now(clock);

        int courseTracksUpdated = 0;
        int moduleTracksUpdated = 0;
        List<Module> courseModules = modules.findActiveByCourse(tenant, courseId);
        for (CourseTrack track : tracking.findCourseTracks(tenant, courseId)) {
            int completed = tracking.countCompletedCountableLessons(tenant, courseId, track.userId());
            TrackingStatus status = ProgressCalculator.aggregateStatus(completed, countable);
            if (status != TrackingStatus.COMPLETED && completed == 0 && track.status() == TrackingStatus.STARTED) {
                status = TrackingStatus.STARTED;
            }
            OffsetDateTime end = status == TrackingStatus.COMPLETED ? Patch.or(track.endDatetime(), now) : null;
            tracking.updateCourseTrack(new CourseTrack(track.courseTrackId(), track.tenantId(), track.organisationId(),
                    track.courseId(), track.userId(), status, track.startDatetime(), end, countable, completed,
                    ProgressCalculator.percentage(completed, countable), track.lastAccessedDate(), track.certGenDate(),
                    track.certificateIssued()));
            courseTracksUpdated++;

            for (Module module : courseModules) {
                refreshModule(module.moduleId(), track.userId(), now, tenant);
                moduleTracksUpdated++;
            }
        }
        log.info("Progress recalculated course={} courseTracks={} moduleTracks={}", courseId, courseTracksUpdated, moduleTracksUpdated);
        return new RecalculationResult(true, ResponseMessages.PROGRESS_RECALCULATED, courseTracksUpdated, moduleTracksUpdated);
    }

    /**
     * Refreshes the user's course and module aggregates after a lesson attempt changed.
     */
    public void refreshCourseAndModule(Lesson lesson, String userId, boolean lessonCompleted, TenantOrg tenant) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        CourseTrack track = getCourseTracking(lesson.courseId(), userId, tenant);
        CourseTrack updated;
        if (lessonCompleted || track.status() == TrackingStatus.STARTED) {
            int completed = tracking.countCompletedCountableLessons(tenant, lesson.courseId(), userId);
            int noOfLessons = track.noOfLessons() > 0 ? track.noOfLessons() : lessons.countCountableLessons(tenant, lesson.courseId());
            TrackingStatus status = ProgressCalculator.aggregateStatus(completed, noOfLessons);
            updated = new CourseTrack(track.courseTrackId(), track.tenantId(), track.organisationId(),
                    track.courseId(), track.userId(), status, track.startDatetime(),
                    status == TrackingStatus.COMPLETED ? Patch.or(track.endDatetime(), now) : track.endDatetime(),
                    noOfLessons, completed, ProgressCalculator.percentage(completed, noOfLessons),
                    now, track.certGenDate(), track.certificateIssued());
        } else {
            updated = new CourseTrack(track.courseTrackId(), track.tenantId(), track.organisationId(),
                    track.courseId(), track.userId(), track.status(), track.startDatetime(), track.endDatetime(),
                    track.noOfLessons(), track.completedLessons(), track.completionPercentage(),
                    now, track.certGenDate(), track.certificateIssued());
        }
        tracking.updateCourseTrack(updated);
        if (lesson.moduleId() != null) {
            refreshModule(lesson.moduleId(), userId, now, tenant);
        }
    }

    private void refreshModule(String moduleId, String userId, OffsetDateTime now, TenantOrg tenant) {
        List<String> lessonIds = lessons.findModuleCountableLessonIds(tenant, moduleId);
        int completed = tracking.countCompletedAmong(tenant, lessonIds, userId);
        int total = lessonIds.size();
        String trackId = tracking.findModuleTrack(tenant, moduleId, userId)
                .map(ModuleTrack::moduleTrackId)
                .orElseGet(Ids::newId);
        tracking.upsertModuleTrack(new ModuleTrack(trackId, tenant.tenantId(), tenant.organisationId(), moduleId, userId,
                ProgressCalculator.aggregateStatus(completed, total), completed, total,
                ProgressCalculator.percentage(completed, total), now));
    }

    private Lesson trackableLesson(String lessonId, TenantOrg tenant) {
        Lesson lesson = lessons.findActive(tenant, lessonId)
                .orElseThrow(() -> new NotFoundException(ResponseMessages.LESSON_NOT_FOUND));
        if (lesson.courseId() == null) {
            throw new NotFoundException(ResponseMessages.LESSON_NOT_IN_COURSE);
        }
        return lesson;
    }
}
