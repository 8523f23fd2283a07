package com.herzen.lms.content;

import com.herzen.lms.common.*;
import com.herzen.lms.content.ContentModels.CreateLessonRequest;
import com.herzen.lms.content.ContentModels.LessonDetails;
import com.herzen.lms.content.ContentModels.LessonSearch;
import com.herzen.lms.content.ContentModels.UpdateLessonRequest;
import com.herzen.lms.domain.DomainModels.*;
import com.herzen.lms.domain.DomainModels.Module;
import com.herzen.lms.repository.LessonJdbcRepository;
import com.herzen.lms.validation.DateRules;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

@Slf4j
@Service
public class LessonService {
    private final LessonJdbcRepository lessons;
    private final CourseService courseService;
    private final ModuleService moduleService;
    private final AliasGenerator aliasGenerator;
    private final OrderingService orderingService;
    private final DateRules dateRules;
    private final Clock clock;

    public LessonService(LessonJdbcRepository lessons,
                         CourseService courseService,
                         ModuleService moduleService,
                         AliasGenerator aliasGenerator,
                         OrderingService orderingService,
                         DateRules dateRules,
                         Clock clock) {
        this.lessons = lessons;
        this.courseService = courseService;
        this.moduleService = moduleService;
        this.aliasGenerator = aliasGenerator;
        this.orderingService = orderingService;
        this.dateRules = dateRules;
        this.clock = clock;
    }

    @Transactional
    public LessonDetails create(CreateLessonRequest request, String userId, TenantOrg tenant) {
        ValidationFailedException.throwIfAny(dateRules.validateRange(request.startDatetime(), request.endDatetime()));
        courseService.activeCourse(request.courseId(), tenant);
        Module module = moduleService.findOne(request.moduleId(), tenant);
        if (!module.courseId().equals(request.courseId())) {
            throw new BadRequestException(ResponseMessages.MODULE_NOT_FOUND);
        }

        Lesson associated = null;
        if (request.associatedLesson() != null) {
            associated = lessons.findActive(tenant, request.associatedLesson())
                    .orElseThrow(() -> new NotFoundException(ResponseMessages.ASSOCIATED_LESSON_NOT_FOUND));
            if (associated.parentId() != null) {
                throw new BadRequestException(ResponseMessages.ASSOCIATED_LESSON_HAS_PARENT);
            }
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        Media media = new Media(Ids.newId(), tenant.tenantId(), tenant.organisationId(), request.format(),
                request.mediaContentSubFormat(), request.mediaContentSource(), request.mediaContentPath(),
                request.storage(), ContentStatus.PUBLISHED, userId, now);
        lessons.insertMedia(media);

        String aliasSource = request.alias() == null || request.alias().isBlank() ? request.title() : request.alias();
        String alias = aliasGenerator.uniqueAlias(aliasSource, a -> lessons.aliasExists(tenant, a, null));
        int ordering = request.ordering() != null
                ? request.ordering()
                : orderingService.nextLessonOrdering(tenant, request.moduleId());

        Lesson lesson = new Lesson(Ids.newId(), tenant.tenantId(), tenant.organisationId(),
                request.courseId(), request.moduleId(), null, request.title().trim(), alias,
                request.description(), request.image(), Patch.or(request.status(), ContentStatus.UNPUBLISHED),
                request.format(), media.mediaId(), request.startDatetime(), request.endDatetime(), request.storage(),
                Patch.or(request.noOfAttempts(), 0),
                Patch.or(request.attemptsGrade(), AttemptsGradeMethod.LAST_ATTEMPT),
                request.idealTime(), Patch.or(request.resume(), true), request.totalMarks(), request.passingMarks(),
                Patch.or(request.considerForPassing(), true), Patch.or(request.sampleLesson(), false),
                Patch.or(request.allowResubmission(), false), ordering, request.params(),
                userId, now, userId, now);
        lessons.insert(lesson);

        if (associated != null) {
            lessons.setParent(tenant, associated.lessonId(), lesson.lessonId());
        }
        log.info("Lesson created id={} format={} module={} tenant={}",
                lesson.lessonId(), lesson.format().value(), lesson.moduleId(), tenant.tenantId());
        return details(lesson, tenant);
    }

    public LessonDetails findOne(String lessonId, TenantOrg tenant) {
        return details(activeLesson(lessonId, tenant), tenant);
    }

    public List<Lesson> findByModule(String moduleId, TenantOrg tenant) {
        moduleService.findOne(moduleId, tenant);
        return lessons.findActiveByModule(tenant, moduleId);
    }

    public PageResult<Lesson> search(LessonSearch search, Pagination pagination, TenantOrg tenant) {
        return PageResult.of(lessons.search(tenant, search, pagination), lessons.count(tenant, search), pagination);
    }

    public LessonDetails findByTestId(String testId, TenantOrg tenant) {
        Lesson lesson = lessons.findByMediaSource(tenant, testId, LessonFormat.TEST)
                .orElseThrow(() -> new NotFoundException(ResponseMessages.TEST_NOT_FOUND));
        return details(lesson, tenant);
    }

    @Transactional
    public LessonDetails update(String lessonId, UpdateLessonRequest request, String userId, TenantOrg tenant) {
        Lesson current = activeLesson(lessonId, tenant);
        OffsetDateTime start = Patch.or(request.startDatetime(), current.startDatetime());
        OffsetDateTime end = Patch.or(request.endDatetime(), current.endDatetime());
        ValidationFailedException.throwIfAny(dateRules.validateRange(start, end));

        String title = request.title() == null ? current.title() : request.title().trim();
        String alias = current.alias();
        if (request.alias() != null && !request.alias().isBlank()) {
            if (!AliasGenerator.normalize(request.alias()).equals(current.alias())) {
                alias = aliasGenerator.uniqueAlias(request.alias(), a -> lessons.aliasExists(tenant, a, lessonId));
            }
        } else if (!title.equals(current.title())) {
            alias = aliasGenerator.uniqueAlias(title, a -> lessons.aliasExists(tenant, a, lessonId));
        }

        Lesson updated = new Lesson(current.lessonId(), current.tenantId(), current.organisationId(),
                current.courseId(), current.moduleId(), current.parentId(), title, alias,
                Patch.or(request.description(), current.description()),
                Patch.or(request.image(), current.image()),
                Patch.or(request.status(), current.status()),
                current.format(), current.mediaId(), start, end, current.storage(),
                Patch.or(request.noOfAttempts(), current.noOfAttempts()),
                Patch.or(request.attemptsGrade(), current.attemptsGrade()),
                Patch.or(request.idealTime(), current.idealTime()),
                Patch.or(request.resume(), current.resume()),
                Patch.or(request.totalMarks(), current.totalMarks()),
                Patch.or(request.passingMarks(), current.passingMarks()),
                Patch.or(request.considerForPassing(), current.considerForPassing()),
                Patch.or(request.sampleLesson(), current.sampleLesson()),
                Patch.or(request.allowResubmission(), current.allowResubmission()),
                Patch.or(request.ordering(), current.ordering()),
                Patch.or(request.params(), current.params()),
                current.createdBy(), current.createdAt(), userId, OffsetDateTime.now(clock));
        lessons.update(updated);
        if (current.mediaId() != null && (request.mediaContentSource() != null || request.mediaContentPath() != null)) {
            lessons.updateMediaLocation(tenant, current.mediaId(), request.mediaContentSource(), request.mediaContentPath());
        }
        log.info("Lesson updated id={} tenant={}", lessonId, tenant.tenantId());
        return details(updated, tenant);
    }

    public OperationResult remove(String lessonId, String userId, TenantOrg tenant) {
        activeLesson(lessonId, tenant);
        lessons.archive(tenant, lessonId, userId, OffsetDateTime.now(clock));
        log.info("Lesson archived id={} tenant={}", lessonId, tenant.tenantId());
        return OperationResult.ok(ResponseMessages.LESSON_DELETED);
    }

    public Lesson activeLesson(String lessonId, TenantOrg tenant) {
        return lessons.findActive(tenant, lessonId)
                .orElseThrow(() -> new NotFoundException(ResponseMessages.LESSON_NOT_FOUND));
    }

    private LessonDetails details(Lesson lesson, TenantOrg tenant) {
        return new LessonDetails(lesson, lessons.findMedia(tenant, lesson.mediaId()).orElse(null),
                lessons.findChildren(tenant, lesson.lessonId()));
    }
}
