package com.herzen.lms.content;

import com.herzen.lms.common.*;
import com.herzen.lms.content.ContentModels.*;
import com.herzen.lms.domain.DomainModels.*;
import com.herzen.lms.domain.DomainModels.Module;
import com.herzen.lms.repository.CourseJdbcRepository;
import com.herzen.lms.repository.LessonJdbcRepository;
import com.herzen.lms.repository.ModuleJdbcRepository;
import com.herzen.lms.repository.TrackingJdbcRepository;
import com.herzen.lms.validation.DateRules;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
public class CourseService {
    private final CourseJdbcRepository courses;
    private final ModuleJdbcRepository modules;
    private final LessonJdbcRepository lessons;
    private final TrackingJdbcRepository tracking;
    private final AliasGenerator aliasGenerator;
    private final OrderingService orderingService;
    private final DateRules dateRules;
    private final Clock clock;

    public CourseService(CourseJdbcRepository courses,
                         ModuleJdbcRepository modules,
                         LessonJdbcRepository lessons,
                         TrackingJdbcRepository tracking,
                         AliasGenerator aliasGenerator,
                         OrderingService orderingService,
                         DateRules dateRules,
                         Clock clock) {
        this.courses = courses;
        this.modules = modules;
        this.lessons = lessons;
        this.tracking = tracking;
        this.aliasGenerator = aliasGenerator;
        this.orderingService = orderingService;
        this.dateRules = dateRules;
        this.clock = clock;
    }

    public Course create(CreateCourseRequest request, String userId, TenantOrg tenant) {
        ValidationFailedException.throwIfAny(dateRules.validateRange(request.startDatetime(), request.endDatetime()));

        String aliasSource = request.alias() == null || request.alias().isBlank() ? request.title() : request.alias();
        String alias = aliasGenerator.uniqueAlias(aliasSource, a -> courses.aliasExists(tenant, a, null));
        OffsetDateTime now = OffsetDateTime.now(clock);

        Course course = new Course(Ids.newId(), tenant.tenantId(), tenant.organisationId(),
                request.title().trim(), alias, request.shortDescription(), request.description(), request.image(),
                Boolean.TRUE.equals(request.featured()), Boolean.TRUE.equals(request.free()),
                Patch.or(request.status(), ContentStatus.UNPUBLISHED),
                Boolean.TRUE.equals(request.adminApproval()), Boolean.TRUE.equals(request.autoEnroll()),
                request.startDatetime(), request.endDatetime(), request.certificateTerm(), request.certificateId(),
                request.params(), cohortOf(request.params()), orderingService.nextCourseOrdering(tenant),
                userId, now, userId, now);
        courses.insert(course);
        log.info("Course created id={} alias={} tenant={}", course.courseId(), alias, tenant.tenantId());
        return course;
    }

    public PageResult<Course> search(CourseSearch search, Pagination pagination, TenantOrg tenant) {
        CourseSearch filters = search == null ? CourseSearch.empty() : search;
        return PageResult.of(courses.search(tenant, filters, pagination), courses.count(tenant, filters), pagination);
    }

    public Course findOne(String courseId, TenantOrg tenant) {
        return courses.findById(tenant, courseId)
                .orElseThrow(() -> new NotFoundException(ResponseMessages.COURSE_NOT_FOUND));
    }

    public CourseHierarchy hierarchy(String courseId, TenantOrg tenant) {
        Course course = activeCourse(courseId, tenant);
        List<Module> courseModules = modules.findActiveByCourse(tenant, courseId);
        Map<String, List<Lesson>> lessonsByModule = topLevelLessonsByModule(tenant, courseId);
        return new CourseHierarchy(course, moduleTree(courseModules, null, lessonsByModule));
    }

    public CourseHierarchyWithTracking hierarchyWithTracking(String courseId, String userId, TenantOrg tenant) {
        CourseHierarchy hierarchy = hierarchy(courseId, tenant);
        int totalLessons = hierarchy.modules().stream().mapToInt(CourseService::countLessons).sum();

        Optional<CourseTrack> courseTrack = tracking.findCourseTrack(tenant, courseId, userId);
        if (courseTrack.isEmpty()) {
            return new CourseHierarchyWithTracking(hierarchy.course(),
                    new TrackingSummary(TrackingStatus.NOT_STARTED, 0, 0, totalLessons, null),
                    hierarchy.modules().stream().map(m -> tracked(m, Map.of(), Map.of())).toList());
        }

        List<LessonTrack> latest = tracking.findLatestAttemptsForCourse(tenant, courseId, userId);
        Map<String, LessonTrack> latestByLesson = latest.stream()
                .collect(Collectors.toMap(LessonTrack::lessonId, Function.identity(), (a, b) -> a));
        Map<String, ModuleTrack> moduleTracks = tracking.findModuleTracksForCourse(tenant, courseId, userId).stream()
                .collect(Collectors.toMap(ModuleTrack::moduleId, Function.identity(), (a, b) -> a));

        CourseTrack track = courseTrack.get();
        LastAccessedLesson lastAccessed = null;
        if (track.status() != TrackingStatus.COMPLETED) {
            lastAccessed = latest.stream()
                    .max(Comparator.comparing(LessonTrack::updatedAt))
                    .map(t -> new LastAccessedLesson(t.lessonId(), t.lessonTrackId(), t.updatedAt()))
                    .orElse(null);
        }
        int lessonsToComplete = track.noOfLessons() > 0 ? track.noOfLessons() : totalLessons;
        TrackingSummary summary = new TrackingSummary(track.status(),
                track.completionPercentage(), track.completedLessons(), lessonsToComplete, lastAccessed);
        return new CourseHierarchyWithTracking(hierarchy.course(), summary,
                hierarchy.modules().stream().map(m -> tracked(m, latestByLesson, moduleTracks)).toList());
    }

    public Course update(String courseId, UpdateCourseRequest request, String userId, TenantOrg tenant) {
        Course current = activeCourse(courseId, tenant);
        OffsetDateTime start = Patch.or(request.startDatetime(), current.startDatetime());
        OffsetDateTime end = Patch.or(request.endDatetime(), current.endDatetime());
        ValidationFailedException.throwIfAny(dateRules.validateRange(start, end));

        String title = request.title() == null ? current.title() : request.title().trim();
        String alias = current.alias();
        if (request.alias() != null && !request.alias().isBlank()) {
            if (!AliasGenerator.normalize(request.alias()).equals(current.alias())) {
                alias = aliasGenerator.uniqueAlias(request.alias(), a -> courses.aliasExists(tenant, a, courseId));
            }
        } else if (!title.equals(current.title())) {
            alias = aliasGenerator.uniqueAlias(title, a -> courses.aliasExists(tenant, a, courseId));
        }

        Map<String, Object> params = Patch.or(request.params(), current.params());
        Course updated = new Course(current.courseId(), current.tenantId(), current.organisationId(),
                title, alias,
                Patch.or(request.shortDescription(), current.shortDescription()),
                Patch.or(request.description(), current.description()),
                Patch.or(request.image(), current.image()),
                Patch.or(request.featured(), current.featured()),
                Patch.or(request.free(), current.free()),
                Patch.or(request.status(), current.status()),
                Patch.or(request.adminApproval(), current.adminApproval()),
                Patch.or(request.autoEnroll(), current.autoEnroll()),
                start, end,
                Patch.or(request.certificateTerm(), current.certificateTerm()),
                Patch.or(request.certificateId(), current.certificateId()),
                params, request.params() == null ? current.cohortId() : cohortOf(params),
                Patch.or(request.ordering(), current.ordering()),
                current.createdBy(), current.createdAt(), userId, OffsetDateTime.now(clock));
        courses.update(updated);
        log.info("Course updated id={} tenant={}", courseId, tenant.tenantId());
        return updated;
    }

    public OperationResult remove(String courseId, String userId, TenantOrg tenant) {
        Course current = activeCourse(courseId, tenant);
        courses.update(withStatus(current, ContentStatus.ARCHIVED, userId));
        log.info("Course archived id={} tenant={}", courseId, tenant.tenantId());
        return OperationResult.ok(ResponseMessages.COURSE_DELETED);
    }

    public Course activeCourse(String courseId, TenantOrg tenant) {
        return courses.findActive(tenant, courseId)
                .orElseThrow(() -> new NotFoundException(ResponseMessages.COURSE_NOT_FOUND));
    }

    private Course withStatus(Course c, ContentStatus status, String userId) {
        return new Course(c.courseId(), c.tenantId(), c.organisationId(), c.title(), c.alias(), c.shortDescription(),
                c.description(), c.image(), c.featured(), c.free(), status, c.adminApproval(), c.autoEnroll(),
                c.startDatetime(), c.endDatetime(), c.certificateTerm(), c.certificateId(), c.params(), c.cohortId(),
                c.ordering(), c.createdBy(), c.createdAt(), userId, OffsetDateTime.now(clock));
    }

    private Map<String, List<Lesson>> topLevelLessonsByModule(TenantOrg tenant, String courseId) {
        return lessons.findActiveByCourse(tenant, courseId).stream()
                .filter(l -> l.parentId() == null && l.moduleId() != null)
                .collect(Collectors.groupingBy(Lesson::moduleId, LinkedHashMap::new, Collectors.toList()));
    }

    private static List<ModuleNode> moduleTree(List<Module> all, String parentId, Map<String, List<Lesson>> lessonsByModule) {
        return all.stream()
                .filter(m -> Objects.equals(m.parentId(), parentId))
                .map(m -> new ModuleNode(m, moduleTree(all, m.moduleId(), lessonsByModule),
                        lessonsByModule.getOrDefault(m.moduleId(), List.of())))
                .toList();
    }

    private static int countLessons(ModuleNode node) {
        return node.lessons().size() + node.submodules().stream().mapToInt(CourseService::countLessons).sum();
    }

    private static TrackedModule tracked(ModuleNode node, Map<String, LessonTrack> latestByLesson, Map<String, ModuleTrack> moduleTracks) {
        return new TrackedModule(node.module(), moduleTracks.get(node.module().moduleId()),
                node.submodules().stream().map(s -> tracked(s, latestByLesson, moduleTracks)).toList(),
                node.lessons().stream().map(l -> new TrackedLesson(l, latestByLesson.get(l.lessonId()))).toList());
    }

    static String cohortOf(Map<String, Object> params) {
        if (params == null) return null;
        Object cohort = params.get("cohortId");
        return cohort == null ? null : cohort.toString();
    }
}
