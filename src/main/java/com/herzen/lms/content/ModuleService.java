package com.herzen.lms.content;

import com.herzen.lms.common.*;
import com.herzen.lms.content.ContentModels.CreateModuleRequest;
import com.herzen.lms.content.ContentModels.ModuleSearch;
import com.herzen.lms.content.ContentModels.ModuleWithLessonCount;
import com.herzen.lms.content.ContentModels.UpdateModuleRequest;
import com.herzen.lms.domain.DomainModels.ContentStatus;
import com.herzen.lms.domain.DomainModels.Module;
import com.herzen.lms.repository.LessonJdbcRepository;
import com.herzen.lms.repository.ModuleJdbcRepository;
import com.herzen.lms.validation.DateRules;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;

@Slf4j
@Service
public class ModuleService {
    private final ModuleJdbcRepository modules;
    private final LessonJdbcRepository lessons;
    private final CourseService courseService;
    private final OrderingService orderingService;
    private final DateRules dateRules;
    private final Clock clock;

    public ModuleService(ModuleJdbcRepository modules,
                         LessonJdbcRepository lessons,
                         CourseService courseService,
                         OrderingService orderingService,
                         DateRules dateRules,
                         Clock clock) {
        this.modules = modules;
        this.lessons = lessons;
        this.courseService = courseService;
        this.orderingService = orderingService;
        this.dateRules = dateRules;
        this.clock = clock;
    }

    public Module create(CreateModuleRequest request, String userId, TenantOrg tenant) {
        if (request.courseId() == null || request.courseId().isBlank()) {
            throw new BadRequestException(ResponseMessages.MODULE_COURSE_REQUIRED);
        }
        ValidationFailedException.throwIfAny(dateRules.validateRange(request.startDatetime(), request.endDatetime()));
        courseService.activeCourse(request.courseId(), tenant);

        if (request.parentId() != null) {
            modules.findActive(tenant, request.parentId())
                    .filter(p -> p.courseId().equals(request.courseId()))
                    .orElseThrow(() -> new BadRequestException(ResponseMessages.PARENT_MODULE_INVALID));
        }
        if (modules.titleExists(tenant, request.courseId(), request.parentId(), request.title())) {
            throw new ConflictException(ResponseMessages.MODULE_ALREADY_EXISTS);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        int ordering = request.ordering() != null
                ? request.ordering()
                : orderingService.nextModuleOrdering(tenant, request.courseId(), request.parentId());
        Module module = new Module(Ids.newId(), tenant.tenantId(), tenant.organisationId(),
                request.courseId(), request.parentId(), request.title().trim(), request.description(), request.image(),
                ordering, Patch.or(request.status(), ContentStatus.PUBLISHED),
                request.startDatetime(), request.endDatetime(), request.params(),
                userId, now, userId, now);
        modules.insert(module);
        log.info("Module created id={} course={} tenant={}", module.moduleId(), module.courseId(), tenant.tenantId());
        return module;
    }

    public Module findOne(String moduleId, TenantOrg tenant) {
        return modules.findActive(tenant, moduleId)
                .orElseThrow(() -> new NotFoundException(ResponseMessages.MODULE_NOT_FOUND));
    }

    public PageResult<ModuleWithLessonCount> search(ModuleSearch search, Pagination pagination, TenantOrg tenant) {
        return PageResult.of(modules.search(tenant, search, pagination.skip(), pagination.limit()),
                modules.count(tenant, search), pagination);
    }

    public Module update(String moduleId, UpdateModuleRequest request, String userId, TenantOrg tenant) {
        Module current = findOne(moduleId, tenant);
        OffsetDateTime start = Patch.or(request.startDatetime(), current.startDatetime());
        OffsetDateTime end = Patch.or(request.endDatetime(), current.endDatetime());
        ValidationFailedException.throwIfAny(dateRules.validateRange(start, end));

        String title = request.title() == null ? current.title() : request.title().trim();
        if (!title.equalsIgnoreCase(current.title())
                && modules.titleExists(tenant, current.courseId(), current.parentId(), title)) {
            throw new ConflictException(ResponseMessages.MODULE_ALREADY_EXISTS);
        }
        Module updated = new Module(current.moduleId(), current.tenantId(), current.organisationId(),
                current.courseId(), current.parentId(), title,
                Patch.or(request.description(), current.description()),
                Patch.or(request.image(), current.image()),
                Patch.or(request.ordering(), current.ordering()),
                Patch.or(request.status(), current.status()),
                start, end, Patch.or(request.params(), current.params()),
                current.createdBy(), current.createdAt(), userId, OffsetDateTime.now(clock));
        modules.update(updated);
        log.info("Module updated id={} tenant={}", moduleId, tenant.tenantId());
        return updated;
    }

    @Transactional
    public OperationResult remove(String moduleId, String userId, TenantOrg tenant) {
        findOne(moduleId, tenant);
        OffsetDateTime now = OffsetDateTime.now(clock);
        lessons.archiveByModule(tenant, moduleId, userId, now);
        modules.archive(tenant, moduleId, userId, now);
        log.info("Module archived id={} tenant={}", moduleId, tenant.tenantId());
        return OperationResult.ok(ResponseMessages.MODULE_DELETED);
    }
}
