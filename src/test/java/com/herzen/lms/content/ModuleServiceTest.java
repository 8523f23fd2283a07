package com.herzen.lms.content;

import com.herzen.lms.TestData;
import com.herzen.lms.common.*;
import com.herzen.lms.content.ContentModels.*;
import com.herzen.lms.domain.DomainModels.ContentStatus;
import com.herzen.lms.domain.DomainModels.Course;
import com.herzen.lms.domain.DomainModels.Module;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ModuleServiceTest {
    private static final String USER = "6f1c2d3e-0000-4000-8000-000000000002";

    @Autowired
    private CourseService courseService;

    @Autowired
    private ModuleService moduleService;

    @Autowired
    private LessonService lessonService;

    @Test
    void createsPublishedModulesInOrder() {
        TenantOrg tenant = TestData.newTenant();
        Course course = courseService.create(TestData.course("Physics"), USER, tenant);

        Module first = moduleService.create(TestData.module(course.courseId(), "Mechanics"), USER, tenant);
        Module second = moduleService.create(TestData.module(course.courseId(), "Optics"), USER, tenant);

        assertEquals(ContentStatus.PUBLISHED, first.status());
        assertEquals(first.ordering() + 1, second.ordering());
    }

    @Test
    void duplicateTitleInSameParentIsConflict() {
        TenantOrg tenant = TestData.newTenant();
        Course course = courseService.create(TestData.course("Chemistry"), USER, tenant);
        Module parent = moduleService.create(TestData.module(course.courseId(), "Atoms"), USER, tenant);

        ConflictException ex = assertThrows(ConflictException.class,
                () -> moduleService.create(TestData.module(course.courseId(), " atoms "), USER, tenant));
        assertEquals(ResponseMessages.MODULE_ALREADY_EXISTS, ex.getMessage());

        assertDoesNotThrow(() -> moduleService.create(TestData.module(course.courseId(), parent.moduleId(), "Atoms"), USER, tenant));
    }

    @Test
    void parentMustBelongToSameCourse() {
        TenantOrg tenant = TestData.newTenant();
        Course one = courseService.create(TestData.course("One"), USER, tenant);
        Course two = courseService.create(TestData.course("Two"), USER, tenant);
        Module foreign = moduleService.create(TestData.module(two.courseId(), "Foreign"), USER, tenant);

        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> moduleService.create(TestData.module(one.courseId(), foreign.moduleId(), "Child"), USER, tenant));
        assertEquals(ResponseMessages.PARENT_MODULE_INVALID, ex.getMessage());
    }

    @Test
    void missingCourseIsRejected() {
        TenantOrg tenant = TestData.newTenant();
        assertThrows(BadRequestException.class, () -> moduleService.create(TestData.module(null, "Orphan"), USER, tenant));
        assertThrows(NotFoundException.class, () -> moduleService.create(TestData.module(Ids.newId(), "Orphan"), USER, tenant));
    }

    @Test
    void searchCountsLessonsAndRemoveArchivesThem() {
        TenantOrg tenant = TestData.newTenant();
        Course course = courseService.create(TestData.course("Biology"), USER, tenant);
        Module cells = moduleService.create(TestData.module(course.courseId(), "Cells"), USER, tenant);
        lessonService.create(TestData.lesson(course.courseId(), cells.moduleId(), "Membranes"), USER, tenant);
        lessonService.create(TestData.lesson(course.courseId(), cells.moduleId(), "Organelles"), USER, tenant);

        ModuleSearch search = new ModuleSearch(null, course.courseId(), null, null, "title", "asc");
        PageResult<ModuleWithLessonCount> page = moduleService.search(search, new Pagination(1, null, 10), tenant);
        assertEquals(1, page.totalElements());
        assertEquals(2, page.data().get(0).lessonCount());

        assertTrue(moduleService.remove(cells.moduleId(), USER, tenant).success());
        assertThrows(NotFoundException.class, () -> moduleService.findOne(cells.moduleId(), tenant));
        assertEquals(0, lessonService.search(new LessonSearch(null, null, null, course.courseId(), null),
                new Pagination(1, null, 10), tenant).totalElements());
    }

    @Test
    void renameKeepsTitleUniqueness() {
        TenantOrg tenant = TestData.newTenant();
        Course course = courseService.create(TestData.course("History"), USER, tenant);
        moduleService.create(TestData.module(course.courseId(), "Rome"), USER, tenant);
        Module greece = moduleService.create(TestData.module(course.courseId(), "Greece"), USER, tenant);

        UpdateModuleRequest clash = new UpdateModuleRequest("ROME", null, null, null, null, null, null, null);
        assertThrows(ConflictException.class, () -> moduleService.update(greece.moduleId(), clash, USER, tenant));

        UpdateModuleRequest rename = new UpdateModuleRequest("Athens", "city states", null, null, null, null, null, null);
        Module updated = moduleService.update(greece.moduleId(), rename, USER, tenant);
        assertEquals("Athens", updated.title());
        assertEquals("city states", updated.description());
    }
}
