package com.herzen.lms.content;

import com.herzen.lms.TestData;
import com.herzen.lms.common.*;
import com.herzen.lms.content.ContentModels.*;
import com.herzen.lms.domain.DomainModels.ContentStatus;
import com.herzen.lms.domain.DomainModels.Course;
import com.herzen.lms.domain.DomainModels.Module;
import com.herzen.lms.domain.DomainModels.TrackingStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.OffsetDateTime;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class CourseServiceTest {
    private static final String USER = "6f1c2d3e-0000-4000-8000-000000000001";

    @Autowired
    private CourseService courseService;

    @Autowired
    private ModuleService moduleService;

    @Autowired
    private LessonService lessonService;

    @Test
    void createsCourseWithDefaultsAndUniqueAlias() {
        TenantOrg tenant = TestData.newTenant();
        Course first = courseService.create(TestData.course("Intro to Java"), USER, tenant);
        Course second = courseService.create(TestData.course("Intro to Java"), USER, tenant);

        assertEquals("intro-to-java", first.alias());
        assertNotEquals(first.alias(), second.alias());
        assertTrue(second.alias().startsWith("intro-to-java-"));
        assertFalse(first.featured());
        assertEquals(second.ordering(), first.ordering() + 1);
    }

    @Test
    void defaultStatusIsUnpublished() {
        TenantOrg tenant = TestData.newTenant();
        CreateCourseRequest request = new CreateCourseRequest("Drafts", null, null, null, null, null, null, null,
                null, null, null, null, null, null, null);
        assertEquals(ContentStatus.UNPUBLISHED, courseService.create(request, USER, tenant).status());
    }

    @Test
    void rejectsEndBeforeStart() {
        OffsetDateTime start = OffsetDateTime.now().plusDays(5);
        CreateCourseRequest request = new CreateCourseRequest("Bad dates", null, null, null, null, null, null, null,
                null, null, start, start.minusDays(1), null, null, null);
        ValidationFailedException ex = assertThrows(ValidationFailedException.class,
                () -> courseService.create(request, USER, TestData.newTenant()));
        assertEquals(2, ex.violations().size());
        assertEquals(ResponseMessages.START_DATE_INVALID, ex.getMessage());
    }

    @Test
    void searchFiltersByCohortAndHidesArchived() {
        TenantOrg tenant = TestData.newTenant();
        Course cohortCourse = courseService.create(TestData.course("Cohort A course", "cohort-a", false), USER, tenant);
        courseService.create(TestData.course("Other cohort", "cohort-b", false), USER, tenant);
        Course archived = courseService.create(TestData.course("Old course", "cohort-a", false), USER, tenant);
        courseService.remove(archived.courseId(), USER, tenant);

        CourseSearch byCohort = new CourseSearch(null, null, "cohort-a", null, null, null, null, null, null, null);
        PageResult<Course> page = courseService.search(byCohort, new Pagination(1, null, 10), tenant);
        assertEquals(1, page.totalElements());
        assertEquals(cohortCourse.courseId(), page.data().get(0).courseId());
        assertEquals("cohort-a", page.data().get(0).cohortId());

        PageResult<Course> all = courseService.search(null, new Pagination(1, null, 1), tenant);
        assertEquals(2, all.totalElements());
        assertEquals(1, all.data().size());

        CourseSearch keyword = new CourseSearch("other", null, null, null, null, null, null, null, null, null);
        assertEquals(1, courseService.search(keyword, new Pagination(null, 0, 10), tenant).totalElements());
    }

    @Test
    void updateRegeneratesAliasOnTitleChange() {
        TenantOrg tenant = TestData.newTenant();
        Course course = courseService.create(TestData.course("Algebra"), USER, tenant);
        UpdateCourseRequest rename = new UpdateCourseRequest("Linear Algebra", null, null, null, null, true, null,
                null, null, null, null, null, null, null, null, null);

        Course updated = courseService.update(course.courseId(), rename, USER, tenant);

        assertEquals("linear-algebra", updated.alias());
        assertTrue(updated.featured());
        assertEquals("short", updated.shortDescription());
    }

    @Test
    void archivedCourseIsNotFoundForHierarchy() {
        TenantOrg tenant = TestData.newTenant();
        Course course = courseService.create(TestData.course("Gone"), USER, tenant);
        OperationResult result = courseService.remove(course.courseId(), USER, tenant);

        assertTrue(result.success());
        assertEquals(ContentStatus.ARCHIVED, courseService.findOne(course.courseId(), tenant).status());
        NotFoundException ex = assertThrows(NotFoundException.class, () -> courseService.hierarchy(course.courseId(), tenant));
        assertEquals(ResponseMessages.COURSE_NOT_FOUND, ex.getMessage());
    }

    @Test
    void unknownCourseIsNotFound() {
        assertThrows(NotFoundException.class, () -> courseService.findOne(Ids.newId(), TestData.newTenant()));
    }

    @Test
    void courseFromAnotherTenantIsInvisible() {
        Course course = courseService.create(TestData.course("Private"), USER, TestData.newTenant());
        assertThrows(NotFoundException.class, () -> courseService.findOne(course.courseId(), TestData.newTenant()));
    }

    @Test
    void buildsNestedHierarchyWithTrackingPlaceholder() {
        TenantOrg tenant = TestData.newTenant();
        Course course = courseService.create(TestData.course("Tree"), USER, tenant);
        Module root = moduleService.create(TestData.module(course.courseId(), "Week 1"), USER, tenant);
        Module child = moduleService.create(TestData.module(course.courseId(), root.moduleId(), "Day 1"), USER, tenant);
        lessonService.create(TestData.lesson(course.courseId(), root.moduleId(), "Welcome"), USER, tenant);
        lessonService.create(TestData.lesson(course.courseId(), child.moduleId(), "Warm-up"), USER, tenant);

        CourseHierarchy hierarchy = courseService.hierarchy(course.courseId(), tenant);
        assertEquals(1, hierarchy.modules().size());
        ModuleNode week = hierarchy.modules().get(0);
        assertEquals(1, week.lessons().size());
        assertEquals(1, week.submodules().size());
        assertEquals("Warm-up", week.submodules().get(0).lessons().get(0).title());

        CourseHierarchyWithTracking tracked = courseService.hierarchyWithTracking(course.courseId(), USER, tenant);
        assertEquals(TrackingStatus.NOT_STARTED, tracked.tracking().status());
        assertEquals(2, tracked.tracking().totalLessons());
        assertNull(tracked.tracking().lastAccessedLesson());
    }
}
