package com.herzen.lms.content;

import com.herzen.lms.common.TenantOrg;
import com.herzen.lms.repository.CourseJdbcRepository;
import com.herzen.lms.repository.LessonJdbcRepository;
import com.herzen.lms.repository.ModuleJdbcRepository;
import org.springframework.stereotype.Service;

/**
 * Next ordering value for new content: one past the highest published sibling.
 */
@Service
public class OrderingService {
    private final CourseJdbcRepository courses;
    private final ModuleJdbcRepository modules;
    private final LessonJdbcRepository lessons;

    public OrderingService(CourseJdbcRepository courses, ModuleJdbcRepository modules, LessonJdbcRepository lessons) {
        this.courses = courses;
        this.modules = modules;
        this.lessons = lessons;
    }

    public int nextCourseOrdering(TenantOrg tenant) {
        return courses.maxPublishedOrdering(tenant) + 1;
    }

    public int nextModuleOrdering(TenantOrg tenant, String courseId, String parentId) {
        return modules.maxPublishedOrdering(tenant, courseId, parentId) + 1;
    }

    public int nextLessonOrdering(TenantOrg tenant, String moduleId) {
        return lessons.maxPublishedOrdering(tenant, moduleId) + 1;
    }
}
