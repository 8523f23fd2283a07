package com.herzen.lms;

import com.herzen.lms.common.Ids;
import com.herzen.lms.common.TenantOrg;
import com.herzen.lms.content.ContentModels.CreateCourseRequest;
import com.herzen.lms.content.ContentModels.CreateLessonRequest;
import com.herzen.lms.content.ContentModels.CreateModuleRequest;
import com.herzen.lms.domain.DomainModels.AttemptsGradeMethod;
import com.herzen.lms.domain.DomainModels.ContentStatus;
import com.herzen.lms.domain.DomainModels.LessonFormat;
import com.herzen.lms.domain.DomainModels.LessonSubFormat;
import com.herzen.lms.enrollment.EnrollmentModels.CreateEnrollmentRequest;

import java.util.Map;

/**
 * Request builders shared by the database-backed tests. Every test works in its own random tenant.
 */
public final class TestData {
    private TestData() {
    }

    public static TenantOrg newTenant() {
        return new TenantOrg(Ids.newId(), Ids.newId());
    }

    public static CreateCourseRequest course(String title) {
        return course(title, null, false);
    }

    public static CreateCourseRequest course(String title, String cohortId, boolean adminApproval) {
        return new CreateCourseRequest(title, null, "short", "description", null, false, false,
                ContentStatus.PUBLISHED, adminApproval, false, null, null, null, null,
                cohortId == null ? null : Map.of("cohortId", cohortId));
    }

    public static CreateModuleRequest module(String courseId, String title) {
        return module(courseId, null, title);
    }

    public static CreateModuleRequest module(String courseId, String parentId, String title) {
        return new CreateModuleRequest(courseId, parentId, title, null, null, null, null, null, null, null);
    }

    public static CreateLessonRequest lesson(String courseId, String moduleId, String title) {
        return lesson(courseId, moduleId, title, LessonFormat.VIDEO, LessonSubFormat.YOUTUBE_URL, null, 0, false);
    }

    public static CreateLessonRequest lesson(String courseId, String moduleId, String title, LessonFormat format,
                                             LessonSubFormat subFormat, String source, int noOfAttempts,
                                             boolean allowResubmission) {
        return new CreateLessonRequest(courseId, moduleId, title, null, null, null, ContentStatus.PUBLISHED,
                format, subFormat, source, null, null, null, null, noOfAttempts, AttemptsGradeMethod.LAST_ATTEMPT,
                null, true, 100, 50, true, false, allowResubmission, null, null, null);
    }

    public static CreateLessonRequest draftLesson(String courseId, String moduleId, String title) {
        return new CreateLessonRequest(courseId, moduleId, title, null, null, null, ContentStatus.UNPUBLISHED,
                LessonFormat.VIDEO, LessonSubFormat.YOUTUBE_URL, null, null, null, null, null, 0, AttemptsGradeMethod.LAST_ATTEMPT,
                null, true, 100, 50, true, false, false, null, null, null);
    }

    public static CreateEnrollmentRequest enrollment(String courseId, String userId) {
        return new CreateEnrollmentRequest(courseId, userId, null, null, null, null, null, null);
    }
}
