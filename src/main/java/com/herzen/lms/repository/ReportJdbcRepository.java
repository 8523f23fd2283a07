package com.herzen.lms.repository;

import com.herzen.lms.common.TenantOrg;
import com.herzen.lms.domain.DomainModels.EnrollmentStatus;
import com.herzen.lms.domain.DomainModels.TrackingStatus;
import com.herzen.lms.domain.DomainModels.Valued;
import com.herzen.lms.report.ReportModels.CourseReportRequest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static com.herzen.lms.repository.JdbcSupport.time;

@Repository
public class ReportJdbcRepository {
    private static final Map<String, String> COURSE_SORT = Map.of(
            "progress", "CASE WHEN COALESCE(ct.no_of_lessons, 0) = 0 THEN 0 ELSE ct.completed_lessons * 100 / ct.no_of_lessons END",
            "completedLessons", "COALESCE(ct.completed_lessons, 0)",
            "status", "COALESCE(ct.status, 'not-started')",
            "enrolledOnTime", "e.enrolled_on_time",
            "lastAccessed", "ct.last_accessed_date",
            "certificateIssued", "COALESCE(ct.certificate_issued, FALSE)");

    private static final Map<String, String> LESSON_SORT = Map.of(
            "progress", "COALESCE(t.completion_percentage, 0)",
            "score", "COALESCE(t.score, 0)",
            "timeSpent", "COALESCE(t.time_spent, 0)",
            "attempt", "COALESCE(t.attempt, 0)",
            "status", "COALESCE(t.status, 'not-started')",
            "enrolledOnTime", "e.enrolled_on_time",
            "lastAccessed", "t.updated_at");

    private static final String COURSE_FROM = " FROM user_enrollments e LEFT JOIN course_track ct ON ct.course_id = e.course_id " +
            "AND ct.user_id = e.user_id AND ct.tenant_id = e.tenant_id AND ct.organisation_id = e.organisation_id";

    private static final String LESSON_FROM = " FROM user_enrollments e LEFT JOIN lesson_track t ON t.lesson_id = ? " +
            "AND t.user_id = e.user_id AND t.tenant_id = e.tenant_id AND t.organisation_id = e.organisation_id " +
            "AND t.attempt = (SELECT MAX(x.attempt) FROM lesson_track x WHERE x.lesson_id = t.lesson_id AND x.user_id = t.user_id " +
            "AND x.tenant_id = t.tenant_id AND x.organisation_id = t.organisation_id)";

    private final JdbcTemplate jdbcTemplate;

    public ReportJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<CourseProgressRow> courseProgress(TenantOrg tenant, CourseReportRequest request) {
        JdbcSupport.Where where = courseFilter(tenant, request);
        String order = JdbcSupport.sortColumn(request.sortBy(), COURSE_SORT, COURSE_SORT.get("progress"))
                + " " + JdbcSupport.direction(request.orderBy()) + ", e.user_id";
        return jdbcTemplate.query("SELECT e.user_id, e.status AS enrollment_status, e.enrolled_on_time, ct.status AS track_status, " +
                        "ct.no_of_lessons, ct.completed_lessons, ct.last_accessed_date, ct.certificate_issued, ct.cert_gen_date" +
                        COURSE_FROM + where.sql() + " ORDER BY " + order + " LIMIT ? OFFSET ?",
                (rs, n) -> new CourseProgressRow(
                        rs.getString("user_id"), EnrollmentStatus.fromValue(rs.getString("enrollment_status")),
                        time(rs, "enrolled_on_time"),
                        rs.getString("track_status") == null ? TrackingStatus.NOT_STARTED : TrackingStatus.fromValue(rs.getString("track_status")),
                        rs.getInt("no_of_lessons"), rs.getInt("completed_lessons"), time(rs, "last_accessed_date"),
                        rs.getBoolean("certificate_issued"), time(rs, "cert_gen_date")),
                where.args(request.limit(), request.offset()));
    }

    public long countCourseProgress(TenantOrg tenant, CourseReportRequest request) {
        JdbcSupport.Where where = courseFilter(tenant, request);
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*)" + COURSE_FROM + where.sql(), Long.class, where.args());
        return count == null ? 0 : count;
    }

    public List<LessonAttemptRow> lessonProgress(TenantOrg tenant, CourseReportRequest request) {
        JdbcSupport.Where where = lessonFilter(tenant, request);
        String order = JdbcSupport.sortColumn(request.sortBy(), LESSON_SORT, LESSON_SORT.get("progress"))
                + " " + JdbcSupport.direction(request.orderBy()) + ", e.user_id";
        Object[] args = prepend(request.lessonId(), where.args(request.limit(), request.offset()));
        return jdbcTemplate.query("SELECT e.user_id, t.lesson_track_id, t.attempt, t.status, t.completion_percentage, t.score, " +
                        "t.time_spent, t.updated_at" + LESSON_FROM + where.sql() + " ORDER BY " + order + " LIMIT ? OFFSET ?",
                (rs, n) -> new LessonAttemptRow(
                        rs.getString("user_id"), rs.getString("lesson_track_id"), rs.getInt("attempt"),
                        rs.getString("status") == null ? TrackingStatus.NOT_STARTED : TrackingStatus.fromValue(rs.getString("status")),
                        rs.getInt("completion_percentage"), rs.getInt("score"), rs.getInt("time_spent"), time(rs, "updated_at")),
                args);
    }

    public long countLessonProgress(TenantOrg tenant, CourseReportRequest request) {
        JdbcSupport.Where where = lessonFilter(tenant, request);
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*)" + LESSON_FROM + where.sql(), Long.class,
                prepend(request.lessonId(), where.args()));
        return count == null ? 0 : count;
    }

    private JdbcSupport.Where courseFilter(TenantOrg tenant, CourseReportRequest r) {
        return enrollmentFilter(tenant, r)
                .andIf(r.status() != null, "COALESCE(ct.status, 'not-started') = ?", Valued.of(r.status()))
                .andIf(r.certificateIssued() != null, "COALESCE(ct.certificate_issued, FALSE) = ?", r.certificateIssued());
    }

    private JdbcSupport.Where lessonFilter(TenantOrg tenant, CourseReportRequest r) {
        return enrollmentFilter(tenant, r)
                .andIf(r.status() != null, "COALESCE(t.status, 'not-started') = ?", Valued.of(r.status()));
    }

    private JdbcSupport.Where enrollmentFilter(TenantOrg tenant, CourseReportRequest r) {
        return new JdbcSupport.Where()
                .and("e.tenant_id = ?", tenant.tenantId())
                .and("e.organisation_id = ?", tenant.organisationId())
                .and("e.course_id = ?", r.courseId())
                .and("e.status <> 'archived'")
                .andIf(r.enrollmentStatus() != null, "e.status = ?", Valued.of(r.enrollmentStatus()));
    }

    private static Object[] prepend(Object first, Object[] rest) {
        Object[] all = new Object[rest.length + 1];
        all[0] = first;
        System.arraycopy(rest, 0, all, 1, rest.length);
        return all;
    }

    public record CourseProgressRow(String userId, EnrollmentStatus enrollmentStatus, OffsetDateTime enrolledOnTime,
                                    TrackingStatus status, int noOfLessons, int completedLessons,
                                    OffsetDateTime lastAccessed, boolean certificateIssued, OffsetDateTime certGenDate) {}

    public record LessonAttemptRow(String userId, String attemptId, int attempt, TrackingStatus status,
                                   int completionPercentage, int score, int timeSpent, OffsetDateTime updatedAt) {}
}
