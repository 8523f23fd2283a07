package com.herzen.lms.repository;

import com.herzen.lms.common.Pagination;
import com.herzen.lms.common.TenantOrg;
import com.herzen.lms.domain.DomainModels.Enrollment;
import com.herzen.lms.domain.DomainModels.EnrollmentStatus;
import com.herzen.lms.domain.DomainModels.Valued;
import com.herzen.lms.enrollment.EnrollmentModels.EnrolledCourse;
import com.herzen.lms.enrollment.EnrollmentModels.EnrollmentFilter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

import static com.herzen.lms.repository.JdbcSupport.time;

@Repository
public class EnrollmentJdbcRepository {
    private static final String COLUMNS = "e.enrollment_id, e.tenant_id, e.organisation_id, e.course_id, e.user_id, e.status, " +
            "e.enrolled_on_time, e.end_time, e.unlimited_plan, e.before_expiry_mail, e.after_expiry_mail, e.params, e.enrolled_by, " +
            "e.enrolled_at, e.updated_by, e.updated_at";

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final CourseJdbcRepository courses;
    private final RowMapper<Enrollment> mapper;

    public EnrollmentJdbcRepository(JdbcTemplate jdbcTemplate, JsonColumns json, CourseJdbcRepository courses) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
        this.courses = courses;
        this.mapper = (rs, n) -> new Enrollment(
                rs.getString("enrollment_id"), rs.getString("tenant_id"), rs.getString("organisation_id"),
                rs.getString("course_id"), rs.getString("user_id"), EnrollmentStatus.fromValue(rs.getString("status")),
                time(rs, "enrolled_on_time"), time(rs, "end_time"), rs.getBoolean("unlimited_plan"),
                rs.getBoolean("before_expiry_mail"), rs.getBoolean("after_expiry_mail"), json.read(rs.getString("params")),
                rs.getString("enrolled_by"), time(rs, "enrolled_at"), rs.getString("updated_by"), time(rs, "updated_at"));
    }

    public void insert(Enrollment e) {
        jdbcTemplate.update("INSERT INTO user_enrollments(enrollment_id, tenant_id, organisation_id, course_id, user_id, status, " +
                        "enrolled_on_time, end_time, unlimited_plan, before_expiry_mail, after_expiry_mail, params, enrolled_by, enrolled_at, " +
                        "updated_by, updated_at) VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
                e.enrollmentId(), e.tenantId(), e.organisationId(), e.courseId(), e.userId(), Valued.of(e.status()),
                e.enrolledOnTime(), e.endTime(), e.unlimitedPlan(), e.beforeExpiryMail(), e.afterExpiryMail(),
                json.write(e.params()), e.enrolledBy(), e.enrolledAt(), e.updatedBy(), e.updatedAt());
    }

    public void update(Enrollment e) {
        jdbcTemplate.update("UPDATE user_enrollments SET status=?, end_time=?, unlimited_plan=?, before_expiry_mail=?, after_expiry_mail=?, " +
                        "params=?, updated_by=?, updated_at=? WHERE enrollment_id=? AND tenant_id=? AND organisation_id=?",
                Valued.of(e.status()), e.endTime(), e.unlimitedPlan(), e.beforeExpiryMail(), e.afterExpiryMail(),
                json.write(e.params()), e.updatedBy(), e.updatedAt(), e.enrollmentId(), e.tenantId(), e.organisationId());
    }

    public Optional<Enrollment> findById(TenantOrg tenant, String enrollmentId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM user_enrollments e WHERE e.enrollment_id=? AND e.tenant_id=? AND e.organisation_id=?",
                mapper, enrollmentId, tenant.tenantId(), tenant.organisationId()).stream().findFirst();
    }

    public Optional<Enrollment> findByCourseAndUser(TenantOrg tenant, String courseId, String userId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM user_enrollments e WHERE e.course_id=? AND e.user_id=? " +
                        "AND e.tenant_id=? AND e.organisation_id=?",
                mapper, courseId, userId, tenant.tenantId(), tenant.organisationId()).stream().findFirst();
    }

    public List<Enrollment> search(TenantOrg tenant, EnrollmentFilter filter, Pagination pagination) {
        JdbcSupport.Where where = filter(tenant, filter);
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM user_enrollments e" + where.sql() +
                        " ORDER BY e.enrolled_on_time DESC LIMIT ? OFFSET ?",
                mapper, where.args(pagination.limit(), pagination.skip()));
    }

    public long count(TenantOrg tenant, EnrollmentFilter filter) {
        JdbcSupport.Where where = filter(tenant, filter);
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM user_enrollments e" + where.sql(), Long.class, where.args());
        return count == null ? 0 : count;
    }

    public void delete(TenantOrg tenant, String enrollmentId) {
        jdbcTemplate.update("DELETE FROM user_enrollments WHERE enrollment_id=? AND tenant_id=? AND organisation_id=?",
                enrollmentId, tenant.tenantId(), tenant.organisationId());
    }

    public List<EnrolledCourse> enrolledCourses(TenantOrg tenant, String userId, String cohortId, int offset, int limit) {
        JdbcSupport.Where where = enrolledCoursesFilter(tenant, userId, cohortId);
        List<Enrollment> rows = jdbcTemplate.query("SELECT " + COLUMNS + " FROM user_enrollments e JOIN courses c ON c.course_id = e.course_id" +
                        where.sql() + " ORDER BY c.ordering, e.enrolled_on_time DESC LIMIT ? OFFSET ?",
                mapper, where.args(limit, offset));
        return rows.stream()
                .map(e -> new EnrolledCourse(e.enrollmentId(), e.userId(), e.status(), e.enrolledOnTime(),
                        courses.findById(tenant, e.courseId()).orElse(null)))
                .toList();
    }

    public long countEnrolledCourses(TenantOrg tenant, String userId, String cohortId) {
        JdbcSupport.Where where = enrolledCoursesFilter(tenant, userId, cohortId);
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM user_enrollments e JOIN courses c ON c.course_id = e.course_id" +
                where.sql(), Long.class, where.args());
        return count == null ? 0 : count;
    }

    private JdbcSupport.Where enrolledCoursesFilter(TenantOrg tenant, String userId, String cohortId) {
        return new JdbcSupport.Where()
                .and("e.tenant_id = ?", tenant.tenantId())
                .and("e.organisation_id = ?", tenant.organisationId())
                .and("e.status = 'published'")
                .and("c.status <> 'archived'")
                .andIf(userId != null, "e.user_id = ?", userId)
                .andIf(cohortId != null, "c.cohort_id = ?", cohortId);
    }

    private JdbcSupport.Where filter(TenantOrg tenant, EnrollmentFilter f) {
        return new JdbcSupport.Where()
                .and("e.tenant_id = ?", tenant.tenantId())
                .and("e.organisation_id = ?", tenant.organisationId())
                .andIf(f.learnerId() != null, "e.user_id = ?", f.learnerId())
                .andIf(f.courseId() != null, "e.course_id = ?", f.courseId())
                .andIf(f.status() != null, "e.status = ?", Valued.of(f.status()));
    }
}
