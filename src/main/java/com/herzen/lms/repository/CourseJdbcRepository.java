package com.herzen.lms.repository;

import com.herzen.lms.common.Pagination;
import com.herzen.lms.common.TenantOrg;
import com.herzen.lms.content.ContentModels.CourseSearch;
import com.herzen.lms.domain.DomainModels.ContentStatus;
import com.herzen.lms.domain.DomainModels.Course;
import com.herzen.lms.domain.DomainModels.Valued;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

import static com.herzen.lms.repository.JdbcSupport.time;

@Repository
public class CourseJdbcRepository {
    private static final String COLUMNS = "course_id, tenant_id, organisation_id, title, alias, short_description, description, image, " +
            "featured, free, status, admin_approval, auto_enroll, start_datetime, end_datetime, certificate_term, certificate_id, " +
            "params, cohort_id, ordering, created_by, created_at, updated_by, updated_at";

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final RowMapper<Course> mapper;

    public CourseJdbcRepository(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
        this.mapper = (rs, n) -> new Course(
                rs.getString("course_id"), rs.getString("tenant_id"), rs.getString("organisation_id"),
                rs.getString("title"), rs.getString("alias"), rs.getString("short_description"),
                rs.getString("description"), rs.getString("image"),
                rs.getBoolean("featured"), rs.getBoolean("free"), ContentStatus.fromValue(rs.getString("status")),
                rs.getBoolean("admin_approval"), rs.getBoolean("auto_enroll"),
                time(rs, "start_datetime"), time(rs, "end_datetime"),
                json.read(rs.getString("certificate_term")), rs.getString("certificate_id"),
                json.read(rs.getString("params")), rs.getString("cohort_id"), rs.getInt("ordering"),
                rs.getString("created_by"), time(rs, "created_at"), rs.getString("updated_by"), time(rs, "updated_at"));
    }

    public void insert(Course c) {
        jdbcTemplate.update("INSERT INTO courses(" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
                c.courseId(), c.tenantId(), c.organisationId(), c.title(), c.alias(), c.shortDescription(),
                c.description(), c.image(), c.featured(), c.free(), Valued.of(c.status()), c.adminApproval(), c.autoEnroll(),
                c.startDatetime(), c.endDatetime(), json.write(c.certificateTerm()), c.certificateId(),
                json.write(c.params()), c.cohortId(), c.ordering(), c.createdBy(), c.createdAt(), c.updatedBy(), c.updatedAt());
    }

    public void update(Course c) {
        jdbcTemplate.update("UPDATE courses SET title=?, alias=?, short_description=?, description=?, image=?, featured=?, free=?, " +
                        "status=?, admin_approval=?, auto_enroll=?, start_datetime=?, end_datetime=?, certificate_term=?, certificate_id=?, " +
                        "params=?, cohort_id=?, ordering=?, updated_by=?, updated_at=? " +
                        "WHERE course_id=? AND tenant_id=? AND organisation_id=?",
                c.title(), c.alias(), c.shortDescription(), c.description(), c.image(), c.featured(), c.free(),
                Valued.of(c.status()), c.adminApproval(), c.autoEnroll(), c.startDatetime(), c.endDatetime(),
                json.write(c.certificateTerm()), c.certificateId(), json.write(c.params()), c.cohortId(), c.ordering(),
                c.updatedBy(), c.updatedAt(), c.courseId(), c.tenantId(), c.organisationId());
    }

    public Optional<Course> findById(TenantOrg tenant, String courseId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM courses WHERE course_id=? AND tenant_id=? AND organisation_id=?",
                mapper, courseId, tenant.tenantId(), tenant.organisationId()).stream().findFirst();
    }

    public Optional<Course> findActive(TenantOrg tenant, String courseId) {
        return findById(tenant, courseId).filter(c -> c.status() != ContentStatus.ARCHIVED);
    }

    public boolean aliasExists(TenantOrg tenant, String alias, String excludeCourseId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM courses WHERE tenant_id=? AND organisation_id=? AND alias=? AND status <> 'archived' " +
                        "AND course_id <> ?",
                Integer.class, tenant.tenantId(), tenant.organisationId(), alias, excludeCourseId == null ? "" : excludeCourseId);
        return count != null && count > 0;
    }

    public List<Course> search(TenantOrg tenant, CourseSearch search, Pagination pagination) {
        JdbcSupport.Where where = filter(tenant, search);
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM courses" + where.sql() + " ORDER BY created_at DESC LIMIT ? OFFSET ?",
                mapper, where.args(pagination.limit(), pagination.skip()));
    }

    public long count(TenantOrg tenant, CourseSearch search) {
        JdbcSupport.Where where = filter(tenant, search);
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM courses" + where.sql(), Long.class, where.args());
        return count == null ? 0 : count;
    }

    public List<Course> findActiveByCohort(TenantOrg tenant, String cohortId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM courses WHERE tenant_id=? AND organisation_id=? AND cohort_id=? " +
                        "AND status <> 'archived' ORDER BY ordering",
                mapper, tenant.tenantId(), tenant.organisationId(), cohortId);
    }

    public int maxPublishedOrdering(TenantOrg tenant) {
        Integer max = jdbcTemplate.queryForObject(
                "SELECT MAX(ordering) FROM courses WHERE tenant_id=? AND organisation_id=? AND status='published'",
                Integer.class, tenant.tenantId(), tenant.organisationId());
        return max == null ? 0 : max;
    }

    private JdbcSupport.Where filter(TenantOrg tenant, CourseSearch s) {
        JdbcSupport.Where where = new JdbcSupport.Where()
                .and("tenant_id = ?", tenant.tenantId())
                .and("organisation_id = ?", tenant.organisationId());
        if (s.status() != null) {
            where.and("status = ?", s.status().value());
        } else {
            where.and("status <> 'archived'");
        }
        String like = s.query() == null || s.query().isBlank() ? null : "%" + s.query().trim().toLowerCase() + "%";
        return where
                .andIf(s.cohortId() != null, "cohort_id = ?", s.cohortId())
                .andIf(s.featured() != null, "featured = ?", s.featured())
                .andIf(s.free() != null, "free = ?", s.free())
                .andIf(s.createdBy() != null, "created_by = ?", s.createdBy())
                .andIf(s.startDateFrom() != null, "start_datetime >= ?", s.startDateFrom())
                .andIf(s.startDateTo() != null, "start_datetime <= ?", s.startDateTo())
                .andIf(s.endDateFrom() != null, "end_datetime >= ?", s.endDateFrom())
                .andIf(s.endDateTo() != null, "end_datetime <= ?", s.endDateTo())
                .andIf(like != null, "(LOWER(title) LIKE ? OR LOWER(description) LIKE ? OR LOWER(short_description) LIKE ?)", like, like, like);
    }
}
