package com.herzen.lms.repository;

import com.herzen.lms.common.TenantOrg;
import com.herzen.lms.content.ContentModels.ModuleSearch;
import com.herzen.lms.content.ContentModels.ModuleWithLessonCount;
import com.herzen.lms.domain.DomainModels.ContentStatus;
import com.herzen.lms.domain.DomainModels.Module;
import com.herzen.lms.domain.DomainModels.Valued;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.herzen.lms.repository.JdbcSupport.time;

@Repository
public class ModuleJdbcRepository {
    private static final String COLUMNS = "m.module_id, m.tenant_id, m.organisation_id, m.course_id, m.parent_id, m.title, m.description, " +
            "m.image, m.ordering, m.status, m.start_datetime, m.end_datetime, m.params, m.created_by, m.created_at, m.updated_by, m.updated_at";

    private static final Map<String, String> SORTABLE = Map.of(
            "createdAt", "m.created_at",
            "updatedAt", "m.updated_at",
            "title", "m.title",
            "startDatetime", "m.start_datetime",
            "endDatetime", "m.end_datetime",
            "ordering", "m.ordering");

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final RowMapper<Module> mapper;

    public ModuleJdbcRepository(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
        this.mapper = (rs, n) -> new Module(
                rs.getString("module_id"), rs.getString("tenant_id"), rs.getString("organisation_id"),
                rs.getString("course_id"), rs.getString("parent_id"), rs.getString("title"),
                rs.getString("description"), rs.getString("image"), rs.getInt("ordering"),
                ContentStatus.fromValue(rs.getString("status")), time(rs, "start_datetime"), time(rs, "end_datetime"),
                json.read(rs.getString("params")), rs.getString("created_by"), time(rs, "created_at"),
                rs.getString("updated_by"), time(rs, "updated_at"));
    }

    public void insert(Module m) {
        jdbcTemplate.update("INSERT INTO modules(module_id, tenant_id, organisation_id, course_id, parent_id, title, description, image, " +
                        "ordering, status, start_datetime, end_datetime, params, created_by, created_at, updated_by, updated_at) " +
                        "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
                m.moduleId(), m.tenantId(), m.organisationId(), m.courseId(), m.parentId(), m.title(), m.description(),
                m.image(), m.ordering(), Valued.of(m.status()), m.startDatetime(), m.endDatetime(), json.write(m.params()),
                m.createdBy(), m.createdAt(), m.updatedBy(), m.updatedAt());
    }

    public void update(Module m) {
        jdbcTemplate.update("UPDATE modules SET title=?, description=?, image=?, ordering=?, status=?, start_datetime=?, end_datetime=?, " +
                        "params=?, updated_by=?, updated_at=? WHERE module_id=? AND tenant_id=? AND organisation_id=?",
                m.title(), m.description(), m.image(), m.ordering(), Valued.of(m.status()), m.startDatetime(), m.endDatetime(),
                json.write(m.params()), m.updatedBy(), m.updatedAt(), m.moduleId(), m.tenantId(), m.organisationId());
    }

    public Optional<Module> findById(TenantOrg tenant, String moduleId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM modules m WHERE m.module_id=? AND m.tenant_id=? AND m.organisation_id=?",
                mapper, moduleId, tenant.tenantId(), tenant.organisationId()).stream().findFirst();
    }

    public Optional<Module> findActive(TenantOrg tenant, String moduleId) {
        return findById(tenant, moduleId).filter(m -> m.status() != ContentStatus.ARCHIVED);
    }

    public boolean titleExists(TenantOrg tenant, String courseId, String parentId, String title) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM modules WHERE tenant_id=? AND organisation_id=? AND course_id=? " +
                        "AND COALESCE(parent_id, '') = ? AND LOWER(title) = ? AND status <> 'archived'",
                Integer.class, tenant.tenantId(), tenant.organisationId(), courseId,
                parentId == null ? "" : parentId, title.trim().toLowerCase());
        return count != null && count > 0;
    }

    public List<Module> findActiveByCourse(TenantOrg tenant, String courseId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM modules m WHERE m.tenant_id=? AND m.organisation_id=? AND m.course_id=? " +
                        "AND m.status <> 'archived' ORDER BY m.ordering, m.created_at",
                mapper, tenant.tenantId(), tenant.organisationId(), courseId);
    }

    public List<Module> findPublishedByCourse(TenantOrg tenant, String courseId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM modules m WHERE m.tenant_id=? AND m.organisation_id=? AND m.course_id=? " +
                        "AND m.status = 'published' ORDER BY m.ordering",
                mapper, tenant.tenantId(), tenant.organisationId(), courseId);
    }

    public int maxPublishedOrdering(TenantOrg tenant, String courseId, String parentId) {
        Integer max = jdbcTemplate.queryForObject(
                "SELECT MAX(ordering) FROM modules WHERE tenant_id=? AND organisation_id=? AND course_id=? " +
                        "AND COALESCE(parent_id, '') = ? AND status='published'",
                Integer.class, tenant.tenantId(), tenant.organisationId(), courseId, parentId == null ? "" : parentId);
        return max == null ? 0 : max;
    }

    public void archive(TenantOrg tenant, String moduleId, String userId, OffsetDateTime at) {
        jdbcTemplate.update("UPDATE modules SET status='archived', updated_by=?, updated_at=? " +
                        "WHERE tenant_id=? AND organisation_id=? AND (module_id=? OR parent_id=?)",
                userId, at, tenant.tenantId(), tenant.organisationId(), moduleId, moduleId);
    }

    public List<ModuleWithLessonCount> search(TenantOrg tenant, ModuleSearch search, int offset, int limit) {
        JdbcSupport.Where where = filter(tenant, search);
        String order = JdbcSupport.sortColumn(search.sortBy(), SORTABLE, "m.ordering") + " " + JdbcSupport.direction(search.orderBy());
        return jdbcTemplate.query("SELECT " + COLUMNS + ", (SELECT COUNT(*) FROM lessons l WHERE l.module_id = m.module_id " +
                        "AND l.tenant_id = m.tenant_id AND l.status <> 'archived') AS lesson_count FROM modules m" + where.sql() +
                        " ORDER BY " + order + " LIMIT ? OFFSET ?",
                (rs, n) -> new ModuleWithLessonCount(mapper.mapRow(rs, n), rs.getInt("lesson_count")),
                where.args(limit, offset));
    }

    public long count(TenantOrg tenant, ModuleSearch search) {
        JdbcSupport.Where where = filter(tenant, search);
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM modules m" + where.sql(), Long.class, where.args());
        return count == null ? 0 : count;
    }

    private JdbcSupport.Where filter(TenantOrg tenant, ModuleSearch s) {
        JdbcSupport.Where where = new JdbcSupport.Where()
                .and("m.tenant_id = ?", tenant.tenantId())
                .and("m.organisation_id = ?", tenant.organisationId());
        if (s.status() != null) {
            where.and("m.status = ?", s.status().value());
        } else {
            where.and("m.status <> 'archived'");
        }
        String like = s.query() == null || s.query().isBlank() ? null : "%" + s.query().trim().toLowerCase() + "%";
        return where
                .andIf(s.courseId() != null, "m.course_id = ?", s.courseId())
                .andIf(s.parentId() != null, "m.parent_id = ?", s.parentId())
                .andIf(like != null, "(LOWER(m.title) LIKE ? OR LOWER(m.description) LIKE ?)", like, like);
    }
}
