package com.herzen.lms.repository;

import com.herzen.lms.common.Pagination;
import com.herzen.lms.common.TenantOrg;
import com.herzen.lms.content.ContentModels.LessonSearch;
import com.herzen.lms.domain.DomainModels.*;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import static com.herzen.lms.repository.JdbcSupport.nullableInt;
import static com.herzen.lms.repository.JdbcSupport.time;

@Repository
public class LessonJdbcRepository {
    private static final String COLUMNS = "l.lesson_id, l.tenant_id, l.organisation_id, l.course_id, l.module_id, l.parent_id, l.title, " +
            "l.alias, l.description, l.image, l.status, l.format, l.media_id, l.start_datetime, l.end_datetime, l.storage, " +
            "l.no_of_attempts, l.attempts_grade, l.ideal_time, l.resume, l.total_marks, l.passing_marks, l.consider_for_passing, " +
            "l.sample_lesson, l.allow_resubmission, l.ordering, l.params, l.created_by, l.created_at, l.updated_by, l.updated_at";

    /** Lessons that count towards course completion: published, graded, top-level and inside a published module. */
    static final String COUNTABLE = "l.status = 'published' AND l.consider_for_passing = TRUE AND l.parent_id IS NULL " +
            "AND EXISTS (SELECT 1 FROM modules m WHERE m.module_id = l.module_id AND m.status = 'published')";

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final RowMapper<Lesson> mapper;
    private final RowMapper<Media> mediaMapper;

    public LessonJdbcRepository(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
        this.mapper = (rs, n) -> new Lesson(
                rs.getString("lesson_id"), rs.getString("tenant_id"), rs.getString("organisation_id"),
                rs.getString("course_id"), rs.getString("module_id"), rs.getString("parent_id"),
                rs.getString("title"), rs.getString("alias"), rs.getString("description"), rs.getString("image"),
                ContentStatus.fromValue(rs.getString("status")), LessonFormat.fromValue(rs.getString("format")),
                rs.getString("media_id"), time(rs, "start_datetime"), time(rs, "end_datetime"), rs.getString("storage"),
                rs.getInt("no_of_attempts"), AttemptsGradeMethod.fromValue(rs.getString("attempts_grade")),
                nullableInt(rs, "ideal_time"), rs.getBoolean("resume"), nullableInt(rs, "total_marks"),
                nullableInt(rs, "passing_marks"), rs.getBoolean("consider_for_passing"), rs.getBoolean("sample_lesson"),
                rs.getBoolean("allow_resubmission"), rs.getInt("ordering"), json.read(rs.getString("params")),
                rs.getString("created_by"), time(rs, "created_at"), rs.getString("updated_by"), time(rs, "updated_at"));
        this.mediaMapper = (rs, n) -> new Media(
                rs.getString("media_id"), rs.getString("tenant_id"), rs.getString("organisation_id"),
                LessonFormat.fromValue(rs.getString("format")), LessonSubFormat.fromValue(rs.getString("sub_format")),
                rs.getString("source"), rs.getString("path"), rs.getString("storage"),
                ContentStatus.fromValue(rs.getString("status")), rs.getString("created_by"), time(rs, "created_at"));
    }

    public void insert(Lesson l) {
        jdbcTemplate.update("INSERT INTO lessons(lesson_id, tenant_id, organisation_id, course_id, module_id, parent_id, title, alias, " +
                        "description, image, status, format, media_id, start_datetime, end_datetime, storage, no_of_attempts, attempts_grade, " +
                        "ideal_time, resume, total_marks, passing_marks, consider_for_passing, sample_lesson, allow_resubmission, ordering, " +
                        "params, created_by, created_at, updated_by, updated_at) VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
                l.lessonId(), l.tenantId(), l.organisationId(), l.courseId(), l.moduleId(), l.parentId(), l.title(), l.alias(),
                l.description(), l.image(), Valued.of(l.status()), Valued.of(l.format()), l.mediaId(), l.startDatetime(),
                l.endDatetime(), l.storage(), l.noOfAttempts(), Valued.of(l.attemptsGrade()), l.idealTime(), l.resume(),
                l.totalMarks(), l.passingMarks(), l.considerForPassing(), l.sampleLesson(), l.allowResubmission(), l.ordering(),
                json.write(l.params()), l.createdBy(), l.createdAt(), l.updatedBy(), l.updatedAt());
    }

    public void update(Lesson l) {
        jdbcTemplate.update("UPDATE lessons SET title=?, alias=?, description=?, image=?, status=?, start_datetime=?, end_datetime=?, " +
                        "no_of_attempts=?, attempts_grade=?, ideal_time=?, resume=?, total_marks=?, passing_marks=?, consider_for_passing=?, " +
                        "sample_lesson=?, allow_resubmission=?, ordering=?, params=?, updated_by=?, updated_at=? " +
                        "WHERE lesson_id=? AND tenant_id=? AND organisation_id=?",
                l.title(), l.alias(), l.description(), l.image(), Valued.of(l.status()), l.startDatetime(), l.endDatetime(),
                l.noOfAttempts(), Valued.of(l.attemptsGrade()), l.idealTime(), l.resume(), l.totalMarks(), l.passingMarks(),
                l.considerForPassing(), l.sampleLesson(), l.allowResubmission(), l.ordering(), json.write(l.params()),
                l.updatedBy(), l.updatedAt(), l.lessonId(), l.tenantId(), l.organisationId());
    }

    public Optional<Lesson> findById(TenantOrg tenant, String lessonId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM lessons l WHERE l.lesson_id=? AND l.tenant_id=? AND l.organisation_id=?",
                mapper, lessonId, tenant.tenantId(), tenant.organisationId()).stream().findFirst();
    }

    public Optional<Lesson> findActive(TenantOrg tenant, String lessonId) {
        return findById(tenant, lessonId).filter(l -> l.status() != ContentStatus.ARCHIVED);
    }

    public boolean aliasExists(TenantOrg tenant, String alias, String excludeLessonId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM lessons WHERE tenant_id=? AND organisation_id=? AND alias=? AND status <> 'archived' AND lesson_id <> ?",
                Integer.class, tenant.tenantId(), tenant.organisationId(), alias, excludeLessonId == null ? "" : excludeLessonId);
        return count != null && count > 0;
    }

    public void setParent(TenantOrg tenant, String lessonId, String parentId) {
        jdbcTemplate.update("UPDATE lessons SET parent_id=? WHERE lesson_id=? AND tenant_id=? AND organisation_id=?",
                parentId, lessonId, tenant.tenantId(), tenant.organisationId());
    }

    public List<Lesson> findActiveByCourse(TenantOrg tenant, String courseId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM lessons l WHERE l.tenant_id=? AND l.organisation_id=? AND l.course_id=? " +
                        "AND l.status <> 'archived' ORDER BY l.ordering, l.created_at",
                mapper, tenant.tenantId(), tenant.organisationId(), courseId);
    }

    public List<Lesson> findActiveByModule(TenantOrg tenant, String moduleId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM lessons l WHERE l.tenant_id=? AND l.organisation_id=? AND l.module_id=? " +
                        "AND l.status <> 'archived' ORDER BY l.ordering, l.created_at",
                mapper, tenant.tenantId(), tenant.organisationId(), moduleId);
    }

    public List<Lesson> findChildren(TenantOrg tenant, String parentId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM lessons l WHERE l.tenant_id=? AND l.organisation_id=? AND l.parent_id=? " +
                        "AND l.status <> 'archived' ORDER BY l.ordering",
                mapper, tenant.tenantId(), tenant.organisationId(), parentId);
    }

    public List<Lesson> search(TenantOrg tenant, LessonSearch search, Pagination pagination) {
        JdbcSupport.Where where = filter(tenant, search);
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM lessons l" + where.sql() + " ORDER BY l.ordering, l.created_at LIMIT ? OFFSET ?",
                mapper, where.args(pagination.limit(), pagination.skip()));
    }

    public long count(TenantOrg tenant, LessonSearch search) {
        JdbcSupport.Where where = filter(tenant, search);
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM lessons l" + where.sql(), Long.class, where.args());
        return count == null ? 0 : count;
    }

    public int maxPublishedOrdering(TenantOrg tenant, String moduleId) {
        Integer max = jdbcTemplate.queryForObject(
                "SELECT MAX(ordering) FROM lessons WHERE tenant_id=? AND organisation_id=? AND module_id=? AND status='published'",
                Integer.class, tenant.tenantId(), tenant.organisationId(), moduleId);
        return max == null ? 0 : max;
    }

    public void archive(TenantOrg tenant, String lessonId, String userId, OffsetDateTime at) {
        jdbcTemplate.update("UPDATE lessons SET status='archived', updated_by=?, updated_at=? " +
                        "WHERE tenant_id=? AND organisation_id=? AND (lesson_id=? OR parent_id=?)",
                userId, at, tenant.tenantId(), tenant.organisationId(), lessonId, lessonId);
    }

    public void archiveByModule(TenantOrg tenant, String moduleId, String userId, OffsetDateTime at) {
        jdbcTemplate.update("UPDATE lessons SET status='archived', updated_by=?, updated_at=? WHERE tenant_id=? AND organisation_id=? " +
                        "AND module_id IN (SELECT module_id FROM modules WHERE module_id=? OR parent_id=?)",
                userId, at, tenant.tenantId(), tenant.organisationId(), moduleId, moduleId);
    }

    /**
     * Number of lessons a learner has to complete for the course to count as completed.
     */
    public int countCountableLessons(TenantOrg tenant, String courseId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM lessons l WHERE l.tenant_id=? AND l.organisation_id=? AND l.course_id=? AND " + COUNTABLE,
                Integer.class, tenant.tenantId(), tenant.organisationId(), courseId);
        return count == null ? 0 : count;
    }

    /**
     * Lesson ids a learner has to complete inside a module.
     */
    public List<String> findModuleCountableLessonIds(TenantOrg tenant, String moduleId) {
        return jdbcTemplate.query("SELECT lesson_id FROM lessons WHERE tenant_id=? AND organisation_id=? AND module_id=? " +
                        "AND status = 'published' AND consider_for_passing = TRUE AND parent_id IS NULL",
                (rs, n) -> rs.getString(1), tenant.tenantId(), tenant.organisationId(), moduleId);
    }

    public Optional<Lesson> findByMediaSource(TenantOrg tenant, String source, LessonFormat format) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM lessons l JOIN media md ON md.media_id = l.media_id " +
                        "WHERE l.tenant_id=? AND l.organisation_id=? AND md.source=? AND l.format=? AND l.status <> 'archived' " +
                        "ORDER BY l.created_at DESC",
                mapper, tenant.tenantId(), tenant.organisationId(), source, format.value()).stream().findFirst();
    }

    public int countPublishedMatching(TenantOrg tenant, List<String> courseIds, LessonFormat format, LessonSubFormat subFormat) {
        if (courseIds.isEmpty()) return 0;
        JdbcSupport.Where where = criteria(tenant, courseIds, format, subFormat);
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM lessons l LEFT JOIN media md ON md.media_id = l.media_id" +
                where.sql(), Integer.class, where.args());
        return count == null ? 0 : count;
    }

    public int countCompletedMatching(TenantOrg tenant, List<String> courseIds, LessonFormat format, LessonSubFormat subFormat, String userId) {
        if (courseIds.isEmpty()) return 0;
        JdbcSupport.Where where = criteria(tenant, courseIds, format, subFormat)
                .and("EXISTS (SELECT 1 FROM lesson_track t WHERE t.lesson_id = l.lesson_id AND t.tenant_id = l.tenant_id AND t.user_id = ? AND t.status = 'completed')", userId);
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM lessons l LEFT JOIN media md ON md.media_id = l.media_id" +
                where.sql(), Integer.class, where.args());
        return count == null ? 0 : count;
    }

    public void insertMedia(Media m) {
        jdbcTemplate.update("INSERT INTO media(media_id, tenant_id, organisation_id, format, sub_format, source, path, storage, status, " +
                        "created_by, created_at) VALUES (?,?,?,?,?,?,?,?,?,?,?)",
                m.mediaId(), m.tenantId(), m.organisationId(), Valued.of(m.format()), Valued.of(m.subFormat()), m.source(),
                m.path(), m.storage(), Valued.of(m.status()), m.createdBy(), m.createdAt());
    }

    public void updateMediaLocation(TenantOrg tenant, String mediaId, String source, String path) {
        jdbcTemplate.update("UPDATE media SET source=COALESCE(?, source), path=COALESCE(?, path) " +
                        "WHERE media_id=? AND tenant_id=? AND organisation_id=?",
                source, path, mediaId, tenant.tenantId(), tenant.organisationId());
    }

    public Optional<Media> findMedia(TenantOrg tenant, String mediaId) {
        if (mediaId == null) return Optional.empty();
        return jdbcTemplate.query("SELECT media_id, tenant_id, organisation_id, format, sub_format, source, path, storage, status, " +
                        "created_by, created_at FROM media WHERE media_id=? AND tenant_id=? AND organisation_id=?",
                mediaMapper, mediaId, tenant.tenantId(), tenant.organisationId()).stream().findFirst();
    }

    private JdbcSupport.Where criteria(TenantOrg tenant, List<String> courseIds, LessonFormat format, LessonSubFormat subFormat) {
        return new JdbcSupport.Where()
                .and("l.tenant_id = ?", tenant.tenantId())
                .and("l.organisation_id = ?", tenant.organisationId())
                .and("l.status = 'published'")
                .andIn("l.course_id", courseIds)
                .andIf(format != null, "l.format = ?", Valued.of(format))
                .andIf(subFormat != null, "md.sub_format = ?", Valued.of(subFormat));
    }

    private JdbcSupport.Where filter(TenantOrg tenant, LessonSearch s) {
        JdbcSupport.Where where = new JdbcSupport.Where()
                .and("l.tenant_id = ?", tenant.tenantId())
                .and("l.organisation_id = ?", tenant.organisationId());
        if (s.status() != null) {
            where.and("l.status = ?", s.status().value());
        } else {
            where.and("l.status <> 'archived'");
        }
        String like = s.query() == null || s.query().isBlank() ? null : "%" + s.query().trim().toLowerCase() + "%";
        return where
                .andIf(s.format() != null, "l.format = ?", Valued.of(s.format()))
                .andIf(s.courseId() != null, "l.course_id = ?", s.courseId())
                .andIf(s.moduleId() != null, "l.module_id = ?", s.moduleId())
                .andIf(like != null, "(LOWER(l.title) LIKE ? OR LOWER(l.description) LIKE ?)", like, like);
    }
}
