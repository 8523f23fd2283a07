package com.herzen.lms.repository;

import com.herzen.lms.common.TenantOrg;
import com.herzen.lms.domain.DomainModels.CourseTrack;
import com.herzen.lms.domain.DomainModels.LessonTrack;
import com.herzen.lms.domain.DomainModels.ModuleTrack;
import com.herzen.lms.domain.DomainModels.TrackingStatus;
import com.herzen.lms.domain.DomainModels.Valued;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static com.herzen.lms.repository.JdbcSupport.time;

@Repository
public class TrackingJdbcRepository {
    private static final String COURSE_COLUMNS = "course_track_id, tenant_id, organisation_id, course_id, user_id, status, start_datetime, " +
            "end_datetime, no_of_lessons, completed_lessons, completion_percentage, last_accessed_date, cert_gen_date, certificate_issued";
    private static final String MODULE_COLUMNS = "module_track_id, tenant_id, organisation_id, module_id, user_id, status, " +
            "completed_lessons, total_lessons, progress, updated_at";
    private static final String LESSON_COLUMNS = "t.lesson_track_id, t.tenant_id, t.organisation_id, t.lesson_id, t.course_id, t.user_id, " +
            "t.attempt, t.status, t.start_datetime, t.end_datetime, t.score, t.total_content, t.current_position, " +
            "t.completion_percentage, t.time_spent, t.params, t.updated_by, t.updated_at";

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final RowMapper<CourseTrack> courseMapper;
    private final RowMapper<ModuleTrack> moduleMapper;
    private final RowMapper<LessonTrack> lessonMapper;

    public TrackingJdbcRepository(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
        this.courseMapper = (rs, n) -> new CourseTrack(
                rs.getString("course_track_id"), rs.getString("tenant_id"), rs.getString("organisation_id"),
                rs.getString("course_id"), rs.getString("user_id"), TrackingStatus.fromValue(rs.getString("status")),
                time(rs, "start_datetime"), time(rs, "end_datetime"), rs.getInt("no_of_lessons"),
                rs.getInt("completed_lessons"), rs.getInt("completion_percentage"), time(rs, "last_accessed_date"),
                time(rs, "cert_gen_date"), rs.getBoolean("certificate_issued"));
        this.moduleMapper = (rs, n) -> new ModuleTrack(
                rs.getString("module_track_id"), rs.getString("tenant_id"), rs.getString("organisation_id"),
                rs.getString("module_id"), rs.getString("user_id"), TrackingStatus.fromValue(rs.getString("status")),
                rs.getInt("completed_lessons"), rs.getInt("total_lessons"), rs.getInt("progress"), time(rs, "updated_at"));
        this.lessonMapper = (rs, n) -> new LessonTrack(
                rs.getString("lesson_track_id"), rs.getString("tenant_id"), rs.getString("organisation_id"),
                rs.getString("lesson_id"), rs.getString("course_id"), rs.getString("user_id"), rs.getInt("attempt"),
                TrackingStatus.fromValue(rs.getString("status")), time(rs, "start_datetime"), time(rs, "end_datetime"),
                rs.getInt("score"), rs.getInt("total_content"), rs.getInt("current_position"),
                rs.getInt("completion_percentage"), rs.getInt("time_spent"), json.read(rs.getString("params")),
                rs.getString("updated_by"), time(rs, "updated_at"));
    }

    // course_track

    public void insertCourseTrack(CourseTrack t) {
        jdbcTemplate.update("INSERT INTO course_track(" + COURSE_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
                t.courseTrackId(), t.tenantId(), t.organisationId(), t.courseId(), t.userId(), Valued.of(t.status()),
                t.startDatetime(), t.endDatetime(), t.noOfLessons(), t.completedLessons(), t.completionPercentage(),
                t.lastAccessedDate(), t.certGenDate(), t.certificateIssued());
    }

    public void updateCourseTrack(CourseTrack t) {
        jdbcTemplate.update("UPDATE course_track SET status=?, start_datetime=?, end_datetime=?, no_of_lessons=?, completed_lessons=?, " +
                        "completion_percentage=?, last_accessed_date=?, cert_gen_date=?, certificate_issued=? " +
                        "WHERE course_track_id=? AND tenant_id=? AND organisation_id=?",
                Valued.of(t.status()), t.startDatetime(), t.endDatetime(), t.noOfLessons(), t.completedLessons(),
                t.completionPercentage(), t.lastAccessedDate(), t.certGenDate(), t.certificateIssued(),
                t.courseTrackId(), t.tenantId(), t.organisationId());
    }

    public Optional<CourseTrack> findCourseTrack(TenantOrg tenant, String courseId, String userId) {
        return jdbcTemplate.query("SELECT " + COURSE_COLUMNS + " FROM course_track WHERE course_id=? AND user_id=? " +
                        "AND tenant_id=? AND organisation_id=?",
                courseMapper, courseId, userId, tenant.tenantId(), tenant.organisationId()).stream().findFirst();
    }

    public List<CourseTrack> findCourseTracks(TenantOrg tenant, String courseId) {
        return jdbcTemplate.query("SELECT " + COURSE_COLUMNS + " FROM course_track WHERE course_id=? AND tenant_id=? AND organisation_id=?",
                courseMapper, courseId, tenant.tenantId(), tenant.organisationId());
    }

    public void deleteCourseTrack(TenantOrg tenant, String courseId, String userId) {
        jdbcTemplate.update("DELETE FROM course_track WHERE course_id=? AND user_id=? AND tenant_id=? AND organisation_id=?",
                courseId, userId, tenant.tenantId(), tenant.organisationId());
    }

    // module_track

    public void upsertModuleTrack(ModuleTrack t) {
        jdbcTemplate.update("MERGE INTO module_track(" + MODULE_COLUMNS + ") KEY(tenant_id, organisation_id, module_id, user_id) " +
                        "VALUES (?,?,?,?,?,?,?,?,?,?)",
                t.moduleTrackId(), t.tenantId(), t.organisationId(), t.moduleId(), t.userId(), Valued.of(t.status()),
                t.completedLessons(), t.totalLessons(), t.progress(), t.updatedAt());
    }

    public Optional<ModuleTrack> findModuleTrack(TenantOrg tenant, String moduleId, String userId) {
        return jdbcTemplate.query("SELECT " + MODULE_COLUMNS + " FROM module_track WHERE module_id=? AND user_id=? " +
                        "AND tenant_id=? AND organisation_id=?",
                moduleMapper, moduleId, userId, tenant.tenantId(), tenant.organisationId()).stream().findFirst();
    }

    public List<ModuleTrack> findModuleTracksForCourse(TenantOrg tenant, String courseId, String userId) {
        return jdbcTemplate.query("SELECT " + MODULE_COLUMNS + " FROM module_track WHERE user_id=? AND tenant_id=? AND organisation_id=? " +
                        "AND module_id IN (SELECT module_id FROM modules WHERE course_id=?)",
                moduleMapper, userId, tenant.tenantId(), tenant.organisationId(), courseId);
    }

    public int deleteModuleTracksForCourse(TenantOrg tenant, String courseId, String userId) {
        return jdbcTemplate.update("DELETE FROM module_track WHERE user_id=? AND tenant_id=? AND organisation_id=? " +
                        "AND module_id IN (SELECT module_id FROM modules WHERE course_id=?)",
                userId, tenant.tenantId(), tenant.organisationId(), courseId);
    }


    // lesson_track

    public void insertLessonTrack(LessonTrack t) {
        jdbcTemplate.update("INSERT INTO lesson_track(lesson_track_id, tenant_id, organisation_id, lesson_id, course_id, user_id, attempt, " +
                        "status, start_datetime, end_datetime, score, total_content, current_position, completion_percentage, time_spent, " +
                        "params, updated_by, updated_at) VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
                t.lessonTrackId(), t.tenantId(), t.organisationId(), t.lessonId(), t.courseId(), t.userId(), t.attempt(),
                Valued.of(t.status()), t.startDatetime(), t.endDatetime(), t.score(), t.totalContent(), t.currentPosition(),
                t.completionPercentage(), t.timeSpent(), json.write(t.params()), t.updatedBy(), t.updatedAt());
    }

    public void updateLessonTrack(LessonTrack t) {
        jdbcTemplate.update("UPDATE lesson_track SET status=?, start_datetime=?, end_datetime=?, score=?, total_content=?, current_position=?, " +
                        "completion_percentage=?, time_spent=?, params=?, updated_by=?, updated_at=? " +
                        "WHERE lesson_track_id=? AND tenant_id=? AND organisation_id=?",
                Valued.of(t.status()), t.startDatetime(), t.endDatetime(), t.score(), t.totalContent(), t.currentPosition(),
                t.completionPercentage(), t.timeSpent(), json.write(t.params()), t.updatedBy(), t.updatedAt(),
                t.lessonTrackId(), t.tenantId(), t.organisationId());
    }

    public Optional<LessonTrack> findAttempt(TenantOrg tenant, String attemptId, String userId) {
        return jdbcTemplate.query("SELECT " + LESSON_COLUMNS + " FROM lesson_track t WHERE t.lesson_track_id=? AND t.user_id=? " +
                        "AND t.tenant_id=? AND t.organisation_id=?",
                lessonMapper, attemptId, userId, tenant.tenantId(), tenant.organisationId()).stream().findFirst();
    }

    public List<LessonTrack> findAttempts(TenantOrg tenant, String lessonId, String userId) {
        return jdbcTemplate.query("SELECT " + LESSON_COLUMNS + " FROM lesson_track t WHERE t.lesson_id=? AND t.user_id=? " +
                        "AND t.tenant_id=? AND t.organisation_id=? ORDER BY t.attempt, t.start_datetime",
                lessonMapper, lessonId, userId, tenant.tenantId(), tenant.organisationId());
    }

    public Optional<LessonTrack> findLatestAttempt(TenantOrg tenant, String lessonId, String userId) {
        return jdbcTemplate.query("SELECT " + LESSON_COLUMNS + " FROM lesson_track t WHERE t.lesson_id=? AND t.user_id=? " +
                        "AND t.tenant_id=? AND t.organisation_id=? ORDER BY t.attempt DESC, t.updated_at DESC LIMIT 1",
                lessonMapper, lessonId, userId, tenant.tenantId(), tenant.organisationId()).stream().findFirst();
    }

    /**
     * Latest attempt per lesson the user touched in a course.
     */
    public List<LessonTrack> findLatestAttemptsForCourse(TenantOrg tenant, String courseId, String userId) {
        return jdbcTemplate.query("SELECT " + LESSON_COLUMNS + " FROM lesson_track t WHERE t.course_id=? AND t.user_id=? " +
                        "AND t.tenant_id=? AND t.organisation_id=? AND t.attempt = (SELECT MAX(x.attempt) FROM lesson_track x " +
                        "WHERE x.lesson_id = t.lesson_id AND x.user_id = t.user_id AND x.tenant_id = t.tenant_id " +
                        "AND x.organisation_id = t.organisation_id) " +
                        "ORDER BY t.updated_at DESC",
                lessonMapper, courseId, userId, tenant.tenantId(), tenant.organisationId());
    }

    public int countAttemptsForCourse(TenantOrg tenant, String courseId, String userId) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM lesson_track WHERE course_id=? AND user_id=? " +
                        "AND tenant_id=? AND organisation_id=?",
                Integer.class, courseId, userId, tenant.tenantId(), tenant.organisationId());
        return count == null ? 0 : count;
    }

    /**
     * Distinct lessons the user completed among those that count towards course completion.
     */
    public int countCompletedCountableLessons(TenantOrg tenant, String courseId, String userId) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(DISTINCT t.lesson_id) FROM lesson_track t " +
                        "JOIN lessons l ON l.lesson_id = t.lesson_id WHERE t.course_id=? AND t.user_id=? AND t.tenant_id=? " +
                        "AND t.organisation_id=? AND t.status='completed' AND " + LessonJdbcRepository.COUNTABLE,
                Integer.class, courseId, userId, tenant.tenantId(), tenant.organisationId());
        return count == null ? 0 : count;
    }

    public int countCompletedAmong(TenantOrg tenant, Collection<String> lessonIds, String userId) {
        if (lessonIds.isEmpty()) return 0;
        JdbcSupport.Where where = new JdbcSupport.Where()
                .and("tenant_id = ?", tenant.tenantId())
                .and("organisation_id = ?", tenant.organisationId())
                .and("user_id = ?", userId)
                .and("status = 'completed'")
                .andIn("lesson_id", lessonIds);
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(DISTINCT lesson_id) FROM lesson_track" + where.sql(),
                Integer.class, where.args());
        return count == null ? 0 : count;
    }

}
