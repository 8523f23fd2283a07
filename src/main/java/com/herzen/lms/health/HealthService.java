package com.herzen.lms.health;

import com.herzen.lms.config.LmsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class HealthService {
    private final JdbcTemplate jdbcTemplate;
    private final LmsProperties properties;

    public HealthService(JdbcTemplate jdbcTemplate, LmsProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.properties = properties;
    }

    public HealthReport check() {
        ComponentHealth database = database();
        String middlewareUrl = properties.getMiddleware().getUrl();
        ComponentHealth directory = middlewareUrl == null || middlewareUrl.isBlank()
                ? new ComponentHealth("userDirectory", "down", "Service URL not configured", null)
                : new ComponentHealth("userDirectory", "configured", null, null);
        return new HealthReport("up".equals(database.status()) ? "ok" : "error", List.of(database, directory));
    }

    private ComponentHealth database() {
        long start = System.currentTimeMillis();
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return new ComponentHealth("database", "up", null, System.currentTimeMillis() - start);
        } catch (DataAccessException e) {
            log.error("Database health check failed: {}", e.getMessage());
            return new ComponentHealth("database", "down", e.getMostSpecificCause().getMessage(), System.currentTimeMillis() - start);
        }
    }

    public record HealthReport(String status, List<ComponentHealth> services) {
        public boolean healthy() {
            return "ok".equals(status);
        }
    }

    public record ComponentHealth(String name, String status, String message, Long responseTimeMs) {}
}
