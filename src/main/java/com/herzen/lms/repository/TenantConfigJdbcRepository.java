package com.herzen.lms.repository;

import com.herzen.lms.domain.DomainModels.StorageProvider;
import com.herzen.lms.domain.DomainModels.UploadEntityType;
import com.herzen.lms.domain.DomainModels.Valued;
import com.herzen.lms.tenant.TenantModels.UploadPolicy;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static com.herzen.lms.repository.JdbcSupport.nullableInt;
import static com.herzen.lms.repository.JdbcSupport.time;

@Repository
public class TenantConfigJdbcRepository {
    private static final String COLUMNS = "tenant_id, entity_type, path, max_file_size_mb, allowed_mime_types, storage_provider, updated_at";

    private final JdbcTemplate jdbcTemplate;
    private final RowMapper<UploadPolicy> mapper = (rs, n) -> new UploadPolicy(
            rs.getString("tenant_id"), UploadEntityType.fromValue(rs.getString("entity_type")), rs.getString("path"),
            nullableInt(rs, "max_file_size_mb"), splitMimeTypes(rs.getString("allowed_mime_types")),
            StorageProvider.fromValue(rs.getString("storage_provider")), time(rs, "updated_at"));

    public TenantConfigJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void upsert(UploadPolicy p) {
        jdbcTemplate.update("MERGE INTO tenant_upload_config(" + COLUMNS + ") KEY(tenant_id, entity_type) VALUES (?,?,?,?,?,?,?)",
                p.tenantId(), Valued.of(p.entityType()), p.path(), p.maxFileSizeMb(),
                p.allowedMimeTypes() == null ? null : String.join(",", p.allowedMimeTypes()),
                Valued.of(p.storageProvider()), p.updatedAt());
    }

    public Optional<UploadPolicy> find(String tenantId, UploadEntityType entityType) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM tenant_upload_config WHERE tenant_id=? AND entity_type=?",
                mapper, tenantId, entityType.value()).stream().findFirst();
    }

    public List<UploadPolicy> findAll(String tenantId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM tenant_upload_config WHERE tenant_id=? ORDER BY entity_type",
                mapper, tenantId);
    }

    private static List<String> splitMimeTypes(String value) {
        if (value == null) return null;
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
