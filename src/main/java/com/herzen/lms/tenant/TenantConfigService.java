package com.herzen.lms.tenant;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.herzen.lms.config.LmsProperties;
import com.herzen.lms.domain.DomainModels.UploadEntityType;
import com.herzen.lms.repository.TenantConfigJdbcRepository;
import com.herzen.lms.tenant.TenantModels.UploadPolicy;
import com.herzen.lms.tenant.TenantModels.UploadPolicyRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class TenantConfigService {
    private final TenantConfigJdbcRepository repository;
    private final Clock clock;
    private final Cache<String, Optional<UploadPolicy>> cache;

    public TenantConfigService(TenantConfigJdbcRepository repository, LmsProperties properties, Clock clock) {
        this.repository = repository;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(properties.getTenantConfig().getCacheMaxSize())
                .expireAfterWrite(properties.getTenantConfig().getCacheTtl())
                .build();
    }

    public Optional<UploadPolicy> uploadPolicy(String tenantId, UploadEntityType entityType) {
        return cache.get(key(tenantId, entityType), k -> repository.find(tenantId, entityType));
    }

    public List<UploadPolicy> uploadPolicies(String tenantId) {
        return repository.findAll(tenantId);
    }

    public UploadPolicy saveUploadPolicy(String tenantId, UploadEntityType entityType, UploadPolicyRequest request) {
        UploadPolicy policy = new UploadPolicy(tenantId, entityType, request.path(), request.maxFileSizeMb(),
                request.allowedMimeTypes(), request.storageProvider(), OffsetDateTime.now(clock));
        repository.upsert(policy);
        cache.invalidate(key(tenantId, entityType));
        log.info("Upload policy saved tenant={} type={} provider={}", tenantId, entityType.value(), request.storageProvider().value());
        return policy;
    }

    private static String key(String tenantId, UploadEntityType entityType) {
        return tenantId + ":" + entityType.value();
    }
}
