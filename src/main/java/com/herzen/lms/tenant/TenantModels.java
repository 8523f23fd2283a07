package com.herzen.lms.tenant;

import com.herzen.lms.domain.DomainModels.StorageProvider;
import com.herzen.lms.domain.DomainModels.UploadEntityType;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.OffsetDateTime;
import java.util.List;

public class TenantModels {
    /**
     * Upload policy for one entity type. A null size or mime list means the tenant never configured it.
     */
    public record UploadPolicy(String tenantId, UploadEntityType entityType, String path, Integer maxFileSizeMb,
                               List<String> allowedMimeTypes, StorageProvider storageProvider, OffsetDateTime updatedAt) {}

    public record UploadPolicyRequest(@NotBlank String path,
                                      @Min(1) Integer maxFileSizeMb,
                                      List<@NotBlank String> allowedMimeTypes,
                                      @NotNull StorageProvider storageProvider) {}
}
