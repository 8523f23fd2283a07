package com.herzen.lms.upload;

import com.herzen.lms.common.BadRequestException;
import com.herzen.lms.common.NotImplementedException;
import com.herzen.lms.common.ResponseMessages;
import com.herzen.lms.common.TenantOrg;
import com.herzen.lms.domain.DomainModels.StorageProvider;
import com.herzen.lms.domain.DomainModels.UploadEntityType;
import com.herzen.lms.tenant.TenantConfigService;
import com.herzen.lms.tenant.TenantModels.UploadPolicy;
import com.herzen.lms.upload.UploadModels.DeleteResult;
import com.herzen.lms.upload.UploadModels.UploadResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.UUID;

@Slf4j
@Service
public class FileUploadService {
    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final TenantConfigService tenantConfigService;
    private final FileStorage storage;

    public FileUploadService(TenantConfigService tenantConfigService, FileStorage storage) {
        this.tenantConfigService = tenantConfigService;
        this.storage = storage;
    }

    public UploadResult uploadFile(MultipartFile file, UploadEntityType type, TenantOrg tenant) {
        if (file == null || file.isEmpty()) {
            throw new BadRequestException(ResponseMessages.FILE_REQUIRED);
        }
        UploadPolicy policy = policy(type, tenant);
        validateFile(file, policy);

        String fileName = UUID.randomUUID() + extension(file.getOriginalFilename());
        String path = storage.store(file, policy.path(), fileName);
        log.info("Uploaded {} file tenant={} path={} size={}", type.value(), tenant.tenantId(), path, file.getSize());
        return new UploadResult(path, type, file.getOriginalFilename(), file.getSize(), file.getContentType());
    }

    public DeleteResult deleteFile(String path, UploadEntityType type, TenantOrg tenant) {
        UploadPolicy policy = policy(type, tenant);
        if (policy.storageProvider() != StorageProvider.LOCAL) {
            throw new NotImplementedException(ResponseMessages.FILE_DELETION_NOT_IMPLEMENTED);
        }
        return new DeleteResult(storage.delete(path), path);
    }

    public void validateFile(MultipartFile file, UploadPolicy policy) {
        Integer maxMb = policy.maxFileSizeMb();
        if (maxMb == null) {
            throw new BadRequestException(ResponseMessages.MAX_FILE_SIZE_NOT_FOUND);
        }
        if (file.getSize() > maxMb * BYTES_PER_MB) {
            throw new BadRequestException(ResponseMessages.FILE_TOO_LARGE + ": " + maxMb + "MB");
        }
        List<String> allowed = policy.allowedMimeTypes();
        if (allowed == null || allowed.isEmpty()) {
            throw new BadRequestException(ResponseMessages.ALLOWED_MIME_TYPES_NOT_FOUND);
        }
        if (!allowed.contains(file.getContentType())) {
            throw new BadRequestException(ResponseMessages.INVALID_FILE_TYPE + ": " + String.join(", ", allowed));
        }
    }

    private UploadPolicy policy(UploadEntityType type, TenantOrg tenant) {
        return tenantConfigService.uploadPolicy(tenant.tenantId(), type)
                .orElseThrow(() -> new BadRequestException(ResponseMessages.CONFIG_NOT_FOUND));
    }

    private static String extension(String originalName) {
        String ext = StringUtils.getFilenameExtension(originalName == null ? null : StringUtils.cleanPath(originalName));
        return ext == null || ext.isBlank() ? "" : "." + ext.toLowerCase();
    }
}
