package com.herzen.lms.api;

import com.herzen.lms.common.NotFoundException;
import com.herzen.lms.common.ResponseMessages;
import com.herzen.lms.common.TenantOrg;
import com.herzen.lms.domain.DomainModels.UploadEntityType;
import com.herzen.lms.tenant.TenantConfigService;
import com.herzen.lms.tenant.TenantModels.UploadPolicy;
import com.herzen.lms.tenant.TenantModels.UploadPolicyRequest;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/tenant-config")
public class TenantConfigController {
    private final TenantConfigService tenantConfigService;

    public TenantConfigController(TenantConfigService tenantConfigService) {
        this.tenantConfigService = tenantConfigService;
    }

    @GetMapping("/upload")
    public ResponseEntity<List<UploadPolicy>> uploadPolicies(TenantOrg tenant) {
        return ResponseEntity.ok(tenantConfigService.uploadPolicies(tenant.tenantId()));
    }

    @GetMapping("/upload/{type}")
    public ResponseEntity<UploadPolicy> uploadPolicy(@PathVariable UploadEntityType type, TenantOrg tenant) {
        return ResponseEntity.ok(tenantConfigService.uploadPolicy(tenant.tenantId(), type)
                .orElseThrow(() -> new NotFoundException(ResponseMessages.CONFIG_NOT_FOUND)));
    }

    @PutMapping("/upload/{type}")
    public ResponseEntity<UploadPolicy> saveUploadPolicy(@PathVariable UploadEntityType type,
                                                         @Valid @RequestBody UploadPolicyRequest request,
                                                         TenantOrg tenant) {
        return ResponseEntity.ok(tenantConfigService.saveUploadPolicy(tenant.tenantId(), type, request));
    }
}
