package com.herzen.lms.common;

/**
 * Tenant and organisation pair every read and write is scoped to.
 */
public record TenantOrg(String tenantId, String organisationId) {
    public TenantOrg {
        if (tenantId == null || tenantId.isBlank()) {
            throw new BadRequestException(ResponseMessages.TENANT_ID_REQUIRED);
        }
        if (organisationId == null || organisationId.isBlank()) {
            throw new BadRequestException(ResponseMessages.ORGANISATION_ID_REQUIRED);
        }
    }
}
