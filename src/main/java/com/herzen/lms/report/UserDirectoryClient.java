package com.herzen.lms.report;

import com.herzen.lms.common.TenantOrg;
import com.herzen.lms.report.ReportModels.UserProfile;

import java.util.Collection;
import java.util.Map;

/**
 * Looks up display names and emails for report rows.
 */
public interface UserDirectoryClient {
    Map<String, UserProfile> fetch(Collection<String> userIds, TenantOrg tenant, String authorization);
}
