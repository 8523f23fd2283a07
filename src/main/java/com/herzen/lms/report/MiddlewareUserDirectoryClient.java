package com.herzen.lms.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.herzen.lms.common.BadRequestException;
import com.herzen.lms.common.ResponseMessages;
import com.herzen.lms.common.TenantOrg;
import com.herzen.lms.config.LmsProperties;
import com.herzen.lms.report.ReportModels.UserProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class MiddlewareUserDirectoryClient implements UserDirectoryClient {
    private final RestTemplate restTemplate;
    private final LmsProperties properties;

    public MiddlewareUserDirectoryClient(RestTemplate middlewareRestTemplate, LmsProperties properties) {
        this.restTemplate = middlewareRestTemplate;
        this.properties = properties;
    }

    @Override
    public Map<String, UserProfile> fetch(Collection<String> userIds, TenantOrg tenant, String authorization) {
        String baseUrl = properties.getMiddleware().getUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new BadRequestException(ResponseMessages.MIDDLEWARE_URL_NOT_CONFIGURED);
        }
        if (userIds.isEmpty()) return Map.of();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("tenantid", tenant.tenantId());
        headers.set("organisationId", tenant.organisationId());
        if (authorization != null) {
            headers.set(HttpHeaders.AUTHORIZATION, authorization);
        }
        Map<String, Object> body = Map.of("filters", Map.of("userId", List.copyOf(userIds)), "limit", userIds.size());

        JsonNode response;
        try {
            response = restTemplate.postForObject(stripSlash(baseUrl) + "/user/v1/list", new HttpEntity<>(body, headers), JsonNode.class);
        } catch (RestClientException e) {
            log.error("User directory call failed for {} users: {}", userIds.size(), e.getMessage());
            throw new BadRequestException(ResponseMessages.FAILED_TO_FETCH_USER_DATA, e);
        }

        Map<String, UserProfile> profiles = new LinkedHashMap<>();
        if (response == null) return profiles;
        for (JsonNode user : response.path("result").path("getUserDetails")) {
            String userId = user.path("userId").asText(null);
            if (userId == null) continue;
            String username = user.path("username").asText(null);
            String name = (user.path("firstName").asText("") + " " + user.path("lastName").asText("")).trim();
            String email = user.path("email").asText("");
            profiles.put(userId, new UserProfile(userId, name.isEmpty() ? username : name, email.isEmpty() ? username : email));
        }
        log.debug("Fetched {} of {} user profiles", profiles.size(), userIds.size());
        return profiles;
    }

    private static String stripSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
