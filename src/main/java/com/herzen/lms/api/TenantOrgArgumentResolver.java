package com.herzen.lms.api;

import com.herzen.lms.common.TenantOrg;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Builds the {@link TenantOrg} controller argument from the tenant headers.
 */
@Component
public class TenantOrgArgumentResolver implements HandlerMethodArgumentResolver {
    public static final String TENANT_HEADER = "tenantid";
    public static final String ORGANISATION_HEADER = "organisationid";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return TenantOrg.class.equals(parameter.getParameterType());
    }

    @Override
    public TenantOrg resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                     NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        return new TenantOrg(webRequest.getHeader(TENANT_HEADER), webRequest.getHeader(ORGANISATION_HEADER));
    }
}
