package com.herzen.lms.api;

import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Configuration
public class WebConfig implements WebMvcConfigurer {
    private final TenantOrgArgumentResolver tenantOrgArgumentResolver;

    public WebConfig(TenantOrgArgumentResolver tenantOrgArgumentResolver) {
        this.tenantOrgArgumentResolver = tenantOrgArgumentResolver;
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(tenantOrgArgumentResolver);
    }

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverterFactory(new ValuedEnumConverterFactory());
    }
}
