package com.herzen.lms.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "lms")
public class LmsProperties {
    private Upload upload = new Upload();
    private Middleware middleware = new Middleware();
    private TenantConfig tenantConfig = new TenantConfig();
    private Enrollment enrollment = new Enrollment();

    public Upload getUpload() { return upload; }
    public void setUpload(Upload upload) { this.upload = upload; }
    public Middleware getMiddleware() { return middleware; }
    public void setMiddleware(Middleware middleware) { this.middleware = middleware; }
    public TenantConfig getTenantConfig() { return tenantConfig; }
    public void setTenantConfig(TenantConfig tenantConfig) { this.tenantConfig = tenantConfig; }
    public Enrollment getEnrollment() { return enrollment; }
    public void setEnrollment(Enrollment enrollment) { this.enrollment = enrollment; }

    public static class Upload {
        private String rootDir = "uploads";
        public String getRootDir() { return rootDir; }
        public void setRootDir(String rootDir) { this.rootDir = rootDir; }
    }

    public static class Middleware {
        /** Base URL of the user service; reports need it to resolve names and emails. */
        private String url;
        private Duration timeout = Duration.ofSeconds(10);
        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class TenantConfig {
        private Duration cacheTtl = Duration.ofMinutes(5);
        private long cacheMaxSize = 500;
        public Duration getCacheTtl() { return cacheTtl; }
        public void setCacheTtl(Duration cacheTtl) { this.cacheTtl = cacheTtl; }
        public long getCacheMaxSize() { return cacheMaxSize; }
        public void setCacheMaxSize(long cacheMaxSize) { this.cacheMaxSize = cacheMaxSize; }
    }

    public static class Enrollment {
        private int maxPageSize = 100;
        public int getMaxPageSize() { return maxPageSize; }
        public void setMaxPageSize(int maxPageSize) { this.maxPageSize = maxPageSize; }
    }
}
