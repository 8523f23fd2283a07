package com.herzen.lms.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class LmsConfig {
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate middlewareRestTemplate(RestTemplateBuilder builder, LmsProperties properties) {
        return builder
                .setConnectTimeout(properties.getMiddleware().getTimeout())
                .setReadTimeout(properties.getMiddleware().getTimeout())
                .build();
    }
}
