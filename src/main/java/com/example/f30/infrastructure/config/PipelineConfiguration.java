package com.example.f30.infrastructure.config;

import com.example.f30.application.exception.ProfileConfigurationException;
import com.example.f30.application.service.DocumentTypeProfileRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the collaborators of the certificate pipeline: profiles, HTTP clients and the job executor.
 */
@Configuration
@EnableConfigurationProperties(F30Properties.class)
public class PipelineConfiguration {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DocumentTypeProfileRegistry documentTypeProfileRegistry(ResourceLoader resourceLoader,
                                                                   F30Properties properties) {
        Resource resource = resourceLoader.getResource(properties.profilesLocation());
        try {
            return DocumentTypeProfileRegistry.fromJson(resource.getInputStream());
        } catch (IOException e) {
            throw new ProfileConfigurationException("Profiles not found at " + properties.profilesLocation(), e);
        }
    }

    @Bean
    public RestTemplate downloadRestTemplate(RestTemplateBuilder builder, F30Properties properties) {
        return builder
                .setConnectTimeout(CONNECT_TIMEOUT)
                .setReadTimeout(properties.download().timeout())
                .build();
    }

    @Bean
    public RestTemplate verificationRestTemplate(RestTemplateBuilder builder, F30Properties properties) {
        return builder
                .setConnectTimeout(CONNECT_TIMEOUT)
                .setReadTimeout(properties.verification().timeout())
                .build();
    }

    @Bean
    public RestTemplate callbackRestTemplate(RestTemplateBuilder builder, F30Properties properties) {
        return builder
                .setConnectTimeout(CONNECT_TIMEOUT)
                .setReadTimeout(properties.callback().timeout())
                .build();
    }

    @Bean
    public ThreadPoolTaskExecutor certificateTaskExecutor(F30Properties properties) {
        F30Properties.Executor settings = properties.executor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.corePoolSize());
        executor.setMaxPoolSize(settings.maxPoolSize());
        executor.setQueueCapacity(settings.queueCapacity());
        executor.setThreadNamePrefix("f30-job-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }
}
