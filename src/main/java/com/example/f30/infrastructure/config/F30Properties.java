package com.example.f30.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * Externalized settings of the certificate pipeline, bound from the {@code f30.*} keys.
 */
@ConfigurationProperties(prefix = "f30")
public record F30Properties(
        @DefaultValue("classpath:profiles/f30-profiles.json") String profilesLocation,
        @DefaultValue Authenticity authenticity,
        @DefaultValue Verification verification,
        @DefaultValue Callback callback,
        @DefaultValue Download download,
        @DefaultValue Executor executor
) {

    /**
     * @param minSizeKb      smallest plausible certificate size
     * @param maxSizeKb      largest plausible certificate size
     * @param editorDenylist producer/creator substrings of known unofficial PDF editors
     */
    public record Authenticity(
            @DefaultValue("10") long minSizeKb,
            @DefaultValue("5120") long maxSizeKb,
            @DefaultValue List<String> editorDenylist
    ) {
    }

    public record Verification(
            @DefaultValue("http://localhost:8001") String baseUrl,
            @DefaultValue("3") int maxAttempts,
            @DefaultValue("2s") Duration backoff,
            @DefaultValue("180s") Duration timeout,
            @DefaultValue("downloads/f30") String copyDirectory
    ) {
    }

    public record Callback(
            @DefaultValue("10s") Duration timeout
    ) {
    }

    public record Download(
            @DefaultValue("30s") Duration timeout
    ) {
    }

    public record Executor(
            @DefaultValue("4") int corePoolSize,
            @DefaultValue("8") int maxPoolSize,
            @DefaultValue("100") int queueCapacity
    ) {
    }
}
