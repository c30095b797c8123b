package com.phillippitts.voicedispatch.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the PurpleAir sensor service. The sensor id itself is a component
 * argument, since several sensors may be configured.
 */
@Validated
@ConfigurationProperties(prefix = "purpleair")
public class PurpleAirProperties {

    @NotBlank
    private final String baseUrl;

    @Min(0)
    private final int cacheTtlSeconds;

    @NotBlank
    private final String cacheDir;

    @Min(1)
    private final int timeoutMs;

    @ConstructorBinding
    public PurpleAirProperties(String baseUrl, Integer cacheTtlSeconds, String cacheDir, Integer timeoutMs) {
        this.baseUrl = baseUrl == null ? "https://www.purpleair.com/json" : baseUrl;
        this.cacheTtlSeconds = cacheTtlSeconds == null ? 60 : cacheTtlSeconds;
        this.cacheDir = cacheDir == null ? System.getProperty("java.io.tmpdir") : cacheDir;
        this.timeoutMs = timeoutMs == null ? 10_000 : timeoutMs;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public int getCacheTtlSeconds() {
        return cacheTtlSeconds;
    }

    public String getCacheDir() {
        return cacheDir;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }
}
