package org.carball.autolysis.config;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.time.Duration;

/**
 * Connection settings for the narrative service. The token is always passed in explicitly by
 * the caller; nothing here reads environment variables or system properties.
 */
@Data
@Builder(toBuilder = true)
public class NarrativeConfig {

    public static final String DEFAULT_BASE_URL = "https://aiproxy.sanand.workers.dev/openai/v1";
    public static final String DEFAULT_MODEL = "gpt-4o-mini";

    @ToString.Exclude
    private String apiToken;

    @Builder.Default
    private String baseUrl = DEFAULT_BASE_URL;

    @Builder.Default
    private String model = DEFAULT_MODEL;

    @Builder.Default
    private int maxTokens = 1500;

    @Builder.Default
    private double temperature = 0.7;

    @Builder.Default
    private Duration timeout = Duration.ofSeconds(60);

    @Builder.Default
    private int maxRetries = 2;

    @Builder.Default
    private boolean enabled = true;

    public static NarrativeConfig disabled() {
        return NarrativeConfig.builder().enabled(false).build();
    }

    public boolean isUsable() {
        return enabled && apiToken != null && !apiToken.isBlank();
    }
}
