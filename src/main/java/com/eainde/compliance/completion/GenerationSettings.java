package com.eainde.compliance.completion;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Generation parameters shared by every completion call.
 *
 * Boxed fields are optional: {@code null} leaves the provider default in place.
 */
@Value
@Builder(toBuilder = true)
public class GenerationSettings {

    public static final int DEFAULT_MAX_TOKENS = 512;
    public static final double DEFAULT_TEMPERATURE = 0.0;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    String modelName;

    @Builder.Default
    int maxOutputTokens = DEFAULT_MAX_TOKENS;

    @Builder.Default
    double temperature = DEFAULT_TEMPERATURE;

    Double topP;

    /** Ask the provider for a JSON object instead of free text. */
    boolean jsonResponse;

    @Builder.Default
    Duration timeout = DEFAULT_TIMEOUT;

    public static GenerationSettings defaults() {
        return GenerationSettings.builder().build();
    }
}
