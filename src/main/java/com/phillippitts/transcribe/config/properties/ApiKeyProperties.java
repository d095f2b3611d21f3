package com.phillippitts.transcribe.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Pre-shared API keys accepted on the transcription endpoint.
 * Binds to {@code security.api-keys} (comma separated).
 *
 * @param apiKeys accepted keys; blanks are dropped
 */
@ConfigurationProperties(prefix = "security")
public record ApiKeyProperties(@DefaultValue List<String> apiKeys) {

    public ApiKeyProperties {
        apiKeys = apiKeys == null ? List.of() : apiKeys.stream()
                .map(String::trim)
                .filter(k -> !k.isEmpty())
                .toList();
    }
}
