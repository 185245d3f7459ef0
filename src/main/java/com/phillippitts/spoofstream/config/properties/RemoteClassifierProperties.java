package com.phillippitts.spoofstream.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the HTTP inference server backing the remote classifier.
 * Binds to properties prefixed with "classifier.remote".
 *
 * <p>Example application.properties:
 * <pre>
 * classifier.remote.base-url=http://localhost:8001
 * classifier.remote.model-id=Speech-Arena-2025/DF_Arena_500M_V_1
 * classifier.remote.connect-timeout-ms=2000
 * classifier.remote.read-timeout-ms=8000
 * </pre>
 *
 * @param enabled          register the remote classifier bean
 * @param baseUrl          inference server root URL
 * @param modelId          model identifier forwarded with every request
 * @param connectTimeoutMs TCP connect timeout
 * @param readTimeoutMs    response read timeout
 */
@ConfigurationProperties(prefix = "classifier.remote")
@Validated
public record RemoteClassifierProperties(
        @DefaultValue("true") boolean enabled,

        @NotBlank(message = "Classifier base URL must not be blank")
        @DefaultValue("http://localhost:8001") String baseUrl,

        @NotBlank(message = "Model id must not be blank")
        @DefaultValue("Speech-Arena-2025/DF_Arena_500M_V_1") String modelId,

        @Positive(message = "Connect timeout must be positive")
        @DefaultValue("2000") int connectTimeoutMs,

        @Positive(message = "Read timeout must be positive")
        @DefaultValue("8000") int readTimeoutMs
) {
    @ConstructorBinding
    public RemoteClassifierProperties {
    }

    public RemoteClassifierProperties() {
        this(true, "http://localhost:8001", "Speech-Arena-2025/DF_Arena_500M_V_1", 2_000, 8_000);
    }
}
