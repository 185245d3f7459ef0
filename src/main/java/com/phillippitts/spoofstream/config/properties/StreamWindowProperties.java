package com.phillippitts.spoofstream.config.properties;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Default windowing parameters applied to every new connection.
 * Clients may override them per connection with a {@code config} message.
 *
 * <p>Example application.properties:
 * <pre>
 * stream.window.sample-rate=16000
 * stream.window.chunk-duration=1.0
 * stream.window.overlap-duration=0.5
 * stream.window.min-duration=1.0
 * </pre>
 *
 * @param sampleRate      expected sample rate until the first chunk commits one
 * @param chunkDuration   window length in seconds
 * @param overlapDuration seconds shared between consecutive windows (must be shorter than the window)
 * @param minDuration     seconds of audio required before the first window
 */
@ConfigurationProperties(prefix = "stream.window")
@Validated
public record StreamWindowProperties(
        @Positive(message = "Sample rate must be positive")
        @DefaultValue("16000") int sampleRate,

        @Positive(message = "Chunk duration must be positive")
        @DefaultValue("1.0") double chunkDuration,

        @DecimalMin(value = "0.0", message = "Overlap duration must not be negative")
        @DefaultValue("0.5") double overlapDuration,

        @DecimalMin(value = "0.0", message = "Minimum duration must not be negative")
        @DefaultValue("1.0") double minDuration
) {
    @ConstructorBinding
    public StreamWindowProperties {
    }

    /**
     * Default constructor with standard values (1 s windows, 0.5 s overlap at 16 kHz).
     */
    public StreamWindowProperties() {
        this(16_000, 1.0, 0.5, 1.0);
    }
}
