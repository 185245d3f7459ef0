package com.phillippitts.spoofstream.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for connection admission and idle handling.
 */
@Validated
@ConfigurationProperties(prefix = "stream.session")
public class SessionProperties {

    /**
     * What happens when a connect claims an identity that is already live.
     */
    public enum DuplicatePolicy {
        /** First registrant wins; the new attempt is refused. */
        REJECT_NEW,
        /** The live session is closed and replaced by the newcomer. */
        EVICT_EXISTING
    }

    @NotNull
    private final DuplicatePolicy duplicatePolicy;

    /**
     * Close sessions that have received nothing for this long. 0 disables the reaper;
     * the core never closes idle connections on its own.
     */
    @Min(0)
    private final long idleTimeoutMs;

    /** How often the idle reaper scans the registry. */
    @Min(1000)
    private final long reaperIntervalMs;

    @ConstructorBinding
    public SessionProperties(DuplicatePolicy duplicatePolicy, Long idleTimeoutMs, Long reaperIntervalMs) {
        this.duplicatePolicy = duplicatePolicy == null ? DuplicatePolicy.REJECT_NEW : duplicatePolicy;
        this.idleTimeoutMs = idleTimeoutMs == null ? 0L : idleTimeoutMs;
        this.reaperIntervalMs = reaperIntervalMs == null ? 30_000L : reaperIntervalMs;
    }

    /**
     * Convenience constructor for tests (idle reaping disabled).
     */
    public SessionProperties(DuplicatePolicy duplicatePolicy) {
        this(duplicatePolicy, 0L, 30_000L);
    }

    public DuplicatePolicy getDuplicatePolicy() {
        return duplicatePolicy;
    }

    public long getIdleTimeoutMs() {
        return idleTimeoutMs;
    }

    public long getReaperIntervalMs() {
        return reaperIntervalMs;
    }
}
