package com.phillippitts.spoofstream.service.session;

import com.phillippitts.spoofstream.config.properties.SessionProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Operator policy: closes sessions that have received nothing for
 * {@code stream.session.idle-timeout-ms}. Disabled when the timeout is 0 (default);
 * the protocol itself never closes idle connections.
 */
@Component
public class IdleSessionReaper {

    private static final Logger LOG = LogManager.getLogger(IdleSessionReaper.class);

    private final ConnectionRegistry registry;
    private final long idleTimeoutMs;
    private final Clock clock;

    @Autowired
    public IdleSessionReaper(ConnectionRegistry registry, SessionProperties props) {
        this(registry, props.getIdleTimeoutMs(), Clock.systemUTC());
    }

    IdleSessionReaper(ConnectionRegistry registry, long idleTimeoutMs, Clock clock) {
        this.registry = registry;
        this.idleTimeoutMs = idleTimeoutMs;
        this.clock = clock;
    }

    /**
     * @return number of sessions closed
     */
    @Scheduled(fixedDelayString = "${stream.session.reaper-interval-ms:30000}")
    public int reap() {
        if (idleTimeoutMs <= 0) {
            return 0;
        }
        long now = clock.millis();
        int closed = 0;
        for (ConnectionSession session : registry.sessions()) {
            long idle = now - session.lastActivityMillis();
            if (idle >= idleTimeoutMs && session.close("idle timeout")) {
                LOG.info("Closed idle session clientId={} after {} ms", session.clientId(), idle);
                closed++;
            }
        }
        return closed;
    }
}
