package com.phillippitts.spoofstream.service.session;

import com.phillippitts.spoofstream.config.properties.SessionProperties;
import com.phillippitts.spoofstream.config.properties.SessionProperties.DuplicatePolicy;
import com.phillippitts.spoofstream.exception.DuplicateConnectionException;
import com.phillippitts.spoofstream.protocol.OutboundMessages;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide map of client identity to live {@link ConnectionSession}.
 *
 * <p>This is the only structure shared between connections. Insertion happens inside
 * {@link ConcurrentMap#compute}, so a session becomes visible to lookups and snapshots
 * only once it is ACTIVE. Removal is conditional on the entry still mapping to the
 * closing session, so a late close of an evicted session never removes its replacement.
 *
 * <p>The registry holds session handles only; window buffers never leave their sessions.
 */
@Component
public class ConnectionRegistry {

    private static final Logger LOG = LogManager.getLogger(ConnectionRegistry.class);

    private final ConcurrentMap<String, ConnectionSession> sessions = new ConcurrentHashMap<>();
    private final AtomicLong retiredDetections = new AtomicLong();
    private final AtomicLong acceptedTotal = new AtomicLong();
    private final DuplicatePolicy duplicatePolicy;
    private final Clock clock;
    private final Instant startedAt;

    @Autowired
    public ConnectionRegistry(SessionProperties props) {
        this(props.getDuplicatePolicy(), Clock.systemUTC());
    }

    public ConnectionRegistry(DuplicatePolicy duplicatePolicy, Clock clock) {
        this.duplicatePolicy = Objects.requireNonNull(duplicatePolicy, "duplicatePolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.startedAt = clock.instant();
    }

    /**
     * Registers a connecting session under {@code clientId} and activates it in one step.
     *
     * <p>With {@link DuplicatePolicy#REJECT_NEW} an identity that is already live fails the
     * attempt and leaves the existing session untouched. With
     * {@link DuplicatePolicy#EVICT_EXISTING} the existing session is sent an {@code error},
     * closed and replaced.
     *
     * @return false if the session was closed before it could be activated
     * @throws DuplicateConnectionException if the identity is live and the policy rejects newcomers
     */
    public boolean register(String clientId, ConnectionSession session) {
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(session, "session");

        session.setCloseListener(this::onSessionClosed);
        ConnectionSession[] evicted = new ConnectionSession[1];
        boolean[] activated = new boolean[1];
        sessions.compute(clientId, (id, current) -> {
            if (current != null && current != session) {
                if (duplicatePolicy == DuplicatePolicy.REJECT_NEW) {
                    throw new DuplicateConnectionException(id);
                }
                evicted[0] = current;
            }
            if (!session.activate(id)) {
                evicted[0] = null;
                return current;
            }
            activated[0] = true;
            return session;
        });

        if (!activated[0]) {
            return false;
        }
        acceptedTotal.incrementAndGet();

        if (evicted[0] != null) {
            ConnectionSession old = evicted[0];
            LOG.warn("Evicting existing session for clientId={} (transport={})", clientId, old.transportId());
            try {
                old.send(OutboundMessages.error("Connection replaced by a new session with the same client_id"));
            } catch (RuntimeException e) {
                LOG.debug("Could not notify evicted session {}: {}", old.transportId(), e.toString());
            }
            old.close("evicted");
        }
        LOG.info("Client registered: clientId={}, live={}", clientId, sessions.size());
        return true;
    }

    /**
     * Removes the entry for {@code clientId} if it still maps to {@code session}.
     * Idempotent.
     *
     * @return true if an entry was removed
     */
    public boolean remove(String clientId, ConnectionSession session) {
        if (clientId == null) {
            return false;
        }
        boolean removed = sessions.remove(clientId, session);
        if (removed) {
            LOG.debug("Client removed: clientId={}, live={}", clientId, sessions.size());
        }
        return removed;
    }

    private void onSessionClosed(ConnectionSession session) {
        remove(session.clientId(), session);
        retiredDetections.addAndGet(session.totalDetections());
    }

    public Optional<ConnectionSession> find(String clientId) {
        return Optional.ofNullable(sessions.get(clientId));
    }

    public int size() {
        return sessions.size();
    }

    /** Connections accepted since startup, including closed ones. */
    public long acceptedTotal() {
        return acceptedTotal.get();
    }

    public Collection<ConnectionSession> sessions() {
        return List.copyOf(sessions.values());
    }

    /**
     * Weakly consistent aggregate: every session live for the whole call is included;
     * sessions opening or closing concurrently may or may not be.
     */
    public RegistrySnapshot snapshot() {
        Map<String, SessionStats> perConnection = new LinkedHashMap<>();
        long liveDetections = 0;
        for (Map.Entry<String, ConnectionSession> e : sessions.entrySet()) {
            SessionStats stats = e.getValue().stats();
            perConnection.put(e.getKey(), stats);
            liveDetections += stats.totalDetections();
        }
        double uptime = Duration.between(startedAt, clock.instant()).toMillis() / 1000.0;
        return new RegistrySnapshot(perConnection.size(), liveDetections + retiredDetections.get(),
                uptime, perConnection);
    }

    /**
     * Closes every live session. Invoked on server shutdown.
     */
    @PreDestroy
    public void drain() {
        List<ConnectionSession> live = new ArrayList<>(sessions.values());
        if (live.isEmpty()) {
            return;
        }
        LOG.info("Draining {} live connection(s)", live.size());
        for (ConnectionSession s : live) {
            try {
                s.close("server shutdown");
            } catch (RuntimeException e) {
                LOG.warn("Error closing session {} during drain: {}", s.clientId(), e.toString());
            }
        }
    }
}
