package com.phillippitts.spoofstream.service.session;

import com.phillippitts.spoofstream.exception.TransportFailureException;
import com.phillippitts.spoofstream.service.audio.window.WindowSpec;
import com.phillippitts.spoofstream.service.audio.window.WindowingBuffer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * State of one client connection: identity, lifecycle phase, counters, window settings
 * and the {@link WindowingBuffer} it exclusively owns.
 *
 * <p><b>Thread Safety:</b> message processing holds {@link #processingLock()}, which makes
 * "window complete → detect → send" a per-connection serialization point. Counters and
 * the phase are atomic so stats snapshots and {@link #close(String)} may run from any
 * thread. The buffer is only mutated under the lock; {@link #stats()} reads its size
 * without it and may be one message behind.
 */
public final class ConnectionSession {

    private static final Logger LOG = LogManager.getLogger(ConnectionSession.class);

    private final String transportId;
    private final MessageSink sink;
    private final Clock clock;
    private final Instant connectedAt;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicReference<SessionPhase> phase = new AtomicReference<>(SessionPhase.CONNECTING);

    private final AtomicLong totalMessages = new AtomicLong();
    private final AtomicLong totalDetections = new AtomicLong();
    private final AtomicLong totalChunksReceived = new AtomicLong();
    private final AtomicLong protocolViolations = new AtomicLong();
    private final AtomicLong windowIndex = new AtomicLong();

    private volatile String clientId;
    private volatile long lastActivityMillis;
    private volatile Future<?> inFlight;
    private volatile Consumer<ConnectionSession> closeListener;

    private final WindowingBuffer buffer;
    private volatile WindowSettings settings;
    private volatile int committedSampleRate = 0;

    /**
     * Durations in seconds plus the rate they are converted at.
     */
    public record WindowSettings(int sampleRate, double chunkDuration, double overlapDuration, double minDuration) {

        WindowSpec toSpec() {
            return WindowSpec.fromDurations(chunkDuration, overlapDuration, minDuration, sampleRate);
        }
    }

    /**
     * @throws com.phillippitts.spoofstream.exception.InvalidWindowConfigException if the
     *         initial settings cannot produce advancing windows
     */
    public ConnectionSession(String transportId, MessageSink sink, WindowSettings initial, Clock clock) {
        this.transportId = Objects.requireNonNull(transportId, "transportId");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.settings = Objects.requireNonNull(initial, "initial");
        this.buffer = new WindowingBuffer(initial.toSpec());
        this.connectedAt = clock.instant();
        this.lastActivityMillis = clock.millis();
    }

    public String transportId() {
        return transportId;
    }

    /** Registered identity, or {@code null} while connecting. */
    public String clientId() {
        return clientId;
    }

    public SessionPhase phase() {
        return phase.get();
    }

    public boolean isActive() {
        return phase.get() == SessionPhase.ACTIVE;
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    public long lastActivityMillis() {
        return lastActivityMillis;
    }

    public long totalDetections() {
        return totalDetections.get();
    }

    public long protocolViolations() {
        return protocolViolations.get();
    }

    /**
     * Moves CONNECTING to ACTIVE under the given identity. Called by the registry while
     * it holds the map slot for {@code id}.
     *
     * @return false if the session is no longer connecting
     */
    boolean activate(String id) {
        Objects.requireNonNull(id, "id");
        if (!phase.compareAndSet(SessionPhase.CONNECTING, SessionPhase.ACTIVE)) {
            return false;
        }
        this.clientId = id;
        return true;
    }

    void setCloseListener(Consumer<ConnectionSession> listener) {
        this.closeListener = listener;
    }

    ReentrantLock processingLock() {
        return lock;
    }

    WindowingBuffer buffer() {
        return buffer;
    }

    WindowSettings settings() {
        return settings;
    }

    int committedSampleRate() {
        return committedSampleRate;
    }

    /** Rate used for the next chunk that does not declare one. */
    int currentSampleRate() {
        return settings.sampleRate();
    }

    /**
     * Replaces the window settings. Pending samples are kept and reinterpreted.
     *
     * @throws com.phillippitts.spoofstream.exception.InvalidWindowConfigException if the
     *         settings are invalid; nothing changes in that case
     */
    void applySettings(WindowSettings next) {
        WindowSpec spec = next.toSpec();
        buffer.reconfigure(spec);
        this.settings = next;
    }

    /**
     * Fixes the connection's sample rate on its first audio chunk, re-deriving window
     * lengths when the chunk's rate differs from the configured one.
     */
    void commitSampleRate(int rate) {
        if (committedSampleRate > 0) {
            return;
        }
        WindowSettings current = settings;
        if (current.sampleRate() != rate) {
            applySettings(new WindowSettings(rate, current.chunkDuration(), current.overlapDuration(),
                    current.minDuration()));
        }
        committedSampleRate = rate;
    }

    void touch() {
        lastActivityMillis = clock.millis();
    }

    void recordMessage() {
        totalMessages.incrementAndGet();
    }

    void recordChunk() {
        totalChunksReceived.incrementAndGet();
    }

    void recordDetection() {
        totalDetections.incrementAndGet();
    }

    void recordViolation() {
        protocolViolations.incrementAndGet();
    }

    long nextWindowIndex() {
        return windowIndex.getAndIncrement();
    }

    void setInFlight(Future<?> future) {
        this.inFlight = future;
    }

    void clearInFlight() {
        this.inFlight = null;
    }

    /**
     * Sends a frame if the transport is still open.
     *
     * @throws TransportFailureException if the write fails
     */
    void send(String text) {
        if (phase.get() == SessionPhase.CLOSED || !sink.isOpen()) {
            LOG.debug("Dropping outbound frame for closed connection {}", transportId);
            return;
        }
        sink.send(text);
    }

    public SessionStats stats() {
        WindowSettings s = settings;
        int pending = buffer.size();
        return new SessionStats(
                clientId,
                connectedAt,
                totalMessages.get(),
                totalDetections.get(),
                totalChunksReceived.get(),
                protocolViolations.get(),
                pending,
                s.sampleRate() <= 0 ? 0.0 : (double) pending / s.sampleRate(),
                s.sampleRate());
    }

    /**
     * Closes the session. Runs at most once regardless of how many exit paths call it:
     * the in-flight detection is cancelled, pending samples are discarded, the registry
     * is notified and the transport is closed.
     *
     * @param reason why the session is closing, for logs and the transport close frame
     * @return true if this call performed the close
     */
    public boolean close(String reason) {
        SessionPhase previous;
        do {
            previous = phase.get();
            if (previous == SessionPhase.CLOSING || previous == SessionPhase.CLOSED) {
                return false;
            }
        } while (!phase.compareAndSet(previous, SessionPhase.CLOSING));

        Future<?> running = inFlight;
        if (running != null) {
            running.cancel(true);
        }

        lock.lock();
        try {
            buffer.discard();
            phase.set(SessionPhase.CLOSED);
        } finally {
            lock.unlock();
        }

        Consumer<ConnectionSession> listener = closeListener;
        if (listener != null) {
            listener.accept(this);
        }
        try {
            sink.close(reason);
        } catch (RuntimeException e) {
            LOG.debug("Transport close failed for {}: {}", transportId, e.toString());
        }
        LOG.info("Connection closed: clientId={}, transport={}, reason={}, detections={}",
                clientId, transportId, reason, totalDetections.get());
        return true;
    }
}
