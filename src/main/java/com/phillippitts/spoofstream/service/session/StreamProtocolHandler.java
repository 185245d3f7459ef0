package com.phillippitts.spoofstream.service.session;

import com.phillippitts.spoofstream.config.properties.DetectionProperties;
import com.phillippitts.spoofstream.config.properties.StreamWindowProperties;
import com.phillippitts.spoofstream.domain.DetectionResult;
import com.phillippitts.spoofstream.domain.SampleSequence;
import com.phillippitts.spoofstream.exception.DuplicateConnectionException;
import com.phillippitts.spoofstream.exception.InferenceException;
import com.phillippitts.spoofstream.exception.ProtocolViolationException;
import com.phillippitts.spoofstream.exception.SpoofStreamException;
import com.phillippitts.spoofstream.exception.TransportFailureException;
import com.phillippitts.spoofstream.protocol.InboundMessage;
import com.phillippitts.spoofstream.protocol.InboundMessageType;
import com.phillippitts.spoofstream.protocol.OutboundMessages;
import com.phillippitts.spoofstream.protocol.ProtocolCodec;
import com.phillippitts.spoofstream.service.audio.AudioEncoding;
import com.phillippitts.spoofstream.service.audio.SampleDecoder;
import com.phillippitts.spoofstream.service.detection.DetectionInvoker;
import com.phillippitts.spoofstream.service.metrics.DetectionMetrics;
import com.phillippitts.spoofstream.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives the per-connection protocol state machine.
 *
 * <p>Transport adapters call {@link #open}, {@link #onMessage}, {@link #onTransportClosed}
 * and {@link #onTransportError}; everything else (identity, registration, decoding,
 * windowing, detection, replies) happens here.
 *
 * <p>Every inbound message is processed under the session's lock, so windows of one
 * connection are detected and answered strictly in arrival order while different
 * connections proceed in parallel. Domain failures become exactly one {@code error}
 * reply and leave the session ACTIVE; only a duplicate identity at connect time or a
 * failed transport write ends the connection.
 */
@Service
public class StreamProtocolHandler {

    private static final Logger LOG = LogManager.getLogger(StreamProtocolHandler.class);

    private final SampleDecoder decoder;
    private final DetectionInvoker invoker;
    private final ConnectionRegistry registry;
    private final StreamWindowProperties windowDefaults;
    private final DetectionProperties detectionProps;
    private final DetectionMetrics metrics;
    private final Clock clock;

    @Autowired
    public StreamProtocolHandler(SampleDecoder decoder,
                                 DetectionInvoker invoker,
                                 ConnectionRegistry registry,
                                 StreamWindowProperties windowDefaults,
                                 DetectionProperties detectionProps,
                                 DetectionMetrics metrics) {
        this(decoder, invoker, registry, windowDefaults, detectionProps, metrics, Clock.systemUTC());
    }

    public StreamProtocolHandler(SampleDecoder decoder,
                                 DetectionInvoker invoker,
                                 ConnectionRegistry registry,
                                 StreamWindowProperties windowDefaults,
                                 DetectionProperties detectionProps,
                                 DetectionMetrics metrics,
                                 Clock clock) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.windowDefaults = Objects.requireNonNull(windowDefaults, "windowDefaults");
        this.detectionProps = Objects.requireNonNull(detectionProps, "detectionProps");
        this.metrics = metrics;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates a CONNECTING session for a newly accepted transport.
     */
    public ConnectionSession open(String transportId, MessageSink sink) {
        ConnectionSession.WindowSettings initial = new ConnectionSession.WindowSettings(
                windowDefaults.sampleRate(),
                windowDefaults.chunkDuration(),
                windowDefaults.overlapDuration(),
                windowDefaults.minDuration());
        ConnectionSession session = new ConnectionSession(transportId, sink, initial, clock);
        LOG.debug("Transport accepted: {}", transportId);
        return session;
    }

    /**
     * Processes one inbound text frame. Frames arriving after the session started closing
     * are ignored.
     */
    public void onMessage(ConnectionSession session, String text) {
        SessionPhase phase = session.phase();
        if (phase == SessionPhase.CLOSING || phase == SessionPhase.CLOSED) {
            LOG.debug("Ignoring frame for {} session {}", phase, session.transportId());
            return;
        }

        ReentrantLock lock = session.processingLock();
        lock.lock();
        try (ConnectionLogContext ignored = ConnectionLogContext.bind(session)) {
            if (!isOpenForMessages(session)) {
                return;
            }
            session.touch();
            session.recordMessage();
            try {
                InboundMessage message = ProtocolCodec.decode(text);
                if (session.phase() == SessionPhase.CONNECTING) {
                    if (!establish(session, message) || message.type() == InboundMessageType.CONNECT) {
                        return;
                    }
                }
                dispatch(session, message);
            } catch (TransportFailureException e) {
                LOG.warn("Transport failure for {}: {}", session.transportId(), e.getMessage());
                session.close("transport failure");
            } catch (SpoofStreamException e) {
                replyError(session, e);
            } catch (RuntimeException e) {
                LOG.error("Unexpected error processing message for {}", session.transportId(), e);
                replyError(session, "Internal error", "internal");
            }
        } finally {
            lock.unlock();
        }
    }

    public void onTransportClosed(ConnectionSession session, String reason) {
        session.close(reason == null ? "transport closed" : reason);
    }

    public void onTransportError(ConnectionSession session, Throwable error) {
        LOG.warn("Transport error for {} ({}): {}", session.transportId(), session.clientId(),
                error == null ? "unknown" : error.toString());
        session.close("transport error");
    }

    private static boolean isOpenForMessages(ConnectionSession session) {
        SessionPhase phase = session.phase();
        return phase == SessionPhase.CONNECTING || phase == SessionPhase.ACTIVE;
    }

    /**
     * Handles the first message of a connecting session. A {@code connect} registers its
     * {@code client_id}; any other message registers a generated identity and is then
     * processed normally.
     *
     * @return false if the connection attempt ended
     */
    private boolean establish(ConnectionSession session, InboundMessage first) {
        String requested = first instanceof InboundMessage.Connect c ? c.clientId() : null;
        if (requested == null && first instanceof InboundMessage.AudioChunk a) {
            requested = a.clientId();
        }
        String clientId = requested == null || requested.isBlank() ? UUID.randomUUID().toString() : requested;

        boolean registered;
        try {
            registered = registry.register(clientId, session);
        } catch (DuplicateConnectionException e) {
            LOG.warn("Rejected duplicate connect: clientId={}", LogSanitizer.clean(clientId));
            countError(e);
            try {
                session.send(OutboundMessages.error(e.getMessage()));
            } finally {
                session.close("duplicate client_id");
            }
            return false;
        }
        if (!registered) {
            return false;
        }
        ConnectionLogContext.identify(clientId);
        session.send(OutboundMessages.connected(clientId));
        LOG.info("Client connected: clientId={}, transport={}", LogSanitizer.clean(clientId), session.transportId());
        return true;
    }

    private void dispatch(ConnectionSession session, InboundMessage message) {
        switch (message.type()) {
            case CONNECT -> throw new ProtocolViolationException(InboundMessageType.CONNECT.wireName(),
                    "Already connected as " + session.clientId());
            case AUDIO_CHUNK -> handleAudio(session, (InboundMessage.AudioChunk) message);
            case CONFIG -> handleConfig(session, (InboundMessage.Config) message);
            case PING -> session.send(OutboundMessages.pong());
            case STATS -> session.send(OutboundMessages.stats(session.stats()));
        }
    }

    private void handleAudio(ConnectionSession session, InboundMessage.AudioChunk chunk) {
        String encoding = chunk.encoding() == null ? AudioEncoding.BASE64.wireName() : chunk.encoding();
        int rate = chunk.sampleRate() == null ? session.currentSampleRate() : chunk.sampleRate();
        SampleDecoder.checkSampleRate(rate, session.committedSampleRate());

        SampleSequence decoded = decoder.decode(chunk.audioData(), encoding, rate);
        session.commitSampleRate(rate);
        session.recordChunk();

        List<float[]> windows = session.buffer().feed(decoded.samples());
        for (float[] window : windows) {
            if (!session.isActive()) {
                return;
            }
            try {
                detectAndSend(session, window, rate);
            } catch (TransportFailureException e) {
                throw e;
            } catch (SpoofStreamException e) {
                // The window is dropped; later windows are still detected.
                replyError(session, e);
            }
        }
    }

    private void detectAndSend(ConnectionSession session, float[] window, int rate) {
        long index = session.nextWindowIndex();
        Instant dispatchedAt = clock.instant();
        Future<DetectionResult> future = invoker.submit(session.clientId(), window, rate);
        session.setInFlight(future);
        DetectionResult result;
        try {
            if (!session.isActive()) {
                future.cancel(true);
                return;
            }
            result = invoker.await(future, session.clientId(), window.length);
        } catch (CancellationException e) {
            if (!session.isActive()) {
                LOG.debug("Detection cancelled for closing session {}", session.transportId());
                return;
            }
            throw new InferenceException("Detection cancelled", invoker.getClassifierName(), e);
        } finally {
            session.clearInFlight();
        }
        session.recordDetection();
        session.send(OutboundMessages.detectionResult(session.clientId(), index, result, dispatchedAt,
                detectionProps.isIncludeLogits()));
    }

    private void handleConfig(ConnectionSession session, InboundMessage.Config config) {
        if (config.isEmpty()) {
            return;
        }
        ConnectionSession.WindowSettings current = session.settings();
        int rate = current.sampleRate();
        if (config.sampleRate() != null) {
            rate = config.sampleRate();
            decoder.validateSampleRate(rate);
            SampleDecoder.checkSampleRate(rate, session.committedSampleRate());
        }
        ConnectionSession.WindowSettings next = new ConnectionSession.WindowSettings(
                rate,
                config.chunkDuration() != null ? config.chunkDuration() : current.chunkDuration(),
                config.overlapDuration() != null ? config.overlapDuration() : current.overlapDuration(),
                config.minDuration() != null ? config.minDuration() : current.minDuration());
        session.applySettings(next);
        LOG.debug("Window settings updated: {}", next);
    }

    private void replyError(ConnectionSession session, SpoofStreamException e) {
        if (e instanceof ProtocolViolationException) {
            session.recordViolation();
        }
        if (e instanceof InferenceException) {
            LOG.debug("Reporting inference failure to client: {}", e.getMessage());
        } else {
            LOG.warn("Rejected message from {}: {}", session.clientId() == null ? session.transportId()
                    : LogSanitizer.clean(session.clientId()), e.getMessage());
        }
        replyError(session, e.getMessage(), e.getClass().getSimpleName());
    }

    private void replyError(ConnectionSession session, String message, String errorType) {
        if (metrics != null) {
            metrics.incrementProtocolError(errorType);
        }
        try {
            session.send(OutboundMessages.error(message));
        } catch (TransportFailureException te) {
            LOG.warn("Could not deliver error to {}: {}", session.transportId(), te.getMessage());
            session.close("transport failure");
        }
    }

    private void countError(SpoofStreamException e) {
        if (metrics != null) {
            metrics.incrementProtocolError(e.getClass().getSimpleName());
        }
    }
}
