package com.phillippitts.spoofstream.presentation.websocket;

import com.phillippitts.spoofstream.exception.TransportFailureException;
import com.phillippitts.spoofstream.service.session.MessageSink;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

/**
 * {@link MessageSink} over a Spring {@link WebSocketSession}.
 *
 * <p>The wrapped session is expected to be a
 * {@link org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator}, since
 * eviction and shutdown may send from threads other than the connection's own. A send that
 * exceeds its time or buffer limit is a transport failure, so the slow client is closed.
 */
final class WebSocketMessageSink implements MessageSink {

    private final WebSocketSession session;

    WebSocketMessageSink(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public void send(String text) {
        try {
            session.sendMessage(new TextMessage(text));
        } catch (IOException | IllegalStateException | SessionLimitExceededException e) {
            throw new TransportFailureException(session.getId(), "Failed to send frame", e);
        }
    }

    @Override
    public void close(String reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.NORMAL.withReason(truncate(reason)));
        } catch (IOException e) {
            throw new TransportFailureException(session.getId(), "Failed to close transport", e);
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    // Close reasons are limited to 123 bytes by RFC 6455
    private static String truncate(String reason) {
        if (reason == null) {
            return null;
        }
        return reason.length() > 100 ? reason.substring(0, 100) : reason;
    }
}
