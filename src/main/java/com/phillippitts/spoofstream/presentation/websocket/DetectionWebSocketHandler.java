package com.phillippitts.spoofstream.presentation.websocket;

import com.phillippitts.spoofstream.config.properties.WebSocketProperties;
import com.phillippitts.spoofstream.service.session.ConnectionSession;
import com.phillippitts.spoofstream.service.session.StreamProtocolHandler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket endpoint for streaming detection. Maps transport events onto the
 * {@link StreamProtocolHandler}; it holds no protocol state of its own beyond the
 * transport-id to session lookup.
 */
@Component
public class DetectionWebSocketHandler extends TextWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(DetectionWebSocketHandler.class);

    private final StreamProtocolHandler protocol;
    private final WebSocketProperties props;
    private final Map<String, ConnectionSession> byTransport = new ConcurrentHashMap<>();

    public DetectionWebSocketHandler(StreamProtocolHandler protocol, WebSocketProperties props) {
        this.protocol = protocol;
        this.props = props;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession concurrent = new ConcurrentWebSocketSessionDecorator(
                session, props.getSendTimeLimitMs(), props.getSendBufferSizeLimit());
        ConnectionSession cs = protocol.open(session.getId(), new WebSocketMessageSink(concurrent));
        byTransport.put(session.getId(), cs);
        LOG.info("WebSocket opened: transport={}, remote={}", session.getId(), session.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ConnectionSession cs = byTransport.get(session.getId());
        if (cs == null) {
            LOG.debug("Frame for unknown transport {}", session.getId());
            return;
        }
        protocol.onMessage(cs, message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        ConnectionSession cs = byTransport.remove(session.getId());
        if (cs != null) {
            protocol.onTransportError(cs, exception);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ConnectionSession cs = byTransport.remove(session.getId());
        if (cs != null) {
            protocol.onTransportClosed(cs, "transport closed (" + status.getCode() + ")");
        }
    }

    /** Open transports, including those that have not registered an identity yet. */
    public int openTransports() {
        return byTransport.size();
    }
}
