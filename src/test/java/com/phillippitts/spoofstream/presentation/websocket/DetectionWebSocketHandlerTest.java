package com.phillippitts.spoofstream.presentation.websocket;

import com.phillippitts.spoofstream.config.properties.DetectionProperties;
import com.phillippitts.spoofstream.config.properties.SessionProperties.DuplicatePolicy;
import com.phillippitts.spoofstream.config.properties.StreamWindowProperties;
import com.phillippitts.spoofstream.config.properties.WebSocketProperties;
import com.phillippitts.spoofstream.service.audio.SampleDecoder;
import com.phillippitts.spoofstream.service.detection.DetectionInvoker;
import com.phillippitts.spoofstream.service.session.ConnectionRegistry;
import com.phillippitts.spoofstream.service.session.StreamProtocolHandler;
import com.phillippitts.spoofstream.testutil.EventCapturingPublisher;
import com.phillippitts.spoofstream.testutil.FakeAudioClassifier;
import com.phillippitts.spoofstream.testutil.SyncExecutor;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;
import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DetectionWebSocketHandlerTest {

    private ConnectionRegistry registry;
    private DetectionWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry(DuplicatePolicy.REJECT_NEW, Clock.systemUTC());
        DetectionInvoker invoker = new DetectionInvoker(new FakeAudioClassifier(), new SyncExecutor(),
                new DetectionProperties(), null, new EventCapturingPublisher(), () -> true);
        StreamProtocolHandler protocol = new StreamProtocolHandler(new SampleDecoder(8_000, 48_000), invoker,
                registry, new StreamWindowProperties(), new DetectionProperties(), null);
        handler = new DetectionWebSocketHandler(protocol, new WebSocketProperties());
    }

    private static WebSocketSession transport(String id) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenReturn(true);
        return session;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static List<String> sentFrames(WebSocketSession session) throws IOException {
        ArgumentCaptor<WebSocketMessage> captor = ArgumentCaptor.forClass(WebSocketMessage.class);
        verify(session, atLeastOnce()).sendMessage(captor.capture());
        return captor.getAllValues().stream().map(m -> ((TextMessage) m).getPayload()).toList();
    }

    @Test
    void routesFramesToProtocolAndRepliesOnSameTransport() throws Exception {
        WebSocketSession ws = transport("ws-1");
        handler.afterConnectionEstablished(ws);

        handler.handleTextMessage(ws, new TextMessage("{\"type\":\"connect\",\"client_id\":\"alice\"}"));
        handler.handleTextMessage(ws, new TextMessage("{\"type\":\"ping\"}"));

        List<String> frames = sentFrames(ws);
        assertThat(frames).hasSize(2);
        assertThat(new JSONObject(frames.get(0)).getString("type")).isEqualTo("connected");
        assertThat(new JSONObject(frames.get(1)).getString("type")).isEqualTo("pong");
        assertThat(handler.openTransports()).isEqualTo(1);
    }

    @Test
    void transportCloseUnregistersClient() throws Exception {
        WebSocketSession ws = transport("ws-1");
        handler.afterConnectionEstablished(ws);
        handler.handleTextMessage(ws, new TextMessage("{\"type\":\"connect\",\"client_id\":\"alice\"}"));

        handler.afterConnectionClosed(ws, CloseStatus.GOING_AWAY);
        handler.afterConnectionClosed(ws, CloseStatus.GOING_AWAY);

        assertThat(registry.find("alice")).isEmpty();
        assertThat(handler.openTransports()).isZero();
    }

    @Test
    void transportErrorClosesSession() throws Exception {
        WebSocketSession ws = transport("ws-1");
        handler.afterConnectionEstablished(ws);
        handler.handleTextMessage(ws, new TextMessage("{\"type\":\"connect\",\"client_id\":\"alice\"}"));

        handler.handleTransportError(ws, new IOException("reset by peer"));

        assertThat(registry.find("alice")).isEmpty();
        verify(ws).close(any(CloseStatus.class));
    }

    @Test
    void failedWriteEndsConnection() throws Exception {
        WebSocketSession ws = transport("ws-1");
        doThrow(new IOException("broken pipe")).when(ws).sendMessage(any());
        handler.afterConnectionEstablished(ws);

        handler.handleTextMessage(ws, new TextMessage("{\"type\":\"connect\",\"client_id\":\"alice\"}"));

        assertThat(registry.find("alice")).isEmpty();
    }

    @Test
    void slowClientOverSendLimitIsDisconnected() throws Exception {
        WebSocketSession ws = transport("ws-1");
        doNothing()
                .doThrow(new SessionLimitExceededException("Send time limit exceeded", CloseStatus.SESSION_NOT_RELIABLE))
                .when(ws).sendMessage(any());
        handler.afterConnectionEstablished(ws);
        handler.handleTextMessage(ws, new TextMessage("{\"type\":\"connect\",\"client_id\":\"alice\"}"));
        assertThat(registry.find("alice")).isPresent();

        handler.handleTextMessage(ws, new TextMessage("{\"type\":\"ping\"}"));

        assertThat(registry.find("alice")).isEmpty();
        verify(ws).close(any(CloseStatus.class));
    }

    @Test
    void framesForUnknownTransportAreIgnored() throws Exception {
        WebSocketSession ws = transport("ghost");

        handler.handleTextMessage(ws, new TextMessage("{\"type\":\"ping\"}"));

        assertThat(handler.openTransports()).isZero();
    }
}
