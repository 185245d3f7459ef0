package com.phillippitts.spoofstream.presentation.websocket;

import com.phillippitts.spoofstream.exception.TransportFailureException;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSocketMessageSinkTest {

    private static WebSocketSession transport() {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("ws-1");
        when(session.isOpen()).thenReturn(true);
        return session;
    }

    @Test
    void sendLimitExceededIsTransportFailure() throws Exception {
        WebSocketSession ws = transport();
        SessionLimitExceededException limit =
                new SessionLimitExceededException("Buffer size limit exceeded", CloseStatus.SESSION_NOT_RELIABLE);
        doThrow(limit).when(ws).sendMessage(any());

        assertThatThrownBy(() -> new WebSocketMessageSink(ws).send("{}"))
                .isInstanceOf(TransportFailureException.class)
                .hasCause(limit);
    }

    @Test
    void ioFailureIsTransportFailure() throws Exception {
        WebSocketSession ws = transport();
        doThrow(new IOException("broken pipe")).when(ws).sendMessage(any(TextMessage.class));

        assertThatThrownBy(() -> new WebSocketMessageSink(ws).send("{}"))
                .isInstanceOf(TransportFailureException.class);
    }

    @Test
    void closeSkipsTransportThatIsAlreadyClosed() throws Exception {
        WebSocketSession ws = transport();
        when(ws.isOpen()).thenReturn(false);

        new WebSocketMessageSink(ws).close("done");

        verify(ws, never()).close(any(CloseStatus.class));
    }
}
