package com.phillippitts.spoofstream.config;

import com.phillippitts.spoofstream.config.properties.WebSocketProperties;
import com.phillippitts.spoofstream.presentation.websocket.DetectionWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the detection endpoint and sizes the container's frame buffers for base64 audio.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final DetectionWebSocketHandler handler;
    private final WebSocketProperties props;

    public WebSocketConfig(DetectionWebSocketHandler handler, WebSocketProperties props) {
        this.handler = handler;
        this.props = props;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, props.getPath())
                .setAllowedOrigins(props.getAllowedOrigins().toArray(String[]::new));
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(props.getMaxTextMessageBufferSize());
        container.setAsyncSendTimeout((long) props.getSendTimeLimitMs());
        return container;
    }
}
