package com.phillippitts.spoofstream.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Transport settings for the detection WebSocket endpoint.
 */
@ConfigurationProperties(prefix = "websocket")
@Validated
public class WebSocketProperties {

    @NotBlank
    private String path = "/ws/detect";

    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

    /** Largest inbound text frame; base64 audio of several seconds fits comfortably. */
    @Positive
    private int maxTextMessageBufferSize = 2 * 1024 * 1024;

    /** Maximum time a single outbound send may block before the session is closed. */
    @Positive
    private int sendTimeLimitMs = 10_000;

    /** Maximum bytes buffered for a slow client before the session is closed. */
    @Positive
    private int sendBufferSizeLimit = 512 * 1024;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    public int getMaxTextMessageBufferSize() {
        return maxTextMessageBufferSize;
    }

    public void setMaxTextMessageBufferSize(int maxTextMessageBufferSize) {
        this.maxTextMessageBufferSize = maxTextMessageBufferSize;
    }

    public int getSendTimeLimitMs() {
        return sendTimeLimitMs;
    }

    public void setSendTimeLimitMs(int sendTimeLimitMs) {
        this.sendTimeLimitMs = sendTimeLimitMs;
    }

    public int getSendBufferSizeLimit() {
        return sendBufferSizeLimit;
    }

    public void setSendBufferSizeLimit(int sendBufferSizeLimit) {
        this.sendBufferSizeLimit = sendBufferSizeLimit;
    }
}
