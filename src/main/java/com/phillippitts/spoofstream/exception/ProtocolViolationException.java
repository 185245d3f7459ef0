package com.phillippitts.spoofstream.exception;

/**
 * Thrown for inbound frames that are not valid protocol messages: unparseable JSON,
 * a missing or unrecognized {@code type}, or a message not allowed in the current phase.
 */
public class ProtocolViolationException extends SpoofStreamException {

    private final String messageType;

    public ProtocolViolationException(String messageType, String detail) {
        super(detail);
        this.messageType = messageType;
    }

    public ProtocolViolationException(String messageType, String detail, Throwable cause) {
        super(detail, cause);
        this.messageType = messageType;
    }

    public String getMessageType() {
        return messageType;
    }
}
