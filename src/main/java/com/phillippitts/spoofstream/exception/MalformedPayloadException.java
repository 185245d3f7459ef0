package com.phillippitts.spoofstream.exception;

/**
 * Thrown when an inbound audio payload cannot be decoded: invalid base64, a byte length
 * that is not a multiple of the float width, non-numeric JSON elements, non-finite samples,
 * or a declared sample rate outside the accepted range.
 */
public class MalformedPayloadException extends SpoofStreamException {

    private final int payloadSize;
    private final String reason;

    public MalformedPayloadException(String reason) {
        super("Malformed audio payload: " + reason);
        this.payloadSize = 0;
        this.reason = reason;
    }

    public MalformedPayloadException(int payloadSize, String reason) {
        super("Malformed audio payload (" + payloadSize + " bytes): " + reason);
        this.payloadSize = payloadSize;
        this.reason = reason;
    }

    public MalformedPayloadException(String reason, Throwable cause) {
        super("Malformed audio payload: " + reason, cause);
        this.payloadSize = 0;
        this.reason = reason;
    }

    public int getPayloadSize() {
        return payloadSize;
    }

    public String getReason() {
        return reason;
    }
}
