package com.phillippitts.spoofstream.exception;

/**
 * Thrown when an {@code audio_chunk} declares an encoding other than {@code base64} or {@code json}.
 */
public class UnsupportedAudioEncodingException extends SpoofStreamException {

    private final String encoding;

    public UnsupportedAudioEncodingException(String encoding) {
        super("Unsupported encoding: " + encoding);
        this.encoding = encoding;
    }

    public String getEncoding() {
        return encoding;
    }
}
