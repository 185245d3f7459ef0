package com.phillippitts.spoofstream.service.audio;

import com.phillippitts.spoofstream.exception.UnsupportedAudioEncodingException;

import java.util.Locale;

/**
 * Wire encodings accepted for {@code audio_chunk.audio_data}.
 */
public enum AudioEncoding {

    /** Base64 of raw little-endian IEEE-754 float32 bytes. */
    BASE64("base64"),

    /** JSON array of numbers (native array or a string holding one). */
    JSON("json");

    private final String wireName;

    AudioEncoding(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire tag, ignoring case.
     *
     * @param tag encoding tag from the client
     * @return matching encoding
     * @throws UnsupportedAudioEncodingException if the tag is null or unknown
     */
    public static AudioEncoding fromWireName(String tag) {
        if (tag != null) {
            String normalized = tag.trim().toLowerCase(Locale.ROOT);
            for (AudioEncoding e : values()) {
                if (e.wireName.equals(normalized)) {
                    return e;
                }
            }
        }
        throw new UnsupportedAudioEncodingException(String.valueOf(tag));
    }
}
