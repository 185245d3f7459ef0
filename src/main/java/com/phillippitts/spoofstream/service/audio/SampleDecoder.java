package com.phillippitts.spoofstream.service.audio;

import com.phillippitts.spoofstream.config.properties.AudioFormatProperties;
import com.phillippitts.spoofstream.domain.SampleSequence;
import com.phillippitts.spoofstream.exception.MalformedPayloadException;
import com.phillippitts.spoofstream.exception.SampleRateMismatchException;
import org.json.JSONArray;
import org.json.JSONException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.FloatBuffer;
import java.util.Base64;

/**
 * Converts wire-encoded audio payloads into {@link SampleSequence}s.
 *
 * <p>Stateless: no connection state is read or written, so one instance is shared by every
 * connection. No resampling is performed; the declared rate is only range-checked and passed
 * through for the window duration arithmetic.
 *
 * <p>Failure modes:
 * <ul>
 *   <li>{@link com.phillippitts.spoofstream.exception.UnsupportedAudioEncodingException} - unknown encoding tag</li>
 *   <li>{@link MalformedPayloadException} - empty payload, bad base64, byte length not a multiple of 4,
 *       non-numeric JSON element, NaN/Inf sample, or sample rate out of range</li>
 * </ul>
 */
@Component
public class SampleDecoder {

    /** Width of one little-endian float32 sample. */
    public static final int BYTES_PER_SAMPLE = Float.BYTES;

    private final int minSampleRate;
    private final int maxSampleRate;

    @Autowired
    public SampleDecoder(AudioFormatProperties props) {
        this(props.getMinSampleRate(), props.getMaxSampleRate());
    }

    public SampleDecoder(int minSampleRate, int maxSampleRate) {
        if (minSampleRate <= 0 || maxSampleRate < minSampleRate) {
            throw new IllegalArgumentException(
                    "Invalid sample rate range [" + minSampleRate + ", " + maxSampleRate + "]");
        }
        this.minSampleRate = minSampleRate;
        this.maxSampleRate = maxSampleRate;
    }

    /**
     * Decodes one payload.
     *
     * @param payload            a base64 string, a {@link JSONArray}, or a string holding a JSON array
     * @param encoding           wire encoding tag ({@code base64} or {@code json})
     * @param declaredSampleRate sample rate declared by the client, in Hz
     * @return decoded samples tagged with the declared rate
     */
    public SampleSequence decode(Object payload, String encoding, int declaredSampleRate) {
        AudioEncoding enc = AudioEncoding.fromWireName(encoding);
        validateSampleRate(declaredSampleRate);

        float[] samples = switch (enc) {
            case BASE64 -> decodeBase64(payload);
            case JSON -> decodeJson(payload);
        };
        requireFinite(samples);
        return new SampleSequence(samples, declaredSampleRate);
    }

    /**
     * Rejects a declared rate that differs from the one a connection has committed to.
     *
     * @param declaredRate  rate declared by the current message
     * @param committedRate rate committed by the first chunk, or {@code 0} if none yet
     * @throws SampleRateMismatchException if both are set and differ
     */
    public static void checkSampleRate(int declaredRate, int committedRate) {
        if (committedRate > 0 && declaredRate != committedRate) {
            throw new SampleRateMismatchException(declaredRate, committedRate);
        }
    }

    /**
     * Encodes samples the way {@link AudioEncoding#BASE64} payloads are expected on the wire.
     */
    public static String encodeBase64(float[] samples) {
        ByteBuffer bytes = ByteBuffer.allocate(samples.length * BYTES_PER_SAMPLE).order(ByteOrder.LITTLE_ENDIAN);
        bytes.asFloatBuffer().put(samples);
        return Base64.getEncoder().encodeToString(bytes.array());
    }

    /**
     * @throws MalformedPayloadException if {@code rate} is outside the accepted range
     */
    public void validateSampleRate(int rate) {
        if (rate < minSampleRate || rate > maxSampleRate) {
            throw new MalformedPayloadException(
                    "Sample rate " + rate + " Hz is out of range [" + minSampleRate + ", " + maxSampleRate + "]");
        }
    }

    private static float[] decodeBase64(Object payload) {
        if (!(payload instanceof String text) || text.isEmpty()) {
            throw new MalformedPayloadException("Missing audio_data");
        }
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(text);
        } catch (IllegalArgumentException e) {
            throw new MalformedPayloadException("Invalid base64 data", e);
        }
        if (bytes.length == 0) {
            throw new MalformedPayloadException("Missing audio_data");
        }
        if (bytes.length % BYTES_PER_SAMPLE != 0) {
            throw new MalformedPayloadException(bytes.length,
                    "byte length is not a multiple of " + BYTES_PER_SAMPLE);
        }
        FloatBuffer floats = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer();
        float[] out = new float[floats.remaining()];
        floats.get(out);
        return out;
    }

    private static float[] decodeJson(Object payload) {
        JSONArray array;
        if (payload instanceof JSONArray a) {
            array = a;
        } else if (payload instanceof String text && !text.isBlank()) {
            try {
                array = new JSONArray(text);
            } catch (JSONException e) {
                throw new MalformedPayloadException("audio_data is not a JSON array", e);
            }
        } else {
            throw new MalformedPayloadException("Missing audio_data");
        }
        if (array.isEmpty()) {
            throw new MalformedPayloadException("Missing audio_data");
        }

        float[] out = new float[array.length()];
        for (int i = 0; i < out.length; i++) {
            Object v = array.opt(i);
            if (!(v instanceof Number n)) {
                throw new MalformedPayloadException("Element " + i + " is not numeric");
            }
            out[i] = n.floatValue();
        }
        return out;
    }

    private static void requireFinite(float[] samples) {
        for (int i = 0; i < samples.length; i++) {
            if (!Float.isFinite(samples[i])) {
                throw new MalformedPayloadException("Audio contains NaN or Inf values (index " + i + ")");
            }
        }
    }
}
