package com.phillippitts.spoofstream.service.detection.remote;

import com.phillippitts.spoofstream.config.properties.RemoteClassifierProperties;
import com.phillippitts.spoofstream.exception.InferenceException;
import com.phillippitts.spoofstream.exception.ModelUnavailableException;
import com.phillippitts.spoofstream.service.audio.AudioEncoding;
import com.phillippitts.spoofstream.service.audio.SampleDecoder;
import com.phillippitts.spoofstream.service.detection.AbstractAudioClassifier;
import com.phillippitts.spoofstream.service.detection.Classification;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Objects;

/**
 * Classifier backed by an out-of-process inference server reached over HTTP.
 *
 * <p>Each window is posted to {@code /v1/classify} as base64 little-endian float32,
 * the same encoding clients use on the WebSocket. {@link #initialize()} probes
 * {@code /health} so an unreachable server surfaces at startup rather than on the
 * first window.
 */
public final class RemoteAudioClassifier extends AbstractAudioClassifier {

    private static final Logger LOG = LogManager.getLogger(RemoteAudioClassifier.class);

    public static final String NAME = "remote";

    static final String CLASSIFY_PATH = "/v1/classify";
    static final String HEALTH_PATH = "/health";

    private final RestClient restClient;
    private final RemoteClassifierProperties props;

    public RemoteAudioClassifier(RestClient restClient, RemoteClassifierProperties props) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    protected void doInitialize() {
        try {
            restClient.get().uri(HEALTH_PATH).retrieve().toBodilessEntity();
        } catch (RestClientException e) {
            throw new ModelUnavailableException(NAME + " (" + props.baseUrl() + ")", e);
        }
        LOG.info("Remote classifier ready: baseUrl={}, model={}", props.baseUrl(), props.modelId());
    }

    @Override
    protected void doClose() {
        // RestClient holds no per-classifier resources
        LOG.info("Remote classifier closed: baseUrl={}", props.baseUrl());
    }

    @Override
    public Classification classify(float[] samples, int sampleRate) {
        ensureReady();
        JSONObject request = new JSONObject()
                .put("model_id", props.modelId())
                .put("sample_rate", sampleRate)
                .put("encoding", AudioEncoding.BASE64.wireName())
                .put("audio_data", SampleDecoder.encodeBase64(samples));
        String body;
        try {
            body = restClient.post()
                    .uri(CLASSIFY_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request.toString())
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            throw new InferenceException("Inference request failed: " + e.getMessage(), NAME, e);
        }
        return ClassificationJsonParser.parse(body, NAME);
    }

    @Override
    public String getName() {
        return NAME;
    }
}
