package com.phillippitts.spoofstream.config;

import com.phillippitts.spoofstream.config.properties.RemoteClassifierProperties;
import com.phillippitts.spoofstream.service.detection.AudioClassifier;
import com.phillippitts.spoofstream.service.detection.remote.RemoteAudioClassifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Wires the classifier backend.
 *
 * <p>The remote classifier is the only production backend. Setting
 * {@code classifier.remote.enabled=false} leaves the {@link AudioClassifier} slot empty so
 * another bean (for example a test double) can fill it.
 */
@Configuration
public class ClassifierConfig {

    @Bean
    @ConditionalOnProperty(prefix = "classifier.remote", name = "enabled", havingValue = "true", matchIfMissing = true)
    public AudioClassifier remoteAudioClassifier(RemoteClassifierProperties props) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(props.connectTimeoutMs());
        requestFactory.setReadTimeout(props.readTimeoutMs());
        RestClient restClient = RestClient.builder()
                .baseUrl(props.baseUrl())
                .requestFactory(requestFactory)
                .build();
        return new RemoteAudioClassifier(restClient, props);
    }
}
