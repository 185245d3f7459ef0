package com.phillippitts.spoofstream;

import com.phillippitts.spoofstream.config.properties.AudioFormatProperties;
import com.phillippitts.spoofstream.config.properties.ClassifierWatchdogProperties;
import com.phillippitts.spoofstream.config.properties.DetectionProperties;
import com.phillippitts.spoofstream.config.properties.RemoteClassifierProperties;
import com.phillippitts.spoofstream.config.properties.SessionProperties;
import com.phillippitts.spoofstream.config.properties.StreamWindowProperties;
import com.phillippitts.spoofstream.config.properties.WebSocketProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        StreamWindowProperties.class,
        AudioFormatProperties.class,
        SessionProperties.class,
        DetectionProperties.class,
        WebSocketProperties.class,
        RemoteClassifierProperties.class,
        ClassifierWatchdogProperties.class
})
@EnableScheduling
public class SpoofStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpoofStreamApplication.class, args);
    }

}
