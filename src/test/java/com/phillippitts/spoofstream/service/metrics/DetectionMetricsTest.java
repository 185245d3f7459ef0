package com.phillippitts.spoofstream.service.metrics;

import com.phillippitts.spoofstream.config.properties.SessionProperties.DuplicatePolicy;
import com.phillippitts.spoofstream.service.session.ConnectionRegistry;
import com.phillippitts.spoofstream.service.session.ConnectionSession;
import com.phillippitts.spoofstream.testutil.RecordingMessageSink;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DetectionMetricsTest {

    private MeterRegistry registry;
    private DetectionMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new DetectionMetrics(registry);
    }

    @Test
    void shouldRecordLatencyPerClassifier() {
        long durationNanos = TimeUnit.MILLISECONDS.toNanos(120);

        metrics.recordLatency("remote", durationNanos);

        Timer timer = registry.find("spoofstream.detection.latency").tag("classifier", "remote").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.NANOSECONDS)).isEqualTo(durationNanos);
    }

    @Test
    void shouldCountSuccessByLabel() {
        metrics.incrementSuccess("remote", "spoof");
        metrics.incrementSuccess("remote", "spoof");
        metrics.incrementSuccess("remote", "bonafide");

        assertThat(registry.find("spoofstream.detection.success").tag("label", "spoof").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.find("spoofstream.detection.success").tag("label", "bonafide").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldCountFailuresAndProtocolErrorsSeparately() {
        metrics.incrementFailure("remote", "timeout");
        metrics.incrementProtocolError("MalformedPayloadException");

        assertThat(registry.find("spoofstream.detection.failure").tag("reason", "timeout").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("spoofstream.protocol.errors").tag("type", "MalformedPayloadException")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void binderTracksRegistrySize() {
        ConnectionRegistry connections = new ConnectionRegistry(DuplicatePolicy.REJECT_NEW, Clock.systemUTC());
        new ConnectionMetricsBinder(connections).bindTo(registry);
        ConnectionSession session = new ConnectionSession("t1", new RecordingMessageSink(),
                new ConnectionSession.WindowSettings(16_000, 1.0, 0.5, 1.0), Clock.systemUTC());

        connections.register("alice", session);
        assertThat(registry.get("spoofstream.connections.active").gauge().value()).isEqualTo(1.0);

        session.close("done");
        assertThat(registry.get("spoofstream.connections.active").gauge().value()).isZero();
        assertThat(registry.get("spoofstream.connections.accepted").functionCounter().count()).isEqualTo(1.0);
    }
}
