package com.phillippitts.spoofstream.service.metrics;

import com.phillippitts.spoofstream.service.session.ConnectionRegistry;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.stereotype.Component;

/**
 * Exposes registry-level gauges: live connections and connections accepted since startup.
 */
@Component
public class ConnectionMetricsBinder implements MeterBinder {

    private final ConnectionRegistry registry;

    public ConnectionMetricsBinder(ConnectionRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void bindTo(MeterRegistry meterRegistry) {
        Gauge.builder("spoofstream.connections.active", registry, ConnectionRegistry::size)
                .description("Live WebSocket connections")
                .register(meterRegistry);
        FunctionCounter.builder("spoofstream.connections.accepted", registry, ConnectionRegistry::acceptedTotal)
                .description("Connections registered since startup")
                .register(meterRegistry);
    }
}
