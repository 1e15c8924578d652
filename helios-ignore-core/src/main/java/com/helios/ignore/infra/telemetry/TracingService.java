package com.helios.ignore.infra.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;

/**
 * Process-wide tracer. Spans are exported to java.util.logging unless
 * {@code -Dotel.disabled=true} is set, in which case a no-op tracer is used.
 */
public class TracingService {

    private static final String INSTRUMENTATION_NAME = "com.helios.ignore";
    private static volatile TracingService instance;

    private final Tracer tracer;

    private TracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    public static TracingService getInstance() {
        TracingService result = instance;
        if (result == null) {
            synchronized (TracingService.class) {
                result = instance;
                if (result == null) {
                    result = create();
                    instance = result;
                }
            }
        }
        return result;
    }

    private static TracingService create() {
        if (Boolean.getBoolean("otel.disabled")) {
            return new TracingService(OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME));
        }
        OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                .setTracerProvider(
                        SdkTracerProvider.builder()
                                .addSpanProcessor(SimpleSpanProcessor.create(LoggingSpanExporter.create()))
                                .build()
                )
                .build();
        return new TracingService(sdk.getTracer(INSTRUMENTATION_NAME));
    }

    public Tracer getTracer() {
        return tracer;
    }
}
