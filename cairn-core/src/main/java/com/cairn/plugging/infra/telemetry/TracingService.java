/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.infra.telemetry;

import com.cairn.plugging.infra.config.EngineConfig;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.sdk.trace.samplers.Sampler;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * OpenTelemetry setup for the planning service.
 *
 * <p>Configuration via environment variables (or system properties of the same name):
 * <ul>
 *   <li>OTEL_DISABLED: disable tracing entirely (default false)</li>
 *   <li>OTEL_EXPORTER_TYPE: otlp|logging (default logging)</li>
 *   <li>OTEL_EXPORTER_OTLP_ENDPOINT: OTLP endpoint (default http://localhost:4317)</li>
 *   <li>OTEL_TRACE_SAMPLING_RATIO: 0.0-1.0 (default 1.0 outside production)</li>
 *   <li>SERVICE_NAME, SERVICE_VERSION, DEPLOYMENT_ENVIRONMENT: resource attributes</li>
 * </ul>
 */
public class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    private static final String INSTRUMENTATION_NAME = "com.cairn.plugging-engine";
    private static final String DEFAULT_SERVICE_NAME = "plugging-engine";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
    private static final AttributeKey<String> DEPLOYMENT_ENVIRONMENT = AttributeKey.stringKey("deployment.environment");

    private static volatile TracingService INSTANCE;
    private static final Object LOCK = new Object();

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;
    private final boolean isNoop;

    private TracingService(OpenTelemetry openTelemetry, Tracer tracer, SdkTracerProvider tracerProvider, boolean isNoop) {
        this.openTelemetry = openTelemetry;
        this.tracer = tracer;
        this.tracerProvider = tracerProvider;
        this.isNoop = isNoop;
        if (!isNoop) {
            registerShutdownHook();
        }
    }

    public static TracingService getInstance() {
        TracingService instance = INSTANCE;
        if (instance == null) {
            synchronized (LOCK) {
                instance = INSTANCE;
                if (instance == null) {
                    instance = initialize();
                    INSTANCE = instance;
                }
            }
        }
        return instance;
    }

    /**
     * A tracer-less instance, for tests and embedded use.
     */
    public static TracingService noop() {
        OpenTelemetry noop = OpenTelemetry.noop();
        return new TracingService(noop, noop.getTracer(INSTRUMENTATION_NAME), null, true);
    }

    private static TracingService initialize() {
        try {
            if (Boolean.parseBoolean(EngineConfig.envOrProperty("OTEL_DISABLED", "false"))) {
                logger.info("OpenTelemetry tracing is disabled (OTEL_DISABLED=true)");
                return noop();
            }

            Sampler sampler = configureSampler();
            SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .setResource(buildResource())
                .setSampler(sampler)
                .addSpanProcessor(BatchSpanProcessor.builder(configureExporter())
                    .setMaxQueueSize(2048)
                    .setMaxExportBatchSize(256)
                    .setScheduleDelay(Duration.ofSeconds(5))
                    .setExporterTimeout(Duration.ofSeconds(30))
                    .build())
                .build();

            OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                .buildAndRegisterGlobal();

            logger.info(String.format("OpenTelemetry initialized: service=%s, env=%s, sampler=%s",
                serviceName(), environment(), sampler.getDescription()));
            return new TracingService(sdk, sdk.getTracer(INSTRUMENTATION_NAME), tracerProvider, false);
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to initialize OpenTelemetry, falling back to noop", e);
            return noop();
        }
    }

    private static Resource buildResource() {
        return Resource.getDefault().merge(Resource.create(Attributes.builder()
            .put(SERVICE_NAME, serviceName())
            .put(SERVICE_VERSION, EngineConfig.envOrProperty("SERVICE_VERSION", "unknown"))
            .put(DEPLOYMENT_ENVIRONMENT, environment())
            .build()));
    }

    private static Sampler configureSampler() {
        String fallback = switch (environment().toLowerCase(Locale.ROOT)) {
            case "prod", "production" -> "0.1";
            case "staging" -> "0.5";
            default -> "1.0";
        };
        double ratio;
        try {
            ratio = Double.parseDouble(EngineConfig.envOrProperty("OTEL_TRACE_SAMPLING_RATIO", fallback));
            ratio = Math.max(0.0, Math.min(1.0, ratio));
        } catch (NumberFormatException e) {
            logger.warning("Invalid OTEL_TRACE_SAMPLING_RATIO, using " + fallback);
            ratio = Double.parseDouble(fallback);
        }
        return Sampler.parentBasedBuilder(Sampler.traceIdRatioBased(ratio)).build();
    }

    private static SpanExporter configureExporter() {
        String exporterType = EngineConfig.envOrProperty("OTEL_EXPORTER_TYPE", "logging").toLowerCase(Locale.ROOT);
        if ("otlp".equals(exporterType)) {
            String endpoint = EngineConfig.envOrProperty("OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4317");
            logger.info("Using OTLP exporter: " + endpoint);
            return OtlpGrpcSpanExporter.builder()
                .setEndpoint(endpoint)
                .setTimeout(30, TimeUnit.SECONDS)
                .build();
        }
        if (!"logging".equals(exporterType)) {
            logger.warning("Unknown exporter type: " + exporterType + ", using logging");
        }
        return LoggingSpanExporter.create();
    }

    private void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "otel-shutdown-hook"));
    }

    public void shutdown() {
        if (isNoop || tracerProvider == null) {
            return;
        }
        try {
            tracerProvider.shutdown().join(30, TimeUnit.SECONDS);
            logger.info("OpenTelemetry shutdown complete");
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error during OpenTelemetry shutdown", e);
        }
    }

    public Tracer getTracer() {
        return tracer;
    }

    public OpenTelemetry getOpenTelemetry() {
        return openTelemetry;
    }

    public boolean isEnabled() {
        return !isNoop;
    }

    private static String serviceName() {
        return EngineConfig.envOrProperty("SERVICE_NAME", EngineConfig.envOrProperty("OTEL_SERVICE_NAME", DEFAULT_SERVICE_NAME));
    }

    private static String environment() {
        return EngineConfig.envOrProperty("DEPLOYMENT_ENVIRONMENT", "dev");
    }
}
