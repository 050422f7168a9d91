/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging;

import com.cairn.plugging.infra.config.EngineConfig;
import com.cairn.plugging.infra.management.PolicyBundleManager;
import com.cairn.plugging.infra.metrics.MetricsRegistry;
import com.cairn.plugging.infra.server.HttpServer;
import com.cairn.plugging.infra.service.PlanningService;
import com.cairn.plugging.infra.telemetry.TracingService;
import com.cairn.plugging.kernel.PlanCompiler;
import com.cairn.plugging.policy.PolicyResolver;
import io.opentelemetry.api.trace.Tracer;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class PluggingEngineApplication {
    private static final Logger logger = Logger.getLogger(PluggingEngineApplication.class.getName());

    private HttpServer httpServer;
    private PolicyBundleManager bundleManager;

    public static void main(String[] args) {
        configureLogging();
        try {
            PluggingEngineApplication app = new PluggingEngineApplication();
            app.start(EngineConfig.fromEnvironment());
            Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown));
            Thread.currentThread().join();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Application failed to start: " + e.getMessage(), e);
            System.exit(1);
        }
    }

    void start(EngineConfig config) throws IOException {
        logger.info("Starting Cairn plugging engine with OpenTelemetry");
        TracingService tracingService = TracingService.getInstance();
        Tracer tracer = tracingService.getTracer();

        MetricsRegistry metrics = MetricsRegistry.getInstance();
        bundleManager = new PolicyBundleManager(config.policySource(), tracer, metrics, config.policyCheckSeconds());
        bundleManager.start();

        PlanningService planningService = new PlanningService(
            bundleManager, new PolicyResolver(tracer), new PlanCompiler(tracer), metrics, tracer);

        httpServer = new HttpServer(config.httpPort(), planningService, metrics, tracer);
        httpServer.start();
        logger.info("Plugging engine is ready to serve requests on port " + httpServer.port());
    }

    void shutdown() {
        if (bundleManager != null)
            bundleManager.shutdown();
        if (httpServer != null)
            httpServer.stop(5);
        logger.info("Plugging engine shutdown complete");
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = PluggingEngineApplication.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not read bundled logging.properties", e);
        }
    }
}
