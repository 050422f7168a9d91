/*
 * Copyright (c) 2025 Cairn Plugging Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.cairn.plugging.infra.server;

import com.cairn.plugging.api.model.EffectivePolicy;
import com.cairn.plugging.api.model.Fact;
import com.cairn.plugging.api.model.Plan;
import com.cairn.plugging.api.model.PlanOptions;
import com.cairn.plugging.api.model.PolicyBundle;
import com.cairn.plugging.infra.metrics.MetricsRegistry;
import com.cairn.plugging.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.cairn.plugging.infra.metrics.impl.prometheus.PrometheusMetricsRegistry;
import com.cairn.plugging.infra.service.PlanningService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lightweight JSON front end for the planning service.
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li>POST /plan - compile a plan from {@code {"facts": {...}, "options": {...}}}</li>
 *   <li>GET /policy/resolve?district=&amp;county=&amp;field= - effective policy</li>
 *   <li>GET /health - active policy id and version</li>
 *   <li>GET /metrics - Prometheus text, or a JSON snapshot for the in-memory registry</li>
 * </ul>
 */
public class HttpServer {
    private static final Logger logger = Logger.getLogger(HttpServer.class.getName());

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final PlanningService planningService;
    private final MetricsRegistry metrics;
    private final Tracer tracer;
    private final ObjectMapper objectMapper;

    /**
     * @param port the port to listen on; 0 picks a free port
     */
    public HttpServer(int port, PlanningService planningService, MetricsRegistry metrics, Tracer tracer) throws IOException {
        this.planningService = Objects.requireNonNull(planningService, "PlanningService cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "MetricsRegistry cannot be null");
        this.tracer = Objects.requireNonNull(tracer, "Tracer cannot be null");
        this.objectMapper = new ObjectMapper();
        this.server = com.sun.net.httpserver.HttpServer.create(new InetSocketAddress(port), 0);

        this.server.createContext("/plan", new PlanHandler());
        this.server.createContext("/policy/resolve", new ResolveHandler());
        this.server.createContext("/health", new HealthHandler());
        this.server.createContext("/metrics", new MetricsHandler());

        int coreCount = Runtime.getRuntime().availableProcessors();
        this.executor = Executors.newFixedThreadPool(coreCount * 2);
        this.server.setExecutor(executor);
    }

    public void start() {
        server.start();
        logger.info(String.format("Plugging engine server started on port %d", port()));
        logger.info("Endpoints: /plan (POST), /policy/resolve (GET), /health (GET), /metrics (GET)");
    }

    public void stop(int delaySeconds) {
        logger.info("Stopping server...");
        server.stop(delaySeconds);
        executor.shutdown();
    }

    public int port() {
        return server.getAddress().getPort();
    }

    class PlanHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"POST".equals(exchange.getRequestMethod())) {
                sendResponse(exchange, 405, "{\"error\":\"Method Not Allowed\"}");
                return;
            }

            Span span = tracer.spanBuilder("http-plan").startSpan();
            try (Scope scope = span.makeCurrent()) {
                Map<String, Object> body;
                try (InputStream is = exchange.getRequestBody()) {
                    body = objectMapper.readValue(is, JSON_OBJECT);
                }
                if (body == null || !(body.get("facts") instanceof Map<?, ?>)) {
                    sendError(exchange, 400, "Request body must contain a facts object");
                    return;
                }
                @SuppressWarnings("unchecked")
                Map<String, Fact> facts = PlanningService.toFacts((Map<String, Object>) body.get("facts"));
                PlanOptions options = body.get("options") != null
                    ? objectMapper.convertValue(body.get("options"), PlanOptions.class)
                    : PlanOptions.defaults();

                Plan plan = planningService.plan(facts, options);
                if (plan.api14() != null) span.setAttribute("api14", plan.api14());
                sendResponse(exchange, 200, objectMapper.writeValueAsString(plan));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                span.recordException(e);
                sendError(exchange, 400, "Malformed request: " + e.getMessage());
            } catch (Exception e) {
                span.recordException(e);
                logger.log(Level.SEVERE, "Error during plan compilation", e);
                sendError(exchange, 500, "Internal Server Error");
            } finally {
                span.end();
            }
        }
    }

    class ResolveHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equals(exchange.getRequestMethod())) {
                sendResponse(exchange, 405, "{\"error\":\"Method Not Allowed\"}");
                return;
            }

            Span span = tracer.spanBuilder("http-resolve-policy").startSpan();
            try (Scope scope = span.makeCurrent()) {
                Map<String, String> query = parseQuery(exchange.getRequestURI().getRawQuery());
                EffectivePolicy policy = planningService.resolve(query.get("district"), query.get("county"), query.get("field"));
                sendResponse(exchange, 200, objectMapper.writeValueAsString(policy));
            } catch (Exception e) {
                span.recordException(e);
                logger.log(Level.SEVERE, "Error resolving policy", e);
                sendError(exchange, 500, "Internal Server Error");
            } finally {
                span.end();
            }
        }
    }

    class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equals(exchange.getRequestMethod())) {
                sendResponse(exchange, 405, "{\"error\":\"Method Not Allowed\"}");
                return;
            }
            PolicyBundle bundle = planningService.activeBundle();
            if (bundle == null) {
                sendResponse(exchange, 503, "{\"status\":\"DOWN\", \"reason\":\"Policy bundle not loaded\"}");
                return;
            }
            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", "UP");
            health.put("policy_id", bundle.policyId());
            health.put("policy_version", bundle.version());
            sendResponse(exchange, 200, objectMapper.writeValueAsString(health));
        }
    }

    class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equals(exchange.getRequestMethod())) {
                sendResponse(exchange, 405, "{\"error\":\"Method Not Allowed\"}");
                return;
            }

            try {
                if (metrics instanceof PrometheusMetricsRegistry prometheus) {
                    sendResponse(exchange, 200, "text/plain; version=0.0.4; charset=utf-8", prometheus.scrape());
                } else if (metrics instanceof InMemoryMetricsRegistry inMemory) {
                    sendResponse(exchange, 200, objectMapper.writeValueAsString(inMemory.snapshot()));
                } else {
                    sendResponse(exchange, 200, "{}");
                }
            } catch (Exception e) {
                logger.log(Level.WARNING, "Error getting metrics", e);
                sendError(exchange, 500, "Internal Server Error");
            }
        }
    }

    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            String name = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), StandardCharsets.UTF_8);
            String value = eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            if (!value.isEmpty()) {
                params.put(name, value);
            }
        }
        return params;
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        sendResponse(exchange, statusCode, objectMapper.writeValueAsString(Map.of("error", message)));
    }

    private void sendResponse(HttpExchange exchange, int statusCode, String body) throws IOException {
        sendResponse(exchange, statusCode, "application/json", body);
    }

    private void sendResponse(HttpExchange exchange, int statusCode, String contentType, String body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        byte[] responseBytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(statusCode, responseBytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(responseBytes);
        }
    }
}
