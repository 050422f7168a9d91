package com.cairn.plugging.infra.server;

import com.cairn.plugging.infra.management.PolicyBundleManager;
import com.cairn.plugging.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.cairn.plugging.infra.service.PlanningService;
import com.cairn.plugging.kernel.PlanCompiler;
import com.cairn.plugging.policy.PolicyResolver;
import com.cairn.plugging.policy.store.PolicyStores;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;

class HttpServerTest {

    private final Tracer tracer = OpenTelemetry.noop().getTracer("test");
    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();

    private PolicyBundleManager bundleManager;
    private InMemoryMetricsRegistry metrics;
    private HttpServer server;

    @BeforeEach
    void setUp() throws Exception {
        bundleManager = new PolicyBundleManager(PolicyStores.bundled(), tracer, 0);
        metrics = new InMemoryMetricsRegistry();
        PlanningService service = new PlanningService(
            bundleManager, new PolicyResolver(tracer), new PlanCompiler(tracer), metrics, tracer);
        server = new HttpServer(0, service, metrics, tracer);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        bundleManager.shutdown();
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + server.port() + path);
    }

    private HttpResponse<String> get(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(uri(path)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void healthReportsActivePolicy() throws Exception {
        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.get("status").asText()).isEqualTo("UP");
        assertThat(body.get("policy_id").asText()).isEqualTo("tx.w3a");
        assertThat(body.get("policy_version").asText()).isEqualTo("2025.10.1");
    }

    @Test
    void planEndpointCompilesAndCountsPlans() throws Exception {
        String request = "{\"facts\": {"
            + "\"api14\": \"42003012340000\", \"district\": \"08A\", \"county\": \"Andrews\","
            + "\"surface_shoe_ft\": {\"value\": 500, \"units\": \"ft\"},"
            + "\"production_shoe_ft\": 6815},"
            + "\"options\": {\"merge_adjacent\": false}}";

        HttpResponse<String> response = post("/plan", request);

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode plan = mapper.readTree(response.body());
        assertThat(plan.get("api14").asText()).isEqualTo("42003012340000");
        assertThat(plan.get("steps").size()).isPositive();
        assertThat(plan.get("steps").get(0).get("step_id").asInt()).isEqualTo(1);
        assertThat(plan.has("rrc_export")).isTrue();
        assertThat(metrics.getCounterValue(PlanningService.METRIC_PLANS_COMPILED)).isEqualTo(1);

        HttpResponse<String> metricsResponse = get("/metrics");
        assertThat(metricsResponse.statusCode()).isEqualTo(200);
        assertThat(mapper.readTree(metricsResponse.body()).get("plans_compiled").asLong()).isEqualTo(1);
    }

    @Test
    void malformedBodiesAreBadRequests() throws Exception {
        assertThat(post("/plan", "{not json").statusCode()).isEqualTo(400);
        assertThat(post("/plan", "{\"options\": {}}").statusCode()).isEqualTo(400);
    }

    @Test
    void wrongMethodIsRejected() throws Exception {
        assertThat(get("/plan").statusCode()).isEqualTo(405);
        assertThat(post("/health", "{}").statusCode()).isEqualTo(405);
    }

    @Test
    void resolveEndpointReturnsEffectivePolicy() throws Exception {
        HttpResponse<String> response = get("/policy/resolve?district=8A&county=Andrews%20County");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode policy = mapper.readTree(response.body());
        assertThat(policy.get("policy_id").asText()).isEqualTo("tx.w3a");
        assertThat(policy.get("field_resolution").get("method").asText()).isEqualTo("none");
        assertThat(policy.has("effective")).isTrue();
    }

    @Test
    void parseQueryDecodesAndDropsEmptyValues() {
        assertThat(HttpServer.parseQuery("district=08A&county=Andrews%20County&field="))
            .containsEntry("district", "08A")
            .containsEntry("county", "Andrews County")
            .doesNotContainKey("field");
        assertThat(HttpServer.parseQuery(null)).isEmpty();
    }
}
