/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.webhook.http;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.nodesizing.common.MetricsProvider;
import io.nodesizing.common.MicrometerMetricsProvider;
import io.nodesizing.webhook.TestCertificates;
import io.nodesizing.webhook.WebhookMetrics;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class HealthCheckAndMetricsServerTest {
    private static HttpResponse<String> get(int port, String path) throws IOException, InterruptedException, URISyntaxException {
        HttpRequest request = HttpRequest.newBuilder().uri(new URI("http://localhost:" + port + path)).GET().build();
        return HttpClient.newHttpClient().send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testAllGood() throws IOException, InterruptedException, URISyntaxException {
        MeterRegistry metricsRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        MetricsProvider metrics = new MicrometerMetricsProvider(metricsRegistry);
        new WebhookMetrics(metrics).patchedPods().increment();

        Liveness liveness = mock(Liveness.class);
        when(liveness.isAlive()).thenReturn(true);
        Readiness readiness = mock(Readiness.class);
        when(readiness.isReady()).thenReturn(true);

        int port = TestCertificates.getFreePort();

        HealthCheckAndMetricsServer server = new HealthCheckAndMetricsServer(port, liveness, readiness, metrics);
        server.start();

        try {
            HttpResponse<String> response = get(port, "/healthy");
            assertThat(response.statusCode(), is(200));
            assertThat(response.body().trim(), is("{\"status\": \"ok\"}"));

            response = get(port, "/ready");
            assertThat(response.statusCode(), is(200));
            assertThat(response.body().trim(), is("{\"status\": \"ok\"}"));

            response = get(port, "/metrics");
            assertThat(response.statusCode(), is(200));
            assertThat(response.body(), containsString("node_specific_sizing_patched_pods_total 1.0"));
        } finally {
            server.stop();
        }
    }

    @Test
    public void testNotGood() throws IOException, InterruptedException, URISyntaxException {
        MetricsProvider metrics = new MicrometerMetricsProvider(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));

        Liveness liveness = mock(Liveness.class);
        when(liveness.isAlive()).thenReturn(false);
        Readiness readiness = mock(Readiness.class);
        when(readiness.isReady()).thenReturn(false);

        int port = TestCertificates.getFreePort();

        HealthCheckAndMetricsServer server = new HealthCheckAndMetricsServer(port, liveness, readiness, metrics);
        server.start();

        try {
            HttpResponse<String> response = get(port, "/healthy");
            assertThat(response.statusCode(), is(500));
            assertThat(response.body().trim(), is("{\"status\": \"not-ok\"}"));

            response = get(port, "/ready");
            assertThat(response.statusCode(), is(500));
            assertThat(response.body().trim(), is("{\"status\": \"not-ok\"}"));
        } finally {
            server.stop();
        }
    }

    @Test
    public void testAliveButNotReady() throws IOException, InterruptedException, URISyntaxException {
        MetricsProvider metrics = new MicrometerMetricsProvider(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));
        int port = TestCertificates.getFreePort();

        HealthCheckAndMetricsServer server = new HealthCheckAndMetricsServer(port, () -> true, () -> false, metrics);
        server.start();

        try {
            assertThat(get(port, "/healthy").statusCode(), is(200));
            assertThat(get(port, "/ready").statusCode(), is(500));
        } finally {
            server.stop();
        }
    }

    @Test
    public void testMetricsWithoutPrometheus() throws IOException, InterruptedException, URISyntaxException {
        MetricsProvider metrics = new MicrometerMetricsProvider(new SimpleMeterRegistry());
        metrics.counter("my-metric", "My test metric", Tags.empty()).increment();
        int port = TestCertificates.getFreePort();

        HealthCheckAndMetricsServer server = new HealthCheckAndMetricsServer(port, () -> true, () -> true, metrics);
        server.start();

        try {
            HttpResponse<String> response = get(port, "/metrics");
            assertThat(response.statusCode(), is(501));
        } finally {
            server.stop();
        }
    }
}
