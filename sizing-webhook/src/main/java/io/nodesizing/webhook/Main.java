/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ClassLoaderMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.nodesizing.common.MetricsProvider;
import io.nodesizing.common.MicrometerMetricsProvider;
import io.nodesizing.common.Util;
import io.nodesizing.engine.PodSizer;
import io.nodesizing.webhook.http.HealthCheckAndMetricsServer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * The main class of the node specific sizing webhook
 */
@SuppressWarnings("checkstyle:classdataabstractioncoupling")
public class Main {
    private static final Logger LOGGER = LogManager.getLogger(Main.class);

    /**
     * Main method which starts the node informer, the webserver with health checks and metrics and the admission
     * webhook
     *
     * @param args  Startup arguments
     */
    public static void main(String[] args) {
        LOGGER.info("Node specific sizing webhook {} is starting", Main.class.getPackage().getImplementationVersion());

        // Log environment information
        Util.printEnvInfo();

        WebhookConfig config = WebhookConfig.buildFromMap(System.getenv());
        LOGGER.info("Webhook configuration is {}", config);

        KubernetesClient client = createClient(Main.class.getPackage().getImplementationVersion());
        MetricsProvider metricsProvider = createMetricsProvider();

        NodeInformerSnapshot nodes = new NodeInformerSnapshot(client);
        HealthCheckAndMetricsServer healthCheckAndMetricsServer = new HealthCheckAndMetricsServer(config.getHealthCheckPort(), nodes, nodes, metricsProvider);

        // The key store lives only in memory, so its password is random
        char[] password = randomPassword();
        KeyStore keyStore = PemKeyStore.load(Path.of(config.getTlsCertFile()), Path.of(config.getTlsKeyFile()), password);

        AdmissionReviewHandler handler = new AdmissionReviewHandler(
                new ObjectMapper(),
                new PodSizer(nodes, config.getNodeResourceSource()),
                config.isFailOpen(),
                new WebhookMetrics(metricsProvider)
        );
        AdmissionWebhookServer webhookServer = new AdmissionWebhookServer(config.getWebhookPort(), keyStore, password, config.getRequestIdleTimeout(), handler);

        // The health check server is started first so that the probes can tell the informer is still syncing
        healthCheckAndMetricsServer.start();
        nodes.start(config.getCacheSyncTimeout());
        webhookServer.start();

        // Register shutdown hooks
        LOGGER.info("Registering shutdown hook");
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Requesting the admission webhook to stop");
            webhookServer.stop();

            LOGGER.info("Requesting the health check and metrics server to stop");
            healthCheckAndMetricsServer.stop();

            nodes.stop();

            LOGGER.info("Requesting Kubernetes client to stop");
            client.close();

            LOGGER.info("Shutdown complete");
        }));
    }

    /**
     * Creates the Kubernetes client. The user agent identifies the webhook and its version in the API server audit logs.
     *
     * @param version   Version of the webhook
     *
     * @return  Kubernetes client
     */
    private static KubernetesClient createClient(String version) {
        return new KubernetesClientBuilder()
                .withConfig(new ConfigBuilder().withUserAgent("node-specific-sizing/" + version).build())
                .build();
    }

    private static char[] randomPassword() {
        byte[] random = new byte[24];
        new SecureRandom().nextBytes(random);
        return Base64.getEncoder().encodeToString(random).toCharArray();
    }

    /**
     * Creates the MetricsProvider instance based on a PrometheusMeterRegistry and binds the JVM metrics to it
     *
     * @return  MetricsProvider instance
     */
    private static MetricsProvider createMetricsProvider()  {
        MeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Bind JVM metrics
        new ClassLoaderMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);

        return new MicrometerMetricsProvider(registry);
    }
}
