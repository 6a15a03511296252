/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.webhook;

import io.nodesizing.common.config.ConfigParameter;
import io.nodesizing.engine.NodeResourceSource;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static io.nodesizing.common.config.ConfigParameterParser.BOOLEAN;
import static io.nodesizing.common.config.ConfigParameterParser.DURATION;
import static io.nodesizing.common.config.ConfigParameterParser.INTEGER;
import static io.nodesizing.common.config.ConfigParameterParser.NON_EMPTY_STRING;
import static io.nodesizing.common.config.ConfigParameterParser.enumeration;
import static io.nodesizing.common.config.ConfigParameterParser.strictlyPositive;

/**
 * Webhook configuration
 */
public class WebhookConfig {
    private static final Map<String, ConfigParameter<?>> CONFIG_VALUES = new HashMap<>();

    /**
     * HTTPS port of the admission webhook
     */
    public static final ConfigParameter<Integer> WEBHOOK_PORT = new ConfigParameter<>("NSS_WEBHOOK_PORT", strictlyPositive(INTEGER), "8443", CONFIG_VALUES);
    /**
     * HTTP port of the health check and metrics server
     */
    public static final ConfigParameter<Integer> HEALTH_CHECK_PORT = new ConfigParameter<>("NSS_HEALTH_CHECK_PORT", strictlyPositive(INTEGER), "8081", CONFIG_VALUES);
    /**
     * PEM file with the server certificate (and its chain)
     */
    public static final ConfigParameter<String> TLS_CERT_FILE = new ConfigParameter<>("NSS_TLS_CERT_FILE", NON_EMPTY_STRING, "/tmp/k8s-webhook-server/serving-certs/tls.crt", CONFIG_VALUES);
    /**
     * PEM file with the private key of the server
     */
    public static final ConfigParameter<String> TLS_KEY_FILE = new ConfigParameter<>("NSS_TLS_KEY_FILE", NON_EMPTY_STRING, "/tmp/k8s-webhook-server/serving-certs/tls.key", CONFIG_VALUES);
    /**
     * Admits the pods unchanged when they cannot be sized
     */
    public static final ConfigParameter<Boolean> FAIL_OPEN = new ConfigParameter<>("NSS_FAIL_OPEN", BOOLEAN, "true", CONFIG_VALUES);
    /**
     * Node resources the fractions apply to
     */
    public static final ConfigParameter<NodeResourceSource> NODE_RESOURCE_SOURCE = new ConfigParameter<>("NSS_NODE_RESOURCE_SOURCE", enumeration(NodeResourceSource.class), "capacity", CONFIG_VALUES);
    /**
     * How long to wait for the node cache to sync at startup
     */
    public static final ConfigParameter<Duration> CACHE_SYNC_TIMEOUT_MS = new ConfigParameter<>("NSS_CACHE_SYNC_TIMEOUT_MS", DURATION, "30000", CONFIG_VALUES);
    /**
     * Idle timeout of the webhook connections
     */
    public static final ConfigParameter<Duration> REQUEST_IDLE_TIMEOUT_MS = new ConfigParameter<>("NSS_REQUEST_IDLE_TIMEOUT_MS", DURATION, "3000", CONFIG_VALUES);

    private final Map<String, Object> map;

    private WebhookConfig(Map<String, Object> map) {
        this.map = map;
    }

    /**
     * Creates the configuration from environment variables. Variables which do not belong to the webhook are ignored.
     *
     * @param map   Map with the environment variables
     *
     * @return  Webhook configuration
     */
    public static WebhookConfig buildFromMap(Map<String, String> map) {
        Map<String, String> envMap = new HashMap<>(map);
        envMap.keySet().retainAll(WebhookConfig.keyNames());

        Map<String, Object> generatedMap = ConfigParameter.define(envMap, CONFIG_VALUES);

        return new WebhookConfig(generatedMap);
    }

    /**
     * @return Set of configuration key/names
     */
    public static Set<String> keyNames() {
        return Collections.unmodifiableSet(CONFIG_VALUES.keySet());
    }

    /**
     * Gets the configuration value corresponding to the key
     *
     * @param <T>      Type of value
     * @param value    Instance of Config Parameter class
     *
     * @return         Configuration value w.r.t to the key
     */
    @SuppressWarnings("unchecked")
    public <T> T get(ConfigParameter<T> value) {
        return (T) this.map.get(value.key());
    }

    /**
     * @return  HTTPS port of the admission webhook
     */
    public int getWebhookPort() {
        return get(WEBHOOK_PORT);
    }

    /**
     * @return  Port of the health check and metrics server
     */
    public int getHealthCheckPort() {
        return get(HEALTH_CHECK_PORT);
    }

    /**
     * @return  Path to the server certificate
     */
    public String getTlsCertFile() {
        return get(TLS_CERT_FILE);
    }

    /**
     * @return  Path to the server private key
     */
    public String getTlsKeyFile() {
        return get(TLS_KEY_FILE);
    }

    /**
     * @return  True if the pods which cannot be sized are admitted unchanged
     */
    public boolean isFailOpen() {
        return get(FAIL_OPEN);
    }

    /**
     * @return  Node resources the fractions apply to
     */
    public NodeResourceSource getNodeResourceSource() {
        return get(NODE_RESOURCE_SOURCE);
    }

    /**
     * @return  Timeout for the initial sync of the node cache
     */
    public Duration getCacheSyncTimeout() {
        return get(CACHE_SYNC_TIMEOUT_MS);
    }

    /**
     * @return  Idle timeout of the webhook connections
     */
    public Duration getRequestIdleTimeout() {
        return get(REQUEST_IDLE_TIMEOUT_MS);
    }

    @Override
    public String toString() {
        return "WebhookConfig{" +
                "\n\twebhookPort=" + getWebhookPort() +
                "\n\thealthCheckPort=" + getHealthCheckPort() +
                "\n\ttlsCertFile='" + getTlsCertFile() + '\'' +
                "\n\ttlsKeyFile='" + getTlsKeyFile() + '\'' +
                "\n\tfailOpen=" + isFailOpen() +
                "\n\tnodeResourceSource=" + getNodeResourceSource() +
                "\n\tcacheSyncTimeout=" + getCacheSyncTimeout() +
                "\n\trequestIdleTimeout=" + getRequestIdleTimeout() +
                '}';
    }
}
