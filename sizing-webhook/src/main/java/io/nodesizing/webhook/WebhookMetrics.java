/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.webhook;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.nodesizing.common.MetricsProvider;

/**
 * Metrics of the admission webhook
 */
public class WebhookMetrics {
    /**
     * Prefix used for the metric names
     */
    public static final String METRICS_PREFIX = "node_specific_sizing.";

    private final MetricsProvider metricsProvider;

    private final Counter admissionRequests;
    private final Counter patchedPods;
    private final Counter limitCorrections;
    private final Timer sizingDuration;

    /**
     * Constructor
     *
     * @param metricsProvider   Metrics provider
     */
    public WebhookMetrics(MetricsProvider metricsProvider) {
        this.metricsProvider = metricsProvider;

        this.admissionRequests = metricsProvider.counter(METRICS_PREFIX + "admission.requests", "Number of admission requests", Tags.empty());
        this.patchedPods = metricsProvider.counter(METRICS_PREFIX + "patched.pods", "Number of pods whose resources were patched", Tags.empty());
        this.limitCorrections = metricsProvider.counter(METRICS_PREFIX + "limit.corrections", "Number of container requests lowered to their limit", Tags.empty());
        this.sizingDuration = metricsProvider.timer(METRICS_PREFIX + "sizing.duration", "Time spent sizing a pod", Tags.empty());
    }

    /**
     * @return  Counter of the admission requests
     */
    public Counter admissionRequests() {
        return admissionRequests;
    }

    /**
     * @return  Counter of the patched pods
     */
    public Counter patchedPods() {
        return patchedPods;
    }

    /**
     * @return  Counter of the requests lowered to their limit
     */
    public Counter limitCorrections() {
        return limitCorrections;
    }

    /**
     * @return  Timer of the sizing
     */
    public Timer sizingDuration() {
        return sizingDuration;
    }

    /**
     * @return  Sample to stop with the {@link #sizingDuration()} timer
     */
    public Timer.Sample startSizing() {
        return Timer.start(metricsProvider.meterRegistry());
    }

    /**
     * @param error     Type of the error (usually the simple name of the exception)
     *
     * @return  Counter of the failures of the given type
     */
    public Counter failures(String error) {
        // Micrometer returns the already registered counter for the same name and tags
        return metricsProvider.counter(METRICS_PREFIX + "failures", "Number of admission requests where the pod could not be sized", Tags.of("error", error));
    }
}
