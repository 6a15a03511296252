/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.StatusBuilder;
import io.fabric8.kubernetes.api.model.admission.v1.AdmissionRequest;
import io.fabric8.kubernetes.api.model.admission.v1.AdmissionResponse;
import io.fabric8.kubernetes.api.model.admission.v1.AdmissionResponseBuilder;
import io.fabric8.kubernetes.api.model.admission.v1.AdmissionReview;
import io.fabric8.kubernetes.api.model.admission.v1.AdmissionReviewBuilder;
import io.micrometer.core.instrument.Timer;
import io.nodesizing.common.AdmissionContext;
import io.nodesizing.common.SizingLogger;
import io.nodesizing.engine.InvalidAnnotationValueException;
import io.nodesizing.engine.PatchBuilder;
import io.nodesizing.engine.PodSizer;
import io.nodesizing.engine.SizingResult;

import java.io.IOException;
import java.util.Base64;
import java.util.List;

/**
 * Handles AdmissionReview requests: sizes the admitted pod and answers with the JSON patch. Failures are handled
 * according to the failure policy:
 *
 * <ul>
 *     <li>fail-open admits the pod unchanged and returns the error as a warning</li>
 *     <li>fail-closed rejects the pod with the error as status</li>
 * </ul>
 */
public class AdmissionReviewHandler {
    private static final SizingLogger LOGGER = SizingLogger.create(AdmissionReviewHandler.class);

    /* test */ static final String API_VERSION = "admission.k8s.io/v1";
    /* test */ static final String KIND = "AdmissionReview";
    /* test */ static final String PATCH_TYPE = "JSONPatch";

    private final ObjectMapper mapper;
    private final PodSizer sizer;
    private final boolean failOpen;
    private final WebhookMetrics metrics;

    /**
     * Constructor
     *
     * @param mapper    Object mapper used to decode the reviews and the pods
     * @param sizer     Pod sizer
     * @param failOpen  True to admit the pods which cannot be sized, false to reject them
     * @param metrics   Webhook metrics
     */
    public AdmissionReviewHandler(ObjectMapper mapper, PodSizer sizer, boolean failOpen, WebhookMetrics metrics) {
        this.mapper = mapper;
        this.sizer = sizer;
        this.failOpen = failOpen;
        this.metrics = metrics;
    }

    /**
     * Decodes an AdmissionReview, handles it and encodes the response.
     *
     * @param body  JSON encoded AdmissionReview
     *
     * @return  JSON encoded AdmissionReview with the response
     *
     * @throws InvalidAdmissionReviewException if the body is not an AdmissionReview with a request
     * @throws IOException if the response cannot be encoded
     */
    public byte[] handle(byte[] body) throws IOException {
        AdmissionReview review;
        try {
            review = mapper.readValue(body, AdmissionReview.class);
        } catch (IOException e) {
            throw new InvalidAdmissionReviewException("Failed to decode the AdmissionReview: " + e.getMessage(), e);
        }

        return mapper.writeValueAsBytes(review(review));
    }

    /**
     * Handles an AdmissionReview.
     *
     * @param review    AdmissionReview with the request
     *
     * @return  AdmissionReview with the response
     *
     * @throws InvalidAdmissionReviewException if the review has no request
     */
    public AdmissionReview review(AdmissionReview review) {
        AdmissionRequest request = review.getRequest();
        if (request == null || request.getUid() == null) {
            throw new InvalidAdmissionReviewException("The AdmissionReview does not contain any request");
        }

        metrics.admissionRequests().increment();
        AdmissionContext context = new AdmissionContext(request.getUid(), request.getOperation(), request.getNamespace(), request.getName());

        return new AdmissionReviewBuilder()
                .withApiVersion(API_VERSION)
                .withKind(KIND)
                .withResponse(respond(context, request))
                .build();
    }

    private AdmissionResponse respond(AdmissionContext context, AdmissionRequest request) {
        Pod pod;
        try {
            pod = decodePod(request);
        } catch (IllegalArgumentException e) {
            LOGGER.warnPod(context, "The admitted object is not a Pod: {}", e.getMessage());
            return failure(context, request, "NotAPod", 400, "The admitted object is not a Pod: " + e.getMessage());
        }

        if (pod == null) {
            LOGGER.debugPod(context, "The request has no object, nothing to size");
            return allowed(request);
        }

        Timer.Sample sample = metrics.startSizing();
        try {
            SizingResult result = sizer.size(pod, context);

            if (result.limitCorrections() > 0) {
                metrics.limitCorrections().increment(result.limitCorrections());
            }

            if (result.hasPatch()) {
                metrics.patchedPods().increment();
                LOGGER.infoPod(context, "Patching {} resources", result.operations().size() - 1);

                return new AdmissionResponseBuilder()
                        .withUid(request.getUid())
                        .withAllowed(true)
                        .withPatchType(PATCH_TYPE)
                        .withPatch(Base64.getEncoder().encodeToString(PatchBuilder.toJson(result.operations())))
                        .build();
            } else {
                return allowed(request);
            }
        } catch (InvalidAnnotationValueException e) {
            LOGGER.warnPod(context, "Pod cannot be sized: {}", e.getMessage());
            return failure(context, request, e.getClass().getSimpleName(), 400, e.getMessage());
        } catch (RuntimeException e) {
            // Node resolution errors and failed contracts of the sizing
            LOGGER.warnPod(context, "Pod cannot be sized: {}", e.getMessage());
            return failure(context, request, e.getClass().getSimpleName(), 500, e.getMessage());
        } finally {
            sample.stop(metrics.sizingDuration());
        }
    }

    /* test */ Pod decodePod(AdmissionRequest request) {
        if (request.getKind() != null && !"Pod".equals(request.getKind().getKind())) {
            throw new IllegalArgumentException("kind is " + request.getKind().getKind());
        } else if (request.getObject() == null) {
            return null;
        }

        return mapper.convertValue(request.getObject(), Pod.class);
    }

    private static AdmissionResponse allowed(AdmissionRequest request) {
        return new AdmissionResponseBuilder()
                .withUid(request.getUid())
                .withAllowed(true)
                .build();
    }

    private AdmissionResponse failure(AdmissionContext context, AdmissionRequest request, String error, int code, String message) {
        metrics.failures(error).increment();

        if (failOpen) {
            LOGGER.infoPod(context, "Admitting the pod unchanged");
            return new AdmissionResponseBuilder()
                    .withUid(request.getUid())
                    .withAllowed(true)
                    .withWarnings(List.of("Node specific sizing was not applied: " + message))
                    .build();
        } else {
            return new AdmissionResponseBuilder()
                    .withUid(request.getUid())
                    .withAllowed(false)
                    .withStatus(new StatusBuilder()
                            .withCode(code)
                            .withMessage(message)
                            .build())
                    .build();
        }
    }
}
