/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.common;

import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * <p>Represents a single admission request for a pod which is about to be sized.</p>
 *
 * <p>Each instance has a unique id and carries the UID and operation of the admission request, which are used to
 * provide consistent context for logging.</p>
 */
public class AdmissionContext {
    private static final AtomicInteger IDS = new AtomicInteger();

    /**
     * Dummy admission context used in tests
     */
    public static final AdmissionContext DUMMY_CONTEXT = new AdmissionContext("test-uid", "CREATE", "namespace", "name");

    private final String uid;
    private final String operation;
    private final String namespace;
    private final String name;
    private final int id;
    private final Marker marker;

    /**
     * Constructs the admission context
     *
     * @param uid           UID of the admission request
     * @param operation     Admission operation (CREATE, UPDATE, ...)
     * @param namespace     Namespace of the pod
     * @param name          Name of the pod (might be empty when the pod uses generateName)
     */
    public AdmissionContext(String uid, String operation, String namespace, String name) {
        this.uid = uid;
        this.operation = operation;
        this.namespace = namespace;
        this.name = name;
        this.id = IDS.getAndIncrement();
        // MarkerManager keeps every marker it creates, so the marker is per namespace and not per pod
        this.marker = MarkerManager.getMarker("Pod(" + this.namespace + ")");
    }

    /**
     * @return  UID of the admission request
     */
    public String uid() {
        return uid;
    }

    /**
     * @return  Admission operation
     */
    public String operation() {
        return operation;
    }

    /**
     * @return  Namespace of the admitted pod
     */
    public String namespace() {
        return namespace;
    }

    /**
     * @return  Name of the admitted pod
     */
    public String name() {
        return name;
    }

    /**
     * @return  The logging marker. It is shared by all admission requests for pods in the same namespace.
     */
    public Marker getMarker() {
        return marker;
    }

    @Override
    public String toString() {
        return "Admission #" + id + "(" + operation + " " + uid + ") Pod(" + namespace() + "/" + name() + ")";
    }
}
