/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.webhook;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import io.nodesizing.common.SizingLogger;
import io.nodesizing.engine.NodeSnapshotProvider;
import io.nodesizing.webhook.http.Liveness;
import io.nodesizing.webhook.http.Readiness;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Node snapshot backed by an informer. The informer watches all the nodes of the cluster and keeps them in its cache,
 * so that the admission requests never wait for the Kubernetes API.
 */
public class NodeInformerSnapshot implements NodeSnapshotProvider, Liveness, Readiness {
    private static final SizingLogger LOGGER = SizingLogger.create(NodeInformerSnapshot.class);
    private static final long STOP_TIMEOUT_MS = 5_000L;

    private final SharedIndexInformer<Node> informer;

    /**
     * Creates the snapshot with an informer which watches all nodes. The informer is not started.
     *
     * @param client    Kubernetes client
     */
    public NodeInformerSnapshot(KubernetesClient client) {
        this(client.nodes().runnableInformer(0));
    }

    /**
     * Constructor
     *
     * @param informer  Node informer
     */
    /* test */ NodeInformerSnapshot(SharedIndexInformer<Node> informer) {
        this.informer = informer;
    }

    /**
     * Starts the informer and waits for the initial sync of the cache. When the cache does not sync in time, the
     * webhook starts anyway: the pods pinned to unknown nodes are handled as sizing failures until the cache catches
     * up, and the readiness check keeps failing.
     *
     * @param syncTimeout   How long to wait for the sync
     */
    public void start(Duration syncTimeout) {
        informer.exceptionHandler((isStarted, throwable) -> {
            LOGGER.errorOp("Caught exception in the Node informer which is " + (isStarted ? "started" : "not started"), throwable);
            // Always retry => the informer stays alive and the liveness check keeps passing
            return true;
        });

        LOGGER.infoOp("Starting the Node informer");
        informer.start();

        try {
            waitForSync(syncTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warnOp("Interrupted while waiting for the Node informer to sync", e);
        }
    }

    /* test */ void waitForSync(Duration syncTimeout) throws InterruptedException {
        long deadline = System.nanoTime() + syncTimeout.toNanos();

        while (!informer.hasSynced()) {
            if (System.nanoTime() >= deadline) {
                LOGGER.warnOp("The Node informer did not sync within {} ms, starting with an incomplete cache", syncTimeout.toMillis());
                return;
            }

            LOGGER.debugOp("Waiting for the Node informer to sync");
            Thread.sleep(100);
        }

        LOGGER.infoOp("The Node informer is synced with {} nodes", informer.getStore().list().size());
    }

    /**
     * Stops the informer and waits until it is stopped.
     */
    public void stop() {
        LOGGER.infoOp("Stopping the Node informer");
        informer.stop();

        try {
            informer.stopped().toCompletableFuture().get(STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warnOp("Interrupted while waiting for the Node informer to stop", e);
        } catch (TimeoutException | ExecutionException e) {
            // We just log the error as we are anyway shutting down
            LOGGER.warnOp("Failed to wait for the Node informer to stop", e);
        }
    }

    @Override
    public Node get(String name) {
        return informer.getStore().getByKey(name);
    }

    /**
     * @return  True when the informer is running
     */
    @Override
    public boolean isAlive() {
        return informer.isRunning();
    }

    /**
     * @return  True once the informer cache is synced
     */
    @Override
    public boolean isReady() {
        return informer.hasSynced();
    }
}
