/*
 * Copyright Node Specific Sizing authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.nodesizing.webhook;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jetty.server.Connector;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.HttpConfiguration;
import org.eclipse.jetty.server.HttpConnectionFactory;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.SecureRequestCustomizer;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.SslConnectionFactory;
import org.eclipse.jetty.server.handler.AbstractHandler;
import org.eclipse.jetty.server.handler.ContextHandler;
import org.eclipse.jetty.util.ssl.SslContextFactory;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.security.KeyStore;
import java.time.Duration;
import java.util.Locale;

/**
 * Jetty based HTTPS server which receives the AdmissionReview requests of the API server on /mutate
 */
public class AdmissionWebhookServer {
    private static final Logger LOGGER = LogManager.getLogger(AdmissionWebhookServer.class);

    /**
     * Path of the mutating webhook
     */
    public static final String MUTATE_PATH = "/mutate";
    /* test */ static final String APPLICATION_JSON = "application/json";
    private static final long GRACEFUL_SHUTDOWN_TIMEOUT_MS = 5_000L;

    private final Server server;
    private final AdmissionReviewHandler handler;

    /**
     * Constructs the webhook server
     *
     * @param port          HTTPS port
     * @param keyStore      Key store with the server key and certificate
     * @param password      Password of the key store entry
     * @param idleTimeout   Idle timeout of the connections
     * @param handler       Handler of the admission reviews
     */
    public AdmissionWebhookServer(int port, KeyStore keyStore, char[] password, Duration idleTimeout, AdmissionReviewHandler handler) {
        this.handler = handler;

        server = new Server();

        HttpConfiguration https = new HttpConfiguration();
        https.addCustomizer(new SecureRequestCustomizer());
        ServerConnector httpsConn = new ServerConnector(server,
                new SslConnectionFactory(sslContextFactory(keyStore, password), "http/1.1"),
                new HttpConnectionFactory(https));
        httpsConn.setPort(port);
        httpsConn.setIdleTimeout(idleTimeout.toMillis());

        ContextHandler mutateContext = new ContextHandler(MUTATE_PATH);
        mutateContext.setHandler(mutateHandler());
        mutateContext.setAllowNullPathInfo(true);

        server.setConnectors(new Connector[] {httpsConn});
        server.setHandler(mutateContext);
        server.setStopTimeout(GRACEFUL_SHUTDOWN_TIMEOUT_MS);
    }

    private static SslContextFactory.Server sslContextFactory(KeyStore keyStore, char[] password) {
        SslContextFactory.Server sslContextFactory = new SslContextFactory.Server();
        sslContextFactory.setKeyStore(keyStore);
        sslContextFactory.setKeyStorePassword(new String(password));
        sslContextFactory.setKeyManagerPassword(new String(password));
        return sslContextFactory;
    }

    /**
     * Starts the webserver
     */
    public void start() {
        try {
            server.start();
            LOGGER.info("Admission webhook is listening on {}", server.getURI());
        } catch (Exception e)   {
            LOGGER.error("Failed to start the admission webhook server", e);
            throw new RuntimeException(e);
        }
    }

    /**
     * Stops the webserver
     */
    public void stop() {
        try {
            server.stop();
        } catch (Exception e)   {
            LOGGER.error("Failed to stop the admission webhook server", e);
            throw new RuntimeException(e);
        }
    }

    /**
     * Creates the handler of the mutation requests
     *
     * @return  Handler
     */
    /* test */ Handler mutateHandler() {
        return new AbstractHandler() {
            @Override
            public void handle(String target, Request baseRequest, HttpServletRequest request, HttpServletResponse response) throws IOException {
                baseRequest.setHandled(true);

                if (!"POST".equals(request.getMethod())) {
                    error(response, HttpServletResponse.SC_METHOD_NOT_ALLOWED, "Only POST is supported");
                    return;
                }

                byte[] body = request.getInputStream().readAllBytes();
                if (body.length == 0) {
                    error(response, HttpServletResponse.SC_BAD_REQUEST, "Empty body");
                    return;
                }

                if (!isJson(request.getContentType())) {
                    error(response, HttpServletResponse.SC_UNSUPPORTED_MEDIA_TYPE, "Content-Type=" + request.getContentType() + ", expected " + APPLICATION_JSON);
                    return;
                }

                try {
                    byte[] review = handler.handle(body);
                    response.setStatus(HttpServletResponse.SC_OK);
                    response.setContentType(APPLICATION_JSON);
                    response.getOutputStream().write(review);
                } catch (InvalidAdmissionReviewException e) {
                    LOGGER.warn("Invalid admission review received: {}", e.getMessage());
                    error(response, HttpServletResponse.SC_BAD_REQUEST, e.getMessage());
                }
            }
        };
    }

    /* test */ static boolean isJson(String contentType) {
        if (contentType == null) {
            return false;
        }

        return contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT).equals(APPLICATION_JSON);
    }

    private static void error(HttpServletResponse response, int status, String message) throws IOException {
        LOGGER.debug("Responding {} to {}: {}", status, MUTATE_PATH, message);
        response.setStatus(status);
        response.setContentType("text/plain");
        response.getWriter().print(message);
    }
}
