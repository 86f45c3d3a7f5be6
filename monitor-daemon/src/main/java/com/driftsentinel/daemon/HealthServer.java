package com.driftsentinel.daemon;

import com.driftsentinel.core.alerting.AlertQuery;
import com.driftsentinel.core.alerting.AlertSystem;
import com.driftsentinel.core.monitor.MonitorStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Read-only HTTP surface of the daemon, served by the JDK {@link HttpServer}.
 *
 * <ul>
 * <li>{@code /health}, {@code /readiness}: liveness answer {@code {"status":"UP"}}</li>
 * <li>{@code /status}: the session's {@link MonitorStatus}</li>
 * <li>{@code /alerts}: open alerts, oldest first</li>
 * <li>{@code /alerts/summary}: alert counts</li>
 * </ul>
 *
 * Every JSON endpoint answers GET only.
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);

    private static final byte[] UP = json("{\"status\":\"UP\"}");
    private static final byte[] METHOD_NOT_ALLOWED = json("{\"error\":\"Method not allowed\"}");
    private static final byte[] INTERNAL_ERROR = json("{\"error\":\"Internal error\"}");

    private final Map<String, HttpHandler> routes = new LinkedHashMap<>();
    private final ObjectMapper mapper;

    private HttpServer http;
    private ExecutorService executor;

    public HealthServer(Supplier<MonitorStatus> status, AlertSystem alertSystem, ObjectMapper mapper) {
        Objects.requireNonNull(status, "status supplier must not be null");
        Objects.requireNonNull(alertSystem, "AlertSystem must not be null");
        this.mapper = Objects.requireNonNull(mapper, "ObjectMapper must not be null");

        routes.put("/health", exchange -> write(exchange, 200, UP));
        routes.put("/readiness", exchange -> write(exchange, 200, UP));
        routes.put("/status", jsonRoute(status));
        routes.put("/alerts", jsonRoute(() -> alertSystem.list(AlertQuery.open())));
        routes.put("/alerts/summary", jsonRoute(alertSystem::summary));
    }

    /**
     * Bind and serve on all interfaces. A bind failure is logged and leaves
     * the server stopped; the daemon keeps monitoring without it.
     *
     * @param port TCP port in [1, 65535]
     * @throws IllegalArgumentException if the port is out of range
     */
    public synchronized void start(int port) {
        if (port < 1 || port > 65_535) {
            throw new IllegalArgumentException("Status port must be in [1, 65535], got: " + port);
        }
        if (http != null) {
            throw new IllegalStateException("Status server already started");
        }
        HttpServer server;
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            LOG.error("Cannot bind status server to port {}: {}", port, e.getMessage(), e);
            return;
        }
        routes.forEach(server::createContext);
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "drift-status-http");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.start();
        http = server;
        LOG.info("Status server listening on port {} ({})", port, String.join(", ", routes.keySet()));
    }

    /**
     * Stop serving. Calling it on a stopped server has no effect.
     */
    public synchronized void stop() {
        if (http == null) {
            return;
        }
        http.stop(0);
        executor.shutdownNow();
        http = null;
        executor = null;
        LOG.info("Status server stopped");
    }

    public synchronized boolean isRunning() {
        return http != null;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private HttpHandler jsonRoute(Supplier<?> body) {
        return exchange -> {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                write(exchange, 405, METHOD_NOT_ALLOWED);
                return;
            }
            byte[] payload;
            try {
                payload = mapper.writeValueAsBytes(body.get());
            } catch (RuntimeException | IOException e) {
                LOG.error("Failed to render {}: {}", exchange.getRequestURI(), e.getMessage(), e);
                write(exchange, 500, INTERNAL_ERROR);
                return;
            }
            write(exchange, 200, payload);
        };
    }

    private static void write(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    private static byte[] json(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
