package in.backtestnet.transport.http;

import in.backtestnet.domain.common.EngineState;
import in.backtestnet.infrastructure.metrics.PrometheusMetricsHandler;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.handlers.PathHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.function.Supplier;

/**
 * Status HTTP server for long-running backtests.
 *
 * Routes:
 * - GET /metrics - Prometheus text format
 * - GET /progress - JSON state and progress
 */
public final class StatusServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StatusServer.class);

    private final String host;
    private final int port;
    private final PathHandler paths;
    private Undertow server;

    public StatusServer(String host, int port, CollectorRegistry registry,
                        Supplier<EngineState> state, Supplier<BigDecimal> progress) {
        this.host = host;
        this.port = port;
        this.paths = Handlers.path()
            .addExactPath("/metrics", new PrometheusMetricsHandler(registry))
            .addExactPath("/progress", new ProgressHandler(state, progress));
    }

    public synchronized void start() {
        if (server != null) {
            throw new IllegalStateException("Status server already started");
        }
        server = Undertow.builder()
            .addHttpListener(port, host)
            .setHandler(paths)
            .build();
        server.start();
        log.info("[StatusServer] Listening on http://{}:{}/ (metrics, progress)", host, port);
    }

    public synchronized void stop() {
        if (server != null) {
            server.stop();
            server = null;
            log.info("[StatusServer] Stopped");
        }
    }

    @Override
    public void close() {
        stop();
    }
}
