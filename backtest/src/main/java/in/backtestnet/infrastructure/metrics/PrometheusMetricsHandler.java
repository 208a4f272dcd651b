package in.backtestnet.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;

/**
 * Undertow handler serving a collector registry in Prometheus text format.
 *
 * Example output:
 * <pre>
 * # HELP backtest_ticks_total Total number of replayed ticks
 * # TYPE backtest_ticks_total counter
 * backtest_ticks_total 8640.0
 * # HELP backtest_progress_percent Backtest progress in percent (0-100)
 * # TYPE backtest_progress_percent gauge
 * backtest_progress_percent 42.5
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        try {
            StringWriter writer = new StringWriter();
            TextFormat.write004(writer, registry.metricFamilySamples());
            String body = writer.toString();

            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
            exchange.setStatusCode(200);
            exchange.getResponseSender().send(body);

            log.debug("[PrometheusMetricsHandler] Served metrics ({} bytes)", body.length());
        } catch (IOException e) {
            log.error("[PrometheusMetricsHandler] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
        }
    }
}
