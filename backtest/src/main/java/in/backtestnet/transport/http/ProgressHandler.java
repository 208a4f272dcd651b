package in.backtestnet.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.backtestnet.domain.common.EngineState;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * GET /progress
 *
 * Returns the run state and progress percentage for polling clients:
 * <pre>
 * {"state":"RUNNING","progress":42.5000}
 * </pre>
 */
public final class ProgressHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(ProgressHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Supplier<EngineState> state;
    private final Supplier<BigDecimal> progress;

    public ProgressHandler(Supplier<EngineState> state, Supplier<BigDecimal> progress) {
        this.state = state;
        this.progress = progress;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("state", state.get());
        body.put("progress", progress.get());

        try {
            String json = MAPPER.writeValueAsString(body);
            exchange.setStatusCode(StatusCodes.OK);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
            exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            log.error("[ProgressHandler] Failed to serialize progress: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
            exchange.getResponseSender().send("Failed to serialize progress", StandardCharsets.UTF_8);
        }
    }
}
