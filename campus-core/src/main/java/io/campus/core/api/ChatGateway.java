package io.campus.core.api;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.campus.core.config.model.AssistantSettings;
import io.campus.core.config.model.GatewayConfig;
import io.campus.core.language.Languages;
import io.campus.core.model.ChatRequest;
import io.campus.core.model.ChatResponse;
import io.campus.core.model.InvalidChatRequestException;
import io.campus.core.observability.ObservabilityService;
import io.campus.core.pipeline.ChatOrchestrator;
import io.campus.core.translation.TranslationUnavailableException;
import io.campus.core.translation.Translator;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP front door for the chat pipeline.
 */
public final class ChatGateway implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ChatGateway.class);
    private static final HttpString CORS_ALLOW_ORIGIN = new HttpString("Access-Control-Allow-Origin");
    private static final HttpString CORS_ALLOW_METHODS = new HttpString("Access-Control-Allow-Methods");
    private static final HttpString CORS_ALLOW_HEADERS = new HttpString("Access-Control-Allow-Headers");
    private static final HttpString CORS_MAX_AGE = new HttpString("Access-Control-Max-Age");

    private final ObjectMapper mapper;
    private final String host;
    private final int requestedPort;
    private final Set<String> corsOrigins;
    private final ChatOrchestrator orchestrator;
    private final AssistantSettings assistant;
    private final Translator translator;
    private final ObservabilityService observabilityService;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public ChatGateway(
        GatewayConfig gateway,
        ChatOrchestrator orchestrator,
        AssistantSettings assistant,
        Translator translator,
        ObservabilityService observabilityService
    ) {
        this.host = gateway.host() == null || gateway.host().isBlank() ? "0.0.0.0" : gateway.host();
        this.requestedPort = gateway.port();
        this.corsOrigins = new LinkedHashSet<>(gateway.corsOrigins() == null ? List.of() : gateway.corsOrigins());
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.assistant = Objects.requireNonNull(assistant, "assistant must not be null");
        this.translator = Objects.requireNonNull(translator, "translator must not be null");
        this.observabilityService = observabilityService;
        this.mapper = new ObjectMapper();
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }
        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", this::handleHealth)
            .addExactPath("/api/v1/chat", this::handleChat)
            .addExactPath("/api/v1/chat/welcome", this::handleWelcome)
            .addExactPath("/api/v1/chat/languages", this::handleLanguages)
            .addExactPath("/dashboard/summary", this::handleDashboardSummary);

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(exchange -> handleWithCors(routes, exchange))
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Chat gateway listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        running.set(false);
        if (server != null) {
            server.stop();
            server = null;
        }
    }

    private void handleWithCors(PathHandler routes, HttpServerExchange exchange) throws Exception {
        applyCorsHeaders(exchange);
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            exchange.setStatusCode(204);
            exchange.endExchange();
            return;
        }
        routes.handleRequest(exchange);
    }

    private void applyCorsHeaders(HttpServerExchange exchange) {
        String origin = exchange.getRequestHeaders().getFirst(Headers.ORIGIN);
        if (origin == null || !corsOrigins.contains(origin)) {
            return;
        }
        exchange.getResponseHeaders().put(CORS_ALLOW_ORIGIN, origin);
        exchange.getResponseHeaders().put(CORS_ALLOW_METHODS, "GET,POST,OPTIONS");
        exchange.getResponseHeaders().put(CORS_ALLOW_HEADERS, "Content-Type");
        exchange.getResponseHeaders().put(CORS_MAX_AGE, "86400");
        exchange.getResponseHeaders().put(Headers.VARY, "Origin");
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleChat(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleChat(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }
        if (!isMethod(exchange, "POST")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }

        ChatRequest request;
        try {
            exchange.startBlocking();
            request = mapper.readValue(exchange.getInputStream(), ChatRequest.class);
        } catch (JsonMappingException e) {
            InvalidChatRequestException invalid = invalidRequestCause(e);
            if (invalid != null) {
                sendJson(exchange, 422, Map.of("error", "invalid_request", "field", invalid.field(), "detail", invalid.getMessage()));
            } else {
                sendJson(exchange, 400, Map.of("error", "invalid_json"));
            }
            return;
        } catch (IOException e) {
            sendJson(exchange, 400, Map.of("error", "invalid_json"));
            return;
        }

        ChatResponse response = orchestrator.handle(request);
        sendJson(exchange, response.failed() ? 503 : 200, response);
    }

    private void handleWelcome(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleWelcome(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        String requested = Languages.normalize(queryParam(exchange, "language"));
        String language = assistant.supportedLanguages().contains(requested) ? requested : assistant.defaultLanguage();

        List<String> suggestions = new ArrayList<>();
        for (String suggestion : assistant.defaultSuggestions()) {
            suggestions.add(localize(suggestion, language));
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", localize(assistant.welcomeMessage(), language));
        payload.put("language", language);
        payload.put("suggested_questions", suggestions);
        sendJson(exchange, 200, payload);
    }

    private void handleLanguages(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("languages", Languages.describe(assistant.supportedLanguages()));
        payload.put("default", assistant.defaultLanguage());
        sendJson(exchange, 200, payload);
    }

    private void handleDashboardSummary(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleDashboardSummary(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        if (observabilityService == null) {
            sendJson(exchange, 503, Map.of("error", "observability_not_configured"));
            return;
        }
        sendJson(exchange, 200, observabilityService.summary());
    }

    private String localize(String text, String language) {
        try {
            return translator.translate(text, assistant.pivotLanguage(), language);
        } catch (TranslationUnavailableException e) {
            LOG.debug("Serving untranslated text for {}: {}", language, e.getMessage());
            return text;
        }
    }

    private InvalidChatRequestException invalidRequestCause(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof InvalidChatRequestException invalid) {
                return invalid;
            }
            current = current.getCause();
        }
        return null;
    }

    private boolean isMethod(HttpServerExchange exchange, String method) {
        return method.equalsIgnoreCase(exchange.getRequestMethod().toString());
    }

    private String queryParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null || values.isEmpty() ? "" : values.peekFirst();
    }

    private void sendInternalError(HttpServerExchange exchange, Exception e) {
        LOG.error("Gateway request {} failed", exchange.getRequestPath(), e);
        try {
            sendJson(exchange, 500, Map.of("error", "internal_error"));
        } catch (IOException sendFailure) {
            LOG.debug("Could not send error response: {}", sendFailure.getMessage());
            exchange.endExchange();
        }
    }

    private void sendJson(HttpServerExchange exchange, int status, Object payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        List<Undertow.ListenerInfo> listeners = undertow.getListenerInfo();
        if (!listeners.isEmpty() && listeners.get(0).getAddress() instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }
}
