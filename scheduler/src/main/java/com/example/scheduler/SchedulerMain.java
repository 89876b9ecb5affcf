package com.example.scheduler;

import com.example.scheduler.api.ErrorResponse;
import com.example.scheduler.api.EventRequest;
import com.example.scheduler.api.DeletedEventResponse;
import com.example.scheduler.dispatch.Dispatcher;
import com.example.scheduler.engine.CronTimerEngine;
import com.example.scheduler.engine.TimerEngine;
import com.example.scheduler.exception.EventNotFoundException;
import com.example.scheduler.exception.InvalidScheduleException;
import com.example.scheduler.exception.StoreUnavailableException;
import com.example.scheduler.metrics.PromDeliveryMetrics;
import com.example.scheduler.model.EventQuery;
import com.example.scheduler.registry.CronEventRegistry;
import com.example.scheduler.registry.EventRegistry;
import com.example.scheduler.service.EventService;
import com.example.scheduler.service.EventServiceImpl;
import com.example.scheduler.store.CassandraEventStore;
import com.example.scheduler.store.EventStore;
import com.example.scheduler.store.InMemoryEventStore;
import com.example.webhook.DeliveryMetrics;
import com.example.webhook.WebhookClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.exporter.common.TextFormat;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.StringWriter;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Executors;

@Slf4j
public class SchedulerMain {
    private static volatile boolean ready = false;

    private static Counter httpRequestsTotal;

    public static void main(String[] args) throws Exception {
        SchedulerConfig config = SchedulerConfig.fromEnv(System.getenv());

        CollectorRegistry registry = CollectorRegistry.defaultRegistry;
        DeliveryMetrics metrics = new PromDeliveryMetrics(registry);
        WebhookClient client = new WebhookClient(config.getRequestTimeout(), metrics);

        EventStore store = openStore(config);

        CronTimerEngine engine = new CronTimerEngine(config.getCronType(), config.getTimezone());
        engine.start();

        EventRegistry eventRegistry = bootstrap(store, engine, new Dispatcher(client, metrics));

        Gauge.build()
                .name("scheduler_triggers")
                .help("Live scheduled triggers")
                .register(registry)
                .setChild(new Gauge.Child() {
                    @Override
                    public double get() {
                        return eventRegistry.size();
                    }
                });

        EventService service = new EventServiceImpl(store, eventRegistry, engine);
        HttpServer server = startServer(service, newObjectMapper(), registry, config.getHttpPort());
        ready = true;
        log.info("HTTP server started on port {} with {} scheduled events", config.getHttpPort(),
                eventRegistry.size());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            ready = false;
            log.info("Shutdown initiated");
            server.stop(1);
            eventRegistry.clear();
            engine.stop();
            if (store instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) store).close();
                } catch (Exception e) {
                    log.warn("Failed closing event store: {}", e.getMessage());
                }
            }
            log.info("Shutdown complete");
        }));
    }

    /**
     * Builds the registry and schedules every stored event. Any failure clears the registry
     * and stops the engine before it is rethrown.
     */
    static EventRegistry bootstrap(EventStore store, TimerEngine engine, Dispatcher dispatcher) {
        EventRegistry eventRegistry = new CronEventRegistry(engine, dispatcher);
        try {
            eventRegistry.scheduleAll(store);
        } catch (RuntimeException e) {
            log.error("Bootstrap failed after scheduling {} events", eventRegistry.size(), e);
            eventRegistry.clear();
            engine.stop();
            throw e;
        }
        return eventRegistry;
    }

    static EventStore openStore(SchedulerConfig config) {
        if (config.getStoreType() == SchedulerConfig.StoreType.CASSANDRA) {
            log.info("Using cassandra event store at {}:{} keyspace={}", config.getCassandraContactPoint(),
                    config.getCassandraPort(), config.getCassandraKeyspace());
            return CassandraEventStore.connect(config.getCassandraContactPoint(), config.getCassandraPort(),
                    config.getCassandraKeyspace(), config.getCassandraLocalDc(),
                    config.getCassandraReplicationFactor());
        }
        log.info("Using in-memory event store");
        return new InMemoryEventStore();
    }

    public static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    // Exposed for tests
    public static HttpServer startServer(EventService service, ObjectMapper mapper, CollectorRegistry registry,
            int httpPort) throws IOException {
        httpRequestsTotal = Counter.build()
                .name("scheduler_http_requests_total")
                .help("Scheduler HTTP requests")
                .labelNames("path", "method", "status")
                .register(registry);

        HttpServer server = HttpServer.create(new InetSocketAddress(httpPort), 0);
        server.createContext("/healthz", exchange -> respond(exchange, 200, "OK"));
        server.createContext("/readyz", exchange -> respond(exchange, ready ? 200 : 503, ready ? "READY" : "NOT_READY"));
        server.createContext("/metrics", new MetricsHandlerProm(registry));
        server.createContext("/events", new EventsHandler(service, mapper));
        server.createContext("/events/", new EventActionHandler(service, mapper));
        server.setExecutor(Executors.newCachedThreadPool());
        server.start();
        return server;
    }

    private static void respond(HttpExchange exchange, int code, String body) throws IOException {
        byte[] data = body.getBytes(StandardCharsets.UTF_8);
        count(exchange, code);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(code, data.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(data);
        }
    }

    private static void respondJson(HttpExchange exchange, int code, Object value, ObjectMapper mapper) throws IOException {
        byte[] data = mapper.writeValueAsBytes(value);
        count(exchange, code);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(code, data.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(data);
        }
    }

    private static void respondError(HttpExchange exchange, int code, String error, String detail,
            ObjectMapper mapper) throws IOException {
        respondJson(exchange, code, new ErrorResponse(code, error, detail), mapper);
    }

    private static void count(HttpExchange exchange, int code) {
        if (httpRequestsTotal != null) {
            httpRequestsTotal.labels(normalizePath(exchange.getRequestURI().getPath()), exchange.getRequestMethod(),
                    String.valueOf(code)).inc();
        }
    }

    static String normalizePath(String rawPath) {
        if (rawPath == null) {
            return "";
        }
        if (rawPath.startsWith("/events/")) {
            return "/events/:id";
        }
        return rawPath;
    }

    static EventQuery parseQuery(String rawQuery) {
        EventQuery query = new EventQuery();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return query;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8);
            String value = URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            if ("expression".equals(key)) {
                query.setExpression(value);
            } else if ("url".equals(key)) {
                query.setUrl(value);
            }
        }
        return query;
    }

    interface ExchangeAction {
        void run() throws IOException;
    }

    /**
     * Maps domain failures to HTTP status codes.
     */
    static void handleErrors(HttpExchange exchange, ObjectMapper mapper, ExchangeAction action) throws IOException {
        try {
            action.run();
        } catch (EventNotFoundException ex) {
            respondError(exchange, 404, "not_found", ex.getMessage(), mapper);
        } catch (InvalidScheduleException ex) {
            respondError(exchange, 400, "invalid_schedule", ex.getMessage(), mapper);
        } catch (JsonProcessingException ex) {
            respondError(exchange, 400, "bad_request", "malformed JSON body", mapper);
        } catch (IllegalArgumentException ex) {
            respondError(exchange, 400, "bad_request", ex.getMessage(), mapper);
        } catch (StoreUnavailableException ex) {
            respondError(exchange, 503, "store_unavailable", ex.getMessage(), mapper);
        } catch (RuntimeException ex) {
            log.error("Unhandled error on {} {}", exchange.getRequestMethod(), exchange.getRequestURI(), ex);
            respondError(exchange, 500, "internal_error", ex.getMessage(), mapper);
        }
    }

    static class MetricsHandlerProm implements HttpHandler {
        private final CollectorRegistry registry;

        MetricsHandlerProm(CollectorRegistry registry) {
            this.registry = registry;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            exchange.getResponseHeaders().set("Content-Type", TextFormat.CONTENT_TYPE_004);
            StringWriter writer = new StringWriter();
            TextFormat.write004(writer, registry.metricFamilySamples());
            byte[] data = writer.toString().getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, data.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(data);
            }
        }
    }

    static class EventsHandler implements HttpHandler {
        private final EventService service;
        private final ObjectMapper mapper;

        EventsHandler(EventService service, ObjectMapper mapper) {
            this.service = service;
            this.mapper = mapper;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            handleErrors(exchange, mapper, () -> {
                if ("POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    EventRequest req;
                    try (InputStream is = exchange.getRequestBody()) {
                        req = mapper.readValue(is, EventRequest.class);
                    }
                    respondJson(exchange, 201, service.createEvent(req), mapper);
                    return;
                }
                if ("GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                    EventQuery query = parseQuery(exchange.getRequestURI().getRawQuery());
                    respondJson(exchange, 200, service.listEvents(query), mapper);
                    return;
                }
                respondError(exchange, 405, "method_not_allowed", exchange.getRequestMethod(), mapper);
            });
        }
    }

    static class EventActionHandler implements HttpHandler {
        private final EventService service;
        private final ObjectMapper mapper;

        EventActionHandler(EventService service, ObjectMapper mapper) {
            this.service = service;
            this.mapper = mapper;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String raw = path.substring("/events/".length());
            long id;
            try {
                id = Long.parseLong(raw);
            } catch (NumberFormatException e) {
                respondError(exchange, 400, "bad_request", "bad event id: " + raw, mapper);
                return;
            }
            if (id <= 0) {
                respondError(exchange, 400, "bad_request", "event id must be positive", mapper);
                return;
            }

            handleErrors(exchange, mapper, () -> {
                String method = exchange.getRequestMethod();
                if ("GET".equalsIgnoreCase(method)) {
                    respondJson(exchange, 200, service.getEvent(id), mapper);
                } else if ("PUT".equalsIgnoreCase(method)) {
                    EventRequest req;
                    try (InputStream is = exchange.getRequestBody()) {
                        req = mapper.readValue(is, EventRequest.class);
                    }
                    respondJson(exchange, 200, service.updateEvent(id, req), mapper);
                } else if ("DELETE".equalsIgnoreCase(method)) {
                    service.deleteEvent(id);
                    respondJson(exchange, 200, DeletedEventResponse.of(id), mapper);
                } else {
                    respondError(exchange, 405, "method_not_allowed", method, mapper);
                }
            });
        }
    }
}
