package com.example.scheduler;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.junit.Assert.assertThrows;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.junit.Test;

import com.cronutils.model.CronType;
import com.example.scheduler.dispatch.Dispatcher;
import com.example.scheduler.engine.CronTimerEngine;
import com.example.scheduler.engine.ManualTimerEngine;
import com.example.scheduler.model.Event;
import com.example.scheduler.model.EventQuery;
import com.example.scheduler.registry.CronEventRegistry;
import com.example.scheduler.service.EventServiceImpl;
import com.example.scheduler.store.InMemoryEventStore;
import com.example.webhook.DeliveryResult;
import com.example.webhook.WebhookClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;

import io.prometheus.client.CollectorRegistry;

public class SchedulerMainTest {
    private static final String YEARLY = "0 0 0 1 1 *";

    private static CronTimerEngine engine;
    private static CronEventRegistry registry;
    private static HttpServer server;
    private static HttpServer hookServer;
    private static final AtomicInteger hookHits = new AtomicInteger();
    private static int port;
    private static int hookPort;
    private static final ObjectMapper mapper = SchedulerMain.newObjectMapper();
    private static final HttpClient http = HttpClient.newHttpClient();

    @BeforeClass
    public static void setup() throws Exception {
        hookServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        hookServer.createContext("/hook", exchange -> {
            hookHits.incrementAndGet();
            byte[] body = "ok".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        hookServer.start();
        hookPort = hookServer.getAddress().getPort();

        engine = new CronTimerEngine(CronType.SPRING, ZoneOffset.UTC);
        engine.start();
        registry = new CronEventRegistry(engine, new Dispatcher(new WebhookClient(Duration.ofSeconds(2))));
        EventServiceImpl service = new EventServiceImpl(new InMemoryEventStore(), registry, engine);

        // bind to ephemeral port 0
        server = SchedulerMain.startServer(service, mapper, new CollectorRegistry(), 0);
        port = server.getAddress().getPort();
    }

    @AfterClass
    public static void teardown() {
        if (server != null)
            server.stop(0);
        if (registry != null)
            registry.clear();
        if (engine != null)
            engine.stop();
        if (hookServer != null)
            hookServer.stop(0);
    }

    private static HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest.Builder b = HttpRequest.newBuilder(URI.create("http://localhost:" + port + path))
                .timeout(Duration.ofSeconds(5));
        if (body == null) {
            b.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            b.header("Content-Type", "application/json").method(method, HttpRequest.BodyPublishers.ofString(body));
        }
        return http.send(b.build(), HttpResponse.BodyHandlers.ofString());
    }

    private static String eventJson(String expression, String url) {
        return "{\"expression\":\"" + expression + "\",\"url\":\"" + url + "\",\"maxRetries\":1,\"retryTimeoutSeconds\":1}";
    }

    private static long create(String expression, String url) throws Exception {
        HttpResponse<String> resp = send("POST", "/events", eventJson(expression, url));
        assertThat(resp.body(), resp.statusCode(), is(201));
        return mapper.readTree(resp.body()).get("id").asLong();
    }

    @Test
    public void healthz() throws Exception {
        HttpResponse<String> resp = send("GET", "/healthz", null);
        assertThat(resp.statusCode(), is(200));
        assertThat(resp.body(), is("OK"));
    }

    @Test
    public void createGetUpdateDelete() throws Exception {
        long id = create(YEARLY, "http://localhost:" + hookPort + "/hook/crud");

        HttpResponse<String> got = send("GET", "/events/" + id, null);
        assertThat(got.statusCode(), is(200));
        JsonNode node = mapper.readTree(got.body());
        assertThat(node.get("expression").asText(), is(YEARLY));
        assertThat(node.get("scheduled").asBoolean(), is(true));
        assertThat(node.get("maxRetries").asInt(), is(1));
        assertThat(node.hasNonNull("nextRunAt"), is(true));

        HttpResponse<String> put = send("PUT", "/events/" + id,
                eventJson("0 0 0 1 6 *", "http://localhost:" + hookPort + "/hook/crud2"));
        assertThat(put.body(), put.statusCode(), is(200));
        assertThat(mapper.readTree(put.body()).get("url").asText(), containsString("/hook/crud2"));
        assertThat(registry.find(id).getExpression(), is("0 0 0 1 6 *"));

        HttpResponse<String> del = send("DELETE", "/events/" + id, null);
        assertThat(del.statusCode(), is(200));
        JsonNode deleted = mapper.readTree(del.body());
        assertThat(deleted.get("id").asLong(), is(id));
        assertThat(deleted.get("status").asText(), is("deleted"));
        assertThat(deleted.hasNonNull("deletedAt"), is(true));

        assertThat(send("GET", "/events/" + id, null).statusCode(), is(404));
        assertThat(send("DELETE", "/events/" + id, null).statusCode(), is(404));
    }

    @Test
    public void listFiltersByUrl() throws Exception {
        String url = "http://localhost:" + hookPort + "/hook/list";
        create(YEARLY, url);
        create("0 0 0 1 2 *", url);

        HttpResponse<String> resp = send("GET", "/events?url=" + URLEncoder.encode(url, StandardCharsets.UTF_8), null);
        assertThat(resp.statusCode(), is(200));
        JsonNode list = mapper.readTree(resp.body());
        assertThat(list.size(), is(2));
        assertThat(SchedulerMain.parseQuery("url=" + URLEncoder.encode(url, StandardCharsets.UTF_8)),
                is(new EventQuery(null, url)));
    }

    @Test
    public void badRequestsMapToClientErrors() throws Exception {
        HttpResponse<String> invalid = send("POST", "/events", eventJson("not a cron", "http://localhost/x"));
        assertThat(invalid.statusCode(), is(400));
        assertThat(mapper.readTree(invalid.body()).get("error").asText(), is("invalid_schedule"));

        HttpResponse<String> malformed = send("POST", "/events", "{not json");
        assertThat(malformed.statusCode(), is(400));
        assertThat(mapper.readTree(malformed.body()).get("error").asText(), is("bad_request"));

        HttpResponse<String> noUrl = send("POST", "/events", "{\"expression\":\"" + YEARLY + "\"}");
        assertThat(noUrl.statusCode(), is(400));

        assertThat(send("GET", "/events/abc", null).statusCode(), is(400));
        assertThat(send("GET", "/events/0", null).statusCode(), is(400));
        assertThat(send("GET", "/events/987654", null).statusCode(), is(404));
        assertThat(send("PUT", "/events/987654", eventJson(YEARLY, "http://localhost/x")).statusCode(), is(404));
        assertThat(send("DELETE", "/events", null).statusCode(), is(405));
        assertThat(send("PATCH", "/events/1", "{}").statusCode(), is(405));
    }

    @Test
    public void metricsExposeRequestCounter() throws Exception {
        send("GET", "/events", null);

        HttpResponse<String> resp = send("GET", "/metrics", null);
        assertThat(resp.statusCode(), is(200));
        assertThat(resp.body(), containsString("scheduler_http_requests_total"));
    }

    @Test(timeout = 20_000)
    public void everySecondEventHitsWebhookUntilDeleted() throws Exception {
        long id = create("* * * * * *", "http://localhost:" + hookPort + "/hook/tick");

        long deadline = System.currentTimeMillis() + 5_000;
        while (hookHits.get() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(100);
        }
        assertThat(hookHits.get(), greaterThanOrEqualTo(2));

        assertThat(send("DELETE", "/events/" + id, null).statusCode(), is(200));
        // a request already in flight may still land
        Thread.sleep(300);
        int afterDelete = hookHits.get();
        Thread.sleep(2_500);
        assertThat(hookHits.get(), is(afterDelete));
    }

    @Test
    public void bootstrapWithMalformedStoredEventStopsTheEngine() {
        InMemoryEventStore store = new InMemoryEventStore();
        store.save(Event.builder().expression(YEARLY).url("http://localhost/ok").build());
        store.save(Event.builder().expression(YEARLY).url(" ").build());
        ManualTimerEngine manual = new ManualTimerEngine();
        manual.start();

        assertThrows(IllegalArgumentException.class, () -> SchedulerMain.bootstrap(store, manual,
                new Dispatcher(url -> DeliveryResult.delivered(200))));

        assertThat(manual.isStopped(), is(true));
        assertThat(manual.liveEntries().isEmpty(), is(true));
    }

    @Test
    public void normalizePathCollapsesIds() {
        assertThat(SchedulerMain.normalizePath("/events/42"), is("/events/:id"));
        assertThat(SchedulerMain.normalizePath("/events"), is("/events"));
        assertThat(SchedulerMain.normalizePath(null), is(""));
    }
}
