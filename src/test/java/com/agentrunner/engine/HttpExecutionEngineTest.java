package com.agentrunner.engine;

import com.agentrunner.entity.AutomationRun;
import com.agentrunner.entity.RunStatus;
import com.agentrunner.orchestration.service.JsonProcessingService;
import com.agentrunner.repository.AutomationRunRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.http.client.ClientHttpRequestFactoryBuilder;
import org.springframework.boot.http.client.ClientHttpRequestFactorySettings;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpExecutionEngineTest {

    private final AutomationRunRepository repository = mock(AutomationRunRepository.class);
    private final Map<UUID, AutomationRun> rows = new ConcurrentHashMap<>();
    private final ExecutorService workerExecutor = Executors.newSingleThreadExecutor();
    private final JsonProcessingService jsonProcessingService = new JsonProcessingService(new ObjectMapper());
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);

    private MockRestServiceServer server;
    private HttpExecutionEngine engine;

    @BeforeEach
    void setUp() {
        when(repository.save(any(AutomationRun.class))).thenAnswer(invocation -> {
            AutomationRun run = invocation.getArgument(0);
            if (run.getId() == null) {
                run.setId(UUID.randomUUID());
            }
            rows.put(run.getId(), run);
            return run;
        });
        when(repository.findById(any(UUID.class)))
                .thenAnswer(invocation -> Optional.ofNullable(rows.get(invocation.<UUID>getArgument(0))));

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        engine = new HttpExecutionEngine(repository, jsonProcessingService, builder.build(), workerExecutor, clock);
    }

    @AfterEach
    void tearDown() {
        workerExecutor.shutdownNow();
    }

    @Test
    void testPostsSeedInputAndRecordsResult() throws Exception {
        server.expect(requestTo("https://hooks.example.test/wf-1"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.automationId").value("wf-1"))
                .andExpect(jsonPath("$.entryPoint").value("Manual"))
                .andExpect(jsonPath("$.mode").value("MANUAL"))
                .andExpect(jsonPath("$.input.message").value("hello"))
                .andRespond(withSuccess("{\"rows\":3}", MediaType.APPLICATION_JSON));

        String runId = engine.submit(request("https://hooks.example.test/wf-1"));
        RunResult result = engine.awaitResult(runId).get(5, TimeUnit.SECONDS);

        assertEquals(runId, result.runId());
        assertEquals(RunStatus.SUCCESS, result.status());
        assertEquals(3, result.resultData().get("rows"));
        server.verify();

        AutomationRun row = rows.get(UUID.fromString(runId));
        assertEquals(RunStatus.SUCCESS, row.getStatus());
        assertEquals("{\"rows\":3}", row.getResultData());
        assertNotNull(row.getFinishedAt());
        assertTrue(row.getSeedInput().contains("\"message\":\"hello\""));
    }

    @Test
    void testServerErrorBecomesErrorRun() throws Exception {
        server.expect(requestTo("https://hooks.example.test/wf-1")).andRespond(withServerError());

        String runId = engine.submit(request("https://hooks.example.test/wf-1"));
        RunResult result = engine.awaitResult(runId).get(5, TimeUnit.SECONDS);

        assertEquals(RunStatus.ERROR, result.status());
        assertEquals("HTTP 500 from automation endpoint", result.resultData().get("error"));
    }

    @Test
    void testMissingEndpointBecomesErrorRun() throws Exception {
        String runId = engine.submit(request(null));
        RunResult result = engine.awaitResult(runId).get(5, TimeUnit.SECONDS);

        assertEquals(RunStatus.ERROR, result.status());
        assertEquals("Automation wf-1 has no endpoint URL", result.resultData().get("error"));
    }

    @Test
    void testFinishedRunIsReadBackFromRepository() throws Exception {
        UUID id = UUID.randomUUID();
        rows.put(id, AutomationRun.builder().id(id).automationId("wf-1").status(RunStatus.SUCCESS)
                .resultData("{\"ok\":true}").build());

        RunResult result = engine.awaitResult(id.toString()).get(1, TimeUnit.SECONDS);

        assertEquals(RunStatus.SUCCESS, result.status());
        assertEquals(true, result.resultData().get("ok"));
    }

    @Test
    void testUnknownRun() {
        assertThrows(ExecutionException.class, () -> engine.awaitResult("not-a-run").get());
        assertThrows(ExecutionException.class, () -> engine.awaitResult(UUID.randomUUID().toString()).get());
    }

    @Test
    void testAbandonedRunIsClosedAndDoesNotBlockLaterRuns() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService endpointExecutor = Executors.newCachedThreadPool();
        HttpServer endpoint = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        endpoint.setExecutor(endpointExecutor);
        endpoint.createContext("/hang", exchange -> {
            try {
                release.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            exchange.close();
        });
        endpoint.createContext("/fast", exchange -> {
            byte[] body = "{\"ok\":true}".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, body.length);
            exchange.getResponseBody().write(body);
            exchange.close();
        });
        endpoint.start();
        try {
            ClientHttpRequestFactorySettings settings = ClientHttpRequestFactorySettings.defaults()
                    .withConnectTimeout(Duration.ofMillis(300))
                    .withReadTimeout(Duration.ofMillis(300));
            RestClient timedClient = RestClient.builder()
                    .requestFactory(ClientHttpRequestFactoryBuilder.jdk().build(settings))
                    .build();
            HttpExecutionEngine timedEngine =
                    new HttpExecutionEngine(repository, jsonProcessingService, timedClient, workerExecutor, clock);
            String baseUrl = "http://127.0.0.1:" + endpoint.getAddress().getPort();

            String hungRun = timedEngine.submit(request(baseUrl + "/hang"));
            CompletableFuture<RunResult> hungResult = timedEngine.awaitResult(hungRun);
            assertThrows(TimeoutException.class, () -> hungResult.get(100, TimeUnit.MILLISECONDS));
            timedEngine.abandon(hungRun, "Automation execution timed out after 100 ms");

            AutomationRun hungRow = rows.get(UUID.fromString(hungRun));
            assertTrue(hungResult.isCancelled());
            assertEquals(RunStatus.ERROR, hungRow.getStatus());
            assertTrue(hungRow.getResultData().contains("timed out after 100 ms"));
            assertNotNull(hungRow.getFinishedAt());

            String fastRun = timedEngine.submit(request(baseUrl + "/fast"));
            RunResult fastResult = timedEngine.awaitResult(fastRun).get(5, TimeUnit.SECONDS);
            assertEquals(RunStatus.SUCCESS, fastResult.status());
            assertEquals(true, fastResult.resultData().get("ok"));

            assertEquals(RunStatus.ERROR, hungRow.getStatus());
            assertTrue(hungRow.getResultData().contains("timed out after 100 ms"));
            RunResult abandoned = timedEngine.awaitResult(hungRun).get(1, TimeUnit.SECONDS);
            assertEquals(RunStatus.ERROR, abandoned.status());
        } finally {
            release.countDown();
            endpoint.stop(0);
            endpointExecutor.shutdownNow();
        }
    }

    @Test
    void testAbandonAfterFinishKeepsResult() throws Exception {
        server.expect(requestTo("https://hooks.example.test/wf-1"))
                .andRespond(withSuccess("{\"rows\":1}", MediaType.APPLICATION_JSON));

        String runId = engine.submit(request("https://hooks.example.test/wf-1"));
        engine.awaitResult(runId).get(5, TimeUnit.SECONDS);
        engine.abandon(runId, "too late");

        assertEquals(RunStatus.SUCCESS, rows.get(UUID.fromString(runId)).getStatus());
    }

    private AutomationRunRequest request(String endpointUrl) {
        return new AutomationRunRequest("wf-1", endpointUrl, UUID.randomUUID(), "Manual", ExecutionMode.MANUAL,
                Map.of("triggeredByAgent", true, "message", "hello"));
    }
}
