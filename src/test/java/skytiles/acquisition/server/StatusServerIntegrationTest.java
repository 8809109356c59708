package skytiles.acquisition.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import skytiles.acquisition.config.AcquisitionConfig;
import skytiles.acquisition.config.Dependencies;
import skytiles.acquisition.model.ImageTimestamp;
import skytiles.acquisition.pipeline.PipelineDefinition;
import skytiles.acquisition.pipeline.ScriptedStep;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Hits the status API over HTTP against a real store and scheduler.
 */
class StatusServerIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path root;

    private Dependencies deps;
    private ScriptedStep step;
    private HttpClient httpClient;
    private String baseUrl;

    @BeforeEach
    void setUp() {
        AcquisitionConfig config = AcquisitionConfig.defaults()
                .withDataDir(root.resolve("data"))
                .withStateDir(root.resolve("state"))
                .withDatabaseUrl("jdbc:h2:mem:test-status-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;DATABASE_TO_UPPER=FALSE")
                .withMaxAttempts(3)
                .validate();

        step = ScriptedStep.succeeding("acquire", ".png");
        deps = Dependencies.create(config, Clock.systemUTC(),
                (c, index) -> new PipelineDefinition(List.of(step)));
        int port = deps.statusServer().start("127.0.0.1", 0);
        baseUrl = "http://127.0.0.1:" + port;

        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    @Test
    void healthReportsStoreAndQueue() throws Exception {
        HttpResponse<String> response = get("/api/v1/health");

        assertEquals(200, response.statusCode(), response.body());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("healthy", body.get("status").asText());
        assertEquals("ok", body.get("database").asText());
        assertEquals(0, body.get("retryQueue").asInt());
        assertEquals(0, body.get("failedTasks").asInt());
    }

    @Test
    @DisplayName("Trigger a timestamp over HTTP, then read its record back")
    void triggerThenReadRecord() throws Exception {
        HttpResponse<String> trigger = httpClient.send(
                HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + "/api/v1/timestamps/20250301101500/trigger"))
                        .POST(HttpRequest.BodyPublishers.noBody())
                        .build(),
                HttpResponse.BodyHandlers.ofString());

        assertEquals(202, trigger.statusCode(), trigger.body());
        JsonNode accepted = MAPPER.readTree(trigger.body());
        assertEquals("20250301101500", accepted.get("timestamp").asText());
        assertFalse(accepted.get("force").asBoolean());
        assertEquals("accepted", accepted.get("status").asText());

        JsonNode record = awaitStatus("20250301101500", "SUCCEEDED");
        assertEquals(1740824100L, record.get("epochSecond").asLong());
        assertEquals(1, record.get("attempts").asInt());
        assertFalse(record.get("givenUp").asBoolean());
        assertTrue(record.hasNonNull("finishedAt"));

        HttpResponse<String> list = get("/api/v1/timestamps?limit=10");
        assertEquals(200, list.statusCode());
        JsonNode listBody = MAPPER.readTree(list.body());
        assertEquals(1, listBody.get("count").asInt());
        assertEquals("20250301101500", listBody.get("records").get(0).get("timestamp").asText());
    }

    @Test
    void listIsNewestFirst() throws Exception {
        deps.repository().markRunning(ImageTimestamp.parse("20250301100000"));
        deps.repository().markRunning(ImageTimestamp.parse("20250301103000"));

        JsonNode body = MAPPER.readTree(get("/api/v1/timestamps").body());

        assertEquals(2, body.get("count").asInt());
        assertEquals("20250301103000", body.get("records").get(0).get("timestamp").asText());
        assertEquals("RUNNING", body.get("records").get(0).get("status").asText());
    }

    @Test
    void malformedIdIsBadRequest() throws Exception {
        assertEquals(400, get("/api/v1/timestamps/2025-03-01").statusCode());
        assertEquals(400, get("/api/v1/timestamps?limit=0").statusCode());
        assertEquals(400, get("/api/v1/timestamps?limit=abc").statusCode());
    }

    @Test
    void unknownRecordAndPathAreNotFound() throws Exception {
        assertEquals(404, get("/api/v1/timestamps/20250301101500").statusCode());
        assertEquals(404, get("/api/v1/nothing-here").statusCode());
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(
                HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode awaitStatus(String id, String status) throws Exception {
        long deadline = System.currentTimeMillis() + 5000;
        JsonNode last = null;
        while (System.currentTimeMillis() < deadline) {
            HttpResponse<String> response = get("/api/v1/timestamps/" + id);
            if (response.statusCode() == 200) {
                last = MAPPER.readTree(response.body());
                if (status.equals(last.get("status").asText())) {
                    return last;
                }
            }
            Thread.sleep(50);
        }
        fail("timestamp " + id + " never reached " + status + ", last: " + last);
        return last;
    }
}
