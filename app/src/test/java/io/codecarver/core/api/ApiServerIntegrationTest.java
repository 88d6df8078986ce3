package io.codecarver.core.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.codecarver.core.carver.Carver;
import io.codecarver.core.config.CarverConfig;
import io.codecarver.core.ledger.InMemoryLedger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.junit.jupiter.api.Assertions.*;

class ApiServerIntegrationTest {

    private static final String RETURN_42_CODE = "0x602a60005260206000f3";
    private static final String RETURN_42_ADDRESS = "0x1948446719e5292888e2f8a66f4d71a340e86f3a";

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http = HttpClient.newHttpClient();

    private ApiServer server;
    private int port;

    @BeforeEach
    void setUp() throws Exception {
        port = freePort();
        Carver carver = new Carver(new InMemoryLedger(), CarverConfig.defaultLocal());
        server = new ApiServer(carver, "127.0.0.1", port, null);
        server.start();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    void carveThenVerifyAndRead() throws Exception {
        HttpResponse<String> predicted = get("/address?code=" + RETURN_42_CODE);
        assertEquals(200, predicted.statusCode());
        assertEquals(RETURN_42_ADDRESS, mapper.readTree(predicted.body()).path("address").asText());

        HttpResponse<String> before = get("/carved?address=" + RETURN_42_ADDRESS);
        assertFalse(mapper.readTree(before.body()).path("carved").asBoolean());

        HttpResponse<String> carved = post("/carve", "{\"codeHex\":\"" + RETURN_42_CODE + "\"}");
        assertEquals(201, carved.statusCode());
        JsonNode body = mapper.readTree(carved.body());
        assertEquals(RETURN_42_ADDRESS, body.path("address").asText());
        assertEquals("0x1948446719E5292888e2f8a66f4d71a340E86F3a", body.path("checksum").asText());
        assertEquals(10, body.path("size").asInt());

        HttpResponse<String> after = get("/carved?address=" + RETURN_42_ADDRESS);
        assertTrue(mapper.readTree(after.body()).path("carved").asBoolean());

        JsonNode code = mapper.readTree(get("/code?address=" + RETURN_42_ADDRESS).body());
        assertEquals(RETURN_42_CODE, code.path("codeHex").asText());
        assertEquals(10, code.path("size").asInt());
        assertTrue(code.path("carved").asBoolean());
    }

    @Test
    void secondCarveConflicts() throws Exception {
        assertEquals(201, post("/carve", "{\"codeHex\":\"" + RETURN_42_CODE + "\"}").statusCode());
        HttpResponse<String> again = post("/carve", "{\"codeHex\":\"" + RETURN_42_CODE + "\"}");
        assertEquals(409, again.statusCode());
        assertEquals("deployment_failed", mapper.readTree(again.body()).path("error").asText());
    }

    @Test
    void rejectedCodeConflicts() throws Exception {
        assertEquals(409, post("/carve", "{\"codeHex\":\"\"}").statusCode());
        assertEquals(409, post("/carve", "{\"codeHex\":\"0xef00\"}").statusCode());
    }

    @Test
    void malformedRequestsAreBadRequests() throws Exception {
        assertEquals(400, post("/carve", "{ nope").statusCode());
        assertEquals(400, post("/carve", "{}").statusCode());
        HttpResponse<String> badHex = post("/carve", "{\"codeHex\":\"0xabc\"}");
        assertEquals(400, badHex.statusCode());
        assertEquals("invalid_code", mapper.readTree(badHex.body()).path("error").asText());
        assertEquals(400, get("/address").statusCode());
        assertEquals(400, get("/carved?address=0x1234").statusCode());
        assertEquals(400, get("/code").statusCode());
    }

    @Test
    void wrongMethodIsRejected() throws Exception {
        assertEquals(405, get("/carve").statusCode());
        assertEquals(405, post("/address?code=00", "{}").statusCode());
    }

    @Test
    void metricsAndOpenApiAreServed() throws Exception {
        post("/carve", "{\"codeHex\":\"0x01\"}");
        HttpResponse<String> metrics = get("/metrics");
        assertEquals(200, metrics.statusCode());
        assertTrue(metrics.body().contains("carve.success"));

        HttpResponse<String> openApi = get("/openapi.json");
        assertEquals(200, openApi.statusCode());
        assertTrue(mapper.readTree(openApi.body()).path("paths").has("/carve"));
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(new URI("http://127.0.0.1:" + port + path)).GET().build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(new URI("http://127.0.0.1:" + port + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static int freePort() throws Exception {
        try (java.net.ServerSocket socket = new java.net.ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }
}
