package io.codecarver.core.api;

import io.codecarver.core.carver.Carver;
import io.codecarver.core.config.CarverConfig;
import io.codecarver.core.ledger.InMemoryLedger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.junit.jupiter.api.Assertions.*;

class ApiServerAuthTest {

    private ApiServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    void endpointsRequireToken() throws Exception {
        int port = freePort();
        server = new ApiServer(new Carver(new InMemoryLedger(), CarverConfig.defaultLocal()), "127.0.0.1", port, "secret-token");
        server.start();

        HttpClient client = HttpClient.newHttpClient();
        URI uri = new URI("http://127.0.0.1:" + port + "/address?code=0x01");

        HttpResponse<String> unauthorized = client.send(HttpRequest.newBuilder(uri).GET().build(), HttpResponse.BodyHandlers.ofString());
        assertEquals(401, unauthorized.statusCode());
        assertTrue(unauthorized.headers().firstValue("WWW-Authenticate").isPresent());

        HttpResponse<String> bearer = client.send(HttpRequest.newBuilder(uri)
                .header("Authorization", "Bearer secret-token")
                .GET()
                .build(), HttpResponse.BodyHandlers.ofString());
        assertEquals(200, bearer.statusCode());

        HttpResponse<String> apiKey = client.send(HttpRequest.newBuilder(uri)
                .header("X-API-Key", "secret-token")
                .GET()
                .build(), HttpResponse.BodyHandlers.ofString());
        assertEquals(200, apiKey.statusCode());

        URI metrics = new URI("http://127.0.0.1:" + port + "/metrics");
        assertEquals(401, client.send(HttpRequest.newBuilder(metrics).GET().build(), HttpResponse.BodyHandlers.ofString()).statusCode());
    }

    private static int freePort() throws Exception {
        try (java.net.ServerSocket socket = new java.net.ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }
}
