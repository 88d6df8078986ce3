package io.codecarver.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.codecarver.core.carver.Carver;
import io.codecarver.core.carver.DeploymentFailedException;
import io.codecarver.core.metrics.HttpMetrics;
import io.codecarver.core.protocol.CodeAddress;
import io.codecarver.core.protocol.Hex;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class ApiServer {
    private static final Logger LOG = Logger.getLogger(ApiServer.class.getName());
    private static final byte[] OPENAPI_SPEC = """
{
  "openapi": "3.0.3",
  "info": {
    "title": "Code Carver API",
    "version": "1.0.0"
  },
  "paths": {
    "/address": {
      "get": {
        "summary": "Predict the address runtime code is carved at",
        "parameters": [
          { "name": "code", "in": "query", "required": true, "schema": { "type": "string" } }
        ],
        "responses": {
          "200": { "description": "Derived address" },
          "400": { "description": "Invalid hex" },
          "401": { "description": "Auth required" }
        }
      }
    },
    "/carve": {
      "post": {
        "summary": "Carve runtime code at its derived address",
        "requestBody": {
          "required": true,
          "content": {
            "application/json": {
              "schema": { "$ref": "#/components/schemas/CarveRequest" }
            }
          }
        },
        "responses": {
          "201": { "description": "Code carved" },
          "400": { "description": "Invalid request" },
          "401": { "description": "Auth required" },
          "409": { "description": "Deployment failed" }
        }
      }
    },
    "/carved": {
      "get": {
        "summary": "Check whether an address holds code that re-derives to it",
        "parameters": [
          { "name": "address", "in": "query", "required": true, "schema": { "type": "string" } }
        ],
        "responses": {
          "200": { "description": "Verification result" },
          "400": { "description": "Invalid address" },
          "401": { "description": "Auth required" }
        }
      }
    },
    "/code": {
      "get": {
        "summary": "Read the code stored at an address",
        "parameters": [
          { "name": "address", "in": "query", "required": true, "schema": { "type": "string" } }
        ],
        "responses": {
          "200": { "description": "Stored code" },
          "400": { "description": "Invalid address" },
          "401": { "description": "Auth required" }
        }
      }
    },
    "/metrics": {
      "get": {
        "summary": "Metrics scrape",
        "responses": { "200": { "description": "Metrics text" }, "401": { "description": "Auth required" } }
      }
    },
    "/openapi.json": {
      "get": {
        "summary": "Return this OpenAPI document",
        "responses": { "200": { "description": "OpenAPI specification" } }
      }
    }
  },
  "components": {
    "schemas": {
      "CarveRequest": {
        "type": "object",
        "required": ["codeHex"],
        "properties": {
          "codeHex": { "type": "string", "description": "Runtime code, hex with optional 0x prefix" }
        }
      }
    }
  }
}
""".getBytes(StandardCharsets.UTF_8);

    private final Carver carver;
    private final String bindAddress;
    private final int port;
    private final String authToken;
    private final ObjectMapper mapper;
    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(Carver carver, String bindAddress, int port, String authToken) {
        this.carver = carver;
        this.bindAddress = (bindAddress == null || bindAddress.isBlank()) ? "127.0.0.1" : bindAddress;
        this.port = port;
        this.authToken = (authToken == null || authToken.isBlank()) ? null : authToken;
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("API server already running");
        }
        server = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        server.createContext("/address", new AddressHandler());
        server.createContext("/carve", new CarveHandler());
        server.createContext("/carved", new CarvedHandler());
        server.createContext("/code", new CodeHandler());
        server.createContext("/metrics", new MetricsHandler(this::ensureAuthorized));
        server.createContext("/openapi.json", new OpenApiHandler());
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        LOG.info(() -> "API server listening on http://" + bindAddress + ':' + port + (authToken != null ? " (auth required)" : ""));
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    int ensureAuthorized(HttpExchange exchange) throws IOException {
        if (authToken == null) {
            return -1;
        }
        List<String> authHeaders = exchange.getRequestHeaders().get("Authorization");
        if (authHeaders != null) {
            for (String header : authHeaders) {
                if (header != null && header.equals("Bearer " + authToken)) {
                    return -1;
                }
            }
        }
        String apiKey = exchange.getRequestHeaders().getFirst("X-API-Key");
        if (apiKey != null && apiKey.equals(authToken)) {
            return -1;
        }
        exchange.getResponseHeaders().set("WWW-Authenticate", "Bearer");
        return sendError(exchange, 401, "unauthorized", "Missing or invalid credentials");
    }

    /** Shared method check, auth and metrics around one endpoint. */
    private abstract class JsonHandler implements HttpHandler {
        private final String allowedMethod;

        JsonHandler(String allowedMethod) {
            this.allowedMethod = allowedMethod;
        }

        @Override
        public final void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            var sample = HttpMetrics.start();
            int status = 500;
            try {
                if (!allowedMethod.equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use " + allowedMethod + " for this endpoint");
                    return;
                }
                status = ensureAuthorized(exchange);
                if (status != -1) {
                    return;
                }
                status = respond(exchange);
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Request to " + path + " failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                HttpMetrics.stop(sample, method, path, status);
                exchange.close();
            }
        }

        abstract int respond(HttpExchange exchange) throws IOException;
    }

    final class AddressHandler extends JsonHandler {
        AddressHandler() { super("GET"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            String codeHex = queryParam(exchange, "code");
            if (codeHex == null) {
                return sendError(exchange, 400, "missing_code", "Query parameter 'code' is required");
            }
            byte[] code;
            try {
                code = Hex.parse(codeHex);
            } catch (IllegalArgumentException e) {
                return sendError(exchange, 400, "invalid_code", e.getMessage());
            }
            CodeAddress address = carver.addressOf(code);
            ObjectNode resp = mapper.createObjectNode()
                    .put("address", address.hex())
                    .put("checksum", address.toChecksumHex())
                    .put("size", code.length);
            return sendJson(exchange, 200, resp);
        }
    }

    final class CarveHandler extends JsonHandler {
        CarveHandler() { super("POST"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            CarveRequest req;
            try {
                req = mapper.readValue(exchange.getRequestBody(), CarveRequest.class);
            } catch (JsonProcessingException e) {
                return sendError(exchange, 400, "invalid_json", "Failed to parse carve request");
            }
            if (req == null || req.codeHex == null) {
                return sendError(exchange, 400, "missing_code", "Field 'codeHex' is required");
            }
            byte[] code;
            try {
                code = Hex.parse(req.codeHex);
            } catch (IllegalArgumentException e) {
                return sendError(exchange, 400, "invalid_code", e.getMessage());
            }
            try {
                CodeAddress address = carver.carve(code);
                ObjectNode resp = mapper.createObjectNode()
                        .put("address", address.hex())
                        .put("checksum", address.toChecksumHex())
                        .put("size", code.length);
                return sendJson(exchange, 201, resp);
            } catch (DeploymentFailedException e) {
                return sendError(exchange, 409, "deployment_failed", Optional.ofNullable(e.getMessage()).orElse("Deployment failed"));
            }
        }
    }

    final class CarvedHandler extends JsonHandler {
        CarvedHandler() { super("GET"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            CodeAddress address = addressParam(exchange);
            if (address == null) {
                return sendError(exchange, 400, "invalid_address", "Query parameter 'address' must be a 20-byte hex address");
            }
            ObjectNode resp = mapper.createObjectNode()
                    .put("address", address.hex())
                    .put("carved", carver.isCarved(address));
            return sendJson(exchange, 200, resp);
        }
    }

    final class CodeHandler extends JsonHandler {
        CodeHandler() { super("GET"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            CodeAddress address = addressParam(exchange);
            if (address == null) {
                return sendError(exchange, 400, "invalid_address", "Query parameter 'address' must be a 20-byte hex address");
            }
            byte[] code = carver.ledger().readCode(address);
            ObjectNode resp = mapper.createObjectNode()
                    .put("address", address.hex())
                    .put("size", code.length)
                    .put("codeHex", Hex.toPrefixedHex(code))
                    .put("carved", carver.isCarved(address));
            return sendJson(exchange, 200, resp);
        }
    }

    final class OpenApiHandler extends JsonHandler {
        OpenApiHandler() { super("GET"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            return sendJson(exchange, 200, OPENAPI_SPEC);
        }
    }

    public static class CarveRequest {
        public String codeHex;
    }

    private CodeAddress addressParam(HttpExchange exchange) {
        String value = queryParam(exchange, "address");
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return CodeAddress.fromHex(value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private int sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload;
        if (body instanceof byte[] bytes) {
            payload = bytes;
        } else {
            payload = mapper.writeValueAsBytes(body);
        }
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
        return status;
    }

    private int sendError(HttpExchange exchange, int status, String code, String message) throws IOException {
        ObjectNode node = mapper.createObjectNode();
        node.put("error", code);
        node.put("message", message);
        return sendJson(exchange, status, node);
    }

    private static String queryParam(HttpExchange exchange, String key) {
        String query = exchange.getRequestURI().getRawQuery();
        if (query == null || query.isBlank()) {
            return null;
        }
        for (String part : query.split("&")) {
            if (part.isEmpty()) {
                continue;
            }
            String[] kv = part.split("=", 2);
            String k = URLDecoder.decode(kv[0], StandardCharsets.UTF_8);
            if (key.equals(k)) {
                return kv.length == 2 ? URLDecoder.decode(kv[1], StandardCharsets.UTF_8) : "";
            }
        }
        return null;
    }
}
