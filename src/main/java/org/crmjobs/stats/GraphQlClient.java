package org.crmjobs.stats;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectReader;
import org.crmjobs.utils.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;

/**
 * Minimal GraphQL-over-HTTP client: POSTs a document and returns the "data" node.
 * Numbers are decoded as BigDecimal so monetary values keep their precision.
 */
public class GraphQlClient {
    private static final Logger logger = LoggerFactory.getLogger(GraphQlClient.class);

    private static final ObjectReader READER = JsonUtil.mapper().reader()
            .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private final URI endpoint;
    private final Duration timeout;
    private final HttpClient client;

    public GraphQlClient(String endpoint, Duration timeout) {
        this.endpoint = URI.create(endpoint);
        this.timeout = timeout;
        this.client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(timeout)
                .build();
    }

    public URI endpoint() {
        return endpoint;
    }

    /**
     * Execute a query or mutation.
     *
     * @return the "data" object of the response, never null
     * @throws FetchException on transport failure, non-200 status, GraphQL errors or a malformed body
     */
    public JsonNode execute(String document) throws FetchException {
        String body;
        try {
            body = JsonUtil.mapper().writeValueAsString(Map.of("query", document));
        } catch (JsonProcessingException e) {
            throw new FetchException("Failed to encode GraphQL request: " + e.getMessage(), e);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new FetchException("GraphQL request to " + endpoint + " timed out after " + timeout.toSeconds() + "s", e);
        } catch (IOException e) {
            throw new FetchException("GraphQL endpoint " + endpoint + " unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("GraphQL request to " + endpoint + " interrupted", e);
        }

        if (response.statusCode() != 200) {
            throw new FetchException("GraphQL endpoint " + endpoint + " returned HTTP " + response.statusCode());
        }

        JsonNode root;
        try {
            root = READER.readTree(response.body());
        } catch (IOException e) {
            throw new FetchException("Malformed GraphQL response: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new FetchException("Malformed GraphQL response: expected a JSON object");
        }

        JsonNode errors = root.path("errors");
        if (errors.isArray() && errors.size() > 0) {
            String message = errors.get(0).path("message").asText("unknown error");
            throw new FetchException("GraphQL error: " + message);
        }

        JsonNode data = root.path("data");
        if (!data.isObject()) {
            throw new FetchException("Malformed GraphQL response: no data");
        }
        logger.debug("GraphQL response received from {}", endpoint);
        return data;
    }
}
