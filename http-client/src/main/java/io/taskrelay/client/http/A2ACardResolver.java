package io.taskrelay.client.http;

import static io.taskrelay.util.Utils.unmarshalFrom;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.taskrelay.common.A2AHeaders;
import io.taskrelay.spec.A2AClientException;
import io.taskrelay.spec.A2AClientJsonException;
import io.taskrelay.spec.AgentCard;
import org.jspecify.annotations.Nullable;

/**
 * Fetches an agent's card from its well-known discovery path.
 */
public class A2ACardResolver {
    private final HttpClient httpClient;
    private final @Nullable Map<String, String> authHeaders;
    private final String agentCardPath;

    /**
     * Get the agent card for an A2A agent.
     * The {@code HttpClient} will be used to fetch the agent card.
     *
     * @param baseUrl the base URL for the agent whose agent card we want to retrieve
     * @throws A2AClientException if the URL for the agent is invalid
     */
    public A2ACardResolver(String baseUrl) throws A2AClientException {
        this.authHeaders = null;
        try {
            this.agentCardPath = resolvePath(new URI(baseUrl).getPath());
        } catch (URISyntaxException e) {
            throw new A2AClientException("Invalid agent URL", e);
        }
        this.httpClient = HttpClient.createHttpClient(baseUrl);
    }

    A2ACardResolver(HttpClient httpClient) {
        this(httpClient, null, null);
    }

    /**
     * @param httpClient the http client to use
     * @param agentCardPath optional path to the agent card endpoint relative to the base
     *                         agent URL, defaults to ".well-known/agent-card.json"
     * @param authHeaders the HTTP authentication headers to use. May be {@code null}
     */
    public A2ACardResolver(HttpClient httpClient, @Nullable String agentCardPath,
                           @Nullable Map<String, String> authHeaders) {
        this.httpClient = httpClient;
        this.agentCardPath = resolvePath(agentCardPath);
        this.authHeaders = authHeaders;
    }

    private static String resolvePath(@Nullable String path) {
        if (path == null) {
            return AgentCard.WELL_KNOWN_PATH;
        }
        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        if (path.isEmpty()) {
            return AgentCard.WELL_KNOWN_PATH;
        } else if (path.endsWith(AgentCard.WELL_KNOWN_PATH)) {
            return path;
        }
        return path + AgentCard.WELL_KNOWN_PATH;
    }

    String getAgentCardPath() {
        return agentCardPath;
    }

    /**
     * Get the agent card for the configured A2A agent.
     *
     * @return the agent card
     * @throws A2AClientException If an HTTP error occurs fetching the card
     * @throws A2AClientJsonException if the response body cannot be decoded as an agent card
     */
    public AgentCard getAgentCard() throws A2AClientException {
        HttpClient.GetRequestBuilder builder = httpClient.get(agentCardPath)
                .addHeader(A2AHeaders.CONTENT_TYPE, A2AHeaders.APPLICATION_JSON);

        if (authHeaders != null) {
            builder.addHeaders(authHeaders);
        }

        String body;
        try {
            HttpResponse response = builder.send().get();
            if (!response.success()) {
                throw new A2AClientException("Failed to obtain agent card: " + response.statusCode());
            }
            body = response.body();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new A2AClientException("Interrupted while obtaining agent card", e);
        } catch (ExecutionException e) {
            throw new A2AClientException("Failed to obtain agent card", e.getCause() != null ? e.getCause() : e);
        }

        try {
            return unmarshalFrom(body, AgentCard.class);
        } catch (JsonProcessingException e) {
            throw new A2AClientJsonException("Could not unmarshal agent card response", e);
        }
    }
}
