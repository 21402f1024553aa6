package io.taskrelay.client;

import java.net.URI;
import java.net.URISyntaxException;

import io.taskrelay.client.http.A2ACardResolver;
import io.taskrelay.client.http.HttpClient;
import io.taskrelay.spec.A2AClientException;
import io.taskrelay.spec.AgentCard;

/**
 * Fetches the card of the agent a {@link ClientConfig} points at.
 */
public final class AgentCards {

    private AgentCards() {
    }

    public static AgentCard fetch(ClientConfig config) throws A2AClientException {
        String url = config.url();
        if (url == null || url.isBlank()) {
            throw new A2AClientException("No agent URL configured");
        }
        String path;
        try {
            path = new URI(url).getPath();
        } catch (URISyntaxException e) {
            throw new A2AClientException("Invalid agent URL: " + url, e);
        }
        HttpClient httpClient;
        try {
            httpClient = HttpClient.createHttpClient(url);
        } catch (IllegalArgumentException e) {
            throw new A2AClientException("Invalid agent URL: " + url, e);
        }
        return new A2ACardResolver(httpClient, path, config.authHeaders()).getAgentCard();
    }
}
