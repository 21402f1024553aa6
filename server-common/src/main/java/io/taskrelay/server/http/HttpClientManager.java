package io.taskrelay.server.http;

import java.net.URI;
import java.net.URL;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.taskrelay.client.http.HttpClient;
import io.taskrelay.client.http.HttpClientBuilder;
import io.taskrelay.util.Assert;

/**
 * Shares one {@link HttpClient} per webhook endpoint (scheme, host and port) so deliveries
 * to the same receiver reuse its connection pool.
 */
@ApplicationScoped
public class HttpClientManager {

    private final Map<Endpoint, HttpClient> clients = new ConcurrentHashMap<>();
    private final HttpClientBuilder clientBuilder;

    public HttpClientManager() {
        this(HttpClientBuilder.DEFAULT_FACTORY);
    }

    public HttpClientManager(HttpClientBuilder clientBuilder) {
        this.clientBuilder = clientBuilder;
    }

    /**
     * @param url any URL of the endpoint
     * @return the client for the endpoint
     * @throws IllegalArgumentException if the URL is malformed
     */
    public HttpClient getOrCreate(String url) {
        Assert.checkNotNullParam("url", url);
        Endpoint endpoint;
        try {
            endpoint = Endpoint.from(URI.create(url).toURL());
        } catch (Exception ex) {
            throw new IllegalArgumentException("URL is malformed: [" + url + "]", ex);
        }
        return clients.computeIfAbsent(endpoint, e -> clientBuilder.create(url));
    }

    private record Endpoint(String scheme, String host, int port) {

        static Endpoint from(URL url) {
            return new Endpoint(url.getProtocol().toLowerCase(Locale.ROOT), url.getHost().toLowerCase(Locale.ROOT),
                    url.getPort() != -1 ? url.getPort() : url.getDefaultPort());
        }
    }
}
