/**
 * Outbound HTTP for the delegation core.
 *
 * <p>{@link io.taskrelay.client.http.HttpClient} is a small asynchronous abstraction bound
 * to one endpoint; the server uses it to POST webhook notifications and the client uses it
 * to fetch agent cards through {@link io.taskrelay.client.http.A2ACardResolver}. The
 * default implementation wraps the JDK {@code java.net.http.HttpClient}.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * HttpClient client = HttpClient.createHttpClient("https://hooks.example.com");
 * HttpResponse response = client.post("/a2a/events")
 *     .addHeader("X-A2A-Notification-Token", token)
 *     .timeout(Duration.ofSeconds(15))
 *     .body(json)
 *     .send()
 *     .get();
 * }</pre>
 */
@NullMarked
package io.taskrelay.client.http;

import org.jspecify.annotations.NullMarked;
