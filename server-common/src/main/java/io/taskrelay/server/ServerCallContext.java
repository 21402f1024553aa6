package io.taskrelay.server;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import io.taskrelay.server.auth.User;
import io.taskrelay.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Per-request information a binding hands to the request handler: the authenticated
 * caller, binding specific state (headers, transport attributes), the extensions and the
 * protocol version the caller declared.
 * <p>
 * The handler records the extensions it activated for the request here, so the binding can
 * echo them back to the caller.
 */
public class ServerCallContext {

    private final User user;
    private final Map<String, Object> state;
    private final Set<String> requestedExtensions;
    private final Set<String> activatedExtensions = ConcurrentHashMap.newKeySet();
    private final @Nullable String requestedProtocolVersion;

    public ServerCallContext(User user, Map<String, Object> state, Set<String> requestedExtensions) {
        this(user, state, requestedExtensions, null);
    }

    public ServerCallContext(User user, Map<String, Object> state, Set<String> requestedExtensions,
                             @Nullable String requestedProtocolVersion) {
        this.user = Assert.checkNotNullParam("user", user);
        this.state = new HashMap<>(Assert.checkNotNullParam("state", state));
        this.requestedExtensions = Set.copyOf(Assert.checkNotNullParam("requestedExtensions", requestedExtensions));
        this.requestedProtocolVersion = requestedProtocolVersion;
    }

    public User getUser() {
        return user;
    }

    public Map<String, Object> getState() {
        return state;
    }

    public Set<String> getRequestedExtensions() {
        return requestedExtensions;
    }

    public Set<String> getActivatedExtensions() {
        return Collections.unmodifiableSet(activatedExtensions);
    }

    public void activateExtension(String uri) {
        activatedExtensions.add(uri);
    }

    public boolean isExtensionActive(String uri) {
        return activatedExtensions.contains(uri);
    }

    public @Nullable String getRequestedProtocolVersion() {
        return requestedProtocolVersion;
    }
}
