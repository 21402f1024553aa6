package io.taskrelay.server.auth;

import io.taskrelay.util.Assert;

/**
 * The set of tasks a caller may see: a task is visible only to the scope that created it.
 *
 * @param tenant the tenant the request addressed, empty for the default tenant
 * @param principal the authenticated principal name, or {@link #ANONYMOUS}
 */
public record AuthorizationScope(String tenant, String principal) {

    public static final String ANONYMOUS = "anonymous";

    public AuthorizationScope {
        Assert.checkNotNullParam("tenant", tenant);
        Assert.checkNotNullParam("principal", principal);
    }

    public static AuthorizationScope anonymous() {
        return new AuthorizationScope("", ANONYMOUS);
    }

    public boolean permits(AuthorizationScope owner) {
        return equals(owner);
    }
}
