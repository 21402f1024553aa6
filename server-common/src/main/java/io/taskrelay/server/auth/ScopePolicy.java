package io.taskrelay.server.auth;

import io.taskrelay.server.ServerCallContext;
import org.jspecify.annotations.Nullable;

/**
 * Computes the caller's {@link AuthorizationScope} for a request.
 * <p>
 * Deployments with a richer authorization model (roles, delegated access) provide their own
 * implementation; the request handler consults it before every read or mutation.
 */
@FunctionalInterface
public interface ScopePolicy {

    /**
     * @param context the call context, or {@code null} for in-process calls without one
     * @param tenant the tenant named by the request, or {@code null}
     * @return the scope the request runs under
     */
    AuthorizationScope resolve(@Nullable ServerCallContext context, @Nullable String tenant);
}
