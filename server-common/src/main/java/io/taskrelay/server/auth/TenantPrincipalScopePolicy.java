package io.taskrelay.server.auth;

import jakarta.enterprise.context.ApplicationScoped;

import io.taskrelay.server.ServerCallContext;
import org.jspecify.annotations.Nullable;

/**
 * Scopes tasks by tenant and principal name. Unauthenticated callers share the
 * {@link AuthorizationScope#ANONYMOUS} principal of their tenant.
 */
@ApplicationScoped
public class TenantPrincipalScopePolicy implements ScopePolicy {

    @Override
    public AuthorizationScope resolve(@Nullable ServerCallContext context, @Nullable String tenant) {
        String principal = AuthorizationScope.ANONYMOUS;
        if (context != null && context.getUser().isAuthenticated()) {
            principal = context.getUser().getUsername();
        }
        return new AuthorizationScope(tenant == null ? "" : tenant, principal);
    }
}
