package io.taskrelay.server.auth;

/**
 * The caller of a request, as established by the binding's authentication layer.
 */
public interface User {

    boolean isAuthenticated();

    String getUsername();
}
