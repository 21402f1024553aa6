package io.taskrelay.server.auth;

public final class UnauthenticatedUser implements User {

    public static final UnauthenticatedUser INSTANCE = new UnauthenticatedUser();

    private UnauthenticatedUser() {
    }

    @Override
    public boolean isAuthenticated() {
        return false;
    }

    @Override
    public String getUsername() {
        return "";
    }
}
