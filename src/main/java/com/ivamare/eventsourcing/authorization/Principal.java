package com.ivamare.eventsourcing.authorization;

import java.util.Set;

/**
 * The identity a command is applied on behalf of.
 *
 * @param name principal name, recorded as the actor of resulting events
 * @param roles granted roles
 */
public record Principal(String name, Set<String> roles) {

    private static final Principal ANONYMOUS = new Principal("anonymous", Set.of());
    private static final Principal SYSTEM = new Principal("system", Set.of("system"));

    public Principal {
        roles = roles != null ? Set.copyOf(roles) : Set.of();
    }

    public static Principal of(String name, String... roles) {
        return new Principal(name, Set.of(roles));
    }

    public static Principal anonymous() {
        return ANONYMOUS;
    }

    /**
     * The principal scheduled commands are delivered as.
     */
    public static Principal system() {
        return SYSTEM;
    }

    public boolean isAuthenticated() {
        return !ANONYMOUS.equals(this);
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }
}
