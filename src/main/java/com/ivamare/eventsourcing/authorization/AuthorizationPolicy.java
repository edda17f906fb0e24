package com.ivamare.eventsourcing.authorization;

import com.ivamare.eventsourcing.aggregate.Command;
import com.ivamare.eventsourcing.aggregate.EventSourcedAggregate;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiPredicate;

/**
 * Decides whether a principal may apply a command to a target aggregate.
 *
 * <p>Policies travel in the {@link com.ivamare.eventsourcing.aggregate.CommandContext}. Anything a
 * policy does not explicitly grant is denied.
 */
@FunctionalInterface
public interface AuthorizationPolicy {

    boolean isAuthorized(Principal principal, Command<?> command, EventSourcedAggregate target);

    default AuthorizationPolicy or(AuthorizationPolicy other) {
        return (principal, command, target) ->
            isAuthorized(principal, command, target) || other.isAuthorized(principal, command, target);
    }

    static AuthorizationPolicy denyAll() {
        return (principal, command, target) -> false;
    }

    static AuthorizationPolicy permitAll() {
        return (principal, command, target) -> true;
    }

    /**
     * Grants every command to {@link Principal#system()} and nothing else.
     */
    static AuthorizationPolicy systemOnly() {
        return (principal, command, target) -> Principal.system().equals(principal);
    }

    static Builder forCommands() {
        return new Builder();
    }

    /**
     * Builds a policy from per-command-type grants.
     */
    class Builder {

        private final List<AuthorizationPolicy> grants = new ArrayList<>();

        /**
         * Grant {@code commandType} to any authenticated principal.
         */
        public Builder permitAuthenticated(Class<? extends Command<?>> commandType) {
            return permit(commandType, (principal, command) -> principal.isAuthenticated());
        }

        /**
         * Grant {@code commandType} to principals holding {@code role}.
         */
        public Builder permitRole(Class<? extends Command<?>> commandType, String role) {
            return permit(commandType, (principal, command) -> principal.hasRole(role));
        }

        @SuppressWarnings("unchecked")
        public <C extends Command<?>> Builder permit(Class<C> commandType, BiPredicate<Principal, C> rule) {
            grants.add((principal, command, target) ->
                commandType.isInstance(command) && rule.test(principal, (C) command));
            return this;
        }

        public AuthorizationPolicy build() {
            List<AuthorizationPolicy> snapshot = List.copyOf(grants);
            return (principal, command, target) -> {
                for (AuthorizationPolicy grant : snapshot) {
                    if (grant.isAuthorized(principal, command, target)) {
                        return true;
                    }
                }
                return false;
            };
        }
    }
}
