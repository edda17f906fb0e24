package com.ivamare.eventsourcing.aggregate;

import com.ivamare.eventsourcing.authorization.AuthorizationPolicy;
import com.ivamare.eventsourcing.authorization.Principal;
import com.ivamare.eventsourcing.clock.Clock;

import java.util.Objects;

/**
 * Ambient values a command is applied with.
 *
 * @param clock time source for event timestamps and scheduling
 * @param principal who the command is applied for, unless the command names its own
 * @param authorizationPolicy decides whether the principal may apply the command
 */
public record CommandContext(Clock clock, Principal principal, AuthorizationPolicy authorizationPolicy) {

    public CommandContext {
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(authorizationPolicy, "authorizationPolicy");
        principal = principal != null ? principal : Principal.anonymous();
    }

    public static CommandContext of(Clock clock, Principal principal, AuthorizationPolicy authorizationPolicy) {
        return new CommandContext(clock, principal, authorizationPolicy);
    }

    /**
     * System principal on the wall clock, allowed by {@link AuthorizationPolicy#systemOnly()}.
     */
    public static CommandContext system() {
        return new CommandContext(Clock.system(), Principal.system(), AuthorizationPolicy.systemOnly());
    }

    public CommandContext withClock(Clock clock) {
        return new CommandContext(clock, principal, authorizationPolicy);
    }

    public CommandContext withPrincipal(Principal principal) {
        return new CommandContext(clock, principal, authorizationPolicy);
    }
}
