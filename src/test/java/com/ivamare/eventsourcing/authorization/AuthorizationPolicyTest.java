package com.ivamare.eventsourcing.authorization;

import com.ivamare.eventsourcing.testdomain.Order;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AuthorizationPolicy")
class AuthorizationPolicyTest {

    private final Order order = Order.TYPE.newInstance(UUID.randomUUID());

    @Test
    @DisplayName("should grant only the system principal under systemOnly")
    void shouldGrantOnlySystemPrincipal() {
        AuthorizationPolicy policy = AuthorizationPolicy.systemOnly();

        assertTrue(policy.isAuthorized(Principal.system(), new Order.Ship(), order));
        assertFalse(policy.isAuthorized(Principal.of("system"), new Order.Ship(), order));
        assertFalse(policy.isAuthorized(Principal.anonymous(), new Order.Ship(), order));
    }

    @Test
    @DisplayName("should grant per command type")
    void shouldGrantPerCommandType() {
        AuthorizationPolicy policy = AuthorizationPolicy.forCommands()
            .permitRole(Order.Ship.class, "warehouse")
            .permitAuthenticated(Order.AddItem.class)
            .build();
        Principal clerk = Principal.of("alice", "clerk");
        Principal packer = Principal.of("bob", "warehouse");

        assertTrue(policy.isAuthorized(packer, new Order.Ship(), order));
        assertFalse(policy.isAuthorized(clerk, new Order.Ship(), order));
        assertTrue(policy.isAuthorized(clerk, new Order.AddItem("Guitar", 1), order));
        assertFalse(policy.isAuthorized(Principal.anonymous(), new Order.AddItem("Guitar", 1), order));
        assertFalse(policy.isAuthorized(clerk, new Order.Cancel("no"), order));
    }

    @Test
    @DisplayName("should let a rule inspect the command")
    void shouldLetRuleInspectCommand() {
        AuthorizationPolicy policy = AuthorizationPolicy.forCommands()
            .permit(Order.AddItem.class, (principal, command) -> command.quantity <= 10)
            .build();

        assertTrue(policy.isAuthorized(Principal.of("alice"), new Order.AddItem("Guitar", 10), order));
        assertFalse(policy.isAuthorized(Principal.of("alice"), new Order.AddItem("Guitar", 11), order));
    }

    @Test
    @DisplayName("should combine policies with or")
    void shouldCombinePoliciesWithOr() {
        AuthorizationPolicy policy = AuthorizationPolicy.denyAll().or(AuthorizationPolicy.systemOnly());

        assertTrue(policy.isAuthorized(Principal.system(), new Order.Ship(), order));
        assertFalse(policy.isAuthorized(Principal.of("alice"), new Order.Ship(), order));
        assertTrue(AuthorizationPolicy.permitAll().isAuthorized(Principal.anonymous(), new Order.Ship(), order));
    }
}
