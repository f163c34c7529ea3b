package me.golemcore.coder.adapter.outbound.permission;

import me.golemcore.coder.domain.model.PermissionAction;
import me.golemcore.coder.domain.model.PermissionRejectedException;
import me.golemcore.coder.domain.model.PermissionRequest;
import me.golemcore.coder.domain.model.PermissionRuleset;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RulesetPermissionAdapterTest {

    private CoderProperties properties;
    private RulesetPermissionAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new CoderProperties();
        adapter = new RulesetPermissionAdapter(properties);
    }

    @Test
    void shouldPreferAgentRuleset() {
        PermissionRuleset ruleset = new PermissionRuleset(Map.of("doom_loop", PermissionAction.ALLOW));

        assertEquals(PermissionAction.ALLOW, adapter.resolve(request("doom_loop", ruleset)));
    }

    @Test
    void shouldFallBackToConfiguredDefaults() {
        assertEquals(PermissionAction.DENY, adapter.resolve(request("doom_loop", PermissionRuleset.EMPTY)));
        assertEquals(PermissionAction.ALLOW, adapter.resolve(request("edit", null)));

        properties.getPermission().setDefaultAction(PermissionAction.ASK);
        assertEquals(PermissionAction.ASK, adapter.resolve(request("edit", null)));
    }

    @Test
    void shouldCompleteWhenAllowed() {
        CompletableFuture<Void> result = adapter.ask(request("edit", null));

        assertTrue(result.isDone());
        assertTrue(!result.isCompletedExceptionally());
    }

    @Test
    void shouldRejectWhenDeniedOrAsked() {
        PermissionRuleset ruleset = new PermissionRuleset(Map.of("bash", PermissionAction.ASK));

        ExecutionException denied = assertThrows(ExecutionException.class,
                () -> adapter.ask(request("doom_loop", null)).get());
        ExecutionException asked = assertThrows(ExecutionException.class,
                () -> adapter.ask(request("bash", ruleset)).get());

        PermissionRejectedException rejection = assertInstanceOf(PermissionRejectedException.class,
                denied.getCause());
        assertEquals("doom_loop", rejection.getPermission());
        assertInstanceOf(PermissionRejectedException.class, asked.getCause());
    }

    private static PermissionRequest request(String permission, PermissionRuleset ruleset) {
        return PermissionRequest.builder()
                .permission(permission)
                .sessionId("ses-1")
                .patterns(List.of("*"))
                .ruleset(ruleset)
                .build();
    }
}
