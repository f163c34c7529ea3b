package me.golemcore.coder.domain.turn;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.coder.domain.model.Part;
import me.golemcore.coder.domain.model.PermissionRejectedException;
import me.golemcore.coder.domain.model.PermissionRequest;
import me.golemcore.coder.domain.model.PermissionRuleset;
import me.golemcore.coder.domain.model.TextPart;
import me.golemcore.coder.domain.model.ToolPart;
import me.golemcore.coder.domain.model.ToolState;
import me.golemcore.coder.domain.model.ToolStatus;
import me.golemcore.coder.domain.model.TurnAbortedException;
import me.golemcore.coder.port.outbound.PermissionPort;
import me.golemcore.coder.port.outbound.SessionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DoomLoopDetectorTest {

    private static final String MESSAGE_ID = "msg-1";

    private SessionPort sessionPort;
    private PermissionPort permissionPort;
    private DoomLoopDetector detector;
    private List<Part> parts;
    private TurnCancellation cancellation;

    @BeforeEach
    void setUp() {
        sessionPort = mock(SessionPort.class);
        permissionPort = mock(PermissionPort.class);
        parts = new ArrayList<>();
        cancellation = new TurnCancellation();
        when(sessionPort.listParts(MESSAGE_ID)).thenReturn(parts);
        when(permissionPort.ask(any())).thenReturn(CompletableFuture.completedFuture(null));
        detector = new DoomLoopDetector(sessionPort, permissionPort, new ObjectMapper(), 3);
    }

    @Test
    void shouldAskForApprovalOnThirdIdenticalCall() {
        parts.add(toolPart("bash", Map.of("cmd", "ls")));
        parts.add(toolPart("bash", Map.of("cmd", "ls")));
        ToolPart latest = toolPart("bash", Map.of("cmd", "ls"));
        parts.add(latest);

        boolean asked = detector.inspect(latest, PermissionRuleset.EMPTY, cancellation);

        assertTrue(asked);
        ArgumentCaptor<PermissionRequest> request = ArgumentCaptor.forClass(PermissionRequest.class);
        verify(permissionPort).ask(request.capture());
        assertEquals(DoomLoopDetector.PERMISSION, request.getValue().permission());
        assertEquals(List.of("bash"), request.getValue().patterns());
        assertEquals("ses-1", request.getValue().sessionId());
        assertSame(PermissionRuleset.EMPTY, request.getValue().ruleset());
    }

    @Test
    void shouldNotTriggerOnSecondIdenticalCall() {
        parts.add(toolPart("bash", Map.of("cmd", "ls")));
        ToolPart latest = toolPart("bash", Map.of("cmd", "ls"));
        parts.add(latest);

        assertFalse(detector.inspect(latest, PermissionRuleset.EMPTY, cancellation));
        verify(permissionPort, never()).ask(any());
    }

    @Test
    void shouldIgnoreKeyOrderWhenComparingInputs() {
        Map<String, Object> ordered = new LinkedHashMap<>();
        ordered.put("path", "a.txt");
        ordered.put("limit", 10);
        Map<String, Object> reversed = new LinkedHashMap<>();
        reversed.put("limit", 10);
        reversed.put("path", "a.txt");
        parts.add(toolPart("read", ordered));
        parts.add(toolPart("read", reversed));
        ToolPart latest = toolPart("read", ordered);
        parts.add(latest);

        assertTrue(detector.inspect(latest, PermissionRuleset.EMPTY, cancellation));
    }

    @Test
    void shouldNotTriggerWhenInputsDiffer() {
        parts.add(toolPart("bash", Map.of("cmd", "ls")));
        parts.add(toolPart("bash", Map.of("cmd", "pwd")));
        ToolPart latest = toolPart("bash", Map.of("cmd", "ls"));
        parts.add(latest);

        assertFalse(detector.inspect(latest, PermissionRuleset.EMPTY, cancellation));
    }

    @Test
    void shouldNotTriggerWhenAnotherPartInterleaves() {
        parts.add(toolPart("bash", Map.of("cmd", "ls")));
        parts.add(toolPart("bash", Map.of("cmd", "ls")));
        parts.add(new TextPart("prt-text", MESSAGE_ID, "ses-1"));
        ToolPart latest = toolPart("bash", Map.of("cmd", "ls"));
        parts.add(latest);

        assertFalse(detector.inspect(latest, PermissionRuleset.EMPTY, cancellation));
    }

    @Test
    void shouldNotTriggerWhenAPreviousCallIsStillPending() {
        ToolPart pending = toolPart("bash", Map.of("cmd", "ls"));
        pending.setState(ToolState.pending());
        parts.add(pending);
        parts.add(toolPart("bash", Map.of("cmd", "ls")));
        ToolPart latest = toolPart("bash", Map.of("cmd", "ls"));
        parts.add(latest);

        assertFalse(detector.inspect(latest, PermissionRuleset.EMPTY, cancellation));
    }

    @Test
    void shouldPropagateRejection() {
        PermissionRejectedException rejection = new PermissionRejectedException(DoomLoopDetector.PERMISSION,
                "denied");
        when(permissionPort.ask(any())).thenReturn(CompletableFuture.failedFuture(rejection));
        parts.add(toolPart("bash", Map.of("cmd", "ls")));
        parts.add(toolPart("bash", Map.of("cmd", "ls")));
        ToolPart latest = toolPart("bash", Map.of("cmd", "ls"));
        parts.add(latest);

        PermissionRejectedException thrown = assertThrows(PermissionRejectedException.class,
                () -> detector.inspect(latest, PermissionRuleset.EMPTY, cancellation));

        assertSame(rejection, thrown);
    }

    @Test
    void shouldAbortPendingApprovalWhenTurnIsCancelled() {
        CompletableFuture<Void> pendingAnswer = new CompletableFuture<>();
        when(permissionPort.ask(any())).thenReturn(pendingAnswer);
        parts.add(toolPart("bash", Map.of("cmd", "ls")));
        parts.add(toolPart("bash", Map.of("cmd", "ls")));
        ToolPart latest = toolPart("bash", Map.of("cmd", "ls"));
        parts.add(latest);
        CompletableFuture.runAsync(() -> cancellation.cancel("user pressed stop"),
                CompletableFuture.delayedExecutor(100, TimeUnit.MILLISECONDS));

        TurnAbortedException thrown = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> assertThrows(TurnAbortedException.class,
                        () -> detector.inspect(latest, PermissionRuleset.EMPTY, cancellation)));

        assertEquals("user pressed stop", thrown.getMessage());
        assertTrue(pendingAnswer.isCancelled());
    }

    @Test
    void shouldNotAskWhenTurnIsAlreadyCancelled() {
        cancellation.cancel("stopped");
        parts.add(toolPart("bash", Map.of("cmd", "ls")));
        parts.add(toolPart("bash", Map.of("cmd", "ls")));
        ToolPart latest = toolPart("bash", Map.of("cmd", "ls"));
        parts.add(latest);

        assertThrows(TurnAbortedException.class,
                () -> detector.inspect(latest, PermissionRuleset.EMPTY, cancellation));
        verify(permissionPort, never()).ask(any());
    }

    @Test
    void shouldBeDisabledWithNonPositiveThreshold() {
        DoomLoopDetector disabled = new DoomLoopDetector(sessionPort, permissionPort, new ObjectMapper(), 0);
        ToolPart latest = toolPart("bash", Map.of("cmd", "ls"));
        parts.add(latest);

        assertFalse(disabled.inspect(latest, PermissionRuleset.EMPTY, cancellation));
        verify(sessionPort, never()).listParts(any());
    }

    private ToolPart toolPart(String tool, Map<String, Object> input) {
        ToolPart part = new ToolPart("prt-" + parts.size(), MESSAGE_ID, "ses-1");
        part.setCallId("call-" + parts.size());
        part.setTool(tool);
        part.setState(ToolState.builder().status(ToolStatus.COMPLETED).input(input).build());
        return part;
    }
}
