package me.golemcore.coder.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PartSerializationTest {

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @Test
    void shouldWriteDiscriminatorForEachPartType() {
        ToolPart tool = new ToolPart("prt-1", "msg-1", "ses-1");
        tool.setCallId("call-1");
        tool.setTool("bash");
        tool.setState(ToolState.builder()
                .status(ToolStatus.ERROR)
                .input(Map.of("cmd", "ls"))
                .error("Tool execution aborted")
                .time(new PartTime(Instant.EPOCH, Instant.EPOCH))
                .build());

        JsonNode json = objectMapper.valueToTree(tool);

        assertEquals("tool", json.get("type").asText());
        assertEquals("ERROR", json.get("state").get("status").asText());
        assertFalse(json.get("state").has("final"));
        Part restored = objectMapper.convertValue(json, Part.class);
        assertEquals(ToolStatus.ERROR, assertInstanceOf(ToolPart.class, restored).status());
    }

    @Test
    void shouldRestorePatchAndStepParts() {
        PatchPart patch = new PatchPart("prt-2", "msg-1", "ses-1", new Patch("abc", List.of("a.txt")));
        StepFinishPart step = new StepFinishPart("prt-3", "msg-1", "ses-1");
        step.setTokens(new TokenUsage(1, 2, 3, 4, 5));

        PatchPart restoredPatch = assertInstanceOf(PatchPart.class, objectMapper.convertValue(
                objectMapper.valueToTree(patch), Part.class));
        StepFinishPart restoredStep = assertInstanceOf(StepFinishPart.class, objectMapper.convertValue(
                objectMapper.valueToTree(step), Part.class));

        assertEquals(List.of("a.txt"), restoredPatch.getFiles());
        assertEquals(15, restoredStep.getTokens().total());
    }

    @Test
    void shouldExposeStreamEventWireNames() {
        assertEquals("tool-input-start", StreamEventType.TOOL_INPUT_START.wireName());
        assertEquals(StreamEventType.UNKNOWN, new StreamEvent.Unknown("raw", null).type());
        assertEquals("finish-step", new StreamEvent.FinishStep("stop", null, null).type().wireName());
    }

    @Test
    void shouldClassifyFinalToolStatuses() {
        assertTrue(ToolStatus.COMPLETED.isFinal());
        assertTrue(ToolStatus.ERROR.isFinal());
        assertFalse(ToolStatus.PENDING.isFinal());
        assertFalse(ToolStatus.RUNNING.isFinal());
        assertFalse(ToolState.pending().isFinal());
    }
}
