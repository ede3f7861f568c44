package com.chronicle.response;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

import org.junit.jupiter.api.Test;

import com.chronicle.permission.PermissionDecision;
import com.chronicle.permission.PermissionVerdict;
import com.chronicle.util.Jsons;
import com.fasterxml.jackson.core.JsonProcessingException;

class ResponseBuilderTest {

    @Test
    void testDefaultResponseContinues() throws JsonProcessingException {
        HookResponse response = ResponseBuilder.forEvent("PostToolUse", "s-1")
                .sessionUuid("uuid-1")
                .eventSaved(true)
                .build();

        assertTrue(response.isContinueExecution());
        assertTrue(response.isSuppressOutput());
        assertNull(response.getStopReason());

        Map<String, Object> json = Jsons.toMap(response.toJson());
        assertEquals(true, json.get("continue"));
        assertFalse(json.containsKey("continueExecution"));
        assertFalse(json.containsKey("stopReason"));
        assertFalse(json.containsKey("error"));
        @SuppressWarnings("unchecked")
        Map<String, Object> specific = (Map<String, Object>) json.get("hookSpecificOutput");
        assertEquals("PostToolUse", specific.get("hookEventName"));
        assertEquals("s-1", specific.get("sessionId"));
        assertEquals("uuid-1", specific.get("sessionUuid"));
        assertEquals(true, specific.get("eventSaved"));
    }

    @Test
    void testEventSavedDefaultsToFalse() {
        ResponseBuilder builder = ResponseBuilder.forEvent("Notification", "s-2");

        assertFalse(builder.isEventSaved());
        assertEquals(false, builder.build().getHookSpecificOutput().get("eventSaved"));
    }

    @Test
    void testPermissionDecision() {
        HookResponse response = ResponseBuilder.forEvent("PreToolUse", "s-3")
                .permission(new PermissionDecision(PermissionVerdict.DENY, "Secrets are off limits", "env-file"))
                .build();

        assertTrue(response.isContinueExecution());
        assertEquals("deny", response.getHookSpecificOutput().get("permissionDecision"));
        assertEquals("Secrets are off limits", response.getHookSpecificOutput().get("permissionDecisionReason"));
    }

    @Test
    void testErrorKeepsContinue() {
        HookResponse response = ResponseBuilder.forEvent("Stop", "s-4").error("Event could not be saved").build();

        assertTrue(response.isContinueExecution());
        assertEquals("Event could not be saved", response.getError());
    }

    @Test
    void testOnlyBlockStops() {
        ResponseBuilder builder = ResponseBuilder.forEvent("UserPromptSubmit", "s-5")
                .additionalContext("  ")
                .put("intent", "general")
                .put("ignored", null);
        assertFalse(builder.isBlocking());

        HookResponse response = builder.block("Prompt blocked: policy").build();

        assertTrue(builder.isBlocking());
        assertFalse(response.isContinueExecution());
        assertEquals("Prompt blocked: policy", response.getStopReason());
        assertFalse(response.getHookSpecificOutput().containsKey("additionalContext"));
        assertFalse(response.getHookSpecificOutput().containsKey("ignored"));
        assertEquals("general", response.getHookSpecificOutput().get("intent"));
    }

    @Test
    void testSafeDefault() throws JsonProcessingException {
        HookResponse response = HookResponse.safeDefault("boom");

        Map<String, Object> json = Jsons.toMap(response.toJson());
        assertEquals(true, json.get("continue"));
        assertEquals("boom", json.get("error"));
        assertFalse(json.containsKey("hookSpecificOutput"));
    }

    @Test
    void testExitCodes() {
        assertEquals(0, ExitCode.SUCCESS.getCode());
        assertEquals(1, ExitCode.WARNING.getCode());
        assertEquals(2, ExitCode.BLOCKING.getCode());
    }
}
