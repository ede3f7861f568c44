package com.chronicle.event;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Properties;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.chronicle.config.Config;
import com.chronicle.config.HookContext;

class EventNormalizerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path home;

    private EventNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new EventNormalizer(context(new Properties(), Map.of(), null));
    }

    private HookContext context(Properties props, Map<String, String> env, String hookArgument) {
        return HookContext.builder()
                .config(Config.fromProperties(home, props))
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .env(env)
                .hookArgument(hookArgument)
                .build();
    }

    private static byte[] json(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static Rejection rejection(NormalizationResult result) {
        assertFalse(result.isAccepted());
        assertTrue(result.getEvent().isEmpty());
        return result.getRejection().orElseThrow();
    }

    @Test
    void testPreToolUseSnakeCase() {
        NormalizationResult result = normalizer.normalize(json("""
                {"hook_event_name":"PreToolUse","session_id":"s-1","cwd":"/demo",
                 "transcript_path":"/tmp/t.jsonl","tool_name":"Read","tool_input":{"file_path":"/demo/a.txt"}}
                """));

        assertTrue(result.isAccepted());
        PreToolUseEvent event = (PreToolUseEvent) result.getEvent().orElseThrow();
        assertEquals(HookEventName.PRE_TOOL_USE, event.getHookEventName());
        assertEquals(EventType.PRE_TOOL_USE, event.getEventType());
        assertEquals("s-1", event.getExternalSessionId());
        assertEquals("/demo", event.getWorkingDirectory().orElseThrow());
        assertEquals("Read", event.getToolNameValue());
        assertEquals("/demo/a.txt", event.getToolInput().get("file_path"));
        assertEquals(NOW, event.getTimestamp());
        assertTrue(event.getHeader().getExtras().isEmpty());
        assertEquals("/tmp/t.jsonl", event.toData().get("transcript_path"));
    }

    @Test
    void testPostToolUseCamelCase() {
        NormalizationResult result = normalizer.normalize(json("""
                {"hookEventName":"PostToolUse","sessionId":"s-2","toolName":"Bash",
                 "toolInput":{"command":"ls"},"toolResult":{"stdout":"a b"},"durationMs":42,
                 "timestamp":"2024-05-01T09:59:58+02:00"}
                """));

        PostToolUseEvent event = (PostToolUseEvent) result.getEvent().orElseThrow();
        assertEquals(EventType.TOOL_USE, event.getEventType());
        assertEquals(42L, event.getDurationMs().orElseThrow());
        assertEquals(Instant.parse("2024-05-01T07:59:58Z"), event.getTimestamp());
        assertEquals(Map.of("stdout", "a b"), event.getToolResult());
        Map<String, Object> data = event.toData();
        assertEquals("Bash", data.get("tool_name"));
        assertEquals(42L, ((Number) data.get("duration_ms")).longValue());
    }

    @Test
    void testNegativeDurationIsDropped() {
        NormalizationResult result = normalizer.normalize(json("""
                {"hookEventName":"PostToolUse","sessionId":"s","toolName":"Bash","duration_ms":-3}
                """));

        assertTrue(result.getEvent().orElseThrow().getDurationMs().isEmpty());
    }

    @Test
    void testNonObjectToolInputIsWrapped() {
        NormalizationResult result = normalizer.normalize(json("""
                {"hookEventName":"PreToolUse","sessionId":"s","toolName":"Bash","toolInput":"ls -la"}
                """));

        PreToolUseEvent event = (PreToolUseEvent) result.getEvent().orElseThrow();
        assertEquals(Map.of("value", "ls -la"), event.getToolInput());
    }

    @Test
    void testUnknownKeysGoToExtras() {
        NormalizationResult result = normalizer.normalize(json("""
                {"hookEventName":"Notification","sessionId":"s","message":"Waiting","level":"info","meta":null}
                """));

        NotificationEvent event = (NotificationEvent) result.getEvent().orElseThrow();
        assertEquals("Waiting", event.getMessage());
        Map<String, Object> extras = event.getHeader().getExtras();
        assertEquals("info", extras.get("level"));
        assertTrue(extras.containsKey("meta"));
        assertNull(extras.get("meta"));
        assertFalse(extras.containsKey("message"));
    }

    @Test
    void testEveryHookNameIsRecognised() {
        for (HookEventName name : HookEventName.values()) {
            NormalizationResult result = normalizer.normalize(json(
                    "{\"hookEventName\":\"" + name.getWireName() + "\",\"sessionId\":\"s\"}"));
            assertTrue(result.isAccepted(), name.getWireName());
            assertEquals(name, result.getEvent().orElseThrow().getHookEventName());
        }
    }

    @Test
    void testVariantDefaults() {
        SessionStartEvent start = (SessionStartEvent) normalizer.normalize(
                json("{\"hookEventName\":\"SessionStart\",\"sessionId\":\"s\"}")).getEvent().orElseThrow();
        StopEvent stop = (StopEvent) normalizer.normalize(
                json("{\"hookEventName\":\"Stop\",\"sessionId\":\"s\",\"stop_hook_active\":true}")).getEvent().orElseThrow();
        PreCompactEvent compact = (PreCompactEvent) normalizer.normalize(
                json("{\"hookEventName\":\"PreCompact\",\"sessionId\":\"s\",\"custom_instructions\":\"keep it\"}"))
                .getEvent().orElseThrow();

        assertEquals("unknown", start.getSource());
        assertEquals("normal", stop.getReason());
        assertTrue(stop.isStopHookActive());
        assertEquals("auto", compact.getTrigger());
        assertEquals("keep it", compact.getCustomInstructions());
    }

    @Test
    void testSessionIdAndHookNameFallbacks() {
        EventNormalizer fromEnv = new EventNormalizer(
                context(new Properties(), Map.of(HookContext.SESSION_ID_ENV, "env-session"), "UserPromptSubmit"));

        NormalizationResult result = fromEnv.normalize(json("{\"prompt\":\"hello\"}"));

        PromptEvent event = (PromptEvent) result.getEvent().orElseThrow();
        assertEquals("env-session", event.getExternalSessionId());
        assertEquals("hello", event.getPrompt());
    }

    @Test
    void testInputValuesWinOverFallbacks() {
        EventNormalizer fromEnv = new EventNormalizer(
                context(new Properties(), Map.of(HookContext.SESSION_ID_ENV, "env-session"), "Stop"));

        HookEvent event = fromEnv.normalize(json("{\"hookEventName\":\"Notification\",\"sessionId\":\"own\"}"))
                .getEvent().orElseThrow();

        assertEquals("own", event.getExternalSessionId());
        assertEquals(HookEventName.NOTIFICATION, event.getHookEventName());
    }

    @Test
    void testUnparseableTimestampUsesClock() {
        HookEvent event = normalizer.normalize(
                json("{\"hookEventName\":\"Stop\",\"sessionId\":\"s\",\"timestamp\":\"yesterday\"}"))
                .getEvent().orElseThrow();

        assertEquals(NOW, event.getTimestamp());
    }

    @Test
    void testMalformedJson() {
        Rejection rejection = rejection(normalizer.normalize(json("{\"hookEventName\":")));

        assertEquals(RejectionReason.INVALID_INPUT, rejection.getReason());
        assertEquals("invalid_input: malformed JSON", rejection.describe());
    }

    @Test
    void testEmptyAndNonObjectInput() {
        assertEquals(RejectionReason.INVALID_INPUT, rejection(normalizer.normalize(new byte[0])).getReason());
        assertEquals(RejectionReason.INVALID_INPUT, rejection(normalizer.normalize(null)).getReason());
        assertEquals(RejectionReason.INVALID_INPUT, rejection(normalizer.normalize(json("[1,2]"))).getReason());
    }

    @Test
    void testOversizedInput() {
        Properties props = new Properties();
        props.setProperty(Config.INPUT_MAX_BYTES, "32");
        EventNormalizer small = new EventNormalizer(context(props, Map.of(), null));

        Rejection rejection = rejection(small.normalize(json(
                "{\"hookEventName\":\"UserPromptSubmit\",\"sessionId\":\"s\",\"prompt\":\"long enough\"}")));

        assertEquals(RejectionReason.TOO_LARGE, rejection.getReason());
    }

    @Test
    void testUnknownEvent() {
        Rejection rejection = rejection(normalizer.normalize(
                json("{\"hookEventName\":\"Teleport\",\"sessionId\":\"s-9\"}")));

        assertEquals(RejectionReason.UNKNOWN_EVENT, rejection.getReason());
        assertEquals("Teleport", rejection.getHookEventName().orElseThrow());
        assertEquals("s-9", rejection.getSessionId().orElseThrow());
    }

    @Test
    void testMissingFields() {
        Rejection noHook = rejection(normalizer.normalize(json("{\"sessionId\":\"s\"}")));
        Rejection noSession = rejection(normalizer.normalize(json("{\"hookEventName\":\"Stop\"}")));

        assertEquals(RejectionReason.INVALID_INPUT, noHook.getReason());
        assertTrue(noHook.getMessage().contains("hookEventName"));
        assertEquals(RejectionReason.INVALID_INPUT, noSession.getReason());
        assertTrue(noSession.getMessage().contains("sessionId"));
    }
}
