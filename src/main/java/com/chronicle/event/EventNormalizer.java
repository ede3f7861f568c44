package com.chronicle.event;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chronicle.config.HookContext;
import com.chronicle.util.Jsons;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Turns the raw hook payload into a {@link HookEvent} or a {@link Rejection}.
 * Accepts both camelCase and snake_case field names. Never throws.
 */
public class EventNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(EventNormalizer.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final List<String> HOOK_NAME_KEYS = List.of("hookEventName", "hook_event_name");
    private static final List<String> SESSION_KEYS = List.of("sessionId", "session_id");
    private static final List<String> TOOL_NAME_KEYS = List.of("toolName", "tool_name");
    private static final List<String> TOOL_INPUT_KEYS = List.of("toolInput", "tool_input");
    private static final List<String> TOOL_RESULT_KEYS = List.of("toolResult", "tool_response", "tool_result");
    private static final List<String> CWD_KEYS = List.of("workingDirectory", "cwd");
    private static final List<String> TRANSCRIPT_KEYS = List.of("transcriptReference", "transcript_path");
    private static final List<String> TIMESTAMP_KEYS = List.of("timestamp");
    private static final List<String> DURATION_KEYS = List.of("durationMs", "duration_ms", "execution_time_ms");
    private static final List<String> STOP_ACTIVE_KEYS = List.of("stopHookActive", "stop_hook_active");
    private static final List<String> CUSTOM_INSTRUCTIONS_KEYS = List.of("customInstructions", "custom_instructions");

    private final HookContext context;
    private final ObjectMapper mapper = Jsons.mapper();

    public EventNormalizer(HookContext context) {
        this.context = context;
    }

    public NormalizationResult normalize(byte[] raw) {
        long maxBytes = context.getConfig().getInputMaxBytes();
        if (raw != null && raw.length > maxBytes) {
            logger.warn("Hook input of {} bytes exceeds limit of {}", raw.length, maxBytes);
            return reject(RejectionReason.TOO_LARGE,
                    "input of " + raw.length + " bytes exceeds " + maxBytes, null, null);
        }
        if (raw == null || raw.length == 0) {
            return reject(RejectionReason.INVALID_INPUT, "empty input", null, null);
        }

        JsonNode root;
        try {
            root = mapper.readTree(raw);
        } catch (IOException e) {
            logger.warn("Malformed hook input: {}", e.getMessage());
            return reject(RejectionReason.INVALID_INPUT, "malformed JSON", null, null);
        }
        if (root == null || !root.isObject()) {
            return reject(RejectionReason.INVALID_INPUT, "input must be a JSON object", null, null);
        }

        return normalize((ObjectNode) root);
    }

    private NormalizationResult normalize(ObjectNode root) {
        Set<String> consumed = new HashSet<>();
        Optional<String> sessionId = text(root, SESSION_KEYS, consumed)
                .or(() -> context.getEnv(HookContext.SESSION_ID_ENV));
        Optional<String> rawHookName = text(root, HOOK_NAME_KEYS, consumed)
                .or(context::getHookArgument);

        if (rawHookName.isEmpty()) {
            return reject(RejectionReason.INVALID_INPUT, "missing hookEventName", null, sessionId.orElse(null));
        }
        Optional<HookEventName> hookName = HookEventName.fromWireName(rawHookName.get());
        if (hookName.isEmpty()) {
            logger.warn("Unknown hook event: {}", rawHookName.get());
            return reject(RejectionReason.UNKNOWN_EVENT, "unsupported hook event '" + rawHookName.get() + "'",
                    rawHookName.get(), sessionId.orElse(null));
        }
        if (sessionId.isEmpty()) {
            return reject(RejectionReason.INVALID_INPUT, "missing sessionId", rawHookName.get(), null);
        }

        Instant timestamp = parseTimestamp(text(root, TIMESTAMP_KEYS, consumed));
        String cwd = text(root, CWD_KEYS, consumed).orElse(null);
        String transcript = text(root, TRANSCRIPT_KEYS, consumed).orElse(null);

        HookEventName name = hookName.get();
        HookEvent event;
        try {
            event = switch (name) {
                case SESSION_START -> {
                    String source = text(root, List.of("source"), consumed).orElse(null);
                    yield new SessionStartEvent(header(name, sessionId.get(), timestamp, cwd, transcript, root, consumed), source);
                }
                case USER_PROMPT_SUBMIT -> {
                    String prompt = text(root, List.of("prompt"), consumed).orElse("");
                    yield new PromptEvent(header(name, sessionId.get(), timestamp, cwd, transcript, root, consumed), prompt);
                }
                case PRE_TOOL_USE -> {
                    String toolName = text(root, TOOL_NAME_KEYS, consumed).orElse(null);
                    Map<String, Object> toolInput = objectMap(root, TOOL_INPUT_KEYS, consumed);
                    yield new PreToolUseEvent(header(name, sessionId.get(), timestamp, cwd, transcript, root, consumed),
                            toolName, toolInput);
                }
                case POST_TOOL_USE -> {
                    String toolName = text(root, TOOL_NAME_KEYS, consumed).orElse(null);
                    Map<String, Object> toolInput = objectMap(root, TOOL_INPUT_KEYS, consumed);
                    Object toolResult = value(root, TOOL_RESULT_KEYS, consumed);
                    Long duration = duration(root, consumed);
                    yield new PostToolUseEvent(header(name, sessionId.get(), timestamp, cwd, transcript, root, consumed),
                            toolName, toolInput, toolResult, duration);
                }
                case STOP -> {
                    String reason = text(root, List.of("reason"), consumed).orElse(null);
                    boolean active = bool(root, STOP_ACTIVE_KEYS, consumed);
                    yield new StopEvent(header(name, sessionId.get(), timestamp, cwd, transcript, root, consumed),
                            reason, active);
                }
                case SUBAGENT_STOP -> {
                    boolean active = bool(root, STOP_ACTIVE_KEYS, consumed);
                    yield new SubagentStopEvent(header(name, sessionId.get(), timestamp, cwd, transcript, root, consumed),
                            active);
                }
                case NOTIFICATION -> {
                    String message = text(root, List.of("message"), consumed).orElse(null);
                    yield new NotificationEvent(header(name, sessionId.get(), timestamp, cwd, transcript, root, consumed),
                            message);
                }
                case PRE_COMPACT -> {
                    String trigger = text(root, List.of("trigger"), consumed).orElse(null);
                    String instructions = text(root, CUSTOM_INSTRUCTIONS_KEYS, consumed).orElse(null);
                    yield new PreCompactEvent(header(name, sessionId.get(), timestamp, cwd, transcript, root, consumed),
                            trigger, instructions);
                }
            };
        } catch (IllegalArgumentException e) {
            return reject(RejectionReason.INVALID_INPUT, e.getMessage(), rawHookName.get(), sessionId.get());
        }

        logger.debug("Normalized {}", event);
        return NormalizationResult.accepted(event);
    }

    private EventHeader header(HookEventName name, String sessionId, Instant timestamp, String cwd,
            String transcript, ObjectNode root, Set<String> consumed) {
        Map<String, Object> extras = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!consumed.contains(field.getKey())) {
                extras.put(field.getKey(), mapper.convertValue(field.getValue(), Object.class));
            }
        }
        return new EventHeader(name, sessionId, timestamp, cwd, transcript, extras);
    }

    private Instant parseTimestamp(Optional<String> value) {
        if (value.isEmpty()) {
            return context.now();
        }
        String text = value.get();
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException ignored) {
                logger.debug("Unparseable timestamp '{}', using invocation time", text);
                return context.now();
            }
        }
    }

    private static Optional<JsonNode> field(ObjectNode root, List<String> keys, Set<String> consumed) {
        Optional<JsonNode> found = Optional.empty();
        for (String key : keys) {
            JsonNode node = root.get(key);
            if (node != null) {
                consumed.add(key);
                if (found.isEmpty() && !node.isNull()) {
                    found = Optional.of(node);
                }
            }
        }
        return found;
    }

    private static Optional<String> text(ObjectNode root, List<String> keys, Set<String> consumed) {
        return field(root, keys, consumed)
                .filter(JsonNode::isValueNode)
                .map(JsonNode::asText)
                .filter(s -> !s.isBlank());
    }

    private static boolean bool(ObjectNode root, List<String> keys, Set<String> consumed) {
        return field(root, keys, consumed).map(JsonNode::asBoolean).orElse(false);
    }

    private Object value(ObjectNode root, List<String> keys, Set<String> consumed) {
        return field(root, keys, consumed).map(node -> mapper.convertValue(node, Object.class)).orElse(null);
    }

    private Map<String, Object> objectMap(ObjectNode root, List<String> keys, Set<String> consumed) {
        Optional<JsonNode> node = field(root, keys, consumed);
        if (node.isEmpty()) {
            return Map.of();
        }
        if (node.get().isObject()) {
            return mapper.convertValue(node.get(), MAP_TYPE);
        }
        Map<String, Object> wrapped = new LinkedHashMap<>();
        wrapped.put("value", mapper.convertValue(node.get(), Object.class));
        return wrapped;
    }

    private Long duration(ObjectNode root, Set<String> consumed) {
        Optional<JsonNode> node = field(root, DURATION_KEYS, consumed);
        if (node.isEmpty() || !node.get().isNumber()) {
            return null;
        }
        long value = node.get().asLong();
        if (value < 0) {
            logger.debug("Ignoring negative duration {}", value);
            return null;
        }
        return value;
    }

    private static NormalizationResult reject(RejectionReason reason, String message, String hookName, String sessionId) {
        return NormalizationResult.rejected(new Rejection(reason, message, hookName, sessionId));
    }
}
