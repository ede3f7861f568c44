package com.chronicle.hook;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chronicle.analysis.DataSanitizer;
import com.chronicle.analysis.PromptAnalysis;
import com.chronicle.analysis.PromptAnalyzer;
import com.chronicle.analysis.ToolUseAnalyzer;
import com.chronicle.config.Config;
import com.chronicle.config.HookContext;
import com.chronicle.event.EventNormalizer;
import com.chronicle.event.HookEvent;
import com.chronicle.event.NormalizationResult;
import com.chronicle.event.PostToolUseEvent;
import com.chronicle.event.PreToolUseEvent;
import com.chronicle.event.PromptEvent;
import com.chronicle.event.Rejection;
import com.chronicle.event.SessionStartEvent;
import com.chronicle.event.StopEvent;
import com.chronicle.permission.PermissionDecision;
import com.chronicle.permission.PermissionEngine;
import com.chronicle.permission.ToolInvocation;
import com.chronicle.response.ExitCode;
import com.chronicle.response.ResponseBuilder;
import com.chronicle.session.SessionLifecycleTracker;
import com.chronicle.session.SessionStartOutcome;
import com.chronicle.storage.EventRecord;
import com.chronicle.storage.PersistenceManager;
import com.chronicle.storage.SaveResult;
import com.chronicle.storage.SessionEndOutcome;
import com.chronicle.storage.SessionRecord;
import com.chronicle.util.Jsons;

/**
 * Runs one hook invocation: normalize, authorize, track the session, persist the event and
 * build the response. Whatever goes wrong, a response with {@code continue=true} comes back.
 */
public class HookProcessor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(HookProcessor.class);

    private final HookContext context;
    private final EventNormalizer normalizer;
    private final PermissionEngine permissionEngine;
    private final PersistenceManager persistence;
    private final SessionLifecycleTracker tracker;
    private final DataSanitizer sanitizer;
    private final PromptAnalyzer promptAnalyzer;
    private final ToolUseAnalyzer toolUseAnalyzer;

    public HookProcessor(HookContext context, PermissionEngine permissionEngine, PersistenceManager persistence,
            SessionLifecycleTracker tracker) {
        this.context = context;
        this.normalizer = new EventNormalizer(context);
        this.permissionEngine = permissionEngine;
        this.persistence = persistence;
        this.tracker = tracker;
        this.sanitizer = new DataSanitizer(context.getConfig().getMaxStringLength());
        this.promptAnalyzer = new PromptAnalyzer(sanitizer);
        this.toolUseAnalyzer = new ToolUseAnalyzer(sanitizer);
    }

    public static HookProcessor create(HookContext context) {
        Config config = context.getConfig();
        PersistenceManager persistence = PersistenceManager.fromContext(context);
        PermissionEngine engine = config.isPermissionsEnabled() ? PermissionEngine.fromConfig(config) : null;
        return new HookProcessor(context, engine, persistence,
                SessionLifecycleTracker.fromContext(context, persistence));
    }

    public HookResult process(byte[] raw) {
        long started = System.nanoTime();
        try {
            return handle(raw);
        } catch (RuntimeException e) {
            logger.error("Hook processing failed", e);
            return HookResult.failOpen("Hook processing failed: " + e.getClass().getSimpleName());
        } finally {
            long elapsedMs = (System.nanoTime() - started) / 1_000_000;
            long budget = context.getConfig().getLatencyBudgetMs();
            if (elapsedMs > budget) {
                logger.warn("Hook took {} ms, over the {} ms budget", elapsedMs, budget);
            } else {
                logger.debug("Hook completed in {} ms", elapsedMs);
            }
        }
    }

    private HookResult handle(byte[] raw) {
        NormalizationResult result = normalizer.normalize(raw);
        if (!result.isAccepted()) {
            return rejected(result.getRejection().orElseThrow());
        }

        HookEvent event = result.getEvent().orElseThrow();
        context.bindLogging(event.getHookEventName().getWireName(), event.getExternalSessionId());
        ResponseBuilder response = ResponseBuilder.forEvent(event.getHookEventName().getWireName(),
                event.getExternalSessionId());

        if (event instanceof SessionStartEvent) {
            onSessionStart((SessionStartEvent) event, response);
        } else if (event instanceof PromptEvent) {
            onPrompt((PromptEvent) event, response);
        } else if (event instanceof PreToolUseEvent) {
            onPreToolUse((PreToolUseEvent) event, response);
        } else if (event instanceof PostToolUseEvent) {
            onPostToolUse((PostToolUseEvent) event, response);
        } else if (event instanceof StopEvent) {
            onStop((StopEvent) event, response);
        } else {
            record(event, sanitizer.sanitize(event.toData()), tracker.sessionFor(event), response);
        }

        return finish(response);
    }

    private HookResult rejected(Rejection rejection) {
        String hookName = rejection.getHookEventName().orElse("unknown");
        context.bindLogging(hookName, rejection.getSessionId().orElse(null));
        logger.warn("Input rejected: {}", rejection.describe());
        ResponseBuilder response = ResponseBuilder.forEvent(hookName, rejection.getSessionId().orElse(null))
                .error(rejection.describe());
        return new HookResult(response.build(), ExitCode.WARNING, "Chronicle: " + rejection.describe());
    }

    private void onSessionStart(SessionStartEvent event, ResponseBuilder response) {
        SessionStartOutcome outcome = tracker.startSession(event);
        Map<String, Object> data = new LinkedHashMap<>(event.toData());
        data.putAll(outcome.getEventData());
        record(event, sanitizer.sanitize(data), outcome.getSession(), response);
        outcome.getSaveResult().getResolvedId().ifPresent(response::sessionUuid);
        outcome.getAdditionalContext().ifPresent(response::additionalContext);
    }

    private void onPrompt(PromptEvent event, ResponseBuilder response) {
        PromptAnalysis analysis = promptAnalyzer.analyze(event.getPrompt());
        Map<String, Object> data = sanitizer.sanitize(event.toData());
        data.putAll(analysis.toData());
        record(event, data, tracker.sessionFor(event), response);

        response.put("intent", analysis.getIntent().getValue());
        if (analysis.isDangerous()) {
            String reason = analysis.getSecurityFlag().orElseThrow();
            logger.warn("Prompt flagged: {}", reason);
            response.put("securityFlag", reason);
            if (context.getConfig().isPromptBlockingEnabled()) {
                response.block("Prompt blocked: " + reason);
                return;
            }
        }
        analysis.getAdditionalContext().ifPresent(response::additionalContext);
    }

    private void onPreToolUse(PreToolUseEvent event, ResponseBuilder response) {
        PermissionDecision decision = null;
        if (permissionEngine != null) {
            decision = permissionEngine.decide(new ToolInvocation(event.getToolNameValue(), event.getToolInput(),
                    event.getWorkingDirectory().orElse(null)));
            logger.info("Permission for {}: {}", event.getToolNameValue(), decision);
        }

        Map<String, Object> data = sanitizer.sanitize(event.toData());
        data.putAll(toolUseAnalyzer.describeInput(event.getToolNameValue(), event.getToolInput()));
        if (decision != null) {
            data.put("permission_decision", decision.getVerdict().getValue());
            data.put("permission_reason", decision.getReason());
            data.put("permission_rule", decision.getRuleName());
        }
        record(event, data, tracker.sessionFor(event), response);
        response.permission(decision);
    }

    private void onPostToolUse(PostToolUseEvent event, ResponseBuilder response) {
        Map<String, Object> resultInfo = toolUseAnalyzer.describeResult(event.getToolNameValue(), event.getToolResult());
        Map<String, Object> data = sanitizer.sanitize(event.toData());
        if (Boolean.TRUE.equals(resultInfo.get("large_result")) && data.containsKey("tool_response")) {
            String summary = Jsons.toJson(data.get("tool_response"));
            data.put("tool_response", DataSanitizer.truncate(summary, context.getConfig().getMaxStringLength()));
        }
        data.putAll(resultInfo);
        record(event, data, tracker.sessionFor(event), response);
    }

    private void onStop(StopEvent event, ResponseBuilder response) {
        SessionEndOutcome end = tracker.endSession(event);
        Map<String, Object> data = sanitizer.sanitize(event.toData());
        if (end.isOk()) {
            data.put("session_ended_now", end.isEndedNow());
            end.getStats().ifPresent(stats -> data.putAll(stats.toMap()));
        }
        record(event, data, tracker.sessionFor(event), response);

        response.put("sessionEnded", end.isOk());
        end.getStats().ifPresent(stats -> {
            response.put("eventCount", stats.getTotalEvents());
            stats.getDurationMs().ifPresent(d -> response.put("durationMs", d));
        });
    }

    private void record(HookEvent event, Map<String, Object> data, SessionRecord sessionIfMissing,
            ResponseBuilder response) {
        EventRecord record = EventRecord.builder(event.getEventType(), event.getTimestamp())
                .externalSessionId(event.getExternalSessionId())
                .hookEventName(event.getHookEventName().getWireName())
                .data(data)
                .toolName(event.getToolName().orElse(null))
                .durationMs(event.getDurationMs().orElse(null))
                .build();
        SaveResult saved = persistence.saveEvent(record, sessionIfMissing);
        response.eventSaved(saved.isOk());
        saved.getResolvedId().ifPresent(response::sessionUuid);
        logger.debug("{} event -> {}", event.getEventType(), saved);
    }

    private static HookResult finish(ResponseBuilder response) {
        if (response.isBlocking()) {
            String reason = String.valueOf(response.build().getStopReason());
            return new HookResult(response.build(), ExitCode.BLOCKING, reason);
        }
        if (!response.isEventSaved()) {
            return new HookResult(response.error("Event could not be saved").build(), ExitCode.WARNING,
                    "Chronicle: event could not be saved");
        }
        return new HookResult(response.build(), ExitCode.SUCCESS, null);
    }

    @Override
    public void close() {
        persistence.close();
    }
}
