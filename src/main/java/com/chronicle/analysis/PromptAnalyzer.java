package com.chronicle.analysis;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Classifies prompt intent and flags prompts that ask for destructive or credential-related work.
 * The first matching intent category wins.
 */
public class PromptAnalyzer {

    static final int MAX_PROMPT_LENGTH = 5000;

    private static final Map<PromptIntent, List<Pattern>> INTENT_PATTERNS = new LinkedHashMap<>();
    private static final Map<Pattern, String> DANGEROUS_PATTERNS = new LinkedHashMap<>();

    static {
        INTENT_PATTERNS.put(PromptIntent.CODE_GENERATION, patterns(
                "\\b(create|write|generate|implement|build)\\b.*\\b(function|class|component|file|script|code)\\b",
                "\\bhelp me (write|create|build|implement)\\b",
                "\\bneed (a|an|some)\\b.*\\b(function|class|script|component)\\b"));
        INTENT_PATTERNS.put(PromptIntent.CODE_MODIFICATION, patterns(
                "\\b(update|modify|change|refactor|optimize|improve)\\b",
                "\\b(add|remove|delete)\\b.*\\b(to|from)\\b",
                "\\bmake.*\\b(better|faster|cleaner|more efficient)\\b"));
        INTENT_PATTERNS.put(PromptIntent.DEBUGGING, patterns(
                "\\b(debug|fix|error|issue|problem|bug|failing|broken)\\b",
                "\\b(not working|doesn't work|isn't working)\\b",
                "\\bwhy (is|does|doesn't|isn't)\\b",
                "\\bthrows?\\s+(an?\\s+)?(error|exception)\\b"));
        INTENT_PATTERNS.put(PromptIntent.EXPLANATION, patterns(
                "\\b(explain|what|how|why)\\b",
                "\\b(tell me about|describe|clarify|understand)\\b",
                "\\b(meaning|purpose|does this do)\\b"));
        INTENT_PATTERNS.put(PromptIntent.CONFIGURATION, patterns(
                "\\b(setup|configure|install|settings)\\b",
                "\\b(environment|config|preferences)\\b"));

        DANGEROUS_PATTERNS.put(compile("delete\\s+all\\s+files"), "Dangerous file deletion request detected");
        DANGEROUS_PATTERNS.put(compile("rm\\s+-rf\\s+/"), "Dangerous system deletion command detected");
        DANGEROUS_PATTERNS.put(compile("format\\s+(c:|hard\\s+drive)"), "System formatting request detected");
        DANGEROUS_PATTERNS.put(compile("access\\s+(password|credential)"), "Attempt to access sensitive credentials");
        DANGEROUS_PATTERNS.put(compile("bypass\\s+(security|authentication)"), "Security bypass attempt detected");
    }

    private final DataSanitizer sanitizer;

    public PromptAnalyzer(DataSanitizer sanitizer) {
        this.sanitizer = sanitizer;
    }

    public PromptAnalysis analyze(String prompt) {
        String text = prompt != null ? prompt : "";
        PromptIntent intent = classify(text);
        String flag = securityFlag(text);
        String stored = DataSanitizer.truncate(sanitizer.sanitizeText(text), MAX_PROMPT_LENGTH);
        return new PromptAnalysis(intent, flag, contextFor(intent), stored, text.length());
    }

    public PromptIntent classify(String text) {
        for (Map.Entry<PromptIntent, List<Pattern>> entry : INTENT_PATTERNS.entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                if (pattern.matcher(text).find()) {
                    return entry.getKey();
                }
            }
        }
        return PromptIntent.GENERAL;
    }

    private static String securityFlag(String text) {
        for (Map.Entry<Pattern, String> entry : DANGEROUS_PATTERNS.entrySet()) {
            if (entry.getKey().matcher(text).find()) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static String contextFor(PromptIntent intent) {
        return switch (intent) {
            case DEBUGGING -> "Consider checking logs, error messages, and testing with minimal examples.";
            case CODE_GENERATION -> "Remember to follow best practices: proper error handling, documentation, and testing.";
            case CONFIGURATION -> "Ensure you have proper backups before making configuration changes.";
            default -> null;
        };
    }

    private static List<Pattern> patterns(String... regexes) {
        return Arrays.stream(regexes).map(PromptAnalyzer::compile).toList();
    }

    private static Pattern compile(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }
}
