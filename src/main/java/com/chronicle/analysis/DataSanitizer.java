package com.chronicle.analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Redacts secrets and truncates oversized strings in event payloads before they are stored.
 */
public class DataSanitizer {

    public static final String REDACTED = "[REDACTED]";
    public static final String TRUNCATED = "...[TRUNCATED]";

    private static final Set<String> SENSITIVE_KEYS = Set.of(
            "password", "passwd", "secret", "token", "api_key", "apikey", "authorization",
            "credential", "private_key", "access_key");

    private static final List<Pattern> SECRET_PATTERNS = List.of(
            Pattern.compile("-----BEGIN [A-Z ]*PRIVATE KEY-----[\\s\\S]*?(-----END [A-Z ]*PRIVATE KEY-----|$)"),
            Pattern.compile("\\bsk-(?:ant-|proj-)?[A-Za-z0-9_-]{20,}"),
            Pattern.compile("\\bgh[pousr]_[A-Za-z0-9]{30,}"),
            Pattern.compile("\\bgithub_pat_[A-Za-z0-9_]{30,}"),
            Pattern.compile("\\bAKIA[0-9A-Z]{16}\\b"),
            Pattern.compile("\\bxox[abpr]-[A-Za-z0-9-]{10,}"),
            Pattern.compile("\\beyJ[A-Za-z0-9_-]{10,}\\.[A-Za-z0-9_-]{10,}\\.[A-Za-z0-9_-]{10,}"),
            Pattern.compile("(?i)\\b(password|passwd|token|secret|api[_-]?key)\\s*[=:]\\s*[^\\s'\"]+"));

    private static final Map<String, Pattern> SENSITIVE_PARAMETER_TYPES = new LinkedHashMap<>();

    static {
        SENSITIVE_PARAMETER_TYPES.put("password", Pattern.compile("(?i)passw(or)?d"));
        SENSITIVE_PARAMETER_TYPES.put("token", Pattern.compile("(?i)token|bearer"));
        SENSITIVE_PARAMETER_TYPES.put("api_key", Pattern.compile("(?i)api[_-]?key|\\bsk-[A-Za-z0-9]"));
        SENSITIVE_PARAMETER_TYPES.put("secret", Pattern.compile("(?i)secret|private[_-]?key"));
        SENSITIVE_PARAMETER_TYPES.put("credential", Pattern.compile("(?i)credential|\\.aws/|\\.ssh/"));
    }

    private final int maxStringLength;

    public DataSanitizer(int maxStringLength) {
        this.maxStringLength = Math.max(16, maxStringLength);
    }

    public Map<String, Object> sanitize(Map<String, Object> data) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (data == null) {
            return out;
        }
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (isSensitiveKey(entry.getKey()) && entry.getValue() != null) {
                out.put(entry.getKey(), REDACTED);
            } else {
                out.put(entry.getKey(), sanitizeValue(entry.getValue()));
            }
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    public Object sanitizeValue(Object value) {
        if (value instanceof Map) {
            return sanitize((Map<String, Object>) value);
        }
        if (value instanceof Collection) {
            List<Object> out = new ArrayList<>();
            for (Object item : (Collection<Object>) value) {
                out.add(sanitizeValue(item));
            }
            return out;
        }
        if (value instanceof String) {
            return sanitizeText((String) value);
        }
        return value;
    }

    /**
     * Masks secret-looking substrings, then truncates.
     */
    public String sanitizeText(String text) {
        if (text == null) {
            return null;
        }
        String result = text;
        for (Pattern pattern : SECRET_PATTERNS) {
            Matcher matcher = pattern.matcher(result);
            if (matcher.find()) {
                result = matcher.replaceAll(REDACTED);
            }
        }
        return truncate(result, maxStringLength);
    }

    /**
     * Names of sensitive value kinds present in the tool input, for the audit trail.
     */
    public List<String> sensitiveParameterTypes(Map<String, Object> toolInput) {
        Set<String> found = new LinkedHashSet<>();
        if (toolInput == null) {
            return List.of();
        }
        for (Map.Entry<String, Object> entry : toolInput.entrySet()) {
            String probe = entry.getKey() + "=" + entry.getValue();
            for (Map.Entry<String, Pattern> type : SENSITIVE_PARAMETER_TYPES.entrySet()) {
                if (type.getValue().matcher(probe).find()) {
                    found.add(type.getKey());
                }
            }
        }
        return new ArrayList<>(found);
    }

    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, Math.max(0, maxLength - TRUNCATED.length())) + TRUNCATED;
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_KEYS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }
}
