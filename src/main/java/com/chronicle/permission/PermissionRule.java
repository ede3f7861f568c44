package com.chronicle.permission;

import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Declarative rule: when {@code pattern} is found in the selected part of a tool invocation,
 * the rule yields {@code verdict}. An empty tool set means the rule applies to every tool.
 */
public final class PermissionRule {

    private final String name;
    private final RuleTarget target;
    private final Pattern pattern;
    private final PermissionVerdict verdict;
    private final String reason;
    private final Set<String> toolNames;

    private PermissionRule(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name");
        this.target = Objects.requireNonNull(builder.target, "target");
        this.pattern = Objects.requireNonNull(builder.pattern, "pattern");
        this.verdict = Objects.requireNonNull(builder.verdict, "verdict");
        this.reason = builder.reason != null ? builder.reason : name;
        this.toolNames = builder.toolNames != null ? Set.copyOf(builder.toolNames) : Set.of();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public boolean matches(ToolInvocation invocation) {
        if (!toolNames.isEmpty() && !toolNames.contains(invocation.getToolName())) {
            return false;
        }
        return switch (target) {
            case TOOL_NAME -> pattern.matcher(invocation.getToolName()).find();
            case PATH -> invocation.paths().stream().anyMatch(p -> pattern.matcher(p).find());
            case COMMAND -> invocation.command().map(c -> pattern.matcher(c).find()).orElse(false);
        };
    }

    public PermissionDecision toDecision() {
        return new PermissionDecision(verdict, reason, name);
    }

    public String getName() { return name; }
    public RuleTarget getTarget() { return target; }
    public Pattern getPattern() { return pattern; }
    public PermissionVerdict getVerdict() { return verdict; }
    public String getReason() { return reason; }
    public Set<String> getToolNames() { return toolNames; }

    @Override
    public String toString() {
        return "PermissionRule{" + name + ", " + target + " ~ " + pattern.pattern() + " -> " + verdict + "}";
    }

    public static final class Builder {
        private final String name;
        private RuleTarget target;
        private Pattern pattern;
        private PermissionVerdict verdict;
        private String reason;
        private Set<String> toolNames;

        private Builder(String name) {
            this.name = name;
        }

        public Builder target(RuleTarget target) {
            this.target = target;
            return this;
        }

        public Builder pattern(String regex) {
            this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
            return this;
        }

        public Builder caseSensitivePattern(String regex) {
            this.pattern = Pattern.compile(regex);
            return this;
        }

        public Builder verdict(PermissionVerdict verdict) {
            this.verdict = verdict;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder tools(String... toolNames) {
            this.toolNames = Set.of(toolNames);
            return this;
        }

        public Builder tools(Set<String> toolNames) {
            this.toolNames = toolNames;
            return this;
        }

        public PermissionRule build() {
            return new PermissionRule(this);
        }
    }
}
