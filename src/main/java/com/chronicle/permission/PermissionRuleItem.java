package com.chronicle.permission;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.PatternSyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One entry of a custom rules file, bound by Jackson.
 */
public class PermissionRuleItem {

    private static final Logger logger = LoggerFactory.getLogger(PermissionRuleItem.class);

    private String name;
    private String target;
    private String pattern;
    private String verdict;
    private String reason;
    private List<String> tools;

    public PermissionRuleItem() {}

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getTarget() { return target; }
    public void setTarget(String target) { this.target = target; }

    public String getPattern() { return pattern; }
    public void setPattern(String pattern) { this.pattern = pattern; }

    public String getVerdict() { return verdict; }
    public void setVerdict(String verdict) { this.verdict = verdict; }

    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }

    public List<String> getTools() { return tools; }
    public void setTools(List<String> tools) { this.tools = tools; }

    /**
     * Converts the entry into a rule, or empty when a field is missing or invalid.
     */
    public Optional<PermissionRule> toRule() {
        if (name == null || pattern == null) {
            logger.warn("Skipping custom rule without name or pattern: {}", name);
            return Optional.empty();
        }
        Optional<RuleTarget> ruleTarget = RuleTarget.fromValue(target);
        Optional<PermissionVerdict> ruleVerdict = PermissionVerdict.fromValue(verdict);
        if (ruleTarget.isEmpty() || ruleVerdict.isEmpty()) {
            logger.warn("Skipping custom rule {}: invalid target '{}' or verdict '{}'", name, target, verdict);
            return Optional.empty();
        }
        try {
            return Optional.of(PermissionRule.builder(name)
                    .target(ruleTarget.get())
                    .pattern(pattern)
                    .verdict(ruleVerdict.get())
                    .reason(reason)
                    .tools(tools != null ? Set.copyOf(tools) : Set.of())
                    .build());
        } catch (PatternSyntaxException e) {
            logger.warn("Skipping custom rule {}: invalid pattern {}", name, e.getDescription());
            return Optional.empty();
        }
    }
}
