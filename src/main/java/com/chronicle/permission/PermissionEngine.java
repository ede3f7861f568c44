package com.chronicle.permission;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chronicle.config.Config;
import com.chronicle.util.Jsons;

/**
 * Evaluates an ordered rule chain; the first matching rule decides. The chain always ends
 * with a catch-all, so every invocation gets a verdict.
 */
public class PermissionEngine {

    private static final Logger logger = LoggerFactory.getLogger(PermissionEngine.class);

    private static final PermissionDecision FALLBACK = new PermissionDecision(
            PermissionVerdict.ASK, "No rule matched", "fallback");

    private final List<PermissionRule> rules;

    public PermissionEngine(List<PermissionRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static PermissionEngine withDefaults() {
        return withCustomRules(List.of());
    }

    /**
     * Builds the chain with each custom rule placed at the front of its verdict tier.
     */
    public static PermissionEngine withCustomRules(List<PermissionRule> custom) {
        List<PermissionRule> chain = new ArrayList<>();
        custom.stream().filter(r -> r.getVerdict() == PermissionVerdict.DENY).forEach(chain::add);
        chain.addAll(DefaultPermissionRules.deny());
        custom.stream().filter(r -> r.getVerdict() == PermissionVerdict.ASK).forEach(chain::add);
        chain.addAll(DefaultPermissionRules.ask());
        custom.stream().filter(r -> r.getVerdict() == PermissionVerdict.ALLOW).forEach(chain::add);
        chain.addAll(DefaultPermissionRules.defaults());
        return new PermissionEngine(chain);
    }

    public static PermissionEngine fromConfig(Config config) {
        Optional<Path> rulesPath = config.getPermissionsRulesPath();
        if (rulesPath.isEmpty()) {
            return withDefaults();
        }
        return withCustomRules(loadRules(rulesPath.get()));
    }

    static List<PermissionRule> loadRules(Path file) {
        if (!Files.isRegularFile(file)) {
            logger.warn("Permission rules file not found: {}", file);
            return List.of();
        }
        try {
            PermissionRuleFile ruleFile = Jsons.mapper().readValue(file.toFile(), PermissionRuleFile.class);
            List<PermissionRule> loaded = new ArrayList<>();
            if (ruleFile.getRules() != null) {
                for (PermissionRuleItem item : ruleFile.getRules()) {
                    item.toRule().ifPresent(loaded::add);
                }
            }
            logger.debug("Loaded {} custom permission rules from {}", loaded.size(), file);
            return loaded;
        } catch (IOException e) {
            logger.warn("Failed to load permission rules from {}: {}", file, e.getMessage());
            return List.of();
        }
    }

    public PermissionDecision decide(ToolInvocation invocation) {
        for (PermissionRule rule : rules) {
            if (rule.matches(invocation)) {
                PermissionDecision decision = rule.toDecision();
                logger.debug("{} -> {}", invocation, decision);
                return decision;
            }
        }
        return FALLBACK;
    }

    public List<PermissionRule> getRules() {
        return rules;
    }
}
